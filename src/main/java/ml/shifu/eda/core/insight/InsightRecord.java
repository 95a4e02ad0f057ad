/*
 * Copyright [2012-2014] PayPal Software Foundation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.eda.core.insight;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One fired insight: its rank in the final list, the id of the rule that produced it, the rendered message and the
 * statistic values that triggered it.
 */
public class InsightRecord {

    /**
     * 1-based, 0 for a record a rule emitted and {@link InsightSynthesizer} has not ranked yet
     */
    private final int rank;

    private final String ruleId;

    private final String message;

    private final Map<String, Double> values;

    public InsightRecord(String ruleId, String message, Map<String, Double> values) {
        this(0, ruleId, message, values);
    }

    public InsightRecord(int rank, String ruleId, String message, Map<String, Double> values) {
        this.rank = rank;
        this.ruleId = ruleId;
        this.message = message;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<String, Double>(values));
    }

    public int getRank() {
        return rank;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getMessage() {
        return message;
    }

    public Map<String, Double> getValues() {
        return values;
    }

    @Override
    public String toString() {
        return rank + ". " + message;
    }
}
