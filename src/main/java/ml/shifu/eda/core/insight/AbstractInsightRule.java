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

import java.util.Locale;
import java.util.Map;

/**
 * Base of the built-in rules: a fixed id, priority and message template rendered with {@link String#format}.
 */
public abstract class AbstractInsightRule implements InsightRule {

    private final String id;

    private final int priority;

    private final String template;

    protected AbstractInsightRule(String id, int priority, String template) {
        this.id = id;
        this.priority = priority;
        this.template = template;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public int getPriority() {
        return priority;
    }

    public String getTemplate() {
        return template;
    }

    protected InsightRecord fire(Map<String, Double> values, Object... args) {
        return new InsightRecord(id, String.format(Locale.ROOT, template, args), values);
    }

    protected static boolean isDefined(double value) {
        return !Double.isNaN(value) && !Double.isInfinite(value);
    }

    @Override
    public String toString() {
        return id + "(" + priority + ")";
    }
}
