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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link InsightSynthesizer} evaluates every rule and ranks all fired records by rule priority. Records of equal
 * priority keep rule declaration order, then the order a rule emitted them.
 */
public class InsightSynthesizer {

    private static final Logger log = LoggerFactory.getLogger(InsightSynthesizer.class);

    private final List<InsightRule> rules;

    public InsightSynthesizer() {
        this(defaultRules());
    }

    public InsightSynthesizer(List<InsightRule> rules) {
        List<InsightRule> sorted = new ArrayList<InsightRule>(rules);
        // stable
        Collections.sort(sorted, new Comparator<InsightRule>() {
            @Override
            public int compare(InsightRule o1, InsightRule o2) {
                return Integer.compare(o1.getPriority(), o2.getPriority());
            }
        });
        this.rules = Collections.unmodifiableList(sorted);
    }

    public static List<InsightRule> defaultRules() {
        return Arrays.<InsightRule> asList(new HighFinancialCorrelationRule(), new RightSkewRule(),
                new DominantCategoriesRule(), new DataCompletenessRule(), new CentralTendencyRule());
    }

    public List<InsightRecord> synthesize(InsightContext context) {
        List<InsightRecord> fired = new ArrayList<InsightRecord>();
        for(InsightRule rule: rules) {
            List<InsightRecord> emitted = rule.evaluate(context);
            if(emitted == null || emitted.isEmpty()) {
                log.debug("Rule {} does not fire.", rule.getId());
                continue;
            }
            log.debug("Rule {} fires {} time(s).", rule.getId(), emitted.size());
            fired.addAll(emitted);
        }

        List<InsightRecord> ranked = new ArrayList<InsightRecord>(fired.size());
        for(int i = 0; i < fired.size(); i++) {
            InsightRecord record = fired.get(i);
            ranked.add(new InsightRecord(i + 1, record.getRuleId(), record.getMessage(), record.getValues()));
        }
        return Collections.unmodifiableList(ranked);
    }

    public List<InsightRule> getRules() {
        return rules;
    }
}
