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
import java.util.List;
import java.util.Map;

import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.util.CommonUtils;

/**
 * Fires when |corr(x, y)| of the designated financial columns reaches the configured threshold.
 */
public class HighFinancialCorrelationRule extends AbstractInsightRule {

    public static final String ID = "HIGH_FINANCIAL_CORRELATION";

    public HighFinancialCorrelationRule() {
        super(ID, 1, "High Correlation in Financials: %s and %s show a strong %s correlation (r = %s).");
    }

    @Override
    public List<InsightRecord> evaluate(InsightContext context) {
        if(context.getBivariate() == null || context.getBivariate().getCorrelationMatrix() == null) {
            return Collections.emptyList();
        }
        AnalysisConfig config = context.getConfig();
        double corr = context.getBivariate().getCorrelationMatrix()
                .get(config.getxColumn(), config.getyColumn());
        if(!isDefined(corr) || Math.abs(corr) < config.getCorrelationThreshold()) {
            return Collections.emptyList();
        }

        Map<String, Double> values = new LinkedHashMap<String, Double>();
        values.put("correlation", corr);
        values.put("threshold", config.getCorrelationThreshold());
        return Collections.singletonList(fire(values, config.getxColumn(), config.getyColumn(),
                corr > 0 ? "positive" : "negative", CommonUtils.formatShort(corr)));
    }
}
