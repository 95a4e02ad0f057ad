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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.eda.container.MissingnessReport;
import ml.shifu.eda.util.CommonUtils;

/**
 * Fires once per column whose missing percentage is above the configured threshold.
 */
public class DataCompletenessRule extends AbstractInsightRule {

    public static final String ID = "DATA_COMPLETENESS";

    public DataCompletenessRule() {
        super(ID, 4, "Data Quality: %s has %s%% missing values, above the %s%% threshold.");
    }

    @Override
    public List<InsightRecord> evaluate(InsightContext context) {
        if(context.getQuality() == null || context.getQuality().getMissingness() == null) {
            return Collections.emptyList();
        }
        double threshold = context.getConfig().getMissingPctThreshold();
        List<InsightRecord> records = new ArrayList<InsightRecord>();
        for(MissingnessReport.Entry entry: context.getQuality().getMissingness().getEntries()) {
            if(entry.getMissingPercentage() > threshold) {
                Map<String, Double> values = new LinkedHashMap<String, Double>();
                values.put("missingCount", (double) entry.getMissingCount());
                values.put("missingPercentage", entry.getMissingPercentage());
                values.put("threshold", threshold);
                records.add(fire(values, entry.getColumnName(),
                        CommonUtils.formatShort(entry.getMissingPercentage()), CommonUtils.formatShort(threshold)));
            }
        }
        return records;
    }
}
