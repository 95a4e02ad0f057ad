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

import ml.shifu.eda.container.DescriptiveStatistics;
import ml.shifu.eda.util.CommonUtils;

/**
 * Fires once per numerical column whose mean exceeds its median by more than one standard deviation.
 */
public class RightSkewRule extends AbstractInsightRule {

    public static final String ID = "RIGHT_SKEW";

    public RightSkewRule() {
        super(ID, 2, "Distribution Skew: %s is right-skewed, mean %s exceeds median %s by more than "
                + "one standard deviation (%s).");
    }

    @Override
    public List<InsightRecord> evaluate(InsightContext context) {
        if(context.getQuality() == null) {
            return Collections.emptyList();
        }
        List<InsightRecord> records = new ArrayList<InsightRecord>();
        for(DescriptiveStatistics stats: context.getQuality().getStatistics()) {
            double mean = stats.getMean();
            double median = stats.getMedian();
            double std = stats.getStdDev();
            if(!isDefined(mean) || !isDefined(median) || !isDefined(std)) {
                continue;
            }
            if(mean - median > std) {
                Map<String, Double> values = new LinkedHashMap<String, Double>();
                values.put("mean", mean);
                values.put("median", median);
                values.put("stdDev", std);
                records.add(fire(values, stats.getColumnName(), CommonUtils.formatDouble(mean),
                        CommonUtils.formatDouble(median), CommonUtils.formatDouble(std)));
            }
        }
        return records;
    }
}
