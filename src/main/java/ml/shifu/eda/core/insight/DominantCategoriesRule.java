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

import ml.shifu.eda.container.CategoricalFrequency;
import ml.shifu.eda.container.CategoricalFrequency.Entry;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.util.CommonUtils;

import org.apache.commons.lang.StringUtils;

/**
 * Names the top-N values of the designated categorical column with their share of present values.
 */
public class DominantCategoriesRule extends AbstractInsightRule {

    public static final String ID = "DOMINANT_CATEGORIES";

    public DominantCategoriesRule() {
        super(ID, 3, "Key Category Popularity: %s are the most dominant %s values in the sample.");
    }

    @Override
    public List<InsightRecord> evaluate(InsightContext context) {
        if(context.getUnivariate() == null) {
            return Collections.emptyList();
        }
        AnalysisConfig config = context.getConfig();
        CategoricalFrequency frequency = context.getUnivariate().getFrequency(config.getCategoryColumn());
        if(frequency == null || frequency.getTotal() == 0) {
            return Collections.emptyList();
        }

        Map<String, Double> values = new LinkedHashMap<String, Double>();
        List<String> labels = new ArrayList<String>();
        for(Entry entry: frequency.top(config.getTopN())) {
            double share = entry.getCount() * 100d / frequency.getTotal();
            values.put(entry.getValue(), share);
            labels.add("'" + entry.getValue() + "' (" + entry.getCount() + ", " + CommonUtils.formatShort(share)
                    + "%)");
        }
        return Collections.singletonList(fire(values, StringUtils.join(labels, ", "), config.getCategoryColumn()));
    }
}
