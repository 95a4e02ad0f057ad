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

import ml.shifu.eda.container.Histogram;
import ml.shifu.eda.container.Histogram.Bin;
import ml.shifu.eda.util.CommonUtils;

import org.apache.commons.lang.StringUtils;

/**
 * Reports the modal bin of the designated numerical column's histogram.
 */
public class CentralTendencyRule extends AbstractInsightRule {

    public static final String ID = "CENTRAL_TENDENCY";

    public CentralTendencyRule() {
        super(ID, 5, "%s Profile: most values cluster in [%s, %s] (%d of %d).");
    }

    @Override
    public List<InsightRecord> evaluate(InsightContext context) {
        if(context.getUnivariate() == null) {
            return Collections.emptyList();
        }
        String columnName = context.getConfig().getModalColumn();
        Histogram histogram = context.getUnivariate().getHistogram(columnName);
        if(histogram == null) {
            return Collections.emptyList();
        }
        Bin modal = histogram.getModalBin();
        if(modal == null || modal.getCount() == 0) {
            return Collections.emptyList();
        }

        Map<String, Double> values = new LinkedHashMap<String, Double>();
        values.put("lower", modal.getLower());
        values.put("upper", modal.getUpper());
        values.put("count", (double) modal.getCount());
        return Collections.singletonList(fire(values, StringUtils.capitalize(columnName), CommonUtils.formatDouble(modal.getLower()),
                CommonUtils.formatDouble(modal.getUpper()), modal.getCount(), histogram.getTotalCount()));
    }
}
