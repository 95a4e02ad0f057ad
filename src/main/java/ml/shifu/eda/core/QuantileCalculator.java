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
package ml.shifu.eda.core;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.apache.commons.math3.stat.descriptive.rank.Percentile.EstimationType;

/**
 * Quantiles by linear interpolation between order statistics, position = p * (n - 1). Ties are ranked by position,
 * not by distinct value.
 */
public class QuantileCalculator {

    private final Percentile percentile;

    private final int size;

    public QuantileCalculator(double[] values) {
        this.size = values.length;
        // R_7 interpolates at position p * (n - 1)
        this.percentile = new Percentile().withEstimationType(EstimationType.R_7);
        this.percentile.setData(values);
    }

    /**
     * @param p
     *            quantile in (0, 1]
     * @return quantile or NaN if there is no value
     */
    public double quantile(double p) {
        if(size == 0) {
            return Double.NaN;
        }
        return percentile.evaluate(p * 100d);
    }

    public double getQ1() {
        return quantile(0.25d);
    }

    public double getMedian() {
        return quantile(0.5d);
    }

    public double getQ3() {
        return quantile(0.75d);
    }
}
