/*
 * Copyright [2013-2016] PayPal Software Foundation
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
package ml.shifu.eda.core.correlation;

import ml.shifu.eda.container.Column;

/**
 * {@link CorrelationAccumulator} is used to store information which is used to compute pearson correlation between
 * two variables.
 *
 * <p>
 * Only rows where both values are present are accumulated (pairwise complete). Count, means and co-moments are
 * updated incrementally, which keeps precision on large magnitude columns like budget and revenue.
 */
public class CorrelationAccumulator {

    private long count;

    private double meanX;

    private double meanY;

    /**
     * sum of (x - meanX)^2
     */
    private double m2X;

    /**
     * sum of (y - meanY)^2
     */
    private double m2Y;

    /**
     * sum of (x - meanX) * (y - meanY)
     */
    private double coMoment;

    public void add(double x, double y) {
        if(Double.isNaN(x) || Double.isNaN(y)) {
            return;
        }
        count++;
        double dx = x - meanX;
        meanX += dx / count;
        double dy = y - meanY;
        meanY += dy / count;
        m2X += dx * (x - meanX);
        m2Y += dy * (y - meanY);
        coMoment += dx * (y - meanY);
    }

    /**
     * Accumulate both columns row by row.
     */
    public static CorrelationAccumulator of(Column x, Column y) {
        CorrelationAccumulator accumulator = new CorrelationAccumulator();
        for(int i = 0; i < x.size(); i++) {
            accumulator.add(x.getDouble(i), y.getDouble(i));
        }
        return accumulator;
    }

    /**
     * @return coefficient in [-1, 1], NaN for fewer than two joint rows or zero variance in either variable
     */
    public double getCorrelation() {
        if(count < 2 || m2X <= 0d || m2Y <= 0d) {
            return Double.NaN;
        }
        double corr = coMoment / Math.sqrt(m2X * m2Y);
        return Math.max(-1d, Math.min(1d, corr));
    }

    public long getCount() {
        return count;
    }

    public double getMeanX() {
        return meanX;
    }

    public double getMeanY() {
        return meanY;
    }
}
