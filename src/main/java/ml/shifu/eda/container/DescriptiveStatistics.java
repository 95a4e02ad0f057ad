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
package ml.shifu.eda.container;

/**
 * Moments and quartiles of a numerical column over its present values. Undefined values are {@link Double#NaN}.
 */
public class DescriptiveStatistics {

    private final String columnName;
    private final int count;
    private final double min;
    private final double max;
    private final double mean;
    private final double stdDev;
    private final double q1;
    private final double median;
    private final double q3;

    public DescriptiveStatistics(String columnName, int count, double min, double max, double mean, double stdDev,
            double q1, double median, double q3) {
        this.columnName = columnName;
        this.count = count;
        this.min = min;
        this.max = max;
        this.mean = mean;
        this.stdDev = stdDev;
        this.q1 = q1;
        this.median = median;
        this.q3 = q3;
    }

    public static DescriptiveStatistics undefined(String columnName) {
        return new DescriptiveStatistics(columnName, 0, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN,
                Double.NaN, Double.NaN);
    }

    public String getColumnName() {
        return columnName;
    }

    public int getCount() {
        return count;
    }

    public double getMin() {
        return min;
    }

    public double getMax() {
        return max;
    }

    public double getMean() {
        return mean;
    }

    public double getStdDev() {
        return stdDev;
    }

    public double getQ1() {
        return q1;
    }

    public double getMedian() {
        return median;
    }

    public double getQ3() {
        return q3;
    }

    public boolean isDefined() {
        return count > 0;
    }
}
