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

/**
 * Calculator, it helps to calculate the sum, max, min, mean and sample standard deviation of present values.
 */
public class BasicStatsCalculator {

    private final double[] values;

    private int count;
    private double sum;
    private double min = Double.NaN;
    private double max = Double.NaN;
    private double mean = Double.NaN;
    private double stdDev = Double.NaN;

    public BasicStatsCalculator(double[] values) {
        this.values = values;
        calculateStats();
    }

    private void calculateStats() {
        count = values.length;
        sum = 0d;

        if(count == 0) {
            return;
        }

        min = Double.MAX_VALUE;
        max = -Double.MAX_VALUE;
        for(double value: values) {
            max = Math.max(max, value);
            min = Math.min(min, value);
            sum += value;
        }

        mean = sum / count;

        // stdDev defaults to NaN with a single value
        if(count <= 1) {
            return;
        }

        // two passes
        double squaredDiffSum = 0d;
        for(double value: values) {
            double diff = value - mean;
            squaredDiffSum += diff * diff;
        }
        stdDev = Math.sqrt(squaredDiffSum / (count - 1));
    }

    public int getCount() {
        return count;
    }

    public double getSum() {
        return sum;
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
}
