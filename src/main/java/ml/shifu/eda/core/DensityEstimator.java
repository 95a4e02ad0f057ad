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

import java.util.ArrayList;
import java.util.List;

import ml.shifu.eda.container.DensityCurve;

import org.apache.commons.math3.util.FastMath;

/**
 * Gaussian kernel density estimate with Scott's rule bandwidth, sampled at evenly spaced points over [min, max].
 */
public class DensityEstimator {

    private static final double SQRT_2PI = FastMath.sqrt(2 * FastMath.PI);

    private final int points;

    public DensityEstimator(int points) {
        if(points < 2) {
            throw new IllegalArgumentException("Density points should be at least 2, but is " + points);
        }
        this.points = points;
    }

    /**
     * @return density curve or null if there are fewer than two values or no variance
     */
    public DensityCurve estimate(double[] values) {
        BasicStatsCalculator stats = new BasicStatsCalculator(values);
        double stdDev = stats.getStdDev();
        if(values.length < 2 || Double.isNaN(stdDev) || stdDev <= 0d) {
            return null;
        }

        double bandwidth = stdDev * FastMath.pow(values.length, -0.2d);
        double min = stats.getMin();
        double step = (stats.getMax() - min) / (points - 1);

        List<Double> xs = new ArrayList<Double>(points);
        List<Double> densities = new ArrayList<Double>(points);
        for(int i = 0; i < points; i++) {
            double x = (i == points - 1) ? stats.getMax() : min + step * i;
            double sum = 0d;
            for(double value: values) {
                double z = (x - value) / bandwidth;
                sum += FastMath.exp(-0.5d * z * z);
            }
            xs.add(x);
            densities.add(sum / (values.length * bandwidth * SQRT_2PI));
        }
        return new DensityCurve(bandwidth, xs, densities);
    }
}
