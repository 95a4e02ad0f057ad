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

import java.util.List;

import ml.shifu.eda.container.DensityCurve;

import org.testng.Assert;
import org.testng.annotations.Test;

public class DensityEstimatorTest {

    @Test
    public void testScottBandwidth() {
        double[] values = new double[] { 1, 2, 3, 4, 5 };
        DensityCurve curve = new DensityEstimator(100).estimate(values);
        Assert.assertNotNull(curve);
        double std = new BasicStatsCalculator(values).getStdDev();
        Assert.assertEquals(curve.getBandwidth(), std * Math.pow(5, -0.2d), 1e-12);
        Assert.assertEquals(curve.getPoints().size(), 100);
        Assert.assertEquals(curve.getDensities().size(), 100);
        Assert.assertEquals(curve.getPoints().get(0), 1d, 1e-12);
        Assert.assertEquals(curve.getPoints().get(99), 5d, 1e-12);
        // symmetric data, symmetric curve
        Assert.assertEquals(curve.getDensities().get(0), curve.getDensities().get(99), 1e-12);
    }

    @Test
    public void testIntegratesToOne() {
        // both extremes lose half of their kernel mass outside [min, max]
        double[] values = new double[] { 0, 50, 50.5, 49.5, 50.2, 49.8, 100 };
        DensityCurve curve = new DensityEstimator(2000).estimate(values);
        List<Double> xs = curve.getPoints();
        List<Double> ys = curve.getDensities();
        double area = 0d;
        for(int i = 1; i < xs.size(); i++) {
            area += (xs.get(i) - xs.get(i - 1)) * (ys.get(i) + ys.get(i - 1)) / 2d;
        }
        Assert.assertTrue(area > 0.6d && area <= 1.0001d, "area " + area);
        for(Double density: ys) {
            Assert.assertTrue(density >= 0d);
        }
    }

    @Test
    public void testUndefined() {
        DensityEstimator estimator = new DensityEstimator(10);
        Assert.assertNull(estimator.estimate(new double[0]));
        Assert.assertNull(estimator.estimate(new double[] { 1d }));
        Assert.assertNull(estimator.estimate(new double[] { 2d, 2d, 2d }));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testTooFewPoints() {
        new DensityEstimator(1);
    }
}
