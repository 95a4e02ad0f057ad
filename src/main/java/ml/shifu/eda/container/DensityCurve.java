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

import java.util.Collections;
import java.util.List;

/**
 * Kernel density sampled at fixed points. Density values integrate to one over the real line; multiply by count *
 * bin width to overlay them on a histogram.
 */
public class DensityCurve {

    private final double bandwidth;

    private final List<Double> points;

    private final List<Double> densities;

    public DensityCurve(double bandwidth, List<Double> points, List<Double> densities) {
        this.bandwidth = bandwidth;
        this.points = Collections.unmodifiableList(points);
        this.densities = Collections.unmodifiableList(densities);
    }

    public double getBandwidth() {
        return bandwidth;
    }

    public List<Double> getPoints() {
        return points;
    }

    public List<Double> getDensities() {
        return densities;
    }
}
