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
 * Data of one horizontal box: quartiles, whisker ends (most extreme present values inside the fences) and the
 * outlier values drawn as points.
 */
public class BoxPlotSummary {

    private final String columnName;
    private final double q1;
    private final double median;
    private final double q3;
    private final double lowerWhisker;
    private final double upperWhisker;
    private final List<Double> outliers;

    public BoxPlotSummary(String columnName, double q1, double median, double q3, double lowerWhisker,
            double upperWhisker, List<Double> outliers) {
        this.columnName = columnName;
        this.q1 = q1;
        this.median = median;
        this.q3 = q3;
        this.lowerWhisker = lowerWhisker;
        this.upperWhisker = upperWhisker;
        this.outliers = Collections.unmodifiableList(outliers);
    }

    public String getColumnName() {
        return columnName;
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

    public double getLowerWhisker() {
        return lowerWhisker;
    }

    public double getUpperWhisker() {
        return upperWhisker;
    }

    public List<Double> getOutliers() {
        return outliers;
    }
}
