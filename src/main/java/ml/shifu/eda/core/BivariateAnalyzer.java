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

import ml.shifu.eda.container.BivariateReport;
import ml.shifu.eda.container.Column;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.JointFeatureSummary;
import ml.shifu.eda.container.JointFeatureSummary.Point;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.core.correlation.CorrelationMatrix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BivariateAnalyzer} computes the pairwise complete correlation matrix over all numerical columns and the
 * joint scatter data of the designated x, y and emphasis columns.
 */
public class BivariateAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(BivariateAnalyzer.class);

    private final AnalysisConfig config;

    public BivariateAnalyzer(AnalysisConfig config) {
        this.config = config;
    }

    public BivariateReport analyze(Dataset dataset, List<String> skipped) {
        CorrelationMatrix matrix = CorrelationMatrix.compute(dataset.getNumericColumns());
        log.debug("Correlation computed over {} numerical columns.", matrix.size());

        JointFeatureSummary jointSummary = null;
        String[] designated = new String[] { config.getxColumn(), config.getyColumn(), config.getEmphasisColumn() };
        List<String> absent = new ArrayList<String>();
        for(String name: designated) {
            if(!dataset.hasNumericColumn(name)) {
                absent.add(name);
            }
        }
        if(absent.isEmpty()) {
            jointSummary = summarizeJoint(dataset.getColumn(config.getxColumn()),
                    dataset.getColumn(config.getyColumn()), dataset.getColumn(config.getEmphasisColumn()));
        } else {
            skipped.add("Joint feature summary skipped: column(s) " + absent + " absent or not numeric");
        }

        return new BivariateReport(matrix, jointSummary);
    }

    /**
     * Every row of the three columns, with emphasis linearly rescaled from its [min, max] onto [sizeMin, sizeMax].
     * A constant emphasis column maps to the middle of the size range.
     */
    public JointFeatureSummary summarizeJoint(Column x, Column y, Column emphasis) {
        double sizeMin = config.getSizeMin();
        double sizeMax = config.getSizeMax();

        BasicStatsCalculator emphasisStats = new BasicStatsCalculator(emphasis.getPresentDoubles());
        double min = emphasisStats.getMin();
        double range = emphasisStats.getMax() - min;

        List<Point> points = new ArrayList<Point>(x.size());
        for(int i = 0; i < x.size(); i++) {
            Double size = null;
            if(!emphasis.isMissing(i)) {
                if(range > 0d) {
                    size = sizeMin + (emphasis.getDouble(i) - min) / range * (sizeMax - sizeMin);
                } else {
                    size = (sizeMin + sizeMax) / 2d;
                }
            }
            points.add(new Point(i, boxed(x, i), boxed(y, i), boxed(emphasis, i), size));
        }
        return new JointFeatureSummary(x.getName(), y.getName(), emphasis.getName(), sizeMin, sizeMax, points);
    }

    private static Double boxed(Column column, int index) {
        return column.isMissing(index) ? null : Double.valueOf(column.getDouble(index));
    }
}
