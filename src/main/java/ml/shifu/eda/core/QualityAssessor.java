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
import java.util.concurrent.Callable;

import ml.shifu.eda.container.BoxPlotSummary;
import ml.shifu.eda.container.Column;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.DescriptiveStatistics;
import ml.shifu.eda.container.MissingnessReport;
import ml.shifu.eda.container.OutlierSummary;
import ml.shifu.eda.container.QualityReport;
import ml.shifu.eda.executor.ExecutorManager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link QualityAssessor} computes missingness, descriptive statistics and Tukey outlier fences.
 *
 * <p>
 * A column with zero IQR has both fences at its quartile, so any value different from it is flagged.
 */
public class QualityAssessor {

    private static final Logger log = LoggerFactory.getLogger(QualityAssessor.class);

    private final double iqrMultiplier;

    private final int numParallel;

    public QualityAssessor(double iqrMultiplier, int numParallel) {
        this.iqrMultiplier = iqrMultiplier;
        this.numParallel = numParallel;
    }

    public QualityReport assess(Dataset dataset) {
        MissingnessReport missingness = assessMissingness(dataset);

        List<Callable<ColumnQuality>> tasks = new ArrayList<Callable<ColumnQuality>>();
        for(final Column column: dataset.getNumericColumns()) {
            tasks.add(new Callable<ColumnQuality>() {
                @Override
                public ColumnQuality call() {
                    return assessColumn(column);
                }
            });
        }

        ExecutorManager<ColumnQuality> manager = new ExecutorManager<ColumnQuality>(numParallel);
        List<ColumnQuality> results;
        try {
            results = manager.submitTasksAndWaitResults(tasks);
        } finally {
            manager.graceShutDown();
        }

        List<DescriptiveStatistics> statistics = new ArrayList<DescriptiveStatistics>(results.size());
        List<OutlierSummary> outliers = new ArrayList<OutlierSummary>(results.size());
        List<BoxPlotSummary> boxPlots = new ArrayList<BoxPlotSummary>(results.size());
        for(ColumnQuality result: results) {
            statistics.add(result.statistics);
            outliers.add(result.outliers);
            if(result.boxPlot != null) {
                boxPlots.add(result.boxPlot);
            }
        }
        return new QualityReport(missingness, statistics, outliers, boxPlots);
    }

    public MissingnessReport assessMissingness(Dataset dataset) {
        List<MissingnessReport.Entry> entries = new ArrayList<MissingnessReport.Entry>();
        for(Column column: dataset.getColumns()) {
            entries.add(new MissingnessReport.Entry(column.getName(), column.getMissingCount(), dataset
                    .getRowCount()));
        }
        return new MissingnessReport(entries);
    }

    public DescriptiveStatistics describe(Column column) {
        double[] values = column.getPresentDoubles();
        if(values.length == 0) {
            log.debug("Column {} has no present value, statistics are undefined.", column.getName());
            return DescriptiveStatistics.undefined(column.getName());
        }

        BasicStatsCalculator calculator = new BasicStatsCalculator(values);
        QuantileCalculator quantiles = new QuantileCalculator(values);
        return new DescriptiveStatistics(column.getName(), calculator.getCount(), calculator.getMin(),
                calculator.getMax(), calculator.getMean(), calculator.getStdDev(), quantiles.getQ1(),
                quantiles.getMedian(), quantiles.getQ3());
    }

    /**
     * Rows whose present value is strictly outside [Q1 - k * IQR, Q3 + k * IQR].
     */
    public OutlierSummary detectOutliers(Column column, DescriptiveStatistics stats) {
        List<Integer> rows = new ArrayList<Integer>();
        if(!stats.isDefined()) {
            return new OutlierSummary(column.getName(), Double.NaN, Double.NaN, Double.NaN, rows);
        }

        double iqr = stats.getQ3() - stats.getQ1();
        double lowerFence = stats.getQ1() - iqrMultiplier * iqr;
        double upperFence = stats.getQ3() + iqrMultiplier * iqr;
        for(int i = 0; i < column.size(); i++) {
            if(column.isMissing(i)) {
                continue;
            }
            double value = column.getDouble(i);
            if(value < lowerFence || value > upperFence) {
                rows.add(i);
            }
        }
        return new OutlierSummary(column.getName(), iqr, lowerFence, upperFence, rows);
    }

    /**
     * @return box data or null if the column has no present value
     */
    public BoxPlotSummary summarizeBox(Column column, DescriptiveStatistics stats, OutlierSummary outliers) {
        if(!stats.isDefined()) {
            return null;
        }

        double lowerWhisker = Double.MAX_VALUE;
        double upperWhisker = -Double.MAX_VALUE;
        List<Double> outlierValues = new ArrayList<Double>();
        for(int i = 0; i < column.size(); i++) {
            if(column.isMissing(i)) {
                continue;
            }
            double value = column.getDouble(i);
            if(value < outliers.getLowerFence() || value > outliers.getUpperFence()) {
                outlierValues.add(value);
            } else {
                lowerWhisker = Math.min(lowerWhisker, value);
                upperWhisker = Math.max(upperWhisker, value);
            }
        }
        // whiskers never end inside the box
        lowerWhisker = Math.min(lowerWhisker, stats.getQ1());
        upperWhisker = Math.max(upperWhisker, stats.getQ3());
        return new BoxPlotSummary(column.getName(), stats.getQ1(), stats.getMedian(), stats.getQ3(), lowerWhisker,
                upperWhisker, outlierValues);
    }

    private ColumnQuality assessColumn(Column column) {
        DescriptiveStatistics stats = describe(column);
        OutlierSummary outliers = detectOutliers(column, stats);
        BoxPlotSummary boxPlot = summarizeBox(column, stats, outliers);
        log.debug("Column {}: {} outliers outside [{}, {}].", column.getName(), outliers.getOutlierRows().size(),
                outliers.getLowerFence(), outliers.getUpperFence());
        return new ColumnQuality(stats, outliers, boxPlot);
    }

    private static class ColumnQuality {
        private final DescriptiveStatistics statistics;
        private final OutlierSummary outliers;
        private final BoxPlotSummary boxPlot;

        private ColumnQuality(DescriptiveStatistics statistics, OutlierSummary outliers, BoxPlotSummary boxPlot) {
            this.statistics = statistics;
            this.outliers = outliers;
            this.boxPlot = boxPlot;
        }
    }
}
