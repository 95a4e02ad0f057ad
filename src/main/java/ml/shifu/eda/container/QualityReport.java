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
 * Output of the quality assessment, statistics lists are in dataset column order.
 */
public class QualityReport {

    private final MissingnessReport missingness;

    private final List<DescriptiveStatistics> statistics;

    private final List<OutlierSummary> outliers;

    private final List<BoxPlotSummary> boxPlots;

    public QualityReport(MissingnessReport missingness, List<DescriptiveStatistics> statistics,
            List<OutlierSummary> outliers, List<BoxPlotSummary> boxPlots) {
        this.missingness = missingness;
        this.statistics = Collections.unmodifiableList(statistics);
        this.outliers = Collections.unmodifiableList(outliers);
        this.boxPlots = Collections.unmodifiableList(boxPlots);
    }

    public MissingnessReport getMissingness() {
        return missingness;
    }

    public List<DescriptiveStatistics> getStatistics() {
        return statistics;
    }

    public List<OutlierSummary> getOutliers() {
        return outliers;
    }

    public List<BoxPlotSummary> getBoxPlots() {
        return boxPlots;
    }

    /**
     * @return statistics of column or null if it is not a numerical column
     */
    public DescriptiveStatistics getStatistics(String columnName) {
        for(DescriptiveStatistics stats: statistics) {
            if(stats.getColumnName().equals(columnName)) {
                return stats;
            }
        }
        return null;
    }

    public OutlierSummary getOutliers(String columnName) {
        for(OutlierSummary summary: outliers) {
            if(summary.getColumnName().equals(columnName)) {
                return summary;
            }
        }
        return null;
    }
}
