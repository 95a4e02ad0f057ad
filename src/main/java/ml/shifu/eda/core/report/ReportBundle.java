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
package ml.shifu.eda.core.report;

import java.util.Collections;
import java.util.List;

import ml.shifu.eda.container.BivariateReport;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.QualityReport;
import ml.shifu.eda.container.StructureReport;
import ml.shifu.eda.container.UnivariateReport;
import ml.shifu.eda.core.insight.InsightRecord;

/**
 * Every stage output of one analysis run, the source of the text report.
 */
public class ReportBundle {

    private final String datasetName;

    private final Dataset.Origin origin;

    private final String sourcePath;

    private final StructureReport structure;

    private final QualityReport quality;

    private final UnivariateReport univariate;

    private final BivariateReport bivariate;

    private final List<InsightRecord> insights;

    /**
     * Statistics not computed because an expected column is absent or of the wrong kind.
     */
    private final List<String> skipped;

    public ReportBundle(Dataset dataset, StructureReport structure, QualityReport quality,
            UnivariateReport univariate, BivariateReport bivariate, List<InsightRecord> insights,
            List<String> skipped) {
        this.datasetName = dataset.getName();
        this.origin = dataset.getOrigin();
        this.sourcePath = dataset.getSourcePath();
        this.structure = structure;
        this.quality = quality;
        this.univariate = univariate;
        this.bivariate = bivariate;
        this.insights = Collections.unmodifiableList(insights);
        this.skipped = Collections.unmodifiableList(skipped);
    }

    public String getDatasetName() {
        return datasetName;
    }

    public Dataset.Origin getOrigin() {
        return origin;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public StructureReport getStructure() {
        return structure;
    }

    public QualityReport getQuality() {
        return quality;
    }

    public UnivariateReport getUnivariate() {
        return univariate;
    }

    public BivariateReport getBivariate() {
        return bivariate;
    }

    public List<InsightRecord> getInsights() {
        return insights;
    }

    public List<String> getSkipped() {
        return skipped;
    }
}
