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

import java.util.List;

import ml.shifu.eda.container.BoxPlotSummary;
import ml.shifu.eda.container.CategoricalFrequency;
import ml.shifu.eda.container.Histogram;
import ml.shifu.eda.container.JointFeatureSummary;
import ml.shifu.eda.core.correlation.CorrelationMatrix;

/**
 * Chart ready data, serialized as-is into charts.json. Rendering is left to the consumer.
 */
public class ChartArtifacts {

    private final List<Histogram> histograms;

    private final List<Histogram> logHistograms;

    private final List<CategoricalFrequency> frequencies;

    private final List<BoxPlotSummary> boxPlots;

    private final CorrelationMatrix correlation;

    private final JointFeatureSummary jointSummary;

    public ChartArtifacts(ReportBundle bundle) {
        this.histograms = bundle.getUnivariate().getHistograms();
        this.logHistograms = bundle.getUnivariate().getLogHistograms();
        this.frequencies = bundle.getUnivariate().getFrequencies();
        this.boxPlots = bundle.getQuality().getBoxPlots();
        this.correlation = bundle.getBivariate().getCorrelationMatrix();
        this.jointSummary = bundle.getBivariate().getJointSummary();
    }

    public List<Histogram> getHistograms() {
        return histograms;
    }

    public List<Histogram> getLogHistograms() {
        return logHistograms;
    }

    public List<CategoricalFrequency> getFrequencies() {
        return frequencies;
    }

    public List<BoxPlotSummary> getBoxPlots() {
        return boxPlots;
    }

    public CorrelationMatrix getCorrelation() {
        return correlation;
    }

    public JointFeatureSummary getJointSummary() {
        return jointSummary;
    }
}
