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
package ml.shifu.eda.core.insight;

import ml.shifu.eda.container.BivariateReport;
import ml.shifu.eda.container.QualityReport;
import ml.shifu.eda.container.UnivariateReport;
import ml.shifu.eda.container.obj.AnalysisConfig;

/**
 * Prior stage outputs a rule may read.
 */
public class InsightContext {

    private final QualityReport quality;

    private final UnivariateReport univariate;

    private final BivariateReport bivariate;

    private final AnalysisConfig config;

    public InsightContext(QualityReport quality, UnivariateReport univariate, BivariateReport bivariate,
            AnalysisConfig config) {
        this.quality = quality;
        this.univariate = univariate;
        this.bivariate = bivariate;
        this.config = config;
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

    public AnalysisConfig getConfig() {
        return config;
    }
}
