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
 * Histograms of numerical columns and frequencies of categorical columns, in dataset column order.
 */
public class UnivariateReport {

    private final List<Histogram> histograms;

    private final List<Histogram> logHistograms;

    private final List<CategoricalFrequency> frequencies;

    public UnivariateReport(List<Histogram> histograms, List<Histogram> logHistograms,
            List<CategoricalFrequency> frequencies) {
        this.histograms = Collections.unmodifiableList(histograms);
        this.logHistograms = Collections.unmodifiableList(logHistograms);
        this.frequencies = Collections.unmodifiableList(frequencies);
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

    /**
     * @return untransformed histogram of column or null
     */
    public Histogram getHistogram(String columnName) {
        for(Histogram histogram: histograms) {
            if(histogram.getColumnName().equals(columnName)) {
                return histogram;
            }
        }
        return null;
    }

    /**
     * @return frequency of column or null
     */
    public CategoricalFrequency getFrequency(String columnName) {
        for(CategoricalFrequency frequency: frequencies) {
            if(frequency.getColumnName().equals(columnName)) {
                return frequency;
            }
        }
        return null;
    }
}
