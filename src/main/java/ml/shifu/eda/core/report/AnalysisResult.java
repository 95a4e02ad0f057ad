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

public class AnalysisResult {

    private final ReportBundle report;

    private final ChartArtifacts charts;

    public AnalysisResult(ReportBundle report) {
        this.report = report;
        this.charts = new ChartArtifacts(report);
    }

    public ReportBundle getReport() {
        return report;
    }

    public ChartArtifacts getCharts() {
        return charts;
    }
}
