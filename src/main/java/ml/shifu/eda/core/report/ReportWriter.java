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

import java.io.File;
import java.io.IOException;

import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;
import ml.shifu.eda.util.Constants;
import ml.shifu.eda.util.JSONUtils;

import org.apache.commons.io.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes report.txt and charts.json of an {@link AnalysisResult} into one output directory.
 */
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final TextReportFormatter formatter;

    public ReportWriter(TextReportFormatter formatter) {
        this.formatter = formatter;
    }

    /**
     * @throws EdaException
     *             {@link EdaErrorCode#ERROR_WRITE_REPORT} if the directory or a file cannot be written
     */
    public void write(AnalysisResult result, File outputDir) {
        File reportFile = new File(outputDir, Constants.REPORT_FILE_NAME);
        File chartsFile = new File(outputDir, Constants.CHARTS_JSON_FILE_NAME);
        try {
            FileUtils.forceMkdir(outputDir);
            FileUtils.writeStringToFile(reportFile, formatter.format(result.getReport()), Constants.DEFAULT_CHARSET);
            JSONUtils.writeValue(chartsFile, result.getCharts());
        } catch (IOException e) {
            throw new EdaException(EdaErrorCode.ERROR_WRITE_REPORT, e, "Cannot write report into " + outputDir);
        }
        log.info("Report is written to {}, chart data to {}.", reportFile, chartsFile);
    }
}
