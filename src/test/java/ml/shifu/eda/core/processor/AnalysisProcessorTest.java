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
package ml.shifu.eda.core.processor;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.eda.container.CategoricalFrequency;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.MissingnessReport;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.core.insight.HighFinancialCorrelationRule;
import ml.shifu.eda.core.insight.InsightRecord;
import ml.shifu.eda.core.report.AnalysisResult;
import ml.shifu.eda.core.report.ReportBundle;
import ml.shifu.eda.fs.SampleDatasets;
import ml.shifu.eda.util.Constants;

import org.apache.commons.io.FileUtils;
import org.testng.Assert;
import org.testng.annotations.AfterClass;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

public class AnalysisProcessorTest {

    private File tmpDir;

    @BeforeClass
    public void setUp() {
        tmpDir = new File("target" + File.separator + "AnalysisProcessorTest");
    }

    @AfterClass
    public void tearDown() throws IOException {
        FileUtils.deleteDirectory(tmpDir);
    }

    @Test
    public void testSampleAnalysis() {
        AnalysisResult result = new AnalysisProcessor(null).analyze(SampleDatasets.movies(), new AnalysisConfig());
        ReportBundle report = result.getReport();

        Assert.assertEquals(report.getOrigin(), Dataset.Origin.SYNTHETIC);
        Assert.assertEquals(report.getStructure().getRowCount(), 5);
        Assert.assertEquals(report.getStructure().getColumnCount(), 9);
        for(MissingnessReport.Entry entry: report.getQuality().getMissingness().getEntries()) {
            Assert.assertEquals(entry.getMissingCount(), 0);
        }
        Assert.assertTrue(report.getSkipped().isEmpty());

        CategoricalFrequency genre = report.getUnivariate().getFrequency("genre");
        Assert.assertEquals(genre.getEntries().toString(), "[Action:2, Drama:2, Sci-Fi:1]");

        double corr = report.getBivariate().getCorrelationMatrix().get("budget", "revenue");
        Assert.assertEquals(corr, 0.6781301085463589d, 1e-9);
        Assert.assertEquals(report.getBivariate().getCorrelationMatrix().get("revenue", "vote_average"),
                -0.9634207935887025d, 1e-9);

        for(InsightRecord record: report.getInsights()) {
            Assert.assertNotEquals(record.getRuleId(), HighFinancialCorrelationRule.ID);
        }
        Assert.assertEquals(result.getCharts().getHistograms().size(), 4);
        Assert.assertEquals(result.getCharts().getLogHistograms().size(), 1);
        Assert.assertNotNull(result.getCharts().getJointSummary());
    }

    @Test
    public void testLowerCorrelationThreshold() {
        AnalysisConfig config = new AnalysisConfig();
        config.setCorrelationThreshold(0.65d);
        List<InsightRecord> insights = new AnalysisProcessor(null).analyze(SampleDatasets.movies(), config)
                .getReport().getInsights();
        Assert.assertEquals(insights.get(0).getRuleId(), HighFinancialCorrelationRule.ID);
        Assert.assertEquals(insights.get(0).getRank(), 1);
    }

    @Test
    public void testRunWritesReport() throws Exception {
        File output = new File(tmpDir, "file");
        Map<String, Object> params = new HashMap<String, Object>();
        params.put(Constants.PARAM_INPUT, "src/test/resources/data/movies.csv");
        params.put(Constants.PARAM_OUTPUT, output.getPath());

        Assert.assertEquals(new AnalysisProcessor(params).run(), 0);

        String report = FileUtils.readFileToString(new File(output, Constants.REPORT_FILE_NAME),
                Constants.DEFAULT_CHARSET);
        Assert.assertTrue(report.contains("Dataset 'movies' loaded from src/test/resources/data/movies.csv."));
        Assert.assertTrue(report.contains("(10, 9)"));
        Assert.assertTrue(report.contains("director has 20.00% missing values"));
        Assert.assertTrue(report.contains("revenue has 10.00% missing values"));
        Assert.assertTrue(report.contains("STEP 6: FINAL INSIGHTS"));

        String charts = FileUtils.readFileToString(new File(output, Constants.CHARTS_JSON_FILE_NAME),
                Constants.DEFAULT_CHARSET);
        Assert.assertTrue(charts.contains("\"correlation\""));
        Assert.assertTrue(charts.contains("\"jointSummary\""));
    }

    @Test
    public void testRunFallsBackToSample() throws Exception {
        File output = new File(tmpDir, "sample");
        Map<String, Object> params = new HashMap<String, Object>();
        params.put(Constants.PARAM_INPUT, "src/test/resources/data/not_exist.csv");
        params.put(Constants.PARAM_OUTPUT, output.getPath());
        params.put(Constants.PARAM_CONFIG, "src/test/resources/config/AnalysisConfig.json");

        Assert.assertEquals(new AnalysisProcessor(params).run(), 0);
        String report = FileUtils.readFileToString(new File(output, Constants.REPORT_FILE_NAME),
                Constants.DEFAULT_CHARSET);
        Assert.assertTrue(report.contains("Using the synthetic movie sample"));
        Assert.assertTrue(report.contains("(5, 9)"));
        Assert.assertTrue(report.contains("--- 4.1 Distributions (5 equal-width bins) ---"));
        Assert.assertTrue(report.contains("log1p(revenue)"));
    }

    @Test
    public void testRunWithInvalidConfig() throws Exception {
        Map<String, Object> params = new HashMap<String, Object>();
        params.put(Constants.PARAM_CONFIG, "src/test/resources/config/InvalidConfig.json");
        Assert.assertEquals(new AnalysisProcessor(params).run(), 1);

        params.put(Constants.PARAM_CONFIG, "src/test/resources/config/BrokenConfig.json");
        Assert.assertEquals(new AnalysisProcessor(params).run(), 1);
    }

    @Test
    public void testRunWithUnwritableOutput() throws Exception {
        File blocker = new File(tmpDir, "blocker");
        FileUtils.writeStringToFile(blocker, "not a directory", Constants.DEFAULT_CHARSET);

        Map<String, Object> params = new HashMap<String, Object>();
        params.put(Constants.PARAM_OUTPUT, blocker.getPath());
        Assert.assertEquals(new AnalysisProcessor(params).run(), -1);
    }

    @Test
    public void testSchemaGapsAreReported() {
        Dataset dataset = SampleDatasets.movies();
        AnalysisConfig config = new AnalysisConfig();
        config.setLogTransformColumns(Arrays.asList("budget", "popularity"));
        ReportBundle report = new AnalysisProcessor(null).analyze(dataset, config).getReport();
        Assert.assertEquals(report.getSkipped().size(), 1);
        Assert.assertTrue(report.getSkipped().get(0).contains("popularity"));
    }
}
