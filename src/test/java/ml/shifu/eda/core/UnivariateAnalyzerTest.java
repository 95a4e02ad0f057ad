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
import java.util.Arrays;
import java.util.List;

import ml.shifu.eda.container.CategoricalFrequency;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.Histogram;
import ml.shifu.eda.container.Histogram.Bin;
import ml.shifu.eda.container.UnivariateReport;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.fs.DatasetLoader;
import ml.shifu.eda.fs.SampleDatasets;

import org.testng.Assert;
import org.testng.annotations.Test;

public class UnivariateAnalyzerTest {

    @Test
    public void testSample() {
        List<String> skipped = new ArrayList<String>();
        UnivariateReport report = new UnivariateAnalyzer(new AnalysisConfig()).analyze(SampleDatasets.movies(),
                skipped);
        Assert.assertTrue(skipped.isEmpty());
        Assert.assertEquals(report.getHistograms().size(), 4);
        Assert.assertEquals(report.getLogHistograms().size(), 1);
        Assert.assertEquals(report.getLogHistograms().get(0).getColumnName(), "budget");

        Histogram runtime = report.getHistogram("runtime");
        Assert.assertEquals(runtime.getBins().size(), 10);
        int[] expected = new int[] { 1, 0, 1, 1, 0, 1, 0, 0, 0, 1 };
        for(int i = 0; i < expected.length; i++) {
            Assert.assertEquals(runtime.getBins().get(i).getCount(), expected[i]);
        }
        Bin modal = runtime.getModalBin();
        Assert.assertEquals(modal.getLower(), 122d, 1e-9);
        Assert.assertEquals(modal.getUpper(), 129.2d, 1e-9);
        Assert.assertNotNull(runtime.getDensity());

        // title, genre and director; dates and booleans have no frequency table
        Assert.assertEquals(report.getFrequencies().size(), 3);
        CategoricalFrequency genre = report.getFrequency("genre");
        Assert.assertEquals(genre.getEntries().toString(), "[Action:2, Drama:2, Sci-Fi:1]");
    }

    @Test
    public void testCountsSumToPresentValues() {
        AnalysisConfig config = new AnalysisConfig();
        config.setBinNum(3);
        config.setNumParallel(3);
        Dataset dataset = new DatasetLoader(config).load("src/test/resources/data/movies.csv");
        UnivariateReport report = new UnivariateAnalyzer(config).analyze(dataset, new ArrayList<String>());
        for(Histogram histogram: report.getHistograms()) {
            int present = dataset.getColumn(histogram.getColumnName()).getNonNullCount();
            Assert.assertEquals(histogram.getTotalCount(), present, histogram.getColumnName());
            Assert.assertEquals(histogram.getMissingCount(), dataset.getRowCount() - present);
        }
        Assert.assertEquals(report.getHistogram("revenue").getMissingCount(), 1);
        // column order is kept with a pool
        Assert.assertEquals(report.getHistograms().get(0).getColumnName(), "budget");
        Assert.assertEquals(report.getHistograms().get(3).getColumnName(), "vote_average");
    }

    @Test
    public void testLogColumnGaps() {
        AnalysisConfig config = new AnalysisConfig();
        config.setLogTransformColumns(Arrays.asList("budget", "genre", "gross"));
        config.setDensityEnabled(Boolean.FALSE);
        List<String> skipped = new ArrayList<String>();
        UnivariateReport report = new UnivariateAnalyzer(config).analyze(SampleDatasets.movies(), skipped);
        Assert.assertEquals(report.getLogHistograms().size(), 1);
        Assert.assertEquals(skipped.size(), 2);
        Assert.assertTrue(skipped.get(0).contains("genre"));
        Assert.assertTrue(skipped.get(1).contains("gross"));
        Assert.assertNull(report.getHistogram("budget").getDensity());
    }
}
