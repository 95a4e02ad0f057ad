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

import ml.shifu.eda.container.BivariateReport;
import ml.shifu.eda.container.Column;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.Dataset.Origin;
import ml.shifu.eda.container.JointFeatureSummary;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.container.obj.ColumnKind;
import ml.shifu.eda.fs.SampleDatasets;

import org.testng.Assert;
import org.testng.annotations.Test;

public class BivariateAnalyzerTest {

    @Test
    public void testSampleJointSummary() {
        List<String> skipped = new ArrayList<String>();
        BivariateReport report = new BivariateAnalyzer(new AnalysisConfig()).analyze(SampleDatasets.movies(),
                skipped);
        Assert.assertTrue(skipped.isEmpty());
        Assert.assertTrue(report.getCorrelationMatrix().get("budget", "revenue") > 0.6d);

        JointFeatureSummary joint = report.getJointSummary();
        Assert.assertEquals(joint.getxColumn(), "budget");
        Assert.assertEquals(joint.getyColumn(), "revenue");
        Assert.assertEquals(joint.getEmphasisColumn(), "vote_average");
        Assert.assertEquals(joint.getPoints().size(), 5);

        double[] sizes = new double[] { 20d, 53.75d, 87.5d, 155d, 200d };
        for(int i = 0; i < sizes.length; i++) {
            Assert.assertEquals(joint.getPoints().get(i).getRow(), i);
            Assert.assertEquals(joint.getPoints().get(i).getSize().doubleValue(), sizes[i], 1e-9);
        }
        Assert.assertEquals(joint.getPoints().get(0).getX().doubleValue(), 237e6, 1e-3);
        Assert.assertEquals(joint.getPoints().get(0).getEmphasis().doubleValue(), 7.2d, 1e-12);
    }

    @Test
    public void testConstantAndMissingEmphasis() {
        Column x = new Column("budget", ColumnKind.NUMERIC, Arrays.asList(1d, 2d, null));
        Column y = new Column("revenue", ColumnKind.NUMERIC, Arrays.asList(3d, 4d, 5d));
        Column emphasis = new Column("vote_average", ColumnKind.NUMERIC, Arrays.asList(8d, null, 8d));
        Dataset dataset = new Dataset("t", Origin.FILE, null, Arrays.asList(x, y, emphasis));

        JointFeatureSummary joint = new BivariateAnalyzer(new AnalysisConfig()).analyze(dataset,
                new ArrayList<String>()).getJointSummary();
        Assert.assertEquals(joint.getPoints().get(0).getSize().doubleValue(), 110d, 1e-9);
        Assert.assertNull(joint.getPoints().get(1).getSize());
        Assert.assertNull(joint.getPoints().get(2).getX());
        Assert.assertEquals(joint.getPoints().get(2).getSize().doubleValue(), 110d, 1e-9);
    }

    @Test
    public void testMissingDesignatedColumn() {
        Column x = new Column("budget", ColumnKind.NUMERIC, Arrays.asList(1d, 2d));
        Column genre = new Column("genre", ColumnKind.CATEGORICAL, Arrays.asList("a", "b"));
        Dataset dataset = new Dataset("t", Origin.FILE, null, Arrays.asList(x, genre));

        List<String> skipped = new ArrayList<String>();
        BivariateReport report = new BivariateAnalyzer(new AnalysisConfig()).analyze(dataset, skipped);
        Assert.assertNull(report.getJointSummary());
        Assert.assertEquals(report.getCorrelationMatrix().size(), 1);
        Assert.assertEquals(skipped.size(), 1);
        Assert.assertTrue(skipped.get(0).contains("revenue"));
        Assert.assertTrue(skipped.get(0).contains("vote_average"));
    }
}
