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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import ml.shifu.eda.container.BivariateReport;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.QualityReport;
import ml.shifu.eda.container.UnivariateReport;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.core.BivariateAnalyzer;
import ml.shifu.eda.core.QualityAssessor;
import ml.shifu.eda.core.UnivariateAnalyzer;
import ml.shifu.eda.fs.SampleDatasets;

import org.easymock.EasyMock;
import org.testng.Assert;
import org.testng.annotations.Test;

public class InsightSynthesizerTest {

    @Test
    public void testRankingByPriorityThenDeclaration() {
        InsightContext context = new InsightContext(null, null, null, new AnalysisConfig());

        InsightRule late = EasyMock.createMock(InsightRule.class);
        EasyMock.expect(late.getPriority()).andReturn(9).anyTimes();
        EasyMock.expect(late.getId()).andReturn("LATE").anyTimes();
        EasyMock.expect(late.evaluate(context)).andReturn(
                Arrays.asList(new InsightRecord("LATE", "late", Collections.<String, Double> emptyMap())));

        InsightRule first = EasyMock.createMock(InsightRule.class);
        EasyMock.expect(first.getPriority()).andReturn(1).anyTimes();
        EasyMock.expect(first.getId()).andReturn("FIRST").anyTimes();
        EasyMock.expect(first.evaluate(context)).andReturn(
                Arrays.asList(new InsightRecord("FIRST", "a", Collections.<String, Double> emptyMap()),
                        new InsightRecord("FIRST", "b", Collections.<String, Double> emptyMap())));

        InsightRule tie = EasyMock.createMock(InsightRule.class);
        EasyMock.expect(tie.getPriority()).andReturn(1).anyTimes();
        EasyMock.expect(tie.getId()).andReturn("TIE").anyTimes();
        EasyMock.expect(tie.evaluate(context)).andReturn(
                Arrays.asList(new InsightRecord("TIE", "c", Collections.<String, Double> emptyMap())));

        InsightRule silent = EasyMock.createMock(InsightRule.class);
        EasyMock.expect(silent.getPriority()).andReturn(0).anyTimes();
        EasyMock.expect(silent.getId()).andReturn("SILENT").anyTimes();
        EasyMock.expect(silent.evaluate(context)).andReturn(Collections.<InsightRecord> emptyList());

        EasyMock.replay(late, first, tie, silent);

        List<InsightRecord> records = new InsightSynthesizer(Arrays.asList(late, first, tie, silent))
                .synthesize(context);
        Assert.assertEquals(records.size(), 4);
        Assert.assertEquals(records.get(0).getMessage(), "a");
        Assert.assertEquals(records.get(1).getMessage(), "b");
        Assert.assertEquals(records.get(2).getRuleId(), "TIE");
        Assert.assertEquals(records.get(3).getRuleId(), "LATE");
        for(int i = 0; i < records.size(); i++) {
            Assert.assertEquals(records.get(i).getRank(), i + 1);
        }
        Assert.assertEquals(records.get(3).toString(), "4. late");

        EasyMock.verify(late, first, tie, silent);
    }

    @Test
    public void testRankingLeavesRuleRecordsUntouched() {
        InsightContext context = new InsightContext(null, null, null, new AnalysisConfig());
        InsightRecord emitted = new InsightRecord("ONLY", "only", Collections.singletonMap("r", 0.9d));

        InsightRule rule = EasyMock.createMock(InsightRule.class);
        EasyMock.expect(rule.getPriority()).andReturn(1).anyTimes();
        EasyMock.expect(rule.getId()).andReturn("ONLY").anyTimes();
        EasyMock.expect(rule.evaluate(context)).andReturn(Arrays.asList(emitted)).times(2);
        EasyMock.replay(rule);

        InsightSynthesizer synthesizer = new InsightSynthesizer(Arrays.asList(rule));
        List<InsightRecord> first = synthesizer.synthesize(context);
        List<InsightRecord> second = synthesizer.synthesize(context);

        Assert.assertEquals(emitted.getRank(), 0);
        Assert.assertEquals(emitted.toString(), "0. only");
        Assert.assertNotSame(first.get(0), emitted);
        Assert.assertEquals(first.get(0).getRank(), 1);
        Assert.assertEquals(second.get(0).getRank(), 1);
        Assert.assertEquals(first.get(0).getRuleId(), "ONLY");
        Assert.assertEquals(first.get(0).getValues().get("r").doubleValue(), 0.9d, 1e-12);

        try {
            first.add(emitted);
            Assert.fail("ranked insights are read-only");
        } catch (UnsupportedOperationException e) {
            // expected
        }
        EasyMock.verify(rule);
    }

    @Test
    public void testDefaultRuleOrder() {
        List<InsightRule> rules = new InsightSynthesizer().getRules();
        Assert.assertEquals(rules.size(), 5);
        Assert.assertEquals(rules.get(0).getId(), HighFinancialCorrelationRule.ID);
        Assert.assertEquals(rules.get(1).getId(), RightSkewRule.ID);
        Assert.assertEquals(rules.get(2).getId(), DominantCategoriesRule.ID);
        Assert.assertEquals(rules.get(3).getId(), DataCompletenessRule.ID);
        Assert.assertEquals(rules.get(4).getId(), CentralTendencyRule.ID);
    }

    @Test
    public void testSampleInsights() {
        AnalysisConfig config = new AnalysisConfig();
        Dataset dataset = SampleDatasets.movies();
        QualityReport quality = new QualityAssessor(1.5d, 1).assess(dataset);
        UnivariateReport univariate = new UnivariateAnalyzer(config).analyze(dataset, new ArrayList<String>());
        BivariateReport bivariate = new BivariateAnalyzer(config).analyze(dataset, new ArrayList<String>());

        List<InsightRecord> records = new InsightSynthesizer().synthesize(new InsightContext(quality, univariate,
                bivariate, config));
        // budget and revenue correlate at 0.68 in the sample, below the default threshold
        Assert.assertEquals(records.size(), 2);
        Assert.assertEquals(records.get(0).getRuleId(), DominantCategoriesRule.ID);
        Assert.assertEquals(records.get(0).getMessage(), "Key Category Popularity: 'Action' (2, 40.00%), "
                + "'Drama' (2, 40.00%) are the most dominant genre values in the sample.");
        Assert.assertEquals(records.get(1).getRuleId(), CentralTendencyRule.ID);
        Assert.assertEquals(records.get(1).getMessage(),
                "Runtime Profile: most values cluster in [122, 129.2] (1 of 5).");

        config.setCorrelationThreshold(0.65d);
        records = new InsightSynthesizer().synthesize(new InsightContext(quality, univariate, bivariate, config));
        Assert.assertEquals(records.get(0).getRuleId(), HighFinancialCorrelationRule.ID);
        Assert.assertEquals(records.get(0).getRank(), 1);
        Assert.assertEquals(records.get(0).getMessage(),
                "High Correlation in Financials: budget and revenue show a strong positive correlation (r = 0.68).");
    }
}
