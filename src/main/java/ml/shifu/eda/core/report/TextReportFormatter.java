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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ml.shifu.eda.container.BivariateReport;
import ml.shifu.eda.container.CategoricalFrequency;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.DescriptiveStatistics;
import ml.shifu.eda.container.Histogram;
import ml.shifu.eda.container.JointFeatureSummary;
import ml.shifu.eda.container.MissingnessReport;
import ml.shifu.eda.container.OutlierSummary;
import ml.shifu.eda.container.QualityReport;
import ml.shifu.eda.container.StructureReport;
import ml.shifu.eda.container.StructureReport.ColumnInfo;
import ml.shifu.eda.container.UnivariateReport;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.core.correlation.CorrelationMatrix;
import ml.shifu.eda.core.insight.InsightRecord;
import ml.shifu.eda.util.CommonUtils;

import org.apache.commons.lang.StringUtils;

/**
 * Renders a {@link ReportBundle} as the plain text report, one step banner per pipeline stage.
 */
public class TextReportFormatter {

    private static final String BANNER = StringUtils.repeat("=", 50);

    private static final String LINE_SEPARATOR = "\n";

    private final AnalysisConfig config;

    public TextReportFormatter(AnalysisConfig config) {
        this.config = config;
    }

    public String format(ReportBundle bundle) {
        StringBuilder sb = new StringBuilder();
        appendLoading(sb, bundle);
        appendStructure(sb, bundle.getStructure());
        appendQuality(sb, bundle.getQuality());
        appendUnivariate(sb, bundle.getUnivariate());
        appendBivariate(sb, bundle.getBivariate());
        appendSkipped(sb, bundle.getSkipped());
        appendInsights(sb, bundle.getInsights());
        return sb.toString();
    }

    private void appendLoading(StringBuilder sb, ReportBundle bundle) {
        banner(sb, "STEP 1: DATA LOADING");
        if(bundle.getOrigin() == Dataset.Origin.SYNTHETIC) {
            line(sb, "Dataset not found. Using the synthetic movie sample '" + bundle.getDatasetName()
                    + "' for demonstration.");
        } else {
            line(sb, "Dataset '" + bundle.getDatasetName() + "' loaded from " + bundle.getSourcePath() + ".");
        }
    }

    private void appendStructure(StringBuilder sb, StructureReport structure) {
        banner(sb, "STEP 2: INITIAL DATA INSPECTION");

        line(sb, "--- First " + structure.getPreviewRows().size() + " Rows ---");
        List<String> header = new ArrayList<String>();
        header.add("");
        header.addAll(structure.getHeader());
        List<List<String>> rows = new ArrayList<List<String>>();
        for(int i = 0; i < structure.getPreviewRows().size(); i++) {
            List<String> row = new ArrayList<String>();
            row.add(Integer.toString(i));
            row.addAll(structure.getPreviewRows().get(i));
            rows.add(row);
        }
        table(sb, header, rows);

        line(sb, "");
        line(sb, "--- Dataset Shape (Rows, Columns) ---");
        line(sb, "(" + structure.getRowCount() + ", " + structure.getColumnCount() + ")");

        line(sb, "");
        line(sb, "--- Column Info and Data Types ---");
        rows = new ArrayList<List<String>>();
        for(int i = 0; i < structure.getColumns().size(); i++) {
            ColumnInfo info = structure.getColumns().get(i);
            rows.add(Arrays.asList(Integer.toString(i), info.getName(), info.getNonNullCount() + " non-null",
                    info.getKind().getShortName()));
        }
        table(sb, Arrays.asList("#", "Column", "Non-Null Count", "Dtype"), rows);
    }

    private void appendQuality(StringBuilder sb, QualityReport quality) {
        banner(sb, "STEP 3: DATA QUALITY ASSESSMENT");

        line(sb, "--- 3.1 Missing Value Report ---");
        List<List<String>> rows = new ArrayList<List<String>>();
        for(MissingnessReport.Entry entry: quality.getMissingness().getEntries()) {
            rows.add(Arrays.asList(entry.getColumnName(), Integer.toString(entry.getMissingCount()),
                    CommonUtils.formatShort(entry.getMissingPercentage())));
        }
        table(sb, Arrays.asList("", "Missing Count", "Missing Percentage"), rows);

        line(sb, "");
        line(sb, "--- 3.2 Numerical Feature Descriptive Statistics ---");
        List<String> header = new ArrayList<String>();
        header.add("");
        String[] labels = new String[] { "count", "mean", "std", "min", "25%", "50%", "75%", "max" };
        List<List<String>> statRows = new ArrayList<List<String>>();
        for(String label: labels) {
            List<String> row = new ArrayList<String>();
            row.add(label);
            statRows.add(row);
        }
        for(DescriptiveStatistics stats: quality.getStatistics()) {
            header.add(stats.getColumnName());
            double[] values = new double[] { stats.getCount(), stats.getMean(), stats.getStdDev(), stats.getMin(),
                    stats.getQ1(), stats.getMedian(), stats.getQ3(), stats.getMax() };
            for(int i = 0; i < values.length; i++) {
                statRows.get(i).add(CommonUtils.formatDouble(values[i]));
            }
        }
        table(sb, header, statRows);

        line(sb, "");
        line(sb, "--- 3.3 Outliers (IQR x " + CommonUtils.formatDouble(config.getIqrMultiplier()) + ") ---");
        rows = new ArrayList<List<String>>();
        for(OutlierSummary outliers: quality.getOutliers()) {
            rows.add(Arrays.asList(outliers.getColumnName(), CommonUtils.formatDouble(outliers.getIqr()),
                    CommonUtils.formatDouble(outliers.getLowerFence()),
                    CommonUtils.formatDouble(outliers.getUpperFence()),
                    Integer.toString(outliers.getOutlierRows().size()), outliers.getOutlierRows().toString()));
        }
        table(sb, Arrays.asList("", "IQR", "Lower Fence", "Upper Fence", "Outliers", "Rows"), rows);
    }

    private void appendUnivariate(StringBuilder sb, UnivariateReport univariate) {
        banner(sb, "STEP 4: UNIVARIATE ANALYSIS");

        line(sb, "--- 4.1 Distributions (" + config.getBinNum() + " equal-width bins) ---");
        List<Histogram> all = new ArrayList<Histogram>(univariate.getHistograms());
        all.addAll(univariate.getLogHistograms());
        for(Histogram histogram: all) {
            String name = histogram.getTransform() == Histogram.Transform.LOG1P ? "log1p(" + histogram.getColumnName()
                    + ")" : histogram.getColumnName();
            Histogram.Bin modal = histogram.getModalBin();
            if(modal == null) {
                line(sb, name + ": no values");
                continue;
            }
            List<Histogram.Bin> bins = histogram.getBins();
            line(sb, name + ": range [" + CommonUtils.formatDouble(bins.get(0).getLower()) + ", "
                    + CommonUtils.formatDouble(bins.get(bins.size() - 1).getUpper()) + "], modal bin ["
                    + CommonUtils.formatDouble(modal.getLower()) + ", " + CommonUtils.formatDouble(modal.getUpper())
                    + "] with " + modal.getCount() + " of " + histogram.getTotalCount() + " values");
        }

        int top = config.getReportTopCategories();
        for(CategoricalFrequency frequency: univariate.getFrequencies()) {
            line(sb, "");
            line(sb, "--- 4.2 Top " + top + " Values of " + frequency.getColumnName() + " ---");
            List<List<String>> rows = new ArrayList<List<String>>();
            for(CategoricalFrequency.Entry entry: frequency.top(top)) {
                rows.add(Arrays.asList(entry.getValue(), Integer.toString(entry.getCount())));
            }
            table(sb, Arrays.asList(frequency.getColumnName(), "count"), rows);
        }
    }

    private void appendBivariate(StringBuilder sb, BivariateReport bivariate) {
        banner(sb, "STEP 5: BIVARIATE AND MULTIVARIATE ANALYSIS");

        line(sb, "--- 5.1 Correlation Matrix ---");
        CorrelationMatrix matrix = bivariate.getCorrelationMatrix();
        List<String> header = new ArrayList<String>();
        header.add("");
        header.addAll(matrix.getColumns());
        List<List<String>> rows = new ArrayList<List<String>>();
        for(int i = 0; i < matrix.size(); i++) {
            List<String> row = new ArrayList<String>();
            row.add(matrix.getColumns().get(i));
            for(int j = 0; j < matrix.size(); j++) {
                row.add(CommonUtils.formatShort(matrix.get(i, j)));
            }
            rows.add(row);
        }
        table(sb, header, rows);

        line(sb, "");
        line(sb, "--- 5.2 Joint Feature Summary ---");
        JointFeatureSummary joint = bivariate.getJointSummary();
        if(joint == null) {
            line(sb, "Not available.");
        } else {
            line(sb, joint.getxColumn() + " vs. " + joint.getyColumn() + " sized by " + joint.getEmphasisColumn()
                    + " in [" + CommonUtils.formatDouble(joint.getSizeMin()) + ", "
                    + CommonUtils.formatDouble(joint.getSizeMax()) + "], " + joint.getPoints().size() + " points");
        }
    }

    private void appendSkipped(StringBuilder sb, List<String> skipped) {
        if(skipped.isEmpty()) {
            return;
        }
        line(sb, "");
        line(sb, "--- Skipped ---");
        for(String reason: skipped) {
            line(sb, "- " + reason);
        }
    }

    private void appendInsights(StringBuilder sb, List<InsightRecord> insights) {
        banner(sb, "STEP 6: FINAL INSIGHTS (STATISTICAL STORYTELLING)");
        if(insights.isEmpty()) {
            line(sb, "No insight fired.");
        }
        for(InsightRecord record: insights) {
            line(sb, record.toString());
        }
        line(sb, BANNER);
    }

    private static void banner(StringBuilder sb, String title) {
        line(sb, "");
        line(sb, BANNER);
        line(sb, title);
        line(sb, BANNER);
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(text).append(LINE_SEPARATOR);
    }

    /**
     * First column left aligned, others right aligned, two spaces apart.
     */
    static void table(StringBuilder sb, List<String> header, List<List<String>> rows) {
        int[] widths = new int[header.size()];
        for(int i = 0; i < header.size(); i++) {
            widths[i] = header.get(i).length();
        }
        for(List<String> row: rows) {
            for(int i = 0; i < row.size() && i < widths.length; i++) {
                widths[i] = Math.max(widths[i], row.get(i).length());
            }
        }

        List<List<String>> all = new ArrayList<List<String>>();
        all.add(header);
        all.addAll(rows);
        for(List<String> row: all) {
            StringBuilder text = new StringBuilder();
            for(int i = 0; i < row.size() && i < widths.length; i++) {
                if(i == 0) {
                    text.append(StringUtils.rightPad(row.get(i), widths[i]));
                } else {
                    text.append("  ").append(StringUtils.leftPad(row.get(i), widths[i]));
                }
            }
            line(sb, StringUtils.stripEnd(text.toString(), " "));
        }
    }
}
