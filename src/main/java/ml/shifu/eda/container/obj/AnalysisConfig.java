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
package ml.shifu.eda.container.obj;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;
import ml.shifu.eda.util.Constants;

import org.apache.commons.lang.StringUtils;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * {@link AnalysisConfig} is the per-run configuration of the analysis pipeline, usually loaded from
 * AnalysisConfig.json and overridden by command line options.
 *
 * <p>
 * Every chart-artifact producer receives this object explicitly; there is no process-wide plotting state.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisConfig {

    /**
     * Number of equal-width bins per numerical histogram.
     */
    private Integer binNum = 10;

    /**
     * Multiplier of IQR used to compute Tukey fences.
     */
    private Double iqrMultiplier = 1.5;

    /**
     * Absolute correlation at or above which the financial correlation insight fires.
     */
    private Double correlationThreshold = 0.7;

    /**
     * Missing percentage above which the completeness insight fires for a column.
     */
    private Double missingPctThreshold = 5.0;

    /**
     * How many dominant categories the category insight reports.
     */
    private Integer topN = 2;

    private Boolean densityEnabled = Boolean.TRUE;

    /**
     * Sample points of each density curve.
     */
    private Integer densityPoints = 100;

    // bounded marker size range of the joint scatter summary
    private Double sizeMin = 20d;
    private Double sizeMax = 200d;

    private String xColumn = Constants.BUDGET;
    private String yColumn = Constants.REVENUE;
    private String emphasisColumn = Constants.VOTE_AVERAGE;
    private String categoryColumn = Constants.GENRE;
    private String modalColumn = Constants.RUNTIME;

    /**
     * Columns which also get a log1p transformed histogram, heavy right skewed money columns mostly.
     */
    private List<String> logTransformColumns = new ArrayList<String>(Arrays.asList(Constants.BUDGET));

    private Integer reportTopCategories = 5;

    private Integer previewRows = 5;

    private Integer numParallel = 1;

    private String delimiter = Constants.DEFAULT_DELIMITER;

    private List<String> missingValues = new ArrayList<String>(Arrays.asList("NA", "NaN", "null", "N/A"));

    /**
     * Reject out-of-domain options before anything is computed.
     *
     * @throws EdaException
     *             with {@link EdaErrorCode#ERROR_CONFIG_INVALID} if any option is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<String>();
        if(binNum == null || binNum < 1) {
            errors.add("binNum should be a positive integer, but is " + binNum);
        }
        if(iqrMultiplier == null || iqrMultiplier.isNaN() || iqrMultiplier.isInfinite() || iqrMultiplier < 0) {
            errors.add("iqrMultiplier should be a non-negative number, but is " + iqrMultiplier);
        }
        if(correlationThreshold == null || !(correlationThreshold >= 0d && correlationThreshold <= 1d)) {
            errors.add("correlationThreshold should be in [0, 1], but is " + correlationThreshold);
        }
        if(missingPctThreshold == null || !(missingPctThreshold >= 0d && missingPctThreshold <= 100d)) {
            errors.add("missingPctThreshold should be in [0, 100], but is " + missingPctThreshold);
        }
        if(topN == null || topN < 1) {
            errors.add("topN should be a positive integer, but is " + topN);
        }
        if(densityPoints == null || densityPoints < 2) {
            errors.add("densityPoints should be at least 2, but is " + densityPoints);
        }
        if(sizeMin == null || sizeMax == null || sizeMin.isNaN() || sizeMax.isNaN() || sizeMin > sizeMax) {
            errors.add("sizeMin should not be greater than sizeMax, but is [" + sizeMin + ", " + sizeMax + "]");
        }
        if(reportTopCategories == null || reportTopCategories < 1) {
            errors.add("reportTopCategories should be a positive integer, but is " + reportTopCategories);
        }
        if(previewRows == null || previewRows < 0) {
            errors.add("previewRows should not be negative, but is " + previewRows);
        }
        if(numParallel == null || numParallel < 1) {
            errors.add("numParallel should be a positive integer, but is " + numParallel);
        }
        if(StringUtils.isEmpty(delimiter) || delimiter.length() != 1) {
            errors.add("delimiter should be exactly one character, but is '" + delimiter + "'");
        }

        if(!errors.isEmpty()) {
            throw new EdaException(EdaErrorCode.ERROR_CONFIG_INVALID, StringUtils.join(errors, "; "));
        }
    }

    public Integer getBinNum() {
        return binNum;
    }

    public void setBinNum(Integer binNum) {
        this.binNum = binNum;
    }

    public Double getIqrMultiplier() {
        return iqrMultiplier;
    }

    public void setIqrMultiplier(Double iqrMultiplier) {
        this.iqrMultiplier = iqrMultiplier;
    }

    public Double getCorrelationThreshold() {
        return correlationThreshold;
    }

    public void setCorrelationThreshold(Double correlationThreshold) {
        this.correlationThreshold = correlationThreshold;
    }

    public Double getMissingPctThreshold() {
        return missingPctThreshold;
    }

    public void setMissingPctThreshold(Double missingPctThreshold) {
        this.missingPctThreshold = missingPctThreshold;
    }

    public Integer getTopN() {
        return topN;
    }

    public void setTopN(Integer topN) {
        this.topN = topN;
    }

    public Boolean getDensityEnabled() {
        return densityEnabled;
    }

    public void setDensityEnabled(Boolean densityEnabled) {
        this.densityEnabled = densityEnabled;
    }

    public Integer getDensityPoints() {
        return densityPoints;
    }

    public void setDensityPoints(Integer densityPoints) {
        this.densityPoints = densityPoints;
    }

    public Double getSizeMin() {
        return sizeMin;
    }

    public void setSizeMin(Double sizeMin) {
        this.sizeMin = sizeMin;
    }

    public Double getSizeMax() {
        return sizeMax;
    }

    public void setSizeMax(Double sizeMax) {
        this.sizeMax = sizeMax;
    }

    public String getxColumn() {
        return xColumn;
    }

    public void setxColumn(String xColumn) {
        this.xColumn = xColumn;
    }

    public String getyColumn() {
        return yColumn;
    }

    public void setyColumn(String yColumn) {
        this.yColumn = yColumn;
    }

    public String getEmphasisColumn() {
        return emphasisColumn;
    }

    public void setEmphasisColumn(String emphasisColumn) {
        this.emphasisColumn = emphasisColumn;
    }

    public String getCategoryColumn() {
        return categoryColumn;
    }

    public void setCategoryColumn(String categoryColumn) {
        this.categoryColumn = categoryColumn;
    }

    public String getModalColumn() {
        return modalColumn;
    }

    public void setModalColumn(String modalColumn) {
        this.modalColumn = modalColumn;
    }

    public List<String> getLogTransformColumns() {
        return logTransformColumns;
    }

    public void setLogTransformColumns(List<String> logTransformColumns) {
        this.logTransformColumns = logTransformColumns;
    }

    public Integer getReportTopCategories() {
        return reportTopCategories;
    }

    public void setReportTopCategories(Integer reportTopCategories) {
        this.reportTopCategories = reportTopCategories;
    }

    public Integer getPreviewRows() {
        return previewRows;
    }

    public void setPreviewRows(Integer previewRows) {
        this.previewRows = previewRows;
    }

    public Integer getNumParallel() {
        return numParallel;
    }

    public void setNumParallel(Integer numParallel) {
        this.numParallel = numParallel;
    }

    public String getDelimiter() {
        return delimiter;
    }

    public void setDelimiter(String delimiter) {
        this.delimiter = delimiter;
    }

    public List<String> getMissingValues() {
        return missingValues;
    }

    public void setMissingValues(List<String> missingValues) {
        this.missingValues = missingValues;
    }

    @Override
    public AnalysisConfig clone() {
        AnalysisConfig other = new AnalysisConfig();
        other.setBinNum(binNum);
        other.setIqrMultiplier(iqrMultiplier);
        other.setCorrelationThreshold(correlationThreshold);
        other.setMissingPctThreshold(missingPctThreshold);
        other.setTopN(topN);
        other.setDensityEnabled(densityEnabled);
        other.setDensityPoints(densityPoints);
        other.setSizeMin(sizeMin);
        other.setSizeMax(sizeMax);
        other.setxColumn(xColumn);
        other.setyColumn(yColumn);
        other.setEmphasisColumn(emphasisColumn);
        other.setCategoryColumn(categoryColumn);
        other.setModalColumn(modalColumn);
        other.setLogTransformColumns(logTransformColumns == null ? null : new ArrayList<String>(
                logTransformColumns));
        other.setReportTopCategories(reportTopCategories);
        other.setPreviewRows(previewRows);
        other.setNumParallel(numParallel);
        other.setDelimiter(delimiter);
        other.setMissingValues(missingValues == null ? null : new ArrayList<String>(missingValues));
        return other;
    }
}
