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
import java.util.List;
import java.util.concurrent.Callable;

import ml.shifu.eda.container.CategoricalFrequency;
import ml.shifu.eda.container.Column;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.DensityCurve;
import ml.shifu.eda.container.Histogram;
import ml.shifu.eda.container.Histogram.Transform;
import ml.shifu.eda.container.UnivariateReport;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.core.binning.CategoricalBinning;
import ml.shifu.eda.core.binning.EqualIntervalBinning;
import ml.shifu.eda.executor.ExecutorManager;

import org.apache.commons.collections.CollectionUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link UnivariateAnalyzer} computes per-column distributions: equal-width histograms (with density curves) for
 * numerical columns and exact frequency tables for categorical columns.
 */
public class UnivariateAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(UnivariateAnalyzer.class);

    private final AnalysisConfig config;

    public UnivariateAnalyzer(AnalysisConfig config) {
        this.config = config;
    }

    public UnivariateReport analyze(Dataset dataset, List<String> skipped) {
        List<Callable<Histogram>> tasks = new ArrayList<Callable<Histogram>>();
        for(final Column column: dataset.getNumericColumns()) {
            tasks.add(new Callable<Histogram>() {
                @Override
                public Histogram call() {
                    return histogram(column, Transform.NONE);
                }
            });
        }

        if(CollectionUtils.isNotEmpty(config.getLogTransformColumns())) {
            for(String columnName: config.getLogTransformColumns()) {
                final Column column = dataset.getColumn(columnName);
                if(column == null || !column.getKind().isNumerical()) {
                    skipped.add("Log-transformed histogram of '" + columnName
                            + "' skipped: column is absent or not numeric");
                    continue;
                }
                tasks.add(new Callable<Histogram>() {
                    @Override
                    public Histogram call() {
                        return histogram(column, Transform.LOG1P);
                    }
                });
            }
        }

        ExecutorManager<Histogram> manager = new ExecutorManager<Histogram>(config.getNumParallel());
        List<Histogram> results;
        try {
            results = manager.submitTasksAndWaitResults(tasks);
        } finally {
            manager.graceShutDown();
        }

        List<Histogram> histograms = new ArrayList<Histogram>();
        List<Histogram> logHistograms = new ArrayList<Histogram>();
        for(Histogram histogram: results) {
            if(histogram.getTransform() == Transform.NONE) {
                histograms.add(histogram);
            } else {
                logHistograms.add(histogram);
            }
        }

        List<CategoricalFrequency> frequencies = new ArrayList<CategoricalFrequency>();
        for(Column column: dataset.getCategoricalColumns()) {
            frequencies.add(frequency(column));
        }

        return new UnivariateReport(histograms, logHistograms, frequencies);
    }

    public Histogram histogram(Column column, Transform transform) {
        EqualIntervalBinning binning = new EqualIntervalBinning(config.getBinNum(), transform);
        binning.addColumn(column);
        if(binning.getInvalidValCnt() > 0) {
            log.warn("{} values of column {} cannot be {} transformed and are left out.",
                    binning.getInvalidValCnt(), column.getName(), transform);
        }

        DensityCurve density = null;
        if(Boolean.TRUE.equals(config.getDensityEnabled())) {
            density = new DensityEstimator(config.getDensityPoints()).estimate(binning.getValues());
        }
        return binning.getHistogram(column.getName(), density);
    }

    public CategoricalFrequency frequency(Column column) {
        CategoricalBinning binning = new CategoricalBinning();
        binning.addColumn(column);
        return binning.getFrequency(column.getName());
    }
}
