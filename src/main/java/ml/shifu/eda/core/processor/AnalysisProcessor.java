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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import ml.shifu.eda.container.BivariateReport;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.QualityReport;
import ml.shifu.eda.container.StructureReport;
import ml.shifu.eda.container.UnivariateReport;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.core.BivariateAnalyzer;
import ml.shifu.eda.core.QualityAssessor;
import ml.shifu.eda.core.StructuralInspector;
import ml.shifu.eda.core.UnivariateAnalyzer;
import ml.shifu.eda.core.insight.InsightContext;
import ml.shifu.eda.core.insight.InsightRecord;
import ml.shifu.eda.core.insight.InsightSynthesizer;
import ml.shifu.eda.core.report.AnalysisResult;
import ml.shifu.eda.core.report.ReportBundle;
import ml.shifu.eda.core.report.ReportWriter;
import ml.shifu.eda.core.report.TextReportFormatter;
import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;
import ml.shifu.eda.fs.DatasetLoader;
import ml.shifu.eda.util.CommonUtils;
import ml.shifu.eda.util.Constants;

import org.apache.commons.collections.MapUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the whole exploratory analysis: load, inspect, assess quality, univariate and bivariate analysis, then
 * insights. Every stage reads the immutable dataset and earlier outputs only.
 *
 * <p>
 * Params:
 * <ul>
 * <li>{@link Constants#PARAM_INPUT}: input file path, the synthetic sample is used if it cannot be loaded</li>
 * <li>{@link Constants#PARAM_CONFIG}: an {@link AnalysisConfig} instance or a JSON file path, defaults if absent</li>
 * <li>{@link Constants#PARAM_OUTPUT}: output directory; the text report goes to stdout if absent</li>
 * </ul>
 */
public class AnalysisProcessor implements Processor {

    private final static Logger log = LoggerFactory.getLogger(AnalysisProcessor.class);

    private final Map<String, Object> params;

    private final InsightSynthesizer synthesizer;

    public AnalysisProcessor(Map<String, Object> params) {
        this(params, new InsightSynthesizer());
    }

    public AnalysisProcessor(Map<String, Object> params, InsightSynthesizer synthesizer) {
        this.params = params;
        this.synthesizer = synthesizer;
    }

    /**
     * runner for the analysis
     *
     * @return 0 on success, 1 for an invalid or unreadable config, -1 for other failures
     */
    @Override
    public int run() throws Exception {
        log.info("Step Start: analysis");
        long start = System.currentTimeMillis();
        try {
            AnalysisConfig config = getConfig();
            config.validate();

            Dataset dataset = new DatasetLoader(config).load(getStringParam(Constants.PARAM_INPUT));
            AnalysisResult result = analyze(dataset, config);

            String output = getStringParam(Constants.PARAM_OUTPUT);
            TextReportFormatter formatter = new TextReportFormatter(config);
            if(StringUtils.isBlank(output)) {
                System.out.println(formatter.format(result.getReport()));
            } else {
                new ReportWriter(formatter).write(result, new File(output));
            }
        } catch (EdaException e) {
            log.error("Error: {}", e.getMessage());
            if(e.getError() == EdaErrorCode.ERROR_CONFIG_INVALID || e.getError() == EdaErrorCode.ERROR_CONFIG_LOAD) {
                return 1;
            }
            return -1;
        } catch (Exception e) {
            log.error("Error:", e);
            return -1;
        }
        log.info("Step Finished: analysis with {} ms", (System.currentTimeMillis() - start));
        return 0;
    }

    /**
     * Run all stages over an already loaded dataset.
     *
     * @throws EdaException
     *             {@link EdaErrorCode#ERROR_CONFIG_INVALID} if config is invalid
     */
    public AnalysisResult analyze(Dataset dataset, AnalysisConfig config) {
        config.validate();

        List<String> skipped = new ArrayList<String>();
        for(String gap: DatasetLoader.findSchemaGaps(dataset)) {
            log.warn("Schema gap: {}.", gap);
            skipped.add(gap);
        }

        long start = System.currentTimeMillis();
        StructureReport structure = new StructuralInspector(config.getPreviewRows()).inspect(dataset);
        log.info("Structure inspected with {} ms.", (System.currentTimeMillis() - start));

        start = System.currentTimeMillis();
        QualityReport quality = new QualityAssessor(config.getIqrMultiplier(), config.getNumParallel())
                .assess(dataset);
        log.info("Quality assessed with {} ms.", (System.currentTimeMillis() - start));

        start = System.currentTimeMillis();
        UnivariateReport univariate = new UnivariateAnalyzer(config).analyze(dataset, skipped);
        log.info("Univariate analysis finished with {} ms.", (System.currentTimeMillis() - start));

        start = System.currentTimeMillis();
        BivariateReport bivariate = new BivariateAnalyzer(config).analyze(dataset, skipped);
        log.info("Bivariate analysis finished with {} ms.", (System.currentTimeMillis() - start));

        List<InsightRecord> insights = synthesizer.synthesize(new InsightContext(quality, univariate, bivariate,
                config));
        log.info("{} insight(s) fired.", insights.size());

        return new AnalysisResult(new ReportBundle(dataset, structure, quality, univariate, bivariate, insights,
                skipped));
    }

    private AnalysisConfig getConfig() {
        Object config = MapUtils.isEmpty(params) ? null : params.get(Constants.PARAM_CONFIG);
        if(config instanceof AnalysisConfig) {
            return (AnalysisConfig) config;
        }
        return CommonUtils.loadAnalysisConfig(config == null ? null : config.toString());
    }

    private String getStringParam(String propKey) {
        if(MapUtils.isNotEmpty(params) && params.get(propKey) instanceof String) {
            return (String) params.get(propKey);
        }
        return null;
    }
}
