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
package ml.shifu.eda;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.core.processor.AnalysisProcessor;
import ml.shifu.eda.exception.EdaException;
import ml.shifu.eda.util.CommonUtils;
import ml.shifu.eda.util.Constants;
import ml.shifu.eda.util.Environment;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.GnuParser;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.OptionBuilder;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.google.common.collect.Lists;

/**
 * Command line entry of the analysis.
 *
 * <pre>
 * eda [-i &lt;input&gt;] [-c &lt;AnalysisConfig.json&gt;] [-o &lt;outputDir&gt;] [-bins n] [-iqr m] ...
 * </pre>
 *
 * Exit status is 0 on success, 1 for invalid options or config, -1 for other failures.
 */
@SuppressWarnings("static-access")
public class EdaCLI {

    private static final String INPUT = "i";
    private static final String CONFIG = "c";
    private static final String OUTPUT = "o";
    private static final String BINS = "bins";
    private static final String IQR = "iqr";
    private static final String CORR = "corr";
    private static final String MISSING = "missing";
    private static final String TOPN = "topn";
    private static final String PARALLEL = "p";
    private static final String LOG_COLUMNS = "logcols";
    private static final String NO_DENSITY = "nodensity";

    static private final Logger log = LoggerFactory.getLogger(EdaCLI.class);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Parse arguments and run the analysis.
     *
     * @return process exit status
     */
    public static int run(String[] args) {
        if(args.length > 0 && isHelpOption(args[0])) {
            printUsage();
            return 0;
        }
        if(args.length > 0 && isVersionOption(args[0])) {
            System.out.println("eda version " + Constants.version);
            return 0;
        }

        CommandLineParser parser = new GnuParser();
        CommandLine cmd = null;
        try {
            cmd = parser.parse(buildOptions(), args);
        } catch (ParseException e) {
            log.error("Invalid command options. Please check help message.");
            printUsage();
            return 1;
        }

        AnalysisConfig config;
        try {
            config = buildConfig(cmd);
        } catch (EdaException e) {
            log.error("Cannot load analysis config: {}", e.getMessage());
            return 1;
        } catch (NumberFormatException e) {
            log.error("Invalid numeric option value: {}", e.getMessage());
            printUsage();
            return 1;
        }

        Map<String, Object> params = new HashMap<String, Object>();
        params.put(Constants.PARAM_INPUT, cmd.getOptionValue(INPUT, Constants.DEFAULT_INPUT_FILE));
        params.put(Constants.PARAM_CONFIG, config);
        params.put(Constants.PARAM_OUTPUT, cmd.getOptionValue(OUTPUT));

        int status;
        try {
            status = new AnalysisProcessor(params).run();
        } catch (Exception e) {
            log.error("Error in running, please check the stack, msg:" + e.toString(), e);
            return -1;
        }
        if(status == 0) {
            log.info("Exploratory analysis is finished successfully.");
        } else {
            log.warn("Exploratory analysis is finished with status {}, please check error message.", status);
        }
        return status;
    }

    /**
     * Config file (or defaults), then eda.config environment, then command line options.
     */
    static AnalysisConfig buildConfig(CommandLine cmd) {
        AnalysisConfig config = CommonUtils.loadAnalysisConfig(cmd.getOptionValue(CONFIG));
        config.setNumParallel(Environment.getInt(Environment.LOCAL_NUM_PARALLEL, config.getNumParallel()));

        if(cmd.hasOption(BINS)) {
            config.setBinNum(Integer.valueOf(cmd.getOptionValue(BINS).trim()));
        }
        if(cmd.hasOption(IQR)) {
            config.setIqrMultiplier(Double.valueOf(cmd.getOptionValue(IQR).trim()));
        }
        if(cmd.hasOption(CORR)) {
            config.setCorrelationThreshold(Double.valueOf(cmd.getOptionValue(CORR).trim()));
        }
        if(cmd.hasOption(MISSING)) {
            config.setMissingPctThreshold(Double.valueOf(cmd.getOptionValue(MISSING).trim()));
        }
        if(cmd.hasOption(TOPN)) {
            config.setTopN(Integer.valueOf(cmd.getOptionValue(TOPN).trim()));
        }
        if(cmd.hasOption(PARALLEL)) {
            config.setNumParallel(Integer.valueOf(cmd.getOptionValue(PARALLEL).trim()));
        }
        if(cmd.hasOption(LOG_COLUMNS)) {
            List<String> columns = Lists.newArrayList(Splitter.on(',').trimResults().omitEmptyStrings()
                    .split(cmd.getOptionValue(LOG_COLUMNS)));
            config.setLogTransformColumns(columns);
        }
        if(cmd.hasOption(NO_DENSITY)) {
            config.setDensityEnabled(Boolean.FALSE);
        }
        return config;
    }

    static Options buildOptions() {
        Options opts = new Options();

        Option opt_input = OptionBuilder.hasArg().withDescription("Input delimited file with a header row")
                .create(INPUT);
        Option opt_config = OptionBuilder.hasArg().withDescription("Analysis config json file").create(CONFIG);
        Option opt_output = OptionBuilder.hasArg()
                .withDescription("Output directory of report.txt and charts.json, stdout if absent").create(OUTPUT);
        Option opt_bins = OptionBuilder.hasArg().withDescription("Number of equal-width histogram bins")
                .create(BINS);
        Option opt_iqr = OptionBuilder.hasArg().withDescription("IQR multiplier of outlier fences").create(IQR);
        Option opt_corr = OptionBuilder.hasArg().withDescription("Correlation threshold of the financial insight")
                .create(CORR);
        Option opt_missing = OptionBuilder.hasArg()
                .withDescription("Missing percentage threshold of the completeness insight").create(MISSING);
        Option opt_topn = OptionBuilder.hasArg().withDescription("Number of dominant categories to report")
                .create(TOPN);
        Option opt_parallel = OptionBuilder.hasArg().withDescription("Number of column worker threads")
                .create(PARALLEL);
        Option opt_logcols = OptionBuilder.hasArg()
                .withDescription("Comma separated columns to draw log1p histograms for").create(LOG_COLUMNS);
        Option opt_nodensity = OptionBuilder.hasArg(false).withDescription("Do not estimate density curves")
                .create(NO_DENSITY);

        opts.addOption(opt_input);
        opts.addOption(opt_config);
        opts.addOption(opt_output);
        opts.addOption(opt_bins);
        opts.addOption(opt_iqr);
        opts.addOption(opt_corr);
        opts.addOption(opt_missing);
        opts.addOption(opt_topn);
        opts.addOption(opt_parallel);
        opts.addOption(opt_logcols);
        opts.addOption(opt_nodensity);
        return opts;
    }

    private static void printUsage() {
        System.out.println("Usage: eda [options]");
        System.out.println("where options are:");
        System.out.println("\t-i <file>           Input file, " + Constants.DEFAULT_INPUT_FILE
                + " by default; a synthetic sample is used if it cannot be loaded.");
        System.out.println("\t-c <file>           Analysis config json file, defaults are used if absent.");
        System.out.println("\t-o <dir>            Write report.txt and charts.json into dir instead of stdout.");
        System.out.println("\t-bins <n>           Number of histogram bins, 10 by default.");
        System.out.println("\t-iqr <m>            IQR multiplier of outlier fences, 1.5 by default.");
        System.out.println("\t-corr <t>           Correlation threshold in [0, 1], 0.7 by default.");
        System.out.println("\t-missing <pct>      Missing percentage threshold in [0, 100], 5.0 by default.");
        System.out.println("\t-topn <n>           Number of dominant categories in insights, 2 by default.");
        System.out.println("\t-p <n>              Number of column worker threads, 1 by default.");
        System.out.println("\t-logcols <a,b>      Columns with log1p histograms, budget by default.");
        System.out.println("\t-nodensity          Skip density curve estimation.");
        System.out.println("\t-v, -version        Print version.");
        System.out.println("\t-h, -help           Print this message.");
    }

    private static boolean isVersionOption(String arg) {
        return arg.equalsIgnoreCase("v") || arg.equalsIgnoreCase("version") || arg.equalsIgnoreCase("-version")
                || arg.equalsIgnoreCase("-v");
    }

    private static boolean isHelpOption(String str) {
        return "h".equalsIgnoreCase(str) || "-h".equalsIgnoreCase(str) || "help".equalsIgnoreCase(str)
                || "-help".equalsIgnoreCase(str);
    }
}
