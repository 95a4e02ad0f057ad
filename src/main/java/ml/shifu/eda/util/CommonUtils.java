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
package ml.shifu.eda.util;

import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.file.Files;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CommonUtils} is used to for almost all kinds of utility function in this framework.
 */
public final class CommonUtils {

    private static final Logger log = LoggerFactory.getLogger(CommonUtils.class);

    private static final ThreadLocal<DecimalFormat> DECIMAL_FORMAT = new ThreadLocal<DecimalFormat>() {
        @Override
        protected DecimalFormat initialValue() {
            return new DecimalFormat("0.######", DecimalFormatSymbols.getInstance(Locale.ROOT));
        }
    };

    private CommonUtils() {
    }

    /**
     * Load analysis config from a JSON file. A blank path means defaults.
     *
     * @param path
     *            the config file path
     * @return the loaded config, not yet validated
     * @throws EdaException
     *             {@link EdaErrorCode#ERROR_CONFIG_LOAD} if the file is absent or not valid JSON
     */
    public static AnalysisConfig loadAnalysisConfig(String path) {
        if(StringUtils.isBlank(path)) {
            log.info("No analysis config is given, defaults are used.");
            return new AnalysisConfig();
        }

        File file = new File(path);
        if(!file.isFile()) {
            throw new EdaException(EdaErrorCode.ERROR_CONFIG_LOAD, "Analysis config " + path + " is not found");
        }

        Reader reader = null;
        try {
            reader = new InputStreamReader(Files.newInputStream(file.toPath()), Constants.DEFAULT_CHARSET);
            return JSONUtils.readValue(reader, AnalysisConfig.class);
        } catch (IOException e) {
            throw new EdaException(EdaErrorCode.ERROR_CONFIG_LOAD, e, "Cannot parse analysis config " + path);
        } finally {
            IOUtils.closeQuietly(reader);
        }
    }

    /**
     * Render a cell value the way a data frame preview would, missing values as NaN.
     */
    public static String formatValue(Object value) {
        if(value == null) {
            return "NaN";
        }
        if(value instanceof Double) {
            return formatDouble((Double) value);
        }
        return value.toString();
    }

    /**
     * Up to six decimals without trailing zeros, NaN for undefined statistics.
     */
    public static String formatDouble(double value) {
        if(Double.isNaN(value)) {
            return "NaN";
        }
        if(Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return DECIMAL_FORMAT.get().format(value);
    }

    /**
     * Two decimals, used for percentages and coefficients.
     */
    public static String formatShort(double value) {
        if(Double.isNaN(value)) {
            return "NaN";
        }
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
