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
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Properties;

import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link Environment} is used to store process level settings like 'EDA_HOME' and return them to user by calling
 * {@link #getProperty(String)} method.
 */
public class Environment {

    public static final String EDA_HOME = "EDA_HOME";

    /**
     * Default thread count of the column worker pool.
     */
    public static final String LOCAL_NUM_PARALLEL = "localNumParallel";

    private static final String CONFIG_FILE_NAME = "eda.config";

    private static Logger logger = LoggerFactory.getLogger(Environment.class);
    private static Properties properties = new Properties();

    static {
        String edaHomePath = ((System.getenv(EDA_HOME) == null) ? System.getProperty(EDA_HOME) : System
                .getenv(EDA_HOME));
        properties.put(EDA_HOME, ((edaHomePath == null) ? "" : edaHomePath));

        try {
            loadEdaConfig();
        } catch (IOException e) {
            throw new EdaException(EdaErrorCode.ERROR_EDA_CONFIG, e);
        }

        if(properties.size() == 1) {
            logger.debug("No eda.config is found or there is no content in it");
        }
    }

    /*
     * Load properties from
     * 1. ${EDA_HOME}/conf/eda.config
     * 2. /etc/eda.config
     * 3. ~/.eda.config
     *
     * Later files override earlier ones, call it again to reload.
     */
    public static void loadEdaConfig() throws IOException {
        loadProperties(properties, getProperty(EDA_HOME) + File.separator + "conf" + File.separator
                + CONFIG_FILE_NAME);

        loadProperties(properties, File.separator + "etc" + File.separator + CONFIG_FILE_NAME);

        String userHome = System.getProperty("user.home");
        loadProperties(properties, userHome + File.separator + "." + CONFIG_FILE_NAME);
    }

    public static String getProperty(String propertyName) {
        return properties.getProperty(propertyName);
    }

    public static void setProperty(String propertyName, String propertyValue) {
        properties.put(propertyName, propertyValue);
    }

    public static String getProperty(String propertyName, String defValue) {
        String propertyValue = getProperty(propertyName);
        return (propertyValue == null) ? defValue : propertyValue;
    }

    public static Integer getInt(String propertyName, Integer defValue) {
        String propertyValue = getProperty(propertyName);
        return StringUtils.isBlank(propertyValue) ? defValue : Integer.valueOf(propertyValue.trim());
    }

    private static void loadProperties(Properties props, String fileName) throws IOException {
        File configFile = new File(fileName);
        if(!configFile.isFile()) {
            return;
        }

        InputStream is = null;
        try {
            is = Files.newInputStream(configFile.toPath());
            props.load(is);
            logger.debug("Loaded eda config from {}", fileName);
        } finally {
            IOUtils.closeQuietly(is);
        }
    }
}
