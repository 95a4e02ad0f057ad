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

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Constants used across the analysis pipeline.
 */
public interface Constants {

    public static final String version = "0.1.0";

    public static final Charset DEFAULT_CHARSET = StandardCharsets.UTF_8;

    public static final String DEFAULT_DELIMITER = ",";

    public static final String REPORT_FILE_NAME = "report.txt";

    public static final String CHARTS_JSON_FILE_NAME = "charts.json";

    public static final String DEFAULT_INPUT_FILE = "tmdb_movies.csv";

    // expected movie columns
    public static final String TITLE = "title";
    public static final String RELEASE_DATE = "release_date";
    public static final String BUDGET = "budget";
    public static final String REVENUE = "revenue";
    public static final String RUNTIME = "runtime";
    public static final String VOTE_AVERAGE = "vote_average";
    public static final String GENRE = "genre";
    public static final String DIRECTOR = "director";
    public static final String IS_ENGLISH = "is_english";

    public static final String SYNTHETIC_DATASET_NAME = "synthetic_movies";

    // params of the analysis processor
    public static final String PARAM_INPUT = "input";
    public static final String PARAM_CONFIG = "config";
    public static final String PARAM_OUTPUT = "output";
}
