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
package ml.shifu.eda.exception;

/**
 * Eda error code
 */
public enum EdaErrorCode {
    /**
     * Configuration Error 400 ~ 500
     */
    ERROR_EDA_CONFIG(400, "Errors happen when loading eda.config"), ERROR_CONFIG_LOAD(401,
            "Could not load the analysis config file"), ERROR_CONFIG_INVALID(402,
            "The analysis config did not pass the validation"),

    /*
     * File/System error: 1001 - 1050
     */
    ERROR_INPUT_NOT_FOUND(1001, "The input data is not found"), ERROR_INPUT_UNPARSABLE(1002,
            "The input data could not be parsed as a delimited table with a header"), ERROR_WRITE_REPORT(1003,
            "Could not write the analysis report"),

    /*
     * data validate 1151 - 1200
     */
    ERROR_COLUMN_LENGTH_MISMATCH(1151, "The columns of a dataset must have the same length"), ERROR_DUPLICATE_COLUMN(
            1152, "The column names of a dataset must be unique"),

    /*
     * execution 1301 - 1350
     */
    ERROR_TASK_EXECUTION(1301, "Exception happened when executing column tasks");

    /**
     * code
     */
    private final int code;

    /**
     * description
     */
    private final String description;

    /**
     * Constructor, not public
     *
     * @param code
     *            the code
     * @param description
     *            the description
     */
    private EdaErrorCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    /**
     * description getter
     *
     * @return description
     */
    public String getDescription() {
        return description;
    }

    /**
     * code getter
     *
     * @return code
     */
    public int getCode() {
        return code;
    }

    @Override
    public String toString() {
        return "[" + code + "] " + description;
    }
}
