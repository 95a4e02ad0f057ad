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
package ml.shifu.eda.container;

import java.util.Collections;
import java.util.List;

/**
 * Tukey fences of a numerical column and the row indices outside them.
 */
public class OutlierSummary {

    private final String columnName;
    private final double iqr;
    private final double lowerFence;
    private final double upperFence;
    private final List<Integer> outlierRows;

    public OutlierSummary(String columnName, double iqr, double lowerFence, double upperFence,
            List<Integer> outlierRows) {
        this.columnName = columnName;
        this.iqr = iqr;
        this.lowerFence = lowerFence;
        this.upperFence = upperFence;
        this.outlierRows = Collections.unmodifiableList(outlierRows);
    }

    public String getColumnName() {
        return columnName;
    }

    public double getIqr() {
        return iqr;
    }

    public double getLowerFence() {
        return lowerFence;
    }

    public double getUpperFence() {
        return upperFence;
    }

    /**
     * @return row indices in ascending order
     */
    public List<Integer> getOutlierRows() {
        return outlierRows;
    }
}
