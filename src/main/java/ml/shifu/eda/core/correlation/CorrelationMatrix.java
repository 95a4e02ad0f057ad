/*
 * Copyright [2013-2016] PayPal Software Foundation
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
package ml.shifu.eda.core.correlation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ml.shifu.eda.container.Column;

/**
 * Square and symmetric matrix of pearson coefficients over numerical columns. Undefined entries are NaN.
 */
public class CorrelationMatrix {

    private final List<String> columns;

    private final double[][] values;

    private CorrelationMatrix(List<String> columns, double[][] values) {
        this.columns = Collections.unmodifiableList(columns);
        this.values = values;
    }

    /**
     * Compute upper triangle pairwise and mirror it. The diagonal is 1 for a column with at least two present values
     * and nonzero variance, NaN otherwise.
     */
    public static CorrelationMatrix compute(List<Column> numericColumns) {
        int size = numericColumns.size();
        List<String> names = new ArrayList<String>(size);
        double[][] values = new double[size][size];
        for(int i = 0; i < size; i++) {
            names.add(numericColumns.get(i).getName());
            double selfCorr = CorrelationAccumulator.of(numericColumns.get(i), numericColumns.get(i))
                    .getCorrelation();
            values[i][i] = Double.isNaN(selfCorr) ? Double.NaN : 1d;
            for(int j = i + 1; j < size; j++) {
                double corr = CorrelationAccumulator.of(numericColumns.get(i), numericColumns.get(j))
                        .getCorrelation();
                values[i][j] = corr;
                values[j][i] = corr;
            }
        }
        return new CorrelationMatrix(names, values);
    }

    public List<String> getColumns() {
        return columns;
    }

    public List<List<Double>> getValues() {
        List<List<Double>> rows = new ArrayList<List<Double>>(values.length);
        for(double[] row: values) {
            List<Double> list = new ArrayList<Double>(row.length);
            for(double value: row) {
                list.add(value);
            }
            rows.add(list);
        }
        return rows;
    }

    public int size() {
        return columns.size();
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    /**
     * @return coefficient or NaN if either column is not in the matrix
     */
    public double get(String columnX, String columnY) {
        int i = columns.indexOf(columnX);
        int j = columns.indexOf(columnY);
        if(i < 0 || j < 0) {
            return Double.NaN;
        }
        return values[i][j];
    }
}
