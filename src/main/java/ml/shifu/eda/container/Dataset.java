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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.eda.container.obj.ColumnKind;
import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;

/**
 * {@link Dataset} is a named, ordered and immutable collection of {@link Column}s of the same length.
 *
 * <p>
 * Row <code>i</code> of every column describes the same record. It is created once by the loader and only read by
 * the analysis stages.
 */
public class Dataset {

    /**
     * Where the data came from: a parsed file or the built-in synthetic sample.
     */
    public static enum Origin {
        FILE, SYNTHETIC
    }

    private final String name;

    private final Origin origin;

    private final String sourcePath;

    private final Map<String, Column> columns;

    private final int rowCount;

    public Dataset(String name, Origin origin, String sourcePath, List<Column> columnList) {
        this.name = name;
        this.origin = origin;
        this.sourcePath = sourcePath;

        Map<String, Column> columnMap = new LinkedHashMap<String, Column>();
        int n = -1;
        for(Column column: columnList) {
            if(columnMap.containsKey(column.getName())) {
                throw new EdaException(EdaErrorCode.ERROR_DUPLICATE_COLUMN, "Duplicate column " + column.getName());
            }
            if(n >= 0 && column.size() != n) {
                throw new EdaException(EdaErrorCode.ERROR_COLUMN_LENGTH_MISMATCH, "Column " + column.getName()
                        + " has " + column.size() + " values, expected " + n);
            }
            n = column.size();
            columnMap.put(column.getName(), column);
        }
        this.columns = Collections.unmodifiableMap(columnMap);
        this.rowCount = Math.max(n, 0);
    }

    public String getName() {
        return name;
    }

    public Origin getOrigin() {
        return origin;
    }

    public String getSourcePath() {
        return sourcePath;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public boolean hasColumn(String columnName) {
        return columns.containsKey(columnName);
    }

    /**
     * @return the column or null if absent
     */
    public Column getColumn(String columnName) {
        return columns.get(columnName);
    }

    /**
     * @return true if column exists and it is numerical
     */
    public boolean hasNumericColumn(String columnName) {
        Column column = columns.get(columnName);
        return column != null && column.getKind().isNumerical();
    }

    public List<Column> getColumns() {
        return new ArrayList<Column>(columns.values());
    }

    public List<Column> getColumns(ColumnKind kind) {
        List<Column> result = new ArrayList<Column>();
        for(Column column: columns.values()) {
            if(column.getKind() == kind) {
                result.add(column);
            }
        }
        return result;
    }

    public List<Column> getNumericColumns() {
        return getColumns(ColumnKind.NUMERIC);
    }

    public List<Column> getCategoricalColumns() {
        return getColumns(ColumnKind.CATEGORICAL);
    }

    @Override
    public String toString() {
        return "Dataset [name=" + name + ", origin=" + origin + ", shape=(" + rowCount + ", " + columns.size() + ")]";
    }
}
