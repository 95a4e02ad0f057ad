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

import ml.shifu.eda.container.obj.ColumnKind;

/**
 * Shape, per column kind and non-null counts, and a preview of the leading rows.
 */
public class StructureReport {

    private final int rowCount;

    private final int columnCount;

    private final List<ColumnInfo> columns;

    private final List<String> header;

    private final List<List<String>> previewRows;

    public StructureReport(int rowCount, int columnCount, List<ColumnInfo> columns, List<String> header,
            List<List<String>> previewRows) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.columns = Collections.unmodifiableList(columns);
        this.header = Collections.unmodifiableList(header);
        this.previewRows = Collections.unmodifiableList(previewRows);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public List<ColumnInfo> getColumns() {
        return columns;
    }

    public List<String> getHeader() {
        return header;
    }

    public List<List<String>> getPreviewRows() {
        return previewRows;
    }

    /**
     * Column name and kind, the non-null count is read from the column on each call.
     */
    public static class ColumnInfo {

        private final Column column;

        public ColumnInfo(Column column) {
            this.column = column;
        }

        public String getName() {
            return column.getName();
        }

        public ColumnKind getKind() {
            return column.getKind();
        }

        public int getNonNullCount() {
            return column.getNonNullCount();
        }
    }
}
