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
package ml.shifu.eda.core;

import java.util.ArrayList;
import java.util.List;

import ml.shifu.eda.container.Column;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.StructureReport;
import ml.shifu.eda.container.StructureReport.ColumnInfo;
import ml.shifu.eda.util.CommonUtils;

/**
 * Reports shape and column info of a dataset, it never modifies the dataset.
 */
public class StructuralInspector {

    private final int previewRows;

    public StructuralInspector(int previewRows) {
        this.previewRows = previewRows;
    }

    public StructureReport inspect(Dataset dataset) {
        List<Column> columns = dataset.getColumns();
        List<ColumnInfo> infos = new ArrayList<ColumnInfo>(columns.size());
        List<String> header = new ArrayList<String>(columns.size());
        for(Column column: columns) {
            infos.add(new ColumnInfo(column));
            header.add(column.getName());
        }

        int rows = columns.isEmpty() ? 0 : Math.min(previewRows, dataset.getRowCount());
        List<List<String>> preview = new ArrayList<List<String>>(rows);
        for(int i = 0; i < rows; i++) {
            List<String> row = new ArrayList<String>(columns.size());
            for(Column column: columns) {
                row.add(CommonUtils.formatValue(column.get(i)));
            }
            preview.add(row);
        }

        return new StructureReport(dataset.getRowCount(), dataset.getColumnCount(), infos, header, preview);
    }
}
