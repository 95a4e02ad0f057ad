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

import java.util.Arrays;
import java.util.Collections;

import ml.shifu.eda.container.Column;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.Dataset.Origin;
import ml.shifu.eda.container.StructureReport;
import ml.shifu.eda.container.obj.ColumnKind;
import ml.shifu.eda.fs.SampleDatasets;

import org.testng.Assert;
import org.testng.annotations.Test;

public class StructuralInspectorTest {

    @Test
    public void testInspectSample() {
        Dataset dataset = SampleDatasets.movies();
        StructureReport report = new StructuralInspector(5).inspect(dataset);
        Assert.assertEquals(report.getRowCount(), 5);
        Assert.assertEquals(report.getColumnCount(), 9);
        Assert.assertEquals(report.getColumns().size(), 9);
        Assert.assertEquals(report.getColumns().get(2).getName(), "budget");
        Assert.assertEquals(report.getColumns().get(2).getKind(), ColumnKind.NUMERIC);
        Assert.assertEquals(report.getColumns().get(2).getNonNullCount(), 5);
        Assert.assertEquals(report.getHeader().get(0), "title");
        Assert.assertEquals(report.getPreviewRows().size(), 5);
        Assert.assertEquals(report.getPreviewRows().get(0).get(0), "Avatar");
        Assert.assertEquals(report.getPreviewRows().get(0).get(2), "237000000");
        Assert.assertEquals(report.getPreviewRows().get(0).get(1), "2009-12-18");
    }

    @Test
    public void testPreviewShowsMissingAsNaN() {
        Dataset dataset = new Dataset("t", Origin.FILE, null, Arrays.asList(new Column("budget",
                ColumnKind.NUMERIC, Arrays.asList(1.5d, null, 3d))));
        StructureReport report = new StructuralInspector(2).inspect(dataset);
        Assert.assertEquals(report.getPreviewRows().size(), 2);
        Assert.assertEquals(report.getPreviewRows().get(0).get(0), "1.5");
        Assert.assertEquals(report.getPreviewRows().get(1).get(0), "NaN");
        Assert.assertEquals(report.getColumns().get(0).getNonNullCount(), 2);
    }

    @Test
    public void testEmptyDataset() {
        Dataset dataset = new Dataset("empty", Origin.FILE, null, Collections.<Column> emptyList());
        StructureReport report = new StructuralInspector(5).inspect(dataset);
        Assert.assertEquals(report.getRowCount(), 0);
        Assert.assertEquals(report.getColumnCount(), 0);
        Assert.assertTrue(report.getColumns().isEmpty());
        Assert.assertTrue(report.getPreviewRows().isEmpty());
    }
}
