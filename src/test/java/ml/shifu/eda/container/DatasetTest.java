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
import java.util.Arrays;
import java.util.Collections;

import ml.shifu.eda.container.Dataset.Origin;
import ml.shifu.eda.container.obj.ColumnKind;
import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;

import org.testng.Assert;
import org.testng.annotations.Test;

public class DatasetTest {

    @Test
    public void testColumnMissingMarkers() {
        Column column = new Column("budget", ColumnKind.NUMERIC, Arrays.asList(1d, null, Double.NaN, 4d));
        Assert.assertEquals(column.size(), 4);
        Assert.assertEquals(column.getMissingCount(), 2);
        Assert.assertEquals(column.getNonNullCount(), 2);
        Assert.assertTrue(column.isMissing(1));
        Assert.assertTrue(column.isMissing(2));
        Assert.assertTrue(Double.isNaN(column.getDouble(1)));
        Assert.assertTrue(Arrays.equals(column.getPresentDoubles(), new double[] { 1d, 4d }));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testGetDoubleOnCategorical() {
        new Column("genre", ColumnKind.CATEGORICAL, Arrays.asList("Action")).getDouble(0);
    }

    @Test(expectedExceptions = UnsupportedOperationException.class)
    public void testColumnIsImmutable() {
        Column column = new Column("genre", ColumnKind.CATEGORICAL, new ArrayList<String>(Arrays.asList("a")));
        column.getValues().add("b");
    }

    @Test
    public void testDatasetAccessors() {
        Column budget = new Column("budget", ColumnKind.NUMERIC, Arrays.asList(1d, 2d));
        Column genre = new Column("genre", ColumnKind.CATEGORICAL, Arrays.asList("a", null));
        Dataset dataset = new Dataset("test", Origin.FILE, "test.csv", Arrays.asList(budget, genre));

        Assert.assertEquals(dataset.getRowCount(), 2);
        Assert.assertEquals(dataset.getColumnCount(), 2);
        Assert.assertTrue(dataset.hasColumn("genre"));
        Assert.assertTrue(dataset.hasNumericColumn("budget"));
        Assert.assertFalse(dataset.hasNumericColumn("genre"));
        Assert.assertFalse(dataset.hasNumericColumn("revenue"));
        Assert.assertNull(dataset.getColumn("revenue"));
        Assert.assertEquals(dataset.getNumericColumns().size(), 1);
        Assert.assertEquals(dataset.getCategoricalColumns().get(0).getName(), "genre");
        Assert.assertEquals(dataset.getColumns().get(0).getName(), "budget");
    }

    @Test
    public void testEmptyDataset() {
        Dataset dataset = new Dataset("empty", Origin.FILE, null, Collections.<Column> emptyList());
        Assert.assertEquals(dataset.getRowCount(), 0);
        Assert.assertEquals(dataset.getColumnCount(), 0);
    }

    @Test
    public void testLengthMismatch() {
        try {
            new Dataset("bad", Origin.FILE, null, Arrays.asList(
                    new Column("a", ColumnKind.NUMERIC, Arrays.asList(1d, 2d)),
                    new Column("b", ColumnKind.NUMERIC, Arrays.asList(1d))));
            Assert.fail("Length mismatch should be rejected");
        } catch (EdaException e) {
            Assert.assertEquals(e.getError(), EdaErrorCode.ERROR_COLUMN_LENGTH_MISMATCH);
        }
    }

    @Test
    public void testDuplicateColumn() {
        try {
            new Dataset("bad", Origin.FILE, null, Arrays.asList(
                    new Column("a", ColumnKind.NUMERIC, Arrays.asList(1d)),
                    new Column("a", ColumnKind.CATEGORICAL, Arrays.asList("x"))));
            Assert.fail("Duplicate column should be rejected");
        } catch (EdaException e) {
            Assert.assertEquals(e.getError(), EdaErrorCode.ERROR_DUPLICATE_COLUMN);
        }
    }
}
