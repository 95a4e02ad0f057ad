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
import java.util.List;

import ml.shifu.eda.container.obj.ColumnKind;

/**
 * {@link Column} is an immutable, ordered sequence of values with a declared {@link ColumnKind}.
 *
 * <p>
 * A <code>null</code> element is the missing marker. Numerical values are stored as {@link Double}, categorical as
 * {@link String}, dates as {@link java.time.LocalDate} and booleans as {@link Boolean}.
 */
public class Column {

    private final String name;

    private final ColumnKind kind;

    private final List<Object> values;

    public Column(String name, ColumnKind kind, List<?> values) {
        if(name == null || kind == null || values == null) {
            throw new IllegalArgumentException("Column name, kind and values should not be null.");
        }
        this.name = name;
        this.kind = kind;
        this.values = Collections.unmodifiableList(new ArrayList<Object>(values));
    }

    public String getName() {
        return name;
    }

    public ColumnKind getKind() {
        return kind;
    }

    public int size() {
        return values.size();
    }

    public Object get(int index) {
        return values.get(index);
    }

    public List<Object> getValues() {
        return values;
    }

    public boolean isMissing(int index) {
        Object value = values.get(index);
        return value == null || (value instanceof Double && ((Double) value).isNaN());
    }

    public int getMissingCount() {
        int missing = 0;
        for(int i = 0; i < values.size(); i++) {
            if(isMissing(i)) {
                missing++;
            }
        }
        return missing;
    }

    public int getNonNullCount() {
        return size() - getMissingCount();
    }

    /**
     * Numerical value at index, {@link Double#NaN} if missing.
     */
    public double getDouble(int index) {
        if(!kind.isNumerical()) {
            throw new IllegalStateException("Column " + name + " is " + kind + ", not numerical.");
        }
        return isMissing(index) ? Double.NaN : ((Double) values.get(index)).doubleValue();
    }

    /**
     * @return present numerical values in row order
     */
    public double[] getPresentDoubles() {
        double[] present = new double[getNonNullCount()];
        int j = 0;
        for(int i = 0; i < values.size(); i++) {
            if(!isMissing(i)) {
                present[j++] = getDouble(i);
            }
        }
        return present;
    }

    @Override
    public String toString() {
        return "Column [name=" + name + ", kind=" + kind + ", size=" + values.size() + "]";
    }
}
