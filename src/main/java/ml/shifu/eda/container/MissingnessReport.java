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
import java.util.Comparator;
import java.util.List;

/**
 * Missing count and percentage per column, ordered by count descending. Columns with equal counts keep dataset
 * order.
 */
public class MissingnessReport {

    private final List<Entry> entries;

    public MissingnessReport(List<Entry> unordered) {
        List<Entry> sorted = new ArrayList<Entry>(unordered);
        // stable, equal counts keep column order
        Collections.sort(sorted, new Comparator<Entry>() {
            @Override
            public int compare(Entry o1, Entry o2) {
                return Integer.compare(o2.getMissingCount(), o1.getMissingCount());
            }
        });
        this.entries = Collections.unmodifiableList(sorted);
    }

    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * @return entry of column or null if not found
     */
    public Entry getEntry(String columnName) {
        for(Entry entry: entries) {
            if(entry.getColumnName().equals(columnName)) {
                return entry;
            }
        }
        return null;
    }

    public static class Entry {

        private final String columnName;

        private final int missingCount;

        private final double missingPercentage;

        public Entry(String columnName, int missingCount, int rowCount) {
            this.columnName = columnName;
            this.missingCount = missingCount;
            this.missingPercentage = rowCount == 0 ? 0d : missingCount * 100d / rowCount;
        }

        public String getColumnName() {
            return columnName;
        }

        public int getMissingCount() {
            return missingCount;
        }

        public double getMissingPercentage() {
            return missingPercentage;
        }
    }
}
