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
 * Distinct value counts of a categorical column, by count descending and first-seen order for ties.
 */
public class CategoricalFrequency {

    private final String columnName;

    private final List<Entry> entries;

    private final int missingCount;

    public CategoricalFrequency(String columnName, List<Entry> entries, int missingCount) {
        this.columnName = columnName;
        this.entries = Collections.unmodifiableList(entries);
        this.missingCount = missingCount;
    }

    public String getColumnName() {
        return columnName;
    }

    public List<Entry> getEntries() {
        return entries;
    }

    public int getMissingCount() {
        return missingCount;
    }

    public List<Entry> top(int n) {
        return entries.subList(0, Math.min(n, entries.size()));
    }

    /**
     * @return count of present values
     */
    public int getTotal() {
        int total = 0;
        for(Entry entry: entries) {
            total += entry.getCount();
        }
        return total;
    }

    public static class Entry {

        private final String value;

        private final int count;

        public Entry(String value, int count) {
            this.value = value;
            this.count = count;
        }

        public String getValue() {
            return value;
        }

        public int getCount() {
            return count;
        }

        @Override
        public String toString() {
            return value + ":" + count;
        }
    }
}
