/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ml.shifu.eda.core.binning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import ml.shifu.eda.container.CategoricalFrequency;

/**
 * CategoricalBinning class, counts each distinct value exactly.
 */
public class CategoricalBinning extends AbstractBinning<String> {

    /**
     * Insertion order is first-seen order, used to break count ties.
     */
    private final Map<String, Integer> categoricalCounts = new LinkedHashMap<String, Integer>();

    public CategoricalBinning() {
        super(0);
    }

    /*
     * (non-Javadoc)
     * Count the value, null is missing
     *
     * @see ml.shifu.eda.core.binning.AbstractBinning#addData(java.lang.Object)
     */
    @Override
    public void addData(Object val) {
        if(val == null) {
            super.incMissingValCnt();
            return;
        }

        String fval = val.toString();
        Integer count = categoricalCounts.get(fval);
        categoricalCounts.put(fval, count == null ? 1 : count + 1);
    }

    /*
     * Distinct values by count descending.
     *
     * @see ml.shifu.eda.core.binning.AbstractBinning#getDataBin()
     */
    @Override
    public List<String> getDataBin() {
        List<String> binningVals = new ArrayList<String>();
        for(CategoricalFrequency.Entry entry: sortedEntries()) {
            binningVals.add(entry.getValue());
        }
        return binningVals;
    }

    public CategoricalFrequency getFrequency(String columnName) {
        return new CategoricalFrequency(columnName, sortedEntries(), super.missingValCnt);
    }

    private List<CategoricalFrequency.Entry> sortedEntries() {
        List<CategoricalFrequency.Entry> entries = new ArrayList<CategoricalFrequency.Entry>();
        for(Map.Entry<String, Integer> entry: categoricalCounts.entrySet()) {
            entries.add(new CategoricalFrequency.Entry(entry.getKey(), entry.getValue()));
        }
        // stable sort keeps first-seen order for ties
        Collections.sort(entries, new Comparator<CategoricalFrequency.Entry>() {
            @Override
            public int compare(CategoricalFrequency.Entry o1, CategoricalFrequency.Entry o2) {
                return Integer.compare(o2.getCount(), o1.getCount());
            }
        });
        return entries;
    }
}
