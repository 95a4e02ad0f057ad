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

import java.util.List;

import ml.shifu.eda.container.Column;

/**
 * Base of the column binners. A binner is fed one column through {@link #addColumn(Column)}, then asked for its
 * bins. Missing values are counted, never binned; values a binner cannot use are counted as invalid.
 *
 * @param <T>
 *            border type for numerical bins, category type for categorical ones
 */
public abstract class AbstractBinning<T> {

    protected int missingValCnt = 0;
    protected int invalidValCnt = 0;

    /**
     * Requested number of bins, ignored by categorical binning.
     */
    protected final int expectedBinningNum;

    public AbstractBinning(int binningNum) {
        this.expectedBinningNum = binningNum;
    }

    public int getMissingValCnt() {
        return missingValCnt;
    }

    public int getInvalidValCnt() {
        return invalidValCnt;
    }

    /**
     * @param val
     *            a present value of the column, or null for a missing one
     */
    public abstract void addData(Object val);

    /**
     * Bin borders in ascending order, or distinct categories.
     */
    public abstract List<T> getDataBin();

    public void addColumn(Column column) {
        for(int i = 0; i < column.size(); i++) {
            addData(column.isMissing(i) ? null : column.get(i));
        }
    }

    protected void incMissingValCnt() {
        missingValCnt++;
    }

    protected void incInvalidValCnt() {
        invalidValCnt++;
    }
}
