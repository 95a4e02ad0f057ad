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

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Equal-width bins of a numerical column, with an optional density curve over the same domain.
 */
public class Histogram {

    /**
     * Value transform applied before binning.
     */
    public static enum Transform {
        NONE, LOG1P
    }

    private final String columnName;

    private final Transform transform;

    private final List<Bin> bins;

    private final int missingCount;

    private final int skippedCount;

    private final DensityCurve density;

    public Histogram(String columnName, Transform transform, List<Bin> bins, int missingCount, int skippedCount,
            DensityCurve density) {
        this.columnName = columnName;
        this.transform = transform;
        this.bins = Collections.unmodifiableList(bins);
        this.missingCount = missingCount;
        this.skippedCount = skippedCount;
        this.density = density;
    }

    public String getColumnName() {
        return columnName;
    }

    public Transform getTransform() {
        return transform;
    }

    public List<Bin> getBins() {
        return bins;
    }

    public int getMissingCount() {
        return missingCount;
    }

    /**
     * @return present values which could not be transformed, always 0 without a transform
     */
    public int getSkippedCount() {
        return skippedCount;
    }

    public DensityCurve getDensity() {
        return density;
    }

    @JsonIgnore
    public int getTotalCount() {
        int total = 0;
        for(Bin bin: bins) {
            total += bin.getCount();
        }
        return total;
    }

    /**
     * @return the first bin with the highest count or null if there is no bin
     */
    @JsonIgnore
    public Bin getModalBin() {
        Bin modal = null;
        for(Bin bin: bins) {
            if(modal == null || bin.getCount() > modal.getCount()) {
                modal = bin;
            }
        }
        return modal;
    }

    /**
     * Bin covering [lower, upper), the last bin of a histogram also includes its upper bound.
     */
    public static class Bin {

        private final double lower;

        private final double upper;

        private final int count;

        public Bin(double lower, double upper, int count) {
            this.lower = lower;
            this.upper = upper;
            this.count = count;
        }

        public double getLower() {
            return lower;
        }

        public double getUpper() {
            return upper;
        }

        public int getCount() {
            return count;
        }
    }
}
