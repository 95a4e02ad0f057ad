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
import java.util.List;

import ml.shifu.eda.container.DensityCurve;
import ml.shifu.eda.container.Histogram;
import ml.shifu.eda.container.Histogram.Bin;
import ml.shifu.eda.container.Histogram.Transform;

/**
 * EqualIntervalBinning class, partitions [min, max] into equal-width bins.
 *
 * <p>
 * Bins are [lower, upper) except the last one which is closed, so the max value is counted. When min equals max a
 * single degenerate bin holds every value.
 */
public class EqualIntervalBinning extends AbstractBinning<Double> {

    private final Transform transform;

    private final List<Double> values = new ArrayList<Double>();

    private double maxVal = -Double.MAX_VALUE;
    private double minVal = Double.MAX_VALUE;

    /**
     * Constructor with expected bin number
     *
     * @param binningNum
     *            the binningNum
     */
    public EqualIntervalBinning(int binningNum) {
        this(binningNum, Transform.NONE);
    }

    public EqualIntervalBinning(int binningNum, Transform transform) {
        super(binningNum);
        if(binningNum < 1) {
            throw new IllegalArgumentException("Bin number should be positive, but is " + binningNum);
        }
        this.transform = transform;
    }

    /*
     * Missing values only increase the missing count. With LOG1P transform, values not greater than -1 have no
     * logarithm and increase the invalid count.
     *
     * @see ml.shifu.eda.core.binning.AbstractBinning#addData(java.lang.Object)
     */
    @Override
    public void addData(Object val) {
        if(val == null) {
            super.incMissingValCnt();
            return;
        }

        double dval = ((Number) val).doubleValue();
        if(Double.isNaN(dval)) {
            super.incMissingValCnt();
            return;
        }

        if(transform == Transform.LOG1P) {
            if(dval <= -1d) {
                super.incInvalidValCnt();
                return;
            }
            dval = Math.log1p(dval);
        }

        process(dval);
    }

    /*
     * Bin borders, expectedBinningNum + 1 values from min to max, or [min, max] for a degenerate column.
     *
     * @see ml.shifu.eda.core.binning.AbstractBinning#getDataBin()
     */
    @Override
    public List<Double> getDataBin() {
        List<Double> binBorders = new ArrayList<Double>();
        if(maxVal < minVal) {
            // no data, just return empty
            return binBorders;
        }

        if(maxVal == minVal) {
            binBorders.add(minVal);
            binBorders.add(maxVal);
            return binBorders;
        }

        double range = maxVal - minVal;
        for(int i = 0; i < super.expectedBinningNum; i++) {
            binBorders.add(minVal + range * i / super.expectedBinningNum);
        }
        binBorders.add(maxVal);
        return binBorders;
    }

    /**
     * Index of the bin holding the value, searched against the same borders the bins publish so a value on a border
     * always lands in the bin starting there.
     *
     * @param borders
     *            ascending bin borders from {@link #getDataBin()}
     * @param dval
     *            value in [min, max]
     * @return bin index, the max value belongs to the last bin
     */
    public static int getBinIndex(List<Double> borders, double dval) {
        int binNum = borders.size() - 1;
        int low = 0;
        int high = borders.size() - 1;

        while(low <= high) {
            int mid = (low + high) >>> 1;
            double midVal = borders.get(mid);
            if(midVal < dval) {
                low = mid + 1;
            } else if(midVal > dval) {
                high = mid - 1;
            } else {
                return Math.min(mid, binNum - 1);
            }
        }

        int index = low == 0 ? 0 : low - 1;
        return Math.min(index, binNum - 1);
    }

    public Histogram getHistogram(String columnName, DensityCurve density) {
        List<Double> borders = getDataBin();
        List<Bin> bins = new ArrayList<Bin>();
        if(!borders.isEmpty()) {
            int binNum = borders.size() - 1;
            int[] counts = new int[binNum];
            for(Double value: values) {
                counts[getBinIndex(borders, value)]++;
            }
            for(int i = 0; i < binNum; i++) {
                bins.add(new Bin(borders.get(i), borders.get(i + 1), counts[i]));
            }
        }
        return new Histogram(columnName, transform, bins, super.missingValCnt, super.invalidValCnt, density);
    }

    /**
     * @return binned values, after transform
     */
    public double[] getValues() {
        double[] array = new double[values.size()];
        for(int i = 0; i < array.length; i++) {
            array[i] = values.get(i);
        }
        return array;
    }

    /**
     * Process the new incoming data
     *
     * @param dval
     *            double value to be processed
     */
    private void process(double dval) {
        values.add(dval);

        if(dval < this.minVal) {
            this.minVal = dval;
        }

        if(dval > this.maxVal) {
            this.maxVal = dval;
        }
    }
}
