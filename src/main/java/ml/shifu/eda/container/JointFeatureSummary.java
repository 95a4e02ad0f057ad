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
 * Row aligned scatter data: x, y, the emphasis value and the emphasis rescaled onto a marker size range. Missing
 * values are null.
 */
public class JointFeatureSummary {

    private final String xColumn;
    private final String yColumn;
    private final String emphasisColumn;
    private final double sizeMin;
    private final double sizeMax;
    private final List<Point> points;

    public JointFeatureSummary(String xColumn, String yColumn, String emphasisColumn, double sizeMin,
            double sizeMax, List<Point> points) {
        this.xColumn = xColumn;
        this.yColumn = yColumn;
        this.emphasisColumn = emphasisColumn;
        this.sizeMin = sizeMin;
        this.sizeMax = sizeMax;
        this.points = Collections.unmodifiableList(points);
    }

    public String getxColumn() {
        return xColumn;
    }

    public String getyColumn() {
        return yColumn;
    }

    public String getEmphasisColumn() {
        return emphasisColumn;
    }

    public double getSizeMin() {
        return sizeMin;
    }

    public double getSizeMax() {
        return sizeMax;
    }

    public List<Point> getPoints() {
        return points;
    }

    public static class Point {

        private final int row;
        private final Double x;
        private final Double y;
        private final Double emphasis;
        private final Double size;

        public Point(int row, Double x, Double y, Double emphasis, Double size) {
            this.row = row;
            this.x = x;
            this.y = y;
            this.emphasis = emphasis;
            this.size = size;
        }

        public int getRow() {
            return row;
        }

        public Double getX() {
            return x;
        }

        public Double getY() {
            return y;
        }

        public Double getEmphasis() {
            return emphasis;
        }

        public Double getSize() {
            return size;
        }
    }
}
