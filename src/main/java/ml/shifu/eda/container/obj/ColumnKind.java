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
package ml.shifu.eda.container.obj;

/**
 * Semantic kind of a column. The short name is what the structure report prints, it follows the dtype names a
 * data frame user expects.
 */
public enum ColumnKind {
    NUMERIC("float64"), CATEGORICAL("object"), DATE("date"), BOOLEAN("bool");

    private final String shortName;

    private ColumnKind(String shortName) {
        this.shortName = shortName;
    }

    public boolean isNumerical() {
        return this == NUMERIC;
    }

    public boolean isCategorical() {
        return this == CATEGORICAL;
    }

    public String getShortName() {
        return shortName;
    }

    public static ColumnKind of(String kind) {
        for(ColumnKind ck: values()) {
            if(ck.toString().equalsIgnoreCase(kind) || ck.shortName.equalsIgnoreCase(kind)) {
                return ck;
            }
        }
        throw new IllegalArgumentException("Cannot find ColumnKind " + kind);
    }
}
