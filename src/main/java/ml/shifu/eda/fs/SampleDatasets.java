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
package ml.shifu.eda.fs;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import ml.shifu.eda.container.Column;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.Dataset.Origin;
import ml.shifu.eda.container.obj.ColumnKind;
import ml.shifu.eda.util.Constants;

/**
 * Canonical built-in datasets. {@link #movies()} is what the loader substitutes when the source is unavailable.
 */
public final class SampleDatasets {

    private SampleDatasets() {
    }

    /**
     * The five record movie sample: Avatar, Titanic, Avengers, Joker and Inception.
     */
    public static Dataset movies() {
        List<Column> columns = new ArrayList<Column>();
        columns.add(new Column(Constants.TITLE, ColumnKind.CATEGORICAL, Arrays.asList("Avatar", "Titanic",
                "Avengers", "Joker", "Inception")));
        columns.add(new Column(Constants.RELEASE_DATE, ColumnKind.DATE, Arrays.asList(LocalDate.of(2009, 12, 18),
                LocalDate.of(1997, 12, 19), LocalDate.of(2012, 5, 4), LocalDate.of(2019, 10, 4),
                LocalDate.of(2010, 7, 16))));
        columns.add(new Column(Constants.BUDGET, ColumnKind.NUMERIC, Arrays.asList(237000000d, 200000000d,
                220000000d, 55000000d, 160000000d)));
        columns.add(new Column(Constants.REVENUE, ColumnKind.NUMERIC, Arrays.asList(2787965087d, 2257844554d,
                1518815515d, 1074219000d, 825532764d)));
        columns.add(new Column(Constants.RUNTIME, ColumnKind.NUMERIC, Arrays.asList(162d, 194d, 143d, 122d, 148d)));
        columns.add(new Column(Constants.VOTE_AVERAGE, ColumnKind.NUMERIC, Arrays.asList(7.2d, 7.5d, 7.8d, 8.4d,
                8.8d)));
        columns.add(new Column(Constants.GENRE, ColumnKind.CATEGORICAL, Arrays.asList("Action", "Drama", "Action",
                "Drama", "Sci-Fi")));
        columns.add(new Column(Constants.DIRECTOR, ColumnKind.CATEGORICAL, Arrays.asList("James Cameron",
                "James Cameron", "Joss Whedon", "Todd Phillips", "Christopher Nolan")));
        columns.add(new Column(Constants.IS_ENGLISH, ColumnKind.BOOLEAN, Arrays.asList(Boolean.TRUE, Boolean.TRUE,
                Boolean.TRUE, Boolean.TRUE, Boolean.TRUE)));
        return new Dataset(Constants.SYNTHETIC_DATASET_NAME, Origin.SYNTHETIC, null, columns);
    }
}
