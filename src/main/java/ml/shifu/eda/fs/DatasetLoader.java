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

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import ml.shifu.eda.container.Column;
import ml.shifu.eda.container.Dataset;
import ml.shifu.eda.container.Dataset.Origin;
import ml.shifu.eda.container.obj.AnalysisConfig;
import ml.shifu.eda.container.obj.ColumnKind;
import ml.shifu.eda.exception.EdaErrorCode;
import ml.shifu.eda.exception.EdaException;
import ml.shifu.eda.util.Constants;

import org.apache.commons.collections.CollectionUtils;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DatasetLoader} reads a delimited file with a header row into an immutable {@link Dataset}.
 *
 * <p>
 * Loading fails soft: if the file is absent or cannot be parsed, a warning is logged and the synthetic sample from
 * {@link SampleDatasets#movies()} is returned instead.
 */
public class DatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(DatasetLoader.class);

    /**
     * Kinds declared for the known movie columns, other columns are inferred from their values.
     */
    private static final Map<String, ColumnKind> DECLARED_KINDS = new HashMap<String, ColumnKind>();

    /**
     * Columns the analysis stages depend on, with the kind they need.
     */
    private static final Map<String, ColumnKind> EXPECTED_ANALYTICAL_COLUMNS = new LinkedHashMap<String, ColumnKind>();

    static {
        DECLARED_KINDS.put(Constants.TITLE, ColumnKind.CATEGORICAL);
        DECLARED_KINDS.put(Constants.RELEASE_DATE, ColumnKind.DATE);
        DECLARED_KINDS.put(Constants.BUDGET, ColumnKind.NUMERIC);
        DECLARED_KINDS.put(Constants.REVENUE, ColumnKind.NUMERIC);
        DECLARED_KINDS.put(Constants.RUNTIME, ColumnKind.NUMERIC);
        DECLARED_KINDS.put(Constants.VOTE_AVERAGE, ColumnKind.NUMERIC);
        DECLARED_KINDS.put(Constants.GENRE, ColumnKind.CATEGORICAL);
        DECLARED_KINDS.put(Constants.DIRECTOR, ColumnKind.CATEGORICAL);
        DECLARED_KINDS.put(Constants.IS_ENGLISH, ColumnKind.BOOLEAN);

        EXPECTED_ANALYTICAL_COLUMNS.put(Constants.BUDGET, ColumnKind.NUMERIC);
        EXPECTED_ANALYTICAL_COLUMNS.put(Constants.REVENUE, ColumnKind.NUMERIC);
        EXPECTED_ANALYTICAL_COLUMNS.put(Constants.RUNTIME, ColumnKind.NUMERIC);
        EXPECTED_ANALYTICAL_COLUMNS.put(Constants.VOTE_AVERAGE, ColumnKind.NUMERIC);
        EXPECTED_ANALYTICAL_COLUMNS.put(Constants.GENRE, ColumnKind.CATEGORICAL);
    }

    private final char delimiter;

    private final Set<String> missingValSet;

    public DatasetLoader(AnalysisConfig config) {
        this.delimiter = config.getDelimiter().charAt(0);
        this.missingValSet = new HashSet<String>();
        this.missingValSet.add("");
        if(CollectionUtils.isNotEmpty(config.getMissingValues())) {
            for(String missingVal: config.getMissingValues()) {
                missingValSet.add(StringUtils.trimToEmpty(missingVal));
            }
        }
    }

    /**
     * Load the file at path, or the synthetic sample if it is absent or unparsable.
     *
     * @param path
     *            path of the delimited file, may be null
     * @return dataset, never null
     */
    public Dataset load(String path) {
        try {
            return loadStrictly(path);
        } catch (EdaException e) {
            log.warn("Dataset not found or not readable ({}). Using the synthetic movie sample for demonstration.",
                    e.getMessage());
            return SampleDatasets.movies();
        }
    }

    /**
     * Load the file without the synthetic fallback.
     *
     * @throws EdaException
     *             {@link EdaErrorCode#ERROR_INPUT_NOT_FOUND} or {@link EdaErrorCode#ERROR_INPUT_UNPARSABLE}
     */
    public Dataset loadStrictly(String path) {
        if(StringUtils.isBlank(path) || !new File(path).isFile()) {
            throw new EdaException(EdaErrorCode.ERROR_INPUT_NOT_FOUND, "Input file " + path + " does not exist");
        }

        File file = new File(path);
        Reader reader = null;
        try {
            reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file.toPath()),
                    Constants.DEFAULT_CHARSET));
            Dataset dataset = parse(reader, FilenameUtils.getBaseName(path), path);
            log.info("Loaded {} from {}.", dataset, path);
            return dataset;
        } catch (IOException e) {
            throw new EdaException(EdaErrorCode.ERROR_INPUT_UNPARSABLE, e, "Cannot read " + path);
        } finally {
            IOUtils.closeQuietly(reader);
        }
    }

    /**
     * Parse a delimited table with a header row.
     *
     * @throws IOException
     *             if the reader fails
     * @throws EdaException
     *             {@link EdaErrorCode#ERROR_INPUT_UNPARSABLE} if there is no header or a record is malformed
     */
    public Dataset parse(Reader reader, String name, String sourcePath) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.withDelimiter(delimiter).withFirstRecordAsHeader()
                .withIgnoreSurroundingSpaces().withIgnoreEmptyLines();

        List<String> headers;
        List<List<String>> rawColumns = new ArrayList<List<String>>();
        CSVParser parser = null;
        try {
            parser = new CSVParser(reader, format);
            headers = parser.getHeaderNames();
            if(headers == null || headers.isEmpty()) {
                throw new EdaException(EdaErrorCode.ERROR_INPUT_UNPARSABLE, "No header found in " + sourcePath);
            }
            for(int i = 0; i < headers.size(); i++) {
                rawColumns.add(new ArrayList<String>());
            }

            for(CSVRecord record: parser) {
                if(record.size() > headers.size()) {
                    throw new EdaException(EdaErrorCode.ERROR_INPUT_UNPARSABLE, "Record " + record.getRecordNumber()
                            + " has " + record.size() + " fields, but header has " + headers.size());
                }
                for(int i = 0; i < headers.size(); i++) {
                    // short records are padded with missing values
                    rawColumns.get(i).add(i < record.size() ? record.get(i) : null);
                }
            }
        } catch (IllegalArgumentException e) {
            // duplicate or empty header names
            throw new EdaException(EdaErrorCode.ERROR_INPUT_UNPARSABLE, e, "Malformed header in " + sourcePath);
        } catch (IllegalStateException e) {
            throw new EdaException(EdaErrorCode.ERROR_INPUT_UNPARSABLE, e, "Malformed record in " + sourcePath);
        } catch (UncheckedIOException e) {
            throw e.getCause();
        } finally {
            IOUtils.closeQuietly(parser);
        }

        List<Column> columns = new ArrayList<Column>(headers.size());
        for(int i = 0; i < headers.size(); i++) {
            columns.add(toColumn(headers.get(i), rawColumns.get(i)));
        }
        return new Dataset(name, Origin.FILE, sourcePath, columns);
    }

    /**
     * Expected analytical columns which are absent or not of the kind the analysis needs. Stages depending on them
     * are skipped.
     */
    public static List<String> findSchemaGaps(Dataset dataset) {
        List<String> gaps = new ArrayList<String>();
        for(Entry<String, ColumnKind> entry: EXPECTED_ANALYTICAL_COLUMNS.entrySet()) {
            Column column = dataset.getColumn(entry.getKey());
            if(column == null) {
                gaps.add("Column '" + entry.getKey() + "' is absent");
            } else if(column.getKind() != entry.getValue()) {
                gaps.add("Column '" + entry.getKey() + "' is " + column.getKind() + ", expected " + entry.getValue());
            }
        }
        return gaps;
    }

    private Column toColumn(String name, List<String> raw) {
        List<String> cleaned = new ArrayList<String>(raw.size());
        for(String val: raw) {
            String fval = StringUtils.trimToEmpty(val);
            cleaned.add(isMissingVal(fval) ? null : fval);
        }

        ColumnKind kind = DECLARED_KINDS.get(name);
        if(kind == null) {
            kind = inferKind(cleaned);
        }

        List<Object> values = new ArrayList<Object>(cleaned.size());
        int invalidValCnt = 0;
        for(String val: cleaned) {
            if(val == null) {
                values.add(null);
                continue;
            }
            Object converted = convert(val, kind);
            if(converted == null) {
                invalidValCnt++;
            }
            values.add(converted);
        }
        if(invalidValCnt > 0) {
            log.warn("Column {} has {} values which are not {}, they are treated as missing.", name, invalidValCnt,
                    kind);
        }
        log.debug("Column {} resolved as {}.", name, kind);
        return new Column(name, kind, values);
    }

    private ColumnKind inferKind(List<String> values) {
        boolean allBoolean = true, allNumeric = true, allDate = true, anyPresent = false;
        for(String val: values) {
            if(val == null) {
                continue;
            }
            anyPresent = true;
            allBoolean = allBoolean && convert(val, ColumnKind.BOOLEAN) != null;
            allNumeric = allNumeric && convert(val, ColumnKind.NUMERIC) != null;
            allDate = allDate && convert(val, ColumnKind.DATE) != null;
        }
        if(!anyPresent) {
            return ColumnKind.CATEGORICAL;
        }
        if(allBoolean) {
            return ColumnKind.BOOLEAN;
        }
        if(allNumeric) {
            return ColumnKind.NUMERIC;
        }
        return allDate ? ColumnKind.DATE : ColumnKind.CATEGORICAL;
    }

    /**
     * @return converted value or null if the text is not of the kind
     */
    private static Object convert(String val, ColumnKind kind) {
        switch(kind) {
            case NUMERIC:
                try {
                    double dval = Double.parseDouble(val);
                    return Double.isNaN(dval) || Double.isInfinite(dval) ? null : Double.valueOf(dval);
                } catch (NumberFormatException e) {
                    return null;
                }
            case BOOLEAN:
                if("true".equalsIgnoreCase(val)) {
                    return Boolean.TRUE;
                }
                return "false".equalsIgnoreCase(val) ? Boolean.FALSE : null;
            case DATE:
                try {
                    return LocalDate.parse(val);
                } catch (DateTimeParseException e) {
                    return null;
                }
            case CATEGORICAL:
            default:
                return val;
        }
    }

    private boolean isMissingVal(String val) {
        return missingValSet.contains(val);
    }
}
