/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.aggregation;

import com.powsybl.antares.craft.exceptions.OutputParsingException;
import com.powsybl.antares.craft.output.Frequency;
import com.powsybl.antares.craft.util.Reports;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.report.ReportNode;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.tsv.TsvParser;
import com.univocity.parsers.tsv.TsvParserSettings;
import org.apache.commons.lang3.tuple.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads the header and the numeric body of a result file.
 * <p>
 * The body is first parsed with a type inferred from the first rows of each column. If a later row does not match
 * the inferred type, the file is parsed again reading every cell as text before converting it.
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public class OutputFileReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutputFileReader.class);

    public static final String MISSING_VALUE = "N/A";

    private static final Pattern DECIMAL_PATTERN = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    public record OutputFileContent(List<Triple<String, String, String>> headers, List<List<Double>> columns, int rowCount) {
    }

    private enum InferredType {
        INTEGER,
        FLOAT
    }

    private static final class SchemaInferenceException extends RuntimeException {

        private SchemaInferenceException(String message) {
            super(message);
        }
    }

    private final String outputId;

    private final AggregationParameters parameters;

    private final ReportNode reportNode;

    public OutputFileReader(String outputId, AggregationParameters parameters, ReportNode reportNode) {
        this.outputId = Objects.requireNonNull(outputId);
        this.parameters = Objects.requireNonNull(parameters);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    public OutputFileContent read(Path file, Frequency frequency) {
        Objects.requireNonNull(file);
        int startColumn = OutputHeaderParser.getStartColumn(Objects.requireNonNull(frequency));
        try {
            try {
                return readWithInference(file, startColumn);
            } catch (SchemaInferenceException e) {
                LOGGER.debug("Schema inference failed for file {} ({}), parsing it again without inference", file, e.getMessage());
                Reports.reportSchemaInferenceFallback(reportNode, fileName(file));
                return readWithoutInference(file, startColumn);
            }
        } catch (TextParsingException e) {
            throw new OutputParsingException(outputId, fileName(file), e.getMessage(), e);
        }
    }

    private static String fileName(Path file) {
        return Objects.toString(file.getFileName(), file.toString());
    }

    private OutputParsingException parsingError(Path file, String message) {
        return new OutputParsingException(outputId, fileName(file), message);
    }

    private List<Triple<String, String, String>> readHeaders(Path file, BufferedReader reader, int startColumn) throws IOException {
        List<String> headerLines = new ArrayList<>(OutputHeaderParser.HEADER_LINE_COUNT);
        String line;
        while (headerLines.size() < OutputHeaderParser.HEADER_LINE_COUNT && (line = reader.readLine()) != null) {
            headerLines.add(line);
        }
        try {
            return OutputHeaderParser.parse(headerLines, startColumn);
        } catch (PowsyblException e) {
            throw new OutputParsingException(outputId, fileName(file), e.getMessage(), e);
        }
    }

    private TsvParser createParser() {
        TsvParserSettings settings = new TsvParserSettings();
        settings.setMaxColumns(parameters.getMaxColumns());
        settings.setLineSeparatorDetectionEnabled(true);
        settings.setSkipEmptyLines(true);
        return new TsvParser(settings);
    }

    private void checkColumnCount(Path file, String[] row, int startColumn, int labelCount, int rowIndex) {
        int dataColumnCount = row.length - startColumn;
        if (dataColumnCount != labelCount) {
            throw parsingError(file, "row " + (rowIndex + 1) + " has " + Math.max(dataColumnCount, 0)
                    + " data columns but header has " + labelCount + " labels");
        }
    }

    private static boolean isMissing(String value) {
        return value == null || MISSING_VALUE.equals(value);
    }

    private OutputFileContent readWithInference(Path file, int startColumn) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<Triple<String, String, String>> headers = readHeaders(file, reader, startColumn);
            int labelCount = headers.size();
            List<List<Double>> columns = newColumns(labelCount);
            TsvParser parser = createParser();
            parser.beginParsing(reader);
            try {
                // rows used for inference are kept as text until every column type is known
                List<String[]> inferenceRows = new ArrayList<>();
                InferredType[] types = null;
                int rowIndex = 0;
                String[] row;
                while ((row = parser.parseNext()) != null) {
                    checkColumnCount(file, row, startColumn, labelCount, rowIndex);
                    if (types == null) {
                        inferenceRows.add(row);
                        if (inferenceRows.size() == parameters.getInferSchemaLength()) {
                            types = inferTypes(file, inferenceRows, startColumn, labelCount);
                            for (String[] inferenceRow : inferenceRows) {
                                appendTypedRow(inferenceRow, types, startColumn, columns);
                            }
                            inferenceRows.clear();
                        }
                    } else {
                        appendTypedRow(row, types, startColumn, columns);
                    }
                    rowIndex++;
                }
                if (types == null) {
                    types = inferTypes(file, inferenceRows, startColumn, labelCount);
                    for (String[] inferenceRow : inferenceRows) {
                        appendTypedRow(inferenceRow, types, startColumn, columns);
                    }
                }
                return new OutputFileContent(headers, columns, rowIndex);
            } finally {
                parser.stopParsing();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private OutputFileContent readWithoutInference(Path file, int startColumn) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            List<Triple<String, String, String>> headers = readHeaders(file, reader, startColumn);
            int labelCount = headers.size();
            TsvParser parser = createParser();
            List<String[]> rows = new ArrayList<>();
            parser.beginParsing(reader);
            try {
                String[] row;
                while ((row = parser.parseNext()) != null) {
                    checkColumnCount(file, row, startColumn, labelCount, rows.size());
                    rows.add(row);
                }
            } finally {
                parser.stopParsing();
            }
            List<List<Double>> columns = newColumns(labelCount);
            for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
                String[] row = rows.get(rowIndex);
                for (int k = 0; k < labelCount; k++) {
                    String value = row[startColumn + k];
                    columns.get(k).add(isMissing(value) ? null : toDouble(file, value, rowIndex, k));
                }
            }
            return new OutputFileContent(headers, columns, rows.size());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses a decimal number as written by the simulator: plain or scientific notation, or one of the
     * {@code inf}, {@code -inf} and {@code nan} tokens whatever their case.
     */
    static double parseDecimal(String value) {
        if (DECIMAL_PATTERN.matcher(value).matches()) {
            return Double.parseDouble(value);
        }
        return switch (value.toLowerCase(Locale.ROOT)) {
            case "inf", "+inf" -> Double.POSITIVE_INFINITY;
            case "-inf" -> Double.NEGATIVE_INFINITY;
            case "nan" -> Double.NaN;
            default -> throw new NumberFormatException("Not a decimal number: '" + value + "'");
        };
    }

    private Double toDouble(Path file, String value, int rowIndex, int column) {
        try {
            return parseDecimal(value);
        } catch (NumberFormatException e) {
            throw new OutputParsingException(outputId, fileName(file), "value '" + value + "' at row " + (rowIndex + 1)
                    + ", data column " + (column + 1) + " is not a number", e);
        }
    }

    private static List<List<Double>> newColumns(int columnCount) {
        List<List<Double>> columns = new ArrayList<>(columnCount);
        for (int k = 0; k < columnCount; k++) {
            columns.add(new ArrayList<>());
        }
        return columns;
    }

    private static boolean isInteger(String value) {
        int start = value.startsWith("-") ? 1 : 0;
        if (start == value.length()) {
            return false;
        }
        for (int i = start; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private InferredType[] inferTypes(Path file, List<String[]> rows, int startColumn, int labelCount) {
        InferredType[] types = new InferredType[labelCount];
        for (int k = 0; k < labelCount; k++) {
            InferredType type = InferredType.INTEGER;
            for (int rowIndex = 0; rowIndex < rows.size(); rowIndex++) {
                String value = rows.get(rowIndex)[startColumn + k];
                if (!isMissing(value) && !isInteger(value)) {
                    // validates the value, a non numeric one cannot be read by any parsing mode
                    toDouble(file, value, rowIndex, k);
                    type = InferredType.FLOAT;
                    break;
                }
            }
            types[k] = type;
        }
        return types;
    }

    private static void appendTypedRow(String[] row, InferredType[] types, int startColumn, List<List<Double>> columns) {
        for (int k = 0; k < types.length; k++) {
            String value = row[startColumn + k];
            if (isMissing(value)) {
                columns.get(k).add(null);
                continue;
            }
            try {
                columns.get(k).add(switch (types[k]) {
                    case INTEGER -> (double) Long.parseLong(value);
                    case FLOAT -> parseDecimal(value);
                });
            } catch (NumberFormatException e) {
                throw new SchemaInferenceException("value '" + value + "' does not match inferred type " + types[k]);
            }
        }
    }
}
