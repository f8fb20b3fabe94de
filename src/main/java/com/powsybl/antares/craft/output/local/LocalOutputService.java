/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.local;

import com.powsybl.antares.craft.exceptions.MatrixDownloadException;
import com.powsybl.antares.craft.exceptions.OutputAggregationException;
import com.powsybl.antares.craft.exceptions.OutputNotFoundException;
import com.powsybl.antares.craft.output.*;
import com.powsybl.antares.craft.output.aggregation.AggregationParameters;
import com.powsybl.antares.craft.output.aggregation.AggregatorManager;
import com.powsybl.antares.craft.output.aggregation.OutputFileReader;
import com.powsybl.antares.craft.output.aggregation.OutputTableBuilder;
import com.powsybl.antares.craft.output.table.ColumnType;
import com.powsybl.antares.craft.output.table.OutputTable;
import com.powsybl.commons.report.ReportNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Triple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads the outputs of a study stored on the local file system, under {@code <study>/output}.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public class LocalOutputService implements OutputService {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalOutputService.class);

    public static final String OUTPUT_FOLDER = "output";

    static final String MATRIX_FILE_EXTENSION = ".txt";

    private final Path studyPath;

    private final AggregationParameters parameters;

    private final ReportNode reportNode;

    public LocalOutputService(Path studyPath) {
        this(studyPath, AggregationParameters.load(), ReportNode.NO_OP);
    }

    public LocalOutputService(Path studyPath, AggregationParameters parameters, ReportNode reportNode) {
        this.studyPath = Objects.requireNonNull(studyPath);
        this.parameters = Objects.requireNonNull(parameters);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    private Path getOutputPath(String outputId) {
        return studyPath.resolve(OUTPUT_FOLDER).resolve(Objects.requireNonNull(outputId));
    }

    @Override
    public OutputTable getMatrix(String outputId, String filePath, Frequency frequency) {
        Objects.requireNonNull(filePath);
        Path file = getOutputPath(outputId).resolve(AggregatorManager.ECONOMY_FOLDER).resolve(filePath + MATRIX_FILE_EXTENSION);
        if (!Files.isRegularFile(file)) {
            throw new MatrixDownloadException(outputId, filePath, "the file does not exist");
        }
        LOGGER.debug("Reading matrix {} of output {}", filePath, outputId);
        OutputFileReader.OutputFileContent content = new OutputFileReader(outputId, parameters, reportNode).read(file, frequency);

        List<Integer> timeIds = new ArrayList<>(content.rowCount());
        for (int timeId = 1; timeId <= content.rowCount(); timeId++) {
            timeIds.add(timeId);
        }
        OutputTable.Builder builder = OutputTable.builder()
                .addColumn(OutputTableBuilder.TIME_ID_COLUMN, ColumnType.INTEGER, timeIds);
        List<Triple<String, String, String>> headers = content.headers();
        for (int k = 0; k < headers.size(); k++) {
            builder.addColumn(getMatrixColumnName(headers.get(k)), ColumnType.DOUBLE, content.columns().get(k));
        }
        return builder.build();
    }

    static String getMatrixColumnName(Triple<String, String, String> header) {
        return Stream.of(header.getLeft(), header.getMiddle(), header.getRight())
                .map(StringUtils::strip)
                .filter(StringUtils::isNotEmpty)
                .collect(Collectors.joining(" "));
    }

    @Override
    public OutputTable aggregateValues(String outputId, AggregationEntry aggregationEntry, OutputObjectType objectType, String mcType) {
        Objects.requireNonNull(aggregationEntry);
        Objects.requireNonNull(objectType);
        Path outputPath = getOutputPath(outputId);
        if (!Files.isDirectory(outputPath)) {
            throw new OutputNotFoundException(outputId);
        }
        McRoot mcRoot = McRoot.fromMcType(mcType);
        OutputDataType dataType = aggregationEntry.getDataType();
        if (dataType.getMcRoot() != mcRoot || dataType.getObjectType() != objectType) {
            throw new OutputAggregationException(outputId, "data type " + dataType + " cannot be read from "
                    + mcRoot.getFolderName() + " " + objectType.getFolderName());
        }
        return new AggregatorManager(outputPath, dataType, aggregationEntry.getFrequency(), aggregationEntry.getTypeIds(),
                aggregationEntry.getColumnNames(), aggregationEntry.getMcYears(), parameters, reportNode)
                .aggregate();
    }
}
