/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.aggregation;

import com.google.common.base.Stopwatch;
import com.powsybl.antares.craft.exceptions.OutputAggregationException;
import com.powsybl.antares.craft.exceptions.OutputNotFoundException;
import com.powsybl.antares.craft.exceptions.OutputSubFolderNotFoundException;
import com.powsybl.antares.craft.output.Frequency;
import com.powsybl.antares.craft.output.OutputDataType;
import com.powsybl.antares.craft.output.table.OutputTable;
import com.powsybl.antares.craft.util.Reports;
import com.powsybl.commons.report.ReportNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Aggregates the result files of an output matching a query into tables with the area or link, the Monte Carlo
 * year and the time step as leading columns.
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public class AggregatorManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregatorManager.class);

    public static final String ECONOMY_FOLDER = "economy";

    private final Path outputPath;

    private final String outputId;

    private final OutputDataType dataType;

    private final Frequency frequency;

    private final List<String> idsToConsider;

    private final List<String> columnNames;

    private final List<Integer> mcYears;

    private final AggregationParameters parameters;

    private final ReportNode reportNode;

    public AggregatorManager(Path outputPath, OutputDataType dataType, Frequency frequency, Collection<String> idsToConsider,
                             Collection<String> columnNames, Collection<Integer> mcYears) {
        this(outputPath, dataType, frequency, idsToConsider, columnNames, mcYears, new AggregationParameters(), ReportNode.NO_OP);
    }

    public AggregatorManager(Path outputPath, OutputDataType dataType, Frequency frequency, Collection<String> idsToConsider,
                             Collection<String> columnNames, Collection<Integer> mcYears, AggregationParameters parameters,
                             ReportNode reportNode) {
        this.outputPath = Objects.requireNonNull(outputPath);
        this.outputId = Objects.requireNonNull(outputPath.getFileName()).toString();
        this.dataType = Objects.requireNonNull(dataType);
        this.frequency = Objects.requireNonNull(frequency);
        this.idsToConsider = List.copyOf(Objects.requireNonNull(idsToConsider));
        this.columnNames = List.copyOf(Objects.requireNonNull(columnNames));
        this.mcYears = List.copyOf(Objects.requireNonNull(mcYears));
        this.parameters = Objects.requireNonNull(parameters);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    public String getOutputId() {
        return outputId;
    }

    public Path getMcRootPath() {
        return outputPath.resolve(ECONOMY_FOLDER).resolve(dataType.getMcRoot().getFolderName());
    }

    private void checkFoldersExist() {
        if (!Files.isDirectory(outputPath)) {
            throw new OutputNotFoundException(outputId);
        }
        if (!Files.isDirectory(getMcRootPath())) {
            throw new OutputSubFolderNotFoundException(outputId, ECONOMY_FOLDER + "/" + dataType.getMcRoot().getFolderName());
        }
    }

    /**
     * Checks the output folders and locates the matching files, then returns a lazy stream of one table per file,
     * in sorted file path order. The stream is meant to be consumed once.
     *
     * @throws OutputNotFoundException if the output folder does not exist
     * @throws OutputSubFolderNotFoundException if the Monte Carlo root folder does not exist
     * @throws OutputAggregationException if no file matches the query
     */
    public Stream<OutputTable> aggregateOutputData() {
        checkFoldersExist();

        ReportNode aggregationReportNode = Reports.createOutputAggregationReporter(reportNode, outputId);
        Path mcRootPath = getMcRootPath();
        List<Path> files = new OutputFilesLocator(mcRootPath, dataType, frequency, idsToConsider, mcYears, parameters, aggregationReportNode)
                .locate();
        if (files.isEmpty()) {
            Reports.reportNoOutputFilesFound(aggregationReportNode, outputId);
            throw new OutputAggregationException(outputId, "No output files matching the criteria were found.");
        }

        LOGGER.info("Parsing {} {} files to build the aggregated output {}", files.size(), frequency.getToken(), outputId);
        Reports.reportOutputFilesFound(aggregationReportNode, files.size(), frequency.getToken());

        OutputTableBuilder tableBuilder = new OutputTableBuilder(outputId, mcRootPath, dataType, frequency, columnNames,
                new OutputFileReader(outputId, parameters, aggregationReportNode));
        return files.stream().map(tableBuilder::build);
    }

    /**
     * Concatenates in memory all the tables of {@link #aggregateOutputData()}.
     */
    public OutputTable aggregate() {
        Stopwatch stopwatch = Stopwatch.createStarted();
        List<OutputTable> tables;
        try (Stream<OutputTable> stream = aggregateOutputData()) {
            tables = stream.collect(Collectors.toList());
        }
        OutputTable table = OutputTable.concat(tables);
        stopwatch.stop();
        LOGGER.info("Output {} aggregated in {} ms ({} rows)", outputId, stopwatch.elapsed(TimeUnit.MILLISECONDS), table.getRowCount());
        return table;
    }
}
