/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.parquet;

import com.google.common.base.Stopwatch;
import com.google.common.io.MoreFiles;
import com.google.common.io.RecursiveDeleteOption;
import com.powsybl.antares.craft.output.aggregation.AggregationParameters;
import com.powsybl.antares.craft.output.table.ColumnType;
import com.powsybl.antares.craft.output.table.OutputTable;
import com.powsybl.antares.craft.util.Reports;
import com.powsybl.commons.PowsyblException;
import com.powsybl.commons.report.ReportNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

/**
 * Merges per-file tables whose columns may differ into a single table, without keeping every table in memory.
 * <p>
 * Tables are written to one Parquet file per distinct set of columns, in a temporary directory. The files are then
 * read back and conformed to the union of all the columns, the missing ones being filled with nulls. The row order
 * of the result is not the one of the input.
 * <p>
 * Parquet files are written through Hadoop, so the temporary directory must be on the default file system.
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public class ChunkedParquetExporter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedParquetExporter.class);

    static final String TMP_DIR_PREFIX = "~aggregation";

    private final AggregationParameters parameters;

    private final ReportNode reportNode;

    public ChunkedParquetExporter() {
        this(new AggregationParameters(), ReportNode.NO_OP);
    }

    public ChunkedParquetExporter(AggregationParameters parameters, ReportNode reportNode) {
        this.parameters = Objects.requireNonNull(parameters);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    public OutputTable export(Path tmpPath, Stream<OutputTable> tables) {
        try (tables) {
            return export(tmpPath, tables.iterator());
        }
    }

    /**
     * @param tmpPath the directory under which the temporary Parquet files are written, it must exist on the
     *                default file system
     * @param tables the tables to merge
     * @return the merged table, or an empty table if there is no input
     */
    public OutputTable export(Path tmpPath, Iterator<OutputTable> tables) {
        Objects.requireNonNull(tmpPath);
        Objects.requireNonNull(tables);
        if (tmpPath.getFileSystem() != FileSystems.getDefault()) {
            throw new PowsyblException("Temporary directory " + tmpPath.toUri() + " is not on the default file system");
        }
        Stopwatch stopwatch = Stopwatch.createStarted();

        Path tmpDir;
        try {
            tmpDir = Files.createTempDirectory(tmpPath, TMP_DIR_PREFIX);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        try {
            OutputTable table = writeAndMerge(tmpDir, tables);
            stopwatch.stop();
            LOGGER.info("{} rows exported in {} ms", table.getRowCount(), stopwatch.elapsed(TimeUnit.MILLISECONDS));
            return table;
        } finally {
            deleteTmpDir(tmpDir);
        }
    }

    private OutputTable writeAndMerge(Path tmpDir, Iterator<OutputTable> tables) {
        Map<Set<String>, ParquetTableWriter> writers = new LinkedHashMap<>();
        Map<Set<String>, Path> files = new LinkedHashMap<>();
        Map<String, ColumnType> allColumnTypes = new LinkedHashMap<>();
        try {
            while (tables.hasNext()) {
                OutputTable table = tables.next();
                if (table.getColumnCount() == 0) {
                    continue;
                }
                mergeColumnTypes(allColumnTypes, table);
                Set<String> signature = new TreeSet<>(table.getColumnNames());
                ParquetTableWriter writer = writers.get(signature);
                if (writer == null) {
                    Path file = tmpDir.resolve("chunk_" + writers.size() + ".parquet");
                    writer = new ParquetTableWriter(file, table.getColumnTypes(), parameters.getParquetCompression());
                    writers.put(signature, writer);
                    files.put(signature, file);
                }
                // same columns, possibly in a different order
                writer.write(table.select(writer.getColumnNames()));
            }
        } catch (RuntimeException e) {
            closeAll(writers.values(), e);
            throw e;
        }
        closeAll(writers.values(), null);

        if (files.isEmpty()) {
            return OutputTable.empty();
        }
        LOGGER.debug("{} parquet files written for {} distinct columns", files.size(), allColumnTypes.size());
        Reports.reportParquetChunksWritten(reportNode, files.size(), allColumnTypes.size());

        List<String> allColumnNames = new ArrayList<>(allColumnTypes.keySet());
        List<OutputTable> chunks = new ArrayList<>(files.size());
        for (Path file : files.values()) {
            chunks.add(ParquetTableReader.read(file).reindex(allColumnNames, allColumnTypes));
        }
        return OutputTable.concat(chunks);
    }

    private static void mergeColumnTypes(Map<String, ColumnType> allColumnTypes, OutputTable table) {
        for (Map.Entry<String, ColumnType> e : table.getColumnTypes().entrySet()) {
            ColumnType previousType = allColumnTypes.putIfAbsent(e.getKey(), e.getValue());
            if (previousType != null && previousType != e.getValue()) {
                throw new PowsyblException("Column '" + e.getKey() + "' has inconsistent types " + previousType + " and " + e.getValue());
            }
        }
    }

    /**
     * Closes all the writers. Close failures are added as suppressed to the pending error if there is one, thrown
     * otherwise.
     */
    static void closeAll(Collection<ParquetTableWriter> writers, RuntimeException pendingError) {
        RuntimeException error = pendingError;
        for (ParquetTableWriter writer : writers) {
            try {
                writer.close();
            } catch (RuntimeException e) {
                if (error == null) {
                    error = e;
                } else {
                    error.addSuppressed(e);
                }
            }
        }
        if (error != null && error != pendingError) {
            throw error;
        }
    }

    private static void deleteTmpDir(Path tmpDir) {
        try {
            MoreFiles.deleteRecursively(tmpDir, RecursiveDeleteOption.ALLOW_INSECURE);
        } catch (IOException e) {
            LOGGER.warn("Cannot delete temporary directory {}", tmpDir, e);
        }
    }
}
