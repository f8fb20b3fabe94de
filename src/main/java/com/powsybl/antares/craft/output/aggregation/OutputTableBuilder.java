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
import com.powsybl.antares.craft.output.McRoot;
import com.powsybl.antares.craft.output.OutputDataType;
import com.powsybl.antares.craft.output.table.ColumnType;
import com.powsybl.antares.craft.output.table.OutputTable;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.lang3.tuple.Triple;

import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Builds the normalized table of one result file: details columns reshaped into one row per cluster and time step,
 * columns filtered, identity columns added in front.
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public class OutputTableBuilder {

    public static final String MC_YEAR_COLUMN = "mcYear";

    public static final String TIME_ID_COLUMN = "timeId";

    public static final String CLUSTER_COLUMN = "cluster";

    private final String outputId;

    private final Path mcRootPath;

    private final OutputDataType dataType;

    private final Frequency frequency;

    private final List<String> lowerCaseColumnNames;

    private final OutputFileReader reader;

    public OutputTableBuilder(String outputId, Path mcRootPath, OutputDataType dataType, Frequency frequency,
                              Collection<String> columnNames, OutputFileReader reader) {
        this.outputId = Objects.requireNonNull(outputId);
        this.mcRootPath = Objects.requireNonNull(mcRootPath);
        this.dataType = Objects.requireNonNull(dataType);
        this.frequency = Objects.requireNonNull(frequency);
        this.lowerCaseColumnNames = Objects.requireNonNull(columnNames).stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
        this.reader = Objects.requireNonNull(reader);
    }

    public OutputTable build(Path file) {
        OutputFileReader.OutputFileContent content = reader.read(file, frequency);
        boolean details = dataType.isDetails();
        OutputTable table = details ? buildDetailsTable(content) : buildValuesTable(file, content);
        table = filterColumns(table, details);
        return addIdentityColumns(file, table, details);
    }

    private OutputTable buildValuesTable(Path file, OutputFileReader.OutputFileContent content) {
        List<String> names = OutputHeaderParser.normalizeColumnNames(dataType.getMcRoot(), content.headers());
        Set<String> uniqueNames = new HashSet<>();
        OutputTable.Builder builder = OutputTable.builder();
        for (int k = 0; k < names.size(); k++) {
            String name = names.get(k);
            if (!uniqueNames.add(name)) {
                throw new OutputParsingException(outputId, file.getFileName().toString(), "duplicated column '" + name + "'");
            }
            builder.addColumn(name, ColumnType.DOUBLE, content.columns().get(k));
        }
        return builder.build();
    }

    /**
     * Headers of a details file are (cluster id, variable, dummy) triples. The result has one row per cluster and
     * time step, one column per variable, sorted by time step then cluster.
     */
    private static OutputTable buildDetailsTable(OutputFileReader.OutputFileContent content) {
        Map<Pair<String, String>, Map<String, Integer>> columnIndexes = new TreeMap<>();
        Set<String> variables = new LinkedHashSet<>();
        List<Triple<String, String, String>> headers = content.headers();
        for (int k = 0; k < headers.size(); k++) {
            Triple<String, String, String> header = headers.get(k);
            columnIndexes.computeIfAbsent(Pair.of(header.getLeft(), header.getRight()), p -> new HashMap<>())
                    .put(header.getMiddle(), k);
            variables.add(header.getMiddle());
        }

        int rowCount = content.rowCount();
        List<Object> clusters = new ArrayList<>();
        List<Object> timeIds = new ArrayList<>();
        Map<String, List<Object>> values = new LinkedHashMap<>();
        variables.forEach(variable -> values.put(variable, new ArrayList<>()));
        for (Map.Entry<Pair<String, String>, Map<String, Integer>> e : columnIndexes.entrySet()) {
            String cluster = e.getKey().getLeft();
            Map<String, Integer> indexByVariable = e.getValue();
            for (String variable : variables) {
                Integer index = indexByVariable.get(variable);
                if (index != null) {
                    values.get(variable).addAll(content.columns().get(index));
                } else {
                    values.get(variable).addAll(Collections.nCopies(rowCount, null));
                }
            }
            clusters.addAll(Collections.nCopies(rowCount, cluster));
            for (int timeId = 1; timeId <= rowCount; timeId++) {
                timeIds.add(timeId);
            }
        }

        OutputTable.Builder builder = OutputTable.builder()
                .addColumn(CLUSTER_COLUMN, ColumnType.STRING, clusters)
                .addColumn(TIME_ID_COLUMN, ColumnType.INTEGER, timeIds);
        for (Map.Entry<String, List<Object>> e : values.entrySet()) {
            if (!CLUSTER_COLUMN.equals(e.getKey()) && !TIME_ID_COLUMN.equals(e.getKey())) {
                builder.addColumn(e.getKey(), ColumnType.DOUBLE, e.getValue());
            }
        }
        return builder.build().sortedBy(List.of(TIME_ID_COLUMN, CLUSTER_COLUMN));
    }

    /**
     * Substring matching for details files and for the synthesis, exact matching for individual years values.
     */
    OutputTable filterColumns(OutputTable table, boolean details) {
        if (lowerCaseColumnNames.isEmpty()) {
            return table;
        }
        List<String> filteredColumns = new ArrayList<>();
        if (details) {
            filteredColumns.add(CLUSTER_COLUMN);
            filteredColumns.add(TIME_ID_COLUMN);
        }
        for (String column : table.getColumnNames()) {
            if (filteredColumns.contains(column)) {
                continue;
            }
            boolean keep;
            if (details || dataType.getMcRoot() == McRoot.MC_ALL) {
                keep = lowerCaseColumnNames.stream().anyMatch(name -> StringUtils.containsIgnoreCase(column, name));
            } else {
                keep = lowerCaseColumnNames.contains(column.toLowerCase(Locale.ROOT));
            }
            if (keep) {
                filteredColumns.add(column);
            }
        }
        return table.select(filteredColumns);
    }

    private OutputTable addIdentityColumns(Path file, OutputTable table, boolean details) {
        Path relativePath = mcRootPath.relativize(file);
        int rowCount = table.getRowCount();
        String entityColumn = dataType.getObjectType().getColumnName();
        List<String> dataColumns = table.getColumnNames().stream()
                .filter(column -> !CLUSTER_COLUMN.equals(column) && !TIME_ID_COLUMN.equals(column))
                .collect(Collectors.toList());

        OutputTable.Builder builder = OutputTable.builder();
        switch (dataType.getMcRoot()) {
            case MC_IND -> {
                // <year>/<areas|links>/<id>/<file>
                builder.addConstantColumn(entityColumn, ColumnType.STRING, relativePath.getName(2).toString(), rowCount);
                if (details) {
                    builder.addColumn(CLUSTER_COLUMN, ColumnType.STRING, table.getColumn(CLUSTER_COLUMN));
                }
                builder.addConstantColumn(MC_YEAR_COLUMN, ColumnType.INTEGER, Integer.parseInt(relativePath.getName(0).toString()), rowCount);
            }
            case MC_ALL -> {
                // <areas|links>/<id>/<file>
                builder.addConstantColumn(entityColumn, ColumnType.STRING, relativePath.getName(1).toString(), rowCount);
                if (details) {
                    builder.addColumn(CLUSTER_COLUMN, ColumnType.STRING, table.getColumn(CLUSTER_COLUMN));
                }
            }
        }
        builder.addColumn(TIME_ID_COLUMN, ColumnType.INTEGER, details ? table.getColumn(TIME_ID_COLUMN) : timeIds(rowCount));
        for (String column : dataColumns) {
            builder.addColumn(column, table.getColumnType(column), table.getColumn(column));
        }
        return builder.build();
    }

    private static List<Integer> timeIds(int rowCount) {
        List<Integer> timeIds = new ArrayList<>(rowCount);
        for (int timeId = 1; timeId <= rowCount; timeId++) {
            timeIds.add(timeId);
        }
        return timeIds;
    }
}
