/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.table;

import com.powsybl.commons.PowsyblException;

import java.util.*;

/**
 * Immutable column oriented table of output values.
 * <p>
 * Each column has a name and a {@link ColumnType}; a {@code null} cell is a missing value (written {@code N/A} by
 * the simulator, or a column absent from some of the concatenated tables).
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public final class OutputTable {

    private static final OutputTable EMPTY = new OutputTable(Collections.emptyList(), Collections.emptyMap(), Collections.emptyMap(), 0);

    private final List<String> columnNames;

    private final Map<String, ColumnType> columnTypes;

    private final Map<String, List<Object>> columns;

    private final int rowCount;

    private OutputTable(List<String> columnNames, Map<String, ColumnType> columnTypes, Map<String, List<Object>> columns, int rowCount) {
        this.columnNames = columnNames;
        this.columnTypes = columnTypes;
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static OutputTable empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private final List<String> names = new ArrayList<>();

        private final Map<String, ColumnType> types = new HashMap<>();

        private final Map<String, List<Object>> values = new HashMap<>();

        private Builder() {
        }

        public Builder addColumn(String name, ColumnType type, List<?> columnValues) {
            Objects.requireNonNull(name);
            Objects.requireNonNull(type);
            Objects.requireNonNull(columnValues);
            if (types.containsKey(name)) {
                throw new PowsyblException("Column '" + name + "' already exists");
            }
            for (Object value : columnValues) {
                if (!type.accepts(value)) {
                    throw new PowsyblException("Value '" + value + "' of column '" + name + "' is not of type " + type);
                }
            }
            names.add(name);
            types.put(name, type);
            values.put(name, Collections.unmodifiableList(new ArrayList<>(columnValues)));
            return this;
        }

        public Builder addConstantColumn(String name, ColumnType type, Object value, int rowCount) {
            return addColumn(name, type, Collections.nCopies(rowCount, value));
        }

        public OutputTable build() {
            int rowCount = names.isEmpty() ? 0 : values.get(names.get(0)).size();
            for (String name : names) {
                int size = values.get(name).size();
                if (size != rowCount) {
                    throw new PowsyblException("Column '" + name + "' has " + size + " rows, expected " + rowCount);
                }
            }
            return new OutputTable(List.copyOf(names), Map.copyOf(types), Map.copyOf(values), rowCount);
        }
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int getColumnCount() {
        return columnNames.size();
    }

    public int getRowCount() {
        return rowCount;
    }

    public boolean isEmpty() {
        return rowCount == 0 && columnNames.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columnTypes.containsKey(name);
    }

    public ColumnType getColumnType(String name) {
        ColumnType type = columnTypes.get(name);
        if (type == null) {
            throw new PowsyblException("Column '" + name + "' not found");
        }
        return type;
    }

    public List<Object> getColumn(String name) {
        getColumnType(name);
        return columns.get(name);
    }

    public Object getValue(int row, String name) {
        return getColumn(name).get(row);
    }

    public String getString(int row, String name) {
        return (String) getValue(row, name);
    }

    public Integer getInteger(int row, String name) {
        return (Integer) getValue(row, name);
    }

    public Double getDouble(int row, String name) {
        return (Double) getValue(row, name);
    }

    /**
     * Keeps the given columns, in the given order.
     */
    public OutputTable select(List<String> names) {
        Builder builder = builder();
        for (String name : names) {
            builder.addColumn(name, getColumnType(name), getColumn(name));
        }
        return builder.build();
    }

    /**
     * Conforms the table to the given columns: existing columns are kept, the others are filled with missing values
     * and typed according to {@code types}.
     */
    public OutputTable reindex(List<String> names, Map<String, ColumnType> types) {
        Builder builder = builder();
        for (String name : names) {
            if (hasColumn(name)) {
                builder.addColumn(name, getColumnType(name), getColumn(name));
            } else {
                builder.addConstantColumn(name, types.getOrDefault(name, ColumnType.DOUBLE), null, rowCount);
            }
        }
        return builder.build();
    }

    public Map<String, ColumnType> getColumnTypes() {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (String name : columnNames) {
            types.put(name, columnTypes.get(name));
        }
        return types;
    }

    /**
     * Outer union of the given tables: columns in first-seen order, rows in table order, missing cells set to null.
     */
    public static OutputTable concat(List<OutputTable> tables) {
        Map<String, ColumnType> allTypes = new LinkedHashMap<>();
        int totalRowCount = 0;
        for (OutputTable table : tables) {
            for (String name : table.columnNames) {
                ColumnType type = table.columnTypes.get(name);
                ColumnType previousType = allTypes.putIfAbsent(name, type);
                if (previousType != null && previousType != type) {
                    throw new PowsyblException("Column '" + name + "' has inconsistent types " + previousType + " and " + type);
                }
            }
            totalRowCount += table.rowCount;
        }
        if (allTypes.isEmpty()) {
            return EMPTY;
        }
        Builder builder = builder();
        for (Map.Entry<String, ColumnType> e : allTypes.entrySet()) {
            String name = e.getKey();
            List<Object> values = new ArrayList<>(totalRowCount);
            for (OutputTable table : tables) {
                if (table.hasColumn(name)) {
                    values.addAll(table.columns.get(name));
                } else {
                    values.addAll(Collections.nCopies(table.rowCount, null));
                }
            }
            builder.addColumn(name, e.getValue(), values);
        }
        return builder.build();
    }

    /**
     * Returns the rows sorted on the given columns, missing values first.
     */
    public OutputTable sortedBy(List<String> keys) {
        Comparator<Integer> comparator = (r1, r2) -> 0;
        for (String key : keys) {
            List<Object> column = getColumn(key);
            comparator = comparator.thenComparing((r1, r2) -> compareValues(column.get(r1), column.get(r2)));
        }
        List<Integer> rows = new ArrayList<>(rowCount);
        for (int row = 0; row < rowCount; row++) {
            rows.add(row);
        }
        rows.sort(comparator);
        Builder builder = builder();
        for (String name : columnNames) {
            List<Object> column = columns.get(name);
            List<Object> sorted = new ArrayList<>(rowCount);
            for (int row : rows) {
                sorted.add(column.get(row));
            }
            builder.addColumn(name, columnTypes.get(name), sorted);
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static int compareValues(Object value1, Object value2) {
        if (value1 == null) {
            return value2 == null ? 0 : -1;
        }
        if (value2 == null) {
            return 1;
        }
        return ((Comparable<Object>) value1).compareTo(value2);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        OutputTable other = (OutputTable) o;
        return rowCount == other.rowCount
                && columnNames.equals(other.columnNames)
                && columnTypes.equals(other.columnTypes)
                && columns.equals(other.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columnNames, columnTypes, columns, rowCount);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append(String.join("\t", columnNames)).append(System.lineSeparator());
        int shownRowCount = Math.min(rowCount, 10);
        for (int row = 0; row < shownRowCount; row++) {
            StringJoiner joiner = new StringJoiner("\t");
            for (String name : columnNames) {
                joiner.add(String.valueOf(columns.get(name).get(row)));
            }
            builder.append(joiner).append(System.lineSeparator());
        }
        if (rowCount > shownRowCount) {
            builder.append("... (").append(rowCount).append(" rows)").append(System.lineSeparator());
        }
        return builder.toString();
    }
}
