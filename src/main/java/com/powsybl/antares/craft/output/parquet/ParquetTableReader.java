/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.parquet;

import com.powsybl.antares.craft.output.table.ColumnType;
import com.powsybl.antares.craft.output.table.OutputTable;
import com.powsybl.commons.PowsyblException;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.example.GroupReadSupport;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads back a Parquet file written by {@link ParquetTableWriter}.
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public final class ParquetTableReader {

    private ParquetTableReader() {
    }

    static Map<String, ColumnType> readColumnTypes(MessageType schema) {
        Map<String, ColumnType> columnTypes = new LinkedHashMap<>();
        for (Type field : schema.getFields()) {
            ColumnType type = switch (field.asPrimitiveType().getPrimitiveTypeName()) {
                case BINARY -> ColumnType.STRING;
                case INT32 -> ColumnType.INTEGER;
                case DOUBLE -> ColumnType.DOUBLE;
                default -> throw new PowsyblException("Unsupported Parquet type for column '" + field.getName() + "': "
                        + field.asPrimitiveType().getPrimitiveTypeName());
            };
            columnTypes.put(field.getName(), type);
        }
        return columnTypes;
    }

    public static OutputTable read(Path file) {
        Configuration conf = new Configuration();
        org.apache.hadoop.fs.Path hadoopPath = new org.apache.hadoop.fs.Path(file.toUri());
        try {
            MessageType schema;
            try (ParquetFileReader fileReader = ParquetFileReader.open(HadoopInputFile.fromPath(hadoopPath, conf))) {
                schema = fileReader.getFooter().getFileMetaData().getSchema();
            }
            Map<String, ColumnType> columnTypes = readColumnTypes(schema);
            Map<String, List<Object>> columns = new LinkedHashMap<>();
            columnTypes.keySet().forEach(name -> columns.put(name, new ArrayList<>()));

            try (ParquetReader<Group> reader = ParquetReader.builder(new GroupReadSupport(), hadoopPath).withConf(conf).build()) {
                Group group;
                while ((group = reader.read()) != null) {
                    for (Map.Entry<String, ColumnType> e : columnTypes.entrySet()) {
                        columns.get(e.getKey()).add(readValue(group, e.getKey(), e.getValue()));
                    }
                }
            }

            OutputTable.Builder builder = OutputTable.builder();
            columnTypes.forEach((name, type) -> builder.addColumn(name, type, columns.get(name)));
            return builder.build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static Object readValue(Group group, String name, ColumnType type) {
        if (group.getFieldRepetitionCount(name) == 0) {
            return null;
        }
        return switch (type) {
            case STRING -> group.getString(name, 0);
            case INTEGER -> group.getInteger(name, 0);
            case DOUBLE -> group.getDouble(name, 0);
        };
    }
}
