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
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Types;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Writes tables sharing the same columns into a single Parquet file. Every column is optional so that missing
 * values are stored as nulls.
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public class ParquetTableWriter implements AutoCloseable {

    static final String SCHEMA_NAME = "output_table";

    private final List<String> columnNames;

    private final Map<String, ColumnType> columnTypes;

    private final SimpleGroupFactory groupFactory;

    private final ParquetWriter<Group> writer;

    public ParquetTableWriter(Path file, Map<String, ColumnType> columnTypes, CompressionCodecName compression) {
        Objects.requireNonNull(file);
        this.columnTypes = new LinkedHashMap<>(Objects.requireNonNull(columnTypes));
        this.columnNames = List.copyOf(columnTypes.keySet());
        MessageType schema = createSchema(columnTypes);
        this.groupFactory = new SimpleGroupFactory(schema);
        try {
            this.writer = ExampleParquetWriter.builder(new org.apache.hadoop.fs.Path(file.toUri()))
                    .withConf(new Configuration())
                    .withType(schema)
                    .withCompressionCodec(Objects.requireNonNull(compression))
                    .withWriterVersion(ParquetProperties.WriterVersion.PARQUET_2_0)
                    .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                    .build();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static MessageType createSchema(Map<String, ColumnType> columnTypes) {
        Types.MessageTypeBuilder builder = Types.buildMessage();
        for (Map.Entry<String, ColumnType> e : columnTypes.entrySet()) {
            String name = e.getKey();
            switch (e.getValue()) {
                case STRING -> builder.addField(Types.optional(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named(name));
                case INTEGER -> builder.addField(Types.optional(PrimitiveTypeName.INT32).named(name));
                case DOUBLE -> builder.addField(Types.optional(PrimitiveTypeName.DOUBLE).named(name));
            }
        }
        return builder.named(SCHEMA_NAME);
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public void write(OutputTable table) {
        if (!table.getColumnNames().equals(columnNames) || !table.getColumnTypes().equals(columnTypes)) {
            throw new PowsyblException("Table columns " + table.getColumnTypes() + " do not match file columns " + columnTypes);
        }
        try {
            for (int row = 0; row < table.getRowCount(); row++) {
                Group group = groupFactory.newGroup();
                for (String name : columnNames) {
                    Object value = table.getValue(row, name);
                    if (value == null) {
                        continue;
                    }
                    switch (columnTypes.get(name)) {
                        case STRING -> group.append(name, (String) value);
                        case INTEGER -> group.append(name, ((Integer) value).intValue());
                        case DOUBLE -> group.append(name, ((Double) value).doubleValue());
                    }
                }
                writer.write(group);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static void write(OutputTable table, Path file, CompressionCodecName compression) {
        try (ParquetTableWriter writer = new ParquetTableWriter(file, table.getColumnTypes(), compression)) {
            writer.write(table);
        }
    }

    @Override
    public void close() {
        try {
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
