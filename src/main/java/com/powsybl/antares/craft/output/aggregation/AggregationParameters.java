/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.aggregation;

import com.powsybl.commons.config.PlatformConfig;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public class AggregationParameters {

    public static final String MODULE_NAME = "antares-output-aggregation-default-parameters";

    public static final String INFER_SCHEMA_LENGTH_PARAM_NAME = "inferSchemaLength";
    public static final int INFER_SCHEMA_LENGTH_DEFAULT_VALUE = 100;
    public static final String MAX_COLUMNS_PARAM_NAME = "maxColumns";
    public static final int MAX_COLUMNS_DEFAULT_VALUE = 16384;
    public static final String PARQUET_COMPRESSION_PARAM_NAME = "parquetCompression";
    public static final CompressionCodecName PARQUET_COMPRESSION_DEFAULT_VALUE = CompressionCodecName.ZSTD;
    public static final String CHECK_ENTITIES_CONSISTENCY_PARAM_NAME = "checkEntitiesConsistency";
    public static final boolean CHECK_ENTITIES_CONSISTENCY_DEFAULT_VALUE = false;
    public static final List<String> SPECIFIC_PARAMETERS_NAMES = List.of(INFER_SCHEMA_LENGTH_PARAM_NAME, MAX_COLUMNS_PARAM_NAME,
            PARQUET_COMPRESSION_PARAM_NAME, CHECK_ENTITIES_CONSISTENCY_PARAM_NAME);

    private int inferSchemaLength = INFER_SCHEMA_LENGTH_DEFAULT_VALUE;

    private int maxColumns = MAX_COLUMNS_DEFAULT_VALUE;

    private CompressionCodecName parquetCompression = PARQUET_COMPRESSION_DEFAULT_VALUE;

    private boolean checkEntitiesConsistency = CHECK_ENTITIES_CONSISTENCY_DEFAULT_VALUE;

    /**
     * Number of data rows used to infer the type of each column before switching to the typed parsing.
     */
    public int getInferSchemaLength() {
        return inferSchemaLength;
    }

    public AggregationParameters setInferSchemaLength(int inferSchemaLength) {
        if (inferSchemaLength < 1) {
            throw new IllegalArgumentException("Invalid infer schema length value: " + inferSchemaLength);
        }
        this.inferSchemaLength = inferSchemaLength;
        return this;
    }

    public int getMaxColumns() {
        return maxColumns;
    }

    public AggregationParameters setMaxColumns(int maxColumns) {
        if (maxColumns < 1) {
            throw new IllegalArgumentException("Invalid max columns value: " + maxColumns);
        }
        this.maxColumns = maxColumns;
        return this;
    }

    public CompressionCodecName getParquetCompression() {
        return parquetCompression;
    }

    public AggregationParameters setParquetCompression(CompressionCodecName parquetCompression) {
        this.parquetCompression = Objects.requireNonNull(parquetCompression);
        return this;
    }

    /**
     * If true, the areas or links of every Monte Carlo year are compared with those of the first year.
     */
    public boolean isCheckEntitiesConsistency() {
        return checkEntitiesConsistency;
    }

    public AggregationParameters setCheckEntitiesConsistency(boolean checkEntitiesConsistency) {
        this.checkEntitiesConsistency = checkEntitiesConsistency;
        return this;
    }

    public static AggregationParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static AggregationParameters load(PlatformConfig platformConfig) {
        AggregationParameters parameters = new AggregationParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
                .ifPresent(config -> parameters
                        .setInferSchemaLength(config.getIntProperty(INFER_SCHEMA_LENGTH_PARAM_NAME, INFER_SCHEMA_LENGTH_DEFAULT_VALUE))
                        .setMaxColumns(config.getIntProperty(MAX_COLUMNS_PARAM_NAME, MAX_COLUMNS_DEFAULT_VALUE))
                        .setParquetCompression(config.getEnumProperty(PARQUET_COMPRESSION_PARAM_NAME, CompressionCodecName.class, PARQUET_COMPRESSION_DEFAULT_VALUE))
                        .setCheckEntitiesConsistency(config.getBooleanProperty(CHECK_ENTITIES_CONSISTENCY_PARAM_NAME, CHECK_ENTITIES_CONSISTENCY_DEFAULT_VALUE)));
        return parameters;
    }

    public static AggregationParameters load(Map<String, String> properties) {
        return new AggregationParameters()
                .update(properties);
    }

    public AggregationParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(INFER_SCHEMA_LENGTH_PARAM_NAME))
                .ifPresent(value -> this.setInferSchemaLength(Integer.parseInt(value)));
        Optional.ofNullable(properties.get(MAX_COLUMNS_PARAM_NAME))
                .ifPresent(value -> this.setMaxColumns(Integer.parseInt(value)));
        Optional.ofNullable(properties.get(PARQUET_COMPRESSION_PARAM_NAME))
                .ifPresent(value -> this.setParquetCompression(CompressionCodecName.valueOf(value)));
        Optional.ofNullable(properties.get(CHECK_ENTITIES_CONSISTENCY_PARAM_NAME))
                .ifPresent(value -> this.setCheckEntitiesConsistency(Boolean.parseBoolean(value)));
        return this;
    }

    @Override
    public String toString() {
        return "AggregationParameters(" +
                "inferSchemaLength=" + inferSchemaLength +
                ", maxColumns=" + maxColumns +
                ", parquetCompression=" + parquetCompression +
                ", checkEntitiesConsistency=" + checkEntitiesConsistency +
                ')';
    }
}
