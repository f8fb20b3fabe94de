/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.aggregation;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
class AggregationParametersTest {

    private InMemoryPlatformConfig platformConfig;

    private FileSystem fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultValues() {
        AggregationParameters parameters = AggregationParameters.load(platformConfig);
        assertEquals(AggregationParameters.INFER_SCHEMA_LENGTH_DEFAULT_VALUE, parameters.getInferSchemaLength());
        assertEquals(AggregationParameters.MAX_COLUMNS_DEFAULT_VALUE, parameters.getMaxColumns());
        assertEquals(CompressionCodecName.ZSTD, parameters.getParquetCompression());
        assertFalse(parameters.isCheckEntitiesConsistency());
        assertEquals("AggregationParameters(inferSchemaLength=100, maxColumns=16384, parquetCompression=ZSTD, checkEntitiesConsistency=false)",
                parameters.toString());
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(AggregationParameters.MODULE_NAME);
        moduleConfig.setStringProperty(AggregationParameters.INFER_SCHEMA_LENGTH_PARAM_NAME, "10");
        moduleConfig.setStringProperty(AggregationParameters.PARQUET_COMPRESSION_PARAM_NAME, "SNAPPY");
        moduleConfig.setStringProperty(AggregationParameters.CHECK_ENTITIES_CONSISTENCY_PARAM_NAME, "true");

        AggregationParameters parameters = AggregationParameters.load(platformConfig);
        assertEquals(10, parameters.getInferSchemaLength());
        assertEquals(AggregationParameters.MAX_COLUMNS_DEFAULT_VALUE, parameters.getMaxColumns());
        assertEquals(CompressionCodecName.SNAPPY, parameters.getParquetCompression());
        assertTrue(parameters.isCheckEntitiesConsistency());
    }

    @Test
    void testInvalidConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig(AggregationParameters.MODULE_NAME);
        moduleConfig.setStringProperty(AggregationParameters.INFER_SCHEMA_LENGTH_PARAM_NAME, "0");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> AggregationParameters.load(platformConfig));
        assertEquals("Invalid infer schema length value: 0", e.getMessage());
    }

    @Test
    void testUpdate() {
        AggregationParameters parameters = AggregationParameters.load(Map.of(
                AggregationParameters.MAX_COLUMNS_PARAM_NAME, "512",
                AggregationParameters.PARQUET_COMPRESSION_PARAM_NAME, "GZIP"));
        assertEquals(512, parameters.getMaxColumns());
        assertEquals(CompressionCodecName.GZIP, parameters.getParquetCompression());
        assertEquals(AggregationParameters.INFER_SCHEMA_LENGTH_DEFAULT_VALUE, parameters.getInferSchemaLength());

        parameters.update(Map.of(AggregationParameters.CHECK_ENTITIES_CONSISTENCY_PARAM_NAME, "true"));
        assertTrue(parameters.isCheckEntitiesConsistency());
        assertEquals(512, parameters.getMaxColumns());

        AggregationParameters defaultParameters = new AggregationParameters();
        assertThrows(IllegalArgumentException.class, () -> defaultParameters.setMaxColumns(-1));
        assertThrows(NullPointerException.class, () -> defaultParameters.setParquetCompression(null));
    }
}
