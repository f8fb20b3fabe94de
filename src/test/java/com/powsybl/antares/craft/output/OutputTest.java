/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.antares.craft.output.aggregation.AggregationParameters;
import com.powsybl.antares.craft.output.local.LocalOutputService;
import com.powsybl.antares.craft.output.table.OutputTable;
import com.powsybl.commons.report.ReportNode;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.powsybl.antares.craft.output.OutputFilesTestUtil.createOutput;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
class OutputTest {

    private static final class RecordingOutputService implements OutputService {

        private final List<String> matrixPaths = new ArrayList<>();

        private final List<AggregationEntry> entries = new ArrayList<>();

        private final List<String> aggregations = new ArrayList<>();

        @Override
        public OutputTable getMatrix(String outputId, String filePath, Frequency frequency) {
            matrixPaths.add(outputId + ":" + filePath);
            return OutputTable.empty();
        }

        @Override
        public OutputTable aggregateValues(String outputId, AggregationEntry aggregationEntry, OutputObjectType objectType, String mcType) {
            entries.add(aggregationEntry);
            aggregations.add(outputId + ":" + objectType.getFolderName() + ":" + mcType);
            return OutputTable.empty();
        }
    }

    @Test
    void testGetMatrix() {
        RecordingOutputService service = new RecordingOutputService();
        Output output = new Output("o1", false, service);
        assertEquals("o1", output.getName());
        assertFalse(output.isArchived());

        output.getMcAllArea(Frequency.DAILY, McAllAreasDataType.DETAILS_ST_STORAGE, "fr");
        output.getMcAllLink(Frequency.ANNUAL, McAllLinksDataType.ID, "fr", "be");
        output.getMcIndArea(3, Frequency.HOURLY, McIndAreasDataType.VALUES, "fr");
        output.getMcIndLink(12, Frequency.WEEKLY, McIndLinksDataType.VALUES, "be", "fr");

        assertEquals(List.of("o1:mc-all/areas/fr/details-STstorage-daily",
                             "o1:mc-all/links/be - fr/id-annual",
                             "o1:mc-ind/00003/areas/fr/values-hourly",
                             "o1:mc-ind/00012/links/be - fr/values-weekly"),
                service.matrixPaths);
    }

    @Test
    void testAggregate() {
        RecordingOutputService service = new RecordingOutputService();
        Output output = new Output("o1", true, service);
        assertTrue(output.isArchived());

        output.aggregateMcIndAreas(McIndAreasDataType.DETAILS, Frequency.HOURLY, List.of(1, 2), List.of("fr"), List.of("MWh"));
        output.aggregateMcIndLinks(McIndLinksDataType.VALUES, Frequency.DAILY, null, List.of(Pair.of("fr", "be"), Pair.of("de", "fr")), null);
        output.aggregateMcAllAreas(McAllAreasDataType.VALUES, Frequency.ANNUAL);
        output.aggregateMcAllLinks(McAllLinksDataType.VALUES, Frequency.MONTHLY);

        assertEquals(List.of("o1:areas:ind", "o1:links:ind", "o1:areas:all", "o1:links:all"), service.aggregations);
        AggregationEntry entry = service.entries.get(0);
        assertEquals(McIndAreasDataType.DETAILS, entry.getDataType());
        assertEquals(List.of(1, 2), entry.getMcYears());
        assertEquals(List.of("fr"), entry.getTypeIds());
        assertEquals(List.of("MWh"), entry.getColumnNames());
        assertEquals(List.of("be - fr", "de - fr"), service.entries.get(1).getTypeIds());
        assertTrue(service.entries.get(1).getMcYears().isEmpty());
        assertTrue(service.entries.get(2).getTypeIds().isEmpty());
    }

    @Test
    void testLinkId() {
        assertEquals("be - fr", Output.getLinkId("fr", "be"));
        assertEquals("be - fr", Output.getLinkId("be", "fr"));
        assertEquals("fr - fr", Output.getLinkId("fr", "fr"));
    }

    @Test
    void testWithLocalService() throws IOException {
        try (FileSystem fileSystem = Jimfs.newFileSystem(Configuration.unix())) {
            Path studyPath = fileSystem.getPath("/study");
            createOutput(studyPath.resolve("output").resolve("o1"));
            Output output = new Output("o1", false, new LocalOutputService(studyPath, new AggregationParameters(), ReportNode.NO_OP));

            OutputTable links = output.aggregateMcIndLinks(McIndLinksDataType.VALUES, Frequency.HOURLY, List.of(2), List.of(Pair.of("fr", "be")), List.of());
            assertEquals(List.of("link", "mcYear", "timeId", "FLOW LIN."), links.getColumnNames());
            assertEquals(List.of(2.0, 4.0), links.getColumn("FLOW LIN."));

            OutputTable matrix = output.getMcIndLink(1, Frequency.HOURLY, McIndLinksDataType.VALUES, "fr", "be");
            assertEquals(List.of(1.0, 2.0), matrix.getColumn("FLOW LIN. MWh EXP"));
        }
    }
}
