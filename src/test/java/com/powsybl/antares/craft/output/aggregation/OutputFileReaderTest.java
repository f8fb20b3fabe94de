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
import com.powsybl.antares.craft.exceptions.OutputParsingException;
import com.powsybl.antares.craft.output.Frequency;
import com.powsybl.antares.craft.util.report.AntaresCraftReportResourceBundle;
import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.test.PowsyblTestReportResourceBundle;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static com.powsybl.antares.craft.output.OutputFilesTestUtil.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
class OutputFileReaderTest {

    private FileSystem fileSystem;

    private Path file;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        file = fileSystem.getPath("/output/values-hourly.txt");
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testRead() {
        writeFile(file, valuesFileContent(Frequency.HOURLY, List.of("LOAD", "GAS"), List.of(
                List.of("10", "1.5"),
                List.of("N/A", "2"),
                List.of("-30", "N/A"))));

        OutputFileReader.OutputFileContent content = new OutputFileReader("o1", new AggregationParameters(), ReportNode.NO_OP)
                .read(file, Frequency.HOURLY);

        assertEquals(List.of(Triple.of("LOAD", "MWh", "EXP"), Triple.of("GAS", "MWh", "EXP")), content.headers());
        assertEquals(3, content.rowCount());
        assertEquals(Arrays.asList(10.0, null, -30.0), content.columns().get(0));
        assertEquals(Arrays.asList(1.5, 2.0, null), content.columns().get(1));
    }

    @Test
    void testReadOtherFrequencies() {
        for (Frequency frequency : Frequency.values()) {
            writeFile(file, valuesFileContent(frequency, List.of("LOAD"), List.of(List.of("1"), List.of("2"))));
            OutputFileReader.OutputFileContent content = new OutputFileReader("o1", new AggregationParameters(), ReportNode.NO_OP)
                    .read(file, frequency);
            assertEquals(List.of(List.of(1.0, 2.0)), content.columns(), frequency.toString());
        }
    }

    @Test
    void testSchemaInferenceFallback() {
        writeFile(file, valuesFileContent(Frequency.HOURLY, List.of("LOAD"), List.of(
                List.of("1"),
                List.of("2"),
                List.of("3.5"))));
        ReportNode reportNode = ReportNode.newRootReportNode()
                .withResourceBundles(PowsyblTestReportResourceBundle.TEST_BASE_NAME, AntaresCraftReportResourceBundle.BASE_NAME)
                .withMessageTemplate("testReport")
                .build();

        OutputFileReader.OutputFileContent content = new OutputFileReader("o1", new AggregationParameters().setInferSchemaLength(2), reportNode)
                .read(file, Frequency.HOURLY);

        assertEquals(List.of(1.0, 2.0, 3.5), content.columns().get(0));
        assertEquals(1, reportNode.getChildren().size());
        assertEquals("Schema inference failed for file values-hourly.txt, parsing it again without inference",
                reportNode.getChildren().get(0).getMessage());
    }

    @Test
    void testNoFallbackWhenInferenceCoversAllRows() {
        writeFile(file, valuesFileContent(Frequency.HOURLY, List.of("LOAD"), List.of(
                List.of("1"),
                List.of("3.5"))));
        ReportNode reportNode = ReportNode.newRootReportNode()
                .withResourceBundles(PowsyblTestReportResourceBundle.TEST_BASE_NAME, AntaresCraftReportResourceBundle.BASE_NAME)
                .withMessageTemplate("testReport")
                .build();

        OutputFileReader.OutputFileContent content = new OutputFileReader("o1", new AggregationParameters(), reportNode)
                .read(file, Frequency.HOURLY);

        assertEquals(List.of(1.0, 3.5), content.columns().get(0));
        assertTrue(reportNode.getChildren().isEmpty());
    }

    @Test
    void testNonNumericValue() {
        writeFile(file, valuesFileContent(Frequency.HOURLY, List.of("LOAD"), List.of(
                List.of("1"),
                List.of("abc"))));
        OutputFileReader reader = new OutputFileReader("o1", new AggregationParameters(), ReportNode.NO_OP);
        OutputParsingException e = assertThrows(OutputParsingException.class, () -> reader.read(file, Frequency.HOURLY));
        assertEquals("o1", e.getOutputId());
        assertEquals("values-hourly.txt", e.getFileName());
        assertTrue(e.getMessage().contains("'abc'"));
    }

    @Test
    void testNonNumericValueAfterInference() {
        writeFile(file, valuesFileContent(Frequency.HOURLY, List.of("LOAD"), List.of(
                List.of("1"),
                List.of("abc"))));
        OutputFileReader reader = new OutputFileReader("o1", new AggregationParameters().setInferSchemaLength(1), ReportNode.NO_OP);
        assertThrows(OutputParsingException.class, () -> reader.read(file, Frequency.HOURLY));
    }

    @Test
    void testParseDecimal() {
        assertEquals(1.5, OutputFileReader.parseDecimal("1.5"));
        assertEquals(-2.0, OutputFileReader.parseDecimal("-2."));
        assertEquals(0.25, OutputFileReader.parseDecimal(".25"));
        assertEquals(1200.0, OutputFileReader.parseDecimal("1.2e+03"));
        assertEquals(Double.POSITIVE_INFINITY, OutputFileReader.parseDecimal("inf"));
        assertEquals(Double.NEGATIVE_INFINITY, OutputFileReader.parseDecimal("-INF"));
        assertTrue(Double.isNaN(OutputFileReader.parseDecimal("nan")));
        for (String value : List.of("1d", "2f", "0x1p3", "Infinity", "NaN1", "", "1e", " 1")) {
            assertThrows(NumberFormatException.class, () -> OutputFileReader.parseDecimal(value), value);
        }
    }

    @Test
    void testJavaNumberLiteralsAreRejected() {
        OutputFileReader reader = new OutputFileReader("o1", new AggregationParameters(), ReportNode.NO_OP);
        for (String value : List.of("1d", "2f", "0x1p3", "Infinity")) {
            writeFile(file, valuesFileContent(Frequency.HOURLY, List.of("LOAD"), List.of(
                    List.of("1.5"),
                    List.of(value))));
            OutputParsingException e = assertThrows(OutputParsingException.class, () -> reader.read(file, Frequency.HOURLY), value);
            assertTrue(e.getMessage().contains("'" + value + "'"), value);
        }
    }

    @Test
    void testInfinityAndNanValues() {
        writeFile(file, valuesFileContent(Frequency.HOURLY, List.of("LOAD"), List.of(
                List.of("1.5"),
                List.of("inf"),
                List.of("nan"))));
        OutputFileReader.OutputFileContent content = new OutputFileReader("o1", new AggregationParameters(), ReportNode.NO_OP)
                .read(file, Frequency.HOURLY);
        List<Double> values = content.columns().get(0);
        assertEquals(1.5, values.get(0));
        assertEquals(Double.POSITIVE_INFINITY, values.get(1));
        assertTrue(values.get(2).isNaN());
    }

    @Test
    void testColumnCountMismatch() {
        writeFile(file, valuesFileContent(Frequency.HOURLY, List.of("LOAD", "GAS"), List.of(
                List.of("1", "2"),
                List.of("3"))));
        OutputFileReader reader = new OutputFileReader("o1", new AggregationParameters(), ReportNode.NO_OP);
        OutputParsingException e = assertThrows(OutputParsingException.class, () -> reader.read(file, Frequency.HOURLY));
        assertTrue(e.getMessage().contains("row 2 has 1 data columns but header has 2 labels"));
    }

    @Test
    void testTruncatedHeader() {
        writeFile(file, "area\tfr\thourly\n\tVARIABLES\tBEGIN\tEND\n");
        OutputFileReader reader = new OutputFileReader("o1", new AggregationParameters(), ReportNode.NO_OP);
        OutputParsingException e = assertThrows(OutputParsingException.class, () -> reader.read(file, Frequency.HOURLY));
        assertEquals("Could not parse file 'values-hourly.txt' of output 'o1': Header has 2 lines, expected 7", e.getMessage());
    }
}
