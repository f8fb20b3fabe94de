/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.aggregation;

import com.powsybl.antares.craft.output.Frequency;
import com.powsybl.antares.craft.output.McRoot;
import com.powsybl.commons.PowsyblException;
import org.apache.commons.lang3.tuple.Triple;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
class OutputHeaderParserTest {

    private static final List<String> HEADER = List.of(
            "fr\tarea\tva\thourly",
            "\tVARIABLES\tBEGIN\tEND",
            "\t2\t1\t168",
            "",
            "fr\thourly\t\t\t\tOV. COST\tLOAD",
            "\t\t\t\t\tEuro\tMWh",
            "\tindex\tday\tmonth\thourly\tEXP\tstd");

    @Test
    void testStartColumn() {
        assertEquals(2, OutputHeaderParser.getStartColumn(Frequency.ANNUAL));
        assertEquals(3, OutputHeaderParser.getStartColumn(Frequency.MONTHLY));
        assertEquals(2, OutputHeaderParser.getStartColumn(Frequency.WEEKLY));
        assertEquals(4, OutputHeaderParser.getStartColumn(Frequency.DAILY));
        assertEquals(5, OutputHeaderParser.getStartColumn(Frequency.HOURLY));
        assertEquals(OutputHeaderParser.getStartColumn(Frequency.DAILY) + 1, OutputHeaderParser.getStartColumn(Frequency.HOURLY));
    }

    @Test
    void testParse() {
        List<Triple<String, String, String>> headers = OutputHeaderParser.parse(HEADER, 5);
        assertEquals(List.of(Triple.of("OV. COST", "Euro", "EXP"), Triple.of("LOAD", "MWh", "std")), headers);
    }

    @Test
    void testParseTooShort() {
        List<String> lines = HEADER.subList(0, 6);
        PowsyblException e = assertThrows(PowsyblException.class, () -> OutputHeaderParser.parse(lines, 5));
        assertEquals("Header has 6 lines, expected 7", e.getMessage());
    }

    @Test
    void testParseDifferentLengths() {
        List<String> lines = List.of("", "", "", "",
                "\t\tA\tB",
                "\t\tMWh",
                "\t\tEXP\tEXP");
        assertThrows(PowsyblException.class, () -> OutputHeaderParser.parse(lines, 2));
    }

    @Test
    void testNormalizeColumnNames() {
        List<Triple<String, String, String>> headers = List.of(Triple.of("OV. COST", "Euro", "EXP"), Triple.of("Load", "MWh", ""));
        assertEquals(List.of("OV. COST", "Load"), OutputHeaderParser.normalizeColumnNames(McRoot.MC_IND, headers));
        assertEquals(List.of("OV. COST EXP", "LOAD"), OutputHeaderParser.normalizeColumnNames(McRoot.MC_ALL, headers));
    }
}
