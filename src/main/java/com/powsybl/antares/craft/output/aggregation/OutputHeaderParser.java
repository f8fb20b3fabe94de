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

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parser of the 7 lines header block of a result file.
 * <p>
 * Lines 5 to 7 hold one label per column. Each data column is described by a triple whose components are, for
 * values files, the variable name, its unit and the statistic (EXP, std, min, max), and for details files, the
 * cluster id, the variable name and a dummy component.
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public final class OutputHeaderParser {

    public static final int HEADER_LINE_COUNT = 7;

    private static final int FIRST_LABEL_LINE = 4;

    private static final String SEPARATOR = "\t";

    private OutputHeaderParser() {
    }

    /**
     * Index of the first data column: the leading columns hold the time stamp, whose width depends on the frequency.
     */
    public static int getStartColumn(Frequency frequency) {
        return switch (frequency) {
            case ANNUAL -> 2;
            case MONTHLY -> 3;
            case WEEKLY -> 2;
            case DAILY -> 4;
            case HOURLY -> 5;
        };
    }

    public static List<Triple<String, String, String>> parse(List<String> headerLines, int startColumn) {
        if (headerLines.size() < HEADER_LINE_COUNT) {
            throw new PowsyblException("Header has " + headerLines.size() + " lines, expected " + HEADER_LINE_COUNT);
        }
        List<String[]> labelLines = new ArrayList<>(3);
        for (int i = FIRST_LABEL_LINE; i < HEADER_LINE_COUNT; i++) {
            String[] fields = headerLines.get(i).split(SEPARATOR, -1);
            int labelCount = Math.max(fields.length - startColumn, 0);
            String[] labels = new String[labelCount];
            System.arraycopy(fields, fields.length - labelCount, labels, 0, labelCount);
            labelLines.add(labels);
        }
        int labelCount = labelLines.get(0).length;
        for (String[] labels : labelLines) {
            if (labels.length != labelCount) {
                throw new PowsyblException("Header label lines have different lengths: " + labelCount + " and " + labels.length);
            }
        }
        List<Triple<String, String, String>> headers = new ArrayList<>(labelCount);
        for (int k = 0; k < labelCount; k++) {
            headers.add(Triple.of(labelLines.get(0)[k], labelLines.get(1)[k], labelLines.get(2)[k]));
        }
        return headers;
    }

    /**
     * Names of the columns of a values file: the variable name for individual years, the variable name followed by
     * the statistic for the synthesis.
     */
    public static List<String> normalizeColumnNames(McRoot mcRoot, List<Triple<String, String, String>> headers) {
        List<String> names = new ArrayList<>(headers.size());
        for (Triple<String, String, String> header : headers) {
            names.add(switch (mcRoot) {
                case MC_IND -> header.getLeft();
                case MC_ALL -> (header.getLeft() + " " + header.getRight()).toUpperCase(Locale.ROOT).strip();
            });
        }
        return names;
    }
}
