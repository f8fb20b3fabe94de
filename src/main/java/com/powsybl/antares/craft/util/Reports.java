/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.util;

import com.powsybl.commons.report.ReportNode;
import com.powsybl.commons.report.TypedValue;

/**
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public final class Reports {

    private static final String OUTPUT_ID = "outputId";

    private Reports() {
    }

    public static ReportNode createOutputAggregationReporter(ReportNode reportNode, String outputId) {
        return reportNode.newReportNode()
                .withMessageTemplate("antares.outputAggregation")
                .withUntypedValue(OUTPUT_ID, outputId)
                .add();
    }

    public static void reportOutputFilesFound(ReportNode reportNode, int fileCount, String frequency) {
        reportNode.newReportNode()
                .withMessageTemplate("antares.outputFilesFound")
                .withUntypedValue("fileCount", fileCount)
                .withUntypedValue("frequency", frequency)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }

    public static void reportNoOutputFilesFound(ReportNode reportNode, String outputId) {
        reportNode.newReportNode()
                .withMessageTemplate("antares.noOutputFilesFound")
                .withUntypedValue(OUTPUT_ID, outputId)
                .withSeverity(TypedValue.ERROR_SEVERITY)
                .add();
    }

    public static void reportInconsistentEntities(ReportNode reportNode, String mcYear, String objectType) {
        reportNode.newReportNode()
                .withMessageTemplate("antares.inconsistentEntities")
                .withUntypedValue("mcYear", mcYear)
                .withUntypedValue("objectType", objectType)
                .withSeverity(TypedValue.WARN_SEVERITY)
                .add();
    }

    public static void reportSchemaInferenceFallback(ReportNode reportNode, String fileName) {
        reportNode.newReportNode()
                .withMessageTemplate("antares.schemaInferenceFallback")
                .withUntypedValue("fileName", fileName)
                .withSeverity(TypedValue.DEBUG_SEVERITY)
                .add();
    }

    public static void reportParquetChunksWritten(ReportNode reportNode, int fileCount, int columnCount) {
        reportNode.newReportNode()
                .withMessageTemplate("antares.parquetChunksWritten")
                .withUntypedValue("fileCount", fileCount)
                .withUntypedValue("columnCount", columnCount)
                .withSeverity(TypedValue.INFO_SEVERITY)
                .add();
    }
}
