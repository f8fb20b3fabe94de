/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output;

import com.powsybl.antares.craft.output.table.OutputTable;

/**
 * Access to the results of the outputs of a study.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public interface OutputService {

    /**
     * Reads a single result matrix.
     *
     * @param outputId the output id
     * @param filePath the path of the file under the {@code economy} folder of the output, without extension
     * @param frequency the frequency of the file
     */
    OutputTable getMatrix(String outputId, String filePath, Frequency frequency);

    /**
     * Aggregates the result files of an output matching the given entry.
     *
     * @param mcType {@code ind} or {@code all}
     */
    OutputTable aggregateValues(String outputId, AggregationEntry aggregationEntry, OutputObjectType objectType, String mcType);
}
