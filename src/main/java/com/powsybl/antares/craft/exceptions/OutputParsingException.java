/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.exceptions;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * Thrown when a result file cannot be read: truncated header, labels not matching data columns, non numeric values.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public class OutputParsingException extends PowsyblException {

    private final String outputId;

    private final String fileName;

    public OutputParsingException(String outputId, String fileName, String message) {
        super("Could not parse file '" + fileName + "' of output '" + outputId + "': " + message);
        this.outputId = Objects.requireNonNull(outputId);
        this.fileName = Objects.requireNonNull(fileName);
    }

    public OutputParsingException(String outputId, String fileName, String message, Throwable cause) {
        super("Could not parse file '" + fileName + "' of output '" + outputId + "': " + message, cause);
        this.outputId = Objects.requireNonNull(outputId);
        this.fileName = Objects.requireNonNull(fileName);
    }

    public String getOutputId() {
        return outputId;
    }

    public String getFileName() {
        return fileName;
    }
}
