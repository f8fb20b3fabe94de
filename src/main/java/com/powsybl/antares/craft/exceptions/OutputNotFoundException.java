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
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public class OutputNotFoundException extends PowsyblException {

    private final String outputId;

    public OutputNotFoundException(String outputId) {
        super("Output '" + outputId + "' not found");
        this.outputId = Objects.requireNonNull(outputId);
    }

    public String getOutputId() {
        return outputId;
    }
}
