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
 * Thrown when an output exists but does not contain the expected Monte Carlo root folder.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public class OutputSubFolderNotFoundException extends PowsyblException {

    private final String outputId;

    private final String subFolder;

    public OutputSubFolderNotFoundException(String outputId, String subFolder) {
        super("The output '" + outputId + "' sub-folder '" + subFolder + "' does not exist");
        this.outputId = Objects.requireNonNull(outputId);
        this.subFolder = Objects.requireNonNull(subFolder);
    }

    public String getOutputId() {
        return outputId;
    }

    public String getSubFolder() {
        return subFolder;
    }
}
