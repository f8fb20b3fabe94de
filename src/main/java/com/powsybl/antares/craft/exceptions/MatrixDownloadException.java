/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.exceptions;

import com.powsybl.commons.PowsyblException;

/**
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public class MatrixDownloadException extends PowsyblException {

    public MatrixDownloadException(String outputId, String filePath, String message) {
        super("Error downloading output matrix " + filePath + " of output " + outputId + ": " + message);
    }
}
