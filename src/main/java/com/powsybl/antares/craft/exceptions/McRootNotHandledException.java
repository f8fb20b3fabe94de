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
public class McRootNotHandledException extends PowsyblException {

    public McRootNotHandledException(String mcRoot) {
        super("Unknown Monte Carlo root: " + mcRoot);
    }
}
