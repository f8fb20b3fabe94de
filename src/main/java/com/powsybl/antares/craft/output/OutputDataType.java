/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output;

/**
 * Dataset stored in a result file, e.g. {@code values} or {@code details}.
 * <p>
 * Implementations are enums, one per Monte Carlo root and object type, so that only the datasets the simulator
 * actually writes for a given folder can be queried.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public interface OutputDataType {

    /**
     * Prefix of the result file name, before the frequency.
     */
    String getFileToken();

    McRoot getMcRoot();

    OutputObjectType getObjectType();

    /**
     * Details datasets hold one group of columns per cluster and have to be reshaped.
     */
    default boolean isDetails() {
        return false;
    }

    default String getFileStem(Frequency frequency) {
        return getFileToken() + "-" + frequency.getToken();
    }
}
