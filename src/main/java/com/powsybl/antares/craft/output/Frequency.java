/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output;

import com.powsybl.commons.PowsyblException;

import java.util.Objects;

/**
 * Temporal resolution of the rows of a result file.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public enum Frequency {
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    ANNUAL("annual");

    private final String token;

    Frequency(String token) {
        this.token = token;
    }

    /**
     * Name of the frequency as it appears in result file names, e.g. {@code values-daily.txt}.
     */
    public String getToken() {
        return token;
    }

    public static Frequency fromToken(String token) {
        Objects.requireNonNull(token);
        for (Frequency frequency : values()) {
            if (frequency.token.equals(token)) {
                return frequency;
            }
        }
        throw new PowsyblException("Unknown frequency '" + token + "'");
    }
}
