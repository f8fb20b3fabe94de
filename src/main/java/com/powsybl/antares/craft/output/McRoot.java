/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output;

import com.powsybl.antares.craft.exceptions.McRootNotHandledException;

import java.util.Objects;

/**
 * Monte Carlo root of an output: results per individual year or synthesis across all years.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public enum McRoot {
    MC_IND("mc-ind", "ind"),
    MC_ALL("mc-all", "all");

    private final String folderName;

    private final String mcType;

    McRoot(String folderName, String mcType) {
        this.folderName = folderName;
        this.mcType = mcType;
    }

    public String getFolderName() {
        return folderName;
    }

    public String getMcType() {
        return mcType;
    }

    /**
     * Accepts either the short type ({@code ind}, {@code all}) or the folder name ({@code mc-ind}, {@code mc-all}).
     */
    public static McRoot fromMcType(String mcType) {
        Objects.requireNonNull(mcType);
        for (McRoot mcRoot : values()) {
            if (mcRoot.mcType.equals(mcType) || mcRoot.folderName.equals(mcType)) {
                return mcRoot;
            }
        }
        throw new McRootNotHandledException(mcType);
    }
}
