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
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public enum OutputObjectType {
    AREAS("areas", "area"),
    LINKS("links", "link");

    private final String folderName;

    private final String columnName;

    OutputObjectType(String folderName, String columnName) {
        this.folderName = folderName;
        this.columnName = columnName;
    }

    public String getFolderName() {
        return folderName;
    }

    /**
     * Name of the identity column holding the area or link id in aggregated tables.
     */
    public String getColumnName() {
        return columnName;
    }

    public static OutputObjectType fromFolderName(String folderName) {
        Objects.requireNonNull(folderName);
        for (OutputObjectType objectType : values()) {
            if (objectType.folderName.equals(folderName)) {
                return objectType;
            }
        }
        throw new PowsyblException("Unknown output object type '" + folderName + "'");
    }
}
