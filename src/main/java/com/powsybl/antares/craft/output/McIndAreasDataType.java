/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output;

/**
 * Datasets written under {@code mc-ind/{year}/areas}.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public enum McIndAreasDataType implements OutputDataType {
    VALUES("values", false),
    DETAILS("details", true),
    DETAILS_ST_STORAGE("details-STstorage", true),
    DETAILS_RES("details-res", true);

    private final String fileToken;

    private final boolean details;

    McIndAreasDataType(String fileToken, boolean details) {
        this.fileToken = fileToken;
        this.details = details;
    }

    @Override
    public String getFileToken() {
        return fileToken;
    }

    @Override
    public McRoot getMcRoot() {
        return McRoot.MC_IND;
    }

    @Override
    public OutputObjectType getObjectType() {
        return OutputObjectType.AREAS;
    }

    @Override
    public boolean isDetails() {
        return details;
    }
}
