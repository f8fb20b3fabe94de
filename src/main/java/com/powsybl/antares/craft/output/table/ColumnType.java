/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.table;

/**
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public enum ColumnType {
    STRING(String.class),
    INTEGER(Integer.class),
    DOUBLE(Double.class);

    private final Class<?> valueClass;

    ColumnType(Class<?> valueClass) {
        this.valueClass = valueClass;
    }

    public Class<?> getValueClass() {
        return valueClass;
    }

    public boolean accepts(Object value) {
        return value == null || valueClass.isInstance(value);
    }
}
