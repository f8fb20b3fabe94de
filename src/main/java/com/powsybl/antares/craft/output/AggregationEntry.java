/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Query of an aggregation: the dataset and frequency to read, optionally restricted to some Monte Carlo years, some
 * areas or links, and some columns. An empty restriction selects everything.
 * <p>
 * Column names are matched exactly for individual years values and as substrings otherwise.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public class AggregationEntry {

    private final OutputDataType dataType;

    private final Frequency frequency;

    private List<Integer> mcYears = Collections.emptyList();

    private List<String> typeIds = Collections.emptyList();

    private List<String> columnNames = Collections.emptyList();

    public AggregationEntry(OutputDataType dataType, Frequency frequency) {
        this.dataType = Objects.requireNonNull(dataType);
        this.frequency = Objects.requireNonNull(frequency);
    }

    public OutputDataType getDataType() {
        return dataType;
    }

    public Frequency getFrequency() {
        return frequency;
    }

    public List<Integer> getMcYears() {
        return mcYears;
    }

    public AggregationEntry setMcYears(Collection<Integer> mcYears) {
        this.mcYears = mcYears == null ? Collections.emptyList() : List.copyOf(mcYears);
        return this;
    }

    public List<String> getTypeIds() {
        return typeIds;
    }

    public AggregationEntry setTypeIds(Collection<String> typeIds) {
        this.typeIds = typeIds == null ? Collections.emptyList() : List.copyOf(typeIds);
        return this;
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public AggregationEntry setColumnNames(Collection<String> columnNames) {
        this.columnNames = columnNames == null ? Collections.emptyList() : List.copyOf(columnNames);
        return this;
    }

    /**
     * Query string of the aggregation endpoint of the remote API, for instance
     * {@code query_file=values&frequency=daily&mc_years=1,2&areas_ids=fr&format=csv}.
     */
    public String toApiQuery(OutputObjectType objectType) {
        Objects.requireNonNull(objectType);
        StringBuilder query = new StringBuilder()
                .append("query_file=").append(dataType.getFileToken())
                .append("&frequency=").append(frequency.getToken());
        if (!mcYears.isEmpty()) {
            query.append("&mc_years=").append(mcYears.stream().map(String::valueOf).collect(Collectors.joining(",")));
        }
        if (!typeIds.isEmpty()) {
            query.append('&').append(objectType.getFolderName()).append("_ids=").append(String.join(",", typeIds));
        }
        if (!columnNames.isEmpty()) {
            query.append("&columns_names=").append(String.join(",", columnNames));
        }
        return query.append("&format=csv").toString();
    }

    @Override
    public String toString() {
        return "AggregationEntry(dataType=" + dataType
                + ", frequency=" + frequency
                + ", mcYears=" + mcYears
                + ", typeIds=" + typeIds
                + ", columnNames=" + columnNames
                + ")";
    }
}
