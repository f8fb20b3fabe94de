/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output;

import com.powsybl.antares.craft.output.table.OutputTable;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A simulation output of a study.
 *
 * @author Claire Marchand {@literal <claire.marchand at rte-france.com>}
 */
public class Output {

    static final String LINK_ID_SEPARATOR = " - ";

    private final String name;

    private final boolean archived;

    private final OutputService outputService;

    public Output(String name, boolean archived, OutputService outputService) {
        this.name = Objects.requireNonNull(name);
        this.archived = archived;
        this.outputService = Objects.requireNonNull(outputService);
    }

    public String getName() {
        return name;
    }

    public boolean isArchived() {
        return archived;
    }

    /**
     * Id of the link between two areas, the areas being sorted, e.g. {@code be - fr}.
     */
    public static String getLinkId(String area1, String area2) {
        Objects.requireNonNull(area1);
        Objects.requireNonNull(area2);
        return area1.compareTo(area2) <= 0 ? area1 + LINK_ID_SEPARATOR + area2 : area2 + LINK_ID_SEPARATOR + area1;
    }

    private static List<String> getLinkIds(Collection<Pair<String, String>> links) {
        if (links == null) {
            return null;
        }
        return links.stream().map(link -> getLinkId(link.getLeft(), link.getRight())).collect(Collectors.toList());
    }

    private static String getFilePath(OutputDataType dataType, Frequency frequency, String prefix, String id) {
        return prefix + "/" + dataType.getObjectType().getFolderName() + "/" + id + "/" + dataType.getFileStem(frequency);
    }

    private static String getMcYearFolder(int mcYear) {
        return McRoot.MC_IND.getFolderName() + "/" + String.format("%05d", mcYear);
    }

    public OutputTable getMcAllArea(Frequency frequency, McAllAreasDataType dataType, String area) {
        return outputService.getMatrix(name, getFilePath(dataType, frequency, McRoot.MC_ALL.getFolderName(), area), frequency);
    }

    public OutputTable getMcAllLink(Frequency frequency, McAllLinksDataType dataType, String areaFrom, String areaTo) {
        return outputService.getMatrix(name, getFilePath(dataType, frequency, McRoot.MC_ALL.getFolderName(), getLinkId(areaFrom, areaTo)), frequency);
    }

    public OutputTable getMcIndArea(int mcYear, Frequency frequency, McIndAreasDataType dataType, String area) {
        return outputService.getMatrix(name, getFilePath(dataType, frequency, getMcYearFolder(mcYear), area), frequency);
    }

    public OutputTable getMcIndLink(int mcYear, Frequency frequency, McIndLinksDataType dataType, String areaFrom, String areaTo) {
        return outputService.getMatrix(name, getFilePath(dataType, frequency, getMcYearFolder(mcYear), getLinkId(areaFrom, areaTo)), frequency);
    }

    private OutputTable aggregate(OutputDataType dataType, Frequency frequency, Collection<Integer> mcYears,
                                  Collection<String> typeIds, Collection<String> columnNames) {
        AggregationEntry entry = new AggregationEntry(dataType, frequency)
                .setMcYears(mcYears)
                .setTypeIds(typeIds)
                .setColumnNames(columnNames);
        return outputService.aggregateValues(name, entry, dataType.getObjectType(), dataType.getMcRoot().getMcType());
    }

    /**
     * Aggregates the individual years results of areas. Null or empty filters select everything.
     */
    public OutputTable aggregateMcIndAreas(McIndAreasDataType dataType, Frequency frequency, Collection<Integer> mcYears,
                                           Collection<String> areasIds, Collection<String> columnNames) {
        return aggregate(dataType, frequency, mcYears, areasIds, columnNames);
    }

    public OutputTable aggregateMcIndAreas(McIndAreasDataType dataType, Frequency frequency) {
        return aggregateMcIndAreas(dataType, frequency, null, null, null);
    }

    public OutputTable aggregateMcIndLinks(McIndLinksDataType dataType, Frequency frequency, Collection<Integer> mcYears,
                                           Collection<Pair<String, String>> links, Collection<String> columnNames) {
        return aggregate(dataType, frequency, mcYears, getLinkIds(links), columnNames);
    }

    public OutputTable aggregateMcIndLinks(McIndLinksDataType dataType, Frequency frequency) {
        return aggregateMcIndLinks(dataType, frequency, null, null, null);
    }

    public OutputTable aggregateMcAllAreas(McAllAreasDataType dataType, Frequency frequency, Collection<Integer> mcYears,
                                           Collection<String> areasIds, Collection<String> columnNames) {
        return aggregate(dataType, frequency, mcYears, areasIds, columnNames);
    }

    public OutputTable aggregateMcAllAreas(McAllAreasDataType dataType, Frequency frequency) {
        return aggregateMcAllAreas(dataType, frequency, null, null, null);
    }

    public OutputTable aggregateMcAllLinks(McAllLinksDataType dataType, Frequency frequency, Collection<Integer> mcYears,
                                           Collection<Pair<String, String>> links, Collection<String> columnNames) {
        return aggregate(dataType, frequency, mcYears, getLinkIds(links), columnNames);
    }

    public OutputTable aggregateMcAllLinks(McAllLinksDataType dataType, Frequency frequency) {
        return aggregateMcAllLinks(dataType, frequency, null, null, null);
    }
}
