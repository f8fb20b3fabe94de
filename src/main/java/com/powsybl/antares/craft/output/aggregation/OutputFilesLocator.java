/**
 * Copyright (c) 2024, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.antares.craft.output.aggregation;

import com.powsybl.antares.craft.output.Frequency;
import com.powsybl.antares.craft.output.OutputDataType;
import com.powsybl.antares.craft.util.Reports;
import com.powsybl.commons.report.ReportNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds the result files matching a query under the Monte Carlo root of an output.
 * <p>
 * The areas or links are listed once, from the first Monte Carlo year, as the simulator writes the same ones for
 * every year.
 *
 * @author Thomas Perrin {@literal <thomas.perrin at rte-france.com>}
 */
public class OutputFilesLocator {

    private static final Logger LOGGER = LoggerFactory.getLogger(OutputFilesLocator.class);

    private final Path mcRootPath;

    private final OutputDataType dataType;

    private final Frequency frequency;

    private final Set<String> idsToConsider;

    private final Set<Integer> mcYears;

    private final AggregationParameters parameters;

    private final ReportNode reportNode;

    public OutputFilesLocator(Path mcRootPath, OutputDataType dataType, Frequency frequency, Collection<String> idsToConsider,
                              Collection<Integer> mcYears, AggregationParameters parameters, ReportNode reportNode) {
        this.mcRootPath = Objects.requireNonNull(mcRootPath);
        this.dataType = Objects.requireNonNull(dataType);
        this.frequency = Objects.requireNonNull(frequency);
        this.idsToConsider = new HashSet<>(Objects.requireNonNull(idsToConsider));
        this.mcYears = new HashSet<>(Objects.requireNonNull(mcYears));
        this.parameters = Objects.requireNonNull(parameters);
        this.reportNode = Objects.requireNonNull(reportNode);
    }

    /**
     * Returns the sorted paths of the matching files, or an empty list if nothing matches.
     */
    public List<Path> locate() {
        List<Path> files = switch (dataType.getMcRoot()) {
            case MC_IND -> locateIndividualYearsFiles();
            case MC_ALL -> {
                Path objectsPath = mcRootPath.resolve(dataType.getObjectType().getFolderName());
                yield locateFiles(objectsPath, filterIds(objectsPath));
            }
        };
        return files.stream().sorted().collect(Collectors.toList());
    }

    private List<Path> locateIndividualYearsFiles() {
        List<String> allMcYears = listDirectoryNames(mcRootPath).stream()
                .filter(OutputFilesLocator::isMcYear)
                .filter(year -> mcYears.isEmpty() || mcYears.contains(Integer.parseInt(year)))
                .collect(Collectors.toList());
        if (allMcYears.isEmpty()) {
            return Collections.emptyList();
        }

        String firstMcYear = allMcYears.get(0);
        Path firstYearObjectsPath = mcRootPath.resolve(firstMcYear).resolve(dataType.getObjectType().getFolderName());
        List<String> ids = filterIds(firstYearObjectsPath);
        if (parameters.isCheckEntitiesConsistency()) {
            checkEntitiesConsistency(allMcYears, listDirectoryNames(firstYearObjectsPath));
        }

        List<Path> files = new ArrayList<>();
        for (String mcYear : allMcYears) {
            files.addAll(locateFiles(mcRootPath.resolve(mcYear).resolve(dataType.getObjectType().getFolderName()), ids));
        }
        return files;
    }

    private static boolean isMcYear(String name) {
        return !name.isEmpty() && name.chars().allMatch(Character::isDigit);
    }

    private List<String> filterIds(Path objectsPath) {
        List<String> ids = listDirectoryNames(objectsPath);
        if (idsToConsider.isEmpty()) {
            return ids;
        }
        return ids.stream().filter(idsToConsider::contains).collect(Collectors.toList());
    }

    private List<Path> locateFiles(Path objectsPath, List<String> ids) {
        String expectedStem = dataType.getFileStem(frequency);
        List<Path> files = new ArrayList<>();
        for (String id : ids) {
            Path folder = objectsPath.resolve(id);
            if (!Files.isDirectory(folder)) {
                continue;
            }
            try (Stream<Path> stream = Files.list(folder)) {
                stream.filter(Files::isRegularFile)
                        .filter(file -> expectedStem.equals(stem(file)))
                        .forEach(files::add);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return files;
    }

    private void checkEntitiesConsistency(List<String> allMcYears, List<String> firstYearEntities) {
        String objectType = dataType.getObjectType().getFolderName();
        for (String mcYear : allMcYears.subList(1, allMcYears.size())) {
            List<String> entities = listDirectoryNames(mcRootPath.resolve(mcYear).resolve(objectType));
            if (!entities.equals(firstYearEntities)) {
                LOGGER.warn("Monte Carlo year {} does not contain the same {} as year {}: {} instead of {}",
                        mcYear, objectType, allMcYears.get(0), entities, firstYearEntities);
                Reports.reportInconsistentEntities(reportNode, mcYear, objectType);
            }
        }
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        return dotIndex > 0 ? name.substring(0, dotIndex) : name;
    }

    private static List<String> listDirectoryNames(Path folder) {
        if (!Files.isDirectory(folder)) {
            return Collections.emptyList();
        }
        try (Stream<Path> stream = Files.list(folder)) {
            return stream.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
