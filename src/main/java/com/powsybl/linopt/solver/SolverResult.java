/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import java.nio.file.Path;
import java.util.*;

/**
 * Normalized outcome of a solve. Variable values, constraint duals and objective are only available when the
 * termination condition is {@link TerminationCondition#OPTIMAL}.
 *
 * @author powsybl-linopt contributors
 */
public final class SolverResult {

    private final String status;

    private final TerminationCondition terminationCondition;

    private final Map<String, Double> variableValues;

    private final Map<String, Double> constraintDuals;

    private final Double objectiveValue;

    private final Path basisFile;

    private SolverResult(String status, TerminationCondition terminationCondition, Map<String, Double> variableValues,
                         Map<String, Double> constraintDuals, Double objectiveValue, Path basisFile) {
        this.status = Objects.requireNonNull(status);
        this.terminationCondition = Objects.requireNonNull(terminationCondition);
        this.variableValues = variableValues;
        this.constraintDuals = constraintDuals;
        this.objectiveValue = objectiveValue;
        this.basisFile = basisFile;
    }

    public static SolverResult optimal(String status, Map<String, Double> variableValues, Map<String, Double> constraintDuals,
                                       double objectiveValue) {
        return new SolverResult(status, TerminationCondition.OPTIMAL,
                Collections.unmodifiableMap(new LinkedHashMap<>(variableValues)),
                Collections.unmodifiableMap(new LinkedHashMap<>(constraintDuals)),
                objectiveValue, null);
    }

    public static SolverResult notOptimal(String status, TerminationCondition terminationCondition) {
        if (terminationCondition == TerminationCondition.OPTIMAL) {
            throw new IllegalArgumentException("An optimal result must carry a solution");
        }
        return new SolverResult(status, terminationCondition, null, null, null, null);
    }

    public SolverResult withBasisFile(Path basisFile) {
        return new SolverResult(status, terminationCondition, variableValues, constraintDuals, objectiveValue, basisFile);
    }

    public String getStatus() {
        return status;
    }

    public TerminationCondition getTerminationCondition() {
        return terminationCondition;
    }

    public boolean isOptimal() {
        return terminationCondition == TerminationCondition.OPTIMAL;
    }

    public Optional<Map<String, Double>> getVariableValues() {
        return Optional.ofNullable(variableValues);
    }

    public Optional<Map<String, Double>> getConstraintDuals() {
        return Optional.ofNullable(constraintDuals);
    }

    public OptionalDouble getObjectiveValue() {
        return objectiveValue != null ? OptionalDouble.of(objectiveValue) : OptionalDouble.empty();
    }

    /**
     * Basis written by the solver, if one was requested and stored.
     */
    public Optional<Path> getBasisFile() {
        return Optional.ofNullable(basisFile);
    }

    @Override
    public String toString() {
        return "SolverResult(status=" + status
                + ", terminationCondition=" + terminationCondition
                + (objectiveValue != null ? ", objectiveValue=" + objectiveValue : "")
                + ")";
    }
}
