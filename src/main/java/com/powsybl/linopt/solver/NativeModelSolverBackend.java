/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.ortools.Loader;
import com.google.ortools.modelbuilder.LinearConstraint;
import com.google.ortools.modelbuilder.ModelSolver;
import com.google.ortools.modelbuilder.SolveStatus;
import com.google.ortools.modelbuilder.Variable;
import com.powsybl.commons.PowsyblException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Solves the problem in-process with an OR-Tools solver, reading values and duals from the solver instead of a
 * solution file.
 * <p>
 * Native solver options are passed to the solver as specific parameters, formatted {@code name:value}. Warm start
 * and basis storage are not available through the OR-Tools model solver: a warm start file is ignored and no basis
 * is stored.
 *
 * @author powsybl-linopt contributors
 */
public class NativeModelSolverBackend implements SolverBackend {

    private static final Logger LOGGER = LoggerFactory.getLogger(NativeModelSolverBackend.class);

    public static final String NAME = "native";

    public NativeModelSolverBackend() {
        Loader.loadNativeLibraries();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public SolverResult solve(SolverFiles files, LpSolverParameters parameters) {
        Objects.requireNonNull(files);
        Objects.requireNonNull(parameters);

        LpModel model = LpModelReader.read(files.getProblemFile());

        String solverName = parameters.getNativeSolverName();
        ModelSolver solver = new ModelSolver(solverName);
        if (!solver.solverIsSupported()) {
            throw new PowsyblException("OR-Tools solver '" + solverName + "' is not supported");
        }
        String specificParameters = formatSpecificParameters(parameters.getNativeSolverOptions());
        if (!specificParameters.isEmpty()) {
            solver.setSolverSpecificParameters(specificParameters);
        }
        files.getWarmStartFile().ifPresent(warmStartFile -> LOGGER.warn("Warm start file '{}' ignored by {} solver", warmStartFile, solverName));

        SolveStatus solveStatus = solve(solver, model, files.getLogFile());

        if (parameters.isStoreBasis()) {
            LOGGER.info("No model basis stored: not available with {} solver", solverName);
        }

        String status = solveStatus.name().toLowerCase(Locale.ROOT);
        TerminationCondition condition = TerminationCondition.fromStatus(status);
        LOGGER.info("Solver {} ({}) terminated with status '{}' ({})", NAME, solverName, status, condition);
        if (condition != TerminationCondition.OPTIMAL) {
            return SolverResult.notOptimal(status, condition);
        }

        Map<String, Double> variableValues = new LinkedHashMap<>();
        for (Map.Entry<String, Variable> e : model.getVariables().entrySet()) {
            variableValues.put(e.getKey(), solver.getValue(e.getValue()));
        }
        Map<String, Double> constraintDuals = new LinkedHashMap<>();
        for (Map.Entry<String, LinearConstraint> e : model.getConstraints().entrySet()) {
            constraintDuals.put(e.getKey(), solver.getDualValue(e.getValue()));
        }
        double objectiveValue = solver.getObjectiveValue() + model.getObjectiveOffset();

        if (!parameters.isKeepFiles()) {
            AbstractExternalSolverBackend.deleteFiles(files.getProblemFile());
        }
        return SolverResult.optimal(status, variableValues, constraintDuals, objectiveValue);
    }

    private static SolveStatus solve(ModelSolver solver, LpModel model, Optional<Path> logFile) {
        if (logFile.isEmpty()) {
            solver.enableOutput(false);
            return solver.solve(model.getBuilder());
        }
        try (BufferedWriter writer = Files.newBufferedWriter(logFile.get(), StandardCharsets.UTF_8)) {
            solver.setLogCallback(message -> {
                try {
                    writer.write(message);
                    if (!message.endsWith("\n")) {
                        writer.newLine();
                    }
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            solver.enableOutput(true);
            return solver.solve(model.getBuilder());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String formatSpecificParameters(Map<String, String> options) {
        return options.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining(" "));
    }
}
