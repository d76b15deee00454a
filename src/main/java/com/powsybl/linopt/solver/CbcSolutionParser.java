/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.powsybl.linopt.writer.TokenType;

import java.io.BufferedReader;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads a solution file written by CBC with {@code -printingOptions all}:
 * <pre>
 * Optimal - objective value 3.5
 *       0 c0                     1                   0.5
 *       1 x0                   1.5                     0
 * </pre>
 * Rows violating a bound or constraint are prefixed with {@code **}.
 *
 * @author powsybl-linopt contributors
 */
public final class CbcSolutionParser {

    static final String OPTIMAL_PREFIX = "Optimal - objective value";

    private CbcSolutionParser() {
    }

    public static SolverResult parse(BufferedReader reader) throws IOException {
        String header = reader.readLine();
        if (header == null) {
            throw new SolutionParsingException("Empty CBC solution");
        }
        if (!header.startsWith(OPTIMAL_PREFIX)) {
            return header.contains("Infeasible")
                    ? SolverResult.notOptimal("infeasible", TerminationCondition.INFEASIBLE)
                    : SolverResult.notOptimal("other", TerminationCondition.OTHER);
        }
        double objective = parseNumber(header.substring(OPTIMAL_PREFIX.length()).trim(), header);

        Map<String, Double> variableValues = new LinkedHashMap<>();
        Map<String, Double> constraintDuals = new LinkedHashMap<>();
        String line;
        while ((line = reader.readLine()) != null) {
            String row = line.trim();
            if (row.startsWith("**")) {
                row = row.substring(2).trim();
            }
            if (row.isEmpty()) {
                continue;
            }
            String[] fields = row.split("\\s+");
            if (fields.length < 4) {
                throw new SolutionParsingException("Invalid CBC solution row: '" + line + "'");
            }
            String name = fields[1];
            if (TokenType.VARIABLE.matches(name)) {
                variableValues.put(name, parseNumber(fields[2], line));
            } else {
                constraintDuals.put(name, parseNumber(fields[3], line));
            }
        }
        return SolverResult.optimal("optimal", variableValues, constraintDuals, objective);
    }

    private static double parseNumber(String text, String line) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new SolutionParsingException("Invalid number '" + text + "' in CBC solution line '" + line + "'", e);
        }
    }
}
