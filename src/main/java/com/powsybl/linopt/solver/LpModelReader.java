/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.ortools.modelbuilder.LinearConstraint;
import com.google.ortools.modelbuilder.LinearExpr;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.Variable;
import com.powsybl.commons.PowsyblException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Reads an LP file, as written by {@link com.powsybl.linopt.writer.LpProblemWriter}, into an OR-Tools
 * {@link ModelBuilder}.
 * <p>
 * Tokens must be separated by white spaces. Supported sections are the objective ({@code min} or {@code max}),
 * the labeled constraints ({@code s.t.} or {@code subject to}), {@code bounds}, {@code generals},
 * {@code binaries} and {@code end}. Variables not bounded explicitly get the LP default bounds
 * {@code [0, +inf)}.
 *
 * @author powsybl-linopt contributors
 */
public final class LpModelReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(LpModelReader.class);

    private static final Pattern BLOCK_COMMENT = Pattern.compile("\\\\\\*.*?\\*\\\\", Pattern.DOTALL);

    private static final Pattern LINE_COMMENT = Pattern.compile("\\\\[^\\n]*");

    private static final Splitter TOKEN_SPLITTER = Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

    private static final Set<String> SENSES = Set.of("<=", "=<", "<", ">=", "=>", ">", "=", "==");

    private static final Set<String> SECTION_KEYWORDS = Set.of("s.t.", "s.t", "st", "subject", "such", "bounds", "bound",
            "general", "generals", "gen", "integer", "integers", "binary", "binaries", "bin", "end");

    private record Expression(Map<String, Double> terms, double constant) {
    }

    private final List<String> tokens;

    private final ModelBuilder builder = new ModelBuilder();

    private final Map<String, Variable> variables = new LinkedHashMap<>();

    private final Map<String, LinearConstraint> constraints = new LinkedHashMap<>();

    private int position = 0;

    private LpModelReader(String text) {
        String uncommented = LINE_COMMENT.matcher(BLOCK_COMMENT.matcher(text).replaceAll(" ")).replaceAll(" ");
        tokens = TOKEN_SPLITTER.splitToList(uncommented);
    }

    public static LpModel read(Path file) {
        Objects.requireNonNull(file);
        try {
            return read(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static LpModel read(String text) {
        Objects.requireNonNull(text);
        LpModel model = new LpModelReader(text).read();
        LOGGER.debug("LP model read with {} variables and {} constraints", model.getVariables().size(),
                model.getConstraints().size());
        return model;
    }

    private LpModel read() {
        boolean maximize = readObjectiveSense();
        if (isLabel(peek())) {
            position++;
        }
        Expression objective = readExpression();
        var objectiveBuilder = LinearExpr.newBuilder();
        objective.terms().forEach((name, coefficient) -> objectiveBuilder.addTerm(getOrCreateVariable(name), coefficient));
        builder.optimize(objectiveBuilder.build(), maximize);

        while (position < tokens.size()) {
            String keyword = next().toLowerCase(Locale.ROOT);
            switch (keyword) {
                case "s.t.", "s.t", "st" -> readConstraints();
                case "subject", "such" -> {
                    next();
                    readConstraints();
                }
                case "bounds", "bound" -> readBounds();
                case "general", "generals", "gen", "integer", "integers" -> readIntegers(false);
                case "binary", "binaries", "bin" -> readIntegers(true);
                case "end" -> position = tokens.size();
                default -> throw new PowsyblException("Unexpected LP token '" + keyword + "'");
            }
        }
        return new LpModel(builder, variables, constraints, objective.constant());
    }

    private boolean readObjectiveSense() {
        String sense = next().toLowerCase(Locale.ROOT);
        return switch (sense) {
            case "min", "minimize", "minimise", "minimum" -> false;
            case "max", "maximize", "maximise", "maximum" -> true;
            default -> throw new PowsyblException("LP objective sense expected, got '" + sense + "'");
        };
    }

    private void readConstraints() {
        while (isLabel(peek())) {
            String label = next();
            String name = label.substring(0, label.length() - 1);
            Expression lhs = readExpression();
            String sense = next();
            if (!SENSES.contains(sense)) {
                throw new PowsyblException("Constraint sense expected in constraint '" + name + "', got '" + sense + "'");
            }
            Expression rhs = readExpression();
            addConstraint(name, lhs, sense, rhs);
        }
    }

    private void addConstraint(String name, Expression lhs, String sense, Expression rhs) {
        Map<String, Double> terms = new LinkedHashMap<>(lhs.terms());
        rhs.terms().forEach((variable, coefficient) -> terms.merge(variable, -coefficient, Double::sum));
        double bound = rhs.constant() - lhs.constant();
        var exprBuilder = LinearExpr.newBuilder();
        terms.forEach((variable, coefficient) -> exprBuilder.addTerm(getOrCreateVariable(variable), coefficient));
        double lb = Double.NEGATIVE_INFINITY;
        double ub = Double.POSITIVE_INFINITY;
        switch (sense) {
            case "<=", "=<", "<" -> ub = bound;
            case ">=", "=>", ">" -> lb = bound;
            default -> {
                lb = bound;
                ub = bound;
            }
        }
        if (constraints.containsKey(name)) {
            throw new PowsyblException("Duplicate LP constraint '" + name + "'");
        }
        constraints.put(name, builder.addLinearConstraint(exprBuilder.build(), lb, ub).withName(name));
    }

    private void readBounds() {
        while (position < tokens.size() && !isSectionKeyword(peek())) {
            String first = next();
            if (isNumber(first)) {
                // value <= x [<= value]
                double value = parseNumber(first);
                String sense = nextSense();
                String name = next();
                applyBound(name, reverse(sense), value);
                if (SENSES.contains(peek())) {
                    String upperSense = next();
                    applyBound(name, upperSense, parseNumber(next()));
                }
            } else if ("free".equalsIgnoreCase(peek())) {
                position++;
                Variable variable = getOrCreateVariable(first);
                variable.setLowerBound(Double.NEGATIVE_INFINITY);
                variable.setUpperBound(Double.POSITIVE_INFINITY);
            } else {
                String sense = nextSense();
                applyBound(first, sense, parseNumber(next()));
            }
        }
    }

    private void readIntegers(boolean binary) {
        while (position < tokens.size() && !isSectionKeyword(peek())) {
            Variable variable = getOrCreateVariable(next());
            variable.setIntegrality(true);
            if (binary) {
                variable.setLowerBound(0);
                variable.setUpperBound(1);
            }
        }
    }

    private void applyBound(String name, String sense, double value) {
        Variable variable = getOrCreateVariable(name);
        switch (sense) {
            case "<=", "=<", "<" -> variable.setUpperBound(value);
            case ">=", "=>", ">" -> variable.setLowerBound(value);
            default -> {
                variable.setLowerBound(value);
                variable.setUpperBound(value);
            }
        }
    }

    private static String reverse(String sense) {
        return switch (sense) {
            case "<=", "=<", "<" -> ">=";
            case ">=", "=>", ">" -> "<=";
            default -> "=";
        };
    }

    /**
     * Reads signed terms up to the next sense, label or section keyword. A number not followed by a variable
     * name is a constant.
     */
    private Expression readExpression() {
        Map<String, Double> terms = new LinkedHashMap<>();
        double constant = 0;
        double sign = 1;
        while (position < tokens.size()) {
            String token = peek();
            if (SENSES.contains(token) || isLabel(token) || isSectionKeyword(token)) {
                break;
            }
            position++;
            if (token.equals("+")) {
                continue;
            }
            if (token.equals("-")) {
                sign = -sign;
                continue;
            }
            if (isNumber(token)) {
                double value = sign * parseNumber(token);
                if (isVariableName(peek())) {
                    terms.merge(next(), value, Double::sum);
                } else {
                    constant += value;
                }
            } else {
                terms.merge(token, sign, Double::sum);
            }
            sign = 1;
        }
        return new Expression(terms, constant);
    }

    private Variable getOrCreateVariable(String name) {
        return variables.computeIfAbsent(name, n -> builder.newNumVar(0, Double.POSITIVE_INFINITY, n));
    }

    private String nextSense() {
        String sense = next();
        if (!SENSES.contains(sense)) {
            throw new PowsyblException("Bound sense expected, got '" + sense + "'");
        }
        return sense;
    }

    private String peek() {
        return position < tokens.size() ? tokens.get(position) : null;
    }

    private String next() {
        if (position >= tokens.size()) {
            throw new PowsyblException("Unexpected end of LP file");
        }
        return tokens.get(position++);
    }

    private static boolean isLabel(String token) {
        return token != null && token.length() > 1 && token.endsWith(":");
    }

    private static boolean isSectionKeyword(String token) {
        return token != null && SECTION_KEYWORDS.contains(token.toLowerCase(Locale.ROOT));
    }

    private static boolean isVariableName(String token) {
        return token != null && !isNumber(token) && !SENSES.contains(token) && !isLabel(token) && !isSectionKeyword(token)
                && !token.equals("+") && !token.equals("-");
    }

    private static boolean isNumber(String token) {
        char first = token.charAt(0);
        if ((first == '+' || first == '-') && token.length() > 1) {
            first = token.charAt(1);
        }
        return Character.isDigit(first) || first == '.' || isInfinity(token);
    }

    private static boolean isInfinity(String token) {
        String unsigned = token.startsWith("+") || token.startsWith("-") ? token.substring(1) : token;
        return unsigned.equalsIgnoreCase("inf") || unsigned.equalsIgnoreCase("infinity");
    }

    private static double parseNumber(String token) {
        if (isInfinity(token)) {
            return token.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
        }
        try {
            return Double.parseDouble(token);
        } catch (NumberFormatException e) {
            throw new PowsyblException("Invalid LP number '" + token + "'", e);
        }
    }
}
