/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.powsybl.commons.config.PlatformConfig;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Parameters of an LP solve, loadable from the {@code linopt-default-parameters} platform config module.
 * <p>
 * Native solver options are given as a list of {@code name=value} entries.
 *
 * @author powsybl-linopt contributors
 */
public class LpSolverParameters {

    public static final String MODULE_NAME = "linopt-default-parameters";

    public static final String SOLVER_NAME_PARAM_NAME = "solverName";
    public static final String SOLVER_OPTIONS_PARAM_NAME = "solverOptions";
    public static final String NATIVE_SOLVER_OPTIONS_PARAM_NAME = "nativeSolverOptions";
    public static final String KEEP_FILES_PARAM_NAME = "keepFiles";
    public static final String STORE_BASIS_PARAM_NAME = "storeBasis";
    public static final String CBC_EXECUTABLE_PARAM_NAME = "cbcExecutable";
    public static final String GLPK_EXECUTABLE_PARAM_NAME = "glpkExecutable";
    public static final String NATIVE_SOLVER_NAME_PARAM_NAME = "nativeSolverName";

    public static final String SOLVER_NAME_DEFAULT_VALUE = "cbc";
    public static final String SOLVER_OPTIONS_DEFAULT_VALUE = "";
    public static final boolean KEEP_FILES_DEFAULT_VALUE = false;
    public static final boolean STORE_BASIS_DEFAULT_VALUE = true;
    public static final String CBC_EXECUTABLE_DEFAULT_VALUE = "cbc";
    public static final String GLPK_EXECUTABLE_DEFAULT_VALUE = "glpsol";
    public static final String NATIVE_SOLVER_NAME_DEFAULT_VALUE = "glop";

    private String solverName = SOLVER_NAME_DEFAULT_VALUE;

    private String solverOptions = SOLVER_OPTIONS_DEFAULT_VALUE;

    private Map<String, String> nativeSolverOptions = new LinkedHashMap<>();

    private boolean keepFiles = KEEP_FILES_DEFAULT_VALUE;

    private boolean storeBasis = STORE_BASIS_DEFAULT_VALUE;

    private String cbcExecutable = CBC_EXECUTABLE_DEFAULT_VALUE;

    private String glpkExecutable = GLPK_EXECUTABLE_DEFAULT_VALUE;

    private String nativeSolverName = NATIVE_SOLVER_NAME_DEFAULT_VALUE;

    private static String checkNotBlank(String value, String parameterName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Invalid value for parameter " + parameterName + ": '" + value + "'");
        }
        return value;
    }

    public String getSolverName() {
        return solverName;
    }

    public LpSolverParameters setSolverName(String solverName) {
        this.solverName = checkNotBlank(solverName, SOLVER_NAME_PARAM_NAME);
        return this;
    }

    /**
     * Free text appended to the solver command line.
     */
    public String getSolverOptions() {
        return solverOptions;
    }

    public LpSolverParameters setSolverOptions(String solverOptions) {
        this.solverOptions = Objects.requireNonNull(solverOptions);
        return this;
    }

    /**
     * Solver specific parameters of the in-process solver, by parameter name.
     */
    public Map<String, String> getNativeSolverOptions() {
        return Collections.unmodifiableMap(nativeSolverOptions);
    }

    public LpSolverParameters setNativeSolverOptions(Map<String, String> nativeSolverOptions) {
        this.nativeSolverOptions = new LinkedHashMap<>(Objects.requireNonNull(nativeSolverOptions));
        return this;
    }

    public boolean isKeepFiles() {
        return keepFiles;
    }

    public LpSolverParameters setKeepFiles(boolean keepFiles) {
        this.keepFiles = keepFiles;
        return this;
    }

    public boolean isStoreBasis() {
        return storeBasis;
    }

    public LpSolverParameters setStoreBasis(boolean storeBasis) {
        this.storeBasis = storeBasis;
        return this;
    }

    public String getCbcExecutable() {
        return cbcExecutable;
    }

    public LpSolverParameters setCbcExecutable(String cbcExecutable) {
        this.cbcExecutable = checkNotBlank(cbcExecutable, CBC_EXECUTABLE_PARAM_NAME);
        return this;
    }

    public String getGlpkExecutable() {
        return glpkExecutable;
    }

    public LpSolverParameters setGlpkExecutable(String glpkExecutable) {
        this.glpkExecutable = checkNotBlank(glpkExecutable, GLPK_EXECUTABLE_PARAM_NAME);
        return this;
    }

    /**
     * OR-Tools solver used in-process, for instance {@code glop}, {@code highs} or {@code pdlp}.
     */
    public String getNativeSolverName() {
        return nativeSolverName;
    }

    public LpSolverParameters setNativeSolverName(String nativeSolverName) {
        this.nativeSolverName = checkNotBlank(nativeSolverName, NATIVE_SOLVER_NAME_PARAM_NAME);
        return this;
    }

    public static LpSolverParameters load() {
        return load(PlatformConfig.defaultConfig());
    }

    public static LpSolverParameters load(PlatformConfig platformConfig) {
        LpSolverParameters parameters = new LpSolverParameters();
        platformConfig.getOptionalModuleConfig(MODULE_NAME)
            .ifPresent(config -> parameters
                .setSolverName(config.getStringProperty(SOLVER_NAME_PARAM_NAME, SOLVER_NAME_DEFAULT_VALUE))
                .setSolverOptions(config.getStringProperty(SOLVER_OPTIONS_PARAM_NAME, SOLVER_OPTIONS_DEFAULT_VALUE))
                .setNativeSolverOptions(parseNativeSolverOptions(config.getStringListProperty(NATIVE_SOLVER_OPTIONS_PARAM_NAME, Collections.emptyList())))
                .setKeepFiles(config.getBooleanProperty(KEEP_FILES_PARAM_NAME, KEEP_FILES_DEFAULT_VALUE))
                .setStoreBasis(config.getBooleanProperty(STORE_BASIS_PARAM_NAME, STORE_BASIS_DEFAULT_VALUE))
                .setCbcExecutable(config.getStringProperty(CBC_EXECUTABLE_PARAM_NAME, CBC_EXECUTABLE_DEFAULT_VALUE))
                .setGlpkExecutable(config.getStringProperty(GLPK_EXECUTABLE_PARAM_NAME, GLPK_EXECUTABLE_DEFAULT_VALUE))
                .setNativeSolverName(config.getStringProperty(NATIVE_SOLVER_NAME_PARAM_NAME, NATIVE_SOLVER_NAME_DEFAULT_VALUE)));
        return parameters;
    }

    public static LpSolverParameters load(Map<String, String> properties) {
        return new LpSolverParameters().update(properties);
    }

    private static Map<String, String> parseNativeSolverOptions(List<String> entries) {
        Map<String, String> options = new LinkedHashMap<>();
        for (String entry : entries) {
            if (entry.isBlank()) {
                continue;
            }
            int separator = entry.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException("Invalid native solver option '" + entry + "', expected name=value");
            }
            options.put(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
        }
        return options;
    }

    public LpSolverParameters update(Map<String, String> properties) {
        Optional.ofNullable(properties.get(SOLVER_NAME_PARAM_NAME))
                .ifPresent(this::setSolverName);
        Optional.ofNullable(properties.get(SOLVER_OPTIONS_PARAM_NAME))
                .ifPresent(this::setSolverOptions);
        Optional.ofNullable(properties.get(NATIVE_SOLVER_OPTIONS_PARAM_NAME))
                .ifPresent(prop -> this.setNativeSolverOptions(parseNativeSolverOptions(Arrays.asList(prop.split(",")))));
        Optional.ofNullable(properties.get(KEEP_FILES_PARAM_NAME))
                .ifPresent(prop -> this.setKeepFiles(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(STORE_BASIS_PARAM_NAME))
                .ifPresent(prop -> this.setStoreBasis(Boolean.parseBoolean(prop)));
        Optional.ofNullable(properties.get(CBC_EXECUTABLE_PARAM_NAME))
                .ifPresent(this::setCbcExecutable);
        Optional.ofNullable(properties.get(GLPK_EXECUTABLE_PARAM_NAME))
                .ifPresent(this::setGlpkExecutable);
        Optional.ofNullable(properties.get(NATIVE_SOLVER_NAME_PARAM_NAME))
                .ifPresent(this::setNativeSolverName);
        return this;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>(8);
        map.put(SOLVER_NAME_PARAM_NAME, solverName);
        map.put(SOLVER_OPTIONS_PARAM_NAME, solverOptions);
        map.put(NATIVE_SOLVER_OPTIONS_PARAM_NAME, nativeSolverOptions);
        map.put(KEEP_FILES_PARAM_NAME, keepFiles);
        map.put(STORE_BASIS_PARAM_NAME, storeBasis);
        map.put(CBC_EXECUTABLE_PARAM_NAME, cbcExecutable);
        map.put(GLPK_EXECUTABLE_PARAM_NAME, glpkExecutable);
        map.put(NATIVE_SOLVER_NAME_PARAM_NAME, nativeSolverName);
        return map;
    }

    @Override
    public String toString() {
        return "LpSolverParameters(" + toMap().entrySet().stream().map(e -> e.getKey() + "=" + e.getValue()).collect(Collectors.joining(", ")) + ")";
    }
}
