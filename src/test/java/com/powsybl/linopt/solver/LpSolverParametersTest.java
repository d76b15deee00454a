/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import com.powsybl.commons.config.InMemoryPlatformConfig;
import com.powsybl.commons.config.MapModuleConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-linopt contributors
 */
class LpSolverParametersTest {

    private InMemoryPlatformConfig platformConfig;

    private FileSystem fileSystem;

    @BeforeEach
    void setUp() {
        fileSystem = Jimfs.newFileSystem(Configuration.unix());
        platformConfig = new InMemoryPlatformConfig(fileSystem);
    }

    @AfterEach
    void tearDown() throws IOException {
        fileSystem.close();
    }

    @Test
    void testDefaultValues() {
        LpSolverParameters parameters = LpSolverParameters.load(platformConfig);
        assertEquals("cbc", parameters.getSolverName());
        assertEquals("", parameters.getSolverOptions());
        assertTrue(parameters.getNativeSolverOptions().isEmpty());
        assertFalse(parameters.isKeepFiles());
        assertTrue(parameters.isStoreBasis());
        assertEquals("cbc", parameters.getCbcExecutable());
        assertEquals("glpsol", parameters.getGlpkExecutable());
        assertEquals("glop", parameters.getNativeSolverName());
    }

    @Test
    void testDefaultConfig() {
        LpSolverParameters parameters = LpSolverParameters.load();
        assertEquals(LpSolverParameters.SOLVER_NAME_DEFAULT_VALUE, parameters.getSolverName());
    }

    @Test
    void testConfig() {
        MapModuleConfig moduleConfig = platformConfig.createModuleConfig("linopt-default-parameters");
        moduleConfig.setStringProperty("solverName", "glpk");
        moduleConfig.setStringProperty("solverOptions", "--tmlim 60");
        moduleConfig.setStringListProperty("nativeSolverOptions", List.of("use_dual_simplex=true", "max_number_of_iterations=1000"));
        moduleConfig.setStringProperty("keepFiles", "true");
        moduleConfig.setStringProperty("storeBasis", "false");
        moduleConfig.setStringProperty("glpkExecutable", "/usr/local/bin/glpsol");
        moduleConfig.setStringProperty("nativeSolverName", "highs");

        LpSolverParameters parameters = LpSolverParameters.load(platformConfig);

        assertEquals("glpk", parameters.getSolverName());
        assertEquals("--tmlim 60", parameters.getSolverOptions());
        assertEquals(Map.of("use_dual_simplex", "true", "max_number_of_iterations", "1000"), parameters.getNativeSolverOptions());
        assertTrue(parameters.isKeepFiles());
        assertFalse(parameters.isStoreBasis());
        assertEquals("cbc", parameters.getCbcExecutable());
        assertEquals("/usr/local/bin/glpsol", parameters.getGlpkExecutable());
        assertEquals("highs", parameters.getNativeSolverName());
    }

    @Test
    void testUpdate() {
        LpSolverParameters parameters = LpSolverParameters.load(Map.of(
                "solverName", "native",
                "nativeSolverOptions", "max_time_in_seconds=10,use_dual_simplex=true",
                "keepFiles", "true"));
        assertEquals("native", parameters.getSolverName());
        assertEquals(Map.of("max_time_in_seconds", "10", "use_dual_simplex", "true"), parameters.getNativeSolverOptions());
        assertTrue(parameters.isKeepFiles());
        assertTrue(parameters.isStoreBasis());

        parameters.update(Map.of("storeBasis", "false", "cbcExecutable", "cbc-2.10", "nativeSolverName", "pdlp"));
        assertEquals("native", parameters.getSolverName());
        assertEquals("pdlp", parameters.getNativeSolverName());
        assertFalse(parameters.isStoreBasis());
        assertEquals("cbc-2.10", parameters.getCbcExecutable());
    }

    @Test
    void testInvalidValues() {
        LpSolverParameters parameters = new LpSolverParameters();
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> parameters.setSolverName(" "));
        assertEquals("Invalid value for parameter solverName: ' '", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> parameters.setCbcExecutable(""));
        assertThrows(IllegalArgumentException.class, () -> parameters.setNativeSolverName(""));
        Map<String, String> properties = Map.of("nativeSolverOptions", "Threads");
        assertThrows(IllegalArgumentException.class, () -> parameters.update(properties));
    }

    @Test
    void testToString() {
        LpSolverParameters parameters = new LpSolverParameters().setNativeSolverOptions(Map.of("use_dual_simplex", "true"));
        assertEquals("LpSolverParameters(solverName=cbc, solverOptions=, nativeSolverOptions={use_dual_simplex=true}, "
                + "keepFiles=false, storeBasis=true, cbcExecutable=cbc, glpkExecutable=glpsol, nativeSolverName=glop)", parameters.toString());
    }

    @Test
    void testSolverFiles() {
        Path dir = fileSystem.getPath("/work");
        assertEquals(dir.resolve("network.bas"), new SolverFiles(dir.resolve("network.lp"), dir.resolve("network.sol")).getBasisFile());
        assertEquals(dir.resolve("network.out.bas"), new SolverFiles(dir.resolve("network.lp"), dir.resolve("network.out")).getBasisFile());
    }
}
