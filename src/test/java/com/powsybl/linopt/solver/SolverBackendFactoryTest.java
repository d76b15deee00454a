/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.auto.service.AutoService;
import com.powsybl.commons.PowsyblException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author powsybl-linopt contributors
 */
class SolverBackendFactoryTest {

    public static class SolverBackendMock implements SolverBackend {

        @Override
        public String getName() {
            return SolverBackendFactoryMock.NAME;
        }

        @Override
        public SolverResult solve(SolverFiles files, LpSolverParameters parameters) {
            return SolverResult.optimal("optimal", Map.of("x0", 1.0), Map.of(), 1.0);
        }
    }

    @AutoService(SolverBackendFactory.class)
    public static class SolverBackendFactoryMock implements SolverBackendFactory {

        public static final String NAME = "SolverBackendMock";

        @Override
        public String getName() {
            return NAME;
        }

        @Override
        public SolverBackend create(LpSolverParameters parameters) {
            return new SolverBackendMock();
        }
    }

    @TempDir
    Path workingDir;

    @Test
    void testFindAll() {
        Set<String> names = SolverBackendFactory.findAll().stream().map(SolverBackendFactory::getName).collect(Collectors.toSet());
        assertEquals(Set.of("cbc", "glpk", "native", "SolverBackendMock"), names);
    }

    @Test
    void testFind() {
        assertInstanceOf(CbcSolverBackend.class, SolverBackendFactory.find("cbc").create(new LpSolverParameters()));
        assertInstanceOf(GlpkSolverBackend.class, SolverBackendFactory.find("glpk").create(new LpSolverParameters()));
        assertInstanceOf(NativeModelSolverBackend.class, SolverBackendFactory.find("native").create(new LpSolverParameters()));
        PowsyblException e = assertThrows(PowsyblException.class, () -> SolverBackendFactory.find("cplex"));
        assertEquals("Solver backend 'cplex' not found", e.getMessage());
    }

    @Test
    void testLpSolver() {
        SolverFiles files = new SolverFiles(workingDir.resolve("problem.lp"), workingDir.resolve("problem.sol"));
        SolverResult result = LpSolver.solve(files, new LpSolverParameters().setSolverName(SolverBackendFactoryMock.NAME));
        assertTrue(result.isOptimal());
        assertEquals(Map.of("x0", 1.0), result.getVariableValues().orElseThrow());
    }
}
