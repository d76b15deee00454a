/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.common.collect.Lists;
import com.powsybl.commons.PowsyblException;

import java.util.List;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * @author powsybl-linopt contributors
 */
public interface SolverBackendFactory {

    static List<SolverBackendFactory> findAll() {
        return Lists.newArrayList(ServiceLoader.load(SolverBackendFactory.class, SolverBackendFactory.class.getClassLoader()).iterator());
    }

    static SolverBackendFactory find(String name) {
        Objects.requireNonNull(name);
        return findAll().stream().filter(sbf -> name.equals(sbf.getName()))
                .findFirst().orElseThrow(() -> new PowsyblException("Solver backend '" + name + "' not found"));
    }

    String getName();

    SolverBackend create(LpSolverParameters parameters);
}
