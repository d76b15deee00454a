/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.auto.service.AutoService;

/**
 * @author powsybl-linopt contributors
 */
@AutoService(SolverBackendFactory.class)
public class NativeModelSolverBackendFactory implements SolverBackendFactory {

    @Override
    public String getName() {
        return NativeModelSolverBackend.NAME;
    }

    @Override
    public SolverBackend create(LpSolverParameters parameters) {
        return new NativeModelSolverBackend();
    }
}
