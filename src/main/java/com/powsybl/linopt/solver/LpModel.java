/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import com.google.ortools.modelbuilder.LinearConstraint;
import com.google.ortools.modelbuilder.ModelBuilder;
import com.google.ortools.modelbuilder.Variable;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;

/**
 * An OR-Tools model read from an LP file, with its variables and constraints indexed by token.
 *
 * @author powsybl-linopt contributors
 */
public class LpModel {

    private final ModelBuilder builder;

    private final Map<String, Variable> variables;

    private final Map<String, LinearConstraint> constraints;

    private final double objectiveOffset;

    LpModel(ModelBuilder builder, Map<String, Variable> variables, Map<String, LinearConstraint> constraints,
            double objectiveOffset) {
        this.builder = Objects.requireNonNull(builder);
        this.variables = Collections.unmodifiableMap(Objects.requireNonNull(variables));
        this.constraints = Collections.unmodifiableMap(Objects.requireNonNull(constraints));
        this.objectiveOffset = objectiveOffset;
    }

    public ModelBuilder getBuilder() {
        return builder;
    }

    public Map<String, Variable> getVariables() {
        return variables;
    }

    public Map<String, LinearConstraint> getConstraints() {
        return constraints;
    }

    /**
     * Constant part of the objective, which the model builder does not carry.
     */
    public double getObjectiveOffset() {
        return objectiveOffset;
    }
}
