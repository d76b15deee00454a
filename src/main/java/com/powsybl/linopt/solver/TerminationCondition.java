/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.solver;

import java.util.Objects;

/**
 * @author powsybl-linopt contributors
 */
public enum TerminationCondition {
    OPTIMAL,
    INFEASIBLE,
    UNBOUNDED,
    INFEASIBLE_OR_UNBOUNDED,
    OTHER;

    /**
     * Classifies a solver status text, for instance {@code "optimal"}, {@code "infeasible"} or
     * {@code "inf_or_unbd"}. Unknown status give {@link #OTHER}.
     */
    public static TerminationCondition fromStatus(String status) {
        Objects.requireNonNull(status);
        return switch (status.trim().toLowerCase()) {
            case "optimal" -> OPTIMAL;
            case "infeasible", "infeasible (final)", "primal infeasible" -> INFEASIBLE;
            case "unbounded", "primal unbounded" -> UNBOUNDED;
            case "inf_or_unbd", "infeasible or unbounded" -> INFEASIBLE_OR_UNBOUNDED;
            default -> OTHER;
        };
    }
}
