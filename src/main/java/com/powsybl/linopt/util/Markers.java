/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.util;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * Log markers, so that LP writing timings and raw solver output can be routed or filtered separately.
 *
 * @author powsybl-linopt contributors
 */
public final class Markers {

    public static final Marker PERFORMANCE_MARKER = MarkerFactory.getMarker("PERFORMANCE");

    public static final Marker SOLVER_OUTPUT_MARKER = MarkerFactory.getMarker("SOLVER_OUTPUT");

    private Markers() {
    }
}
