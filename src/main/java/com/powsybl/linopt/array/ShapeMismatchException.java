/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.array;

import com.powsybl.commons.PowsyblException;

/**
 * Thrown when operands of an elementwise operation are not aligned.
 *
 * @author powsybl-linopt contributors
 */
public class ShapeMismatchException extends PowsyblException {

    public ShapeMismatchException(String msg) {
        super(msg);
    }
}
