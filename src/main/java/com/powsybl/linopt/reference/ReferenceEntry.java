/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.reference;

import java.util.Objects;

/**
 * Bookkeeping of one registered attribute: whether its tokens are stored in the time-varying tables or in the
 * static columns, and a free text describing which constraints or variables were written for it.
 *
 * @author powsybl-linopt contributors
 */
public record ReferenceEntry(boolean timeVarying, String specification) {

    public ReferenceEntry {
        Objects.requireNonNull(specification);
    }

    ReferenceEntry appendSpecification(String other) {
        if (specification.isEmpty()) {
            return new ReferenceEntry(timeVarying, other);
        }
        return new ReferenceEntry(timeVarying, specification + ", " + other);
    }
}
