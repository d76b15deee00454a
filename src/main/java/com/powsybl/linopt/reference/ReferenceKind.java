/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.reference;

/**
 * What a stored token array refers to. The suffix is appended to the attribute name to build the storage name,
 * so that variable and constraint references of a same attribute can coexist.
 *
 * @author powsybl-linopt contributors
 */
public enum ReferenceKind {
    VARIABLE("_varref"),
    CONSTRAINT("_conref");

    private final String suffix;

    ReferenceKind(String suffix) {
        this.suffix = suffix;
    }

    public String getSuffix() {
        return suffix;
    }

    public String getStorageName(String attribute) {
        return attribute + suffix;
    }

    public boolean isStorageName(String name) {
        return name.endsWith(suffix);
    }
}
