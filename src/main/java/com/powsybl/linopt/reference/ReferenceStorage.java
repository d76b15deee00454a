/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.reference;

import com.powsybl.linopt.array.Axis;
import com.powsybl.linopt.array.Matrix;
import com.powsybl.linopt.array.Vector;

import java.util.Optional;
import java.util.Set;

/**
 * Storage areas of the model owning the entities (generators, lines, ...): one static column per entity kind and
 * name, indexed by entity ids, and one time-varying table per entity kind and name, with snapshots as rows and
 * entity ids as columns.
 *
 * @author powsybl-linopt contributors
 */
public interface ReferenceStorage {

    Set<String> getEntityKinds();

    /**
     * @throws com.powsybl.commons.PowsyblException if the entity kind is unknown
     */
    Axis getEntityIds(String entityKind);

    Set<String> getStaticColumnNames(String entityKind);

    Optional<Vector<String>> getStaticColumn(String entityKind, String name);

    void setStaticColumn(String entityKind, String name, Vector<String> column);

    Optional<Vector<String>> removeStaticColumn(String entityKind, String name);

    Set<String> getTimeVaryingTableNames(String entityKind);

    Optional<Matrix<String>> getTimeVaryingTable(String entityKind, String name);

    void setTimeVaryingTable(String entityKind, String name, Matrix<String> table);

    Optional<Matrix<String>> removeTimeVaryingTable(String entityKind, String name);
}
