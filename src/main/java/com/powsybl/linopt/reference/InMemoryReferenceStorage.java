/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.reference;

import com.powsybl.commons.PowsyblException;
import com.powsybl.linopt.array.Axis;
import com.powsybl.linopt.array.Matrix;
import com.powsybl.linopt.array.Vector;

import java.util.*;

/**
 * {@link ReferenceStorage} keeping columns and tables in memory, for models that do not have their own storage.
 *
 * @author powsybl-linopt contributors
 */
public class InMemoryReferenceStorage implements ReferenceStorage {

    private static final class EntityTables {

        private final Axis entityIds;

        private final Map<String, Vector<String>> staticColumns = new LinkedHashMap<>();

        private final Map<String, Matrix<String>> timeVaryingTables = new LinkedHashMap<>();

        private EntityTables(Axis entityIds) {
            this.entityIds = entityIds;
        }
    }

    private final Map<String, EntityTables> tablesByEntityKind = new LinkedHashMap<>();

    public InMemoryReferenceStorage addEntityKind(String entityKind, Axis entityIds) {
        Objects.requireNonNull(entityKind);
        Objects.requireNonNull(entityIds);
        if (tablesByEntityKind.containsKey(entityKind)) {
            throw new PowsyblException("Entity kind '" + entityKind + "' already exists");
        }
        tablesByEntityKind.put(entityKind, new EntityTables(entityIds));
        return this;
    }

    private EntityTables getTables(String entityKind) {
        EntityTables tables = tablesByEntityKind.get(Objects.requireNonNull(entityKind));
        if (tables == null) {
            throw new PowsyblException("Unknown entity kind '" + entityKind + "'");
        }
        return tables;
    }

    @Override
    public Set<String> getEntityKinds() {
        return Collections.unmodifiableSet(tablesByEntityKind.keySet());
    }

    @Override
    public Axis getEntityIds(String entityKind) {
        return getTables(entityKind).entityIds;
    }

    @Override
    public Set<String> getStaticColumnNames(String entityKind) {
        return Collections.unmodifiableSet(getTables(entityKind).staticColumns.keySet());
    }

    @Override
    public Optional<Vector<String>> getStaticColumn(String entityKind, String name) {
        return Optional.ofNullable(getTables(entityKind).staticColumns.get(name));
    }

    @Override
    public void setStaticColumn(String entityKind, String name, Vector<String> column) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(column);
        getTables(entityKind).staticColumns.put(name, column);
    }

    @Override
    public Optional<Vector<String>> removeStaticColumn(String entityKind, String name) {
        return Optional.ofNullable(getTables(entityKind).staticColumns.remove(name));
    }

    @Override
    public Set<String> getTimeVaryingTableNames(String entityKind) {
        return Collections.unmodifiableSet(getTables(entityKind).timeVaryingTables.keySet());
    }

    @Override
    public Optional<Matrix<String>> getTimeVaryingTable(String entityKind, String name) {
        return Optional.ofNullable(getTables(entityKind).timeVaryingTables.get(name));
    }

    @Override
    public void setTimeVaryingTable(String entityKind, String name, Matrix<String> table) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(table);
        getTables(entityKind).timeVaryingTables.put(name, table);
    }

    @Override
    public Optional<Matrix<String>> removeTimeVaryingTable(String entityKind, String name) {
        return Optional.ofNullable(getTables(entityKind).timeVaryingTables.remove(name));
    }
}
