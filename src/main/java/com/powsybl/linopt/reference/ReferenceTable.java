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
import com.powsybl.linopt.array.LpArray;
import com.powsybl.linopt.array.Matrix;
import com.powsybl.linopt.array.ShapeMismatchException;
import com.powsybl.linopt.array.Vector;
import org.apache.commons.lang3.tuple.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Records where the tokens returned by the LP writer are stored, per (entity kind, attribute), so that solved
 * values can be scattered back to the model once the problem is solved.
 * <p>
 * Tokens are stored in the model through a {@link ReferenceStorage}: in a static column indexed by entity ids, or
 * in a time-varying table with snapshots as rows and entity ids as columns. Variable and constraint references
 * are registered independently, the storage name being the attribute name suffixed by
 * {@link ReferenceKind#getSuffix()}.
 *
 * @author powsybl-linopt contributors
 */
public class ReferenceTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceTable.class);

    private final ReferenceStorage storage;

    private final Map<ReferenceKind, Map<Pair<String, String>, ReferenceEntry>> entries = new EnumMap<>(ReferenceKind.class);

    public ReferenceTable(ReferenceStorage storage) {
        this.storage = Objects.requireNonNull(storage);
        for (ReferenceKind kind : ReferenceKind.values()) {
            entries.put(kind, new LinkedHashMap<>());
        }
    }

    public ReferenceStorage getStorage() {
        return storage;
    }

    public void set(ReferenceKind kind, String entityKind, String attribute, LpArray<String> tokens, boolean timeVarying) {
        set(kind, entityKind, attribute, tokens, timeVarying, "");
    }

    /**
     * Registers tokens of an attribute and stores them. Nothing is done if there is no token.
     * <p>
     * Registering again an attribute with a non empty specification appends it to the existing one, otherwise
     * the entry is replaced. Time-varying tokens must be a labeled {@link Matrix} and are merged column-wise into
     * the existing table; static tokens must be a labeled {@link Vector} and are written at their entity ids.
     */
    public void set(ReferenceKind kind, String entityKind, String attribute, LpArray<String> tokens, boolean timeVarying,
                    String specification) {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(entityKind);
        Objects.requireNonNull(attribute);
        Objects.requireNonNull(tokens);
        Objects.requireNonNull(specification);
        if (tokens.isEmpty()) {
            return;
        }

        Map<Pair<String, String>, ReferenceEntry> kindEntries = entries.get(kind);
        Pair<String, String> key = Pair.of(entityKind, attribute);
        ReferenceEntry entry = kindEntries.get(key);
        if (entry != null && !specification.isEmpty()) {
            if (entry.timeVarying() != timeVarying) {
                throw new IllegalArgumentException("Reference " + entityKind + "." + attribute + " is already registered as "
                        + (entry.timeVarying() ? "time-varying" : "static"));
            }
            entry = entry.appendSpecification(specification);
        } else {
            entry = new ReferenceEntry(timeVarying, specification);
        }

        String name = kind.getStorageName(attribute);
        if (timeVarying) {
            setTimeVarying(entityKind, name, tokens);
        } else {
            setStatic(entityKind, name, tokens);
        }
        kindEntries.put(key, entry);
        LOGGER.trace("{} references of {}.{} registered ({})", tokens.getValues().size(), entityKind, attribute, kind);
    }

    private void setTimeVarying(String entityKind, String name, LpArray<String> tokens) {
        if (!(tokens instanceof Matrix<String> table) || !table.isLabeled()) {
            throw new IllegalArgumentException("Time-varying references must be a labeled matrix");
        }
        Matrix<String> merged = storage.getTimeVaryingTable(entityKind, name)
                .map(existing -> mergeColumns(existing, table))
                .orElse(table);
        Axis entityIds = storage.getEntityIds(entityKind);
        Axis columns = merged.getColumnAxis().orElseThrow();
        if (!columns.equals(entityIds) && columns.size() == entityIds.size() && entityIds.getLabels().containsAll(columns.getLabels())) {
            merged = reindexColumns(merged, entityIds);
        }
        storage.setTimeVaryingTable(entityKind, name, merged);
    }

    private static Matrix<String> mergeColumns(Matrix<String> existing, Matrix<String> update) {
        Axis rows = existing.getRowAxis().orElseThrow();
        if (!rows.equals(update.getRowAxis().orElseThrow())) {
            throw new ShapeMismatchException("Time-varying references have different snapshots: " + rows + " != " + update.getRowAxis().orElseThrow());
        }
        Axis existingColumns = existing.getColumnAxis().orElseThrow();
        Axis updateColumns = update.getColumnAxis().orElseThrow();
        List<String> mergedColumnLabels = new ArrayList<>(existingColumns.getLabels());
        for (String column : updateColumns) {
            if (!existingColumns.contains(column)) {
                mergedColumnLabels.add(column);
            }
        }
        Axis mergedColumns = Axis.of(mergedColumnLabels);
        List<String> values = new ArrayList<>(rows.size() * mergedColumns.size());
        for (int row = 0; row < rows.size(); row++) {
            for (String column : mergedColumns) {
                int updateColumn = updateColumns.indexOf(column);
                values.add(updateColumn != -1 ? update.get(row, updateColumn) : existing.get(row, existingColumns.indexOf(column)));
            }
        }
        return Matrix.of(rows, mergedColumns, values);
    }

    private static Matrix<String> reindexColumns(Matrix<String> table, Axis columns) {
        Axis rows = table.getRowAxis().orElseThrow();
        Axis tableColumns = table.getColumnAxis().orElseThrow();
        List<String> values = new ArrayList<>(rows.size() * columns.size());
        for (int row = 0; row < rows.size(); row++) {
            for (String column : columns) {
                values.add(table.get(row, tableColumns.indexOf(column)));
            }
        }
        return Matrix.of(rows, columns, values);
    }

    private void setStatic(String entityKind, String name, LpArray<String> tokens) {
        if (!(tokens instanceof Vector<String> update) || !update.isLabeled()) {
            throw new IllegalArgumentException("Static references must be a labeled vector");
        }
        Vector<String> column = storage.getStaticColumn(entityKind, name).orElse(null);
        Axis entityIds = column != null ? column.getAxis().orElseThrow() : storage.getEntityIds(entityKind);
        List<String> values = column != null
                ? new ArrayList<>(column.getValues())
                : new ArrayList<>(Collections.nCopies(entityIds.size(), null));
        Axis updateIds = update.getAxis().orElseThrow();
        for (int i = 0; i < updateIds.size(); i++) {
            int index = entityIds.indexOf(updateIds.get(i));
            if (index == -1) {
                throw new PowsyblException("Unknown " + entityKind + " '" + updateIds.get(i) + "'");
            }
            values.set(index, update.get(i));
        }
        storage.setStaticColumn(entityKind, name, Vector.of(entityIds, values));
    }

    public LpArray<String> get(ReferenceKind kind, String entityKind, String attribute) {
        return get(kind, entityKind, attribute, false);
    }

    /**
     * Gets the tokens of a registered attribute.
     *
     * @param consume if true, tokens are removed from the storage
     * @throws PowsyblException if the attribute is not registered or its tokens have already been consumed
     */
    public LpArray<String> get(ReferenceKind kind, String entityKind, String attribute, boolean consume) {
        ReferenceEntry entry = getEntry(kind, entityKind, attribute)
                .orElseThrow(() -> new PowsyblException("No " + kind.name().toLowerCase() + " reference registered for "
                        + entityKind + "." + attribute));
        String name = kind.getStorageName(attribute);
        Optional<? extends LpArray<String>> tokens;
        if (entry.timeVarying()) {
            tokens = consume ? storage.removeTimeVaryingTable(entityKind, name) : storage.getTimeVaryingTable(entityKind, name);
        } else {
            tokens = consume ? storage.removeStaticColumn(entityKind, name) : storage.getStaticColumn(entityKind, name);
        }
        return tokens.orElseThrow(() -> new PowsyblException("References '" + name + "' of " + entityKind + " not found in storage"));
    }

    /**
     * Maps the tokens of a registered attribute to solved values. Tokens without value, and entities without
     * token, give {@link Double#NaN}.
     */
    public LpArray<Double> resolve(ReferenceKind kind, String entityKind, String attribute, Map<String, Double> values,
                                   boolean consume) {
        Objects.requireNonNull(values);
        return get(kind, entityKind, attribute, consume)
                .map(token -> token == null ? Double.NaN : values.getOrDefault(token, Double.NaN));
    }

    public Optional<ReferenceEntry> getEntry(ReferenceKind kind, String entityKind, String attribute) {
        Objects.requireNonNull(kind);
        return Optional.ofNullable(entries.get(kind).get(Pair.of(entityKind, attribute)));
    }

    public Map<Pair<String, String>, ReferenceEntry> getEntries(ReferenceKind kind) {
        return Collections.unmodifiableMap(entries.get(Objects.requireNonNull(kind)));
    }

    /**
     * Removes every variable and constraint reference from the storage and drops all the entries.
     */
    public void clear() {
        clear(EnumSet.allOf(ReferenceKind.class));
    }

    public void clear(ReferenceKind kind) {
        clear(EnumSet.of(kind));
    }

    private void clear(Set<ReferenceKind> kinds) {
        int removed = 0;
        for (String entityKind : List.copyOf(storage.getEntityKinds())) {
            for (String name : List.copyOf(storage.getTimeVaryingTableNames(entityKind))) {
                if (matches(kinds, name)) {
                    storage.removeTimeVaryingTable(entityKind, name);
                    removed++;
                }
            }
            for (String name : List.copyOf(storage.getStaticColumnNames(entityKind))) {
                if (matches(kinds, name)) {
                    storage.removeStaticColumn(entityKind, name);
                    removed++;
                }
            }
        }
        kinds.forEach(kind -> entries.get(kind).clear());
        LOGGER.debug("{} stored references of kinds {} cleared", removed, kinds);
    }

    private static boolean matches(Set<ReferenceKind> kinds, String name) {
        return kinds.stream().anyMatch(kind -> kind.isStorageName(name));
    }
}
