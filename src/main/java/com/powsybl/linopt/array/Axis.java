/**
 * Copyright (c) 2025, RTE (http://www.rte-france.com)
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package com.powsybl.linopt.array;

import java.util.*;

/**
 * Ordered set of unique labels attached to one dimension of an {@link LpArray}, typically entity ids or snapshots.
 * Two axes are equal when they hold the same labels at the same positions.
 *
 * @author powsybl-linopt contributors
 */
public final class Axis implements Iterable<String> {

    public static final Axis EMPTY = new Axis(Collections.emptyList());

    private final List<String> labels;

    private final Map<String, Integer> positions;

    private Axis(List<String> labels) {
        this.labels = Collections.unmodifiableList(labels);
        this.positions = new HashMap<>(labels.size());
        for (int i = 0; i < labels.size(); i++) {
            String label = Objects.requireNonNull(labels.get(i), "Axis label is null");
            if (positions.put(label, i) != null) {
                throw new IllegalArgumentException("Duplicate axis label: " + label);
            }
        }
    }

    public static Axis of(String... labels) {
        return of(Arrays.asList(labels));
    }

    public static Axis of(Collection<String> labels) {
        Objects.requireNonNull(labels);
        return labels.isEmpty() ? EMPTY : new Axis(new ArrayList<>(labels));
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public String get(int index) {
        return labels.get(index);
    }

    /**
     * @return position of the label, or -1 if not on this axis
     */
    public int indexOf(String label) {
        Integer position = positions.get(label);
        return position != null ? position : -1;
    }

    public boolean contains(String label) {
        return positions.containsKey(label);
    }

    public List<String> getLabels() {
        return labels;
    }

    @Override
    public Iterator<String> iterator() {
        return labels.iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj instanceof Axis other) {
            return labels.equals(other.labels);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return "Axis" + labels;
    }
}
