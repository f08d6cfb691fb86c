/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import java.util.*;

/**
 * 1-based indices of transformed variables grouped by {@link VariableCategory}.
 *
 * @author open-qcircuit contributors
 */
public class VariableCategories {

    private final Map<VariableCategory, List<Integer>> indices = new EnumMap<>(VariableCategory.class);

    public VariableCategories() {
        for (VariableCategory category : VariableCategory.values()) {
            indices.put(category, new ArrayList<>());
        }
    }

    public VariableCategories add(VariableCategory category, int index) {
        indices.get(category).add(index);
        return this;
    }

    public List<Integer> get(VariableCategory category) {
        return Collections.unmodifiableList(indices.get(category));
    }

    public List<Integer> getPeriodic() {
        return get(VariableCategory.PERIODIC);
    }

    public List<Integer> getExtended() {
        return get(VariableCategory.EXTENDED);
    }

    public List<Integer> getFree() {
        return get(VariableCategory.FREE);
    }

    public List<Integer> getFrozen() {
        return get(VariableCategory.FROZEN);
    }

    public Optional<VariableCategory> getCategory(int index) {
        for (Map.Entry<VariableCategory, List<Integer>> e : indices.entrySet()) {
            if (e.getValue().contains(index)) {
                return Optional.of(e.getKey());
            }
        }
        return Optional.empty();
    }

    public int size() {
        return indices.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof VariableCategories other && indices.equals(other.indices);
    }

    @Override
    public int hashCode() {
        return indices.hashCode();
    }

    @Override
    public String toString() {
        return indices.toString();
    }
}
