/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Product of atoms raised to non-zero integer exponents. The empty product is {@link #ONE}.
 *
 * @author open-qcircuit contributors
 */
public final class Monomial implements Comparable<Monomial> {

    public static final Monomial ONE = new Monomial(new TreeMap<>());

    private final SortedMap<Atom, Integer> powers;

    private final String text;

    private Monomial(SortedMap<Atom, Integer> powers) {
        this.powers = powers;
        this.text = powers.entrySet().stream()
                .map(e -> format(e.getKey(), e.getValue()))
                .collect(Collectors.joining("*"));
    }

    private static String format(Atom atom, int exponent) {
        return exponent == 1 ? atom.toString() : atom + "**" + (exponent < 0 ? "(" + exponent + ")" : exponent);
    }

    public static Monomial of(Atom atom) {
        return of(atom, 1);
    }

    public static Monomial of(Atom atom, int exponent) {
        Objects.requireNonNull(atom);
        if (exponent == 0) {
            return ONE;
        }
        SortedMap<Atom, Integer> powers = new TreeMap<>();
        powers.put(atom, exponent);
        return new Monomial(powers);
    }

    public Map<Atom, Integer> getPowers() {
        return Collections.unmodifiableMap(powers);
    }

    public int getExponent(Atom atom) {
        return powers.getOrDefault(atom, 0);
    }

    public boolean isOne() {
        return powers.isEmpty();
    }

    public boolean contains(Symbol symbol) {
        return powers.keySet().stream().anyMatch(atom -> atom.contains(symbol));
    }

    public Monomial multiply(Monomial other) {
        if (other.isOne()) {
            return this;
        }
        if (isOne()) {
            return other;
        }
        SortedMap<Atom, Integer> product = new TreeMap<>(powers);
        for (Map.Entry<Atom, Integer> e : other.powers.entrySet()) {
            int exponent = product.getOrDefault(e.getKey(), 0) + e.getValue();
            if (exponent == 0) {
                product.remove(e.getKey());
            } else {
                product.put(e.getKey(), exponent);
            }
        }
        return new Monomial(product);
    }

    public Monomial inverse() {
        SortedMap<Atom, Integer> inverse = new TreeMap<>();
        powers.forEach((atom, exponent) -> inverse.put(atom, -exponent));
        return new Monomial(inverse);
    }

    /**
     * Same monomial with the given atom removed.
     */
    public Monomial without(Atom atom) {
        if (!powers.containsKey(atom)) {
            return this;
        }
        SortedMap<Atom, Integer> remaining = new TreeMap<>(powers);
        remaining.remove(atom);
        return new Monomial(remaining);
    }

    @Override
    public int compareTo(Monomial other) {
        int c = Integer.compare(powers.isEmpty() ? 0 : 1, other.powers.isEmpty() ? 0 : 1);
        return c != 0 ? c : text.compareTo(other.text);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Monomial other && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return text.hashCode();
    }

    @Override
    public String toString() {
        return text;
    }
}
