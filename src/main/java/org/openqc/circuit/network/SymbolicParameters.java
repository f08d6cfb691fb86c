/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import com.powsybl.commons.PowsyblException;
import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Symbol;

import java.util.*;

/**
 * Insertion-ordered registry of named circuit parameters and their current numeric value.
 *
 * @author open-qcircuit contributors
 */
public class SymbolicParameters {

    private final Map<Symbol, Double> values = new LinkedHashMap<>();

    public SymbolicParameters define(String name, double value) {
        return define(Symbol.of(name), value);
    }

    public SymbolicParameters define(Symbol symbol, double value) {
        if (values.containsKey(symbol)) {
            throw new PowsyblException("Parameter '" + symbol + "' is already defined");
        }
        values.put(symbol, value);
        return this;
    }

    public boolean isDefined(Symbol symbol) {
        return values.containsKey(symbol);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<Symbol> getSymbols() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public Map<Symbol, Double> getValues() {
        return Collections.unmodifiableMap(values);
    }

    public double getValue(Symbol symbol) {
        Double value = values.get(symbol);
        if (value == null) {
            throw new PowsyblException("Parameter '" + symbol + "' has not been initialized");
        }
        return value;
    }

    public Optional<Symbol> findSymbol(String name) {
        Symbol symbol = Symbol.of(name);
        return values.containsKey(symbol) ? Optional.of(symbol) : Optional.empty();
    }

    public Symbol setValue(String name, double value) {
        Symbol symbol = findSymbol(name)
                .orElseThrow(() -> new PowsyblException("Unknown parameter '" + name + "'"));
        values.put(symbol, value);
        return symbol;
    }

    public Map<Symbol, Expression> toSubstitutions() {
        Map<Symbol, Expression> substitutions = new LinkedHashMap<>();
        values.forEach((symbol, value) -> substitutions.put(symbol, Expression.constant(value)));
        return substitutions;
    }
}
