/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.network;

import org.openqc.circuit.equations.Expression;
import org.openqc.circuit.equations.Symbol;

import java.util.Objects;
import java.util.Optional;

/**
 * Energy parameter of a branch: either a fixed number or a symbol whose value lives in {@link SymbolicParameters}.
 *
 * @author open-qcircuit contributors
 */
public final class BranchParameter {

    private final double value;

    private final Symbol symbol;

    private BranchParameter(double value, Symbol symbol) {
        this.value = value;
        this.symbol = symbol;
    }

    public static BranchParameter of(double value) {
        return new BranchParameter(value, null);
    }

    public static BranchParameter of(Symbol symbol) {
        return new BranchParameter(Double.NaN, Objects.requireNonNull(symbol));
    }

    public static BranchParameter symbolic(String name) {
        return of(Symbol.of(name));
    }

    public boolean isSymbolic() {
        return symbol != null;
    }

    public Optional<Symbol> getSymbol() {
        return Optional.ofNullable(symbol);
    }

    public double getValue(SymbolicParameters parameters) {
        return symbol != null ? parameters.getValue(symbol) : value;
    }

    public Expression toExpression() {
        return symbol != null ? symbol.toExpression() : Expression.constant(value);
    }

    /**
     * Expression with symbols replaced by their current value.
     */
    public Expression toExpression(SymbolicParameters parameters, boolean substitute) {
        return substitute ? Expression.constant(getValue(parameters)) : toExpression();
    }

    @Override
    public String toString() {
        return symbol != null ? symbol.getName() : Double.toString(value);
    }
}
