/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.energy;

import org.openqc.circuit.equations.Symbol;

/**
 * Names of the symbols appearing in Lagrangians and Hamiltonians. Indices start at 1.
 *
 * @author open-qcircuit contributors
 */
public final class EnergySymbols {

    private EnergySymbols() {
    }

    public static Symbol nodeFlux(int index) {
        return Symbol.indexed("φ", index);
    }

    public static Symbol nodeVelocity(int index) {
        return Symbol.indexed("vφ", index);
    }

    public static Symbol variable(int index) {
        return Symbol.indexed("θ", index);
    }

    public static Symbol velocity(int index) {
        return Symbol.indexed("vθ", index);
    }

    public static Symbol charge(int index) {
        return Symbol.indexed("Q", index);
    }

    public static Symbol chargeNumber(int index) {
        return Symbol.indexed("n", index);
    }

    public static Symbol offsetCharge(int index) {
        return Symbol.indexed("ng", index);
    }

    public static Symbol capacitance(int index) {
        return Symbol.indexed("C", index);
    }
}
