/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.util;

import org.slf4j.Marker;
import org.slf4j.MarkerFactory;

/**
 * @author open-qcircuit contributors
 */
public final class Markers {

    public static final Marker PERFORMANCE_MARKER = MarkerFactory.getMarker("PERFORMANCE");

    /**
     * Mismatches between a user supplied variable classification and the one found from the circuit.
     */
    public static final Marker CLASSIFICATION_MARKER = MarkerFactory.getMarker("CLASSIFICATION");

    private Markers() {
    }
}
