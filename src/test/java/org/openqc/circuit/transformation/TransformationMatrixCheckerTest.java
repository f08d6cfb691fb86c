/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqc.circuit.network.CircuitFixtures;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.util.MatrixUtil;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author open-qcircuit contributors
 */
class TransformationMatrixCheckerTest {

    private Logger logger;

    private ListAppender<ILoggingEvent> listAppender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LoggerFactory.getLogger(TransformationMatrixChecker.class);
        logger.setLevel(Level.ALL);
        listAppender = new ListAppender<>();
        listAppender.start();
        logger.addAppender(listAppender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(listAppender);
    }

    private List<String> warnings() {
        return listAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .map(ILoggingEvent::getFormattedMessage)
                .toList();
    }

    @Test
    void testGeneratedMatrixIsConsistent() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        VariableTransformation transformation = new TransformationMatrixBuilder(network, BasisCompletion.HEURISTIC).build(true);
        VariableCategories categories = new TransformationMatrixChecker(network).check(transformation.matrix(), true);
        assertEquals(transformation.categories(), categories);
        assertTrue(warnings().isEmpty());
    }

    @Test
    void testUngroundedMatrix() {
        CircuitNetwork network = CircuitFixtures.transmon();
        DenseMatrix t = MatrixUtil.fromColumns(List.of(new double[] {1, 0}, new double[] {1, 1}), 2);
        VariableCategories categories = new TransformationMatrixChecker(network).check(t, true);
        assertEquals(List.of(1), categories.getPeriodic());
        assertEquals(1, categories.size());
        assertTrue(warnings().isEmpty());
    }

    @Test
    void testMissingModesReported() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        VariableCategories categories = new TransformationMatrixChecker(network).check(MatrixUtil.identity(3), true);
        assertEquals(List.of(1, 2, 3), categories.getExtended());
        assertEquals(List.of("Number of extra periodic modes found: 1", "Number of extra frozen modes found: 1"), warnings());

        listAppender.list.clear();
        new TransformationMatrixChecker(network).check(MatrixUtil.identity(3), false);
        assertTrue(warnings().isEmpty());
    }

    @Test
    void testInvalidMatrix() {
        CircuitNetwork network = CircuitFixtures.fluxQubit();
        TransformationMatrixChecker checker = new TransformationMatrixChecker(network);
        DenseMatrix singular = MatrixUtil.fromColumns(List.of(new double[] {1, 0, 0}, new double[] {2, 0, 0}, new double[] {0, 0, 1}), 3);
        PowsyblException e = assertThrows(PowsyblException.class, () -> checker.check(singular, true));
        assertEquals("The transformation matrix provided is not invertible", e.getMessage());

        e = assertThrows(PowsyblException.class, () -> checker.check(MatrixUtil.identity(2), true));
        assertEquals("Transformation matrix must be 3x3, got 2x2", e.getMessage());
    }
}
