/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.transformation;

import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import org.apache.commons.math3.linear.*;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;
import org.openqc.circuit.network.CircuitMatrices;
import org.openqc.circuit.network.CircuitNetwork;
import org.openqc.circuit.util.MatrixUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Normal mode decomposition of a purely harmonic circuit: solves {@code L v = lambda C v} on the transformed
 * inductance and capacitance matrices. Directions with no capacitance give infinite eigenvalues, directions with
 * no inductance give zero ones.
 *
 * @author open-qcircuit contributors
 */
public class HarmonicTransformation {

    private static final Logger LOGGER = LoggerFactory.getLogger(HarmonicTransformation.class);

    private static final int EIGENVALUE_DIGITS = 10;

    private static final double DEGENERACY_THRESHOLD = 1e-10;

    private static final double NULL_EIGENVALUE_THRESHOLD = 1e-10;

    private final CircuitNetwork network;

    private final BasisCompletion basisCompletion;

    public HarmonicTransformation(CircuitNetwork network, BasisCompletion basisCompletion) {
        this.network = Objects.requireNonNull(network);
        this.basisCompletion = Objects.requireNonNull(basisCompletion);
    }

    private record Mode(double eigenvalue, RealVector vector) {

        int group() {
            if (Double.isInfinite(eigenvalue)) {
                return 2;
            }
            return eigenvalue == 0 ? 1 : 0;
        }
    }

    public HarmonicModes compute() {
        if (!network.isPurelyHarmonic()) {
            throw new PowsyblException("Normal modes are only defined for circuits without junctions");
        }
        DenseMatrix t = new TransformationMatrixBuilder(network, basisCompletion).build(true).matrix();
        int n = network.getNodeCount();
        int size = network.isGrounded() ? n : n - 1;
        if (size == 0) {
            return new HarmonicModes(new double[0], t);
        }
        RealMatrix tr = MatrixUtil.toRealMatrix(t);
        RealMatrix c = reduce(tr.transpose().multiply(MatrixUtil.toRealMatrix(CircuitMatrices.numericCapacitance(network))).multiply(tr), size);
        RealMatrix l = reduce(tr.transpose().multiply(MatrixUtil.toRealMatrix(CircuitMatrices.numericInductance(network))).multiply(tr), size);

        List<Mode> modes = solve(l, c);
        modes.sort(Comparator.comparingInt(Mode::group).thenComparingDouble(Mode::eigenvalue));
        orthogonalizeDegenerate(modes, c);

        RealMatrix v = new Array2DRowRealMatrix(size, size);
        for (int j = 0; j < size; j++) {
            v.setColumnVector(j, modes.get(j).vector());
        }
        RealMatrix leading = tr.getSubMatrix(0, n - 1, 0, size - 1).multiply(v);
        for (int j = 0; j < size; j++) {
            leading.setColumnVector(j, orient(leading.getColumnVector(j)));
        }
        DenseMatrix transformed = MatrixUtil.copy(t);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < size; j++) {
                transformed.set(i, j, leading.getEntry(i, j));
            }
        }

        double[] frequencies = modes.stream()
                .filter(mode -> mode.group() == 0)
                .mapToDouble(mode -> FastMath.sqrt(mode.eigenvalue()))
                .toArray();
        LOGGER.info("Normal mode frequencies: {}", Arrays.toString(frequencies));
        return new HarmonicModes(frequencies, transformed);
    }

    private static RealMatrix reduce(RealMatrix m, int size) {
        RealMatrix sub = m.getSubMatrix(0, size - 1, 0, size - 1);
        return sub.add(sub.transpose()).scalarMultiply(0.5);
    }

    /**
     * Generalized eigenproblem with a symmetric positive semi-definite right-hand side. The problem is restricted
     * to the range of c after eliminating the null space directions of c through their stationarity condition.
     */
    private static List<Mode> solve(RealMatrix l, RealMatrix c) {
        int size = c.getRowDimension();
        EigenDecomposition cEigen = new EigenDecomposition(c);
        double[] d = cEigen.getRealEigenvalues();
        double maxD = Arrays.stream(d).map(FastMath::abs).max().orElse(0);
        List<Integer> range = new ArrayList<>();
        List<Integer> kernel = new ArrayList<>();
        for (int i = 0; i < size; i++) {
            if (FastMath.abs(d[i]) > NULL_EIGENVALUE_THRESHOLD * FastMath.max(maxD, 1)) {
                range.add(i);
            } else {
                kernel.add(i);
            }
        }
        RealMatrix q = columns(cEigen.getV(), range, size);
        RealMatrix p = columns(cEigen.getV(), kernel, size);

        RealMatrix lqq = q == null ? null : q.transpose().multiply(l).multiply(q);
        RealMatrix back = null;
        if (q != null && p != null) {
            RealMatrix lpq = p.transpose().multiply(l).multiply(q);
            RealMatrix lppInverse = new SingularValueDecomposition(p.transpose().multiply(l).multiply(p)).getSolver().getInverse();
            back = lppInverse.multiply(lpq).scalarMultiply(-1);
            lqq = lqq.add(lpq.transpose().multiply(back));
        }

        List<Mode> modes = new ArrayList<>(size);
        if (q != null) {
            int r = range.size();
            RealMatrix scale = new Array2DRowRealMatrix(r, r);
            for (int i = 0; i < r; i++) {
                scale.setEntry(i, i, 1 / FastMath.sqrt(d[range.get(i)]));
            }
            RealMatrix s = scale.multiply(lqq).multiply(scale);
            EigenDecomposition sEigen = new EigenDecomposition(s.add(s.transpose()).scalarMultiply(0.5));
            for (int k = 0; k < r; k++) {
                RealVector a = scale.operate(sEigen.getEigenvector(k));
                RealVector vector = q.operate(a);
                if (back != null) {
                    vector = vector.add(p.operate(back.operate(a)));
                }
                double eigenvalue = Precision.round(sEigen.getRealEigenvalue(k), EIGENVALUE_DIGITS);
                modes.add(new Mode(eigenvalue == 0 ? 0 : eigenvalue, normalize(vector)));
            }
        }
        if (p != null) {
            for (int k = 0; k < kernel.size(); k++) {
                modes.add(new Mode(Double.POSITIVE_INFINITY, normalize(p.getColumnVector(k))));
            }
        }
        return modes;
    }

    private static RealMatrix columns(RealMatrix m, List<Integer> indices, int size) {
        if (indices.isEmpty()) {
            return null;
        }
        RealMatrix selected = new Array2DRowRealMatrix(size, indices.size());
        for (int j = 0; j < indices.size(); j++) {
            selected.setColumnVector(j, m.getColumnVector(indices.get(j)));
        }
        return selected;
    }

    /**
     * Unit 2-norm, first significant entry positive.
     */
    private static RealVector normalize(RealVector vector) {
        return orient(vector.unitVector());
    }

    private static RealVector orient(RealVector vector) {
        for (int i = 0; i < vector.getDimension(); i++) {
            if (FastMath.abs(vector.getEntry(i)) > DEGENERACY_THRESHOLD) {
                return vector.getEntry(i) < 0 ? vector.mapMultiply(-1) : vector;
            }
        }
        return vector;
    }

    /**
     * Gram-Schmidt with the capacitance metric inside each group of equal finite non-zero eigenvalues.
     */
    private static void orthogonalizeDegenerate(List<Mode> modes, RealMatrix c) {
        int start = 0;
        while (start < modes.size()) {
            int end = start + 1;
            while (end < modes.size() && modes.get(end).group() == 0 && modes.get(start).group() == 0
                    && FastMath.abs(modes.get(end).eigenvalue() - modes.get(start).eigenvalue()) < DEGENERACY_THRESHOLD) {
                end++;
            }
            for (int i = start + 1; i < end; i++) {
                RealVector vector = modes.get(i).vector();
                RealVector projection = new ArrayRealVector(vector.getDimension());
                for (int j = start; j < i; j++) {
                    RealVector ortho = modes.get(j).vector();
                    projection = projection.add(ortho.mapMultiply(c.operate(vector).dotProduct(ortho) / c.operate(ortho).dotProduct(ortho)));
                }
                modes.set(i, new Mode(modes.get(i).eigenvalue(), vector.subtract(projection)));
            }
            start = end;
        }
    }
}
