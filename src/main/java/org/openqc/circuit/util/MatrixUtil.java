/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.util;

import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;
import com.powsybl.math.matrix.LUDecomposition;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.apache.commons.math3.util.Precision;

import java.util.ArrayList;
import java.util.List;

/**
 * Dense matrix and vector helpers. Vectors are plain {@code double[]}, matrices are powsybl {@link DenseMatrix};
 * rank and pseudo-inverse computations go through commons-math singular value decomposition.
 *
 * @author open-qcircuit contributors
 */
public final class MatrixUtil {

    private MatrixUtil() {
    }

    public static void round(DenseMatrix m, int digits) {
        for (int i = 0; i < m.getRowCount(); i++) {
            for (int j = 0; j < m.getColumnCount(); j++) {
                m.set(i, j, Precision.round(m.get(i, j), digits));
            }
        }
    }

    public static DenseMatrix identity(int size) {
        DenseMatrix m = new DenseMatrix(size, size);
        for (int i = 0; i < size; i++) {
            m.set(i, i, 1.);
        }
        return m;
    }

    public static DenseMatrix transpose(DenseMatrix m) {
        DenseMatrix transposed = new DenseMatrix(m.getColumnCount(), m.getRowCount());
        for (int i = 0; i < m.getRowCount(); i++) {
            for (int j = 0; j < m.getColumnCount(); j++) {
                transposed.set(j, i, m.get(i, j));
            }
        }
        return transposed;
    }

    public static DenseMatrix copy(DenseMatrix m) {
        DenseMatrix copy = new DenseMatrix(m.getRowCount(), m.getColumnCount());
        for (int i = 0; i < m.getRowCount(); i++) {
            for (int j = 0; j < m.getColumnCount(); j++) {
                copy.set(i, j, m.get(i, j));
            }
        }
        return copy;
    }

    public static RealMatrix toRealMatrix(DenseMatrix m) {
        RealMatrix real = new Array2DRowRealMatrix(m.getRowCount(), m.getColumnCount());
        for (int i = 0; i < m.getRowCount(); i++) {
            for (int j = 0; j < m.getColumnCount(); j++) {
                real.setEntry(i, j, m.get(i, j));
            }
        }
        return real;
    }

    public static DenseMatrix toDenseMatrix(RealMatrix m) {
        DenseMatrix dense = new DenseMatrix(m.getRowDimension(), m.getColumnDimension());
        for (int i = 0; i < m.getRowDimension(); i++) {
            for (int j = 0; j < m.getColumnDimension(); j++) {
                dense.set(i, j, m.getEntry(i, j));
            }
        }
        return dense;
    }

    public static double[] getColumn(DenseMatrix m, int column) {
        double[] values = new double[m.getRowCount()];
        for (int i = 0; i < values.length; i++) {
            values[i] = m.get(i, column);
        }
        return values;
    }

    public static List<double[]> getColumns(DenseMatrix m) {
        List<double[]> columns = new ArrayList<>(m.getColumnCount());
        for (int j = 0; j < m.getColumnCount(); j++) {
            columns.add(getColumn(m, j));
        }
        return columns;
    }

    public static DenseMatrix fromColumns(List<double[]> columns, int rowCount) {
        DenseMatrix m = new DenseMatrix(rowCount, columns.size());
        for (int j = 0; j < columns.size(); j++) {
            double[] column = columns.get(j);
            for (int i = 0; i < rowCount; i++) {
                m.set(i, j, column[i]);
            }
        }
        return m;
    }

    public static double dot(double[] a, double[] b) {
        double sum = 0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    public static int rank(DenseMatrix m) {
        if (m.getRowCount() == 0 || m.getColumnCount() == 0) {
            return 0;
        }
        return new SingularValueDecomposition(toRealMatrix(m)).getRank();
    }

    /**
     * Rank of the family of vectors, all of the same dimension.
     */
    public static int rank(List<double[]> vectors) {
        if (vectors.isEmpty()) {
            return 0;
        }
        return new SingularValueDecomposition(new Array2DRowRealMatrix(vectors.toArray(new double[0][]), false)).getRank();
    }

    public static boolean increasesRank(List<double[]> basis, double[] candidate) {
        List<double[]> extended = new ArrayList<>(basis);
        extended.add(candidate);
        return rank(extended) > rank(basis);
    }

    /**
     * Whether a vector lies in the span of the given vectors. Nothing lies in the span of an empty family.
     */
    public static boolean inSubspace(double[] vector, List<double[]> subspace) {
        if (subspace.isEmpty()) {
            return false;
        }
        List<double[]> extended = new ArrayList<>(subspace);
        extended.add(vector);
        return rank(extended) == rank(subspace);
    }

    public static DenseMatrix pseudoInverse(DenseMatrix m) {
        return toDenseMatrix(new SingularValueDecomposition(toRealMatrix(m)).getSolver().getInverse());
    }

    public static DenseMatrix inverse(DenseMatrix m) {
        if (m.getRowCount() != m.getColumnCount() || rank(m) < m.getRowCount()) {
            throw new PowsyblException("Matrix of size " + m.getRowCount() + "x" + m.getColumnCount() + " is not invertible");
        }
        DenseMatrix inverse = identity(m.getRowCount());
        try (LUDecomposition lu = copy(m).decomposeLU()) {
            lu.solve(inverse);
        }
        return inverse;
    }
}
