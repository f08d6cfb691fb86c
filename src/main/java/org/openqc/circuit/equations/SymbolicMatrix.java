/**
 * Copyright (c) 2026, the open-qcircuit contributors
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/.
 * SPDX-License-Identifier: MPL-2.0
 */
package org.openqc.circuit.equations;

import com.powsybl.commons.PowsyblException;
import com.powsybl.math.matrix.DenseMatrix;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Dense matrix of {@link Expression} entries.
 *
 * @author open-qcircuit contributors
 */
public class SymbolicMatrix {

    private final int rowCount;

    private final int columnCount;

    private final Expression[][] values;

    public SymbolicMatrix(int rowCount, int columnCount) {
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        values = new Expression[rowCount][columnCount];
        for (Expression[] row : values) {
            Arrays.fill(row, Expression.ZERO);
        }
    }

    public static SymbolicMatrix of(DenseMatrix m) {
        SymbolicMatrix symbolic = new SymbolicMatrix(m.getRowCount(), m.getColumnCount());
        for (int i = 0; i < m.getRowCount(); i++) {
            for (int j = 0; j < m.getColumnCount(); j++) {
                symbolic.values[i][j] = Expression.constant(m.get(i, j));
            }
        }
        return symbolic;
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public Expression get(int i, int j) {
        return values[i][j];
    }

    public void set(int i, int j, Expression value) {
        values[i][j] = value;
    }

    public void add(int i, int j, Expression value) {
        values[i][j] = values[i][j].add(value);
    }

    public boolean isConstant() {
        return Arrays.stream(values).flatMap(Arrays::stream).allMatch(Expression::isConstant);
    }

    public DenseMatrix toDenseMatrix() {
        DenseMatrix m = new DenseMatrix(rowCount, columnCount);
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < columnCount; j++) {
                if (!values[i][j].isConstant()) {
                    throw new PowsyblException("Matrix entry (" + i + ", " + j + ") is not numeric: " + values[i][j]);
                }
                m.set(i, j, values[i][j].getConstantValue());
            }
        }
        return m;
    }

    public SymbolicMatrix block(int firstRow, int firstColumn, int blockRowCount, int blockColumnCount) {
        SymbolicMatrix block = new SymbolicMatrix(blockRowCount, blockColumnCount);
        for (int i = 0; i < blockRowCount; i++) {
            System.arraycopy(values[firstRow + i], firstColumn, block.values[i], 0, blockColumnCount);
        }
        return block;
    }

    public SymbolicMatrix withoutRowAndColumn(int index) {
        SymbolicMatrix reduced = new SymbolicMatrix(rowCount - 1, columnCount - 1);
        for (int i = 0, ri = 0; i < rowCount; i++) {
            if (i == index) {
                continue;
            }
            for (int j = 0, rj = 0; j < columnCount; j++) {
                if (j != index) {
                    reduced.values[ri][rj++] = values[i][j];
                }
            }
            ri++;
        }
        return reduced;
    }

    /**
     * Congruence transform {@code t^T * this * t}.
     */
    public SymbolicMatrix congruence(DenseMatrix t) {
        if (t.getRowCount() != rowCount || rowCount != columnCount) {
            throw new PowsyblException("Incompatible congruence transform");
        }
        int n = t.getColumnCount();
        // this * t first
        SymbolicMatrix right = new SymbolicMatrix(rowCount, n);
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < n; j++) {
                Expression sum = Expression.ZERO;
                for (int k = 0; k < columnCount; k++) {
                    double tkj = t.get(k, j);
                    if (tkj != 0) {
                        sum = sum.add(values[i][k].multiply(tkj));
                    }
                }
                right.values[i][j] = sum;
            }
        }
        SymbolicMatrix result = new SymbolicMatrix(n, n);
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                Expression sum = Expression.ZERO;
                for (int k = 0; k < rowCount; k++) {
                    double tki = t.get(k, i);
                    if (tki != 0) {
                        sum = sum.add(right.values[k][j].multiply(tki));
                    }
                }
                result.values[i][j] = sum;
            }
        }
        return result;
    }

    /**
     * Quadratic form {@code v^T * this * v}.
     */
    public Expression quadraticForm(List<Expression> vector) {
        if (vector.size() != rowCount || rowCount != columnCount) {
            throw new PowsyblException("Vector size " + vector.size() + " does not match matrix size " + rowCount);
        }
        Expression result = Expression.ZERO;
        for (int i = 0; i < rowCount; i++) {
            if (vector.get(i).isZero()) {
                continue;
            }
            for (int j = 0; j < columnCount; j++) {
                if (!values[i][j].isZero() && !vector.get(j).isZero()) {
                    result = result.add(vector.get(i).multiply(values[i][j]).multiply(vector.get(j)));
                }
            }
        }
        return result;
    }

    public Expression determinant() {
        if (rowCount != columnCount) {
            throw new PowsyblException("Determinant of a non square matrix");
        }
        if (rowCount == 0) {
            return Expression.ONE;
        }
        if (rowCount == 1) {
            return values[0][0];
        }
        Expression det = Expression.ZERO;
        for (int j = 0; j < columnCount; j++) {
            if (values[0][j].isZero()) {
                continue;
            }
            Expression cofactor = minor(0, j).determinant().multiply(j % 2 == 0 ? 1 : -1);
            det = det.add(values[0][j].multiply(cofactor));
        }
        return det;
    }

    private SymbolicMatrix minor(int row, int column) {
        SymbolicMatrix minor = new SymbolicMatrix(rowCount - 1, columnCount - 1);
        for (int i = 0, mi = 0; i < rowCount; i++) {
            if (i == row) {
                continue;
            }
            for (int j = 0, mj = 0; j < columnCount; j++) {
                if (j != column) {
                    minor.values[mi][mj++] = values[i][j];
                }
            }
            mi++;
        }
        return minor;
    }

    /**
     * Inverse by adjugate over determinant, fully symbolic.
     */
    public SymbolicMatrix inverse() {
        Expression det = determinant();
        if (det.isZero()) {
            throw new PowsyblException("Matrix is singular");
        }
        Expression inverseDet = Reciprocal.of(det);
        SymbolicMatrix inverse = new SymbolicMatrix(rowCount, columnCount);
        if (rowCount == 1) {
            inverse.values[0][0] = inverseDet;
            return inverse;
        }
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < columnCount; j++) {
                Expression cofactor = minor(i, j).determinant().multiply((i + j) % 2 == 0 ? 1 : -1);
                inverse.values[j][i] = cofactor.multiply(inverseDet);
            }
        }
        return inverse;
    }

    public SymbolicMatrix map(UnaryOperator<Expression> operator) {
        SymbolicMatrix mapped = new SymbolicMatrix(rowCount, columnCount);
        for (int i = 0; i < rowCount; i++) {
            for (int j = 0; j < columnCount; j++) {
                mapped.values[i][j] = operator.apply(values[i][j]);
            }
        }
        return mapped;
    }

    public SymbolicMatrix substitute(Map<Symbol, Expression> substitutions) {
        return map(e -> e.substitute(substitutions));
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("[");
        for (int i = 0; i < rowCount; i++) {
            builder.append(i == 0 ? "[" : ", [");
            for (int j = 0; j < columnCount; j++) {
                builder.append(j == 0 ? "" : ", ").append(values[i][j]);
            }
            builder.append("]");
        }
        return builder.append("]").toString();
    }
}
