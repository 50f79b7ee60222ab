package com.bmsedge.analytics.util;

import com.bmsedge.analytics.exception.InvalidParameterException;
import com.bmsedge.analytics.exception.SingularMatrixException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.linear.RealMatrix;

/**
 * Dense solver for the small normal-equation systems built by least-squares fits.
 */
public final class LinearSystemSolver {

    static final double PIVOT_TOLERANCE = 1e-12;

    private LinearSystemSolver() {
    }

    /**
     * Solves A·x = b for a symmetric matrix A.
     * <p>
     * Cholesky decomposition is tried first. If A is not positive definite the system is solved
     * by LU decomposition with partial pivoting. Neither argument is modified.
     *
     * @throws SingularMatrixException when an LU pivot falls below 1e-12
     */
    public static double[] solveSymmetricPositiveDefinite(double[][] a, double[] b) {
        int n = a.length;
        if (n == 0) {
            throw new InvalidParameterException("Matrix must not be empty");
        }
        for (double[] row : a) {
            if (row.length != n) {
                throw new InvalidParameterException("Matrix must be square, found row of length "
                        + row.length + " in " + n + "x" + n + " system");
            }
        }
        if (b.length != n) {
            throw new InvalidParameterException("Right-hand side has length " + b.length + ", expected " + n);
        }

        RealMatrix matrix = new Array2DRowRealMatrix(a, true);
        DecompositionSolver solver = choleskySolver(matrix);
        if (solver == null) {
            solver = new LUDecomposition(matrix, PIVOT_TOLERANCE).getSolver();
        }
        if (!solver.isNonSingular()) {
            throw new SingularMatrixException(String.format(
                    "%dx%d system has an LU pivot below tolerance %.0e", n, n, PIVOT_TOLERANCE));
        }
        return solver.solve(new ArrayRealVector(b, true)).toArray();
    }

    /**
     * @return a Cholesky solver, or null when the matrix is not symmetric positive definite
     */
    static DecompositionSolver choleskySolver(RealMatrix matrix) {
        try {
            return new CholeskyDecomposition(matrix).getSolver();
        } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e) {
            return null;
        }
    }
}
