package com.bmsedge.analytics.util;

import com.bmsedge.analytics.exception.InvalidParameterException;
import com.bmsedge.analytics.exception.SingularMatrixException;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearSystemSolverTest {

    @Test
    @DisplayName("Should solve a positive definite system through Cholesky")
    void testSolvePositiveDefinite() {
        // Arrange
        double[][] a = {{4, 2, 0}, {2, 5, 1}, {0, 1, 3}};
        double[] expected = {1, -2, 3};
        double[] b = multiply(a, expected);

        // Act
        double[] x = LinearSystemSolver.solveSymmetricPositiveDefinite(a, b);

        // Assert
        assertArrayEquals(expected, x, 1e-10);
        assertNotNull(LinearSystemSolver.choleskySolver(new Array2DRowRealMatrix(a)));
    }

    @Test
    @DisplayName("Should fall back to LU for an indefinite symmetric matrix")
    void testFallbackForIndefiniteMatrix() {
        double[][] a = {{1, 2}, {2, 1}};
        double[] expected = {3, -1};
        double[] b = multiply(a, expected);

        assertNull(LinearSystemSolver.choleskySolver(new Array2DRowRealMatrix(a)));
        assertArrayEquals(expected, LinearSystemSolver.solveSymmetricPositiveDefinite(a, b), 1e-10);
    }

    @Test
    @DisplayName("Should report a singular matrix")
    void testSingularMatrix() {
        double[][] a = {{1, 2}, {2, 4}};

        SingularMatrixException ex = assertThrows(SingularMatrixException.class,
                () -> LinearSystemSolver.solveSymmetricPositiveDefinite(a, new double[]{1, 2}));
        assertTrue(ex.getMessage().contains("below tolerance"));
    }

    @Test
    @DisplayName("Should report a nearly singular matrix that fails the pivot tolerance")
    void testNearlySingularMatrix() {
        double[][] a = {{1, 1}, {1, 1 + 1e-14}};

        assertThrows(SingularMatrixException.class,
                () -> LinearSystemSolver.solveSymmetricPositiveDefinite(a, new double[]{1, 1}));
    }

    @Test
    @DisplayName("Should leave the inputs untouched")
    void testInputsNotModified() {
        double[][] a = {{1, 2}, {2, 1}};
        double[] b = {1, 5};

        LinearSystemSolver.solveSymmetricPositiveDefinite(a, b);

        assertArrayEquals(new double[]{1, 2}, a[0]);
        assertArrayEquals(new double[]{2, 1}, a[1]);
        assertArrayEquals(new double[]{1, 5}, b);
    }

    @Test
    @DisplayName("Should reject mismatched dimensions")
    void testDimensionMismatch() {
        assertThrows(InvalidParameterException.class,
                () -> LinearSystemSolver.solveSymmetricPositiveDefinite(new double[][]{{1, 0}, {0, 1}}, new double[]{1}));
        assertThrows(InvalidParameterException.class,
                () -> LinearSystemSolver.solveSymmetricPositiveDefinite(new double[][]{{1, 0}}, new double[]{1}));
        assertThrows(InvalidParameterException.class,
                () -> LinearSystemSolver.solveSymmetricPositiveDefinite(new double[0][0], new double[0]));
    }

    private static double[] multiply(double[][] a, double[] x) {
        double[] b = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            for (int j = 0; j < x.length; j++) {
                b[i] += a[i][j] * x[j];
            }
        }
        return b;
    }
}
