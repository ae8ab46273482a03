package org.openet.sharpen.regression;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;

import java.util.Arrays;

/**
 * Accumulates the normal equations of a small linear least squares problem and solves them with
 * the pseudo-inverse, so that rank deficient problems (e.g. spatially uniform predictors) yield
 * the minimum norm solution instead of failing.
 *
 * @author openet
 * @version $Revision: $ $Date: $
 */
public class LeastSquaresSolver {

    // singular values below this fraction of the largest one are treated as zero
    static final double RELATIVE_CUTOFF = 1.0e-12;

    private final int numUnknowns;
    private final double[][] xtx;
    private final double[] xty;
    private int numSamples;

    public LeastSquaresSolver(int numUnknowns) {
        this.numUnknowns = numUnknowns;
        this.xtx = new double[numUnknowns][numUnknowns];
        this.xty = new double[numUnknowns];
    }

    public int getNumUnknowns() {
        return numUnknowns;
    }

    public int getNumSamples() {
        return numSamples;
    }

    public void reset() {
        for (int i = 0; i < numUnknowns; i++) {
            Arrays.fill(xtx[i], 0.0);
        }
        Arrays.fill(xty, 0.0);
        numSamples = 0;
    }

    public void addSample(double[] x, double y) {
        for (int i = 0; i < numUnknowns; i++) {
            final double xi = x[i];
            xty[i] += xi * y;
            for (int j = i; j < numUnknowns; j++) {
                xtx[i][j] += xi * x[j];
            }
        }
        numSamples++;
    }

    /**
     * @return the coefficients, or {@code null} if fewer samples than unknowns were added
     */
    public double[] solve() {
        if (numSamples < numUnknowns) {
            return null;
        }
        final double[][] a = new double[numUnknowns][numUnknowns];
        for (int i = 0; i < numUnknowns; i++) {
            for (int j = i; j < numUnknowns; j++) {
                a[i][j] = xtx[i][j];
                a[j][i] = xtx[i][j];
            }
        }
        final SingularValueDecomposition svd = new SingularValueDecomposition(new Array2DRowRealMatrix(a, false));
        final double[] s = svd.getSingularValues();
        final RealMatrix u = svd.getU();
        final RealMatrix v = svd.getV();
        final double cutoff = s[0] * RELATIVE_CUTOFF;

        final double[] coefficients = new double[numUnknowns];
        for (int k = 0; k < s.length; k++) {
            if (s[k] <= cutoff || s[k] == 0.0) {
                continue;
            }
            double projection = 0.0;
            for (int i = 0; i < numUnknowns; i++) {
                projection += u.getEntry(i, k) * xty[i];
            }
            final double factor = projection / s[k];
            for (int i = 0; i < numUnknowns; i++) {
                coefficients[i] += v.getEntry(i, k) * factor;
            }
        }
        return coefficients;
    }
}
