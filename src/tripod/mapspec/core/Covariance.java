package tripod.mapspec.core;

import java.util.logging.Logger;

import org.apache.commons.math.linear.Array2DRowRealMatrix;
import org.apache.commons.math.linear.MatrixUtils;
import org.apache.commons.math.linear.RealMatrix;

/**
 * Covariance of a noisy signal after it has been linearly interpolated
 * onto a new grid and convolved with a kernel (Gardner 2003,
 * Uncertainties in Interpolated Spectral Data, eq. 6).
 */
public class Covariance {
    private static final Logger logger =
        Logger.getLogger(Covariance.class.getName());

    private Covariance () {}

    /**
     * Covariance of the interpolated-then-convolved signal.
     *
     * @param x source grid (strictly increasing)
     * @param xinterp target grid, inside the range of x
     * @param z 1-sigma errors on x
     * @param k kernel as applied by {@link Kernels#convolve}; its length
     *  must be 1 or within two of the target grid's
     * @param breakwidth pixel lag at and beyond which convolved pixels
     *  are taken to be uncorrelated
     * @return symmetric matrix indexed by target grid position
     */
    public static RealMatrix propagate (double[] x, double[] xinterp,
                                        double[] z, double[] k,
                                        double breakwidth) {
        if (x.length != z.length) {
            throw new IllegalArgumentException
                ("Grid and errors differ in length ("+x.length
                 +","+z.length+")");
        }

        int n = xinterp.length;
        double[] var = new double[n];
        double[] off = new double[Math.max(0, n - 1)];
        for (int t = 0; t < n; ++t) {
            int i = Spectrum.bracket(x, xinterp[t]);
            double f = (xinterp[t] - x[i-1])/(x[i] - x[i-1]);
            var[t] = f*f*z[i]*z[i] + (1. - f)*(1. - f)*z[i-1]*z[i-1];
            // neighbors share source pixel i; only lag one survives
            if (t < n - 1)
                off[t] = f*(1. - f)*z[i]*z[i];
        }

        if (k.length == 1) {
            // no convolution, so no mixing
            return MatrixUtils.createRealDiagonalMatrix(var);
        }

        double[] kp = pad (k, n);
        int cent = n/2;
        int lags = Math.max(1, (int)breakwidth);

        double[][] covar = new double[n][n];
        for (int i = 0; i < n; ++i) {
            for (int lag = 0; lag < lags; ++lag) {
                int j = Math.min(i + lag, n - 1);
                double q = quadratic (kp, cent, i, j, var, off);
                covar[i][j] = q;
                covar[j][i] = q;
            }
        }

        logger.fine("Covariance of "+n+" pixels over "+lags+" lags");
        return new Array2DRowRealMatrix (covar, false);
    }

    /**
     * Kernel zero padded to size n with its center at n/2.
     */
    static double[] pad (double[] k, int n) {
        double[] kp = new double[n];
        if (k.length == n - 2) {
            System.arraycopy(k, 0, kp, 1, k.length);
        }
        else if (k.length == n - 1 || k.length == n) {
            System.arraycopy(k, 0, kp, n - k.length, k.length);
        }
        else {
            throw new IllegalArgumentException
                ("Kernel of size "+k.length+" doesn't match grid of size "
                 +n);
        }
        return kp;
    }

    /**
     * Weight of input pixel p in convolved pixel i; zero where the
     * kernel would run off either end of the grid.
     */
    static double weight (double[] kp, int cent, int i, int p) {
        int m = cent + i - p;
        return m >= 0 && m < kp.length ? kp[m] : 0.;
    }

    /**
     * w_i' C w_j with C the tridiagonal interpolation covariance.
     */
    static double quadratic (double[] kp, int cent, int i, int j,
                             double[] var, double[] off) {
        int n = var.length;
        // w_i is nonzero only for p in (i + cent - n, i + cent]
        int lo = Math.max(0, i + cent - n + 1);
        int hi = Math.min(n - 1, i + cent);
        double sum = 0.;
        for (int p = lo; p <= hi; ++p) {
            double wi = weight (kp, cent, i, p);
            if (wi == 0.)
                continue;
            double cw = var[p] * weight (kp, cent, j, p);
            if (p > 0)
                cw += off[p-1] * weight (kp, cent, j, p - 1);
            if (p < n - 1)
                cw += off[p] * weight (kp, cent, j, p + 1);
            sum += wi * cw;
        }
        return sum;
    }
}
