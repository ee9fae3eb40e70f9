package tripod.mapspec.core;

import org.apache.commons.math.analysis.polynomials.PolynomialFunction;

/**
 * Smoothing kernels sampled at integer pixel offsets, and the
 * convolution that applies them.
 */
public class Kernels {
    static final double SQRT_2PI = Math.sqrt(2.*Math.PI);

    private Kernels () {}

    public static double[] delta () {
        return new double[]{ 1. };
    }

    /**
     * Gaussian of the given physical width on the pixel grid of x.
     */
    public static double[] gauss (double[] x, double width) {
        double pixwidth = width / (x[1] - x[0]);
        int[] offsets = offsets (x.length);
        double[] k = new double[offsets.length];
        for (int i = 0; i < k.length; ++i) {
            double u = offsets[i]/pixwidth;
            k[i] = Math.exp(-0.5*u*u);
        }
        return normalize (k);
    }

    /**
     * Gauss-Hermite kernel (van der Marel &amp; Franx 1993): a Gaussian
     * times 1 + h3 He3(u) + h4 He4(u), with He the probabilists'
     * Hermite polynomials. The normalization happens after the
     * polynomial is applied so h3 and h4 keep their usual meaning.
     */
    public static double[] hermite (double[] x, double width,
                                    double h3, double h4) {
        double pixwidth = width / (x[1] - x[0]);
        PolynomialFunction h = hermiteSeries (h3, h4);
        int[] offsets = offsets (x.length);
        double[] k = new double[offsets.length];
        for (int i = 0; i < k.length; ++i) {
            double u = offsets[i]/pixwidth;
            k[i] = Math.exp(-0.5*u*u)/(pixwidth*SQRT_2PI) * h.value(u);
        }
        return normalize (k);
    }

    /**
     * He0 + h3 He3 + h4 He4 in the power basis, where
     * He3 = u^3 - 3u and He4 = u^4 - 6u^2 + 3.
     */
    static PolynomialFunction hermiteSeries (double h3, double h4) {
        return new PolynomialFunction (new double[] {
                1. + 3.*h4, -3.*h3, -6.*h4, h3, h4
            });
    }

    /**
     * Offsets -(n/2)+1 .. n/2-1; always an odd count.
     */
    static int[] offsets (int n) {
        int half = n/2;
        int size = Math.max(1, 2*half - 1);
        int[] offsets = new int[size];
        for (int i = 0; i < size; ++i)
            offsets[i] = i - (size/2);
        return offsets;
    }

    static double[] normalize (double[] k) {
        double sum = 0.;
        for (double v : k)
            sum += v;
        sum = Math.abs(sum);
        for (int i = 0; i < k.length; ++i)
            k[i] /= sum;
        return k;
    }

    /**
     * Linear convolution trimmed to the central max(m, n) samples, the
     * kernel centered on each output sample.
     */
    public static double[] convolve (double[] signal, double[] kernel) {
        int m = signal.length, n = kernel.length;
        int size = Math.max(m, n);
        int start = (Math.min(m, n) - 1)/2;
        double[] out = new double[size];
        for (int t = 0; t < size; ++t) {
            int c = t + start; // index into the full convolution
            int lo = Math.max(0, c - n + 1);
            int hi = Math.min(m - 1, c);
            double sum = 0.;
            for (int i = lo; i <= hi; ++i)
                sum += signal[i]*kernel[c - i];
            out[t] = sum;
        }
        return out;
    }

    public static double[] square (double[] v) {
        double[] sq = new double[v.length];
        for (int i = 0; i < v.length; ++i)
            sq[i] = v[i]*v[i];
        return sq;
    }
}
