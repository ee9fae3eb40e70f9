package tripod.mapspec.core;

import java.io.Serializable;
import java.util.Arrays;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.interpolation.SplineInterpolator;
import org.apache.commons.math.analysis.polynomials.PolynomialSplineFunction;

/**
 * One dimensional spectrum: flux and 1-sigma error sampled on a strictly
 * increasing wavelength grid. Instances are immutable; the accessors
 * return copies.
 */
public class Spectrum implements Serializable {
    private static final long serialVersionUID = 0x3a1c0e7d95b24f61l;

    public enum Style {
        LINEAR, // flux and error both propagate correctly
        SPLINE  // cubic spline flux, linearly propagated error
    }

    /**
     * Flux and error resampled at arbitrary wavelengths
     */
    public static class Interp {
        final double[] flux;
        final double[] error;

        Interp (double[] flux, double[] error) {
            this.flux = flux;
            this.error = error;
        }

        public double[] getFlux () { return flux; }
        public double[] getError () { return error; }
    }

    final double[] wv;
    final double[] f;
    final double[] ef;
    final Style style;

    public Spectrum (double[] wv, double[] f, double[] ef) {
        this (wv, f, ef, Style.LINEAR);
    }

    public Spectrum (double[] wv, double[] f, double[] ef, Style style) {
        if (wv.length != f.length || wv.length != ef.length) {
            throw new IllegalArgumentException
                ("Wavelength, flux, and error arrays differ in length ("
                 +wv.length+","+f.length+","+ef.length+")");
        }
        for (int i = 1; i < wv.length; ++i) {
            if (!(wv[i] > wv[i-1])) {
                throw new IllegalArgumentException
                    ("Wavelengths are not strictly increasing at index "+i
                     +": "+wv[i-1]+" >= "+wv[i]);
            }
        }
        this.wv = wv.clone();
        this.f = f.clone();
        this.ef = ef.clone();
        this.style = style != null ? style : Style.LINEAR;
    }

    // subclasses that already validated their arrays
    Spectrum (Spectrum s) {
        this.wv = s.wv;
        this.f = s.f;
        this.ef = s.ef;
        this.style = s.style;
    }

    public int size () { return wv.length; }
    public double[] getWavelength () { return wv.clone(); }
    public double[] getFlux () { return f.clone(); }
    public double[] getError () { return ef.clone(); }
    public double getWavelength (int i) { return wv[i]; }
    public double getFlux (int i) { return f[i]; }
    public double getError (int i) { return ef[i]; }
    public Style getStyle () { return style; }

    public double getMinWavelength () { return wv[0]; }
    public double getMaxWavelength () { return wv[wv.length-1]; }

    /**
     * Pixel size as seen by the kernels: the first grid step.
     */
    public double pixelSize () {
        if (wv.length < 2) {
            throw new IllegalStateException
                ("Spectrum has fewer than two pixels");
        }
        return wv[1] - wv[0];
    }

    public Spectrum withStyle (Style style) {
        return new Spectrum (wv, f, ef, style);
    }

    /**
     * Copy of this spectrum with every wavelength reduced by shift.
     */
    public Spectrum shift (double shift) {
        double[] x = new double[wv.length];
        for (int i = 0; i < x.length; ++i)
            x[i] = wv[i] - shift;
        return new Spectrum (x, f, ef, style);
    }

    /**
     * Spectrum restricted to the pixels selected by mask.
     */
    public Spectrum subset (boolean[] mask) {
        int n = count (mask);
        double[] x = new double[n], y = new double[n], z = new double[n];
        for (int i = 0, j = 0; i < mask.length; ++i) {
            if (mask[i]) {
                x[j] = wv[i];
                y[j] = f[i];
                z[j] = ef[i];
                ++j;
            }
        }
        return new Spectrum (x, y, z, style);
    }

    /**
     * Mask of the pixels whose wavelength lies in [low, high].
     */
    public boolean[] within (double low, double high) {
        boolean[] mask = new boolean[wv.length];
        for (int i = 0; i < wv.length; ++i)
            mask[i] = wv[i] >= low && wv[i] <= high;
        return mask;
    }

    /**
     * Resample flux and error at the given wavelengths. The error is
     * always propagated through linear interpolation weights; only the
     * LINEAR style keeps flux and error consistent.
     */
    public Interp interp (double[] x) {
        double[] y = new double[x.length];
        double[] z = new double[x.length];
        for (int j = 0; j < x.length; ++j) {
            int i = bracket (wv, x[j]);
            double w = (x[j] - wv[i-1])/(wv[i] - wv[i-1]);
            y[j] = w*f[i] + (1. - w)*f[i-1];
            z[j] = Math.sqrt(w*w*ef[i]*ef[i]
                             + (1. - w)*(1. - w)*ef[i-1]*ef[i-1]);
        }

        if (style == Style.SPLINE && wv.length > 2) {
            try {
                PolynomialSplineFunction spline =
                    new SplineInterpolator().interpolate(wv, f);
                for (int j = 0; j < x.length; ++j)
                    y[j] = spline.value(x[j]);
            }
            catch (MathException ex) {
                throw new IllegalArgumentException
                    ("Can't evaluate spline: "+ex.getMessage(), ex);
            }
        }

        return new Interp (y, z);
    }

    /**
     * Index i of the upper end of the source interval [x[i-1], x[i]]
     * containing v; always at least 1.
     */
    static int bracket (double[] x, double v) {
        if (v < x[0] || v > x[x.length-1] || x.length < 2) {
            throw new IllegalArgumentException
                ("Wavelength "+v+" is outside of ["+x[0]+","
                 +x[x.length-1]+"]");
        }
        int i = Arrays.binarySearch(x, v);
        if (i < 0)
            i = -i - 1; // insertion point
        return Math.max(1, i);
    }

    static int count (boolean[] mask) {
        int n = 0;
        for (boolean b : mask)
            if (b) ++n;
        return n;
    }

    public String toString () {
        return getClass().getSimpleName()+"{size="+wv.length
            +(wv.length > 0 ? ",range=["+wv[0]+","+wv[wv.length-1]+"]" : "")
            +",style="+style+"}";
    }
}
