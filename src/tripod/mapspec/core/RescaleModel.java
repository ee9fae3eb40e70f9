package tripod.mapspec.core;

import java.util.*;
import java.util.logging.Logger;
import java.util.logging.Level;

import org.apache.commons.math.linear.Array2DRowRealMatrix;
import org.apache.commons.math.linear.DecompositionSolver;
import org.apache.commons.math.linear.InvalidMatrixException;
import org.apache.commons.math.linear.LUDecompositionImpl;
import org.apache.commons.math.linear.RealMatrix;
import org.apache.commons.math.random.RandomGenerator;

import static tripod.mapspec.core.KernelFamily.*;

/**
 * Model that maps a spectrum onto a reference emission line: shift the
 * wavelengths, resample onto the reference grid, smooth with a kernel,
 * and scale the flux. Evaluating the model against data gives
 * -2 ln(likelihood), i.e. chi^2 plus prior terms.
 *
 * <p>There are two ways to get chi^2: from the full covariance matrix
 * of the transformed data (useCovariance), or from the per pixel
 * errors alone, where the smoothed error is only approximate.
 */
public class RescaleModel {
    private static final Logger logger =
        Logger.getLogger(RescaleModel.class.getName());

    // fraction of the overlap dropped at each edge before computing
    // chi^2; fixed so the degrees of freedom don't change with shift
    public static final double EDGE_TRIM = 0.05;

    /**
     * A spectrum after the model has been applied to it
     */
    public static class Output {
        final Spectrum spectrum;
        final boolean[] mask;
        final RealMatrix covariance;

        Output (Spectrum spectrum, boolean[] mask, RealMatrix covariance) {
            this.spectrum = spectrum;
            this.mask = mask;
            this.covariance = covariance;
        }

        public Spectrum getSpectrum () { return spectrum; }
        // pixels of the input spectrum that made it into the output
        public boolean[] getMask () { return mask.clone(); }
        // null unless requested
        public RealMatrix getCovariance () { return covariance; }
    }

    // shifted, resampled, smoothed, and scaled flux on a grid
    static class Transformed {
        double[] flux;
        double[] error;
        RealMatrix covariance;
    }

    final EmissionLine reference;
    final KernelFamily family;
    final boolean useCovariance;
    final double pixel;

    private Parameters params;
    private final Map<String, Prior> priors =
        new LinkedHashMap<String, Prior>();

    public RescaleModel (EmissionLine reference, KernelFamily family,
                         boolean useCovariance) {
        if (reference == null || family == null) {
            throw new IllegalArgumentException
                ("Both reference and kernel family are required");
        }
        this.reference = reference;
        this.family = family;
        this.useCovariance = useCovariance;
        this.pixel = reference.pixelSize();
        this.params = family.initial(pixel);
    }

    public RescaleModel (EmissionLine reference, String family,
                         boolean useCovariance) {
        this (reference, KernelFamily.forName(family), useCovariance);
    }

    public RescaleModel (EmissionLine reference, KernelFamily family) {
        this (reference, family, false);
    }

    protected RescaleModel (RescaleModel model) {
        this.reference = model.reference;
        this.family = model.family;
        this.useCovariance = model.useCovariance;
        this.pixel = model.pixel;
        this.params = model.params;
        this.priors.putAll(model.priors);
    }

    /**
     * Working copy; shares only the (read-only) reference.
     */
    public RescaleModel copy () {
        return new RescaleModel (this);
    }

    public EmissionLine getReference () { return reference; }
    public KernelFamily getFamily () { return family; }
    public boolean getUseCovariance () { return useCovariance; }
    public Parameters getParameters () { return params; }
    public double getParameter (String name) { return params.get(name); }

    public void setParameters (Parameters params) {
        if (params.getFamily() != family) {
            throw new IllegalArgumentException
                ("Parameters "+params+" are not for "+family);
        }
        this.params = params;
    }

    public void setParameter (String name, double value) {
        params = params.with(name, value);
    }

    public Map<String, Prior> getPriors () {
        return Collections.unmodifiableMap(priors);
    }

    /**
     * Register a prior on a parameter, replacing any earlier one.
     */
    public void setPrior (String name, Prior prior) {
        if (!family.hasParameter(name)) {
            throw new IllegalArgumentException
                (family+" has no parameter \""+name+"\"");
        }
        priors.put(name, prior);
    }

    public void setFunctionPrior (String name, final DensityFunction func,
                                  double... params) {
        final double[] args = params.clone();
        setPrior (name, new Prior () {
                public double density (double x) {
                    return func.value(x, args);
                }
            });
    }

    /**
     * Gaussian prior built from the marginal distribution of a
     * parameter in an earlier chain, e.g. the width from a GAUSS run as
     * a prior for a HERMITE run. The first burn fraction of the chain is
     * discarded; the parameter starts at the median.
     */
    public void setDistributionPrior (Chain chain, String name,
                                      double burn) {
        Chain.Summary s = chain.getSummary(name, burn);
        GaussianPrior prior = GaussianPrior.fromPercentiles
            (s.getLower(), s.getMedian(), s.getUpper());
        setPrior (name, prior);
        setParameter (name, s.getMedian());
        logger.info("Prior on "+name+" from "+s+": "+prior);
    }

    /**
     * Random walk step from the given parameters.
     */
    public Parameters propose (Parameters from, RandomGenerator rng) {
        double[] v = from.toArray();
        for (int i = 0; i < v.length; ++i)
            v[i] += family.step(i) * rng.nextGaussian();
        return new Parameters (family, v);
    }

    public double evaluate (Spectrum data) {
        return evaluate (data, params);
    }

    /**
     * -2 ln(likelihood) of data under the given parameters.
     *
     * @throws SingularCovarianceException if the covariance matrix
     *  can't be inverted
     */
    public double evaluate (Spectrum data, Parameters p) {
        if (p.getFamily() != family) {
            throw new IllegalArgumentException
                ("Parameters "+p+" are not for "+family);
        }

        double penalty = penalty (p);
        if (Double.isInfinite(penalty))
            return penalty;

        return chi2 (data, p) + penalty;
    }

    /**
     * Sum of -2 ln(prior) over the registered priors; infinite when p
     * is outside the family's bounds.
     */
    public double penalty (Parameters p) {
        if (!family.inBounds(p, pixel))
            return Double.POSITIVE_INFINITY;

        double penalty = 0.;
        for (Map.Entry<String, Prior> me : priors.entrySet()) {
            penalty += -2.*Math.log
                (me.getValue().density(p.get(me.getKey())));
        }
        return penalty;
    }

    double chi2 (Spectrum data, Parameters p) {
        Spectrum s = data.shift(p.get(SHIFT));
        boolean[] mask = reference.within
            (s.getMinWavelength(), s.getMaxWavelength());

        int first = 0;
        while (first < mask.length && !mask[first])
            ++first;
        int n = Spectrum.count(mask);
        int trim = Math.max(1, (int)Math.round(EDGE_TRIM * n));
        if (n < 3 || n - 2*trim < 1) {
            if (logger.isLoggable(Level.FINE))
                logger.fine(p+": overlap of "+n+" pixel(s) is too small");
            return Double.POSITIVE_INFINITY;
        }

        double[] x = reference.subset(mask).wv;
        Transformed t = transform (s, x, p, useCovariance);

        int size = n - 2*trim;
        double[] resid = new double[size];
        double[] refvar = new double[size];
        for (int i = 0; i < size; ++i) {
            int r = first + trim + i;
            resid[i] = reference.f[r] - t.flux[trim + i];
            refvar[i] = reference.ef[r]*reference.ef[r];
        }

        double chi2 = 0.;
        if (useCovariance) {
            double[][] c = new double[size][size];
            for (int i = 0; i < size; ++i) {
                for (int j = 0; j < size; ++j)
                    c[i][j] = t.covariance.getEntry(trim + i, trim + j);
                // reference errors are independent of the data's
                c[i][i] += refvar[i];
            }
            chi2 = quadratic (new Array2DRowRealMatrix (c, false), resid);
        }
        else {
            for (int i = 0; i < size; ++i) {
                double e = t.error[trim + i];
                chi2 += resid[i]*resid[i]/(refvar[i] + e*e);
            }
        }

        if (logger.isLoggable(Level.FINE))
            logger.fine(p+": chi2="+chi2+" over "+size+" pixels");
        return chi2;
    }

    /**
     * r' C^-1 r
     */
    static double quadratic (RealMatrix c, double[] r) {
        int n = r.length;
        double max = 0.;
        for (int i = 0; i < n; ++i)
            max = Math.max(max, Math.abs(c.getEntry(i, i)));
        if (!(max > 0.))
            throw new SingularCovarianceException (n);

        DecompositionSolver solver =
            new LUDecompositionImpl (c, 1.e-12*max).getSolver();
        if (!solver.isNonSingular())
            throw new SingularCovarianceException (n);

        double[] x;
        try {
            x = solver.solve(r);
        }
        catch (InvalidMatrixException ex) {
            SingularCovarianceException sce =
                new SingularCovarianceException (n);
            sce.initCause(ex);
            throw sce;
        }

        double chi2 = 0.;
        for (int i = 0; i < n; ++i)
            chi2 += r[i]*x[i];
        return chi2;
    }

    /**
     * Apply the model with its current parameters to a full spectrum.
     * No edges are trimmed and no priors are applied.
     */
    public Output apply (Spectrum spectrum, boolean withCovariance) {
        Spectrum s = spectrum.shift(params.get(SHIFT));
        boolean[] mask = spectrum.within
            (s.getMinWavelength(), s.getMaxWavelength());
        if (Spectrum.count(mask) < 3) {
            throw new IllegalArgumentException
                ("Shifted spectrum overlaps "+spectrum+" by fewer than "
                 +"three pixels");
        }

        double[] x = spectrum.subset(mask).wv;
        Transformed t = transform (s, x, params, withCovariance);
        return new Output (new Spectrum (x, t.flux, t.error),
                           mask, t.covariance);
    }

    public Output apply (Spectrum spectrum) {
        return apply (spectrum, true);
    }

    Transformed transform (Spectrum shifted, double[] x, Parameters p,
                           boolean withCovariance) {
        Spectrum.Interp in = shifted.interp(x);
        double[] k = family.kernel(x, p);

        Transformed t = new Transformed ();
        // covariance has to come from the unsmoothed errors
        if (withCovariance) {
            t.covariance = Covariance.propagate
                (shifted.wv, x, shifted.ef, k,
                 family.breakwidth(p, x[1] - x[0]));
        }

        // smoothing the variance ignores the covariance it introduces
        double[] var = Kernels.convolve
            (Kernels.square(in.getError()), Kernels.square(k));
        t.error = new double[var.length];
        for (int i = 0; i < var.length; ++i)
            t.error[i] = Math.sqrt(var[i]);
        t.flux = Kernels.convolve(in.getFlux(), k);

        double scale = p.get(SCALE);
        for (int i = 0; i < t.flux.length; ++i) {
            t.flux[i] *= scale;
            t.error[i] *= Math.abs(scale);
        }
        if (t.covariance != null)
            t.covariance = t.covariance.scalarMultiply(scale*scale);

        return t;
    }

    public String toString () {
        return "RescaleModel{family="+family+",covariance="+useCovariance
            +",params="+params+",priors="+priors.keySet()+"}";
    }
}
