package tripod.mapspec.core;

import java.io.Serializable;

/**
 * Unnormalized Gaussian, exp(-(x - mean)^2 / 2 sigma^2)
 */
public class GaussianPrior implements Prior, Serializable {
    private static final long serialVersionUID = 0x7d39e1b64f0a2c58l;

    final double mean;
    final double sigma;

    public GaussianPrior (double mean, double sigma) {
        if (!(sigma > 0.)) {
            throw new IllegalArgumentException
                ("Gaussian prior needs a positive sigma; got "+sigma);
        }
        this.mean = mean;
        this.sigma = sigma;
    }

    /**
     * Gaussian approximation of the 16th, 50th, and 84th percentiles of
     * a distribution.
     */
    public static GaussianPrior fromPercentiles (double p16, double p50,
                                                 double p84) {
        return new GaussianPrior (p50, (p84 - p16)/2.);
    }

    public double getMean () { return mean; }
    public double getSigma () { return sigma; }

    public double density (double x) {
        double u = (x - mean)/sigma;
        return Math.exp(-0.5*u*u);
    }

    public String toString () {
        return "GaussianPrior{mean="+mean+",sigma="+sigma+"}";
    }
}
