package tripod.mapspec.core;

/**
 * Outcome of fitting a {@link RescaleModel} to data: the best chi^2
 * reached, its parameters, the fraction of accepted proposals, and
 * optionally the chain. A failed fit carries its cause instead and can
 * be turned into the sentinel result batch jobs report.
 */
public class FitResult {
    public static final double SENTINEL_CHI2 = 999.;

    final KernelFamily family;
    final double chi2;
    final Parameters parameters;
    final double acceptance;
    final Chain chain;
    final Throwable error;
    final boolean sentinel;

    FitResult (KernelFamily family, double chi2, Parameters parameters,
               double acceptance, Chain chain, Throwable error) {
        this (family, chi2, parameters, acceptance, chain, error, false);
    }

    private FitResult (KernelFamily family, double chi2,
                       Parameters parameters, double acceptance,
                       Chain chain, Throwable error, boolean sentinel) {
        this.family = family;
        this.chi2 = chi2;
        this.parameters = parameters;
        this.acceptance = acceptance;
        this.chain = chain;
        this.error = error;
        this.sentinel = sentinel;
    }

    public static FitResult success (double chi2, Parameters parameters,
                                     double acceptance, Chain chain) {
        return new FitResult (parameters.getFamily(), chi2, parameters,
                              acceptance, chain, null);
    }

    public static FitResult failure (KernelFamily family, Throwable error) {
        return new FitResult (family, Double.NaN, null, 0., null, error);
    }

    /**
     * chi2 = 999, every parameter -99, nothing accepted
     */
    public static FitResult sentinel (KernelFamily family) {
        return new FitResult (family, SENTINEL_CHI2,
                              Parameters.sentinel(family), 0., null, null,
                              true);
    }

    public boolean isSuccess () { return error == null; }
    // stands in for a failed fit
    public boolean isSentinel () { return sentinel; }
    public KernelFamily getFamily () { return family; }
    public Throwable getError () { return error; }

    /**
     * This result if the fit succeeded, the sentinel otherwise.
     */
    public FitResult orSentinel () {
        return isSuccess () ? this : sentinel (family);
    }

    public double getChi2 () {
        checkSuccess ();
        return chi2;
    }

    public Parameters getParameters () {
        checkSuccess ();
        return parameters;
    }

    public double getAcceptance () {
        checkSuccess ();
        return acceptance;
    }

    // null unless the chain was kept
    public Chain getChain () { return chain; }

    void checkSuccess () {
        if (error != null) {
            throw new IllegalStateException
                (family+" fit failed: "+error.getMessage(), error);
        }
    }

    public String toString () {
        if (error != null)
            return "FitResult{"+family+" failed: "+error+"}";
        if (sentinel)
            return "FitResult{"+family+" sentinel}";
        return "FitResult{chi2="+String.format("%1$.3f", chi2)
            +",params="+parameters
            +",acceptance="+String.format("%1$.3f", acceptance)
            +(chain != null ? ",chain="+chain.size() : "")+"}";
    }
}
