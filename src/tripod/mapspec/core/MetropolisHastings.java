package tripod.mapspec.core;

import java.util.logging.Logger;
import java.util.logging.Level;

import org.apache.commons.math.random.MersenneTwister;
import org.apache.commons.math.random.RandomGenerator;

/**
 * Random walk fit of a {@link RescaleModel} to data. Every proposal
 * that lowers chi^2 is taken; a worse one is taken with probability
 * exp(-chi2_try / chi2_current). Note this is not the usual
 * exp(-(chi2_try - chi2_current)/2) ratio, so the chain is a record of
 * a stochastic minimization and not a sample of the posterior.
 */
public class MetropolisHastings {
    private static final Logger logger =
        Logger.getLogger(MetropolisHastings.class.getName());

    static boolean DEBUG = false;
    static int PROGRESS = 500;
    static {
        try {
            DEBUG = Boolean.getBoolean("mapspec.debug");
            PROGRESS = Math.max(1, Integer.getInteger("mapspec.progress", 500));
        }
        catch (SecurityException ex) {
            logger.log(Level.WARNING,
                       "Can't read sampler settings; using defaults", ex);
        }
    }

    private final RandomGenerator rng;

    public MetropolisHastings () {
        this (new MersenneTwister ());
    }

    public MetropolisHastings (long seed) {
        this (new MersenneTwister (seed));
    }

    public MetropolisHastings (RandomGenerator rng) {
        this.rng = rng;
    }

    public RandomGenerator getRandomGenerator () { return rng; }

    /**
     * Whether to move from a state with chi2 to one with chi2try: always
     * when chi2try is lower, otherwise when a uniform deviate is at most
     * exp(-chi2try/chi2).
     */
    public boolean accept (double chi2try, double chi2) {
        if (chi2try < chi2)
            return true;
        // an infinitely unlikely state is never entered
        return chi2try < Double.POSITIVE_INFINITY
            && rng.nextDouble() <= Math.exp(-chi2try/chi2);
    }

    /**
     * Run ntrial proposals starting from the model's current
     * parameters. The model itself is left untouched. Any failure to
     * evaluate the model is thrown to the caller.
     *
     * @param keepChain whether to return the chain; it then holds the
     *  starting state followed by one record per trial
     */
    public FitResult run (int ntrial, Spectrum data, RescaleModel model,
                          boolean keepChain) {
        if (ntrial <= 0) {
            throw new IllegalArgumentException
                ("Number of trials must be positive; got "+ntrial);
        }

        RescaleModel m = model.copy();
        Parameters current = m.getParameters();
        double chi2 = m.evaluate(data, current);

        Parameters best = current;
        double chi2best = chi2;
        int accepted = 0;

        Chain chain = keepChain ? new Chain (m.getFamily().names()) : null;
        if (chain != null)
            chain.add(current, chi2);

        for (int i = 0; i < ntrial; ++i) {
            Parameters trial = m.propose(current, rng);
            double chi2try = m.evaluate(data, trial);

            if (accept (chi2try, chi2)) {
                current = trial;
                chi2 = chi2try;
                ++accepted;

                if (chi2 < chi2best) {
                    chi2best = chi2;
                    best = current;
                }
            }

            // rejected trials repeat the current state
            if (chain != null)
                chain.add(current, chi2);

            if (DEBUG && i % PROGRESS == 0) {
                logger.info(m.getFamily()+" "+i+": best="+chi2best
                            +" current="+chi2+" try="+chi2try);
            }
        }

        FitResult result = FitResult.success
            (chi2best, best, (double)accepted/ntrial, chain);
        logger.fine(m.getFamily()+" after "+ntrial+" trials: "+result);

        return result;
    }

    /**
     * Same as {@link #run}, but a failure during the run comes back as
     * a failed result instead of an exception.
     */
    public FitResult fit (int ntrial, Spectrum data, RescaleModel model,
                          boolean keepChain) {
        if (ntrial <= 0) {
            throw new IllegalArgumentException
                ("Number of trials must be positive; got "+ntrial);
        }

        try {
            return run (ntrial, data, model, keepChain);
        }
        catch (RuntimeException ex) {
            logger.log(Level.WARNING, model.getFamily()+" fit failed", ex);
            return FitResult.failure(model.getFamily(), ex);
        }
    }
}
