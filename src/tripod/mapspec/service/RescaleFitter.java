package tripod.mapspec.service;

import java.util.*;
import java.util.logging.Logger;
import java.util.logging.Level;

import tripod.mapspec.core.*;

import static tripod.mapspec.core.KernelFamily.*;

/**
 * Fits one spectrum after another to a reference emission line. For
 * each spectrum a DELTA, a GAUSS and a HERMITE model are fit in turn;
 * the GAUSS and HERMITE models are then applied to the whole spectrum.
 * Whenever the plain DELTA fit is better than the smoothed one, the
 * output uses its shift and scale with a negligible kernel width. A fit
 * that fails is reported as the sentinel result so the batch goes on.
 */
public class RescaleFitter {
    private static final Logger logger =
        Logger.getLogger(RescaleFitter.class.getName());

    static int DELTA_TRIALS = 1000;
    static int GAUSS_TRIALS = 5000;
    static int HERMITE_TRIALS = 50000;
    static {
        try {
            DELTA_TRIALS = Integer.getInteger
                ("mapspec.trials.delta", DELTA_TRIALS);
            GAUSS_TRIALS = Integer.getInteger
                ("mapspec.trials.gauss", GAUSS_TRIALS);
            HERMITE_TRIALS = Integer.getInteger
                ("mapspec.trials.hermite", HERMITE_TRIALS);
        }
        catch (SecurityException ex) {
            logger.log(Level.WARNING,
                       "Can't read trial counts; using defaults", ex);
        }
    }

    // kernel width (wavelength units) standing in for no smoothing
    public static final double NARROW_WIDTH = 0.001;

    public static class Report {
        final Spectrum spectrum;
        final FitResult delta;
        final FitResult gauss;
        final FitResult hermite;
        final RescaleModel.Output gaussOutput;
        final RescaleModel.Output hermiteOutput;

        Report (Spectrum spectrum, FitResult delta,
                FitResult gauss, RescaleModel.Output gaussOutput,
                FitResult hermite, RescaleModel.Output hermiteOutput) {
            this.spectrum = spectrum;
            this.delta = delta;
            this.gauss = gauss;
            this.gaussOutput = gaussOutput;
            this.hermite = hermite;
            this.hermiteOutput = hermiteOutput;
        }

        public Spectrum getSpectrum () { return spectrum; }
        public FitResult getDelta () { return delta; }
        public FitResult getGauss () { return gauss; }
        public FitResult getHermite () { return hermite; }
        // outputs are null when the fits behind them failed
        public RescaleModel.Output getGaussOutput () { return gaussOutput; }
        public RescaleModel.Output getHermiteOutput () {
            return hermiteOutput;
        }
    }

    final EmissionLine reference;
    final MetropolisHastings sampler;

    private int deltaTrials = DELTA_TRIALS;
    private int gaussTrials = GAUSS_TRIALS;
    private int hermiteTrials = HERMITE_TRIALS;
    private boolean useCovariance;
    private boolean outputCovariance = true;
    private double widthPriorBurn = -1.; // no prior

    public RescaleFitter (EmissionLine reference, MetropolisHastings sampler) {
        this.reference = reference;
        this.sampler = sampler;
    }

    public RescaleFitter setTrials (int delta, int gauss, int hermite) {
        this.deltaTrials = delta;
        this.gaussTrials = gauss;
        this.hermiteTrials = hermite;
        return this;
    }

    public RescaleFitter setUseCovariance (boolean useCovariance) {
        this.useCovariance = useCovariance;
        return this;
    }

    public RescaleFitter setOutputCovariance (boolean outputCovariance) {
        this.outputCovariance = outputCovariance;
        return this;
    }

    /**
     * Use the marginal width of the GAUSS chain, after discarding the
     * given fraction as burn-in, as prior on the HERMITE width. A
     * negative fraction turns the prior off.
     */
    public RescaleFitter setWidthPriorBurn (double burn) {
        this.widthPriorBurn = burn;
        return this;
    }

    public Report fit (Spectrum spectrum) {
        List<Window> continuum = reference.getContinuumWindows();
        EmissionLine line = new EmissionLine
            (spectrum, reference.getLineWindow(),
             continuum.toArray(new Window[0]));

        FitResult delta = sampler.fit
            (deltaTrials, line, new RescaleModel
             (reference, DELTA, useCovariance), false).orSentinel();

        RescaleModel gauss = new RescaleModel
            (reference, GAUSS, useCovariance);
        FitResult g = sampler.fit(gaussTrials, line, gauss, true);
        RescaleModel.Output gout = output (gauss, delta, g.orSentinel(),
                                           spectrum);

        RescaleModel hermite = hermiteModel (g);
        FitResult h = sampler.fit
            (hermiteTrials, line, hermite, true).orSentinel();
        RescaleModel.Output hout = output (hermite, delta, h, spectrum);

        logger.info(spectrum+":\n  "+delta+"\n  "+g.orSentinel()
                    +"\n  "+h);

        return new Report (spectrum, delta, g.orSentinel(), gout, h, hout);
    }

    /**
     * HERMITE model to fit, with the width prior from the GAUSS chain
     * when one is requested and can be built.
     */
    RescaleModel hermiteModel (FitResult gauss) {
        RescaleModel hermite = new RescaleModel
            (reference, HERMITE, useCovariance);
        if (widthPriorBurn < 0. || !gauss.isSuccess()
            || gauss.getChain() == null)
            return hermite;

        try {
            hermite.setDistributionPrior
                (gauss.getChain(), WIDTH, widthPriorBurn);
        }
        catch (IllegalArgumentException ex) {
            // e.g. a chain stuck at one width gives no spread
            logger.log(Level.WARNING, "No width prior from "
                       +gauss.getChain()+"; fitting without it", ex);
        }
        catch (IllegalStateException ex) {
            logger.log(Level.WARNING, "No width prior from "
                       +gauss.getChain()+"; fitting without it", ex);
        }
        return hermite;
    }

    /**
     * The model applied to the whole spectrum with the parameters
     * {@link #choose} picks; null if neither fit succeeded.
     */
    RescaleModel.Output output (RescaleModel model, FitResult delta,
                                FitResult smoothed, Spectrum spectrum) {
        Parameters p = choose (delta, smoothed);
        if (p == null) {
            logger.warning("No "+model.getFamily()+" output for "
                           +spectrum+"; all fits failed");
            return null;
        }
        model.setParameters(p);
        return model.apply(spectrum, outputCovariance);
    }

    /**
     * Parameters to apply: those of the smoothed fit, unless the DELTA
     * fit reached a lower chi^2 (or only the DELTA fit succeeded), in
     * which case the DELTA shift and scale go with a negligible width.
     */
    Parameters choose (FitResult delta, FitResult smoothed) {
        if (!delta.isSentinel()
            && (smoothed.isSentinel()
                || delta.getChi2() < smoothed.getChi2())) {
            Parameters p = smoothed.getFamily().initial
                (reference.pixelSize());
            return p.with(SHIFT, delta.getParameters().get(SHIFT))
                .with(SCALE, delta.getParameters().get(SCALE))
                .with(WIDTH, NARROW_WIDTH);
        }
        return smoothed.isSentinel() ? null : smoothed.getParameters();
    }
}
