package tripod.mapspec.service;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;
import java.util.logging.Level;

import tripod.mapspec.core.*;

/**
 * Combines a list of spectra into a reference spectrum. Every spectrum
 * after the first is aligned to the first one by a random walk in the
 * wavelength shift alone, fit on the emission line; it is then shifted
 * and resampled onto the first spectrum's grid. The result is the
 * inverse-variance weighted mean over the pixels all spectra cover.
 */
public class ReferenceBuilder {
    private static final Logger logger =
        Logger.getLogger(ReferenceBuilder.class.getName());

    static final String SHIFTS = "ref_shifts.dat";

    static int TRIALS = 1000;
    static {
        try {
            TRIALS = Integer.getInteger("mapspec.trials.reference", TRIALS);
        }
        catch (SecurityException ex) {
            logger.log(Level.WARNING,
                       "Can't read mapspec.trials.reference", ex);
        }
    }

    // random walk step in the shift (wavelength units)
    public static final double STEP = 0.1;

    /**
     * Best shift of one spectrum onto the first
     */
    public static class Alignment {
        final double shift;
        final double chi2;
        final double acceptance;

        Alignment (double shift, double chi2, double acceptance) {
            this.shift = shift;
            this.chi2 = chi2;
            this.acceptance = acceptance;
        }

        public double getShift () { return shift; }
        public double getChi2 () { return chi2; }
        public double getAcceptance () { return acceptance; }

        public String toString () {
            return "Alignment{shift="+String.format("%1$.4f", shift)
                +",chi2="+String.format("%1$.3f", chi2)
                +",acceptance="+String.format("%1$.3f", acceptance)+"}";
        }
    }

    public static class Result {
        final Spectrum reference;
        final List<Alignment> alignments;

        Result (Spectrum reference, List<Alignment> alignments) {
            this.reference = reference;
            this.alignments = Collections.unmodifiableList(alignments);
        }

        public Spectrum getReference () { return reference; }
        // one per spectrum after the first
        public List<Alignment> getAlignments () { return alignments; }

        public double[] getShifts () {
            double[] shifts = new double[alignments.size()];
            for (int i = 0; i < shifts.length; ++i)
                shifts[i] = alignments.get(i).getShift();
            return shifts;
        }
    }

    final MetropolisHastings sampler;
    final Window line;
    final Window[] continuum;
    private int trials = TRIALS;

    public ReferenceBuilder (MetropolisHastings sampler, Window line,
                             Window... continuum) {
        this.sampler = sampler;
        this.line = line;
        this.continuum = continuum.clone();
    }

    public ReferenceBuilder setTrials (int trials) {
        if (trials <= 0) {
            throw new IllegalArgumentException
                ("Number of trials must be positive; got "+trials);
        }
        this.trials = trials;
        return this;
    }

    public Result build (List<Spectrum> spectra) {
        if (spectra.isEmpty())
            throw new IllegalArgumentException ("No spectra to combine");

        Spectrum first = spectra.get(0);
        EmissionLine lref = new EmissionLine (first, line, continuum);

        List<Alignment> alignments = new ArrayList<Alignment>();
        List<Spectrum> aligned = new ArrayList<Spectrum>();
        for (Spectrum s : spectra.subList(1, spectra.size())) {
            Alignment a = align (lref, new EmissionLine (s, line, continuum));
            logger.info(s+": "+a);
            alignments.add(a);
            aligned.add(resample (first, s.shift(a.getShift()),
                                  trim (a.getShift(), s.pixelSize())));
        }

        return new Result (combine (first, aligned), alignments);
    }

    /**
     * Random walk in the shift of l against lref, starting from zero.
     */
    public Alignment align (EmissionLine lref, EmissionLine l) {
        double shift = 0.;
        double chi2 = chi2 (lref, l, shift);
        double best = shift, chi2best = chi2;
        int accepted = 0;

        for (int i = 0; i < trials; ++i) {
            double trial = shift
                + STEP * sampler.getRandomGenerator().nextGaussian();
            double chi2try = chi2 (lref, l, trial);
            if (sampler.accept(chi2try, chi2)) {
                shift = trial;
                chi2 = chi2try;
                ++accepted;
                if (chi2 < chi2best) {
                    chi2best = chi2;
                    best = shift;
                }
            }
        }
        return new Alignment (best, chi2best, (double)accepted/trials);
    }

    /**
     * Pixels dropped at each end for a given shift
     */
    static int trim (double shift, double pixel) {
        return (int)Math.abs(shift/pixel) + 1;
    }

    /**
     * chi^2 of l shifted by shift against lref resampled on l's trimmed
     * grid; infinite when nothing is left to compare or lref doesn't
     * cover the shifted grid.
     */
    static double chi2 (EmissionLine lref, EmissionLine l, double shift) {
        int trim = trim (shift, lref.pixelSize());
        int n = l.size() - 2*trim;
        if (n < 1)
            return Double.POSITIVE_INFINITY;

        double[] x = new double[n];
        for (int i = 0; i < n; ++i)
            x[i] = l.getWavelength(trim + i) - shift;
        if (x[0] < lref.getMinWavelength()
            || x[n-1] > lref.getMaxWavelength())
            return Double.POSITIVE_INFINITY;

        Spectrum.Interp in = lref.interp(x);
        double[] y = in.getFlux(), z = in.getError();
        double chi2 = 0.;
        for (int i = 0; i < n; ++i) {
            double r = y[i] - l.getFlux(trim + i);
            double e = l.getError(trim + i);
            chi2 += r*r/(z[i]*z[i] + e*e);
        }
        return chi2;
    }

    /**
     * Shifted spectrum resampled on the grid of first, less trim pixels
     * at each end and anything the shifted spectrum doesn't cover.
     */
    static Spectrum resample (Spectrum first, Spectrum shifted, int trim) {
        boolean[] mask = first.within
            (shifted.getMinWavelength(), shifted.getMaxWavelength());
        for (int i = 0; i < mask.length; ++i)
            if (i < trim || i >= mask.length - trim)
                mask[i] = false;

        double[] x = first.subset(mask).getWavelength();
        if (x.length == 0) {
            throw new IllegalArgumentException
                (shifted+" doesn't overlap "+first);
        }
        Spectrum.Interp in = shifted.interp(x);
        return new Spectrum (x, in.getFlux(), in.getError());
    }

    /**
     * Inverse-variance weighted mean of first and spectra resampled on
     * its grid, over the wavelengths all of them share. The error is
     * sqrt(1/sum(1/z^2)).
     */
    public static Spectrum combine (Spectrum first, List<Spectrum> aligned) {
        int n = first.size();
        boolean[] common = new boolean[n];
        Arrays.fill(common, true);

        List<Map<Double, Integer>> index =
            new ArrayList<Map<Double, Integer>>();
        for (Spectrum s : aligned) {
            Map<Double, Integer> pos = new HashMap<Double, Integer>();
            for (int i = 0; i < s.size(); ++i)
                pos.put(s.getWavelength(i), i);
            for (int i = 0; i < n; ++i)
                if (!pos.containsKey(first.getWavelength(i)))
                    common[i] = false;
            index.add(pos);
        }

        Spectrum grid = first.subset(common);
        if (grid.size() == 0)
            throw new IllegalArgumentException ("Spectra share no pixels");

        double[] x = grid.getWavelength();
        double[] y = new double[x.length];
        double[] z = new double[x.length];
        for (int i = 0; i < x.length; ++i) {
            double wsum = weight (grid.getError(i));
            double ysum = wsum * grid.getFlux(i);
            for (int k = 0; k < aligned.size(); ++k) {
                Spectrum s = aligned.get(k);
                int j = index.get(k).get(x[i]);
                double w = weight (s.getError(j));
                wsum += w;
                ysum += w * s.getFlux(j);
            }
            y[i] = ysum/wsum;
            z[i] = Math.sqrt(1./wsum);
        }
        return new Spectrum (x, y, z);
    }

    static double weight (double error) {
        if (!(error > 0.)) {
            throw new IllegalArgumentException
                ("Can't weight a pixel with error "+error);
        }
        return 1./(error*error);
    }

    /**
     * One shift per line
     */
    public static void writeShifts (double[] shifts, File file)
        throws IOException {
        PrintStream ps = new PrintStream
            (new FileOutputStream (file), false, "UTF-8");
        try {
            for (double s : shifts)
                ps.println(SpectrumWriter.format(s));
            if (ps.checkError())
                throw new IOException ("Can't write "+file);
        }
        finally {
            ps.close();
        }
    }

    public static void main (String[] argv) throws Exception {
        if (argv.length < 3) {
            System.err.println
                ("Usage: ReferenceBuilder SPECLIST WINDOW OUTFILE");
            System.err.println
                ("  SPECLIST  text spectra to combine, one per line; "
                 +"the first sets the grid");
            System.err.println
                ("  WINDOW    line window, then continuum windows, "
                 +"one \"low high\" per line");
            System.err.println
                ("  OUTFILE   combined reference spectrum; shifts go to "
                 +SHIFTS);
            System.exit(1);
        }

        List<Spectrum> spectra = new ArrayList<Spectrum>();
        for (String name : MapSpec.readList(new File (argv[0])))
            spectra.add(SpectrumReader.read
                        (new File (name), Spectrum.Style.LINEAR));

        List<Window> windows;
        InputStream is = new FileInputStream (argv[1]);
        try {
            windows = SpectrumReader.readWindows(is);
        }
        finally {
            is.close();
        }

        Long seed = Long.getLong("mapspec.seed");
        MetropolisHastings sampler = seed != null
            ? new MetropolisHastings (seed) : new MetropolisHastings ();
        Result result = new ReferenceBuilder
            (sampler, windows.get(0),
             windows.subList(1, windows.size()).toArray(new Window[0]))
            .build(spectra);

        SpectrumWriter.write(result.getReference(), new File (argv[2]));
        writeShifts (result.getShifts(), new File
                     (System.getProperty("mapspec.output", "."), SHIFTS));
    }
}
