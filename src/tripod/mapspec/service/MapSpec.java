package tripod.mapspec.service;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;
import java.util.logging.Level;

import tripod.mapspec.core.*;

import static tripod.mapspec.core.KernelFamily.*;

/**
 * Aligns and rescales a list of spectra onto a reference spectrum's
 * emission line. For every spectrum a row of fit parameters is appended
 * to the parameter file and the rescaled spectra are written next to
 * it as scale_NAME (GAUSS kernel) and scale.h._NAME (HERMITE kernel).
 */
public class MapSpec {
    private static final Logger logger =
        Logger.getLogger(MapSpec.class.getName());

    static final String COVAR_DIR = "covar_matrices";
    static final String CHAIN_DIR = "chains";

    final RescaleFitter fitter;
    final File outdir;
    boolean writeCovariance;
    boolean writeChains;
    Spectrum.Style style = Spectrum.Style.LINEAR;

    public MapSpec (RescaleFitter fitter, File outdir) {
        this.fitter = fitter;
        this.outdir = outdir;
    }

    public MapSpec setWriteCovariance (boolean writeCovariance) {
        this.writeCovariance = writeCovariance;
        fitter.setOutputCovariance(writeCovariance);
        return this;
    }

    public MapSpec setWriteChains (boolean writeChains) {
        this.writeChains = writeChains;
        return this;
    }

    public MapSpec setStyle (Spectrum.Style style) {
        this.style = style;
        return this;
    }

    /**
     * Fit a single spectrum file and write its outputs; returns the
     * fits for the caller's bookkeeping.
     */
    public RescaleFitter.Report process (File file, PrintStream params)
        throws IOException {
        Spectrum s = SpectrumReader.read(file, style);
        RescaleFitter.Report report = fitter.fit(s);
        String name = file.getName();

        params.println(format (name, report));
        params.flush();

        write (report.getGaussOutput(), "scale_"+name, "covar_"+name);
        write (report.getHermiteOutput(),
               "scale.h._"+name, "covar.h._"+name);

        if (writeChains) {
            File dir = mkdir (CHAIN_DIR);
            write (report.getGauss().getChain(),
                   new File (dir, name+".chain.gauss"));
            write (report.getHermite().getChain(),
                   new File (dir, name+".chain.herm"));
        }

        return report;
    }

    void write (RescaleModel.Output output, String spectrum,
                String covariance) throws IOException {
        if (output == null) {
            logger.warning("Nothing to write for "+spectrum);
            return;
        }

        SpectrumWriter.write(output.getSpectrum(),
                             new File (outdir, spectrum));
        if (writeCovariance && output.getCovariance() != null) {
            SpectrumWriter.write(output.getCovariance(),
                                 new File (mkdir (COVAR_DIR), covariance));
        }
    }

    File mkdir (String name) throws IOException {
        File dir = new File (outdir, name);
        if (!dir.isDirectory() && !dir.mkdirs())
            throw new IOException ("Can't create directory "+dir);
        return dir;
    }

    static void write (Chain chain, File file) throws IOException {
        if (chain == null) {
            logger.warning("No chain for "+file.getName());
            return;
        }

        OutputStream os = new FileOutputStream (file);
        try {
            chain.write(os);
        }
        finally {
            os.close();
        }
    }

    static String format (String name, RescaleFitter.Report r) {
        FitResult d = r.getDelta(), g = r.getGauss(), h = r.getHermite();
        Parameters pd = d.getParameters(), pg = g.getParameters(),
            ph = h.getParameters();
        return String.format
            (Locale.US, "%15s %10.2f % 8.4f % 8.4f % 5.2f"
             +" %10.2f % 8.4f % 8.4f % 8.4f % 5.2f"
             +" %10.2f % 8.4f % 8.4f % 8.4f % 5.4e % 5.4e %8.4f",
             name,
             d.getChi2(), pd.get(SHIFT), pd.get(SCALE), d.getAcceptance(),
             g.getChi2(), pg.get(SHIFT), pg.get(SCALE), pg.get(WIDTH),
             g.getAcceptance(),
             h.getChi2(), ph.get(SHIFT), ph.get(SCALE), ph.get(WIDTH),
             ph.get(H3), ph.get(H4), h.getAcceptance());
    }

    static List<String> readList (File file) throws IOException {
        List<String> list = new ArrayList<String>();
        BufferedReader br = new BufferedReader (new FileReader (file));
        try {
            for (String line; (line = br.readLine()) != null; ) {
                line = line.trim();
                if (line.length() > 0 && !line.startsWith("#"))
                    list.add(line.split("\\s+")[0]);
            }
        }
        finally {
            br.close();
        }
        return list;
    }

    public static void main (String[] argv) throws Exception {
        if (argv.length < 5) {
            System.err.println
                ("Usage: MapSpec REFERENCE WINDOW STYLE SPECLIST PARAMS "
                 +"[covar] [chains]");
            System.err.println
                ("  REFERENCE  text spectrum (wavelength flux error) "
                 +"to align to");
            System.err.println
                ("  WINDOW     line window, then continuum windows, "
                 +"one \"low high\" per line");
            System.err.println
                ("  STYLE      interpolation: linear or spline");
            System.err.println
                ("  SPECLIST   text spectra to align, one per line");
            System.err.println
                ("  PARAMS     fit parameters are appended here");
            System.exit(1);
        }

        Spectrum.Style style =
            Spectrum.Style.valueOf(argv[2].toUpperCase(Locale.US));
        Spectrum sref = SpectrumReader.read(new File (argv[0]), style);

        List<Window> windows;
        InputStream is = new FileInputStream (argv[1]);
        try {
            windows = SpectrumReader.readWindows(is);
        }
        finally {
            is.close();
        }
        EmissionLine lref = new EmissionLine
            (sref, windows.get(0),
             windows.subList(1, windows.size()).toArray(new Window[0]));

        Long seed = Long.getLong("mapspec.seed");
        MetropolisHastings sampler = seed != null
            ? new MetropolisHastings (seed) : new MetropolisHastings ();

        Set<String> flags = new HashSet<String>();
        for (int i = 5; i < argv.length; ++i)
            flags.add(argv[i].toLowerCase(Locale.US));

        MapSpec mapspec = new MapSpec
            (new RescaleFitter (lref, sampler),
             new File (System.getProperty("mapspec.output", ".")))
            .setStyle(style)
            .setWriteCovariance(flags.contains("covar"))
            .setWriteChains(flags.contains("chains"));

        PrintStream params = new PrintStream
            (new FileOutputStream (argv[4], true));
        try {
            for (String spec : readList (new File (argv[3]))) {
                logger.info(spec);
                try {
                    mapspec.process(new File (spec), params);
                }
                catch (Exception ex) {
                    logger.log(Level.WARNING, spec+": "+ex.getMessage(), ex);
                }
            }
        }
        finally {
            params.close();
        }
    }
}
