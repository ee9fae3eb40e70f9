package tripod.mapspec.service;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;
import java.util.logging.Level;

import tripod.mapspec.core.*;

/**
 * Reads plain text spectra, one pixel per line:
 * <pre>
 * # wavelength  flux  error
 * 5000.0  1.23e-15  4.5e-17
 * </pre>
 * Blank lines and lines starting with # are ignored; extra columns
 * are ignored too.
 */
public class SpectrumReader {
    private static final Logger logger =
        Logger.getLogger(SpectrumReader.class.getName());

    static int DEBUG = 0;
    static {
        try {
            DEBUG = Integer.getInteger("reader.debug", 0);
        }
        catch (SecurityException ex) {
            logger.log(Level.WARNING, "Can't read reader.debug", ex);
        }
    }

    private int lines;
    private BufferedReader reader;
    private Spectrum.Style style = Spectrum.Style.LINEAR;

    public SpectrumReader (InputStream is) throws IOException {
        reader = new BufferedReader (new InputStreamReader (is, "UTF-8"));
    }

    public SpectrumReader setStyle (Spectrum.Style style) {
        this.style = style;
        return this;
    }

    public Spectrum read () throws IOException {
        List<double[]> pixels = new ArrayList<double[]>();
        for (String line; (line = reader.readLine()) != null; ) {
            ++lines;
            double[] v = parse (line, 3);
            if (v != null)
                pixels.add(v);
        }

        if (DEBUG > 0)
            logger.info(pixels.size()+" pixels from "+lines+" lines");

        double[] wv = new double[pixels.size()];
        double[] f = new double[wv.length];
        double[] ef = new double[wv.length];
        for (int i = 0; i < wv.length; ++i) {
            double[] v = pixels.get(i);
            wv[i] = v[0];
            f[i] = v[1];
            ef[i] = v[2];
        }

        try {
            return new Spectrum (wv, f, ef, style);
        }
        catch (IllegalArgumentException ex) {
            throw new IOException ("Bad spectrum: "+ex.getMessage(), ex);
        }
    }

    /**
     * Window file: the line window on the first line, then any number
     * of continuum windows, each as "low high".
     */
    public static List<Window> readWindows (InputStream is)
        throws IOException {
        BufferedReader br = new BufferedReader
            (new InputStreamReader (is, "UTF-8"));
        List<Window> windows = new ArrayList<Window>();
        int lines = 0;
        for (String line; (line = br.readLine()) != null; ) {
            ++lines;
            double[] v = parseLine (line, 2, lines);
            if (v != null) {
                try {
                    windows.add(new Window (v[0], v[1]));
                }
                catch (IllegalArgumentException ex) {
                    throw new IOException
                        ("Line "+lines+": "+ex.getMessage(), ex);
                }
            }
        }

        if (windows.isEmpty())
            throw new IOException ("No line window found");
        return windows;
    }

    double[] parse (String line, int columns) throws IOException {
        return parseLine (line, columns, lines);
    }

    static double[] parseLine (String line, int columns, int lineno)
        throws IOException {
        line = line.trim();
        if (line.length() == 0 || line.startsWith("#"))
            return null;

        String[] tokens = line.split("[\\s,]+");
        if (tokens.length < columns) {
            throw new IOException
                ("Line "+lineno+": expecting "+columns
                 +" columns; got "+tokens.length);
        }

        double[] v = new double[columns];
        try {
            for (int i = 0; i < columns; ++i)
                v[i] = Double.parseDouble(tokens[i]);
        }
        catch (NumberFormatException ex) {
            throw new IOException ("Line "+lineno+": "+ex.getMessage(), ex);
        }
        return v;
    }

    public static Spectrum read (File file, Spectrum.Style style)
        throws IOException {
        InputStream is = new FileInputStream (file);
        try {
            return new SpectrumReader(is).setStyle(style).read();
        }
        finally {
            is.close();
        }
    }
}
