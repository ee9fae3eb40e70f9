package tripod.mapspec.service;

import java.io.*;
import java.util.Locale;

import org.apache.commons.math.linear.RealMatrix;

import tripod.mapspec.core.Spectrum;

/**
 * Text output for rescaled spectra and their covariance matrices, in
 * the format {@link SpectrumReader} reads back.
 */
public class SpectrumWriter {
    private SpectrumWriter () {}

    public static void write (Spectrum s, OutputStream os)
        throws IOException {
        PrintStream ps = new PrintStream (os, false, "UTF-8");
        ps.println("# wavelength   flux   error");
        for (int i = 0; i < s.size(); ++i) {
            ps.println(format (s.getWavelength(i))+" "
                       +format (s.getFlux(i))+" "+format (s.getError(i)));
        }
        ps.flush();
        if (ps.checkError())
            throw new IOException ("Can't write spectrum");
    }

    /**
     * One matrix row per line
     */
    public static void write (RealMatrix covar, OutputStream os)
        throws IOException {
        PrintStream ps = new PrintStream (os, false, "UTF-8");
        for (int i = 0; i < covar.getRowDimension(); ++i) {
            StringBuilder sb = new StringBuilder ();
            for (int j = 0; j < covar.getColumnDimension(); ++j) {
                if (j > 0) sb.append(" ");
                sb.append(format (covar.getEntry(i, j)));
            }
            ps.println(sb);
        }
        ps.flush();
        if (ps.checkError())
            throw new IOException ("Can't write covariance matrix");
    }

    public static void write (Spectrum s, File file) throws IOException {
        OutputStream os = new FileOutputStream (file);
        try {
            write (s, os);
        }
        finally {
            os.close();
        }
    }

    public static void write (RealMatrix covar, File file)
        throws IOException {
        OutputStream os = new FileOutputStream (file);
        try {
            write (covar, os);
        }
        finally {
            os.close();
        }
    }

    static String format (double v) {
        return String.format(Locale.US, "%1$.18e", v);
    }
}
