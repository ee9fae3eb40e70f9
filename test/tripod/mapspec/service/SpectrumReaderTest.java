package tripod.mapspec.service;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.apache.commons.math.linear.Array2DRowRealMatrix;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import tripod.mapspec.core.*;

import static org.junit.jupiter.api.Assertions.*;

public class SpectrumReaderTest {
    @TempDir
    File tmp;

    static InputStream stream (String text) {
        return new ByteArrayInputStream (text.getBytes(StandardCharsets.UTF_8));
    }

    static Spectrum read (String text) throws IOException {
        return new SpectrumReader(stream (text)).read();
    }

    @Test
    void readsColumnsSkippingComments () throws IOException {
        Spectrum s = read ("# wavelength flux error\n"
                           +"\n"
                           +"4000.0  1.5e-15  2.0e-17\n"
                           +"4001.0, 1.7e-15, 2.1e-17, 99\n"
                           +"   # trailing comment\n"
                           +"4002.0\t1.6e-15\t2.2e-17\n");
        assertEquals(3, s.size());
        assertEquals(4001., s.getWavelength(1), 0.);
        assertEquals(1.7e-15, s.getFlux(1), 0.);
        assertEquals(2.2e-17, s.getError(2), 0.);
        assertSame(Spectrum.Style.LINEAR, s.getStyle());
    }

    @Test
    void styleIsCarried () throws IOException {
        Spectrum s = new SpectrumReader(stream ("1 2 3\n2 3 4\n3 4 5\n"))
            .setStyle(Spectrum.Style.SPLINE).read();
        assertSame(Spectrum.Style.SPLINE, s.getStyle());
    }

    @Test
    void malformedSpectra () {
        assertThrows(IOException.class, () -> read ("1 2 3\n2 3\n"));
        assertThrows(IOException.class, () -> read ("1 2 3\n2 x 4\n"));
        IOException ex = assertThrows
            (IOException.class, () -> read ("1 2 3\n3 3 4\n2 4 5\n"));
        assertTrue(ex.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void readsWindows () throws IOException {
        List<Window> w = SpectrumReader.readWindows
            (stream ("# line\n4840 4880\n# continuum\n4800 4820\n"
                     +"4900, 4920\n"));
        assertEquals(3, w.size());
        assertEquals(4840., w.get(0).getLow(), 0.);
        assertEquals(4880., w.get(0).getHigh(), 0.);
        assertEquals(4920., w.get(2).getHigh(), 0.);

        assertThrows(IOException.class,
                     () -> SpectrumReader.readWindows(stream ("# none\n")));
        assertThrows(IOException.class,
                     () -> SpectrumReader.readWindows(stream ("10 5\n")));
    }

    @Test
    void writtenSpectraReadBack () throws IOException {
        Spectrum s = Spectra.noisy(Spectra.grid(6500., 20, 0.7),
                                   6507., 3.3, 0.1, 17L);
        File f = new File (tmp, "s.txt");
        SpectrumWriter.write(s, f);

        Spectrum t = SpectrumReader.read(f, Spectrum.Style.LINEAR);
        assertArrayEquals(s.getWavelength(), t.getWavelength(), 1e-12);
        assertArrayEquals(s.getFlux(), t.getFlux(), 1e-15);
        assertArrayEquals(s.getError(), t.getError(), 1e-15);
    }

    @Test
    void writesOneMatrixRowPerLine () throws IOException {
        ByteArrayOutputStream bos = new ByteArrayOutputStream ();
        SpectrumWriter.write(new Array2DRowRealMatrix
                             (new double[][]{{ 1., 0.5 }, { 0.5, 2. }}), bos);
        String[] lines = bos.toString("UTF-8").trim().split("\\r?\\n");
        assertEquals(2, lines.length);
        String[] row = lines[1].split(" ");
        assertEquals(2, row.length);
        assertEquals(0.5, Double.parseDouble(row[0]), 0.);
        assertEquals(2., Double.parseDouble(row[1]), 0.);
    }
}
