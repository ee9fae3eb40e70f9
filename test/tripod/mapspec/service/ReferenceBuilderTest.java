package tripod.mapspec.service;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import tripod.mapspec.core.*;

import static org.junit.jupiter.api.Assertions.*;

public class ReferenceBuilderTest {
    @TempDir
    File tmp;

    static Spectrum flat (double[] x, int from, int to, double f, double ef) {
        double[] wv = Arrays.copyOfRange(x, from, to);
        double[] y = new double[wv.length], z = new double[wv.length];
        Arrays.fill(y, f);
        Arrays.fill(z, ef);
        return new Spectrum (wv, y, z);
    }

    @Test
    void combineWeightsByInverseVariance () {
        double[] x = Spectra.grid(0., 10, 1.);
        Spectrum first = flat (x, 0, 10, 1., 1.);
        List<Spectrum> aligned = new ArrayList<Spectrum>();
        aligned.add(flat (x, 1, 9, 3., 1.));
        aligned.add(flat (x, 2, 8, 0., 0.5));

        Spectrum s = ReferenceBuilder.combine(first, aligned);
        assertEquals(6, s.size());
        assertEquals(2., s.getWavelength(0), 0.);
        assertEquals(7., s.getWavelength(5), 0.);
        for (int i = 0; i < s.size(); ++i) {
            // weights 1, 1 and 4
            assertEquals(4./6., s.getFlux(i), 1e-12);
            assertEquals(Math.sqrt(1./6.), s.getError(i), 1e-12);
        }
    }

    @Test
    void combineNeedsSharedPixelsWithErrors () {
        double[] x = Spectra.grid(0., 10, 1.);
        final Spectrum first = flat (x, 0, 5, 1., 1.);
        assertThrows(IllegalArgumentException.class,
                     () -> ReferenceBuilder.combine
                     (first, Arrays.asList(flat (x, 5, 10, 1., 1.))));
        assertThrows(IllegalArgumentException.class,
                     () -> ReferenceBuilder.combine
                     (first, Arrays.asList(flat (x, 0, 5, 1., 0.))));
        assertEquals(5, ReferenceBuilder.combine
                   (first, new ArrayList<Spectrum>()).size());
    }

    @Test
    void alignsAndCombinesShiftedLines () {
        double[] x = Spectra.grid(4990., 71, 1.);
        Spectrum first = Spectra.line(x, Spectra.CENTER, 10., 0.2);
        Spectrum second = Spectra.line(x, Spectra.CENTER + 2., 10., 0.4);

        ReferenceBuilder.Result r = new ReferenceBuilder
            (new MetropolisHastings (17L), new Window (5000., 5050.))
            .setTrials(2000)
            .build(Arrays.asList(first, second));

        assertEquals(1, r.getAlignments().size());
        double shift = r.getShifts()[0];
        assertEquals(2., shift, 0.1);
        ReferenceBuilder.Alignment a = r.getAlignments().get(0);
        assertTrue(a.getChi2() < 5., a.toString());
        assertTrue(a.getAcceptance() > 0. && a.getAcceptance() <= 1.);

        Spectrum ref = r.getReference();
        assertTrue(ref.size() >= 63 && ref.size() <= 67, ref.toString());
        for (int i = 0; i < ref.size(); ++i) {
            double wv = ref.getWavelength(i);
            assertEquals(Spectra.profile(wv, Spectra.CENTER, Spectra.SIGMA,
                                         10.), ref.getFlux(i), 0.1);
            // 0.2 combined with 0.4 scaled by the interpolation weights
            assertTrue(ref.getError(i) > 0.164 && ref.getError(i) < 0.179,
                       "error="+ref.getError(i));
        }
    }

    @Test
    void singleSpectrumIsItsOwnReference () {
        Spectrum only = Spectra.line(Spectra.grid(4990., 71, 1.),
                                     Spectra.CENTER, 10., 0.2);
        ReferenceBuilder.Result r = new ReferenceBuilder
            (new MetropolisHastings (1L), new Window (5000., 5050.))
            .build(Arrays.asList(only));
        assertTrue(r.getAlignments().isEmpty());
        assertArrayEquals(only.getFlux(), r.getReference().getFlux(), 1e-12);
        assertArrayEquals(only.getError(), r.getReference().getError(),
                          1e-12);
    }

    @Test
    void shiftTooLargeForTheLineIsInfinitelyUnlikely () {
        EmissionLine l = Spectra.reference();
        assertEquals(0., ReferenceBuilder.chi2(l, l, 0.), 1e-20);
        assertEquals(Double.POSITIVE_INFINITY,
                     ReferenceBuilder.chi2(l, l, 30.));
        assertEquals(3, ReferenceBuilder.trim(-2.5, 1.));
    }

    @Test
    void writesOneShiftPerLine () throws IOException {
        File f = new File (tmp, ReferenceBuilder.SHIFTS);
        ReferenceBuilder.writeShifts(new double[]{ 1.5, -0.25 }, f);

        BufferedReader br = new BufferedReader
            (new InputStreamReader (new FileInputStream (f),
                                    StandardCharsets.UTF_8));
        try {
            assertEquals(1.5, Double.parseDouble(br.readLine()), 0.);
            assertEquals(-0.25, Double.parseDouble(br.readLine()), 0.);
            assertNull(br.readLine());
        }
        finally {
            br.close();
        }
    }

    @Test
    void trialsMustBePositive () {
        final ReferenceBuilder b = new ReferenceBuilder
            (new MetropolisHastings (1L), new Window (5000., 5050.));
        assertThrows(IllegalArgumentException.class, () -> b.setTrials(0));
        assertThrows(IllegalArgumentException.class,
                     () -> b.build(new ArrayList<Spectrum>()));
    }
}
