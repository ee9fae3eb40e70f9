package tripod.mapspec.core;

import org.apache.commons.math.linear.RealMatrix;
import org.apache.commons.math.random.MersenneTwister;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static tripod.mapspec.core.KernelFamily.*;

public class RescaleModelTest {
    EmissionLine ref;
    double[] x;

    @BeforeEach
    void setUp () {
        ref = Spectra.reference();
        x = ref.getWavelength();
    }

    @Test
    void constructionByName () {
        RescaleModel m = new RescaleModel (ref, "gauss", true);
        assertSame(GAUSS, m.getFamily());
        assertTrue(m.getUseCovariance());
        assertEquals(1.e-4, m.getParameter(SHIFT), 0.);
        assertEquals(1., m.getParameter(SCALE), 0.);
        assertEquals(0.51, m.getParameter(WIDTH), 1e-12);

        assertThrows(UnknownKernelFamilyException.class,
                     () -> new RescaleModel (ref, "Lorentz", false));
    }

    @Test
    void deltaApplyOnlyShiftsAndScales () {
        Spectrum data = Spectra.line(x, 5027., 12.5, 0.25);
        RescaleModel m = new RescaleModel (ref, DELTA);
        m.setParameter(SHIFT, 2.);
        m.setParameter(SCALE, 0.8);

        RescaleModel.Output out = m.apply(data, false);
        Spectrum s = out.getSpectrum();
        assertEquals(49, s.size());
        assertNull(out.getCovariance());
        boolean[] mask = out.getMask();
        assertTrue(mask[0]);
        assertTrue(mask[48]);
        assertFalse(mask[49]);
        assertFalse(mask[50]);
        for (int i = 0; i < s.size(); ++i) {
            assertEquals(x[i], s.getWavelength(i), 0.);
            assertEquals(ref.getFlux(i), s.getFlux(i), 1e-9);
            assertEquals(0.2, s.getError(i), 1e-12);
        }
    }

    @Test
    void identicalDataFitsPerfectly () {
        for (boolean covar : new boolean[]{ false, true }) {
            RescaleModel m = new RescaleModel (ref, DELTA, covar);
            m.setParameter(SHIFT, 0.);
            assertEquals(0., m.evaluate(ref), 1e-20);
        }
    }

    @Test
    void covarianceChi2MatchesFastChi2WithoutSmoothing () {
        Spectrum data = Spectra.noisy(x, 5025., 10., 0.2, 42L);
        RescaleModel fast = new RescaleModel (ref, DELTA, false);
        RescaleModel full = new RescaleModel (ref, DELTA, true);
        fast.setParameter(SHIFT, 0.);
        full.setParameter(SHIFT, 0.);

        double chi2 = fast.evaluate(data);
        assertTrue(chi2 > 0.);
        assertEquals(chi2, full.evaluate(data), 1e-9*chi2);
    }

    @Test
    void covarianceAwareGaussIsFinite () {
        Spectrum data = Spectra.noisy(x, 5026., 10., 0.2, 9L);
        RescaleModel m = new RescaleModel (ref, GAUSS, true);
        m.setParameter(WIDTH, 1.2);
        double chi2 = m.evaluate(data);
        assertTrue(chi2 > 0. && !Double.isInfinite(chi2), "chi2="+chi2);
    }

    @Test
    void applyScalesCovariance () {
        Spectrum data = Spectra.noisy(x, 5025., 10., 0.2, 5L);
        RescaleModel m = new RescaleModel (ref, GAUSS);
        m.setParameter(WIDTH, 1.5);
        RealMatrix c1 = m.apply(data, true).getCovariance();
        m.setParameter(SCALE, 2.);
        RealMatrix c2 = m.apply(data, true).getCovariance();

        assertEquals(c1.getRowDimension(), c2.getRowDimension());
        for (int i = 0; i < c1.getRowDimension(); i += 7) {
            assertEquals(4.*c1.getEntry(i, i), c2.getEntry(i, i), 1e-12);
            assertEquals(c2.getEntry(i, 3), c2.getEntry(3, i), 1e-15);
        }
    }

    @Test
    void outOfBoundsParametersAreInfinitelyUnlikely () {
        Spectrum data = Spectra.noisy(x, 5025., 10., 0.2, 1L);
        RescaleModel h = new RescaleModel (ref, HERMITE);
        h.setParameter(WIDTH, 2.);
        assertFalse(Double.isInfinite(h.evaluate(data)));

        assertEquals(Double.POSITIVE_INFINITY,
                     h.evaluate(data, h.getParameters().with(H3, 0.5)));
        assertEquals(Double.POSITIVE_INFINITY,
                     h.evaluate(data, h.getParameters().with(H4, -0.4)
                                .with(SHIFT, 0.).with(SCALE, 1.)));

        RescaleModel g = new RescaleModel (ref, GAUSS);
        assertEquals(Double.POSITIVE_INFINITY,
                     g.evaluate(data, g.getParameters().with(WIDTH, 0.1)));
    }

    @Test
    void noOverlapIsInfinitelyUnlikely () {
        RescaleModel m = new RescaleModel (ref, DELTA);
        m.setParameter(SHIFT, 100.);
        assertEquals(Double.POSITIVE_INFINITY, m.evaluate(ref));
    }

    @Test
    void singularCovarianceIsThrown () {
        Spectrum exact = Spectra.line(x, 5025., 10., 0.);
        EmissionLine zero = new EmissionLine
            (exact, new Window (5000., 5050.));
        RescaleModel m = new RescaleModel (zero, DELTA, true);
        SingularCovarianceException ex = assertThrows
            (SingularCovarianceException.class, () -> m.evaluate(exact));
        // 50 pixel overlap less 3 trimmed at each end
        assertEquals(44, ex.getDimension());
    }

    @Test
    void copyIsIndependent () {
        RescaleModel m = new RescaleModel (ref, GAUSS);
        RescaleModel c = m.copy();
        c.setParameter(WIDTH, 3.);
        c.setPrior(WIDTH, new GaussianPrior (3., 1.));
        assertEquals(0.51, m.getParameter(WIDTH), 1e-12);
        assertTrue(m.getPriors().isEmpty());
        assertSame(m.getReference(), c.getReference());
    }

    @Test
    void proposalsMoveEveryParameter () {
        RescaleModel m = new RescaleModel (ref, HERMITE);
        Parameters p = m.getParameters();
        Parameters q = m.propose(p, new MersenneTwister (3L));
        assertSame(HERMITE, q.getFamily());
        for (int i = 0; i < p.size(); ++i)
            assertNotEquals(p.get(i), q.get(i));
        assertEquals(p, m.getParameters());
    }

    @Nested
    class Priors {
        RescaleModel m;

        @BeforeEach
        void setUp () {
            m = new RescaleModel (ref, GAUSS);
            m.setParameter(WIDTH, 1.);
        }

        @Test
        void functionPriorAddsMinusTwoLogDensity () {
            m.setFunctionPrior(WIDTH, new DensityFunction () {
                    public double value (double x, double[] params) {
                        double u = (x - params[0])/params[1];
                        return Math.exp(-0.5*u*u);
                    }
                }, 1.5, 0.5);
            assertEquals(1., m.penalty(m.getParameters()), 1e-12);
        }

        @Test
        void zeroDensityRejects () {
            m.setPrior(SCALE, new Prior () {
                    public double density (double x) {
                        return x > 0. ? 1. : 0.;
                    }
                });
            assertEquals(0., m.penalty(m.getParameters()), 0.);
            assertEquals(Double.POSITIVE_INFINITY,
                         m.penalty(m.getParameters().with(SCALE, -1.)));
        }

        @Test
        void lastRegistrationWins () {
            m.setPrior(WIDTH, new GaussianPrior (5., 0.1));
            m.setPrior(WIDTH, new GaussianPrior (1., 0.1));
            assertEquals(1, m.getPriors().size());
            assertEquals(0., m.penalty(m.getParameters()), 1e-12);
        }

        @Test
        void unknownParameterIsRejected () {
            assertThrows(IllegalArgumentException.class,
                         () -> m.setPrior(H3, new GaussianPrior (0., 1.)));
        }

        @Test
        void distributionPriorIsCenteredOnTheChainMedian () {
            Chain chain = new Chain (GAUSS.names());
            for (int i = 0; i <= 200; ++i) {
                chain.add(Parameters.of(GAUSS, 0., 1., 1.4 + 0.001*i),
                          10. + i);
            }

            m.setDistributionPrior(chain, WIDTH, 0.5);
            assertEquals(1.55, m.getParameter(WIDTH), 1e-9);
            double penalty = m.penalty(m.getParameters());
            assertEquals(0., penalty, 1e-12);

            double chi2 = m.evaluate(Spectra.noisy(x, 5025., 10., 0.2, 2L));
            assertFalse(Double.isInfinite(chi2) || Double.isNaN(chi2));
        }
    }
}
