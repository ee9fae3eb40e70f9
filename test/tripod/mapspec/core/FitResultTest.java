package tripod.mapspec.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class FitResultTest {

    @Test
    void success () {
        Parameters p = Parameters.of(KernelFamily.GAUSS, 0.1, 0.9, 1.2);
        FitResult r = FitResult.success(42., p, 0.25, null);
        assertTrue(r.isSuccess());
        assertFalse(r.isSentinel());
        assertSame(r, r.orSentinel());
        assertSame(KernelFamily.GAUSS, r.getFamily());
        assertEquals(42., r.getChi2(), 0.);
        assertEquals(0.25, r.getAcceptance(), 0.);
        assertSame(p, r.getParameters());
        assertNull(r.getError());
    }

    @Test
    void failureBecomesSentinel () {
        RuntimeException cause = new SingularCovarianceException (5);
        FitResult r = FitResult.failure(KernelFamily.HERMITE, cause);
        assertFalse(r.isSuccess());
        assertSame(cause, r.getError());

        IllegalStateException ex = assertThrows
            (IllegalStateException.class, () -> r.getParameters());
        assertSame(cause, ex.getCause());
        assertThrows(IllegalStateException.class, () -> r.getAcceptance());

        FitResult s = r.orSentinel();
        assertTrue(s.isSuccess());
        assertTrue(s.isSentinel());
        assertSame(KernelFamily.HERMITE, s.getFamily());
        assertEquals(FitResult.SENTINEL_CHI2, s.getChi2(), 0.);
        assertEquals(0., s.getAcceptance(), 0.);
        assertEquals(Parameters.sentinel(KernelFamily.HERMITE),
                     s.getParameters());
        assertEquals(-99., s.getParameters().get(KernelFamily.SHIFT), 0.);
        assertEquals(-99., s.getParameters().get(KernelFamily.H4), 0.);
        assertNull(s.getChain());
    }
}
