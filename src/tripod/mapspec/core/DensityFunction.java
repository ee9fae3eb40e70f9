package tripod.mapspec.core;

/**
 * Parametrized density, e.g. a Gaussian with params {mean, sigma}; bound
 * to its parameters it becomes a {@link Prior}.
 */
public interface DensityFunction {
    double value (double x, double[] params);
}
