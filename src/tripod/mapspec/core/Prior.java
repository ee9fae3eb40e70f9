package tripod.mapspec.core;

/**
 * Prior probability density of a single model parameter. A density of
 * zero rejects the parameter value outright.
 */
public interface Prior {
    double density (double x);
}
