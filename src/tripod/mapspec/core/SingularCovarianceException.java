package tripod.mapspec.core;

/**
 * The covariance matrix of a covariance-aware likelihood can't be
 * inverted.
 */
public class SingularCovarianceException extends ArithmeticException {
    private static final long serialVersionUID = 0x0e6a4d2f9b17c853l;

    final int dimension;

    public SingularCovarianceException (int dimension) {
        super ("Covariance matrix ("+dimension+"x"+dimension
               +") is singular");
        this.dimension = dimension;
    }

    public int getDimension () { return dimension; }
}
