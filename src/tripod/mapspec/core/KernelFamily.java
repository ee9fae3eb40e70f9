package tripod.mapspec.core;

/**
 * The smoothing kernel families a {@link RescaleModel} can fit. Each
 * family fixes its parameter names, random walk step sizes, starting
 * values and the limits outside of which a parameter set is rejected.
 */
public enum KernelFamily {
    DELTA ("Delta",
           new String[]{ "shift", "scale" },
           new double[]{ 0.05, 0.02 }, 0.) {
        public double[] kernel (double[] x, Parameters p) {
            return Kernels.delta();
        }
        public int breakwidth (Parameters p, double pixel) {
            return 2;
        }
    },

    GAUSS ("Gauss",
           new String[]{ "shift", "scale", "width" },
           new double[]{ 0.05, 0.02, 0.30 }, 0.51) {
        public double[] kernel (double[] x, Parameters p) {
            return Kernels.gauss(x, p.get(WIDTH));
        }
    },

    HERMITE ("Hermite",
             new String[]{ "shift", "scale", "width", "h3", "h4" },
             new double[]{ 0.05, 0.02, 0.30, 0.03, 0.03 }, 0.46) {
        public double[] kernel (double[] x, Parameters p) {
            return Kernels.hermite
                (x, p.get(WIDTH), p.get(H3), p.get(H4));
        }
        public boolean inBounds (Parameters p, double pixel) {
            return super.inBounds(p, pixel)
                && Math.abs(p.get(H3)) <= MAX_MOMENT
                && Math.abs(p.get(H4)) <= MAX_MOMENT;
        }
    };

    public static final String SHIFT = "shift";
    public static final String SCALE = "scale";
    public static final String WIDTH = "width";
    public static final String H3 = "h3";
    public static final String H4 = "h4";

    // h3 and h4 beyond this already give very odd line shapes
    public static final double MAX_MOMENT = 0.3;

    final String label;
    final String[] names;
    final double[] steps;
    final double minWidth; // fraction of a pixel

    KernelFamily (String name, String[] names, double[] steps,
                  double minWidth) {
        this.label = name;
        this.names = names;
        this.steps = steps;
        this.minWidth = minWidth;
    }

    public String getName () { return label; }
    public int size () { return names.length; }
    public String[] names () { return names.clone(); }
    public String parameterName (int i) { return names[i]; }
    public double step (int i) { return steps[i]; }

    public int indexOf (String param) {
        for (int i = 0; i < names.length; ++i)
            if (names[i].equals(param))
                return i;
        return -1;
    }

    public boolean hasParameter (String param) {
        return indexOf (param) >= 0;
    }

    /**
     * Kernel for the (uniform) grid x under parameters p.
     */
    public abstract double[] kernel (double[] x, Parameters p);

    /**
     * Number of output pixel lags beyond which the covariance between
     * two convolved pixels is taken to be zero.
     */
    public int breakwidth (Parameters p, double pixel) {
        return Math.max(1, (int)Math.ceil(5.*p.get(WIDTH)/pixel));
    }

    /**
     * False if p leaves the region where the kernel is meaningful: a
     * width under the sampling floor or, for HERMITE, |h3| or |h4|
     * above MAX_MOMENT.
     */
    public boolean inBounds (Parameters p, double pixel) {
        return minWidth <= 0. || !(p.get(WIDTH) < minWidth*pixel);
    }

    /**
     * Starting point for a fit against a reference with the given pixel
     * size.
     */
    public Parameters initial (double pixel) {
        double[] values = new double[names.length];
        values[0] = 1.e-4; // shift
        values[1] = 1.; // scale
        if (names.length > 2)
            values[2] = minWidth*pixel;
        return new Parameters (this, values);
    }

    public static KernelFamily forName (String name) {
        if (name != null) {
            for (KernelFamily k : values()) {
                if (k.label.equalsIgnoreCase(name.trim()))
                    return k;
            }
        }
        throw new UnknownKernelFamilyException (name);
    }

    public String toString () { return label; }
}
