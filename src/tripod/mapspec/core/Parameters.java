package tripod.mapspec.core;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Immutable parameter vector of a kernel family. The names and their
 * order are those of the family; setting a value gives a new instance.
 */
public final class Parameters implements Serializable {
    private static final long serialVersionUID = 0x5e27b9d04c1a83f2l;

    // value given to every parameter of a failed fit
    public static final double SENTINEL = -99.;

    final KernelFamily family;
    final double[] values;

    Parameters (KernelFamily family, double[] values) {
        if (values.length != family.size()) {
            throw new IllegalArgumentException
                (family+" expects "+family.size()+" parameters; got "
                 +values.length);
        }
        this.family = family;
        this.values = values;
    }

    public static Parameters of (KernelFamily family, double... values) {
        return new Parameters (family, values.clone());
    }

    public static Parameters sentinel (KernelFamily family) {
        double[] v = new double[family.size()];
        Arrays.fill(v, SENTINEL);
        return new Parameters (family, v);
    }

    public KernelFamily getFamily () { return family; }
    public int size () { return values.length; }
    public String[] names () { return family.names(); }
    public double get (int i) { return values[i]; }

    public double get (String name) {
        return values[index (name)];
    }

    public Parameters with (String name, double value) {
        double[] v = values.clone();
        v[index (name)] = value;
        return new Parameters (family, v);
    }

    public double[] toArray () { return values.clone(); }

    int index (String name) {
        int i = family.indexOf(name);
        if (i < 0) {
            throw new IllegalArgumentException
                (family+" has no parameter \""+name+"\"");
        }
        return i;
    }

    public boolean equals (Object obj) {
        if (obj instanceof Parameters) {
            Parameters p = (Parameters)obj;
            return family == p.family && Arrays.equals(values, p.values);
        }
        return false;
    }

    public int hashCode () {
        return family.hashCode() * 31 + Arrays.hashCode(values);
    }

    public String toString () {
        StringBuilder sb = new StringBuilder (family.getName()+"{");
        for (int i = 0; i < values.length; ++i) {
            if (i > 0) sb.append(",");
            sb.append(family.parameterName(i)+"="
                      +String.format("%1$.5f", values[i]));
        }
        sb.append("}");
        return sb.toString();
    }
}
