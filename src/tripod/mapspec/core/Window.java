package tripod.mapspec.core;

import java.io.Serializable;

/**
 * Closed wavelength interval [low, high]
 */
public class Window implements Serializable {
    private static final long serialVersionUID = 0x6b0d1f52a8e3c417l;

    final double low;
    final double high;

    public Window (double low, double high) {
        if (!(high > low)) {
            throw new IllegalArgumentException
                ("Bad window ["+low+","+high+"]");
        }
        this.low = low;
        this.high = high;
    }

    public double getLow () { return low; }
    public double getHigh () { return high; }

    public String toString () {
        return "["+low+","+high+"]";
    }
}
