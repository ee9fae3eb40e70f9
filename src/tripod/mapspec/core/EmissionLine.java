package tripod.mapspec.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A spectrum cut down to the window around a single emission line. The
 * source spectrum is expected to have its continuum removed already;
 * the continuum windows are kept along so callers know where the line
 * came from.
 */
public class EmissionLine extends Spectrum {
    private static final long serialVersionUID = 0x1f8e62c0b7a94d35l;

    final Window line;
    final List<Window> continuum;

    public EmissionLine (Spectrum source, Window line, Window... continuum) {
        super (cut (source, line));
        this.line = line;
        List<Window> windows = new ArrayList<Window>();
        for (Window w : continuum)
            windows.add(w);
        this.continuum = Collections.unmodifiableList(windows);
    }

    static Spectrum cut (Spectrum source, Window line) {
        Spectrum s = source.subset
            (source.within(line.getLow(), line.getHigh()));
        if (s.size() < 3) {
            throw new IllegalArgumentException
                ("Line window "+line+" covers only "+s.size()
                 +" pixel(s) of "+source);
        }
        return s;
    }

    public Window getLineWindow () { return line; }
    public List<Window> getContinuumWindows () { return continuum; }

    public String toString () {
        return "EmissionLine{line="+line+",continuum="+continuum
            +",size="+size()+"}";
    }
}
