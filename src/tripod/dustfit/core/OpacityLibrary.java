package tripod.dustfit.core;

import java.io.IOException;

/**
 * Source of reference opacity curves keyed by grain composition and
 * grain size (micron).
 */
public interface OpacityLibrary {
    OpacityCurve getCurve (String composition, double grainSize) 
        throws IOException;
}
