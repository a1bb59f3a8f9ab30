package tripod.dustfit.io;

import java.io.IOException;
import tripod.dustfit.core.Bandpass;

/**
 * Source of filter transmission curves by filter name.
 */
public interface BandpassLibrary {
    /**
     * @throws IOException if the filter is unknown or can't be read
     */
    Bandpass getBandpass (String name) throws IOException;
}
