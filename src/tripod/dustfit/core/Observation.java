package tripod.dustfit.core;

import java.io.Serializable;

/**
 * POJO photometric measurement: a detection, or an upper limit when only
 * a non-detection threshold is known.
 */
public class Observation implements Serializable {
    private static final long serialVersionUID = 0x1f93c4be2a08d571l;

    private final double wavelength; // micron, observer frame
    private final double flux; // Jy
    private final double fluxErr; // Jy
    private final boolean upperLimit;
    private final Bandpass bandpass;

    public Observation (double wavelength, double flux, double fluxErr, 
                        boolean upperLimit) {
        this (wavelength, flux, fluxErr, upperLimit, null);
    }

    public Observation (double wavelength, double flux, double fluxErr, 
                        boolean upperLimit, Bandpass bandpass) {
        this.wavelength = wavelength;
        this.flux = flux;
        this.fluxErr = fluxErr;
        this.upperLimit = upperLimit;
        this.bandpass = bandpass;
    }

    public double getWavelength () { return wavelength; }
    public double getFlux () { return flux; }
    public double getFluxErr () { return fluxErr; }
    public boolean isUpperLimit () { return upperLimit; }
    public Bandpass getBandpass () { return bandpass; }

    public String toString () {
        return getClass().getName()+"{wavelength="+wavelength+",flux="
            +flux+",fluxErr="+fluxErr+",upperLimit="+upperLimit
            +",bandpass="+(bandpass != null ? bandpass.getName() : null)
            +"}";
    }
}
