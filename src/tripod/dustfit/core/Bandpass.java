package tripod.dustfit.core;

import java.io.Serializable;

/**
 * Instrument filter transmission curve in the observer frame.
 */
public class Bandpass implements Serializable {
    private static final long serialVersionUID = 0x6b2e91d04a7f3c18l;

    private final String name;
    private final double[] wavelength; // micron
    private final double[] transmission;

    public Bandpass (String name, double[] wavelength, double[] transmission) {
        if (wavelength == null || transmission == null) {
            throw new IllegalArgumentException
                ("Bandpass "+name+" needs wavelength and transmission");
        }
        if (wavelength.length != transmission.length) {
            throw new IllegalArgumentException
                ("Bandpass "+name+" has "+wavelength.length
                 +" wavelengths but "+transmission.length+" transmissions");
        }
        if (wavelength.length < 2) {
            throw new IllegalArgumentException
                ("Bandpass "+name+" needs at least two points");
        }
        for (int i = 1; i < wavelength.length; ++i) {
            if (!(wavelength[i] > wavelength[i-1])) {
                throw new IllegalArgumentException
                    ("Bandpass "+name+" wavelengths are not strictly "
                     +"increasing at index "+i);
            }
        }
        this.name = name;
        this.wavelength = (double[])wavelength.clone();
        this.transmission = (double[])transmission.clone();
    }

    public String getName () { return name; }
    public int size () { return wavelength.length; }
    public double getWavelength (int i) { return wavelength[i]; }
    public double getTransmission (int i) { return transmission[i]; }
    public double getMinWavelength () { return wavelength[0]; }
    public double getMaxWavelength () { 
        return wavelength[wavelength.length-1]; 
    }

    public String toString () {
        return "Bandpass{name="+name+",range=["+getMinWavelength()
            +","+getMaxWavelength()+"]}";
    }
}
