package tripod.dustfit.core;

import java.io.Serializable;
import java.util.logging.Logger;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.UnivariateRealFunction;
import org.apache.commons.math.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math.analysis.interpolation.UnivariateRealInterpolator;

/**
 * Tabulated dust mass absorption coefficient (cm^2/g) as a function of
 * wavelength (micron) for one grain composition and size. Instances are
 * immutable and can be shared between concurrent fits.
 */
public class OpacityCurve implements Serializable {
    private static final long serialVersionUID = 0x3c5a0f6e9b1d2247l;
    private static final Logger logger = 
        Logger.getLogger(OpacityCurve.class.getName());

    private final String composition;
    private final double grainSize; // micron
    private final double[] wavelength;
    private final double[] opacity;
    private transient UnivariateRealFunction interp;

    public OpacityCurve (double[] wavelength, double[] opacity) {
        this (null, Double.NaN, wavelength, opacity);
    }

    public OpacityCurve (String composition, double grainSize,
                         double[] wavelength, double[] opacity) {
        if (wavelength == null || opacity == null) {
            throw new IllegalArgumentException
                ("Opacity curve needs both wavelength and opacity");
        }
        if (wavelength.length != opacity.length) {
            throw new IllegalArgumentException
                ("Opacity curve has "+wavelength.length+" wavelengths but "
                 +opacity.length+" opacities!");
        }
        if (wavelength.length < 2) {
            throw new IllegalArgumentException
                ("Opacity curve needs at least two points");
        }
        for (int i = 1; i < wavelength.length; ++i) {
            if (!(wavelength[i] > wavelength[i-1])) {
                throw new IllegalArgumentException
                    ("Opacity wavelengths are not strictly increasing at "
                     +"index "+i+": "+wavelength[i-1]+" >= "+wavelength[i]);
            }
        }
        this.composition = composition;
        this.grainSize = grainSize;
        this.wavelength = (double[])wavelength.clone();
        this.opacity = (double[])opacity.clone();
        this.interp = createInterpolator ();
    }

    UnivariateRealFunction createInterpolator () {
        UnivariateRealInterpolator li = new LinearInterpolator ();
        try {
            return li.interpolate(wavelength, opacity);
        }
        catch (MathException ex) {
            throw new IllegalArgumentException
                ("Can't interpolate opacity curve "+this, ex);
        }
    }

    public String getComposition () { return composition; }
    public double getGrainSize () { return grainSize; }
    public int size () { return wavelength.length; }
    public double getMinWavelength () { return wavelength[0]; }
    public double getMaxWavelength () { 
        return wavelength[wavelength.length-1]; 
    }
    public double[] getWavelength () { return (double[])wavelength.clone(); }
    public double[] getOpacity () { return (double[])opacity.clone(); }

    public boolean covers (double wave) {
        return wave >= getMinWavelength() && wave <= getMaxWavelength();
    }

    /**
     * Interpolate the opacity onto the given rest-frame wavelengths
     * (micron).
     */
    public double[] interpolate (double[] restWave, 
                                 ExtrapolationPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException
                ("No extrapolation policy given");
        }

        UnivariateRealFunction f;
        synchronized (this) {
            if (interp == null) // deserialized
                interp = createInterpolator ();
            f = interp;
        }

        double[] kappa = new double[restWave.length];
        int clamped = 0;
        for (int i = 0; i < restWave.length; ++i) {
            double w = restWave[i];
            if (Double.isNaN(w)) {
                throw new IllegalArgumentException
                    ("Wavelength at index "+i+" is NaN");
            }
            if (w < getMinWavelength() || w > getMaxWavelength()) {
                if (policy == ExtrapolationPolicy.ERROR) {
                    throw new IllegalArgumentException
                        ("Wavelength "+w+" um is outside the opacity table "
                         +"range ["+getMinWavelength()+","
                         +getMaxWavelength()+"] of "+this);
                }
                kappa[i] = w < getMinWavelength() 
                    ? opacity[0] : opacity[opacity.length-1];
                ++clamped;
            }
            else {
                try {
                    kappa[i] = f.value(w);
                }
                catch (MathException ex) {
                    throw new IllegalStateException
                        ("Interpolation failed at "+w+" um", ex);
                }
            }
        }

        if (clamped > 0) {
            logger.fine(this+": clamped "+clamped+" of "+restWave.length
                        +" wavelength(s) to the table edges");
        }
        return kappa;
    }

    public String toString () {
        return "OpacityCurve{composition="+composition+",grainSize="
            +grainSize+",range=["+getMinWavelength()+","
            +getMaxWavelength()+"]}";
    }
}
