package tripod.dustfit.core;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.UnivariateRealFunction;
import org.apache.commons.math.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math.analysis.interpolation.UnivariateRealInterpolator;

/**
 * Synthetic photometry: passes a densely sampled model spectrum through
 * an instrument bandpass.
 */
public class FilterIntegrator {
    private FilterIntegrator () {}

    /**
     * The transmission weighted mean of the model flux over the part of
     * the bandpass covered by the model grid,
     *
     *    F = int F(l) T(l) dl / int T(l) dl
     *
     * with both integrals evaluated by the trapezoid rule on the filter
     * samples. NaN is returned when the model grid and the bandpass
     * don't overlap.
     */
    public static double integrate (double[] modelWave, double[] modelFlux,
                                    Bandpass bandpass) {
        if (modelWave.length != modelFlux.length) {
            throw new IllegalArgumentException
                ("Model wavelength ("+modelWave.length+") and flux ("
                 +modelFlux.length+") must have the same length");
        }
        if (modelWave.length < 2) {
            throw new IllegalArgumentException
                ("Model spectrum needs at least two points");
        }

        double lo = modelWave[0], hi = modelWave[modelWave.length-1];
        UnivariateRealFunction model;
        try {
            UnivariateRealInterpolator li = new LinearInterpolator ();
            model = li.interpolate(modelWave, modelFlux);
        }
        catch (MathException ex) {
            throw new IllegalArgumentException
                ("Can't interpolate model spectrum", ex);
        }

        double num = 0., den = 0.;
        double pw = Double.NaN, pf = 0., pt = 0.;
        for (int i = 0; i < bandpass.size(); ++i) {
            double w = bandpass.getWavelength(i);
            if (w < lo || w > hi)
                continue;

            double t = bandpass.getTransmission(i);
            double f;
            try {
                f = model.value(w);
            }
            catch (MathException ex) {
                throw new IllegalStateException
                    ("Model interpolation failed at "+w+" um", ex);
            }

            if (!Double.isNaN(pw)) {
                double dw = w - pw;
                num += 0.5 * dw * (f*t + pf*pt);
                den += 0.5 * dw * (t + pt);
            }
            pw = w;
            pf = f;
            pt = t;
        }

        return den > 0. ? num / den : Double.NaN;
    }

    /**
     * one synthetic flux per bandpass
     */
    public static double[] integrate (double[] modelWave, double[] modelFlux,
                                      Bandpass[] bandpasses) {
        double[] flux = new double[bandpasses.length];
        for (int i = 0; i < flux.length; ++i)
            flux[i] = integrate (modelWave, modelFlux, bandpasses[i]);
        return flux;
    }
}
