package tripod.dustfit.core;

import static tripod.dustfit.core.Constants.*;

/**
 * Optically thin thermal dust emission. All wavelengths are in micron,
 * masses in solar masses, temperatures in Kelvin and distances in cm.
 */
public class DustEmission {
    static final double FOUR_PI = 4.*Math.PI;

    private DustEmission () {}

    public static double[] restWavelength (double[] obsWave, double redshift) {
        double[] rest = new double[obsWave.length];
        for (int i = 0; i < rest.length; ++i)
            rest[i] = obsWave[i] / (1. + redshift);
        return rest;
    }

    /**
     * Planck spectral radiance B_nu in erg/s/cm^2/Hz/sr. The exponent
     * overflows to infinity for very cold dust at short wavelengths; the
     * radiance is then simply 0.
     */
    public static double planck (double waveMicron, double temperature) {
        double nu = SPEED_OF_LIGHT / (waveMicron * MICRON);
        double x = PLANCK * nu / (BOLTZMANN * temperature);
        return 2. * PLANCK * nu * nu * nu
            / (SPEED_OF_LIGHT * SPEED_OF_LIGHT) / Math.expm1(x);
    }

    /**
     * Intrinsic luminosity of an optically thin dust cloud,
     *
     *    L_nu = M * kappa(lambda) * 4 pi * B_nu(T)
     *
     * returned in erg/s/Hz or, for LUMINOSITY_LAMBDA, erg/s/AA.
     */
    public static SpectralDensity luminosity
        (double[] restWave, double[] kappa, double dustMass,
         double temperature, SpectralUnit unit) {
        if (restWave.length != kappa.length) {
            throw new IllegalArgumentException
                ("Rest wavelengths ("+restWave.length+") and opacities ("
                 +kappa.length+") must have the same length");
        }
        if (unit != SpectralUnit.LUMINOSITY_NU
            && unit != SpectralUnit.LUMINOSITY_LAMBDA) {
            throw new IllegalArgumentException
                ("Invalid luminosity unit "+unit+"; must be "
                 +SpectralUnit.LUMINOSITY_NU+" or "
                 +SpectralUnit.LUMINOSITY_LAMBDA);
        }

        double mass = dustMass * SOLAR_MASS;
        double[] lum = new double[restWave.length];
        for (int i = 0; i < lum.length; ++i) {
            double lnu = mass * kappa[i]
                * planck (restWave[i], temperature) * FOUR_PI;
            if (unit == SpectralUnit.LUMINOSITY_LAMBDA) {
                double wave = restWave[i] * MICRON;
                lum[i] = lnu * SPEED_OF_LIGHT / (wave * wave) * ANGSTROM;
            }
            else {
                lum[i] = lnu;
            }
        }
        return new SpectralDensity (lum, unit);
    }

    /**
     * Flux density seen by an observer at the given luminosity distance.
     * A per-frequency luminosity gains a factor (1+z), a per-wavelength
     * one loses it; the result is then expressed at the observed
     * wavelength rest*(1+z).
     */
    public static SpectralDensity flux
        (double[] restWave, SpectralDensity luminosity,
         double distance, double redshift, SpectralUnit unit) {
        if (luminosity == null) {
            throw new IllegalArgumentException ("No luminosity given");
        }
        if (restWave.length != luminosity.size()) {
            throw new IllegalArgumentException
                ("Rest wavelengths ("+restWave.length+") and luminosity ("
                 +luminosity.size()+") must have the same length");
        }
        if (unit == null || unit.isLuminosity()) {
            throw new IllegalArgumentException
                ("Invalid flux unit "+unit+"; must be "
                 +SpectralUnit.JANSKY+", "+SpectralUnit.FLUX_NU
                 +" or "+SpectralUnit.FLUX_LAMBDA);
        }

        double area = FOUR_PI * distance * distance;
        double zfactor = 1. + redshift;
        double[] lum = luminosity.raw();
        double[] flux = new double[lum.length];
        for (int i = 0; i < flux.length; ++i) {
            // observed wavelength in cm
            double wave = restWave[i] * zfactor * MICRON;

            // first bring everything to erg/s/cm^2/Hz
            double fnu;
            switch (luminosity.getUnit()) {
            case LUMINOSITY_NU:
                fnu = lum[i] / area * zfactor;
                break;
            case LUMINOSITY_LAMBDA: {
                double flambda = lum[i] / area / zfactor / ANGSTROM;
                fnu = flambda * wave * wave / SPEED_OF_LIGHT;
                break;
            }
            default:
                throw new IllegalArgumentException
                    ("Luminosity must be in "
                     +SpectralUnit.LUMINOSITY_NU.getSymbol()+" or "
                     +SpectralUnit.LUMINOSITY_LAMBDA.getSymbol()
                     +" but got "+luminosity.getUnit().getSymbol());
            }

            switch (unit) {
            case JANSKY: flux[i] = fnu / JANSKY; break;
            case FLUX_NU: flux[i] = fnu; break;
            case FLUX_LAMBDA:
                flux[i] = fnu * SPEED_OF_LIGHT / (wave * wave) * ANGSTROM;
                break;
            default: // unreachable, rejected above
                throw new IllegalArgumentException ("Invalid unit "+unit);
            }
        }
        return new SpectralDensity (flux, unit);
    }

    /**
     * Model flux (Jy) at the observed wavelengths for one dust component,
     * given the opacity already interpolated onto the rest-frame grid.
     */
    public static double[] modelFlux (double[] obsWave, double dustMass,
                                      double temperature, double redshift,
                                      double distance, double[] kappaOnGrid) {
        if (kappaOnGrid == null) {
            throw new IllegalArgumentException
                ("No opacity given on the wavelength grid");
        }
        double[] rest = restWavelength (obsWave, redshift);
        SpectralDensity lum = luminosity
            (rest, kappaOnGrid, dustMass, temperature,
             SpectralUnit.LUMINOSITY_NU);
        return flux (rest, lum, distance, redshift,
                     SpectralUnit.JANSKY).raw();
    }

    /**
     * Same as above but the opacity is interpolated from the reference
     * curve onto the rest-frame grid first.
     */
    public static double[] modelFlux (double[] obsWave, double dustMass,
                                      double temperature, double redshift,
                                      double distance, OpacityCurve curve,
                                      ExtrapolationPolicy policy) {
        if (curve == null) {
            throw new IllegalArgumentException ("No opacity curve given");
        }
        double[] kappa = curve.interpolate
            (restWavelength (obsWave, redshift), policy);
        return modelFlux (obsWave, dustMass, temperature,
                          redshift, distance, kappa);
    }
}
