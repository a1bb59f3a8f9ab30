package tripod.dustfit.core;

import org.apache.commons.math.MathException;
import org.apache.commons.math.analysis.UnivariateRealFunction;
import org.apache.commons.math.analysis.integration.SimpsonIntegrator;
import org.apache.commons.math.analysis.integration.UnivariateRealIntegrator;

/**
 * Flat Lambda-CDM cosmology without radiation.
 */
public class Cosmology {
    public static final double DEFAULT_H0 = 70.; // km/s/Mpc
    public static final double DEFAULT_OMEGA_M = 0.3;

    static final double C_KMS = Constants.SPEED_OF_LIGHT / 1e5;

    final double h0;
    final double omegaM;

    public Cosmology () {
        this (DEFAULT_H0, DEFAULT_OMEGA_M);
    }

    public Cosmology (double h0, double omegaM) {
        if (!(h0 > 0.) || !(omegaM >= 0. && omegaM <= 1.)) {
            throw new IllegalArgumentException
                ("Invalid cosmology H0="+h0+", Om0="+omegaM);
        }
        this.h0 = h0;
        this.omegaM = omegaM;
    }

    public double getH0 () { return h0; }
    public double getOmegaM () { return omegaM; }

    /**
     * Luminosity distance in cm.
     */
    public double luminosityDistance (double redshift) {
        if (!(redshift >= 0.)) {
            throw new IllegalArgumentException
                ("Invalid redshift "+redshift);
        }
        if (redshift == 0.)
            return 0.;

        UnivariateRealFunction invE = new UnivariateRealFunction () {
                public double value (double z) {
                    double a = 1. + z;
                    return 1. / Math.sqrt(omegaM * a * a * a + 1. - omegaM);
                }
            };

        UnivariateRealIntegrator integrator = new SimpsonIntegrator ();
        double dc;
        try {
            dc = integrator.integrate(invE, 0., redshift);
        }
        catch (MathException ex) {
            throw new IllegalStateException
                ("Can't integrate comoving distance to z="+redshift, ex);
        }
        return (1. + redshift) * C_KMS / h0 * dc * Constants.MEGAPARSEC;
    }
}
