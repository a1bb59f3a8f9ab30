package tripod.dustfit.core;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.commons.math.MathException;
import org.apache.commons.math.special.Erf;

/**
 * Gaussian likelihood of the photometry that treats upper limits as
 * censored data.
 *
 * Detections contribute the usual
 *
 *    -1/2 sum_i ((f_i - m_i)/s_i)^2 - 1/2 sum_i log(2 pi s_i^2)
 *
 * and each upper limit contributes log Phi((f_j - m_j)/s_j), where Phi
 * is the standard normal CDF written with the complementary error
 * function; see Eq. 8 of arXiv:1210.0285.
 */
public class CensoredLikelihood {
    private static final Logger logger =
        Logger.getLogger(CensoredLikelihood.class.getName());

    static final double SQRT2 = Math.sqrt(2.);

    final SedModel model;
    final double[] flux;
    final double[] fluxErr;
    final boolean[] limits;

    public CensoredLikelihood (SedModel model, Photometry phot) {
        phot.validate();
        this.model = model;
        this.flux = phot.getFluxes();
        this.fluxErr = phot.getFluxErrors();
        this.limits = phot.getUpperLimits();
    }

    public SedModel getModel () { return model; }
    public int getNumObservations () { return flux.length; }

    public double logLikelihood (double[] theta) {
        return logLikelihood (flux, fluxErr, limits, model.predict(theta));
    }

    public static double logLikelihood (double[] flux, double[] fluxErr,
                                        boolean[] limits, double[] model) {
        if (flux.length != fluxErr.length || flux.length != limits.length
            || flux.length != model.length) {
            throw new IllegalArgumentException
                ("Flux ("+flux.length+"), error ("+fluxErr.length
                 +"), limit ("+limits.length+") and model ("+model.length
                 +") arrays must have the same length");
        }

        double lnl = 0.;
        for (int i = 0; i < flux.length; ++i) {
            if (Double.isNaN(model[i]))
                return Double.NEGATIVE_INFINITY;

            if (limits[i]) {
                lnl += upperLimitTerm (flux[i], fluxErr[i], model[i]);
            }
            else {
                lnl += detectionTerm (flux[i], fluxErr[i], model[i]);
            }
        }
        return lnl;
    }

    public static double detectionTerm (double flux, double fluxErr,
                                        double model) {
        double r = (flux - model) / fluxErr;
        return -0.5 * r * r - 0.5 * Math.log(2.*Math.PI * fluxErr * fluxErr);
    }

    /**
     * log of the probability that the true flux is at or below the
     * quoted limit given the model prediction. A model far above the
     * limit has probability 0 and thus -infinity. A limit with no
     * error is a hard cutoff.
     */
    public static double upperLimitTerm (double limit, double fluxErr,
                                         double model) {
        if (fluxErr == 0.) {
            return model <= limit ? 0. : Double.NEGATIVE_INFINITY;
        }

        double z = (model - limit) / fluxErr;
        double prob;
        try {
            prob = 0.5 * Erf.erfc(z / SQRT2);
        }
        catch (MathException ex) {
            // erfc only fails to converge deep in the tails
            logger.log(Level.FINE, "erfc failed for z="+z, ex);
            prob = z > 0. ? 0. : 1.;
        }
        return prob > 0. ? Math.log(prob) : Double.NEGATIVE_INFINITY;
    }
}
