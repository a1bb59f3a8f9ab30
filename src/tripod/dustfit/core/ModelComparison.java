package tripod.dustfit.core;

import java.util.logging.Logger;

/**
 * Information criteria comparison of a one-component and a
 * two-component fit of the same photometry, evaluated at the median
 * parameters of each fit. Differences are taken as (1 component) -
 * (2 components), so a positive value favours the two-component model.
 */
public class ModelComparison {
    private static final Logger logger =
        Logger.getLogger(ModelComparison.class.getName());

    public static class Result {
        final double logLike1, logLike2;
        final double aic1, aic2;
        final double bic1, bic2;

        Result (double logLike1, double logLike2, double aic1, double aic2,
                double bic1, double bic2) {
            this.logLike1 = logLike1;
            this.logLike2 = logLike2;
            this.aic1 = aic1;
            this.aic2 = aic2;
            this.bic1 = bic1;
            this.bic2 = bic2;
        }

        public double getLogLike1 () { return logLike1; }
        public double getLogLike2 () { return logLike2; }
        public double getAic1 () { return aic1; }
        public double getAic2 () { return aic2; }
        public double getBic1 () { return bic1; }
        public double getBic2 () { return bic2; }
        public double getDeltaAic () { return aic1 - aic2; }
        public double getDeltaBic () { return bic1 - bic2; }

        public String getVerdict () {
            double da = getDeltaAic (), db = getDeltaBic ();
            if (da > 0 && db > 0)
                return "Both AIC and BIC favor the 2-component model.";
            if (da > 0)
                return "AIC favors the 2-component model, but BIC (which "
                    +"penalizes complexity more) favors the 1-component "
                    +"model.";
            if (db <= 0)
                return "Both AIC and BIC favor the 1-component model.";
            return "BIC favors the 2-component model, but AIC favors the "
                +"1-component model.";
        }

        public String toString () {
            return String.format
                ("1-component model: Log-likelihood = %1$.2f, AIC = %2$.2f, "
                 +"BIC = %3$.2f%n2-component model: Log-likelihood = %4$.2f,"
                 +" AIC = %5$.2f, BIC = %6$.2f%nDelta AIC (1comp - 2comp) = "
                 +"%7$.2f%nDelta BIC (1comp - 2comp) = %8$.2f%n%9$s",
                 logLike1, aic1, bic1, logLike2, aic2, bic2,
                 getDeltaAic (), getDeltaBic (), getVerdict ());
        }
    }

    private ModelComparison () {}

    public static double aic (int k, double logLike) {
        return 2. * k - 2. * logLike;
    }

    public static double bic (int k, int n, double logLike) {
        return Math.log(n) * k - 2. * logLike;
    }

    public static Result compare (CensoredLikelihood like1, FitResult fit1,
                                  CensoredLikelihood like2, FitResult fit2) {
        if (fit1.getType() != ModelType.ONE_COMPONENT
            || fit2.getType() != ModelType.TWO_COMPONENT) {
            throw new IllegalArgumentException
                ("Expecting a 1-component and a 2-component fit but got "
                 +fit1.getType()+" and "+fit2.getType());
        }
        if (like1.getModel().getType() != fit1.getType()
            || like2.getModel().getType() != fit2.getType()) {
            throw new IllegalArgumentException
                ("Likelihoods don't match the fitted models");
        }
        if (like1.getNumObservations() != like2.getNumObservations()) {
            throw new IllegalArgumentException
                ("Models were not fitted to the same photometry");
        }

        int n = like1.getNumObservations();
        int k1 = fit1.getType().getNumParams();
        int k2 = fit2.getType().getNumParams();
        double ll1 = like1.logLikelihood(fit1.getMedians());
        double ll2 = like2.logLikelihood(fit2.getMedians());

        Result r = new Result (ll1, ll2, aic (k1, ll1), aic (k2, ll2),
                               bic (k1, n, ll1), bic (k2, n, ll2));
        logger.info("Model Comparison:\n"+r);
        return r;
    }
}
