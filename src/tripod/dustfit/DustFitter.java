package tripod.dustfit;

import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import org.apache.commons.math.random.MersenneTwister;
import org.apache.commons.math.random.RandomGenerator;

import tripod.dustfit.core.CensoredLikelihood;
import tripod.dustfit.core.FitResult;
import tripod.dustfit.core.ModelComparison;
import tripod.dustfit.core.ModelType;
import tripod.dustfit.core.OpacityCurve;
import tripod.dustfit.core.OpacityLibrary;
import tripod.dustfit.core.Photometry;
import tripod.dustfit.core.Posterior;
import tripod.dustfit.core.Prior;
import tripod.dustfit.core.ResultSummarizer;
import tripod.dustfit.core.SedModel;
import tripod.dustfit.io.BandpassLibrary;
import tripod.dustfit.io.DirectoryBandpassLibrary;
import tripod.dustfit.io.DirectoryOpacityLibrary;
import tripod.dustfit.io.ParameterTableWriter;
import tripod.dustfit.io.PhotometryReader;
import tripod.dustfit.mcmc.Chain;
import tripod.dustfit.mcmc.ConvergenceController;
import tripod.dustfit.mcmc.StretchMoveSampler;
import tripod.dustfit.plot.CornerPlot;
import tripod.dustfit.plot.SedPlot;
import tripod.dustfit.plot.TracePlot;

/**
 * Fits one- and two-component dust models to the photometry of an
 * object and writes the parameter tables and diagnostic plots.
 */
public class DustFitter {
    private static final Logger logger =
        Logger.getLogger(DustFitter.class.getName());

    /**
     * Everything produced by fitting one model.
     */
    public static class Fit {
        final String object;
        final Photometry phot;
        final OpacityCurve curve;
        final SedModel model;
        final CensoredLikelihood likelihood;
        final Chain chain;
        final double[][] samples;
        final int firstKept;
        final FitResult result;
        final double acceptance;

        Fit (String object, Photometry phot, OpacityCurve curve,
             CensoredLikelihood likelihood, Chain chain, double[][] samples,
             int firstKept, FitResult result, double acceptance) {
            this.object = object;
            this.phot = phot;
            this.curve = curve;
            this.model = likelihood.getModel();
            this.likelihood = likelihood;
            this.chain = chain;
            this.samples = samples;
            this.firstKept = firstKept;
            this.result = result;
            this.acceptance = acceptance;
        }

        public String getObject () { return object; }
        public Photometry getPhotometry () { return phot; }
        public OpacityCurve getOpacityCurve () { return curve; }
        public SedModel getModel () { return model; }
        public CensoredLikelihood getLikelihood () { return likelihood; }
        public Chain getChain () { return chain; }

        /**
         * retained samples as samples[n][dim]
         */
        public double[][] getSamples () { return samples; }
        public FitResult getResult () { return result; }
        public ModelType getType () { return result.getType(); }
        public double getAcceptanceFraction () { return acceptance; }

        /**
         * step index of the chain where the summarized samples start
         */
        public int getFirstKept () { return firstKept; }
    }

    /**
     * Both fits of an object and how they compare.
     */
    public static class Comparison {
        final Fit oneComp, twoComp;
        final ModelComparison.Result result;

        Comparison (Fit oneComp, Fit twoComp, ModelComparison.Result result) {
            this.oneComp = oneComp;
            this.twoComp = twoComp;
            this.result = result;
        }

        public Fit getOneComponent () { return oneComp; }
        public Fit getTwoComponent () { return twoComp; }
        public ModelComparison.Result getResult () { return result; }
    }

    final FitConfig config;
    final OpacityLibrary opacities;

    public DustFitter (FitConfig config, OpacityLibrary opacities) {
        if (config == null || opacities == null) {
            throw new IllegalArgumentException
                ("Fitter needs a configuration and an opacity library");
        }
        this.config = config;
        this.opacities = opacities;
    }

    /**
     * Fitter for a single opacity curve, whatever the configured
     * composition and grain size are.
     */
    public DustFitter (FitConfig config, final OpacityCurve curve) {
        this (config, new OpacityLibrary () {
                public OpacityCurve getCurve (String composition,
                                              double grainSize) {
                    return curve;
                }
            });
        if (curve == null) {
            throw new IllegalArgumentException ("No opacity curve given");
        }
    }

    public FitConfig getConfig () { return config; }

    public Fit fit (String object, Photometry phot, double redshift,
                    ModelType type) throws IOException {
        OpacityCurve curve = opacities.getCurve
            (config.getComposition(), config.getGrainSize());
        if (curve == null) {
            throw new IllegalArgumentException
                ("No opacity for "+config.getComposition()+" grains of "
                 +config.getGrainSize()+" um");
        }

        double distance = config.getDistance(redshift);
        logger.info(object+": fitting "+type+" to "+phot.size()
                    +" observation(s) at z="+redshift+", d="+distance
                    +" cm; "+config);

        SedModel model = new SedModel
            (type, phot, curve, redshift, distance,
             config.getFilterSamples(), config.getExtrapolation());
        CensoredLikelihood likelihood = new CensoredLikelihood (model, phot);
        Prior prior = new Prior (type, config.getBounds());
        Posterior posterior = new Posterior (prior, likelihood);
        Prior init = new Prior (type, config.getInitialBounds());

        RandomGenerator rng = new MersenneTwister (config.getSeed());
        StretchMoveSampler sampler = new StretchMoveSampler
            (posterior, rng, config.getCores());
        Chain chain;
        try {
            ConvergenceController controller = new ConvergenceController
                (sampler, prior, init.getLowerBounds(),
                 init.getUpperBounds(), rng)
                .setSteps(config.getSteps())
                .setRepeats(config.getRepeats())
                .setSigmaClip(config.getSigmaClip());
            chain = controller.run
                (controller.initialPositions(config.getWalkers()));
        }
        finally {
            sampler.close();
        }
        logger.info(object+": acceptance fraction "
                    +String.format("%1$.3f", sampler.getAcceptanceFraction())
                    +", "+posterior.getSuppressedCount()
                    +" non-finite posterior value(s)");

        double[][] samples = ResultSummarizer.retainedSamples
            (chain, config.getSteps(), config.getRepeats(),
             config.getBurnIn());
        FitResult result = new ResultSummarizer(type).summarize(samples);
        int firstKept = chain.getSteps()
            - samples.length / chain.getWalkers();
        logger.info(object+": "+result);

        Fit fit = new Fit (object, phot, curve, likelihood, chain,
                           samples, firstKept, result,
                           sampler.getAcceptanceFraction());
        write (fit, prior);
        return fit;
    }

    void write (Fit fit, Prior prior) throws IOException {
        File dir = outputDir ();
        ParameterTableWriter.write(dir, fit.object, fit.result);
        if (!config.getPlot())
            return;

        FitResult result = fit.result;
        new SedPlot (fit.phot, fit.curve, fit.model.getRedshift(),
                     fit.model.getDistance())
            .saveFit(dir, fit.object, fit.phot, result,
                     fit.chain.lastPositions());
        new CornerPlot (result.getType(), fit.samples)
            .save(dir, fit.object, result);

        TracePlot trace = new TracePlot (fit.chain);
        ModelType type = result.getType();
        for (int d = 0; d < type.getNumParams(); ++d) {
            trace.save(dir, fit.object, type.getComponents(), d,
                       type.getParam(d), result.get(type.getParam(d)),
                       prior.getBound(d), fit.firstKept);
        }
    }

    File outputDir () throws IOException {
        File dir = config.getOutputDir();
        if (!dir.isDirectory() && !dir.mkdirs()) {
            throw new IOException ("Can't create output directory "+dir);
        }
        return dir;
    }

    /**
     * Fit the two-component model, then the one-component model, and
     * compare them.
     */
    public Comparison fullModel (String object, Photometry phot,
                                 double redshift) throws IOException {
        Fit twoComp = fit (object, phot, redshift, ModelType.TWO_COMPONENT);
        Fit oneComp = fit (object, phot, redshift, ModelType.ONE_COMPONENT);

        ModelComparison.Result cmp = ModelComparison.compare
            (oneComp.likelihood, oneComp.result,
             twoComp.likelihood, twoComp.result);

        if (config.getPlot()) {
            new SedPlot (phot, oneComp.curve, oneComp.model.getRedshift(),
                         oneComp.model.getDistance())
                .saveComparison(outputDir (), object, phot,
                                oneComp.result, twoComp.result, cmp);
        }
        return new Comparison (oneComp, twoComp, cmp);
    }

    public Comparison fullModel (File file, String object, double redshift,
                                 BandpassLibrary bandpasses)
        throws IOException {
        logger.info("Reading from \""+file+"\"...");
        return fullModel (object, PhotometryReader.read
                          (file, object, bandpasses), redshift);
    }

    public static void main (String[] argv) throws Exception {
        if (argv.length < 3) {
            System.err.println
                ("Usage: DustFitter FILE OBJECT REDSHIFT [STEPS WALKERS]");
            System.exit(1);
        }

        FitConfig.Builder builder = FitConfig.load();
        if (argv.length > 3)
            builder.setSteps(Integer.parseInt(argv[3]));
        if (argv.length > 4)
            builder.setWalkers(Integer.parseInt(argv[4]));

        FitConfig config = builder.build();
        OpacityLibrary opacities =
            new DirectoryOpacityLibrary (config.getOpacityDir());
        BandpassLibrary bandpasses = config.getFilterDir() != null
            ? new DirectoryBandpassLibrary (config.getFilterDir()) : null;

        DustFitter fitter = new DustFitter (config, opacities);
        Comparison cmp = fitter.fullModel
            (new File (argv[0]), argv[1], Double.parseDouble(argv[2]),
             bandpasses);

        System.out.println(cmp.getOneComponent().getResult());
        System.out.println(cmp.getTwoComponent().getResult());
        System.out.println(cmp.getResult());
    }
}
