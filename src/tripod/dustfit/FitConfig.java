package tripod.dustfit;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import java.util.logging.Logger;

import tripod.dustfit.core.Cosmology;
import tripod.dustfit.core.ExtrapolationPolicy;
import tripod.dustfit.core.Parameter;
import tripod.dustfit.core.Prior;
import tripod.dustfit.core.SedModel;

/**
 * Immutable settings of a dust fit. Instances are created with a
 * {@link Builder}, optionally seeded from properties (see
 * {@link #load()}), and handed to every fit explicitly so that fits
 * running side by side never share mutable state.
 */
public class FitConfig {
    private static final Logger logger =
        Logger.getLogger(FitConfig.class.getName());

    public static final String RESOURCE = "/dustfit.properties";
    public static final String PREFIX = "dustfit.";

    public static class Builder {
        int walkers = 32;
        int steps = 1000;
        double burnIn = 0.75;
        int cores = 1;
        double sigmaClip = 2.;
        int repeats = 3;
        String composition = "carbon";
        double grainSize = 0.1;
        int filterSamples = SedModel.DEFAULT_FILTER_SAMPLES;
        long seed = 42l;
        double distance = Double.NaN; // cm; NaN means from the redshift
        double h0 = Cosmology.DEFAULT_H0;
        double omegaM = Cosmology.DEFAULT_OMEGA_M;
        Prior.Bounds bounds = Prior.DEFAULT_BOUNDS;
        Prior.Bounds initialBounds; // null means the prior bounds
        ExtrapolationPolicy extrapolation = ExtrapolationPolicy.ERROR;
        boolean plot = true;
        File outputDir = new File (".");
        File opacityDir = new File (".");
        File filterDir; // null means no bandpasses

        public Builder () {}

        public Builder setWalkers (int walkers) {
            this.walkers = walkers;
            return this;
        }
        public Builder setSteps (int steps) {
            this.steps = steps;
            return this;
        }
        public Builder setBurnIn (double burnIn) {
            this.burnIn = burnIn;
            return this;
        }
        public Builder setCores (int cores) {
            this.cores = cores;
            return this;
        }
        public Builder setSigmaClip (double sigmaClip) {
            this.sigmaClip = sigmaClip;
            return this;
        }
        public Builder setRepeats (int repeats) {
            this.repeats = repeats;
            return this;
        }
        public Builder setComposition (String composition) {
            this.composition = composition;
            return this;
        }
        public Builder setGrainSize (double grainSize) {
            this.grainSize = grainSize;
            return this;
        }
        public Builder setFilterSamples (int filterSamples) {
            this.filterSamples = filterSamples;
            return this;
        }
        public Builder setSeed (long seed) {
            this.seed = seed;
            return this;
        }
        public Builder setDistance (double distance) {
            this.distance = distance;
            return this;
        }
        public Builder setCosmology (double h0, double omegaM) {
            this.h0 = h0;
            this.omegaM = omegaM;
            return this;
        }
        public Builder setBounds (Prior.Bounds bounds) {
            this.bounds = bounds;
            return this;
        }
        public Builder setBound (Parameter p, double lower, double upper) {
            this.bounds = bounds.with(p, lower, upper);
            return this;
        }
        public Builder setInitialBound (Parameter p, double lower,
                                        double upper) {
            this.initialBounds = (initialBounds != null
                                  ? initialBounds : bounds)
                .with(p, lower, upper);
            return this;
        }
        public Builder setExtrapolation (ExtrapolationPolicy extrapolation) {
            this.extrapolation = extrapolation;
            return this;
        }
        public Builder setPlot (boolean plot) {
            this.plot = plot;
            return this;
        }
        public Builder setOutputDir (File outputDir) {
            this.outputDir = outputDir;
            return this;
        }
        public Builder setOpacityDir (File opacityDir) {
            this.opacityDir = opacityDir;
            return this;
        }
        public Builder setFilterDir (File filterDir) {
            this.filterDir = filterDir;
            return this;
        }

        /**
         * Apply every dustfit.* entry of the given properties.
         */
        public Builder setProperties (Properties props) {
            for (String name : props.stringPropertyNames()) {
                if (name.startsWith(PREFIX)) {
                    set (name.substring(PREFIX.length()),
                         props.getProperty(name).trim());
                }
            }
            return this;
        }

        void set (String key, String value) {
            try {
                if ("walkers".equals(key)) walkers = Integer.parseInt(value);
                else if ("steps".equals(key)) steps = Integer.parseInt(value);
                else if ("burnIn".equals(key))
                    burnIn = Double.parseDouble(value);
                else if ("cores".equals(key)) cores = Integer.parseInt(value);
                else if ("sigmaClip".equals(key))
                    sigmaClip = Double.parseDouble(value);
                else if ("repeats".equals(key))
                    repeats = Integer.parseInt(value);
                else if ("composition".equals(key)) composition = value;
                else if ("grainSize".equals(key))
                    grainSize = Double.parseDouble(value);
                else if ("filterSamples".equals(key))
                    filterSamples = Integer.parseInt(value);
                else if ("seed".equals(key)) seed = Long.parseLong(value);
                else if ("distance".equals(key))
                    distance = Double.parseDouble(value);
                else if ("h0".equals(key)) h0 = Double.parseDouble(value);
                else if ("omegaM".equals(key))
                    omegaM = Double.parseDouble(value);
                else if ("extrapolation".equals(key))
                    extrapolation = ExtrapolationPolicy.valueOf
                        (value.toUpperCase());
                else if ("plot".equals(key))
                    plot = Boolean.parseBoolean(value);
                else if ("outputDir".equals(key))
                    outputDir = new File (value);
                else if ("opacityDir".equals(key))
                    opacityDir = new File (value);
                else if ("filterDir".equals(key))
                    filterDir = value.length() > 0 ? new File (value) : null;
                else if (key.startsWith("prior."))
                    bounds = parseBound (bounds, key.substring(6), value);
                else if (key.startsWith("init."))
                    initialBounds = parseBound
                        (initialBounds != null ? initialBounds : bounds,
                         key.substring(5), value);
                else
                    logger.warning("Ignoring unknown setting "+PREFIX+key);
            }
            catch (NumberFormatException ex) {
                throw new IllegalArgumentException
                    ("Bogus value for "+PREFIX+key+": \""+value+"\"", ex);
            }
        }

        static Prior.Bounds parseBound (Prior.Bounds b, String param,
                                        String value) {
            String[] toks = value.split("[,\\s]+");
            if (toks.length != 2) {
                throw new IllegalArgumentException
                    ("Expecting \"lower,upper\" for "+param+" but got \""
                     +value+"\"");
            }
            return b.with(Parameter.forKey(param),
                          Double.parseDouble(toks[0]),
                          Double.parseDouble(toks[1]));
        }

        public FitConfig build () {
            return new FitConfig (this);
        }
    }

    private final int walkers;
    private final int steps;
    private final double burnIn;
    private final int cores;
    private final double sigmaClip;
    private final int repeats;
    private final String composition;
    private final double grainSize;
    private final int filterSamples;
    private final long seed;
    private final double distance;
    private final double h0, omegaM;
    private final Prior.Bounds bounds;
    private final Prior.Bounds initialBounds;
    private final ExtrapolationPolicy extrapolation;
    private final boolean plot;
    private final File outputDir;
    private final File opacityDir;
    private final File filterDir;

    FitConfig (Builder b) {
        if (b.walkers < 4) {
            throw new IllegalArgumentException
                ("Need at least 4 walkers but got "+b.walkers);
        }
        if (b.steps < 1) {
            throw new IllegalArgumentException
                ("Number of steps must be positive but got "+b.steps);
        }
        if (!(b.burnIn >= 0. && b.burnIn < 1.)) {
            throw new IllegalArgumentException
                ("Burn-in must be in [0,1) but got "+b.burnIn);
        }
        if (b.cores < 1) {
            throw new IllegalArgumentException
                ("Number of cores must be positive but got "+b.cores);
        }
        if (!(b.sigmaClip > 0.)) {
            throw new IllegalArgumentException
                ("Sigma clip must be positive but got "+b.sigmaClip);
        }
        if (b.repeats < 1) {
            throw new IllegalArgumentException
                ("Number of repeats must be positive but got "+b.repeats);
        }
        if (b.composition == null || b.composition.length() == 0) {
            throw new IllegalArgumentException ("No dust composition given");
        }
        if (!(b.grainSize > 0.)) {
            throw new IllegalArgumentException
                ("Grain size must be positive but got "+b.grainSize);
        }
        if (b.repeats == 1 && (int)(b.steps * (1. - b.burnIn)) < 1) {
            throw new IllegalArgumentException
                ("Burn-in of "+b.burnIn+" leaves no samples out of "
                 +b.steps+" steps");
        }
        if (b.bounds == null || b.extrapolation == null
            || b.outputDir == null) {
            throw new IllegalArgumentException
                ("Prior bounds, extrapolation policy and output directory "
                 +"are required");
        }

        walkers = b.walkers;
        steps = b.steps;
        burnIn = b.burnIn;
        cores = b.cores;
        sigmaClip = b.sigmaClip;
        repeats = b.repeats;
        composition = b.composition;
        grainSize = b.grainSize;
        filterSamples = b.filterSamples;
        seed = b.seed;
        distance = b.distance;
        h0 = b.h0;
        omegaM = b.omegaM;
        bounds = b.bounds;
        initialBounds = b.initialBounds != null ? b.initialBounds : b.bounds;
        extrapolation = b.extrapolation;
        plot = b.plot;
        outputDir = b.outputDir;
        opacityDir = b.opacityDir;
        filterDir = b.filterDir;
    }

    public static Builder builder () { return new Builder (); }

    /**
     * Defaults from the dustfit.properties resource, overridden by any
     * dustfit.* system property.
     */
    public static Builder load () throws IOException {
        Builder b = new Builder ();
        InputStream is = FitConfig.class.getResourceAsStream(RESOURCE);
        if (is != null) {
            try {
                Properties props = new Properties ();
                props.load(is);
                b.setProperties(props);
            }
            finally {
                is.close();
            }
        }
        else {
            logger.warning("No "+RESOURCE+" found; using built-in defaults");
        }
        b.setProperties(System.getProperties());
        return b;
    }

    public int getWalkers () { return walkers; }
    public int getSteps () { return steps; }
    public double getBurnIn () { return burnIn; }
    public int getCores () { return cores; }
    public double getSigmaClip () { return sigmaClip; }
    public int getRepeats () { return repeats; }
    public String getComposition () { return composition; }
    public double getGrainSize () { return grainSize; }
    public int getFilterSamples () { return filterSamples; }
    public long getSeed () { return seed; }
    public Prior.Bounds getBounds () { return bounds; }
    public Prior.Bounds getInitialBounds () { return initialBounds; }
    public ExtrapolationPolicy getExtrapolation () { return extrapolation; }
    public boolean getPlot () { return plot; }
    public File getOutputDir () { return outputDir; }
    public File getOpacityDir () { return opacityDir; }
    public File getFilterDir () { return filterDir; }

    public boolean hasDistance () { return !Double.isNaN(distance); }
    public double getDistance () { return distance; }

    /**
     * The configured luminosity distance (cm), or the one implied by
     * the redshift in the configured cosmology.
     */
    public double getDistance (double redshift) {
        return hasDistance ()
            ? distance : new Cosmology (h0, omegaM).luminosityDistance(redshift);
    }

    public String toString () {
        return "FitConfig{walkers="+walkers+",steps="+steps+",burnIn="
            +burnIn+",cores="+cores+",sigmaClip="+sigmaClip+",repeats="
            +repeats+",composition="+composition+",grainSize="+grainSize
            +",seed="+seed+"}";
    }
}
