package tripod.dustfit.core;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.Map;

import tripod.dustfit.mcmc.LogDensity;

/**
 * Uniform box prior over the model parameters. For the two-component
 * model the hot component must also be hotter than the cold one, which
 * removes the label swap degeneracy between the components.
 */
public class Prior implements LogDensity {
    /**
     * Open interval (lower, upper) for one parameter.
     */
    public static class Bound implements Serializable {
        private static final long serialVersionUID = 0x7d1e2c3b4a596877l;

        final double lower, upper;

        public Bound (double lower, double upper) {
            if (!(lower < upper)) {
                throw new IllegalArgumentException
                    ("Invalid bound ("+lower+","+upper+")");
            }
            this.lower = lower;
            this.upper = upper;
        }

        public double getLower () { return lower; }
        public double getUpper () { return upper; }
        public boolean contains (double x) { return lower < x && x < upper; }

        public String toString () { return "("+lower+","+upper+")"; }
    }

    /**
     * Immutable set of bounds, one per parameter.
     */
    public static class Bounds implements Serializable {
        private static final long serialVersionUID = 0x2a4d6f8091b3c5e7l;

        final Map<Parameter, Bound> bounds;

        Bounds (Map<Parameter, Bound> bounds) {
            for (Parameter p : Parameter.values()) {
                if (!bounds.containsKey(p)) {
                    throw new IllegalArgumentException
                        ("No bound for parameter "+p.getKey());
                }
            }
            this.bounds = new EnumMap<Parameter, Bound>(bounds);
        }

        public Bound get (Parameter p) { return bounds.get(p); }

        /**
         * a copy of these bounds with one parameter replaced
         */
        public Bounds with (Parameter p, double lower, double upper) {
            Map<Parameter, Bound> m = new EnumMap<Parameter, Bound>(bounds);
            m.put(p, new Bound (lower, upper));
            return new Bounds (m);
        }

        public String toString () { return "Bounds"+bounds; }
    }

    public static final Bounds DEFAULT_BOUNDS;
    static {
        Map<Parameter, Bound> m = new EnumMap<Parameter, Bound>
            (Parameter.class);
        m.put(Parameter.LOG_DUST_MASS_COLD, new Bound (-6., 1.));
        m.put(Parameter.TEMP_COLD, new Bound (20., 2000.));
        m.put(Parameter.LOG_DUST_MASS_HOT, new Bound (-8., 1.));
        m.put(Parameter.TEMPERATURE_HOT, new Bound (20., 3000.));
        DEFAULT_BOUNDS = new Bounds (m);
    }

    final ModelType type;
    final Bounds bounds;

    public Prior (ModelType type) {
        this (type, DEFAULT_BOUNDS);
    }

    public Prior (ModelType type, Bounds bounds) {
        if (type == null || bounds == null) {
            throw new IllegalArgumentException
                ("Prior needs a model type and bounds");
        }
        this.type = type;
        this.bounds = bounds;
    }

    public ModelType getType () { return type; }
    public Bounds getBounds () { return bounds; }
    public Bound getBound (int n) { return bounds.get(type.getParam(n)); }
    public int getDimension () { return type.getNumParams(); }

    public double[] getLowerBounds () {
        double[] lo = new double[getDimension ()];
        for (int i = 0; i < lo.length; ++i)
            lo[i] = getBound(i).getLower();
        return lo;
    }

    public double[] getUpperBounds () {
        double[] hi = new double[getDimension ()];
        for (int i = 0; i < hi.length; ++i)
            hi[i] = getBound(i).getUpper();
        return hi;
    }

    public double logDensity (double[] theta) { return logPrior (theta); }

    /**
     * 0 inside the prior volume, -infinity outside of it (NaN included).
     */
    public double logPrior (double[] theta) {
        type.check(theta);
        for (int i = 0; i < theta.length; ++i) {
            if (!getBound(i).contains(theta[i]))
                return Double.NEGATIVE_INFINITY;
        }

        if (type == ModelType.TWO_COMPONENT && !(theta[3] > theta[1]))
            return Double.NEGATIVE_INFINITY;

        return 0.;
    }
}
