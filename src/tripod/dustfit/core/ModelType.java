package tripod.dustfit.core;

/**
 * Number of thermal dust components in the model.
 */
public enum ModelType {
    ONE_COMPONENT (1, Parameter.LOG_DUST_MASS_COLD, Parameter.TEMP_COLD),
    TWO_COMPONENT (2, Parameter.LOG_DUST_MASS_COLD, Parameter.TEMP_COLD,
                   Parameter.LOG_DUST_MASS_HOT, Parameter.TEMPERATURE_HOT);

    final int components;
    final Parameter[] params;

    ModelType (int components, Parameter... params) {
        this.components = components;
        this.params = params;
    }

    public int getComponents () { return components; }
    public int getNumParams () { return params.length; }
    public Parameter getParam (int n) { return params[n]; }
    public Parameter[] parameters () { return (Parameter[])params.clone(); }

    public static ModelType forComponents (int n) {
        switch (n) {
        case 1: return ONE_COMPONENT;
        case 2: return TWO_COMPONENT;
        }
        throw new IllegalArgumentException
            ("Number of components must be 1 or 2 but got "+n);
    }

    /**
     * Check a parameter vector has the right dimension for this model.
     */
    public void check (double[] theta) {
        if (theta == null || theta.length != params.length) {
            throw new IllegalArgumentException
                (this+" expects "+params.length+" parameters but got "
                 +(theta == null ? null : theta.length));
        }
    }
}
