package tripod.dustfit.core;

/**
 * Free parameters of the dust model, in theta order.
 */
public enum Parameter {
    LOG_DUST_MASS_COLD ("log_dust_mass_cold", "log M_cold (M_sun)", true),
    TEMP_COLD ("temp_cold", "T_cold (K)", false),
    LOG_DUST_MASS_HOT ("log_dust_mass_hot", "log M_hot (M_sun)", true),
    TEMPERATURE_HOT ("temperature_hot", "T_hot (K)", false);

    final String key;
    final String label;
    final boolean logMass;

    Parameter (String key, String label, boolean logMass) {
        this.key = key;
        this.label = label;
        this.logMass = logMass;
    }

    /**
     * name used in result tables and configuration files
     */
    public String getKey () { return key; }
    public String getLabel () { return label; }
    public boolean isLogMass () { return logMass; }

    public static Parameter forKey (String key) {
        for (Parameter p : values ())
            if (p.key.equals(key))
                return p;
        throw new IllegalArgumentException ("Unknown parameter: "+key);
    }
}
