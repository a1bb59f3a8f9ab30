package tripod.dustfit.core;

/**
 * Units a spectrum can be expressed in. Luminosities are intrinsic
 * (rest frame), fluxes are what an observer measures.
 */
public enum SpectralUnit {
    LUMINOSITY_NU ("erg/s/Hz", true),
    LUMINOSITY_LAMBDA ("erg/s/AA", true),
    FLUX_NU ("erg/s/cm^2/Hz", false),
    FLUX_LAMBDA ("erg/s/cm^2/AA", false),
    JANSKY ("Jy", false);

    final String symbol;
    final boolean luminosity;

    SpectralUnit (String symbol, boolean luminosity) {
        this.symbol = symbol;
        this.luminosity = luminosity;
    }

    public String getSymbol () { return symbol; }
    public boolean isLuminosity () { return luminosity; }

    public static SpectralUnit parse (String name) {
        if (name != null) {
            for (SpectralUnit u : values ()) {
                if (u.name().equalsIgnoreCase(name) 
                    || u.symbol.equals(name))
                    return u;
            }
        }
        throw new IllegalArgumentException ("Unknown spectral unit: "+name);
    }
}
