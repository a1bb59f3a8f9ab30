package tripod.dustfit.core;

/**
 * Physical constants in cgs units.
 */
public final class Constants {
    public static final double PLANCK = 6.62607015e-27; // erg s
    public static final double BOLTZMANN = 1.380649e-16; // erg/K
    public static final double SPEED_OF_LIGHT = 2.99792458e10; // cm/s
    public static final double SOLAR_MASS = 1.988409870698051e33; // g
    public static final double JANSKY = 1e-23; // erg/s/cm^2/Hz
    public static final double MEGAPARSEC = 3.0856775814913673e24; // cm

    public static final double MICRON = 1e-4; // cm
    public static final double ANGSTROM = 1e-8; // cm

    private Constants () {}
}
