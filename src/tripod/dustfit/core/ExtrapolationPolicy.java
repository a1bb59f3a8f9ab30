package tripod.dustfit.core;

/**
 * What to do when opacity is requested outside the tabulated
 * wavelength range.
 */
public enum ExtrapolationPolicy {
    ERROR, // refuse with IllegalArgumentException
    CLAMP  // use the value at the nearest tabulated edge
}
