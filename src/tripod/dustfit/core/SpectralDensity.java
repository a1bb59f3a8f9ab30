package tripod.dustfit.core;

/**
 * A spectrum sampled on a wavelength grid together with its unit. The
 * unit is checked once where a SpectralDensity enters a computation so
 * the arithmetic underneath can assume canonical cgs values.
 */
public class SpectralDensity {
    private final double[] values;
    private final SpectralUnit unit;

    public SpectralDensity (double[] values, SpectralUnit unit) {
        if (values == null) {
            throw new IllegalArgumentException ("No spectral values given");
        }
        if (unit == null) {
            throw new IllegalArgumentException ("No spectral unit given");
        }
        this.values = values;
        this.unit = unit;
    }

    public SpectralUnit getUnit () { return unit; }
    public int size () { return values.length; }
    public double get (int i) { return values[i]; }

    /**
     * a copy of the underlying values
     */
    public double[] values () { return (double[])values.clone(); }

    double[] raw () { return values; }

    public String toString () {
        return "SpectralDensity{unit="+unit.getSymbol()
            +",size="+values.length+"}";
    }
}
