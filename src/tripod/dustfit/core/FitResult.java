package tripod.dustfit.core;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Summary of one dust model fit: an estimate per model parameter, in
 * theta order, followed by the derived total dust mass.
 */
public class FitResult implements Serializable {
    private static final long serialVersionUID = 0x5a6b7c8d9e0f1a2bl;

    public static final String TOTAL_DUST_MASS = "total_dust_mass";

    private final ModelType type;
    private final Map<String, Estimate> estimates;

    public FitResult (ModelType type, Estimate[] params, Estimate totalMass) {
        if (params.length != type.getNumParams()) {
            throw new IllegalArgumentException
                (type+" has "+type.getNumParams()+" parameters but got "
                 +params.length+" estimates");
        }
        Map<String, Estimate> m = new LinkedHashMap<String, Estimate>();
        for (int i = 0; i < params.length; ++i)
            m.put(type.getParam(i).getKey(), params[i]);
        m.put(TOTAL_DUST_MASS, totalMass);
        this.type = type;
        this.estimates = Collections.unmodifiableMap(m);
    }

    public ModelType getType () { return type; }

    /**
     * parameter name to estimate, total dust mass last
     */
    public Map<String, Estimate> getEstimates () { return estimates; }
    public Estimate get (String name) { return estimates.get(name); }
    public Estimate get (Parameter p) { return estimates.get(p.getKey()); }
    public Estimate getTotalDustMass () { return estimates.get(TOTAL_DUST_MASS); }

    /**
     * the median of every model parameter as a parameter vector
     */
    public double[] getMedians () {
        double[] theta = new double[type.getNumParams()];
        for (int i = 0; i < theta.length; ++i)
            theta[i] = get(type.getParam(i)).getMedian();
        return theta;
    }

    public String toString () {
        StringBuilder sb = new StringBuilder ("FitResult{\n");
        sb.append(" model: "+type+"\n");
        for (Map.Entry<String, Estimate> me : estimates.entrySet())
            sb.append(" "+me.getKey()+": "+me.getValue()+"\n");
        sb.append("}");
        return sb.toString();
    }
}
