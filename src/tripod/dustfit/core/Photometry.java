package tripod.dustfit.core;

import java.io.Serializable;
import java.util.List;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;

/**
 * POJO photometric data set for a single object
 */
public class Photometry implements Serializable {
    private static final long serialVersionUID = 0x52ad6e08c4b19f3dl;

    private String name; // object name
    private String comments; // any comments
    private List<Observation> observations = new ArrayList<Observation>();

    public Photometry () {}
    public Photometry (String name) {
        this.name = name;
    }

    public Photometry setName (String name) {
        this.name = name;
        return this;
    }
    public String getName () { return name; }

    public Photometry setComments (String comments) {
        this.comments = comments;
        return this;
    }
    public String getComments () { return comments; }

    public Photometry add (Observation obs) {
        if (obs == null) {
            throw new IllegalArgumentException ("Null observation");
        }
        observations.add(obs);
        return this;
    }

    public Photometry add (double wavelength, double flux,
                           double fluxErr, boolean upperLimit) {
        return add (new Observation (wavelength, flux, fluxErr, upperLimit));
    }

    public int size () { return observations.size(); }
    public Observation get (int pos) { return observations.get(pos); }
    public Iterator<Observation> observations () {
        return observations.iterator();
    }

    public List<Observation> getObservations () {
        return Collections.unmodifiableList(observations);
    }

    public int getDetectionCount () {
        int c = 0;
        for (Observation o : observations)
            if (!o.isUpperLimit())
                ++c;
        return c;
    }

    public int getUpperLimitCount () {
        return size () - getDetectionCount ();
    }

    /**
     * true if every observation carries a bandpass
     */
    public boolean hasBandpasses () {
        if (observations.isEmpty())
            return false;
        for (Observation o : observations)
            if (o.getBandpass() == null)
                return false;
        return true;
    }

    public double[] getWavelengths () {
        double[] w = new double[size ()];
        for (int i = 0; i < w.length; ++i)
            w[i] = observations.get(i).getWavelength();
        return w;
    }

    public double[] getFluxes () {
        double[] f = new double[size ()];
        for (int i = 0; i < f.length; ++i)
            f[i] = observations.get(i).getFlux();
        return f;
    }

    public double[] getFluxErrors () {
        double[] e = new double[size ()];
        for (int i = 0; i < e.length; ++i)
            e[i] = observations.get(i).getFluxErr();
        return e;
    }

    public boolean[] getUpperLimits () {
        boolean[] l = new boolean[size ()];
        for (int i = 0; i < l.length; ++i)
            l[i] = observations.get(i).isUpperLimit();
        return l;
    }

    public Bandpass[] getBandpasses () {
        if (!hasBandpasses ())
            return null;
        Bandpass[] b = new Bandpass[size ()];
        for (int i = 0; i < b.length; ++i)
            b[i] = observations.get(i).getBandpass();
        return b;
    }

    /**
     * Make sure this data set can be fitted; throws
     * IllegalArgumentException otherwise.
     */
    public void validate () {
        if (observations.isEmpty()) {
            throw new IllegalArgumentException
                ("Photometry "+name+" contains no observations!");
        }

        int withBandpass = 0;
        for (int i = 0; i < observations.size(); ++i) {
            Observation o = observations.get(i);
            if (!(o.getWavelength() > 0.)) {
                throw new IllegalArgumentException
                    (name+": observation "+i+" has invalid wavelength "
                     +o.getWavelength());
            }
            if (Double.isNaN(o.getFlux()) || Double.isInfinite(o.getFlux())) {
                throw new IllegalArgumentException
                    (name+": observation "+i+" has invalid flux "
                     +o.getFlux());
            }
            // limits may be exact; detections need a weight
            double err = o.getFluxErr();
            if (Double.isNaN(err) || Double.isInfinite(err) || err < 0.
                || (err == 0. && !o.isUpperLimit())) {
                throw new IllegalArgumentException
                    (name+": observation "+i+" has invalid flux error "
                     +o.getFluxErr());
            }
            if (o.getBandpass() != null)
                ++withBandpass;
        }

        if (withBandpass != 0 && withBandpass != observations.size()) {
            throw new IllegalArgumentException
                (name+": "+withBandpass+" of "+observations.size()
                 +" observations have a bandpass; either all or none "
                 +"must have one");
        }
    }

    public String toString () { return name; }
}
