package tripod.dustfit.io;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;

import tripod.dustfit.core.Bandpass;
import tripod.dustfit.core.Observation;
import tripod.dustfit.core.Photometry;

/**
 * Reads the photometry of one object from UTF-8 delimited text such as
 *
 * <pre>
 * # SN 2004et, day 300
 * wavelength,flux,flux_err,limit,filter
 * 3.6,1.2e-3,6e-5,False,IRAC1
 * 4.5,2.1e-3,1e-4,False,IRAC2
 * 24,5e-3,1e-3,True,MIPS24
 * </pre>
 *
 * The filter column is optional; commas, tabs or blanks can separate
 * the columns.
 */
public class PhotometryReader {
    private static final Logger logger = 
        Logger.getLogger(PhotometryReader.class.getName());

    public static final String WAVELENGTH = "wavelength";
    public static final String FLUX = "flux";
    public static final String FLUX_ERR = "flux_err";
    public static final String LIMIT = "limit";
    public static final String FILTER = "filter";

    static final Map<String, String> ALIASES = new HashMap<String, String>();
    static {
        ALIASES.put("wave", WAVELENGTH);
        ALIASES.put("wavelength", WAVELENGTH);
        ALIASES.put("flux", FLUX);
        ALIASES.put("flux_err", FLUX_ERR);
        ALIASES.put("flux_error", FLUX_ERR);
        ALIASES.put("err", FLUX_ERR);
        ALIASES.put("error", FLUX_ERR);
        ALIASES.put("limit", LIMIT);
        ALIASES.put("limits", LIMIT);
        ALIASES.put("upper_limit", LIMIT);
        ALIASES.put("filter", FILTER);
        ALIASES.put("filters", FILTER);
    }

    private int lines;
    private BufferedReader reader;
    private BandpassLibrary bandpasses;
    private Map<String, Integer> columns = new HashMap<String, Integer>();

    public PhotometryReader (InputStream is) throws IOException {
        this (is, null);
    }

    public PhotometryReader (InputStream is, BandpassLibrary bandpasses) 
        throws IOException {
        reader = new BufferedReader (new InputStreamReader (is, "UTF-8"));
        this.bandpasses = bandpasses;

        String line;
        do {
            line = reader.readLine();
            ++lines;
        }
        while (line != null && isComment (line));

        if (line == null) {
            throw new IOException ("No header found");
        }

        String[] header = split (line);
        for (int i = 0; i < header.length; ++i) {
            String name = header[i] != null 
                ? ALIASES.get(header[i].trim().toLowerCase()) : null;
            if (name == null) {
                logger.warning("Ignoring unknown column \""+header[i]+"\"");
            }
            else if (columns.put(name, i) != null) {
                throw new IOException ("Duplicate column "+name
                                       +" in header: "+line);
            }
        }

        for (String c : new String[]{WAVELENGTH, FLUX, FLUX_ERR, LIMIT}) {
            if (!columns.containsKey(c)) {
                throw new IOException 
                    ("Invalid header: "+line+"; no column "+c);
            }
        }

        if (columns.containsKey(FILTER) && bandpasses == null) {
            throw new IOException
                ("Input has a filter column but no bandpass library "
                 +"was given");
        }
    }

    public boolean hasFilters () { return columns.containsKey(FILTER); }

    /**
     * Read all remaining observations into a new data set.
     */
    public Photometry read (String name) throws IOException {
        Photometry phot = new Photometry (name);
        for (String line; (line = reader.readLine()) != null; ) {
            ++lines;
            if (isComment (line))
                continue;

            String[] toks = split (line);
            Observation obs = parse (toks, line);
            if (obs != null)
                phot.add(obs);
        }
        logger.info(name+": "+phot.size()+" observation(s), "
                    +phot.getUpperLimitCount()+" upper limit(s)");
        return phot;
    }

    Observation parse (String[] toks, String line) throws IOException {
        for (Integer c : columns.values()) {
            if (c >= toks.length || toks[c] == null) {
                logger.warning(lines+": missing value in column "+c
                               +"; skipping line \""+line+"\"");
                return null;
            }
        }

        double wave, flux, err;
        try {
            wave = Double.parseDouble(toks[columns.get(WAVELENGTH)]);
            flux = Double.parseDouble(toks[columns.get(FLUX)]);
            err = Double.parseDouble(toks[columns.get(FLUX_ERR)]);
        }
        catch (NumberFormatException ex) {
            logger.warning(lines+": bogus number; skipping line \""
                           +line+"\"");
            return null;
        }

        boolean limit = parseLimit (toks[columns.get(LIMIT)].trim());
        Bandpass bp = null;
        if (hasFilters ()) {
            bp = bandpasses.getBandpass(toks[columns.get(FILTER)].trim());
        }
        return new Observation (wave, flux, err, limit, bp);
    }

    boolean parseLimit (String tok) throws IOException {
        String t = tok.toLowerCase();
        if ("true".equals(t) || "t".equals(t) 
            || "1".equals(t) || "yes".equals(t))
            return true;
        if ("false".equals(t) || "f".equals(t) 
            || "0".equals(t) || "no".equals(t))
            return false;
        throw new IOException (lines+": bogus limit flag \""+tok+"\"");
    }

    static boolean isComment (String line) {
        String s = line.trim();
        return s.length() == 0 || s.charAt(0) == '#';
    }

    /**
     * Split on commas if there are any, otherwise on tabs, otherwise on
     * blanks.
     */
    static String[] split (String line) {
        if (line.indexOf(',') >= 0)
            return tokenizer (line, ',');
        if (line.indexOf('\t') >= 0)
            return tokenizer (line.trim(), '\t');
        return line.trim().split("\\s+");
    }

    static String[] tokenizer (String line, char delim) {
        List<String> toks = new ArrayList<String>();

        int len = line.length(), parity = 0;
        StringBuilder curtok = new StringBuilder ();
        for (int i = 0; i < len; ++i) {
            char ch = line.charAt(i);
            if (ch == '"') {
                parity ^= 1;
            }
            if (ch == delim) {
                if (parity == 0) {
                    String tok = curtok.toString().trim();
                    toks.add(tok.length() > 0 ? tok : null);
                    curtok.setLength(0);
                }
                else {
                    curtok.append(ch);
                }
            }
            else if (ch != '"') {
                curtok.append(ch);
            }
        }

        if (curtok.toString().trim().length() > 0) {
            toks.add(curtok.toString().trim());
        }
        // if the line ends with the delimiter, then append an empty token
        else if (len > 0 && line.charAt(len-1) == delim)
            toks.add(null); 

        return toks.toArray(new String[0]);
    }

    public static Photometry read (File file, String name, 
                                   BandpassLibrary bandpasses) 
        throws IOException {
        InputStream is = new FileInputStream (file);
        try {
            return new PhotometryReader (is, bandpasses).read(name);
        }
        finally {
            is.close();
        }
    }
}
