package tripod.dustfit.io;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;

import tripod.dustfit.core.Estimate;
import tripod.dustfit.core.FitResult;

/**
 * Writes a fit summary as a blank separated table with the columns
 * parameter, median, upper and lower; one row per parameter followed
 * by the total dust mass.
 */
public class ParameterTableWriter {
    private static final Logger logger = 
        Logger.getLogger(ParameterTableWriter.class.getName());

    public static final String HEADER = "parameter median upper lower";

    private final PrintWriter pw;

    public ParameterTableWriter (Writer writer) {
        pw = new PrintWriter (writer);
    }

    public void write (FitResult result) throws IOException {
        pw.println(HEADER);
        for (Map.Entry<String, Estimate> me 
                 : result.getEstimates().entrySet()) {
            Estimate e = me.getValue();
            pw.println(me.getKey()+" "+e.getMedian()+" "+e.getUpper()
                       +" "+e.getLower());
        }
        pw.flush();
        if (pw.checkError()) {
            throw new IOException ("Can't write parameter table");
        }
    }

    /**
     * parameters_<object>_<components>.txt
     */
    public static String getFileName (String object, int components) {
        return "parameters_"+object+"_"+components+".txt";
    }

    public static File write (File dir, String object, FitResult result) 
        throws IOException {
        File file = new File 
            (dir, getFileName (object, result.getType().getComponents()));
        Writer w = new OutputStreamWriter 
            (new FileOutputStream (file), "UTF-8");
        try {
            new ParameterTableWriter(w).write(result);
        }
        finally {
            w.close();
        }
        logger.info("Parameters written to "+file);
        return file;
    }

    /**
     * Parse a table written by this class back into name/estimate
     * pairs, in file order.
     */
    public static Map<String, Estimate> read (InputStream is) 
        throws IOException {
        BufferedReader br = new BufferedReader (new InputStreamReader 
                                                (is, "UTF-8"));
        String line = br.readLine();
        if (line == null || !HEADER.equals(line.trim())) {
            throw new IOException ("Invalid header: "+line);
        }

        Map<String, Estimate> table = new LinkedHashMap<String, Estimate>();
        for (int lines = 2; (line = br.readLine()) != null; ++lines) {
            String[] toks = line.trim().split("\\s+");
            if (toks.length != 4) {
                throw new IOException 
                    (lines+": expecting 4 columns but got "+toks.length);
            }
            try {
                table.put(toks[0], new Estimate 
                          (Double.parseDouble(toks[1]),
                           Double.parseDouble(toks[2]),
                           Double.parseDouble(toks[3])));
            }
            catch (NumberFormatException ex) {
                throw new IOException (lines+": bogus number", ex);
            }
        }
        return table;
    }
}
