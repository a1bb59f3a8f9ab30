package tripod.dustfit.io;

import java.io.*;
import java.util.*;
import java.util.logging.Logger;

/**
 * Two-column numeric table (x y) as used by opacity and bandpass
 * files. Blank lines and lines starting with # are skipped; columns may
 * be separated by commas, tabs or blanks.
 */
class ColumnTable {
    private static final Logger logger = 
        Logger.getLogger(ColumnTable.class.getName());

    final double[] x;
    final double[] y;

    ColumnTable (double[] x, double[] y) {
        this.x = x;
        this.y = y;
    }

    static ColumnTable read (File file) throws IOException {
        InputStream is = new FileInputStream (file);
        try {
            return read (is, file.getName());
        }
        finally {
            is.close();
        }
    }

    static ColumnTable read (InputStream is, String source) 
        throws IOException {
        BufferedReader br = new BufferedReader
            (new InputStreamReader (is, "UTF-8"));
        List<double[]> rows = new ArrayList<double[]>();
        int lines = 0;
        for (String line; (line = br.readLine()) != null; ) {
            ++lines;
            line = line.trim();
            if (line.length() == 0 || line.charAt(0) == '#')
                continue;

            String[] toks = PhotometryReader.split(line);
            if (toks.length < 2) {
                throw new IOException 
                    (source+":"+lines+": expecting 2 columns but got "
                     +toks.length);
            }
            try {
                rows.add(new double[]{
                        Double.parseDouble(toks[0]),
                        Double.parseDouble(toks[1])
                    });
            }
            catch (NumberFormatException ex) {
                // column headers are allowed on the first data line only
                if (rows.isEmpty()) {
                    logger.fine(source+":"+lines+": skipping header "+line);
                }
                else {
                    throw new IOException 
                        (source+":"+lines+": bogus number in \""+line+"\"", 
                         ex);
                }
            }
        }

        double[] x = new double[rows.size()];
        double[] y = new double[rows.size()];
        for (int i = 0; i < x.length; ++i) {
            x[i] = rows.get(i)[0];
            y[i] = rows.get(i)[1];
        }
        return new ColumnTable (x, y);
    }
}
