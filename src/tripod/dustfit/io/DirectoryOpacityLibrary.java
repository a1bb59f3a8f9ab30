package tripod.dustfit.io;

import java.io.*;
import java.math.BigDecimal;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

import tripod.dustfit.core.OpacityCurve;
import tripod.dustfit.core.OpacityLibrary;

/**
 * Opacity tables stored as <composition>_<grainSize>.txt, each holding
 * wavelength (micron) and mass absorption coefficient (cm^2/g)
 * columns, e.g. carbon_0.1.txt. Tables are read once and cached.
 */
public class DirectoryOpacityLibrary implements OpacityLibrary {
    private static final Logger logger = 
        Logger.getLogger(DirectoryOpacityLibrary.class.getName());

    final File dir;
    final ConcurrentMap<String, OpacityCurve> cache = 
        new ConcurrentHashMap<String, OpacityCurve>();

    public DirectoryOpacityLibrary (File dir) {
        if (!dir.isDirectory()) {
            throw new IllegalArgumentException 
                (dir+" is not a directory");
        }
        this.dir = dir;
    }

    public File getDirectory () { return dir; }

    public static String getFileName (String composition, double grainSize) {
        return composition+"_"+BigDecimal.valueOf(grainSize)
            .stripTrailingZeros().toPlainString()+".txt";
    }

    public OpacityCurve getCurve (String composition, double grainSize) 
        throws IOException {
        if (composition == null || !(grainSize > 0.)) {
            throw new IllegalArgumentException
                ("Invalid opacity key "+composition+"/"+grainSize);
        }

        String key = getFileName (composition, grainSize);
        OpacityCurve curve = cache.get(key);
        if (curve == null) {
            File file = new File (dir, key);
            if (!file.exists()) {
                throw new FileNotFoundException
                    ("No opacity table for "+composition+" grains of "
                     +grainSize+" um ("+file+")");
            }
            logger.info("Loading opacity table "+file);
            ColumnTable table = ColumnTable.read(file);
            try {
                curve = new OpacityCurve 
                    (composition, grainSize, table.x, table.y);
            }
            catch (IllegalArgumentException ex) {
                throw new IOException 
                    (file+": invalid opacity table; "+ex.getMessage(), ex);
            }
            OpacityCurve prev = cache.putIfAbsent(key, curve);
            if (prev != null)
                curve = prev;
        }
        return curve;
    }
}
