package tripod.dustfit.io;

import java.io.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.logging.Logger;

import tripod.dustfit.core.Bandpass;

/**
 * Bandpasses stored one per file as <name>.dat or <name>.txt with
 * wavelength (micron) and transmission columns. Curves are cached once
 * read, so one library can be shared between fits.
 */
public class DirectoryBandpassLibrary implements BandpassLibrary {
    private static final Logger logger = 
        Logger.getLogger(DirectoryBandpassLibrary.class.getName());

    static final String[] EXTENSIONS = {".dat", ".txt"};

    final File dir;
    final ConcurrentMap<String, Bandpass> cache = 
        new ConcurrentHashMap<String, Bandpass>();

    public DirectoryBandpassLibrary (File dir) {
        if (!dir.isDirectory()) {
            throw new IllegalArgumentException 
                (dir+" is not a directory");
        }
        this.dir = dir;
    }

    public File getDirectory () { return dir; }

    public Bandpass getBandpass (String name) throws IOException {
        Bandpass bp = cache.get(name);
        if (bp == null) {
            bp = load (name);
            Bandpass prev = cache.putIfAbsent(name, bp);
            if (prev != null)
                bp = prev;
        }
        return bp;
    }

    Bandpass load (String name) throws IOException {
        for (String ext : EXTENSIONS) {
            File file = new File (dir, name+ext);
            if (file.exists()) {
                logger.info("Loading bandpass "+name+" from "+file);
                ColumnTable table = ColumnTable.read(file);
                try {
                    return new Bandpass (name, table.x, table.y);
                }
                catch (IllegalArgumentException ex) {
                    throw new IOException 
                        (file+": invalid bandpass; "+ex.getMessage(), ex);
                }
            }
        }
        throw new FileNotFoundException 
            ("No bandpass \""+name+"\" in "+dir);
    }
}
