package tripod.dustfit.io;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.assertj.core.api.Assertions.*;

import tripod.dustfit.core.Bandpass;
import tripod.dustfit.core.Fixtures;
import tripod.dustfit.core.Photometry;

class PhotometryReaderTest {

    static InputStream stream (String text) {
        return new ByteArrayInputStream (text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void readsCommaSeparatedPhotometry() throws IOException {
        Photometry phot = new PhotometryReader (stream
            ("# SN 2004et\n"
             +"wavelength,flux,flux_err,limit\n"
             +"3.6,1.2e-3,6e-5,False\n"
             +"\n"
             +"24,5e-3,1e-3,True\n")).read("sn2004et");
        assertThat(phot.getName()).isEqualTo("sn2004et");
        assertThat(phot.getWavelengths()).containsExactly(3.6, 24.);
        assertThat(phot.getFluxes()).containsExactly(1.2e-3, 5e-3);
        assertThat(phot.getFluxErrors()).containsExactly(6e-5, 1e-3);
        assertThat(phot.getUpperLimits()).containsExactly(false, true);
    }

    @Test
    void readsBlankSeparatedColumnsInAnyOrder() throws IOException {
        Photometry phot = new PhotometryReader (stream
            ("limit  flux  wave  error\n"
             +"0  1e-3  10  1e-4\n"
             +"1  2e-3  20  2e-4\n")).read("x");
        assertThat(phot.getWavelengths()).containsExactly(10., 20.);
        assertThat(phot.getUpperLimits()).containsExactly(false, true);
    }

    @Test
    void skipsBogusLines() throws IOException {
        Photometry phot = new PhotometryReader (stream
            ("wavelength\tflux\tflux_err\tlimit\n"
             +"10\tabc\t1e-4\tfalse\n"
             +"20\t2e-3\t2e-4\tfalse\n"
             +"30\t3e-3\n")).read("x");
        assertThat(phot.size()).isEqualTo(1);
        assertThat(phot.get(0).getWavelength()).isEqualTo(20.);
    }

    @Test
    void missingColumnIsAnError() {
        assertThatThrownBy(() -> new PhotometryReader 
                           (stream ("wavelength,flux,limit\n")))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("flux_err");
    }

    @Test
    void emptyInputIsAnError() {
        assertThatThrownBy(() -> new PhotometryReader (stream ("# nothing\n")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void filterColumnNeedsALibrary() {
        assertThatThrownBy(() -> new PhotometryReader 
                           (stream ("wavelength,flux,flux_err,limit,filter\n")))
            .isInstanceOf(IOException.class);
    }

    @Test
    void filtersAreResolvedThroughTheLibrary(@TempDir Path dir) 
        throws IOException {
        Files.write(dir.resolve("MIPS24.dat"), 
                    "# wave trans\n20 0.1\n24 1.0\n28 0.1\n"
                    .getBytes(StandardCharsets.UTF_8));
        Path data = dir.resolve("sn.csv");
        Files.write(data, ("wavelength,flux,flux_err,limit,filter\n"
                           +"24,5e-3,1e-3,False,MIPS24\n")
                    .getBytes(StandardCharsets.UTF_8));

        DirectoryBandpassLibrary lib = 
            new DirectoryBandpassLibrary (dir.toFile());
        Photometry phot = PhotometryReader.read(data.toFile(), "sn", lib);
        assertThat(phot.hasBandpasses()).isTrue();
        Bandpass bp = phot.get(0).getBandpass();
        assertThat(bp.getName()).isEqualTo("MIPS24");
        assertThat(bp.size()).isEqualTo(3);
        assertThat(lib.getBandpass("MIPS24")).isSameAs(bp);
    }

    @Test
    void filterNamesAreDecodedAsUtf8() throws IOException {
        final String name = "K\u209b-\u00e9t\u00e9";
        BandpassLibrary lib = new BandpassLibrary () {
                public Bandpass getBandpass (String filter) throws IOException {
                    if (!name.equals(filter))
                        throw new IOException ("No bandpass "+filter);
                    return Fixtures.tophat(filter, 2., 2.4, 5);
                }
            };
        Photometry phot = new PhotometryReader (stream
            ("wavelength,flux,flux_err,limit,filter\n"
             +"2.2,1e-3,1e-4,False,"+name+"\n"), lib).read("sn");
        assertThat(phot.get(0).getBandpass().getName()).isEqualTo(name);
    }

    @Test
    void unknownFilterIsAnError(@TempDir Path dir) {
        DirectoryBandpassLibrary lib = 
            new DirectoryBandpassLibrary (dir.toFile());
        assertThatThrownBy(() -> lib.getBandpass("nope"))
            .isInstanceOf(IOException.class);
    }

    @Test
    void tokenizerHonorsQuotes() {
        assertThat(PhotometryReader.tokenizer("a,\"b,c\",,d", ','))
            .containsExactly("a", "b,c", null, "d");
        assertThat(PhotometryReader.tokenizer("a,b,", ','))
            .containsExactly("a", "b", null);
    }
}
