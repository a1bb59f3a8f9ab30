package tripod.dustfit.io;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.assertj.core.api.Assertions.*;

import tripod.dustfit.core.ExtrapolationPolicy;
import tripod.dustfit.core.OpacityCurve;

class DirectoryOpacityLibraryTest {

    @Test
    void fileNameCombinesCompositionAndGrainSize() {
        assertThat(DirectoryOpacityLibrary.getFileName("carbon", 0.1))
            .isEqualTo("carbon_0.1.txt");
        assertThat(DirectoryOpacityLibrary.getFileName("silicate", 1.0))
            .isEqualTo("silicate_1.txt");
    }

    @Test
    void loadsAndCachesCurves(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve("carbon_0.1.txt"),
                    ("# wavelength kappa\n"
                     +"wavelength kappa\n"
                     +"1 1000\n2 500\n4 100\n")
                    .getBytes(StandardCharsets.UTF_8));
        DirectoryOpacityLibrary lib = 
            new DirectoryOpacityLibrary (dir.toFile());
        OpacityCurve c = lib.getCurve("carbon", 0.1);
        assertThat(c.getComposition()).isEqualTo("carbon");
        assertThat(c.getGrainSize()).isEqualTo(0.1);
        assertThat(c.interpolate(new double[]{3.}, ExtrapolationPolicy.ERROR))
            .containsExactly(300.);
        assertThat(lib.getCurve("carbon", 0.1)).isSameAs(c);
    }

    @Test
    void missingTableIsAnError(@TempDir Path dir) {
        DirectoryOpacityLibrary lib = 
            new DirectoryOpacityLibrary (dir.toFile());
        assertThatThrownBy(() -> lib.getCurve("iron", 0.5))
            .isInstanceOf(FileNotFoundException.class);
    }

    @Test
    void unsortedTableIsAnError(@TempDir Path dir) throws IOException {
        Files.write(dir.resolve("carbon_0.1.txt"),
                    "2 500\n1 1000\n".getBytes(StandardCharsets.UTF_8));
        DirectoryOpacityLibrary lib = 
            new DirectoryOpacityLibrary (dir.toFile());
        assertThatThrownBy(() -> lib.getCurve("carbon", 0.1))
            .isInstanceOf(IOException.class);
    }

    @Test
    void badNumbersAfterTheHeaderAreAnError(@TempDir Path dir) 
        throws IOException {
        Files.write(dir.resolve("carbon_0.1.txt"),
                    "1 1000\n2 x\n".getBytes(StandardCharsets.UTF_8));
        DirectoryOpacityLibrary lib = 
            new DirectoryOpacityLibrary (dir.toFile());
        assertThatThrownBy(() -> lib.getCurve("carbon", 0.1))
            .isInstanceOf(IOException.class);
    }
}
