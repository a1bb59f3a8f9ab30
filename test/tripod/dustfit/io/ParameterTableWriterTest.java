package tripod.dustfit.io;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.assertj.core.api.Assertions.*;

import tripod.dustfit.core.Estimate;
import tripod.dustfit.core.FitResult;
import tripod.dustfit.core.ModelType;

class ParameterTableWriterTest {

    static FitResult result () {
        return new FitResult
            (ModelType.ONE_COMPONENT, new Estimate[]{
                new Estimate (-3.01, 0.05, 0.04),
                new Estimate (151.2, 3.5, 2.9)
            }, new Estimate (9.8e-4, 1.1e-4, 0.9e-4));
    }

    @Test
    void writesOneRowPerEstimate(@TempDir Path dir) throws IOException {
        File file = ParameterTableWriter.write(dir.toFile(), "sn", result ());
        assertThat(file.getName()).isEqualTo("parameters_sn_1.txt");

        List<String> lines = Files.readAllLines
            (file.toPath(), StandardCharsets.UTF_8);
        assertThat(lines).hasSize(4);
        assertThat(lines.get(0)).isEqualTo("parameter median upper lower");
        assertThat(lines.get(1)).startsWith("log_dust_mass_cold ");
        assertThat(lines.get(3)).startsWith("total_dust_mass ");
    }

    @Test
    void tablesReadBackAsWritten(@TempDir Path dir) throws IOException {
        File file = ParameterTableWriter.write(dir.toFile(), "sn", result ());
        InputStream is = new FileInputStream (file);
        try {
            Map<String, Estimate> table = ParameterTableWriter.read(is);
            assertThat(table).isEqualTo(result().getEstimates());
        }
        finally {
            is.close();
        }
    }
}
