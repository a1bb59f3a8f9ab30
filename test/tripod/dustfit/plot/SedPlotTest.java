package tripod.dustfit.plot;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import org.jfree.chart.JFreeChart;
import org.jfree.data.xy.DefaultXYDataset;
import org.jfree.data.xy.YIntervalSeriesCollection;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.assertj.core.api.Assertions.*;

import tripod.dustfit.core.Estimate;
import tripod.dustfit.core.FitResult;
import tripod.dustfit.core.Fixtures;
import tripod.dustfit.core.ModelType;
import tripod.dustfit.core.Photometry;

class SedPlotTest {

    static final double[] THETA2 = {-3., 100., -5., 400.};

    static FitResult result (ModelType type, double... medians) {
        Estimate[] e = new Estimate[medians.length];
        for (int i = 0; i < e.length; ++i)
            e[i] = new Estimate (medians[i], 0.1, 0.1);
        return new FitResult (type, e, new Estimate (1e-3, 1e-4, 1e-4));
    }

    static Photometry photometry () {
        return Fixtures.photometry
            (ModelType.TWO_COMPONENT, THETA2, Fixtures.BANDS, 0.05, false)
            .add(30., 1e-6, 1e-7, true);
    }

    @Test
    void gridExtendsBeyondTheData() {
        SedPlot plot = new SedPlot (photometry (), Fixtures.opacity(), 0.,
                                    Fixtures.DISTANCE);
        double[] w = plot.getWavelengths();
        assertThat(w).hasSize(SedPlot.GRID_POINTS);
        assertThat(w[0]).isCloseTo(4., within(1e-9));
        assertThat(w[w.length-1]).isCloseTo(36., within(1e-9));
    }

    @Test
    void dataSeriesSeparateDetectionsAndLimits() {
        YIntervalSeriesCollection ds = SedPlot.createDataDataset(photometry ());
        assertThat(ds.getSeriesCount()).isEqualTo(2);
        assertThat(ds.getItemCount(0)).isEqualTo(6);
        assertThat(ds.getItemCount(1)).isEqualTo(1);
        for (int i = 0; i < ds.getItemCount(0); ++i)
            assertThat(ds.getStartYValue(0, i)).isPositive();
    }

    @Test
    void twoComponentModelShowsItsComponents() {
        SedPlot plot = new SedPlot (photometry (), Fixtures.opacity(), 0.,
                                    Fixtures.DISTANCE);
        DefaultXYDataset ds = plot.createModelDataset
            (result (ModelType.TWO_COMPONENT, THETA2));
        assertThat(ds.getSeriesCount()).isEqualTo(3);
        int n = ds.getItemCount(0);
        for (int i = 0; i < n; ++i) {
            assertThat(ds.getYValue(0, i))
                .isCloseTo(ds.getYValue(1, i) + ds.getYValue(2, i),
                           withinPercentage(1e-9));
        }
    }

    @Test
    void sampleCurvesAreThinned() {
        SedPlot plot = new SedPlot (photometry (), Fixtures.opacity(), 0.,
                                    Fixtures.DISTANCE);
        double[][] samples = new double[200][];
        for (int i = 0; i < samples.length; ++i)
            samples[i] = new double[]{-3. + 0.001 * i, 150.};
        DefaultXYDataset ds = plot.createSampleDataset
            (ModelType.ONE_COMPONENT, samples);
        assertThat(ds.getSeriesCount())
            .isLessThanOrEqualTo(SedPlot.MAX_SAMPLE_CURVES);
    }

    @Test
    void savesPngFiles(@TempDir Path dir) throws IOException {
        Photometry phot = photometry ();
        SedPlot plot = new SedPlot (phot, Fixtures.opacity(), 0.,
                                    Fixtures.DISTANCE);
        File fit = plot.saveFit(dir.toFile(), "sn", phot,
                                result (ModelType.TWO_COMPONENT, THETA2),
                                new double[][]{THETA2, THETA2});
        assertThat(fit.getName()).isEqualTo("sn_2_model_fit.png");
        assertThat(fit.length()).isPositive();

        JFreeChart chart = plot.createFitChart
            ("sn", phot, result (ModelType.ONE_COMPONENT, -3., 150.), null);
        assertThat(chart.getXYPlot().getDatasetCount()).isGreaterThanOrEqualTo(2);
    }
}
