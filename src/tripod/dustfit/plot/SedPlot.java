package tripod.dustfit.plot;

import java.awt.BasicStroke;
import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtilities;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.axis.LogarithmicAxis;
import org.jfree.chart.axis.NumberAxis;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYErrorRenderer;
import org.jfree.chart.renderer.xy.XYItemRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.DefaultXYDataset;
import org.jfree.data.xy.XYDataset;
import org.jfree.data.xy.YIntervalSeries;
import org.jfree.data.xy.YIntervalSeriesCollection;

import tripod.dustfit.core.DustEmission;
import tripod.dustfit.core.ExtrapolationPolicy;
import tripod.dustfit.core.FitResult;
import tripod.dustfit.core.ModelComparison;
import tripod.dustfit.core.ModelType;
import tripod.dustfit.core.Observation;
import tripod.dustfit.core.OpacityCurve;
import tripod.dustfit.core.Photometry;
import tripod.dustfit.core.SedModel;

/**
 * Observed photometry against fitted dust models: observed wavelength
 * (micron) on a linear axis, flux density (Jy) on a log axis.
 */
public class SedPlot {
    private static final Logger logger = 
        Logger.getLogger(SedPlot.class.getName());

    public static final int WIDTH = 800;
    public static final int HEIGHT = 600;
    public static final int GRID_POINTS = 500;
    public static final int MAX_SAMPLE_CURVES = 50;

    static final String X_LABEL = "Observed Wavelength (um)";
    static final String Y_LABEL = "Flux Density (Jy)";

    final OpacityCurve curve;
    final double redshift;
    final double distance;
    final double[] wave; // observer frame
    final double[] kappa;

    public SedPlot (Photometry phot, OpacityCurve curve, 
                    double redshift, double distance) {
        this.curve = curve;
        this.redshift = redshift;
        this.distance = distance;
        this.wave = grid (phot, curve, redshift, GRID_POINTS);
        // the grid never leaves the table so the policy doesn't matter
        this.kappa = curve.interpolate
            (DustEmission.restWavelength(wave, redshift), 
             ExtrapolationPolicy.CLAMP);
    }

    /**
     * Evenly spaced observer frame grid 20% beyond the data on either
     * side (bandpasses included), cut to what the opacity table covers.
     */
    static double[] grid (Photometry phot, OpacityCurve curve, 
                          double redshift, int n) {
        double lo = Double.MAX_VALUE, hi = 0.;
        for (Observation o : phot.getObservations()) {
            double min = o.getWavelength(), max = o.getWavelength();
            if (o.getBandpass() != null) {
                min = Math.min(min, o.getBandpass().getMinWavelength());
                max = Math.max(max, o.getBandpass().getMaxWavelength());
            }
            lo = Math.min(lo, min);
            hi = Math.max(hi, max);
        }
        lo = Math.max(0.8 * lo, curve.getMinWavelength() * (1. + redshift));
        hi = Math.min(1.2 * hi, curve.getMaxWavelength() * (1. + redshift));
        if (!(lo < hi)) {
            throw new IllegalArgumentException 
                ("Photometry of "+phot+" is outside of "+curve);
        }

        double[] w = new double[n];
        for (int i = 0; i < n; ++i)
            w[i] = lo + (hi - lo) * i / (n - 1);
        return w;
    }

    public double[] getWavelengths () { return (double[])wave.clone(); }

    public double[] model (ModelType type, double[] theta) {
        return SedModel.flux(type, theta, wave, kappa, redshift, distance);
    }

    /**
     * Detections with 1-sigma error bars in series 0, upper limits in
     * series 1.
     */
    public static YIntervalSeriesCollection createDataDataset 
        (Photometry phot) {
        YIntervalSeries det = new YIntervalSeries ("Detections");
        YIntervalSeries lim = new YIntervalSeries ("Upper limits");
        for (Observation o : phot.getObservations()) {
            double f = o.getFlux();
            if (!(f > 0.))
                continue; // nothing to show on a log axis
            if (o.isUpperLimit()) {
                lim.add(o.getWavelength(), f, f, f);
            }
            else {
                double lo = f - o.getFluxErr();
                det.add(o.getWavelength(), f, lo > 0. ? lo : f * 1e-3, 
                        f + o.getFluxErr());
            }
        }

        YIntervalSeriesCollection ds = new YIntervalSeriesCollection ();
        ds.addSeries(det);
        ds.addSeries(lim);
        return ds;
    }

    /**
     * Total model at the fitted medians followed by its components for
     * the two-component model.
     */
    public DefaultXYDataset createModelDataset (FitResult result) {
        DefaultXYDataset ds = new DefaultXYDataset ();
        double[] theta = result.getMedians();
        addSeries (ds, "Best fit ("+result.getType().getComponents()
                   +"-comp)", model (result.getType(), theta));
        if (result.getType() == ModelType.TWO_COMPONENT) {
            addSeries (ds, "Cold component", model 
                       (ModelType.ONE_COMPONENT, 
                        new double[]{theta[0], theta[1]}));
            addSeries (ds, "Hot component", model 
                       (ModelType.ONE_COMPONENT, 
                        new double[]{theta[2], theta[3]}));
        }
        return ds;
    }

    /**
     * Model curves of (at most MAX_SAMPLE_CURVES) walker positions.
     */
    public DefaultXYDataset createSampleDataset (ModelType type, 
                                                 double[][] samples) {
        DefaultXYDataset ds = new DefaultXYDataset ();
        int stride = Math.max(1, samples.length / MAX_SAMPLE_CURVES);
        for (int i = 0; i < samples.length; i += stride) {
            addSeries (ds, "sample "+i, model (type, samples[i]));
        }
        return ds;
    }

    void addSeries (DefaultXYDataset ds, String key, double[] flux) {
        int n = 0;
        for (int i = 0; i < flux.length; ++i)
            if (flux[i] > 0.)
                ++n;

        double[][] data = new double[2][n];
        for (int i = 0, j = 0; i < flux.length; ++i) {
            if (flux[i] > 0.) {
                data[0][j] = wave[i];
                data[1][j] = flux[i];
                ++j;
            }
        }
        if (n < flux.length) {
            logger.fine(key+": dropped "+(flux.length - n)
                        +" non-positive point(s)");
        }
        ds.addSeries(key, data);
    }

    static JFreeChart createChart (String title, XYDataset data) {
        JFreeChart chart = ChartFactory.createScatterPlot
            (title, X_LABEL, Y_LABEL, data, 
             PlotOrientation.VERTICAL, true, false, false);
        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.white);
        plot.setRangeGridlinesVisible(false);
        plot.setDomainGridlinesVisible(false);
        ((NumberAxis)plot.getDomainAxis()).setAutoRangeIncludesZero(false);

        LogarithmicAxis axis = new LogarithmicAxis (Y_LABEL);
        axis.setStrictValuesFlag(false);
        plot.setRangeAxis(axis);

        XYErrorRenderer renderer = new XYErrorRenderer ();
        renderer.setSeriesPaint(0, Color.black);
        renderer.setSeriesPaint(1, Color.gray);
        plot.setRenderer(0, renderer);
        return chart;
    }

    static XYItemRenderer lines (Color... colors) {
        XYLineAndShapeRenderer r = new XYLineAndShapeRenderer (true, false);
        for (int i = 0; i < colors.length; ++i) {
            r.setSeriesPaint(i, colors[i]);
            r.setSeriesStroke(i, new BasicStroke (i == 0 ? 2.f : 1.5f));
        }
        return r;
    }

    public JFreeChart createFitChart (String object, Photometry phot, 
                                      FitResult result, 
                                      double[][] samples) {
        JFreeChart chart = createChart 
            (object, createDataDataset (phot));
        XYPlot plot = chart.getXYPlot();

        plot.setDataset(1, createModelDataset (result));
        plot.setRenderer(1, lines (new Color (0, 128, 0), 
                                   Color.blue, Color.red));

        if (samples != null && samples.length > 0) {
            XYLineAndShapeRenderer r = 
                new XYLineAndShapeRenderer (true, false);
            r.setBasePaint(new Color (0, 128, 0, 40));
            r.setAutoPopulateSeriesPaint(false);
            r.setBaseSeriesVisibleInLegend(false);
            plot.setDataset(2, createSampleDataset 
                            (result.getType(), samples));
            plot.setRenderer(2, r);
        }
        return chart;
    }

    public JFreeChart createComparisonChart (String object, Photometry phot,
                                             FitResult oneComp,
                                             FitResult twoComp,
                                             ModelComparison.Result cmp) {
        JFreeChart chart = createChart 
            (String.format("%1$s: delta AIC = %2$.2f, delta BIC = %3$.2f",
                           object, cmp.getDeltaAic(), cmp.getDeltaBic()),
             createDataDataset (phot));
        XYPlot plot = chart.getXYPlot();
        plot.setDataset(1, createModelDataset (oneComp));
        plot.setRenderer(1, lines (Color.blue));
        plot.setDataset(2, createModelDataset (twoComp));
        plot.setRenderer(2, lines (Color.red, new Color (255, 128, 128),
                                   new Color (128, 0, 0)));
        return chart;
    }

    /**
     * <object>_<components>_model_fit.png
     */
    public static String getFitFileName (String object, int components) {
        return object+"_"+components+"_model_fit.png";
    }

    public static String getComparisonFileName (String object) {
        return "comparison_"+object+".png";
    }

    public File saveFit (File dir, String object, Photometry phot,
                         FitResult result, double[][] samples) 
        throws IOException {
        File file = new File 
            (dir, getFitFileName (object, result.getType().getComponents()));
        ChartUtilities.saveChartAsPNG
            (file, createFitChart (object, phot, result, samples), 
             WIDTH, HEIGHT);
        logger.info("Model fit plot saved to "+file);
        return file;
    }

    public File saveComparison (File dir, String object, Photometry phot,
                                FitResult oneComp, FitResult twoComp,
                                ModelComparison.Result cmp) 
        throws IOException {
        File file = new File (dir, getComparisonFileName (object));
        ChartUtilities.saveChartAsPNG
            (file, createComparisonChart 
             (object, phot, oneComp, twoComp, cmp), WIDTH, HEIGHT);
        logger.info("Comparison plot saved to "+file);
        return file;
    }
}
