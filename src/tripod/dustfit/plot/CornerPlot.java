package tripod.dustfit.plot;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.geom.Ellipse2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.logging.Logger;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtilities;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.StandardXYBarPainter;
import org.jfree.chart.renderer.xy.XYBarRenderer;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.statistics.HistogramDataset;
import org.jfree.data.xy.DefaultXYDataset;

import tripod.dustfit.core.Estimate;
import tripod.dustfit.core.FitResult;
import tripod.dustfit.core.ModelType;
import tripod.dustfit.core.Parameter;

/**
 * Pairwise posterior of the retained samples: marginal histograms on
 * the diagonal and sample scatter below it, with the medians marked.
 */
public class CornerPlot {
    private static final Logger logger =
        Logger.getLogger(CornerPlot.class.getName());

    public static final int PANEL = 250;
    public static final int BINS = 30;
    public static final int MAX_POINTS = 2000;

    final ModelType type;
    final double[][] samples; // samples[n][dim]

    public CornerPlot (ModelType type, double[][] samples) {
        if (samples == null || samples.length == 0) {
            throw new IllegalArgumentException ("No samples to plot");
        }
        type.check(samples[0]);
        this.type = type;
        this.samples = samples;
    }

    double[] column (int dim) {
        double[] x = new double[samples.length];
        for (int i = 0; i < x.length; ++i)
            x[i] = samples[i][dim];
        return x;
    }

    public HistogramDataset createHistogramDataset (int dim) {
        HistogramDataset ds = new HistogramDataset ();
        ds.addSeries(type.getParam(dim).getKey(), column (dim), BINS);
        return ds;
    }

    /**
     * At most MAX_POINTS samples of the (xdim, ydim) pair.
     */
    public DefaultXYDataset createScatterDataset (int xdim, int ydim) {
        int stride = Math.max(1, (samples.length + MAX_POINTS - 1)
                              / MAX_POINTS);
        int n = (samples.length + stride - 1) / stride;
        double[][] data = new double[2][n];
        for (int i = 0, j = 0; j < n; i += stride, ++j) {
            data[0][j] = samples[i][xdim];
            data[1][j] = samples[i][ydim];
        }
        DefaultXYDataset ds = new DefaultXYDataset ();
        ds.addSeries(type.getParam(xdim).getKey()+" vs "
                     +type.getParam(ydim).getKey(), data);
        return ds;
    }

    /**
     * Panel in row ydim and column xdim; null above the diagonal.
     */
    public JFreeChart createPanel (int ydim, int xdim, FitResult result) {
        if (xdim > ydim)
            return null;

        Parameter px = type.getParam(xdim);
        JFreeChart chart;
        if (xdim == ydim) {
            chart = ChartFactory.createHistogram
                (null, px.getLabel(), null, createHistogramDataset (xdim),
                 PlotOrientation.VERTICAL, false, false, false);
            XYBarRenderer r = (XYBarRenderer)chart.getXYPlot().getRenderer();
            r.setBarPainter(new StandardXYBarPainter ());
            r.setShadowVisible(false);
            r.setSeriesPaint(0, Color.darkGray);
        }
        else {
            Parameter py = type.getParam(ydim);
            chart = ChartFactory.createScatterPlot
                (null, px.getLabel(), py.getLabel(),
                 createScatterDataset (xdim, ydim),
                 PlotOrientation.VERTICAL, false, false, false);
            XYLineAndShapeRenderer r =
                new XYLineAndShapeRenderer (false, true);
            r.setSeriesShape(0, new Ellipse2D.Double (-1., -1., 2., 2.));
            r.setSeriesPaint(0, new Color (0, 0, 0, 60));
            chart.getXYPlot().setRenderer(r);
            if (result != null)
                chart.getXYPlot().addRangeMarker(marker (result.get(py)));
        }

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.white);
        plot.setRangeGridlinesVisible(false);
        plot.setDomainGridlinesVisible(false);
        if (result != null)
            plot.addDomainMarker(marker (result.get(px)));
        return chart;
    }

    static ValueMarker marker (Estimate e) {
        return new ValueMarker (e.getMedian(), new Color (0, 0, 200),
                                new BasicStroke (1.5f));
    }

    public BufferedImage render (FitResult result) {
        int n = type.getNumParams();
        BufferedImage img = new BufferedImage
            (n * PANEL, n * PANEL, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = img.createGraphics();
        try {
            g.setPaint(Color.white);
            g.fillRect(0, 0, img.getWidth(), img.getHeight());
            for (int y = 0; y < n; ++y) {
                for (int x = 0; x <= y; ++x) {
                    createPanel(y, x, result).draw
                        (g, new Rectangle2D.Double
                         (x * PANEL, y * PANEL, PANEL, PANEL));
                }
            }
        }
        finally {
            g.dispose();
        }
        return img;
    }

    /**
     * <object>_<components>_corner.png
     */
    public static String getFileName (String object, int components) {
        return object+"_"+components+"_corner.png";
    }

    public File save (File dir, String object, FitResult result)
        throws IOException {
        File file = new File
            (dir, getFileName (object, type.getComponents()));
        OutputStream os = new BufferedOutputStream
            (new FileOutputStream (file));
        try {
            ChartUtilities.writeBufferedImageAsPNG(os, render (result));
        }
        finally {
            os.close();
        }
        logger.info("Corner plot saved to "+file);
        return file;
    }
}
