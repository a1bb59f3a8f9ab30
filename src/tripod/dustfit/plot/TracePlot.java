package tripod.dustfit.plot;

import java.awt.BasicStroke;
import java.awt.Color;
import java.io.File;
import java.io.IOException;
import java.util.logging.Logger;

import org.jfree.chart.ChartFactory;
import org.jfree.chart.ChartUtilities;
import org.jfree.chart.JFreeChart;
import org.jfree.chart.plot.PlotOrientation;
import org.jfree.chart.plot.ValueMarker;
import org.jfree.chart.plot.XYPlot;
import org.jfree.chart.renderer.xy.XYLineAndShapeRenderer;
import org.jfree.data.xy.DefaultXYDataset;

import tripod.dustfit.core.Estimate;
import tripod.dustfit.core.Parameter;
import tripod.dustfit.core.Prior;
import tripod.dustfit.mcmc.Chain;

/**
 * Walker traces of one parameter over all runs with the median and the
 * start of the retained samples marked.
 */
public class TracePlot {
    private static final Logger logger = 
        Logger.getLogger(TracePlot.class.getName());

    public static final int WIDTH = 800;
    public static final int HEIGHT = 400;

    final Chain chain;

    public TracePlot (Chain chain) {
        this.chain = chain;
    }

    /**
     * One series per walker, step number against parameter value.
     */
    public DefaultXYDataset createDataset (int dim) {
        double[][] trace = chain.trace(dim);
        DefaultXYDataset ds = new DefaultXYDataset ();
        for (int w = 0; w < trace.length; ++w) {
            double[][] data = new double[2][trace[w].length];
            for (int s = 0; s < trace[w].length; ++s) {
                data[0][s] = s;
                data[1][s] = trace[w][s];
            }
            ds.addSeries("walker "+w, data);
        }
        return ds;
    }

    /**
     * @param firstKept step index where the retained samples start
     */
    public JFreeChart createChart (int dim, Parameter param, 
                                   Estimate estimate, Prior.Bound bound,
                                   int firstKept) {
        JFreeChart chart = ChartFactory.createXYLineChart
            (param.getKey(), "Step", param.getLabel(), 
             createDataset (dim), PlotOrientation.VERTICAL, 
             false, false, false);

        XYPlot plot = chart.getXYPlot();
        plot.setBackgroundPaint(Color.white);
        plot.setRangeGridlinesVisible(false);

        XYLineAndShapeRenderer r = new XYLineAndShapeRenderer (true, false);
        r.setBasePaint(new Color (0, 0, 0, 60));
        r.setAutoPopulateSeriesPaint(false);
        plot.setRenderer(r);

        if (estimate != null) {
            ValueMarker median = new ValueMarker (estimate.getMedian());
            median.setPaint(Color.red);
            median.setStroke(new BasicStroke (2.f));
            plot.addRangeMarker(median);
        }
        if (bound != null) {
            plot.addRangeMarker(new ValueMarker 
                                (bound.getLower(), Color.blue, 
                                 new BasicStroke (1.f)));
            plot.addRangeMarker(new ValueMarker 
                                (bound.getUpper(), Color.blue, 
                                 new BasicStroke (1.f)));
        }
        if (firstKept > 0) {
            plot.addDomainMarker(new ValueMarker 
                                 (firstKept, Color.gray, 
                                  new BasicStroke (1.f)));
        }
        return chart;
    }

    /**
     * <object>_<components>_trace_<param>.png
     */
    public static String getFileName (String object, int components, 
                                      Parameter param) {
        return object+"_"+components+"_trace_"+param.getKey()+".png";
    }

    public File save (File dir, String object, int components, int dim,
                      Parameter param, Estimate estimate, Prior.Bound bound,
                      int firstKept) throws IOException {
        File file = new File (dir, getFileName (object, components, param));
        ChartUtilities.saveChartAsPNG
            (file, createChart (dim, param, estimate, bound, firstKept),
             WIDTH, HEIGHT);
        logger.fine("Trace of "+param.getKey()+" saved to "+file);
        return file;
    }
}
