package tripod.dustfit.mcmc;

import org.apache.commons.math.random.MersenneTwister;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class StretchMoveSamplerTest {

    static double[][] start (int walkers, int ndim, long seed) {
        MersenneTwister rng = new MersenneTwister (seed);
        double[][] p = new double[walkers][ndim];
        for (int k = 0; k < walkers; ++k)
            for (int d = 0; d < ndim; ++d)
                p[k][d] = rng.nextDouble() - 0.5;
        return p;
    }

    static Chain run (int cores, long seed) {
        StretchMoveSampler s = new StretchMoveSampler
            (new Gaussian (2), new MersenneTwister (seed), cores);
        try {
            return s.run(start (16, 2, 1l), 200);
        }
        finally {
            s.close();
        }
    }

    @Test
    void sameSeedGivesTheSameChain() {
        Chain a = run (1, 42l), b = run (1, 42l);
        assertThat(a.flatten(0)).isDeepEqualTo(b.flatten(0));
    }

    @Test
    void coreCountDoesNotChangeTheChain() {
        Chain a = run (1, 42l), b = run (3, 42l);
        assertThat(a.flatten(0)).isDeepEqualTo(b.flatten(0));
    }

    @Test
    void samplesAStandardNormal() {
        StretchMoveSampler s = new StretchMoveSampler
            (new Gaussian (2), new MersenneTwister (3l));
        Chain c = s.run(start (32, 2, 5l), 3000);
        double[][] samples = c.flatten(500);
        for (int d = 0; d < 2; ++d) {
            double[] x = new double[samples.length];
            for (int i = 0; i < x.length; ++i)
                x[i] = samples[i][d];
            assertThat(new Mean().evaluate(x)).isCloseTo(0., within(0.15));
            assertThat(new StandardDeviation().evaluate(x))
                .isCloseTo(1., within(0.15));
        }
        assertThat(s.getAcceptanceFraction()).isBetween(0.2, 0.9);
    }

    @Test
    void nanDensityIsNeverAccepted() {
        LogDensity half = new LogDensity () {
                public int getDimension () { return 1; }
                public double logDensity (double[] theta) {
                    return theta[0] > 1. ? Double.NaN : -0.5 * theta[0] * theta[0];
                }
            };
        StretchMoveSampler s = new StretchMoveSampler
            (half, new MersenneTwister (9l));
        Chain c = s.run(start (8, 1, 2l), 500);
        assertThat(s.getNonFiniteCount()).isPositive();
        for (double[] x : c.flatten(0))
            assertThat(x[0]).isLessThanOrEqualTo(1.);
    }

    @Test
    void needsTwiceAsManyWalkersAsDimensions() {
        StretchMoveSampler s = new StretchMoveSampler
            (new Gaussian (3), new MersenneTwister (1l));
        assertThatThrownBy(() -> s.run(start (5, 3, 1l), 10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void walkersMustMatchTheDimension() {
        StretchMoveSampler s = new StretchMoveSampler
            (new Gaussian (2), new MersenneTwister (1l));
        assertThatThrownBy(() -> s.run(start (8, 3, 1l), 10))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void stretchScaleMustExceedOne() {
        assertThatThrownBy(() -> new StretchMoveSampler
                           (new Gaussian (2), new MersenneTwister (1l), 
                            1., 1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
