package tripod.dustfit.core;

import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class PriorTest {

    static final double NEG_INF = Double.NEGATIVE_INFINITY;

    @Test
    void insideTheBoxIsZero() {
        Prior p = new Prior (ModelType.ONE_COMPONENT);
        assertThat(p.logPrior(new double[]{-3., 150.})).isEqualTo(0.);
    }

    @Test
    void boundsAreExclusive() {
        Prior p = new Prior (ModelType.ONE_COMPONENT);
        assertThat(p.logPrior(new double[]{-6., 150.})).isEqualTo(NEG_INF);
        assertThat(p.logPrior(new double[]{-3., 2000.})).isEqualTo(NEG_INF);
        assertThat(p.logPrior(new double[]{-5.999, 1999.9})).isEqualTo(0.);
    }

    @Test
    void nanIsOutside() {
        Prior p = new Prior (ModelType.ONE_COMPONENT);
        assertThat(p.logPrior(new double[]{Double.NaN, 150.}))
            .isEqualTo(NEG_INF);
    }

    @Test
    void hotComponentMustBeHotter() {
        Prior p = new Prior (ModelType.TWO_COMPONENT);
        assertThat(p.logPrior(new double[]{-3., 150., -5., 500.}))
            .isEqualTo(0.);
        assertThat(p.logPrior(new double[]{-3., 150., -5., 150.}))
            .isEqualTo(NEG_INF);
        assertThat(p.logPrior(new double[]{-3., 500., -5., 150.}))
            .isEqualTo(NEG_INF);
    }

    @Test
    void hotMassHasItsOwnRange() {
        Prior p = new Prior (ModelType.TWO_COMPONENT);
        assertThat(p.logPrior(new double[]{-3., 150., -7.5, 500.}))
            .isEqualTo(0.);
        assertThat(p.logPrior(new double[]{-3., 150., -8.5, 500.}))
            .isEqualTo(NEG_INF);
    }

    @Test
    void boundsCanBeOverridden() {
        Prior.Bounds b = Prior.DEFAULT_BOUNDS
            .with(Parameter.TEMP_COLD, 100., 200.);
        Prior p = new Prior (ModelType.ONE_COMPONENT, b);
        assertThat(p.logPrior(new double[]{-3., 250.})).isEqualTo(NEG_INF);
        assertThat(p.getLowerBounds()).containsExactly(-6., 100.);
        assertThat(p.getUpperBounds()).containsExactly(1., 200.);
        // the defaults are untouched
        assertThat(Prior.DEFAULT_BOUNDS.get(Parameter.TEMP_COLD).getUpper())
            .isEqualTo(2000.);
    }

    @Test
    void rejectsWrongDimension() {
        Prior p = new Prior (ModelType.TWO_COMPONENT);
        assertThatThrownBy(() -> p.logPrior(new double[]{-3., 150.}))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsEmptyBound() {
        assertThatThrownBy(() -> new Prior.Bound (1., 1.))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void modelTypeFollowsComponentCount() {
        assertThat(ModelType.forComponents(1))
            .isEqualTo(ModelType.ONE_COMPONENT);
        assertThat(ModelType.forComponents(2).getNumParams()).isEqualTo(4);
        assertThatThrownBy(() -> ModelType.forComponents(3))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
