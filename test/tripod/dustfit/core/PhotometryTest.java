package tripod.dustfit.core;

import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class PhotometryTest {

    @Test
    void keepsObservationsInOrder() {
        Photometry phot = new Photometry ("sn")
            .add(10., 1e-3, 1e-4, false)
            .add(20., 2e-3, 1e-4, true)
            .add(5., 5e-4, 5e-5, false);
        assertThat(phot.size()).isEqualTo(3);
        assertThat(phot.getWavelengths()).containsExactly(10., 20., 5.);
        assertThat(phot.getUpperLimits()).containsExactly(false, true, false);
        assertThat(phot.getDetectionCount()).isEqualTo(2);
        assertThat(phot.getUpperLimitCount()).isEqualTo(1);
        assertThat(phot.hasBandpasses()).isFalse();
        assertThat(phot.getBandpasses()).isNull();
    }

    @Test
    void emptyPhotometryIsInvalid() {
        assertThatThrownBy(() -> new Photometry ("empty").validate())
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonFiniteFluxIsInvalid() {
        Photometry phot = new Photometry ("nan")
            .add(10., Double.NaN, 1e-4, false);
        assertThatThrownBy(phot::validate)
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void nonPositiveWavelengthIsInvalid() {
        Photometry phot = new Photometry ("zero").add(0., 1e-3, 1e-4, false);
        assertThatThrownBy(phot::validate)
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void exactUpperLimitIsValid() {
        new Photometry ("exact")
            .add(10., 1e-3, 1e-4, false)
            .add(24., 2e-3, 0., true)
            .validate();
    }

    @Test
    void detectionNeedsAPositiveError() {
        Photometry zero = new Photometry ("zero").add(10., 1e-3, 0., false);
        assertThatThrownBy(zero::validate)
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("flux error");

        Photometry negative = new Photometry ("negative")
            .add(10., 1e-3, 1e-4, false)
            .add(24., 2e-3, -1e-4, true);
        assertThatThrownBy(negative::validate)
            .isInstanceOf(IllegalArgumentException.class);
    }
}
