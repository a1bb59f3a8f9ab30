package tripod.dustfit.core;

import org.junit.jupiter.api.Test;
import static org.assertj.core.api.Assertions.*;

class DustEmissionTest {

    static final double[] WAVE = {5., 10., 20., 50.};

    static double[] kappa () {
        return Fixtures.opacity().interpolate(WAVE, ExtrapolationPolicy.ERROR);
    }

    @Test
    void planckApproachesRayleighJeansAtLongWavelengths() {
        double wave = 1e5; // 10 cm
        double t = 100.;
        double nu = Constants.SPEED_OF_LIGHT / (wave * Constants.MICRON);
        double rj = 2. * nu * nu * Constants.BOLTZMANN * t
            / (Constants.SPEED_OF_LIGHT * Constants.SPEED_OF_LIGHT);
        assertThat(DustEmission.planck(wave, t))
            .isCloseTo(rj, withinPercentage(0.1));
    }

    @Test
    void planckOfColdDustAtShortWavelengthsIsZero() {
        assertThat(DustEmission.planck(0.1, 20.)).isEqualTo(0.);
    }

    @Test
    void fluxScalesLinearlyWithMass() {
        double[] f1 = DustEmission.modelFlux
            (WAVE, 1e-3, 150., 0., Fixtures.DISTANCE, kappa ());
        double[] f2 = DustEmission.modelFlux
            (WAVE, 2e-3, 150., 0., Fixtures.DISTANCE, kappa ());
        for (int i = 0; i < WAVE.length; ++i) {
            assertThat(f1[i]).isPositive();
            assertThat(f2[i]).isCloseTo(2. * f1[i], withinPercentage(1e-9));
        }
    }

    @Test
    void fluxIncreasesWithTemperatureEverywhere() {
        double[] cold = DustEmission.modelFlux
            (WAVE, 1e-3, 100., 0., Fixtures.DISTANCE, kappa ());
        double[] warm = DustEmission.modelFlux
            (WAVE, 1e-3, 300., 0., Fixtures.DISTANCE, kappa ());
        for (int i = 0; i < WAVE.length; ++i)
            assertThat(warm[i]).isGreaterThan(cold[i]);
    }

    @Test
    void fluxFallsWithTheSquareOfTheDistance() {
        double[] near = DustEmission.modelFlux
            (WAVE, 1e-3, 150., 0., Fixtures.DISTANCE, kappa ());
        double[] far = DustEmission.modelFlux
            (WAVE, 1e-3, 150., 0., 2. * Fixtures.DISTANCE, kappa ());
        for (int i = 0; i < WAVE.length; ++i)
            assertThat(far[i]).isCloseTo(near[i] / 4., withinPercentage(1e-9));
    }

    @Test
    void wavelengthAndFrequencyPathsAgree() {
        double z = 0.5;
        double[] rest = DustEmission.restWavelength(WAVE, z);
        double[] k = Fixtures.opacity().interpolate
            (rest, ExtrapolationPolicy.ERROR);

        SpectralDensity lnu = DustEmission.luminosity
            (rest, k, 1e-3, 200., SpectralUnit.LUMINOSITY_NU);
        SpectralDensity llam = DustEmission.luminosity
            (rest, k, 1e-3, 200., SpectralUnit.LUMINOSITY_LAMBDA);

        SpectralDensity a = DustEmission.flux
            (rest, lnu, Fixtures.DISTANCE, z, SpectralUnit.JANSKY);
        SpectralDensity b = DustEmission.flux
            (rest, llam, Fixtures.DISTANCE, z, SpectralUnit.JANSKY);
        for (int i = 0; i < WAVE.length; ++i)
            assertThat(b.get(i)).isCloseTo(a.get(i), withinPercentage(1e-6));
    }

    @Test
    void janskyIsCgsFluxDensityScaled() {
        double[] rest = WAVE;
        SpectralDensity lnu = DustEmission.luminosity
            (rest, kappa (), 1e-3, 150., SpectralUnit.LUMINOSITY_NU);
        SpectralDensity jy = DustEmission.flux
            (rest, lnu, Fixtures.DISTANCE, 0., SpectralUnit.JANSKY);
        SpectralDensity cgs = DustEmission.flux
            (rest, lnu, Fixtures.DISTANCE, 0., SpectralUnit.FLUX_NU);
        assertThat(jy.getUnit()).isEqualTo(SpectralUnit.JANSKY);
        for (int i = 0; i < rest.length; ++i)
            assertThat(jy.get(i))
                .isCloseTo(cgs.get(i) / Constants.JANSKY,
                           withinPercentage(1e-9));
    }

    @Test
    void twoComponentModelIsTheSumOfItsComponents() {
        double[] k = kappa ();
        double[] theta = {-3., 100., -5., 400.};
        double[] total = SedModel.flux
            (ModelType.TWO_COMPONENT, theta, WAVE, k, 0., Fixtures.DISTANCE);
        double[] cold = SedModel.componentFlux
            (-3., 100., WAVE, k, 0., Fixtures.DISTANCE);
        double[] hot = SedModel.componentFlux
            (-5., 400., WAVE, k, 0., Fixtures.DISTANCE);
        for (int i = 0; i < WAVE.length; ++i)
            assertThat(total[i])
                .isCloseTo(cold[i] + hot[i], withinPercentage(1e-9));
    }

    @Test
    void rejectsFluxUnitForLuminosity() {
        assertThatThrownBy(() -> DustEmission.luminosity
                           (WAVE, kappa (), 1e-3, 150., SpectralUnit.JANSKY))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsLuminosityUnitForFlux() {
        SpectralDensity lnu = DustEmission.luminosity
            (WAVE, kappa (), 1e-3, 150., SpectralUnit.LUMINOSITY_NU);
        assertThatThrownBy(() -> DustEmission.flux
                           (WAVE, lnu, Fixtures.DISTANCE, 0.,
                            SpectralUnit.LUMINOSITY_LAMBDA))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMismatchedOpacity() {
        assertThatThrownBy(() -> DustEmission.luminosity
                           (WAVE, new double[]{1., 2.}, 1e-3, 150.,
                            SpectralUnit.LUMINOSITY_NU))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsMissingOpacity() {
        assertThatThrownBy(() -> DustEmission.modelFlux
                           (WAVE, 1e-3, 150., 0., Fixtures.DISTANCE,
                            (double[])null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unitsParseFromTheirNames() {
        assertThat(SpectralUnit.parse("Jy")).isEqualTo(SpectralUnit.JANSKY);
        assertThatThrownBy(() -> SpectralUnit.parse("furlong"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
