package org.sugarscape.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.sugarscape.junit.extensions.logging.LogWatchExtension;
import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.internal.services.SeededRandomProvider;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TwoPeakGaussianCapacityFieldTest {

    @Test
    void peaksReachPsiAndValleysDropToZero() {
        TwoPeakGaussianCapacityField field = TwoPeakGaussianCapacityField.withDefaults(40, 40);

        assertThat(field.capacityAt(10, 10)).isEqualTo(4);
        assertThat(field.capacityAt(30, 30)).isEqualTo(4);
        assertThat(field.capacityAt(10, 30)).isZero();
        assertThat(field.capacityAt(30, 10)).isZero();
    }

    @Test
    void coordinatesWrapOnTheBounds() {
        TwoPeakGaussianCapacityField field = TwoPeakGaussianCapacityField.withDefaults(40, 40);

        assertThat(field.capacityAt(50, 50)).isEqualTo(field.capacityAt(10, 10));
        assertThat(field.capacityAt(-30, 10)).isEqualTo(field.capacityAt(10, 10));
        assertThat(field.capacityAt(7, 83)).isEqualTo(field.capacityAt(7, 3));
    }

    @Test
    void capacityFallsOffWithDistanceFromAPeak() {
        TwoPeakGaussianCapacityField field = TwoPeakGaussianCapacityField.withDefaults(40, 40);

        int previous = field.capacityAt(10, 10);
        for (int x = 11; x <= 20; x++) {
            int capacity = field.capacityAt(x, 10);
            assertThat(capacity).isLessThanOrEqualTo(previous).isGreaterThanOrEqualTo(0);
            previous = capacity;
        }
    }

    @Test
    void optionsOverrideDefaults() {
        TwoPeakGaussianCapacityField field = new TwoPeakGaussianCapacityField(20, 20, new SeededRandomProvider(1L),
                ConfigFactory.parseString("psi = 9.0, peak1 = [0.5, 0.5], peak2 = [0.5, 0.5], theta-x = 0.1, theta-y = 0.1"));

        assertThat(field.capacityAt(10, 10)).isEqualTo(18);
        assertThat(field.capacityAt(0, 0)).isZero();
    }

    @Test
    void randomizedFieldsAreReproduciblePerSeed() {
        TwoPeakGaussianCapacityField a = TwoPeakGaussianCapacityField.randomized(30, 30, new SeededRandomProvider(5L));
        TwoPeakGaussianCapacityField b = new TwoPeakGaussianCapacityField(30, 30, new SeededRandomProvider(5L),
                ConfigFactory.parseString("randomize = true, psi = 100"));

        for (int x = 0; x < 30; x++) {
            for (int y = 0; y < 30; y++) {
                assertThat(a.capacityAt(x, y)).isEqualTo(b.capacityAt(x, y)).isBetween(0, 10);
            }
        }
    }

    @Test
    void invalidParametersAreRejected() {
        assertThatThrownBy(() -> new TwoPeakGaussianCapacityField(0, 10, 4.0, 0.25, 0.25, 0.75, 0.75, 0.3, 0.3))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new TwoPeakGaussianCapacityField(10, 10, 4.0, 0.25, 0.25, 0.75, 0.75, 0.0, 0.3))
                .isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new TwoPeakGaussianCapacityField(10, 10, new SeededRandomProvider(1L),
                ConfigFactory.parseString("peak1 = [0.5]")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("peak1");
    }
}
