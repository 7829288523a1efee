package io.github.jakubt4.eosensor.service.revisit;

import io.github.jakubt4.eosensor.dto.OrbitalElements;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ConstellationBuilderTest {

    @Test
    void walkerDeltaSpreadsPlanesAndPhases() {
        final var satellites = ConstellationBuilder.walkerDelta(550, 53, 24, 3, 1);

        assertThat(satellites).hasSize(24);
        assertThat(satellites).extracting(OrbitalElements::raan).containsOnly(0.0, 120.0, 240.0);
        assertThat(satellites).allSatisfy(sat -> {
            assertThat(sat.altitude()).isEqualTo(550.0);
            assertThat(sat.inclination()).isEqualTo(53.0);
            assertThat(sat.trueAnomaly()).isBetween(0.0, 360.0);
        });

        // Second plane: slot 0 shifted by 360 * F * 1 / T
        assertThat(satellites.get(8).trueAnomaly()).isCloseTo(15.0, within(1e-9));
        assertThat(satellites.get(1).trueAnomaly()).isCloseTo(45.0, within(1e-9));
    }

    @Test
    void walkerDeltaRejectsUnevenPlanes() {
        assertThatThrownBy(() -> ConstellationBuilder.walkerDelta(550, 53, 10, 3, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("multiple of P");

        assertThatThrownBy(() -> ConstellationBuilder.walkerDelta(550, 53, 12, 3, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("phasing");
    }

    @Test
    void trainFollowsLeaderInPlane() {
        final var leader = new OrbitalElements(700, 98, 45, 350);

        final var train = ConstellationBuilder.train(leader, 3, 10);

        assertThat(train).hasSize(3);
        assertThat(train.get(0)).isEqualTo(leader);
        assertThat(train.get(1).trueAnomaly()).isCloseTo(0.0, within(1e-9));
        assertThat(train.get(2).trueAnomaly()).isCloseTo(10.0, within(1e-9));
        assertThat(train).extracting(OrbitalElements::raan).containsOnly(45.0);
    }
}
