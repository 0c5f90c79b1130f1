package org.sugarscape.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumMap;
import java.util.Map;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.sugarscape.junit.extensions.logging.LogWatchExtension;
import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.internal.services.SeededRandomProvider;
import org.sugarscape.runtime.model.AgentTraits;
import org.sugarscape.runtime.model.Sex;
import org.sugarscape.runtime.spi.IRandomProvider;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class UniformAgentTraitsSamplerTest {

    @Test
    void samplesStayWithinTheDefaultRanges() {
        UniformAgentTraitsSampler sampler = new UniformAgentTraitsSampler(traits(""));
        IRandomProvider rng = new SeededRandomProvider(11L);
        Map<Sex, Integer> sexes = new EnumMap<>(Sex.class);

        for (int i = 0; i < 2000; i++) {
            AgentTraits t = sampler.sample(rng);
            assertThat(t.fieldOfView()).isBetween(1, 6);
            assertThat(t.metabolism()).isBetween(1.0, 4.0);
            assertThat(t.endowment()).isBetween(50.0, 100.0);
            assertThat(t.lifespan()).isBetween(60.0, 100.0);
            assertThat(t.fertilityWindow().begin()).isBetween(12.0, 15.0);
            if (t.sex() == Sex.FEMALE) {
                assertThat(t.fertilityWindow().end()).isBetween(40.0, 50.0);
            } else {
                assertThat(t.fertilityWindow().end()).isBetween(50.0, 60.0);
            }
            sexes.merge(t.sex(), 1, Integer::sum);
        }

        assertThat(sexes.get(Sex.FEMALE)).isBetween(850, 1150);
        assertThat(sexes.get(Sex.MALE)).isBetween(850, 1150);
    }

    @Test
    void everyFieldOfViewValueOccurs() {
        UniformAgentTraitsSampler sampler = new UniformAgentTraitsSampler(traits(""));
        IRandomProvider rng = new SeededRandomProvider(3L);
        boolean[] seen = new boolean[7];

        for (int i = 0; i < 500; i++) {
            seen[sampler.sample(rng).fieldOfView()] = true;
        }

        for (int fov = 1; fov <= 6; fov++) {
            assertThat(seen[fov]).as("field of view %d", fov).isTrue();
        }
    }

    @Test
    void degenerateRangesYieldFixedValues() {
        UniformAgentTraitsSampler sampler = new UniformAgentTraitsSampler(traits(
                "field-of-view { min = 2, max = 2 }, metabolism { min = 1.5, max = 1.5 }"));

        AgentTraits t = sampler.sample(new SeededRandomProvider(1L));

        assertThat(t.fieldOfView()).isEqualTo(2);
        assertThat(t.metabolism()).isEqualTo(1.5);
        assertThat(t.withEndowment(75.0).endowment()).isEqualTo(75.0);
        assertThat(t.withEndowment(75.0).fieldOfView()).isEqualTo(2);
    }

    @Test
    void invalidRangesAreRejected() {
        assertThatThrownBy(() -> new UniformAgentTraitsSampler(traits("field-of-view.min = 0")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("field-of-view");
        assertThatThrownBy(() -> new UniformAgentTraitsSampler(traits("metabolism { min = 0.0, max = 1.0 }")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("metabolism");
        assertThatThrownBy(() -> new UniformAgentTraitsSampler(traits("lifespan { min = 90.0, max = 80.0 }")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("lifespan");
        assertThatThrownBy(() -> new UniformAgentTraitsSampler(traits("fertility-begin.max = 45.0")))
                .isInstanceOf(InvalidConfigurationException.class)
                .hasMessageContaining("fertility-begin");
        assertThatThrownBy(() -> new UniformAgentTraitsSampler(ConfigFactory.empty()))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    private static Config traits(String overrides) {
        return ConfigFactory.parseString(overrides)
                .withFallback(ConfigFactory.defaultReference().getConfig("agents.traits"));
    }
}
