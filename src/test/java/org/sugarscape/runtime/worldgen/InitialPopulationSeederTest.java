package org.sugarscape.runtime.worldgen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.sugarscape.junit.extensions.logging.LogWatchExtension;
import org.sugarscape.runtime.InvalidConfigurationException;
import org.sugarscape.runtime.internal.services.SeededRandomProvider;
import org.sugarscape.runtime.model.Agent;
import org.sugarscape.runtime.model.AgentFactory;
import org.sugarscape.runtime.model.Landscape;
import org.sugarscape.runtime.model.LandscapeProperties;

import com.typesafe.config.ConfigFactory;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class InitialPopulationSeederTest {

    @Test
    void placesRequestedAgentsOnDistinctCells() {
        AgentFactory factory = factory(10, 10, 1L);

        List<Agent> agents = new InitialPopulationSeeder(25).seed(factory);

        assertThat(agents).hasSize(25);
        assertThat(agents.stream().map(a -> a.getX() + "," + a.getY()).collect(Collectors.toSet())).hasSize(25);
        assertThat(agents).allSatisfy(agent -> {
            assertThat(agent.getBirthTime()).isZero();
            assertThat(agent.getWealth()).isEqualTo(agent.getEndowment());
            assertThat(factory.getLandscape().cellAt(agent.getX(), agent.getY()).getOccupantId())
                    .isEqualTo(agent.getId());
        });
        assertThat(agents).extracting(Agent::getId).doesNotHaveDuplicates();
    }

    @Test
    void countIsClampedToFreeCells() {
        AgentFactory factory = factory(3, 3, 1L);

        List<Agent> agents = new InitialPopulationSeeder(50).seed(factory);

        assertThat(agents).hasSize(9);
        assertThat(factory.getLandscape().emptyCells()).isEmpty();
    }

    @Test
    void zeroAgentsIsAllowed() {
        assertThat(new InitialPopulationSeeder(0).seed(factory(3, 3, 1L))).isEmpty();
    }

    @Test
    void placementDependsOnSeed() {
        List<String> first = positions(new InitialPopulationSeeder(10).seed(factory(20, 20, 1L)));
        List<String> again = positions(new InitialPopulationSeeder(10).seed(factory(20, 20, 1L)));
        List<String> other = positions(new InitialPopulationSeeder(10).seed(factory(20, 20, 2L)));

        assertThat(first).isEqualTo(again).isNotEqualTo(other);
    }

    @Test
    void negativeCountIsRejected() {
        assertThatThrownBy(() -> new InitialPopulationSeeder(-1))
                .isInstanceOf(InvalidConfigurationException.class);
    }

    private static AgentFactory factory(int width, int height, long seed) {
        Landscape landscape = new Landscape(new LandscapeProperties(width, height, 1), new UniformCapacityField(2));
        UniformAgentTraitsSampler sampler = new UniformAgentTraitsSampler(
                ConfigFactory.defaultReference().getConfig("agents.traits"));
        return new AgentFactory(landscape, new SeededRandomProvider(seed), sampler);
    }

    private static List<String> positions(List<Agent> agents) {
        return agents.stream().map(a -> a.getX() + "," + a.getY()).toList();
    }
}
