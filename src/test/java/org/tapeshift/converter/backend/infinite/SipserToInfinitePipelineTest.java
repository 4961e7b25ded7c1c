package org.tapeshift.converter.backend.infinite;

import org.tapeshift.converter.model.ConverterSettings;
import org.tapeshift.converter.model.Direction;
import org.tapeshift.converter.model.Transition;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link SipserToInfinitePipeline}, checking the wall setup and the
 * wall checks inserted after left moves.
 */
@Tag("unit")
public class SipserToInfinitePipelineTest {

    private final SipserToInfinitePipeline pipeline = new SipserToInfinitePipeline(ConverterSettings.defaults());

    /**
     * Verifies that the setup steps left and keeps moving left until it finds a blank cell,
     * where it writes the wall.
     */
    @Test
    void testSetupWritesWallToTheLeft() {
        assertThat(pipeline.setup("sim_0")).containsExactly(
                new Transition("0", '*', '*', Direction.LEFT, "q_write_wall"),
                new Transition("q_write_wall", '_', '#', Direction.RIGHT, "sim_0"),
                new Transition("q_write_wall", '*', '*', Direction.LEFT, "q_write_wall"));
    }

    /**
     * Verifies that only left moves to non-terminal states are redirected, and that the wall
     * check ends in the plain terminal state.
     */
    @Test
    void testLeftMovesAreRetargetedToWallChecks() {
        // Act
        List<Transition> out = pipeline.convert(List.of(
                new Transition("sim_0", '0', '1', Direction.RIGHT, "sim_1"),
                new Transition("sim_1", '1', '0', Direction.LEFT, "sim_0"),
                new Transition("sim_1", '_', '_', Direction.LEFT, "halt-accept"),
                new Transition("sim_1", '0', '0', Direction.STAY, "sim_2")));

        // Assert
        assertThat(out).containsExactly(
                new Transition("0", '*', '*', Direction.LEFT, "q_write_wall"),
                new Transition("q_write_wall", '_', '#', Direction.RIGHT, "sim_0"),
                new Transition("q_write_wall", '*', '*', Direction.LEFT, "q_write_wall"),
                new Transition("sim_0", '0', '1', Direction.RIGHT, "sim_1"),
                new Transition("sim_1", '1', '0', Direction.LEFT, "check_left_wall_sim_0"),
                new Transition("sim_1", '_', '_', Direction.LEFT, "halt-accept"),
                new Transition("sim_1", '0', '0', Direction.STAY, "sim_2"),
                new Transition("check_left_wall_sim_0", '*', '*', Direction.STAY, "sim_0"),
                new Transition("check_left_wall_sim_0", '#', '#', Direction.STAY, "halt"));
    }

    @Test
    void testOneCheckPerDistinctTarget() {
        // Act
        List<Transition> out = pipeline.convert(List.of(
                new Transition("sim_a", '0', '0', Direction.LEFT, "sim_b"),
                new Transition("sim_a", '1', '1', Direction.LEFT, "sim_b"),
                new Transition("sim_b", '1', '1', Direction.LEFT, "sim_a")));

        // Assert
        assertThat(out).filteredOn(t -> t.currentState().startsWith("check_left_wall_"))
                .extracting(Transition::currentState)
                .containsExactly("check_left_wall_sim_b", "check_left_wall_sim_b",
                        "check_left_wall_sim_a", "check_left_wall_sim_a");
    }
}
