package io.github.hide212131.langchain4j.mentor.runtime.capability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class PhaseTest {

    @Test
    void advanceTo_shouldNeverMoveBackwards() {
        assertThat(Phase.INITIALIZATION.advanceTo(Phase.REQUIREMENTS_COMPLETE)).isEqualTo(Phase.REQUIREMENTS_COMPLETE);
        assertThat(Phase.ARCHITECTURE_COMPLETE.advanceTo(Phase.REQUIREMENTS_COMPLETE))
                .isEqualTo(Phase.ARCHITECTURE_COMPLETE);
        assertThat(Phase.DISCOVERY.advanceTo(null)).isEqualTo(Phase.DISCOVERY);
    }

    @Test
    void fromWireName_shouldBeCaseInsensitive() {
        assertThat(Phase.fromWireName(" Planning_Complete ")).isEqualTo(Phase.PLANNING_COMPLETE);
        assertThat(Phase.EXPORTABLE.toString()).isEqualTo("exportable");
    }

    @Test
    void fromWireName_shouldRejectUnknownNames() {
        assertThatThrownBy(() -> Phase.fromWireName("done"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown phase: done");
        assertThatThrownBy(() -> Phase.fromWireName(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
