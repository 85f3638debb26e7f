package com.phillippitts.scalogram.service.orchestration;

import com.phillippitts.scalogram.service.orchestration.FileStateMachine.State;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileStateMachineTest {

    @Test
    void shouldWalkHappyPath() {
        FileStateMachine machine = new FileStateMachine("a.aaa");

        assertThat(machine.current()).isEqualTo(State.PENDING);
        machine.advance(State.LOADED);
        machine.advance(State.TRANSFORMED);
        machine.advance(State.RENDERED);
        machine.advance(State.EMITTED);

        assertThat(machine.current()).isEqualTo(State.EMITTED);
        assertThat(machine.isTerminal()).isTrue();
    }

    @Test
    void shouldRejectSkippedStage() {
        FileStateMachine machine = new FileStateMachine("a.aaa");

        assertThatThrownBy(() -> machine.advance(State.RENDERED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("a.aaa")
                .hasMessageContaining("PENDING -> RENDERED");
        assertThat(machine.current()).isEqualTo(State.PENDING);
    }

    @Test
    void shouldFailFromAnyNonTerminalState() {
        FileStateMachine machine = new FileStateMachine("a.aaa");
        machine.advance(State.LOADED);

        machine.fail();

        assertThat(machine.current()).isEqualTo(State.FAILED);
        assertThat(machine.isTerminal()).isTrue();
    }

    @Test
    void terminalStatesShouldBeFinal() {
        FileStateMachine failed = new FileStateMachine("a.aaa");
        failed.fail();

        assertThatThrownBy(failed::fail).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> failed.advance(State.LOADED)).isInstanceOf(IllegalStateException.class);
    }
}
