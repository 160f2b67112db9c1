package net.papermentat.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessingStateTest {

    @Test
    @DisplayName("states move forward only")
    void canAdvanceTo_forwardOnly() {
        assertThat(ProcessingState.NEW.canAdvanceTo(ProcessingState.TRIAGED)).isTrue();
        assertThat(ProcessingState.NEW.canAdvanceTo(ProcessingState.METADATA_EXTRACTED)).isTrue();
        assertThat(ProcessingState.METADATA_EXTRACTED.canAdvanceTo(ProcessingState.OA_VERIFIED)).isTrue();
        assertThat(ProcessingState.OA_VERIFIED.canAdvanceTo(ProcessingState.METADATA_EXTRACTED)).isFalse();
        assertThat(ProcessingState.TRIAGED.canAdvanceTo(ProcessingState.TRIAGED)).isFalse();
    }

    @ParameterizedTest
    @EnumSource(value = ProcessingState.class, names = {"NEW", "TRIAGED", "METADATA_EXTRACTED", "OA_VERIFIED"})
    @DisplayName("every non-terminal state may fail")
    void nonTerminal_mayFail(ProcessingState state) {
        assertThat(state.isTerminal()).isFalse();
        assertThat(state.canAdvanceTo(ProcessingState.FAILED)).isTrue();
    }

    @ParameterizedTest
    @EnumSource(value = ProcessingState.class, names = {"COMPLETED", "FAILED"})
    @DisplayName("terminal states accept no transition")
    void terminal_acceptsNothing(ProcessingState state) {
        assertThat(state.isTerminal()).isTrue();
        for (ProcessingState next : ProcessingState.values()) {
            assertThat(state.canAdvanceTo(next)).isFalse();
        }
    }

    @Test
    @DisplayName("serialized value is the lowercase name")
    void value_isLowercase() {
        assertThat(ProcessingState.METADATA_EXTRACTED.value()).isEqualTo("metadata_extracted");
    }
}
