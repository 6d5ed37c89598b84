package me.internalizable.orchestra.api.hub;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationResultTest {

    @Test
    void completedCarriesRecord() {
        ServerConfig config = ServerConfig.builder("echo").type("process").port(9000).build();
        ServerRecord record = ServerRecord.starting(config, Instant.EPOCH, null);

        OperationResult result = OperationResult.completed(record);

        assertThat(result.isCompleted()).isTrue();
        assertThat(result.getServerId()).isEqualTo("echo");
        assertThat(result.getRecord()).contains(record);
        assertThat(result.requireRecord()).isSameAs(record);
        assertThat(result.getMessage()).isNull();
    }

    @Test
    void rejectionsHaveNoRecord() {
        OperationResult unknown = OperationResult.unknownServer("ghost");
        OperationResult invalid = OperationResult.validationFailed(null, "Server id must not be empty");

        assertThat(unknown.getOutcome()).isEqualTo(OperationResult.Outcome.UNKNOWN_SERVER);
        assertThat(unknown.getMessage()).isEqualTo("Server not found: ghost");
        assertThat(invalid.getOutcome()).isEqualTo(OperationResult.Outcome.VALIDATION_FAILED);
        assertThat(invalid.getRecord()).isEmpty();
        assertThatThrownBy(unknown::requireRecord)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("ghost");
    }
}
