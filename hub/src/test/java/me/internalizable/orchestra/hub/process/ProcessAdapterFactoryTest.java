package me.internalizable.orchestra.hub.process;

import me.internalizable.orchestra.api.hub.ServerConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessAdapterFactoryTest {

    private final ProcessAdapterFactory factory = new ProcessAdapterFactory();

    @Test
    void stringCommandIsSplitOnWhitespace() {
        ProcessServerAdapter adapter = (ProcessServerAdapter) factory.create(config("  ./run.sh   --port 9000 "));

        assertThat(adapter.getCommand()).containsExactly("./run.sh", "--port", "9000");
        assertThat(adapter.getServerId()).isEqualTo("search");
        assertThat(adapter.getPid()).isEqualTo(-1);
    }

    @Test
    void listCommandIsKeptAsArguments() {
        ProcessServerAdapter adapter = (ProcessServerAdapter) factory.create(
                config(List.of("sh", "-c", "echo hello world")));

        assertThat(adapter.getCommand()).containsExactly("sh", "-c", "echo hello world");
    }

    @Test
    void missingCommandIsRejected() {
        ServerConfig config = ServerConfig.builder("search").type("process").port(9000).build();

        assertThatThrownBy(() -> factory.create(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("search");
    }

    private static ServerConfig config(Object command) {
        return ServerConfig.builder("search")
                .type("process")
                .port(9000)
                .metadata(ProcessAdapterFactory.COMMAND, command)
                .build();
    }
}
