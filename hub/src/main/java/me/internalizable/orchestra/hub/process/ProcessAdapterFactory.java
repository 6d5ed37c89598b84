package me.internalizable.orchestra.hub.process;

import me.internalizable.orchestra.api.hub.ServerConfig;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapter;
import me.internalizable.orchestra.api.hub.adapter.ServerAdapterFactory;

import javax.annotation.Nonnull;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Factory for servers of type {@code process}.
 *
 * <h2>Metadata</h2>
 * <ul>
 *   <li>{@code command} - command line as a string (split on whitespace) or a list of arguments, required</li>
 *   <li>{@code workingDirectory} - directory to run in, defaults to the current directory</li>
 *   <li>{@code readyLine} - output fragment that marks the server as started</li>
 * </ul>
 *
 * <p>The process receives {@code ORCHESTRA_SERVER_ID} and {@code ORCHESTRA_PORT}
 * in its environment.</p>
 */
public class ProcessAdapterFactory implements ServerAdapterFactory {

    public static final String TYPE = "process";

    public static final String COMMAND = "command";
    public static final String WORKING_DIRECTORY = "workingDirectory";
    public static final String READY_LINE = "readyLine";

    @Override
    @Nonnull
    public String type() {
        return TYPE;
    }

    @Override
    @Nonnull
    public ServerAdapter create(@Nonnull ServerConfig config) {
        List<String> command = parseCommand(config);

        String directory = config.getMetadataString(WORKING_DIRECTORY);
        Path workingDirectory = directory != null ? Paths.get(directory) : Paths.get(".");

        Map<String, String> environment = new HashMap<>();
        environment.put("ORCHESTRA_SERVER_ID", config.id());
        environment.put("ORCHESTRA_PORT", String.valueOf(config.port()));

        return new ProcessServerAdapter(
                config.id(),
                command,
                workingDirectory,
                environment,
                config.getMetadataString(READY_LINE)
        );
    }

    private static List<String> parseCommand(ServerConfig config) {
        Object raw = config.getMetadata(COMMAND);
        List<String> command = new ArrayList<>();

        if (raw instanceof List<?> list) {
            for (Object part : list) {
                if (part != null) {
                    command.add(part.toString());
                }
            }
        } else if (raw != null) {
            Arrays.stream(raw.toString().trim().split("\\s+"))
                    .filter(part -> !part.isEmpty())
                    .forEach(command::add);
        }

        if (command.isEmpty()) {
            throw new IllegalArgumentException("Server '" + config.id() + "' has no command configured");
        }
        return command;
    }
}
