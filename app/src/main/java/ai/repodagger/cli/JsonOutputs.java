package ai.repodagger.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/** Writes run artifacts as single-line JSON documents with sorted keys and a trailing newline. */
public final class JsonOutputs {
    private static final ObjectMapper MAPPER =
            new ObjectMapper().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

    private JsonOutputs() {}

    public static void write(Path path, Object value) throws IOException {
        var json = MAPPER.writeValueAsString(value) + "\n";
        Files.writeString(path, json, StandardCharsets.UTF_8);
    }
}
