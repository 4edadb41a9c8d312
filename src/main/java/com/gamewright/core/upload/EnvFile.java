package com.gamewright.core.upload;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import io.github.cdimascio.dotenv.DotenvException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the keys declared in a {@code .env} marker file. Only entries from the
 * file itself are visible; the process environment is neither consulted nor modified.
 * Malformed lines are skipped.
 */
public final class EnvFile {

    private final Map<String, String> values;

    private EnvFile(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static EnvFile load(Path file) throws IOException {
        Path directory = file.toAbsolutePath().getParent();
        Dotenv dotenv;
        try {
            dotenv = Dotenv.configure()
                    .directory(directory.toString())
                    .filename(file.getFileName().toString())
                    .ignoreIfMalformed()
                    .load();
        } catch (DotenvException e) {
            throw new IOException("Could not read " + file + ": " + e.getMessage(), e);
        }

        var values = new LinkedHashMap<String, String>();
        for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
            values.put(entry.getKey(), entry.getValue());
        }
        return new EnvFile(values);
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key)).filter(v -> !v.isBlank());
    }

    /** First non-blank value among the given keys, in order. */
    public Optional<String> firstOf(List<String> keys) {
        for (String key : keys) {
            var value = get(key);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
