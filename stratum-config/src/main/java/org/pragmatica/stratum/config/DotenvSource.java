package org.pragmatica.stratum.config;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;
import io.github.cdimascio.dotenv.DotenvException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads {@code KEY=VALUE} entries from a dotenv file.
 *
 * <p>Only entries declared in the file are returned; process environment variables are a
 * separate layer. The read is a single local file read with no retry.
 */
public final class DotenvSource {
    private static final Logger log = LoggerFactory.getLogger(DotenvSource.class);

    private DotenvSource() {}

    /**
     * Read the entries of the file at the given path.
     *
     * @throws ConfigException.SourceReadError if the file is missing, unreadable, malformed or repeats a key
     */
    public static Map<String, String> read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw ConfigException.sourceReadError(path, "file does not exist", null);
        }
        if (!Files.isReadable(path)) {
            throw ConfigException.sourceReadError(path, "file is not readable", null);
        }
        var absolute = path.toAbsolutePath();
        try{
            var dotenv = Dotenv.configure()
                               .directory(absolute.getParent()
                                                  .toString())
                               .filename(absolute.getFileName()
                                                 .toString())
                               .load();
            var entries = new LinkedHashMap<String, String>();
            for (DotenvEntry entry : dotenv.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
                entries.put(entry.getKey(), entry.getValue());
            }
            log.debug("Read {} entries from {}", entries.size(), absolute);
            return Map.copyOf(entries);
        } catch (DotenvException | IllegalStateException e) {
            // dotenv-java reports a repeated key as IllegalStateException
            throw ConfigException.sourceReadError(path, e.getMessage(), e);
        }
    }
}
