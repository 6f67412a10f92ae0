package org.gudu0.journalbot.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.gudu0.journalbot.util.ConsoleLog;

import java.nio.file.*;
import java.util.function.Supplier;

/**
 * Loads and saves a JSON config object with atomic writes.
 */
public class TypedConfigStore<T> {
    private final Path path;
    private final ObjectMapper om;
    private final Class<T> type;
    private final Supplier<T> defaults;

    private final boolean existed;
    private final T cfg;

    public TypedConfigStore(Path path, Class<T> type, Supplier<T> defaults) {
        this.path = path;
        this.type = type;
        this.defaults = defaults;
        this.om = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.existed = Files.exists(path);
        this.cfg = loadOrNew();
    }

    public T cfg() { return cfg; }

    /** False when defaults were used because the file did not exist yet. */
    public boolean existed() { return existed; }

    public synchronized void save() throws Exception {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        om.writeValue(tmp.toFile(), cfg);
        Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        ConsoleLog.info("TypedConfigStore", "Saved config to " + path);
    }

    private T loadOrNew() {
        if (existed) {
            try {
                T loaded = om.readValue(path.toFile(), type);
                ConsoleLog.info("TypedConfigStore", "Loaded config from " + path);
                return loaded;
            } catch (Exception e) {
                // A broken file must not be silently replaced by defaults.
                throw new ConfigInvalidException("Cannot parse " + path + ": " + e.getMessage(), e);
            }
        }
        ConsoleLog.warn("TypedConfigStore", "Config missing: " + path + " (using defaults)");
        return defaults.get();
    }
}
