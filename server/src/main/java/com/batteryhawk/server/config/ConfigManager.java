/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.batteryhawk.server.config;

import com.batteryhawk.common.exception.ConfigurationException;
import com.batteryhawk.common.util.ConfigPropertyResolver;
import com.batteryhawk.common.util.JsonUtil;
import com.batteryhawk.messaging.core.ConfigChangeListener;
import com.batteryhawk.messaging.core.ConfigSource;
import com.fasterxml.jackson.core.type.TypeReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * File-backed configuration with hot reload.
 *
 * <h3>Sections</h3>
 * <ul>
 *   <li>{@code system} → {@code system.json}</li>
 *   <li>{@code devices} → {@code devices.json}</li>
 *   <li>{@code vehicles} → {@code vehicles.json}</li>
 * </ul>
 *
 * <h3>Loading</h3>
 * A missing or unreadable file is (re)created from the bundled defaults. Keys missing from a file
 * are filled in from the defaults, recursively. {@code ${key:default}} placeholders are resolved
 * with {@link ConfigPropertyResolver}, then {@code BATTERYHAWK_SECTION_KEY...=value} environment
 * variables override individual keys; values are parsed as JSON when they parse.
 *
 * <h3>Reload</h3>
 * A daemon thread compares a per-file fingerprint every {@code pollInterval}. A changed file is
 * re-read, validated and, if valid, swapped in; listeners then receive
 * {@code (section, values)}. An invalid file leaves the previous values in place.
 */
public class ConfigManager implements ConfigSource {

    private static final Logger log = LoggerFactory.getLogger(ConfigManager.class);

    public static final Map<String, String> CONFIG_FILES = Map.of(
            "system", "system.json",
            "devices", "devices.json",
            "vehicles", "vehicles.json");

    private static final Map<String, List<String>> REQUIRED_OBJECTS = Map.of(
            "system", List.of("logging", "bluetooth", "discovery", "mqtt", "api"),
            "devices", List.of("devices"),
            "vehicles", List.of("vehicles"));

    static final String ENV_PREFIX = "BATTERYHAWK_";
    private static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(5);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Path configDir;
    private final Map<String, String> environment;
    private final ConfigPropertyResolver resolver;
    private final Duration pollInterval;
    private final Map<String, Map<String, Object>> configs = new ConcurrentHashMap<>();
    private final Map<String, Long> fingerprints = new ConcurrentHashMap<>();
    private final List<ConfigChangeListener> listeners = new CopyOnWriteArrayList<>();
    private ScheduledExecutorService scheduler;

    public ConfigManager(Path configDir) {
        this(configDir, System.getenv(), new ConfigPropertyResolver(), DEFAULT_POLL_INTERVAL);
    }

    public ConfigManager(Path configDir, Map<String, String> environment, ConfigPropertyResolver resolver,
                         Duration pollInterval) {
        this.configDir = configDir;
        this.environment = environment;
        this.resolver = resolver;
        this.pollInterval = pollInterval;
        loadAll();
    }

    // ─── ConfigSource ───────────────────────────────────────────────

    @Override
    public Map<String, Object> getConfig(String section) {
        Map<String, Object> values = configs.get(section);
        return values != null ? deepCopy(values) : new LinkedHashMap<>();
    }

    @Override
    public void registerListener(ConfigChangeListener listener) {
        listeners.add(listener);
    }

    /**
     * Validate, persist and apply a section, then notify listeners.
     *
     * @throws ConfigurationException if the section is unknown, invalid or cannot be written
     */
    public void saveConfig(String section, Map<String, Object> values) {
        String filename = requireSection(section);
        Map<String, Object> copy = deepCopy(values);
        validate(section, copy);
        Path path = configDir.resolve(filename);
        writeFile(path, copy);
        configs.put(section, copy);
        fingerprints.put(section, fingerprint(path));
        log.info("Saved configuration section '{}'", section);
        notifyListeners(section, copy);
    }

    // ─── Reload scheduler ───────────────────────────────────────────

    public synchronized void start() {
        if (scheduler != null && !scheduler.isShutdown()) return;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "config-auto-reload");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleWithFixedDelay(this::checkForChanges,
                pollInterval.toMillis(), pollInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Config watcher started, checking {} every {} ms", configDir, pollInterval.toMillis());
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
            log.info("Config watcher stopped");
        }
    }

    /** One polling cycle: reload every section whose file changed since it was last read. */
    public void checkForChanges() {
        for (Map.Entry<String, String> entry : CONFIG_FILES.entrySet()) {
            String section = entry.getKey();
            Path path = configDir.resolve(entry.getValue());
            try {
                long current = fingerprint(path);
                Long previous = fingerprints.get(section);
                if (previous != null && previous == current) {
                    continue;
                }
                log.info("Change detected in {}, reloading section '{}'", path, section);
                Map<String, Object> reloaded = readSection(section, path);
                validate(section, reloaded);
                configs.put(section, reloaded);
                fingerprints.put(section, current);
                notifyListeners(section, reloaded);
            } catch (ConfigurationException e) {
                fingerprints.put(section, fingerprint(path));
                log.error("Rejected reload of '{}', keeping previous values: {}", section, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Error checking configuration section '{}'", section, e);
            }
        }
    }

    // ─── Loading ────────────────────────────────────────────────────

    private void loadAll() {
        try {
            Files.createDirectories(configDir);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create config directory " + configDir, e);
        }
        for (Map.Entry<String, String> entry : CONFIG_FILES.entrySet()) {
            String section = entry.getKey();
            Path path = configDir.resolve(entry.getValue());
            Map<String, Object> values;
            if (Files.exists(path)) {
                try {
                    values = readSection(section, path);
                } catch (ConfigurationException e) {
                    log.error("Failed to load {}, restoring defaults: {}", path, e.getMessage());
                    values = restoreDefaults(section, path);
                }
            } else {
                log.info("Config file {} not found, creating it from defaults", path);
                values = restoreDefaults(section, path);
            }
            validate(section, values);
            configs.put(section, values);
            fingerprints.put(section, fingerprint(path));
        }
        log.info("Loaded configuration sections {} from {}", configs.keySet(), configDir);
    }

    private Map<String, Object> readSection(String section, Path path) {
        Map<String, Object> raw;
        try {
            raw = JsonUtil.readMap(path.toFile());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + path + ": " + e.getMessage(), e);
        }
        if (raw == null) {
            throw new ConfigurationException(path + " does not contain a JSON object");
        }
        return effective(section, raw);
    }

    private Map<String, Object> restoreDefaults(String section, Path path) {
        Map<String, Object> defaults = defaults(section);
        writeFile(path, defaults);
        return effective(section, defaults);
    }

    private Map<String, Object> effective(String section, Map<String, Object> raw) {
        Map<String, Object> merged = mergeDefaults(raw, defaults(section));
        resolver.resolveMap(merged);
        applyEnvOverrides(section, merged);
        return merged;
    }

    static Map<String, Object> defaults(String section) {
        String resource = "defaults/" + requireSection(section);
        try (InputStream in = ConfigManager.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Missing bundled defaults " + resource);
            }
            return JsonUtil.mapper().readValue(in, MAP_TYPE);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read bundled defaults " + resource, e);
        }
    }

    /** Fill keys missing from {@code config} with values from {@code defaults}, recursing into objects. */
    @SuppressWarnings("unchecked")
    static Map<String, Object> mergeDefaults(Map<String, Object> config, Map<String, Object> defaults) {
        for (Map.Entry<String, Object> entry : defaults.entrySet()) {
            Object current = config.get(entry.getKey());
            if (!config.containsKey(entry.getKey())) {
                config.put(entry.getKey(), deepCopyValue(entry.getValue()));
            } else if (current instanceof Map && entry.getValue() instanceof Map) {
                mergeDefaults((Map<String, Object>) current, (Map<String, Object>) entry.getValue());
            }
        }
        return config;
    }

    /**
     * Apply {@code BATTERYHAWK_<SECTION>_<PATH>} overrides. Path segments are matched against
     * existing keys first so that keys containing underscores, such as {@code topic_prefix},
     * can be addressed.
     */
    @SuppressWarnings("unchecked")
    void applyEnvOverrides(String section, Map<String, Object> config) {
        String sectionPrefix = ENV_PREFIX + section.toUpperCase(Locale.ROOT) + "_";
        for (Map.Entry<String, String> env : environment.entrySet()) {
            if (!env.getKey().startsWith(sectionPrefix)) continue;
            List<String> parts = Arrays.asList(
                    env.getKey().substring(sectionPrefix.length()).toLowerCase(Locale.ROOT).split("_"));
            if (parts.isEmpty() || parts.get(0).isEmpty()) continue;

            Map<String, Object> target = config;
            int i = 0;
            String key = null;
            while (i < parts.size()) {
                int end = longestExistingKey(target, parts, i);
                key = String.join("_", parts.subList(i, end));
                i = end;
                if (i == parts.size()) break;
                Object next = target.get(key);
                if (!(next instanceof Map)) {
                    next = new LinkedHashMap<String, Object>();
                    target.put(key, next);
                }
                target = (Map<String, Object>) next;
            }
            Object value = parseEnvValue(env.getValue());
            target.put(key, value);
            log.info("Applied env override {} -> {}.{}", env.getKey(), section, String.join(".", parts));
        }
    }

    private static int longestExistingKey(Map<String, Object> target, List<String> parts, int from) {
        for (int end = parts.size(); end > from + 1; end--) {
            if (target.containsKey(String.join("_", parts.subList(from, end)))) {
                return end;
            }
        }
        return from + 1;
    }

    static Object parseEnvValue(String value) {
        try {
            return JsonUtil.mapper().readValue(value, Object.class);
        } catch (IOException e) {
            return value;
        }
    }

    private static void validate(String section, Map<String, Object> values) {
        for (String key : REQUIRED_OBJECTS.getOrDefault(section, List.of())) {
            Object value = values.get(key);
            if (!(value instanceof Map)) {
                throw new ConfigurationException("Validation error in " + section + " config: '" + key
                        + "' must be an object");
            }
        }
    }

    private static String requireSection(String section) {
        String filename = CONFIG_FILES.get(section);
        if (filename == null) {
            throw new ConfigurationException("Unknown configuration section '" + section + "'");
        }
        return filename;
    }

    private static void writeFile(Path path, Map<String, Object> values) {
        try {
            JsonUtil.toFile(path.toFile(), values);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to save " + path + ": " + e.getMessage(), e);
        }
    }

    private void notifyListeners(String section, Map<String, Object> values) {
        for (ConfigChangeListener listener : listeners) {
            try {
                listener.onConfigChanged(section, deepCopy(values));
            } catch (RuntimeException e) {
                log.error("Config listener failed for section '{}'", section, e);
            }
        }
    }

    /** Size, timestamp and content hash of a file; 0 when it does not exist. */
    private static long fingerprint(Path path) {
        File file = path.toFile();
        if (!file.isFile()) return 0L;
        long fp = file.length();
        fp = 31 * fp + file.lastModified();
        try {
            fp = 31 * fp + Arrays.hashCode(Files.readAllBytes(path));
        } catch (IOException e) {
            log.debug("Could not hash {}: {}", path, e.getMessage());
        }
        return fp;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> deepCopy(Map<String, Object> source) {
        return (Map<String, Object>) deepCopyValue(source);
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            ((Map<String, Object>) value).forEach((k, v) -> copy.put(k, deepCopyValue(v)));
            return copy;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            ((List<Object>) value).forEach(v -> copy.add(deepCopyValue(v)));
            return copy;
        }
        return value;
    }
}
