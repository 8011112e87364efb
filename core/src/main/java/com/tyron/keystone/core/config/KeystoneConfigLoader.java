package com.tyron.keystone.core.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads {@link KeystoneConfig} from YAML.
 * <p>
 * Recognized layout (every key optional):
 * <pre>
 * initialization:
 *   strict: true
 *   validateFirst: true
 * cache:
 *   enabled: true
 *   ttlSeconds: 300
 * discovery:
 *   enabled: true
 * logging:
 *   verbose: false
 * </pre>
 * Unknown keys are ignored.
 */
public final class KeystoneConfigLoader {

    public static final String DEFAULT_RESOURCE = "keystone.yaml";

    private static final Logger LOG = Logger.getLogger(KeystoneConfigLoader.class.getName());

    private KeystoneConfigLoader() {
    }

    /**
     * Loads {@value #DEFAULT_RESOURCE} from the class path, or returns defaults if it is absent.
     */
    public static KeystoneConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE, KeystoneConfigLoader.class.getClassLoader());
    }

    public static KeystoneConfig loadResource(String resource, ClassLoader loader) {
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("No " + resource + " on the class path, using defaults");
                }
                return KeystoneConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
    }

    public static KeystoneConfig load(Path file) {
        if (!Files.exists(file)) {
            return KeystoneConfig.defaults();
        }
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
    }

    public static KeystoneConfig load(InputStream in) {
        Object doc = new Yaml().load(in);
        KeystoneConfig.Builder builder = KeystoneConfig.builder();
        if (!(doc instanceof Map<?, ?> root)) {
            return builder.build();
        }

        Map<?, ?> init = section(root, "initialization");
        Boolean strict = bool(init, "strict", "initialization.strict");
        if (strict != null) builder.strictInitialization(strict);
        Boolean validateFirst = bool(init, "validateFirst", "initialization.validateFirst");
        if (validateFirst != null) builder.validateBeforeInitialization(validateFirst);

        Map<?, ?> cache = section(root, "cache");
        Boolean cacheEnabled = bool(cache, "enabled", "cache.enabled");
        if (cacheEnabled != null) builder.cacheEnabled(cacheEnabled);
        Object ttl = cache.get("ttlSeconds");
        if (ttl != null) {
            long seconds = number(ttl, "cache.ttlSeconds");
            if (seconds <= 0) {
                throw new IllegalArgumentException("cache.ttlSeconds must be positive: " + seconds);
            }
            builder.cacheTtl(Duration.ofSeconds(seconds));
        }

        Boolean discovery = bool(section(root, "discovery"), "enabled", "discovery.enabled");
        if (discovery != null) builder.discoveryEnabled(discovery);

        Boolean verbose = bool(section(root, "logging"), "verbose", "logging.verbose");
        if (verbose != null) builder.verboseLogging(verbose);

        return builder.build();
    }

    private static Map<?, ?> section(Map<?, ?> root, String name) {
        Object value = root.get(name);
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        if (value != null) {
            throw new IllegalArgumentException(name + " must be a mapping, got: " + value);
        }
        return Map.of();
    }

    private static Boolean bool(Map<?, ?> section, String key, String path) {
        Object value = section.get(key);
        if (value == null) return null;
        if (value instanceof Boolean b) return b;
        String s = String.valueOf(value).trim();
        if (s.equalsIgnoreCase("true")) return true;
        if (s.equalsIgnoreCase("false")) return false;
        throw new IllegalArgumentException(path + " must be true or false, got: " + value);
    }

    private static long number(Object value, String path) {
        if (value instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(path + " must be a number, got: " + value, e);
        }
    }
}
