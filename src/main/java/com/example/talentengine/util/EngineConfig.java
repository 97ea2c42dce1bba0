package com.example.talentengine.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Engine settings. Lookup order for a key such as {@code db.url}:
 * environment variable {@code TALENTENGINE_DB_URL}, then system property
 * {@code talentengine.db.url}, then the classpath {@code /talentengine.yaml}, then the default.
 */
public class EngineConfig {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String RESOURCE = "/talentengine.yaml";

    public static final String KEY_ABILITIES = "abilities";
    public static final String KEY_TALENTS = "talents";
    public static final String KEY_AVATARS = "avatars";
    public static final String KEY_DB_URL = "db.url";
    public static final String KEY_DB_USER = "db.user";
    public static final String KEY_DB_PASSWORD = "db.password";

    private static final Map<String, String> DEFAULTS = new LinkedHashMap<>();

    static {
        DEFAULTS.put(KEY_ABILITIES, "/data/abilities.yaml");
        DEFAULTS.put(KEY_TALENTS, "/data/talents.yaml");
        DEFAULTS.put(KEY_AVATARS, "/data/avatars.yaml");
        DEFAULTS.put(KEY_DB_URL, "jdbc:h2:file:./data/talentengine;AUTO_SERVER=TRUE;DB_CLOSE_DELAY=-1");
        DEFAULTS.put(KEY_DB_USER, "sa");
        DEFAULTS.put(KEY_DB_PASSWORD, "");
    }

    private final Map<String, String> fileValues;
    private final Map<String, String> env;

    EngineConfig(Map<String, String> fileValues, Map<String, String> env) {
        this.fileValues = fileValues;
        this.env = env;
    }

    /** Load from the default classpath resource and the process environment. */
    public static EngineConfig load() {
        return load(RESOURCE);
    }

    public static EngineConfig load(String resourcePath) {
        return new EngineConfig(readYaml(resourcePath), System.getenv());
    }

    public String get(String key) {
        String envValue = env.get(envName(key));
        if (envValue != null && !envValue.isEmpty()) return envValue;
        String prop = System.getProperty("talentengine." + key);
        if (prop != null && !prop.isEmpty()) return prop;
        String fileValue = fileValues.get(key);
        if (fileValue != null) return fileValue;
        return DEFAULTS.get(key);
    }

    public String getAbilitiesResource() { return get(KEY_ABILITIES); }
    public String getTalentsResource() { return get(KEY_TALENTS); }
    public String getAvatarsResource() { return get(KEY_AVATARS); }
    public String getDbUrl() { return get(KEY_DB_URL); }
    public String getDbUser() { return get(KEY_DB_USER); }
    public String getDbPassword() { return get(KEY_DB_PASSWORD); }

    /** Environment variable consulted for {@code key}, e.g. {@code TALENTENGINE_DB_URL}. */
    public static String envName(String key) {
        return "TALENTENGINE_" + key.toUpperCase(Locale.ROOT).replace('.', '_');
    }

    private static Map<String, String> readYaml(String resourcePath) {
        Map<String, String> out = new LinkedHashMap<>();
        try (InputStream in = EngineConfig.class.getResourceAsStream(resourcePath)) {
            if (in == null) {
                logger.debug("No config resource at {}, using defaults", resourcePath);
                return out;
            }
            Object root = new Yaml().load(in);
            if (root instanceof Map) {
                flatten("", (Map<?, ?>) root, out);
            }
            logger.info("Loaded {} config values from {}", out.size(), resourcePath);
        } catch (Exception e) {
            logger.warn("Failed to read config {}: {}", resourcePath, e.getMessage());
        }
        return out;
    }

    // nested maps become dotted keys: db: {url: x} -> db.url
    private static void flatten(String prefix, Map<?, ?> map, Map<String, String> out) {
        for (Map.Entry<?, ?> e : map.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(e.getKey()) : prefix + "." + e.getKey();
            Object v = e.getValue();
            if (v instanceof Map) {
                flatten(key, (Map<?, ?>) v, out);
            } else if (v != null) {
                out.put(key, String.valueOf(v));
            }
        }
    }
}
