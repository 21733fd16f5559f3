package com.argoframe.core.config;

import com.argoframe.core.exception.ConfigLoadException;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * 从 YAML 读取 {@link ArgoFrameConfig}
 * <pre>
 * argoframe:
 *   plugin-home: plugins
 *   plugin-pattern: "*-plugin*"
 *   plugin-class-suffix: Plugin
 *   auto-scan: true
 *   event-history-capacity: 100
 *   async-pool-size: 4
 *   properties:
 *     llm:
 *       model: gpt-4o
 * </pre>
 * properties 下的嵌套结构会被展开为点分 key，例如 {@code llm.model}
 */
@Slf4j
public final class ConfigLoader {

    public static final String DEFAULT_RESOURCE = "argoframe.yml";
    private static final String ROOT_KEY = "argoframe";

    private ConfigLoader() {
    }

    public static ArgoFrameConfig load(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigLoadException("Config file not found: " + file);
        }
        try (InputStream in = Files.newInputStream(file)) {
            log.info("Loading ArgoFrame config from {}", file);
            return load(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read config file: " + file, e);
        }
    }

    /**
     * 读取 classpath 上的 argoframe.yml，不存在时返回默认配置
     */
    public static ArgoFrameConfig loadDefault(ClassLoader classLoader) {
        try (InputStream in = classLoader.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                log.info("No {} on classpath, using defaults", DEFAULT_RESOURCE);
                return ArgoFrameConfig.defaults();
            }
            return load(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to read " + DEFAULT_RESOURCE, e);
        }
    }

    @SuppressWarnings("unchecked")
    public static ArgoFrameConfig load(InputStream in) {
        Object root;
        try {
            root = new Yaml(new SafeConstructor(new LoaderOptions())).load(in);
        } catch (YAMLException e) {
            throw new ConfigLoadException("Malformed config: " + e.getMessage(), e);
        }
        if (root == null) {
            return ArgoFrameConfig.defaults();
        }
        if (!(root instanceof Map)) {
            throw new ConfigLoadException("Config root must be a mapping");
        }
        Object section = ((Map<String, Object>) root).get(ROOT_KEY);
        if (section == null) {
            return ArgoFrameConfig.defaults();
        }
        if (!(section instanceof Map)) {
            throw new ConfigLoadException("'" + ROOT_KEY + "' must be a mapping");
        }
        return bind((Map<?, ?>) section);
    }

    @SuppressWarnings("unchecked")
    private static ArgoFrameConfig bind(Map<?, ?> section) {
        ArgoFrameConfig config = ArgoFrameConfig.defaults();
        for (Map.Entry<?, ?> entry : section.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new ConfigLoadException("Config key under '" + ROOT_KEY + "' must be a string: " + entry.getKey());
            }
            Object value = entry.getValue();
            switch (key) {
                case "plugin-home" -> config.setPluginHome(asString(key, value));
                case "plugin-pattern" -> config.setPluginPattern(asString(key, value));
                case "plugin-class-suffix" -> config.setPluginClassSuffix(asString(key, value));
                case "auto-scan" -> config.setAutoScan(asBoolean(key, value));
                case "event-history-capacity" -> config.setEventHistoryCapacity(asPositiveInt(key, value));
                case "async-pool-size" -> config.setAsyncPoolSize(asPositiveInt(key, value));
                case "properties" -> {
                    if (!(value instanceof Map)) {
                        throw new ConfigLoadException("'properties' must be a mapping");
                    }
                    Map<String, String> flat = new HashMap<>();
                    flatten("", (Map<String, Object>) value, flat);
                    config.setProperties(flat);
                }
                default -> log.warn("Unknown config key ignored: {}.{}", ROOT_KEY, key);
            }
        }
        return config;
    }

    @SuppressWarnings("unchecked")
    private static void flatten(String prefix, Map<String, Object> source, Map<String, String> target) {
        for (Map.Entry<String, Object> entry : source.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            Object value = entry.getValue();
            if (value instanceof Map) {
                flatten(key, (Map<String, Object>) value, target);
            } else if (value != null) {
                target.put(key, String.valueOf(value));
            }
        }
    }

    private static String asString(String key, Object value) {
        if (value == null) {
            throw new ConfigLoadException("'" + key + "' must not be empty");
        }
        return String.valueOf(value);
    }

    private static boolean asBoolean(String key, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        throw new ConfigLoadException("'" + key + "' must be true or false, got: " + value);
    }

    private static int asPositiveInt(String key, Object value) {
        if (value instanceof Integer i && i > 0) {
            return i;
        }
        throw new ConfigLoadException("'" + key + "' must be a positive integer, got: " + value);
    }
}
