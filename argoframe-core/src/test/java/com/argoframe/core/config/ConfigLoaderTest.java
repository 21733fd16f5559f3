package com.argoframe.core.config;

import com.argoframe.core.exception.ConfigLoadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ConfigLoader 单元测试")
public class ConfigLoaderTest {

    @TempDir
    Path dir;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("读取所有配置项，properties 展开为点分 key")
    void shouldBindAllKeys() throws IOException {
        Path file = dir.resolve("argoframe.yml");
        Files.writeString(file, """
                argoframe:
                  plugin-home: /opt/argo/plugins
                  plugin-pattern: "*.jar"
                  plugin-class-suffix: Extension
                  auto-scan: false
                  event-history-capacity: 7
                  async-pool-size: 3
                  properties:
                    llm:
                      model: gpt-4o
                    region: eu
                """);

        ArgoFrameConfig config = ConfigLoader.load(file);

        assertEquals("/opt/argo/plugins", config.getPluginHome());
        assertEquals("*.jar", config.getPluginPattern());
        assertEquals("Extension", config.getPluginClassSuffix());
        assertFalse(config.isAutoScan());
        assertEquals(7, config.getEventHistoryCapacity());
        assertEquals(3, config.getAsyncPoolSize());
        assertEquals("gpt-4o", config.getProperty("llm.model").orElseThrow());
        assertEquals("eu", config.getProperty("region").orElseThrow());
    }

    @Test
    @DisplayName("缺省项使用默认值")
    void missingKeysShouldUseDefaults() {
        ArgoFrameConfig config = ConfigLoader.load(yaml("argoframe:\n  auto-scan: true\n"));

        assertEquals("plugins", config.getPluginHome());
        assertEquals("*-plugin*", config.getPluginPattern());
        assertEquals("Plugin", config.getPluginClassSuffix());
        assertEquals(100, config.getEventHistoryCapacity());
        assertTrue(config.getAsyncPoolSize() >= 2);
    }

    @Test
    @DisplayName("空文件或没有根节点时返回默认配置")
    void emptyDocumentShouldYieldDefaults() {
        assertEquals(ArgoFrameConfig.defaults(), ConfigLoader.load(yaml("")));
        assertEquals(ArgoFrameConfig.defaults(), ConfigLoader.load(yaml("other: 1\n")));
    }

    @Test
    @DisplayName("未知 key 只告警")
    void unknownKeysShouldBeIgnored() {
        ArgoFrameConfig config = ConfigLoader.load(yaml("argoframe:\n  dev-mode: true\n  plugin-home: x\n"));
        assertEquals("x", config.getPluginHome());
    }

    @Test
    @DisplayName("类型错误与语法错误抛出 ConfigLoadException")
    void badValuesShouldFail() {
        assertThrows(ConfigLoadException.class,
                () -> ConfigLoader.load(yaml("argoframe:\n  async-pool-size: 0\n")));
        assertThrows(ConfigLoadException.class,
                () -> ConfigLoader.load(yaml("argoframe:\n  auto-scan: maybe\n")));
        assertThrows(ConfigLoadException.class,
                () -> ConfigLoader.load(yaml("argoframe:\n  properties: [a, b]\n")));
        assertThrows(ConfigLoadException.class,
                () -> ConfigLoader.load(yaml("argoframe: [unclosed\n")));
        assertThrows(ConfigLoadException.class, () -> ConfigLoader.load(dir.resolve("missing.yml")));
    }

    @Test
    @DisplayName("非字符串或空 key 抛出 ConfigLoadException")
    void nonStringKeysShouldFail() {
        assertThrows(ConfigLoadException.class,
                () -> ConfigLoader.load(yaml("argoframe:\n  1: x\n")));
        assertThrows(ConfigLoadException.class,
                () -> ConfigLoader.load(yaml("argoframe:\n  ~: x\n")));
    }

    @Test
    @DisplayName("YAML 中的全局标签不会被实例化")
    void globalTagsShouldBeRejected() {
        assertThrows(ConfigLoadException.class,
                () -> ConfigLoader.load(yaml("argoframe: !!java.io.File [\"/tmp\"]\n")));
    }

    @Test
    @DisplayName("classpath 上的 argoframe.yml 被读取，缺失时返回默认配置")
    void loadDefaultShouldReadClasspathResource() throws IOException {
        ArgoFrameConfig config = ConfigLoader.loadDefault(getClass().getClassLoader());
        assertEquals(20, config.getEventHistoryCapacity());
        assertEquals("test-model", config.getProperty("llm.model").orElseThrow());
        assertEquals("0.2", config.getProperty("llm.temperature").orElseThrow());

        try (URLClassLoader empty = new URLClassLoader(new URL[0], null)) {
            assertEquals(ArgoFrameConfig.defaults(), ConfigLoader.loadDefault(empty));
        }
    }
}
