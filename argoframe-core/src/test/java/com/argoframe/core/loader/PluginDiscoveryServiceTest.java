package com.argoframe.core.loader;

import com.argoframe.api.plugin.ArgoPlugin;
import com.argoframe.core.classloader.PluginClassLoader;
import com.argoframe.core.config.ArgoFrameConfig;
import com.argoframe.core.fixture.BrokenPlugin;
import com.argoframe.core.fixture.CsvAnalyzer;
import com.argoframe.core.fixture.GoodPlugin;
import com.argoframe.core.fixture.PartialPlugin;
import com.argoframe.core.fixture.PdfAnalyzer;
import com.argoframe.core.fixture.PluginUnits;
import com.argoframe.core.plugin.PluginManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("插件发现 单元测试")
public class PluginDiscoveryServiceTest {

    @TempDir
    Path home;

    private PluginManager manager;

    @BeforeEach
    void setUp() {
        manager = new PluginManager(ArgoFrameConfig.builder()
                .autoScan(false)
                .pluginHome(home.toString())
                .asyncPoolSize(2)
                .build());
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private static String manifestFor(Class<?>... classes) {
        List<String> names = Arrays.stream(classes).map(Class::getName).toList();
        return PluginUnits.manifestFor(names, "  greeting: hello\n");
    }

    @Nested
    @DisplayName("清单声明")
    class ManifestTests {

        @Test
        @DisplayName("一个单元初始化失败、一个成功时，只有成功的入表，异常不外抛")
        void failingUnitShouldNotAffectOthers() throws IOException {
            PluginUnits.manifestUnit(home, "broken-plugin", manifestFor(BrokenPlugin.class));
            PluginUnits.manifestUnit(home, "good-plugin", manifestFor(GoodPlugin.class));

            int loaded = assertDoesNotThrow(() -> manager.loadFromDirectory(home));

            assertEquals(1, loaded);
            assertEquals(1, manager.listPlugins().size());
            assertEquals(GoodPlugin.NAME, manager.listPlugins().get(0).getName());
            // 失败插件在 initialize 中的订阅已被回收
            assertEquals(1, manager.getEventBus().countHandlers("ping"));
        }

        @Test
        @DisplayName("清单中的 properties 通过上下文暴露给插件")
        void manifestPropertiesShouldReachPlugin() throws IOException {
            PluginUnits.manifestUnit(home, "good-plugin", manifestFor(GoodPlugin.class));
            manager.loadFromDirectory(home);

            manager.getEventBus().publishSync("ping", new HashMap<>());

            Map<String, Object> pong = manager.getEventBus().getHistory("pong", 1).get(0).getPayload();
            assertEquals("hello", pong.get("greeting"));
            assertEquals(GoodPlugin.NAME, manager.getEventBus().getHistory("pong", 1).get(0).getSource());
        }

        @Test
        @DisplayName("插件注册的分析器与钩子生效")
        void discoveredPluginShouldContributeCapabilities() throws IOException {
            PluginUnits.manifestUnit(home, "good-plugin", manifestFor(GoodPlugin.class));
            manager.loadFromDirectory(home);

            assertTrue(manager.getAnalyzerFor(Path.of("data.xlsx")).isPresent());
            Map<String, Object> data = manager.getHookPipeline().execute("pre_analysis", new HashMap<>());
            assertEquals(Boolean.TRUE, data.get(GoodPlugin.NAME));
        }

        @Test
        @DisplayName("不存在或未实现 ArgoPlugin 的类被跳过")
        void invalidClassesShouldBeSkipped() throws IOException {
            PluginUnits.manifestUnit(home, "mixed-plugin", PluginUnits.manifestFor(
                    List.of("com.example.DoesNotExist", CsvAnalyzer.class.getName(), GoodPlugin.class.getName()),
                    null));

            assertEquals(1, manager.loadFromDirectory(home));
        }

        @Test
        @DisplayName("损坏的清单只影响所在单元")
        void malformedManifestShouldBeIsolated() throws IOException {
            PluginUnits.manifestUnit(home, "bad-plugin", "pluginClasses: [unclosed\n");
            PluginUnits.manifestUnit(home, "good-plugin", manifestFor(GoodPlugin.class));

            assertEquals(1, manager.loadFromDirectory(home));
        }
    }

    @Nested
    @DisplayName("类名后缀扫描")
    class SuffixScanTests {

        @Test
        @DisplayName("没有清单的目录单元按后缀扫描，由单元自己的类加载器加载")
        void directoryUnitShouldBeScanned() throws IOException {
            PluginUnits.classUnit(home, "scan-plugin", GoodPlugin.class, CsvAnalyzer.class);

            assertEquals(1, manager.loadFromDirectory(home));

            ArgoPlugin plugin = manager.getPlugin(GoodPlugin.NAME).orElseThrow();
            assertInstanceOf(PluginClassLoader.class, plugin.getClass().getClassLoader());
            assertNotSame(GoodPlugin.class, plugin.getClass());
            assertEquals(1, manager.getStats().classLoaders());
        }

        @Test
        @DisplayName("Jar 单元按后缀扫描")
        void jarUnitShouldBeScanned() throws IOException {
            PluginUnits.jarUnit(home, "scan-plugin.jar", null, GoodPlugin.class);

            assertEquals(1, manager.loadFromDirectory(home));
            assertTrue(manager.getPlugin(GoodPlugin.NAME).isPresent());
        }

        @Test
        @DisplayName("初始化失败的单元注册过的分析器被回收，类加载器关闭后查找不受影响")
        void failedUnitShouldNotLeaveCapabilities() throws IOException {
            PluginUnits.classUnit(home, "good-plugin", GoodPlugin.class, CsvAnalyzer.class);
            PluginUnits.classUnit(home, "partial-plugin", PartialPlugin.class, PdfAnalyzer.class);

            assertEquals(1, manager.loadFromDirectory(home));

            assertTrue(manager.getPlugin(PartialPlugin.NAME).isEmpty());
            assertTrue(assertDoesNotThrow(() -> manager.getAnalyzerFor(Path.of("x.pdf"))).isEmpty());
            assertTrue(manager.getAnalyzerFor(Path.of("x.csv")).isPresent());
            assertEquals(1, manager.listAnalyzers().size());
            assertEquals(1, manager.getStats().classLoaders());
        }

        @Test
        @DisplayName("Jar 单元中的清单优先于扫描")
        void jarManifestShouldWin() throws IOException {
            PluginUnits.jarUnit(home, "declared-plugin.jar", manifestFor(BrokenPlugin.class), GoodPlugin.class);

            assertEquals(0, manager.loadFromDirectory(home));
            assertTrue(manager.listPlugins().isEmpty());
            assertEquals(0, manager.getStats().classLoaders());
        }
    }

    @Nested
    @DisplayName("目录与匹配规则")
    class DirectoryTests {

        @Test
        @DisplayName("目录不存在时返回 0，不抛异常")
        void missingDirectoryShouldReturnZero() {
            assertEquals(0, manager.loadFromDirectory(home.resolve("nope")));
        }

        @Test
        @DisplayName("只加载匹配 glob 的条目")
        void onlyMatchingEntriesShouldLoad() throws IOException {
            PluginUnits.manifestUnit(home, "good-extension", manifestFor(GoodPlugin.class));
            Files.writeString(home.resolve("readme-plugin.txt"), "not a unit");

            assertEquals(0, manager.loadFromDirectory(home));
            assertEquals(1, manager.loadFromDirectory(home, "*-extension"));
        }

        @Test
        @DisplayName("start 按配置扫描插件目录")
        void startShouldScanConfiguredHome() throws IOException {
            PluginUnits.manifestUnit(home, "good-plugin", manifestFor(GoodPlugin.class));
            try (PluginManager autoManager = new PluginManager(ArgoFrameConfig.builder()
                    .pluginHome(home.toString())
                    .asyncPoolSize(2)
                    .build())) {
                assertEquals(1, autoManager.start());
            }
            assertEquals(0, manager.start());
        }

        @Test
        @DisplayName("close 释放单元类加载器")
        void closeShouldReleaseClassLoaders() throws IOException {
            PluginUnits.classUnit(home, "scan-plugin", GoodPlugin.class);
            manager.loadFromDirectory(home);
            PluginClassLoader loader = (PluginClassLoader) manager.getPlugin(GoodPlugin.NAME)
                    .orElseThrow().getClass().getClassLoader();

            manager.close();

            assertTrue(loader.isClosed());
            assertEquals(0, manager.getStats().classLoaders());
        }
    }
}
