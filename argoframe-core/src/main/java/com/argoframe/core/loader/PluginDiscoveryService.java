package com.argoframe.core.loader;

import com.argoframe.api.config.PluginManifest;
import com.argoframe.api.plugin.ArgoPlugin;
import com.argoframe.core.config.ArgoFrameConfig;
import com.argoframe.core.plugin.PluginManager;
import com.argoframe.core.spi.PluginLoaderFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.nio.file.*;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 插件自动发现服务
 * <p>
 * 职责：
 * 1. 扫描目录下匹配 glob 的一级条目（Jar 包或 exploded 类目录）
 * 2. 为每个单元创建隔离的类加载器
 * 3. 按 plugin.yml 声明或类名后缀找出插件入口类并实例化
 * 4. 调用 PluginManager 完成注册
 * </p>
 * 单元之间、类之间的失败互相隔离，只记录日志。
 */
@Slf4j
public class PluginDiscoveryService implements AutoCloseable {

    private static final String CLASS_SUFFIX = ".class";
    private static final String JAR_SUFFIX = ".jar";

    private final ArgoFrameConfig config;
    private final PluginManager pluginManager;
    private final PluginLoaderFactory loaderFactory;

    // 产出过插件的单元加载器，关闭时统一释放
    private final List<ClassLoader> activeLoaders = new CopyOnWriteArrayList<>();

    public PluginDiscoveryService(ArgoFrameConfig config, PluginManager pluginManager,
                                  PluginLoaderFactory loaderFactory) {
        this.config = config;
        this.pluginManager = pluginManager;
        this.loaderFactory = loaderFactory;
    }

    /**
     * 扫描并加载
     *
     * @param dir     插件目录
     * @param pattern 单元名 glob，例如 {@code *-plugin*}
     * @return 成功注册的插件数
     */
    public int discover(Path dir, String pattern) {
        if (dir == null || !Files.isDirectory(dir)) {
            log.warn("Plugin directory does not exist: {}", dir);
            return 0;
        }
        String glob = pattern != null && !pattern.isBlank() ? pattern : config.getPluginPattern();
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);

        List<Path> units;
        try (Stream<Path> entries = Files.list(dir)) {
            units = entries
                    .filter(p -> matcher.matches(p.getFileName()))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            log.error("Failed to list plugin directory: {}", dir, e);
            return 0;
        }

        log.info("Starting plugin discovery from {}, units: {}", dir, units.size());
        int loaded = 0;
        for (Path unit : units) {
            try {
                // 坏单元只打印报错，不影响其他单元
                loaded += loadUnit(unit);
            } catch (Exception e) {
                log.error("Failed to load plugin unit: {}", unit, e);
            }
        }
        log.info("Plugin discovery finished. Total loaded: {}", loaded);
        return loaded;
    }

    private int loadUnit(Path unit) {
        if (!Files.isDirectory(unit) && !unit.getFileName().toString().endsWith(JAR_SUFFIX)) {
            log.debug("Skipping non-plugin entry: {}", unit);
            return 0;
        }

        Optional<PluginManifest> manifest = PluginManifestLoader.parse(unit);
        ClassLoader loader = loaderFactory.create(unit, getClass().getClassLoader());

        int loaded = 0;
        try {
            List<String> classNames = manifest.filter(PluginManifest::declaresClasses)
                    .map(PluginManifest::getPluginClasses)
                    .orElseGet(() -> scanClassNames(unit));
            if (classNames.isEmpty()) {
                log.warn("No plugin classes found in unit: {}", unit.getFileName());
            }

            PluginManifest effective = manifest.orElseGet(PluginManifest::new);
            for (String className : classNames) {
                Optional<ArgoPlugin> plugin = instantiate(unit, loader, className);
                if (plugin.isPresent() && pluginManager.registerPlugin(plugin.get(), effective.copy(), unit)) {
                    loaded++;
                }
            }
        } finally {
            if (loaded > 0) {
                activeLoaders.add(loader);
            } else {
                closeLoader(loader);
            }
        }
        log.info("Loaded {} plugin(s) from {}", loaded, unit.getFileName());
        return loaded;
    }

    private Optional<ArgoPlugin> instantiate(Path unit, ClassLoader loader, String className) {
        try {
            Class<?> clazz = Class.forName(className, true, loader);
            if (!ArgoPlugin.class.isAssignableFrom(clazz)) {
                log.warn("Class {} in {} does not implement ArgoPlugin, skipped", className, unit.getFileName());
                return Optional.empty();
            }
            if (clazz.isInterface() || Modifier.isAbstract(clazz.getModifiers())) {
                log.debug("Skipping abstract plugin type: {}", className);
                return Optional.empty();
            }
            return Optional.of((ArgoPlugin) clazz.getDeclaredConstructor().newInstance());
        } catch (ReflectiveOperationException | LinkageError e) {
            log.error("Failed to instantiate plugin class {} from {}", className, unit.getFileName(), e);
            return Optional.empty();
        }
    }

    /**
     * 没有清单时，按类名后缀扫描顶层类
     */
    private List<String> scanClassNames(Path unit) {
        String suffix = config.getPluginClassSuffix() + CLASS_SUFFIX;
        try {
            if (Files.isDirectory(unit)) {
                try (Stream<Path> files = Files.walk(unit)) {
                    return files
                            .filter(Files::isRegularFile)
                            .map(p -> unit.relativize(p).toString().replace('\\', '/'))
                            .filter(entry -> isCandidate(entry, suffix))
                            .map(PluginDiscoveryService::toClassName)
                            .sorted()
                            .collect(Collectors.toList());
                }
            }
            try (JarFile jar = new JarFile(unit.toFile())) {
                return jar.stream()
                        .map(JarEntry::getName)
                        .filter(entry -> isCandidate(entry, suffix))
                        .map(PluginDiscoveryService::toClassName)
                        .sorted()
                        .collect(Collectors.toList());
            }
        } catch (IOException e) {
            log.error("Failed to scan plugin unit: {}", unit, e);
            return List.of();
        }
    }

    private static boolean isCandidate(String entry, String suffix) {
        String simpleName = entry.substring(entry.lastIndexOf('/') + 1);
        // 内部类与匿名类不作为入口
        return simpleName.endsWith(suffix) && simpleName.indexOf('$') < 0;
    }

    private static String toClassName(String entry) {
        return entry.substring(0, entry.length() - CLASS_SUFFIX.length()).replace('/', '.');
    }

    /**
     * 释放所有单元类加载器
     */
    @Override
    public void close() {
        for (ClassLoader loader : activeLoaders) {
            closeLoader(loader);
        }
        activeLoaders.clear();
    }

    private void closeLoader(ClassLoader loader) {
        if (loader instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close plugin class loader: {}", e.getMessage());
            }
        }
    }

    public int getActiveLoaderCount() {
        return activeLoaders.size();
    }
}
