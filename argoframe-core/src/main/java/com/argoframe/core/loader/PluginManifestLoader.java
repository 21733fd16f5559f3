package com.argoframe.core.loader;

import com.argoframe.api.config.PluginManifest;
import com.argoframe.core.exception.PluginLoadException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.jar.JarFile;
import java.util.zip.ZipEntry;

/**
 * plugin.yml 解析
 */
public class PluginManifestLoader {

    public static final String MANIFEST_NAME = "plugin.yml";

    public static PluginManifest load(InputStream inputStream) {
        // 1. 配置加载选项
        // 注意：SnakeYAML 2.x 建议显式传入 LoaderOptions；默认拒绝全局标签，清单里不允许实例化任意类
        LoaderOptions options = new LoaderOptions();

        // 2. 创建构造器，指定根对象类型为 PluginManifest；未知字段忽略，方便清单向前兼容
        Constructor constructor = new Constructor(PluginManifest.class, options);
        constructor.getPropertyUtils().setSkipMissingProperties(true);

        // 3. 实例化 Yaml 对象并加载
        Yaml yaml = new Yaml(constructor);
        PluginManifest manifest = yaml.load(inputStream);
        return manifest != null ? manifest : new PluginManifest();
    }

    /**
     * 读取插件单元内的清单
     *
     * @param unit Jar 包或类目录
     * @return 单元内没有 plugin.yml 时为空
     */
    public static Optional<PluginManifest> parse(Path unit) {
        try {
            if (Files.isDirectory(unit)) {
                Path file = unit.resolve(MANIFEST_NAME);
                if (!Files.isRegularFile(file)) {
                    return Optional.empty();
                }
                try (InputStream in = Files.newInputStream(file)) {
                    return Optional.of(load(in));
                }
            }
            try (JarFile jar = new JarFile(unit.toFile())) {
                ZipEntry entry = jar.getEntry(MANIFEST_NAME);
                if (entry == null) {
                    return Optional.empty();
                }
                try (InputStream in = jar.getInputStream(entry)) {
                    return Optional.of(load(in));
                }
            }
        } catch (IOException | YAMLException e) {
            throw new PluginLoadException(unit.toString(), "Invalid " + MANIFEST_NAME + ": " + e.getMessage(), e);
        }
    }

}
