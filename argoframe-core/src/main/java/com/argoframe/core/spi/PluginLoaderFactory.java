package com.argoframe.core.spi;

import java.nio.file.Path;

/**
 * 插件单元类加载器工厂
 * 默认实现为 Child-First 的 {@link com.argoframe.core.classloader.PluginClassLoader}
 */
public interface PluginLoaderFactory {

    /**
     * @param unit   插件单元 (Jar 包或类目录)
     * @param parent 父加载器，通常是宿主的加载器
     */
    ClassLoader create(Path unit, ClassLoader parent);
}
