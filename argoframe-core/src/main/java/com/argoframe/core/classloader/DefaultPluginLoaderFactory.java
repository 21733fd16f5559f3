package com.argoframe.core.classloader;

import com.argoframe.core.exception.PluginLoadException;
import com.argoframe.core.spi.PluginLoaderFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;

public class DefaultPluginLoaderFactory implements PluginLoaderFactory {
    @Override
    public ClassLoader create(Path unit, ClassLoader parent) {
        try {
            // 目录的 URI 以 / 结尾，URLClassLoader 会按目录处理
            return new PluginClassLoader(unit.getFileName().toString(),
                    new URL[]{unit.toUri().toURL()}, parent);
        } catch (MalformedURLException e) {
            throw new PluginLoadException(unit.toString(), "Failed to create classloader", e);
        }
    }
}
