package com.argoframe.core.classloader;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.util.*;

/**
 * 插件类加载器
 * 特性：
 * 1. Child-First (优先加载插件单元内部类)
 * 2. 强制委派白名单 (API 契约必须走父加载器，否则插件实例无法转型为 ArgoPlugin)
 * 3. 资源加载 Child-First (优先读取单元内的 plugin.yml)
 */
@Slf4j
public class PluginClassLoader extends URLClassLoader {

    // 必须强制走父加载器的包（契约包 + JDK）
    private static final List<String> FORCE_PARENT_PACKAGES = Arrays.asList(
            "java.", "javax.", "jdk.", "sun.", "com.sun.", "org.w3c.", "org.xml.",
            "com.argoframe.api.", // API 契约必须共享
            "org.slf4j.",         // 日志门面共享
            "ch.qos.logback.",    // Logback
            "org.yaml.snakeyaml." // SnakeYAML
    );

    @Getter
    private final String unitName;

    private volatile boolean closed = false;

    public PluginClassLoader(String unitName, URL[] urls, ClassLoader parent) {
        super(urls, parent);
        this.unitName = unitName;
    }

    @Override
    public Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        synchronized (getClassLoadingLock(name)) {
            // 1. 白名单强制委派给父加载器 (防止 ClassCastException)，关闭后依然可用
            if (shouldDelegateToParent(name)) {
                Class<?> c = getParent().loadClass(name);
                if (resolve) resolveClass(c);
                return c;
            }

            if (closed) {
                throw new ClassNotFoundException("ClassLoader of unit [" + unitName + "] is closed: " + name);
            }

            // 2. 检查缓存
            Class<?> c = findLoadedClass(name);
            if (c != null) return c;

            // 3. Child-First: 优先自己加载
            try {
                c = findClass(name);
            } catch (ClassNotFoundException e) {
                // 4. 兜底: 自己没有，再找父亲
                c = super.loadClass(name, false);
            }

            if (resolve) resolveClass(c);
            return c;
        }
    }

    @Override
    public URL getResource(String name) {
        if (closed) return null;
        // 资源加载也必须 Child-First，否则会读到宿主的同名配置
        URL url = findResource(name);
        if (url != null) return url;
        return super.getResource(name);
    }

    @Override
    public Enumeration<URL> getResources(String name) throws IOException {
        // 组合资源：自己的 + 父加载器的
        Enumeration<URL> localUrls = findResources(name);
        Enumeration<URL> parentUrls = null;
        if (getParent() != null) {
            parentUrls = getParent().getResources(name);
        }

        List<URL> urls = new ArrayList<>();
        while (localUrls.hasMoreElements()) urls.add(localUrls.nextElement());
        if (parentUrls != null) {
            while (parentUrls.hasMoreElements()) urls.add(parentUrls.nextElement());
        }
        return Collections.enumeration(urls);
    }

    @Override
    public void close() throws IOException {
        closed = true;
        super.close();
        log.debug("ClassLoader of unit [{}] closed", unitName);
    }

    public boolean isClosed() {
        return closed;
    }

    private boolean shouldDelegateToParent(String name) {
        for (String pkg : FORCE_PARENT_PACKAGES) {
            if (name.startsWith(pkg)) return true;
        }
        return false;
    }
}
