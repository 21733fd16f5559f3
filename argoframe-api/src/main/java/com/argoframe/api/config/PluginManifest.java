package com.argoframe.api.config;

import lombok.Getter;
import lombok.Setter;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 对应插件单元中 plugin.yml 的根节点
 * <p>
 * 清单可选：缺省时按类名后缀扫描插件类。
 * </p>
 */
@Getter
@Setter
public class PluginManifest implements Serializable {

    // === 单元描述 ===
    private String id;
    private String description;

    // 插件入口类全限定名，可声明多个
    private List<String> pluginClasses = new ArrayList<>();

    // === 扩展配置 (KV 键值对，通过 PluginContext#getProperty 读取) ===
    private Map<String, Object> properties = new HashMap<>();

    /**
     * 深拷贝
     */
    public PluginManifest copy() {
        PluginManifest copy = new PluginManifest();
        copy.id = this.id;
        copy.description = this.description;
        if (this.pluginClasses != null) {
            copy.pluginClasses = new ArrayList<>(this.pluginClasses);
        }
        if (this.properties != null) {
            copy.properties = new HashMap<>(this.properties);
        }
        return copy;
    }

    public boolean declaresClasses() {
        return pluginClasses != null && !pluginClasses.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("PluginManifest{id='%s', pluginClasses=%s}", id, pluginClasses);
    }
}
