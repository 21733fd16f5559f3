package com.argoframe.api.capability;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * 按文件格式分派的能力（分析器、抽取器）
 */
public interface FileCapability extends Capability {

    /**
     * 支持的扩展名，带点，例如 {@code .csv}
     */
    Set<String> getSupportedFormats();

    /**
     * 扩展名不区分大小写
     */
    default boolean canHandle(Path path) {
        String extension = extensionOf(path);
        if (extension.isEmpty()) {
            return false;
        }
        for (String format : getSupportedFormats()) {
            if (format != null && format.toLowerCase(Locale.ROOT).equals(extension)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 小写扩展名（带点），没有扩展名时返回空串
     */
    static String extensionOf(Path path) {
        if (path == null || path.getFileName() == null) {
            return "";
        }
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
