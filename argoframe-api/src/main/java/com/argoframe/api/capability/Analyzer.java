package com.argoframe.api.capability;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * 文档分析器
 * 例如 Excel 分析、进度计划分析、图片 OCR
 *
 * @author ArgoFrame
 */
public interface Analyzer extends FileCapability {

    default String getVersion() {
        return "1.0.0";
    }

    default String getDescription() {
        return getName() + " analyzer";
    }

    /**
     * 分析前校验
     *
     * @return 校验失败原因，通过时为空
     */
    default Optional<String> validate(Path path) {
        if (!Files.exists(path)) {
            return Optional.of("File not found: " + path);
        }
        if (!Files.isRegularFile(path)) {
            return Optional.of("Not a file: " + path);
        }
        if (!canHandle(path)) {
            return Optional.of("Unsupported format: " + FileCapability.extensionOf(path));
        }
        return Optional.empty();
    }

    /**
     * 执行分析
     *
     * @param path    待分析文件
     * @param options 可选参数，可为 null
     */
    AnalysisResult analyze(Path path, Map<String, Object> options);
}
