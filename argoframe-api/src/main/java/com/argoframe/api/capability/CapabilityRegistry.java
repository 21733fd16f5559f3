package com.argoframe.api.capability;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 能力注册表
 * <p>
 * 同一种类内名称重复时保留先注册者并记录警告；
 * 分析器例外，允许后注册者覆盖（热替换）。
 * </p>
 *
 * @author ArgoFrame
 */
public interface CapabilityRegistry {

    /**
     * 注册能力
     *
     * @return 是否生效，重名被拒绝时返回 false
     */
    boolean register(CapabilityKind kind, Capability capability);

    /**
     * 第一个（按注册顺序）支持该文件扩展名的能力
     */
    Optional<Capability> lookupForFile(CapabilityKind kind, Path path);

    Optional<Capability> lookupByName(CapabilityKind kind, String name);

    /**
     * 按注册顺序列出
     */
    List<Capability> list(CapabilityKind kind);

    /**
     * 第一个能力标签匹配的智能增强器
     */
    Optional<IntelligenceEnhancer> findEnhancer(String capability);

    void clear();

    // ===== 类型化快捷方法 =====

    default boolean registerAnalyzer(Analyzer analyzer) {
        return register(CapabilityKind.ANALYZER, analyzer);
    }

    default boolean registerExtractor(Extractor extractor) {
        return register(CapabilityKind.EXTRACTOR, extractor);
    }

    default boolean registerEvaluator(Evaluator evaluator) {
        return register(CapabilityKind.EVALUATOR, evaluator);
    }

    default boolean registerEnhancer(IntelligenceEnhancer enhancer) {
        return register(CapabilityKind.INTELLIGENCE_ENHANCER, enhancer);
    }

    default Optional<Analyzer> findAnalyzer(Path path) {
        return lookupForFile(CapabilityKind.ANALYZER, path).map(Analyzer.class::cast);
    }

    default Optional<Extractor> findExtractor(Path path) {
        return lookupForFile(CapabilityKind.EXTRACTOR, path).map(Extractor.class::cast);
    }

    default Optional<Evaluator> findEvaluator(String name) {
        return lookupByName(CapabilityKind.EVALUATOR, name).map(Evaluator.class::cast);
    }

    default List<Analyzer> listAnalyzers() {
        return list(CapabilityKind.ANALYZER).stream().map(Analyzer.class::cast).toList();
    }
}
