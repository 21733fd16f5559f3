package com.argoframe.api.capability;

import java.util.List;
import java.util.Map;

/**
 * 评估器，按一组指标评估数据（例如 DCMA、GAO 检查项）
 */
public interface Evaluator extends Capability {

    List<String> getMetrics();

    AnalysisResult evaluate(Map<String, Object> data);
}
