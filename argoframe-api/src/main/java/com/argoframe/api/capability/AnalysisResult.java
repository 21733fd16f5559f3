package com.argoframe.api.capability;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;
import java.util.Map;

/**
 * 分析器、评估器的统一返回结构
 */
@Getter
@Builder
public class AnalysisResult {

    public enum Status {
        SUCCESS, ERROR, PARTIAL
    }

    private final Status status;

    @Builder.Default
    private final Map<String, Object> data = Map.of();

    @Builder.Default
    private final Map<String, Object> metadata = Map.of();

    @Singular
    private final List<String> errors;

    @Singular
    private final List<String> warnings;

    private final double executionTimeMs;

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public static AnalysisResult success(Map<String, Object> data) {
        return AnalysisResult.builder().status(Status.SUCCESS).data(data).build();
    }

    public static AnalysisResult error(String... errors) {
        return AnalysisResult.builder().status(Status.ERROR).errors(List.of(errors)).build();
    }
}
