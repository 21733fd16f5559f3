package com.argoframe.core.fixture;

import com.argoframe.api.capability.AnalysisResult;
import com.argoframe.api.capability.Analyzer;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

public class PdfAnalyzer implements Analyzer {

    @Override
    public String getName() {
        return "pdf";
    }

    @Override
    public Set<String> getSupportedFormats() {
        return Set.of(".pdf");
    }

    @Override
    public AnalysisResult analyze(Path path, Map<String, Object> options) {
        return AnalysisResult.success(Map.of("file", path.getFileName().toString()));
    }
}
