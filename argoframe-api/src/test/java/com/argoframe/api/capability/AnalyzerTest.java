package com.argoframe.api.capability;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Analyzer 契约测试")
class AnalyzerTest {

    private final Analyzer analyzer = new Analyzer() {
        @Override
        public String getName() {
            return "excel";
        }

        @Override
        public Set<String> getSupportedFormats() {
            return Set.of(".xlsx", ".XLS");
        }

        @Override
        public AnalysisResult analyze(Path path, Map<String, Object> options) {
            return AnalysisResult.success(Map.of("sheets", 1));
        }
    };

    @Nested
    @DisplayName("扩展名匹配")
    class CanHandleTests {

        @Test
        @DisplayName("扩展名不区分大小写")
        void canHandleShouldIgnoreCase() {
            assertTrue(analyzer.canHandle(Path.of("a.XLSX")));
            assertTrue(analyzer.canHandle(Path.of("dir/b.xls")));
            assertFalse(analyzer.canHandle(Path.of("c.csv")));
            assertFalse(analyzer.canHandle(Path.of("noext")));
        }

        @Test
        @DisplayName("extensionOf 返回带点的小写扩展名")
        void extensionOfShouldNormalize() {
            assertEquals(".pdf", FileCapability.extensionOf(Path.of("Report.PDF")));
            assertEquals("", FileCapability.extensionOf(Path.of(".hidden")));
            assertEquals("", FileCapability.extensionOf(Path.of("trailing.")));
            assertEquals("", FileCapability.extensionOf(null));
        }
    }

    @Nested
    @DisplayName("分析前校验")
    class ValidateTests {

        @TempDir
        Path dir;

        @Test
        @DisplayName("文件不存在、不是文件、格式不支持时给出原因")
        void validateShouldReportProblems() throws IOException {
            Path csv = Files.writeString(dir.resolve("data.csv"), "a,b");
            Path xlsx = Files.writeString(dir.resolve("data.xlsx"), "stub");

            assertTrue(analyzer.validate(dir.resolve("missing.xlsx")).orElseThrow().startsWith("File not found"));
            assertTrue(analyzer.validate(dir).orElseThrow().startsWith("Not a file"));
            assertEquals(Optional.of("Unsupported format: .csv"), analyzer.validate(csv));
            assertEquals(Optional.empty(), analyzer.validate(xlsx));
        }

        @Test
        @DisplayName("默认版本与描述")
        void defaultsShouldBeProvided() {
            assertEquals("1.0.0", analyzer.getVersion());
            assertEquals("excel analyzer", analyzer.getDescription());
        }
    }

    @Test
    @DisplayName("AnalysisResult 工厂方法")
    void analysisResultFactories() {
        AnalysisResult ok = AnalysisResult.success(Map.of("k", "v"));
        assertTrue(ok.isSuccess());
        assertFalse(ok.hasErrors());
        assertEquals("v", ok.getData().get("k"));

        AnalysisResult failed = AnalysisResult.error("bad header", "empty sheet");
        assertFalse(failed.isSuccess());
        assertEquals(List.of("bad header", "empty sheet"), failed.getErrors());

        AnalysisResult partial = AnalysisResult.builder()
                .status(AnalysisResult.Status.PARTIAL)
                .warning("truncated")
                .executionTimeMs(12.5)
                .build();
        assertEquals(List.of("truncated"), partial.getWarnings());
        assertTrue(partial.getData().isEmpty());
    }

    @Test
    @DisplayName("能力种类对应的接口")
    void capabilityKindsShouldMapToInterfaces() {
        assertTrue(CapabilityKind.ANALYZER.isFileBased());
        assertTrue(CapabilityKind.EXTRACTOR.isFileBased());
        assertFalse(CapabilityKind.EVALUATOR.isFileBased());
        assertFalse(CapabilityKind.INTELLIGENCE_ENHANCER.isFileBased());
        assertEquals(Evaluator.class, CapabilityKind.EVALUATOR.type());
    }
}
