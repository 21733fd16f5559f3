package com.argoframe.api.capability;

import java.io.IOException;
import java.nio.file.Path;

/**
 * 文本抽取器
 */
public interface Extractor extends FileCapability {

    String extract(Path path) throws IOException;
}
