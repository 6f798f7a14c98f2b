package com.termindex.document;

import com.termindex.config.IndexConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 将一组文本文件读取为原文列表，列表下标即顺序文档ID。
 */
public class TextCorpusReader {
    private static final Logger logger = LoggerFactory.getLogger(TextCorpusReader.class);

    private final IndexConfig config;

    public TextCorpusReader(IndexConfig config) {
        this.config = config;
    }

    public List<String> read(List<Path> paths) {
        if (paths == null || paths.isEmpty()) {
            return List.of();
        }
        if (paths.size() > config.getMaxDocuments()) {
            throw new IllegalArgumentException("文档数 " + paths.size() + " 超过上限 " + config.getMaxDocuments());
        }

        List<String> documents = new ArrayList<>(paths.size());
        for (Path path : paths) {
            try {
                documents.add(Files.readString(path, config.getDocumentCharset()));
            } catch (IOException ioException) {
                throw new CorpusReadException("读取文档失败", path, ioException);
            }
            logger.debug("已读取文档 #{}: {}", documents.size() - 1, path);
        }
        return List.copyOf(documents);
    }
}
