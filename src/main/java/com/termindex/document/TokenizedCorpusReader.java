package com.termindex.document;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.termindex.config.IndexConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 读取已分词语料，格式为 JSON 对象：{"文档ID": ["词项", ...], ...}。
 */
public class TokenizedCorpusReader {
    private static final Logger logger = LoggerFactory.getLogger(TokenizedCorpusReader.class);
    private static final TypeReference<LinkedHashMap<Integer, List<String>>> CORPUS_TYPE = new TypeReference<>() {
    };

    private final IndexConfig config;
    private final ObjectMapper mapper;

    public TokenizedCorpusReader(IndexConfig config) {
        this(config, new ObjectMapper());
    }

    public TokenizedCorpusReader(IndexConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
    }

    public Map<Integer, List<String>> read(Path path) {
        Map<Integer, List<String>> documents;
        try (Reader reader = Files.newBufferedReader(path, config.getDocumentCharset())) {
            documents = mapper.readValue(reader, CORPUS_TYPE);
        } catch (IOException ioException) {
            throw new CorpusReadException("读取已分词语料失败", path, ioException);
        }
        if (documents == null) {
            return Map.of();
        }
        if (documents.size() > config.getMaxDocuments()) {
            throw new IllegalArgumentException("文档数 " + documents.size() + " 超过上限 " + config.getMaxDocuments());
        }
        logger.debug("已读取已分词语料: {} 个文档, 来源={}", documents.size(), path);
        return documents;
    }
}
