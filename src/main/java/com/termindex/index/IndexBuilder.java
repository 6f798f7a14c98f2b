package com.termindex.index;

import com.termindex.text.Tokenizer;
import com.termindex.text.WhitespaceTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 倒排索引构建器，支持两种构建方式：
 * 按原文顺序分配文档ID，或使用调用方提供的文档ID与已分词词项。
 */
public class IndexBuilder {
    private static final Logger logger = LoggerFactory.getLogger(IndexBuilder.class);

    private final Tokenizer tokenizer;

    /**
     * 使用默认空白分词器。
     */
    public IndexBuilder() {
        this(new WhitespaceTokenizer());
    }

    public IndexBuilder(Tokenizer tokenizer) {
        if (tokenizer == null) {
            throw new IllegalArgumentException("tokenizer不能为null");
        }
        this.tokenizer = tokenizer;
    }

    /**
     * 对原文逐个分词建立索引，文档ID为其在列表中的下标（从0开始）。
     * 分词结果统一再做小写归一化，空白词项跳过。
     */
    public InvertedIndex fromTexts(List<String> documents) {
        if (documents == null) {
            throw new IllegalArgumentException("documents不能为null");
        }

        PostingAccumulator accumulator = new PostingAccumulator();
        int skippedTerms = 0;
        for (int documentId = 0; documentId < documents.size(); documentId++) {
            skippedTerms += accumulator.addDocument(documentId, tokenizer.tokenize(documents.get(documentId)));
        }

        logSkipped(skippedTerms, 0);
        InvertedIndex index = accumulator.build();
        logger.debug("按顺序ID建立索引完成: 输入文档={}, 词项={}", documents.size(), index.termCount());
        return index;
    }

    /**
     * 使用调用方提供的文档ID建立索引，词项不再分词，只做小写归一化。
     * 文档按ID升序处理，使词项的首次出现顺序可复现；
     * 同一文档内的重复词项由累加器吸收。
     */
    public InvertedIndex fromTokenizedDocuments(Map<Integer, List<String>> documents) {
        if (documents == null) {
            throw new IllegalArgumentException("documents不能为null");
        }

        for (Integer documentId : documents.keySet()) {
            if (documentId == null) {
                throw new IllegalArgumentException("文档ID不能为null");
            }
        }

        PostingAccumulator accumulator = new PostingAccumulator();
        int skippedTerms = 0;
        int skippedDocuments = 0;
        for (Map.Entry<Integer, List<String>> document : new TreeMap<>(documents).entrySet()) {
            List<String> terms = document.getValue();
            if (terms == null) {
                skippedDocuments++;
                continue;
            }
            skippedTerms += accumulator.addDocument(document.getKey(), terms);
        }

        logSkipped(skippedTerms, skippedDocuments);
        InvertedIndex index = accumulator.build();
        logger.debug("按指定ID建立索引完成: 输入文档={}, 词项={}", documents.size(), index.termCount());
        return index;
    }

    private void logSkipped(int skippedTerms, int skippedDocuments) {
        if (skippedTerms > 0) {
            logger.warn("跳过空白词项 {} 个", skippedTerms);
        }
        if (skippedDocuments > 0) {
            logger.warn("跳过词项列表为null的文档 {} 个", skippedDocuments);
        }
    }
}
