package com.termindex.config;

import java.nio.charset.Charset;

/**
 * 索引运行时配置
 * 
 * 支持从CLI参数注入，覆盖Constants默认值
 */
public class IndexConfig {
    private Charset documentCharset = Constants.DEFAULT_DOCUMENT_CHARSET;
    private int maxQueryLength = Constants.MAX_QUERY_LENGTH;
    private int maxQueryTerms = Constants.MAX_QUERY_TERMS;
    private int maxDocuments = Constants.MAX_DOCUMENTS;

    public Charset getDocumentCharset() {
        return documentCharset;
    }

    public void setDocumentCharset(Charset documentCharset) {
        this.documentCharset = documentCharset;
    }

    public int getMaxQueryLength() {
        return maxQueryLength;
    }

    public void setMaxQueryLength(int maxQueryLength) {
        this.maxQueryLength = maxQueryLength;
    }

    public int getMaxQueryTerms() {
        return maxQueryTerms;
    }

    public void setMaxQueryTerms(int maxQueryTerms) {
        this.maxQueryTerms = maxQueryTerms;
    }

    public int getMaxDocuments() {
        return maxDocuments;
    }

    public void setMaxDocuments(int maxDocuments) {
        this.maxDocuments = maxDocuments;
    }

    /**
     * 使用默认配置创建实例
     */
    public static IndexConfig defaults() {
        return new IndexConfig();
    }
}
