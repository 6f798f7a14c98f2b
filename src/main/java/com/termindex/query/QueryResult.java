package com.termindex.query;

import java.util.Arrays;

/**
 * 单词查询结果：命中或未命中。未命中是正常结果，不是异常。
 */
public sealed interface QueryResult permits QueryResult.Found, QueryResult.NotFound {

    /**
     * 调用方输入的原始查询词。
     */
    String searchTerm();

    boolean found();

    /**
     * 命中的文档ID，未命中时为空数组。
     */
    int[] documentIds();

    /**
     * 生成一行可读的结果描述。
     */
    String describe();

    record Found(String searchTerm, String term, int[] documentIds) implements QueryResult {
        public Found {
            documentIds = Arrays.copyOf(documentIds, documentIds.length);
        }

        @Override
        public boolean found() {
            return true;
        }

        @Override
        public int[] documentIds() {
            return Arrays.copyOf(documentIds, documentIds.length);
        }

        public int documentFrequency() {
            return documentIds.length;
        }

        @Override
        public String describe() {
            return "Found: " + searchTerm + " in documents: " + Arrays.toString(documentIds);
        }

        @Override
        public boolean equals(Object other) {
            if (this == other) {
                return true;
            }
            if (!(other instanceof Found that)) {
                return false;
            }
            return searchTerm.equals(that.searchTerm)
                && term.equals(that.term)
                && Arrays.equals(documentIds, that.documentIds);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * searchTerm.hashCode() + term.hashCode()) + Arrays.hashCode(documentIds);
        }

        @Override
        public String toString() {
            return describe();
        }
    }

    record NotFound(String searchTerm) implements QueryResult {
        @Override
        public boolean found() {
            return false;
        }

        @Override
        public int[] documentIds() {
            return new int[0];
        }

        @Override
        public String describe() {
            return "Not Found: " + searchTerm;
        }
    }
}
