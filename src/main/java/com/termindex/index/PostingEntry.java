package com.termindex.index;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * 单个词项的倒排记录，文档频率即包含该词项的不同文档数。
 *
 * @param term 归一化后的词项
 * @param documentIds 按首次加入顺序排列的文档ID，无重复
 */
public record PostingEntry(String term, int[] documentIds) {
    /**
     * 构造时执行校验并复制输入数据，避免外部修改。
     */
    public PostingEntry {
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("term不能为空");
        }
        if (documentIds == null) {
            throw new IllegalArgumentException("documentIds不能为null, term=" + term);
        }
        Set<Integer> seen = new HashSet<>(documentIds.length * 2);
        for (int index = 0; index < documentIds.length; index++) {
            if (!seen.add(documentIds[index])) {
                throw new IllegalArgumentException("documentIds存在重复，term=" + term + ", 位置=" + index + ", value=" + documentIds[index]);
            }
        }
        documentIds = Arrays.copyOf(documentIds, documentIds.length);
    }

    /**
     * 返回包含该词项的文档数。
     *
     * @return 文档频率
     */
    public int documentFrequency() {
        return documentIds.length;
    }

    /**
     * 获取指定位置的文档ID。
     *
     * @param index 倒排项下标
     * @return 文档ID
     */
    public int documentId(int index) {
        return documentIds[index];
    }

    /**
     * 判断该词项是否出现在指定文档中。
     */
    public boolean containsDocument(int documentId) {
        for (int candidate : documentIds) {
            if (candidate == documentId) {
                return true;
            }
        }
        return false;
    }

    @Override
    public int[] documentIds() {
        return Arrays.copyOf(documentIds, documentIds.length);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingEntry that)) {
            return false;
        }
        return term.equals(that.term) && Arrays.equals(documentIds, that.documentIds);
    }

    @Override
    public int hashCode() {
        return 31 * term.hashCode() + Arrays.hashCode(documentIds);
    }

    @Override
    public String toString() {
        return "PostingEntry[term=" + term + ", documentFrequency=" + documentIds.length
            + ", documentIds=" + Arrays.toString(documentIds) + "]";
    }
}
