package com.termindex.index;

import com.termindex.text.TermNormalizer;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 构建期可变的倒排累加器，调用 {@link #build()} 后发布不可变索引。
 *
 * <p>同一 (词项, 文档) 重复加入时直接忽略，保证每个文档对每个词项最多贡献一条倒排。
 * 非线程安全。
 */
public final class PostingAccumulator {
    private final Map<String, LinkedHashSet<Integer>> postings = new LinkedHashMap<>();
    private final Set<Integer> documentIds = new HashSet<>();
    private boolean built;

    /**
     * 为词项追加一个文档。
     *
     * @param term 已归一化的词项
     * @param documentId 文档ID
     * @return 是否新增了倒排项，重复的 (词项, 文档) 返回 false
     */
    public boolean addPosting(String term, int documentId) {
        ensureNotBuilt();
        if (term == null || term.isBlank()) {
            throw new IllegalArgumentException("term不能为空, documentId=" + documentId);
        }
        documentIds.add(documentId);
        return postings.computeIfAbsent(term, key -> new LinkedHashSet<>()).add(documentId);
    }

    /**
     * 将一个文档的全部词项小写归一化后加入索引，空白词项跳过。
     *
     * @return 跳过的空白词项数量
     */
    public int addDocument(int documentId, Iterable<String> terms) {
        int skippedTerms = 0;
        for (String rawTerm : terms) {
            String term = TermNormalizer.normalize(rawTerm);
            if (term.isBlank()) {
                skippedTerms++;
                continue;
            }
            addPosting(term, documentId);
        }
        return skippedTerms;
    }

    public boolean containsTerm(String term) {
        return postings.containsKey(term);
    }

    public int termCount() {
        return postings.size();
    }

    /**
     * 发布不可变索引，此后累加器不可再修改。
     */
    public InvertedIndex build() {
        ensureNotBuilt();
        built = true;

        LinkedHashMap<String, PostingEntry> entries = new LinkedHashMap<>(postings.size() * 2);
        for (Map.Entry<String, LinkedHashSet<Integer>> posting : postings.entrySet()) {
            int[] ids = posting.getValue().stream().mapToInt(Integer::intValue).toArray();
            entries.put(posting.getKey(), new PostingEntry(posting.getKey(), ids));
        }
        return new InvertedIndex(entries, documentIds.size());
    }

    private void ensureNotBuilt() {
        if (built) {
            throw new IllegalStateException("索引已发布，累加器不可再修改");
        }
    }
}
