package com.termindex.index;

import com.termindex.config.Constants;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 不可变倒排索引。
 *
 * <p>词项到倒排记录的映射按首次出现顺序保存，既用于 O(1) 查找，也用于稳定枚举。
 * 实例只能由 {@link PostingAccumulator#build()} 发布，发布后不再变化，可被多个读线程共享。
 * 这里的词项均按原样查找，调用方负责归一化。
 */
public final class InvertedIndex {
    private static final InvertedIndex EMPTY = new InvertedIndex(new LinkedHashMap<>(), 0);

    private final Map<String, PostingEntry> entries;
    private final Map<String, Integer> positions;
    private final List<PostingEntry> orderedEntries;
    private final int documentCount;

    InvertedIndex(LinkedHashMap<String, PostingEntry> entries, int documentCount) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        this.orderedEntries = List.copyOf(entries.values());
        Map<String, Integer> termPositions = new HashMap<>(entries.size() * 2);
        int position = 0;
        for (String term : entries.keySet()) {
            termPositions.put(term, position++);
        }
        this.positions = Collections.unmodifiableMap(termPositions);
        this.documentCount = documentCount;
    }

    /**
     * 返回不含任何词项的索引。
     */
    public static InvertedIndex empty() {
        return EMPTY;
    }

    public boolean contains(String term) {
        return term != null && entries.containsKey(term);
    }

    /**
     * 查找词项的倒排记录，不存在时返回空。
     */
    public Optional<PostingEntry> lookup(String term) {
        if (term == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(term));
    }

    /**
     * 获取已确认存在的词项的倒排记录。
     *
     * @throws IllegalStateException 词项不在索引中，说明调用方跳过了存在性检查
     */
    public PostingEntry posting(String term) {
        PostingEntry entry = term == null ? null : entries.get(term);
        if (entry == null) {
            throw new IllegalStateException("词项不在索引中: " + term);
        }
        return entry;
    }

    /**
     * 返回词项在首次出现顺序中的下标，不存在时返回 {@link Constants#NOT_FOUND}。
     */
    public int positionOf(String term) {
        if (term == null) {
            return Constants.NOT_FOUND;
        }
        return positions.getOrDefault(term, Constants.NOT_FOUND);
    }

    /**
     * 按首次出现顺序枚举全部倒排记录。
     */
    public List<PostingEntry> postings() {
        return orderedEntries;
    }

    public Set<String> terms() {
        return entries.keySet();
    }

    public int termCount() {
        return entries.size();
    }

    /**
     * 至少贡献过一个词项的不同文档数量。
     */
    public int documentCount() {
        return documentCount;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public String toString() {
        return "InvertedIndex[terms=" + entries.size() + ", documents=" + documentCount + "]";
    }
}
