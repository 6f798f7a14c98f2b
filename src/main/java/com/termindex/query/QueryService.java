package com.termindex.query;

import com.termindex.index.InvertedIndex;
import com.termindex.index.PostingEntry;
import com.termindex.text.TermNormalizer;

import java.util.ArrayList;
import java.util.List;

/**
 * 精确词项查询：与建索引时相同的小写归一化，不做排序、模糊或前缀匹配。
 */
public class QueryService {

    public QueryResult find(InvertedIndex index, String searchTerm) {
        if (index == null) {
            throw new IllegalArgumentException("index不能为null");
        }
        String displayTerm = searchTerm == null ? "" : searchTerm;
        String term = TermNormalizer.normalize(searchTerm).strip();
        if (term.isEmpty() || !index.contains(term)) {
            return new QueryResult.NotFound(displayTerm);
        }

        PostingEntry entry = index.posting(term);
        return new QueryResult.Found(displayTerm, term, entry.documentIds());
    }

    /**
     * 依次查询多个词项，结果顺序与输入一致。
     */
    public List<QueryResult> findAll(InvertedIndex index, List<String> searchTerms) {
        if (searchTerms == null || searchTerms.isEmpty()) {
            return List.of();
        }
        List<QueryResult> results = new ArrayList<>(searchTerms.size());
        for (String searchTerm : searchTerms) {
            results.add(find(index, searchTerm));
        }
        return List.copyOf(results);
    }
}
