package com.termindex.text;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * 词项归一化工具：小写化与文档内去重。
 */
public final class TermNormalizer {

    private TermNormalizer() {
    }

    /**
     * 将单个词项转换为小写，固定使用 Locale.ROOT。
     */
    public static String normalize(String term) {
        if (term == null) {
            return "";
        }
        return term.toLowerCase(Locale.ROOT);
    }

    /**
     * 逐个归一化，保留原顺序与重复项。
     */
    public static List<String> normalizeAll(List<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return List.of();
        }
        List<String> normalized = new ArrayList<>(terms.size());
        for (String term : terms) {
            normalized.add(normalize(term));
        }
        return List.copyOf(normalized);
    }

    /**
     * 去除重复词项，只保留首次出现。
     */
    public static List<String> removeDuplicates(List<String> terms) {
        if (terms == null || terms.isEmpty()) {
            return List.of();
        }
        return List.copyOf(new LinkedHashSet<>(terms));
    }
}
