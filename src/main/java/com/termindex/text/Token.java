package com.termindex.text;

/**
 * 分词得到的单个词元。
 *
 * @param term 归一化后的词项
 * @param surface 原文中的片段
 * @param position 在文档中的序号（去重前）
 * @param startOffset 起始字符偏移（含）
 * @param endOffset 结束字符偏移（不含）
 */
public record Token(
    String term,
    String surface,
    int position,
    int startOffset,
    int endOffset
) {
}
