package com.termindex.text;

import java.util.List;

public interface Tokenizer {

    /**
     * 将文档文本切分为归一化且文档内去重的词项列表，保持首次出现顺序。
     */
    List<String> tokenize(String text);

    /**
     * 返回去重前的原始词元，包含位置与原文偏移。
     */
    List<Token> tokens(String text);
}
