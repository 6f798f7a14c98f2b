package com.termindex.text;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 按空白切分的分词器，不剥离标点，不做词干还原。
 */
public class WhitespaceTokenizer implements Tokenizer {

    private static final Pattern TOKEN_PATTERN = Pattern.compile("\\S+");

    /**
     * 切分、小写化并在文档内去重。
     */
    @Override
    public List<String> tokenize(String text) {
        List<Token> tokens = tokens(text);
        if (tokens.isEmpty()) {
            return List.of();
        }

        List<String> terms = new ArrayList<>(tokens.size());
        for (Token token : tokens) {
            terms.add(token.term());
        }
        return TermNormalizer.removeDuplicates(terms);
    }

    /**
     * 输出每个非空白片段及其原文偏移，未去重。
     */
    @Override
    public List<Token> tokens(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }

        // TODO: 去除词首尾标点，使 "sales," 与 "sales" 归为同一词项
        List<Token> tokens = new ArrayList<>();
        Matcher matcher = TOKEN_PATTERN.matcher(text);
        int position = 0;
        while (matcher.find()) {
            String surface = matcher.group();
            tokens.add(new Token(TermNormalizer.normalize(surface), surface, position, matcher.start(), matcher.end()));
            position++;
        }
        return List.copyOf(tokens);
    }
}
