package com.termindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.termindex.config.IndexConfig;
import com.termindex.document.TextCorpusReader;
import com.termindex.document.TokenizedCorpusReader;
import com.termindex.index.IndexBuilder;
import com.termindex.index.InvertedIndex;
import com.termindex.index.PostingEntry;
import com.termindex.query.QueryResult;
import com.termindex.query.QueryService;
import com.termindex.text.Token;
import com.termindex.text.WhitespaceTokenizer;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "termindex",
    description = "🔍 内存倒排索引构建与精确词项查询",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.SearchSubcommand.class,
        MainCommand.PostingsSubcommand.class,
        MainCommand.TokensSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {

    @Option(names = {"--charset"}, description = "文档文件编码", defaultValue = "UTF-8")
    private Charset charset;

    @Option(names = {"--max-documents"}, description = "单次读取的最大文档数", defaultValue = "100000")
    private int maxDocuments;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("🔍 内存倒排索引构建与精确词项查询");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    IndexConfig buildConfig() {
        IndexConfig config = IndexConfig.defaults();
        if (charset != null) {
            config.setDocumentCharset(charset);
        }
        if (maxDocuments > 0) {
            config.setMaxDocuments(maxDocuments);
        } else {
            System.err.printf("⚠️ 非法文档上限 %d，已回退为默认值 %d%n", maxDocuments, config.getMaxDocuments());
        }
        return config;
    }

    List<String> sanitizeQueryTerms(List<String> rawTerms, IndexConfig config) {
        if (rawTerms.size() > config.getMaxQueryTerms()) {
            throw new CommandLine.ParameterException(new CommandLine(this),
                "查询词数量超过限制（最多 " + config.getMaxQueryTerms() + " 个）");
        }
        for (String rawTerm : rawTerms) {
            if (rawTerm.length() > config.getMaxQueryLength()) {
                throw new CommandLine.ParameterException(new CommandLine(this),
                    "查询长度超过限制（最大 " + config.getMaxQueryLength() + " 字符）");
            }
        }
        return rawTerms;
    }

    /**
     * 语料来源：原文文件（顺序ID）或已分词 JSON（指定ID），二选一。
     */
    static class CorpusSource {
        @Option(names = {"-d", "--doc"}, description = "文档文件，按给出顺序分配ID（从0开始）", arity = "1..*")
        List<Path> documentPaths;

        @Option(names = {"-t", "--tokenized"}, description = "已分词语料 JSON 文件：{\"ID\": [\"词项\", ...]}")
        Path tokenizedPath;

        InvertedIndex buildIndex(IndexConfig config) {
            IndexBuilder builder = new IndexBuilder();
            if (tokenizedPath != null) {
                return builder.fromTokenizedDocuments(new TokenizedCorpusReader(config).read(tokenizedPath));
            }
            return builder.fromTexts(new TextCorpusReader(config).read(documentPaths));
        }
    }

    public record QueryView(String searchTerm, boolean found, int documentFrequency, int[] documentIds) {
        static QueryView of(QueryResult result) {
            int[] ids = result.documentIds();
            return new QueryView(result.searchTerm(), result.found(), ids.length, ids);
        }
    }

    public record PostingView(String term, int documentFrequency, int[] documentIds) {
        static PostingView of(PostingEntry entry) {
            return new PostingView(entry.term(), entry.documentFrequency(), entry.documentIds());
        }
    }

    @Command(name = "search", description = "🔎 建立索引并查询一个或多个词项")
    static class SearchSubcommand implements Callable<Integer> {

        @Parameters(description = "查询词项（不区分大小写）", arity = "1..*")
        private List<String> terms;

        @ArgGroup(exclusive = true, multiplicity = "1")
        private CorpusSource source;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            IndexConfig config = main.buildConfig();
            List<String> safeTerms = main.sanitizeQueryTerms(terms, config);
            try {
                InvertedIndex index = source.buildIndex(config);
                List<QueryResult> results = new QueryService().findAll(index, safeTerms);

                if ("json".equalsIgnoreCase(format)) {
                    printJsonResults(results);
                } else {
                    printTextResults(results);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 查询失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextResults(List<QueryResult> results) {
            for (QueryResult result : results) {
                System.out.println(result.describe());
            }
        }

        private void printJsonResults(List<QueryResult> results) throws IOException {
            List<QueryView> views = new ArrayList<>(results.size());
            for (QueryResult result : results) {
                views.add(QueryView.of(result));
            }
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(views));
        }
    }

    @Command(name = "postings", description = "📊 按首次出现顺序列出全部倒排记录")
    static class PostingsSubcommand implements Callable<Integer> {

        @ArgGroup(exclusive = true, multiplicity = "1")
        private CorpusSource source;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                InvertedIndex index = source.buildIndex(main.buildConfig());
                if ("json".equalsIgnoreCase(format)) {
                    printJsonPostings(index);
                } else {
                    printTextPostings(index);
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 建立索引失败: " + exception.getMessage());
                return 1;
            }
        }

        private void printTextPostings(InvertedIndex index) {
            if (index.isEmpty()) {
                System.out.println("⚠️ 索引为空");
                return;
            }
            for (PostingEntry entry : index.postings()) {
                System.out.printf("%-20s %5d  %s%n", entry.term(), entry.documentFrequency(), Arrays.toString(entry.documentIds()));
            }
            System.out.println();
            System.out.println("📊 词条数: " + index.termCount() + "，文档数: " + index.documentCount());
        }

        private void printJsonPostings(InvertedIndex index) throws IOException {
            List<PostingView> views = new ArrayList<>(index.termCount());
            for (PostingEntry entry : index.postings()) {
                views.add(PostingView.of(entry));
            }
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(views));
        }
    }

    @Command(name = "tokens", description = "🔤 查看文本的分词结果")
    static class TokensSubcommand implements Callable<Integer> {

        @Parameters(description = "待分词文本", arity = "1")
        private String text;

        @Option(names = {"--raw"}, description = "输出去重前的词元与偏移", defaultValue = "false")
        private boolean raw;

        @Override
        public Integer call() {
            WhitespaceTokenizer tokenizer = new WhitespaceTokenizer();
            if (raw) {
                for (Token token : tokenizer.tokens(text)) {
                    System.out.printf("%d\t%s\t%s\t[%d,%d)%n",
                        token.position(), token.term(), token.surface(), token.startOffset(), token.endOffset());
                }
            } else {
                System.out.println(tokenizer.tokenize(text));
            }
            return 0;
        }
    }
}
