package com.termindex;

import com.termindex.index.IndexBuilder;
import com.termindex.index.InvertedIndex;
import com.termindex.query.QueryResult;
import com.termindex.query.QueryService;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.runner.Runner;
import org.openjdk.jmh.runner.options.Options;
import org.openjdk.jmh.runner.options.OptionsBuilder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * 索引构建与查询性能基准测试
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-Xms1g", "-Xmx1g"})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class IndexBenchmark {

    @State(Scope.Thread)
    public static class CorpusState {
        List<String> texts;
        Map<Integer, List<String>> tokenized;
        IndexBuilder indexBuilder;

        @Setup
        public void setup() {
            texts = new ArrayList<>(1000);
            tokenized = new HashMap<>();
            // 创建1000个测试文档
            for (int i = 0; i < 1000; i++) {
                String content = generateDocument(i);
                texts.add(content);
                tokenized.put(i * 3, List.of(content.split("\\s+")));
            }
            indexBuilder = new IndexBuilder();
        }

        private String generateDocument(int index) {
            return "Document " + index + " content. " +
                   "new home sales top forecasts " +
                   "home sales rise in July " +
                   "increase in home sales in July " +
                   "term" + (index % 97) + " bucket" + (index % 13) + " " +
                   " repeated text to increase size.".repeat(5);
        }
    }

    @Benchmark
    public InvertedIndex buildFromTexts(CorpusState state) {
        return state.indexBuilder.fromTexts(state.texts);
    }

    @Benchmark
    public InvertedIndex buildFromTokenizedDocuments(CorpusState state) {
        return state.indexBuilder.fromTokenizedDocuments(state.tokenized);
    }

    @State(Scope.Benchmark)
    public static class QueryState {
        InvertedIndex index;
        QueryService queryService;

        @Setup
        public void setup() {
            List<String> texts = new ArrayList<>(10000);
            // 创建10000个测试文档
            for (int i = 0; i < 10000; i++) {
                texts.add("Document " + i + " about " +
                    (i % 10 == 0 ? "Java programming" :
                     i % 10 == 1 ? "Python data science" :
                     i % 10 == 2 ? "machine learning" :
                     "general content") +
                    " with various keywords for search testing.");
            }
            index = new IndexBuilder().fromTexts(texts);
            queryService = new QueryService();
        }
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    public QueryResult queryLatencyHit(QueryState state) {
        return state.queryService.find(state.index, "Java");
    }

    @Benchmark
    @BenchmarkMode(Mode.AverageTime)
    @OutputTimeUnit(TimeUnit.NANOSECONDS)
    public QueryResult queryLatencyMiss(QueryState state) {
        return state.queryService.find(state.index, "Haskell");
    }

    public static void main(String[] args) throws Exception {
        Options opt = new OptionsBuilder()
            .include(IndexBenchmark.class.getSimpleName())
            .forks(1)
            .build();
        new Runner(opt).run();
    }
}
