package com.termindex.integration;

import com.termindex.config.IndexConfig;
import com.termindex.document.TextCorpusReader;
import com.termindex.document.TokenizedCorpusReader;
import com.termindex.index.IndexBuilder;
import com.termindex.index.InvertedIndex;
import com.termindex.index.PostingEntry;
import com.termindex.query.QueryResult;
import com.termindex.query.QueryService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 索引集成测试
 * 
 * 覆盖完整流程：读取语料 → 建索引 → 查询 → 枚举倒排
 */
class IndexIntegrationTest {

    @TempDir
    Path tempDir;

    private IndexConfig config;
    private IndexBuilder indexBuilder;
    private QueryService queryService;

    @BeforeEach
    void setUp() {
        config = IndexConfig.defaults();
        indexBuilder = new IndexBuilder();
        queryService = new QueryService();
    }

    @Test
    void testTextFilesToQuery() throws IOException {
        List<Path> paths = List.of(
            createTestFile("doc0.txt", "new home sales top forecasts"),
            createTestFile("doc1.txt", "home sales rise in July"),
            createTestFile("doc2.txt", "increase in home sales in July"));

        InvertedIndex index = indexBuilder.fromTexts(new TextCorpusReader(config).read(paths));

        assertEquals(3, index.documentCount());
        assertEquals("Found: July in documents: [1, 2]", queryService.find(index, "July").describe());
        assertEquals("Not Found: mortgage", queryService.find(index, "mortgage").describe());
        for (PostingEntry entry : index.postings()) {
            assertEquals(entry.documentIds().length, entry.documentFrequency());
        }
    }

    @Test
    void testTokenizedJsonToQuery() throws IOException {
        Path corpus = createTestFile("corpus.json",
            "{\"1\": [\"1001\", \"1002\", \"1002\"], \"23\": [\"1001\", \"1003\"]}");

        InvertedIndex index = indexBuilder.fromTokenizedDocuments(new TokenizedCorpusReader(config).read(corpus));

        QueryResult result = queryService.find(index, "1002");
        assertTrue(result.found());
        assertArrayEquals(new int[] {1}, result.documentIds());
        assertArrayEquals(new int[] {1, 23}, queryService.find(index, "1001").documentIds());
        assertEquals(List.of("1001", "1002", "1003"), List.copyOf(index.terms()));
    }

    private Path createTestFile(String name, String content) throws IOException {
        return Files.writeString(tempDir.resolve(name), content);
    }
}
