package eu.virtualparadox.titanshield.knowledge;

import eu.virtualparadox.titanshield.knowledge.index.LuceneChunkIndexService;
import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.knowledge.store.LuceneKnowledgeStore;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Knowledge index in memory, wired the same way the application wires the on-disk one.
 */
public class InMemoryKnowledgeIndex implements AutoCloseable {

    public static final float ENTITY_BOOST = 2.0f;

    private final Directory directory = new ByteBuffersDirectory();
    private final Analyzer analyzer = new StandardAnalyzer();
    private final IndexWriter writer;
    private final SearcherManager searcherManager;
    private final LuceneChunkIndexService indexService;
    private final LuceneKnowledgeStore store;

    public InMemoryKnowledgeIndex() throws IOException {
        this.writer = new IndexWriter(directory, new IndexWriterConfig(analyzer));
        this.writer.commit();
        this.searcherManager = new SearcherManager(writer, null);
        this.indexService = new LuceneChunkIndexService(writer, searcherManager);
        this.store = new LuceneKnowledgeStore(searcherManager, analyzer, ENTITY_BOOST);
    }

    /**
     * Indexes the chunks with their vectors, one upsert per source.
     */
    public InMemoryKnowledgeIndex add(final List<Chunk> chunks, final List<float[]> vectors) throws IOException {
        final Map<String, List<Integer>> bySource = new LinkedHashMap<>();
        for (int i = 0; i < chunks.size(); i++) {
            bySource.computeIfAbsent(chunks.get(i).source(), s -> new ArrayList<>()).add(i);
        }
        for (final Map.Entry<String, List<Integer>> entry : bySource.entrySet()) {
            final List<Chunk> batch = new ArrayList<>();
            final List<float[]> batchVectors = new ArrayList<>();
            for (final int i : entry.getValue()) {
                batch.add(chunks.get(i));
                batchVectors.add(vectors.get(i));
            }
            indexService.upsert(entry.getKey(), batch, batchVectors);
        }
        return this;
    }

    public LuceneKnowledgeStore store() {
        return store;
    }

    public LuceneChunkIndexService indexService() {
        return indexService;
    }

    public IndexWriter writer() {
        return writer;
    }

    public SearcherManager searcherManager() {
        return searcherManager;
    }

    @Override
    public void close() throws IOException {
        searcherManager.close();
        writer.close();
        analyzer.close();
        directory.close();
    }
}
