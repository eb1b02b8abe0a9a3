package eu.virtualparadox.titanshield.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.SearcherFactory;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.similarities.BM25Similarity;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Lucene resources for the knowledge index: one writer and one near-real-time searcher manager over the same directory.
 * <p>Resources are opened against the on-disk index under {@code titanshield.paths.index} and closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private Analyzer analyzer;

    /**
     * Provides the Lucene FS directory bound to the configured index path.
     *
     * @throws IOException if the path cannot be created or opened
     */
    @Bean
    public Directory luceneDirectory(final TitanShieldProperties props) throws IOException {
        final Path indexPath = props.getPaths().getIndex();
        if (indexPath == null) {
            throw new IllegalStateException("titanshield.paths.index is not configured");
        }
        Files.createDirectories(indexPath);
        this.directory = FSDirectory.open(indexPath);
        log.info("Opened knowledge index at {}", indexPath.toAbsolutePath());
        return this.directory;
    }

    /**
     * Standard tokenisation with lower-casing and no stop words. Vietnamese syllables are space separated, so the
     * standard tokenizer splits them correctly, and diacritics are kept so {@code cấm} and {@code cầm} stay distinct.
     */
    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    /**
     * Opens the writer in create-or-append mode and commits once, so a fresh directory is a valid empty index that
     * {@link eu.virtualparadox.titanshield.knowledge.index.KnowledgeBootstrap} can count.
     */
    @Bean
    public IndexWriter indexWriter(final Directory dir, final Analyzer analyzer) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND)
                .setSimilarity(new BM25Similarity());
        this.indexWriter = new IndexWriter(dir, cfg);
        if (!DirectoryReader.indexExists(dir)) {
            indexWriter.commit();
            log.info("Created empty knowledge index");
        }
        return this.indexWriter;
    }

    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, new SearcherFactory() {
            @Override
            public IndexSearcher newSearcher(final IndexReader reader, final IndexReader previousReader) {
                final IndexSearcher searcher = new IndexSearcher(reader);
                searcher.setSimilarity(new BM25Similarity());
                return searcher;
            }
        });
        return this.searcherManager;
    }

    @PreDestroy
    public void close() {
        closeQuietly("SearcherManager", searcherManager);
        closeQuietly("IndexWriter", indexWriter);
        closeQuietly("Analyzer", analyzer);
        closeQuietly("Directory", directory);
    }

    private static void closeQuietly(final String name, final Closeable resource) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (IOException | RuntimeException e) {
            log.error("Unable to close {}", name, e);
        }
    }
}
