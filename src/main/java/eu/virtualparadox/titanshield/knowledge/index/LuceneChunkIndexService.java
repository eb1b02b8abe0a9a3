package eu.virtualparadox.titanshield.knowledge.index;

import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.util.VietnameseText;
import lombok.RequiredArgsConstructor;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.IntPoint;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.SearcherManager;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static eu.virtualparadox.titanshield.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link ChunkIndexService} using the HNSW k-NN graph.
 * <p>
 * Each chunk is stored as one Lucene {@link Document} holding both its text and its vector, so the lexical and the
 * vector index cannot drift apart.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code chunkId} – {@link StringField}: unique chunk identifier</li>
 *   <li>{@code source} – {@link StringField}: source label, used for replace-by-source</li>
 *   <li>{@code text} – {@link TextField}: NFC-normalised chunk text, BM25-indexed and stored</li>
 *   <li>{@code type}, {@code region} – {@link StringField}: candidate filter terms</li>
 *   <li>{@code validFrom}, {@code validUntil} – {@link IntPoint} plus {@link StoredField}</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField}: dense vector, cosine similarity</li>
 * </ul>
 *
 * <p><b>Vector dimensions:</b> Lucene requires a constant dimension per vector field across an index. Changing the
 * embedding model means rebuilding the index into a fresh directory.</p>
 */
@Service
@RequiredArgsConstructor
public class LuceneChunkIndexService implements ChunkIndexService {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * First-seen dimension of this writer; later batches must match it.
     */
    private Integer vectorDim;

    /**
     * Adds or replaces all chunks of a source.
     * <ol>
     *   <li>Delete any existing chunks for the {@code source}</li>
     *   <li>Insert the provided {@code chunks}+{@code vectors} pairs, replacing any chunk with the same id</li>
     *   <li>Commit and refresh the searcher for near-real-time visibility</li>
     * </ol>
     *
     * @throws IllegalArgumentException if input lists are null, empty, or size/dimension mismatch, or an id repeats
     */
    @Override
    public synchronized void upsert(final String source,
                                    final List<Chunk> chunks,
                                    final List<float[]> vectors) throws IOException {

        requireNonNullOrEmpty(source, "source");
        requireNonNullOrEmpty(chunks, "chunks");
        requireNonNullOrEmpty(vectors, "vectors");

        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("chunks.size() != vectors.size()");
        }

        final int dim = vectors.get(0) == null ? 0 : vectors.get(0).length;
        ensureConsistentDimension(dim);
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
        }

        final Set<String> ids = new HashSet<>();
        for (final Chunk chunk : chunks) {
            if (!ids.add(chunk.id())) {
                throw new IllegalArgumentException("Duplicate chunk id " + chunk.id() + " in source " + source);
            }
        }

        writer.deleteDocuments(new Term(FIELD_SOURCE, source));

        // a chunk id already written under another source moves to this one
        for (int i = 0; i < chunks.size(); i++) {
            writer.updateDocument(new Term(FIELD_CHUNK_ID, chunks.get(i).id()),
                    buildLuceneDocument(source, chunks.get(i), vectors.get(i)));
        }

        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    @Override
    public synchronized void deleteBySource(final String source) throws IOException {
        requireNonNullOrEmpty(source, "source");
        writer.deleteDocuments(new Term(FIELD_SOURCE, source));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    private void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (!vectorDim.equals(dim)) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    private Document buildLuceneDocument(final String source,
                                         final Chunk c,
                                         final float[] vec) {
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_CHUNK_ID, c.id(), Field.Store.YES));
        d.add(new StringField(FIELD_SOURCE, source, Field.Store.YES));

        // Text content (indexed + stored)
        d.add(new TextField(FIELD_TEXT, VietnameseText.normalize(c.text()), Field.Store.YES));

        // Filter terms
        d.add(new StringField(FIELD_TYPE, c.type().name(), Field.Store.YES));
        d.add(new StringField(FIELD_REGION, c.region(), Field.Store.YES));

        // Validity window
        d.add(new IntPoint(FIELD_VALID_FROM, c.validFrom()));
        d.add(new StoredField(FIELD_VALID_FROM, c.validFrom()));
        d.add(new IntPoint(FIELD_VALID_UNTIL, c.validUntil()));
        d.add(new StoredField(FIELD_VALID_UNTIL, c.validUntil()));

        // Vector for HNSW ANN search
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));

        return d;
    }

    private void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof Collection<?> collection && collection.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
