package eu.virtualparadox.titanshield.knowledge.store;

import eu.virtualparadox.titanshield.application.config.TitanShieldProperties;
import eu.virtualparadox.titanshield.knowledge.model.Chunk;
import eu.virtualparadox.titanshield.knowledge.model.DocumentType;
import eu.virtualparadox.titanshield.util.VietnameseText;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.FieldInfo;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.MultiBits;
import org.apache.lucene.index.MultiTerms;
import org.apache.lucene.index.PostingsEnum;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.Terms;
import org.apache.lucene.index.TermsEnum;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.BoostQuery;
import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.search.FieldExistsQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.util.Bits;
import org.apache.lucene.util.QueryBuilder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static eu.virtualparadox.titanshield.util.LuceneConstants.*;

/**
 * {@link KnowledgeStore} over a single Lucene index in which every chunk is one document carrying both its
 * BM25-indexed text and its HNSW vector.
 * <p>
 * Keeping text and vector in the same document is what keeps the lexical and the vector index aligned: a hit from
 * either leg resolves to the same chunk id. {@link #verifyIntegrity(int)} checks that no document lost one of the two.
 */
@Service
@Slf4j
public class LuceneKnowledgeStore implements KnowledgeStore {

    private final SearcherManager searcherManager;
    private final Analyzer analyzer;
    private final float entityBoost;

    @Autowired
    public LuceneKnowledgeStore(final SearcherManager searcherManager,
                                final Analyzer analyzer,
                                final TitanShieldProperties props) {
        this(searcherManager, analyzer, props.getRetrieval().getEntityBoost());
    }

    public LuceneKnowledgeStore(final SearcherManager searcherManager,
                                final Analyzer analyzer,
                                final float entityBoost) {
        this.searcherManager = searcherManager;
        this.analyzer = analyzer;
        this.entityBoost = entityBoost;
    }

    @Override
    public List<IndexHit> lexicalSearch(final String queryText,
                                        final List<String> entities,
                                        final CandidateFilter filter,
                                        final int limit) throws IOException {
        if (limit <= 0) {
            return List.of();
        }

        final QueryBuilder builder = new QueryBuilder(analyzer);
        final BooleanQuery.Builder terms = new BooleanQuery.Builder();
        boolean hasClause = false;

        final Query textQuery = builder.createBooleanQuery(FIELD_TEXT, VietnameseText.normalize(queryText));
        if (textQuery != null) {
            terms.add(textQuery, BooleanClause.Occur.SHOULD);
            hasClause = true;
        }
        if (entities != null) {
            for (final String entity : entities) {
                final Query phrase = builder.createPhraseQuery(FIELD_TEXT, VietnameseText.normalize(entity));
                if (phrase != null) {
                    terms.add(new BoostQuery(phrase, entityBoost), BooleanClause.Occur.SHOULD);
                    hasClause = true;
                }
            }
        }
        if (!hasClause) {
            return List.of();
        }

        final BooleanQuery.Builder query = new BooleanQuery.Builder()
                .add(terms.build(), BooleanClause.Occur.MUST);
        final Query filterQuery = toFilterQuery(filter);
        if (filterQuery != null) {
            query.add(filterQuery, BooleanClause.Occur.FILTER);
        }

        return search(query.build(), limit);
    }

    @Override
    public List<IndexHit> vectorSearch(final float[] queryVector,
                                       final CandidateFilter filter,
                                       final int limit) throws IOException {
        if (limit <= 0) {
            return List.of();
        }
        final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, queryVector, limit, toFilterQuery(filter));
        return search(knn, limit);
    }

    @Override
    public Optional<Chunk> getChunk(final String chunkId) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs top = searcher.search(new TermQuery(new Term(FIELD_CHUNK_ID, chunkId)), 1);
            if (top.scoreDocs.length == 0) {
                return Optional.empty();
            }
            final Document doc = searcher.storedFields().document(top.scoreDocs[0].doc);
            return Optional.of(toChunk(doc));
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public int size() throws IOException {
        searcherManager.maybeRefreshBlocking();
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Startup check of the index against the configured embedding dimension.
     *
     * @throws KnowledgeStoreConfigurationException if the index is empty, if the number of documents with text
     *                                              differs from the number with a vector, if a chunk id is held by
     *                                              more than one document, or if the stored vectors have another
     *                                              dimension
     */
    public void verifyIntegrity(final int expectedDimension) throws IOException {
        searcherManager.maybeRefreshBlocking();
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final int total = searcher.getIndexReader().numDocs();
            if (total == 0) {
                throw new KnowledgeStoreConfigurationException("Knowledge index is empty");
            }

            final int withText = searcher.count(new FieldExistsQuery(FIELD_TEXT));
            final int withVector = searcher.count(new FieldExistsQuery(FIELD_VECTOR));
            if (withText != total || withVector != total) {
                throw new KnowledgeStoreConfigurationException(
                        "Lexical and vector index are misaligned: documents=" + total
                                + ", withText=" + withText + ", withVector=" + withVector);
            }

            final int distinctIds = countDistinctChunkIds(searcher.getIndexReader());
            if (distinctIds != total) {
                throw new KnowledgeStoreConfigurationException(
                        "Chunk ids are not unique: documents=" + total + ", distinct ids=" + distinctIds);
            }

            for (final LeafReaderContext leaf : searcher.getIndexReader().leaves()) {
                final FieldInfo info = leaf.reader().getFieldInfos().fieldInfo(FIELD_VECTOR);
                if (info != null && info.getVectorDimension() != expectedDimension) {
                    throw new KnowledgeStoreConfigurationException(
                            "Index vector dimension " + info.getVectorDimension()
                                    + " differs from embedding dimension " + expectedDimension);
                }
            }
            log.info("Knowledge index verified: {} chunks, dimension {}", total, expectedDimension);
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Number of chunk ids held by at least one live document.
     */
    private static int countDistinctChunkIds(final IndexReader reader) throws IOException {
        final Terms terms = MultiTerms.getTerms(reader, FIELD_CHUNK_ID);
        if (terms == null) {
            return 0;
        }
        final Bits liveDocs = MultiBits.getLiveDocs(reader);
        final TermsEnum termsEnum = terms.iterator();
        PostingsEnum postings = null;
        int distinct = 0;
        while (termsEnum.next() != null) {
            postings = termsEnum.postings(postings, PostingsEnum.NONE);
            for (int doc = postings.nextDoc(); doc != DocIdSetIterator.NO_MORE_DOCS; doc = postings.nextDoc()) {
                if (liveDocs == null || liveDocs.get(doc)) {
                    distinct++;
                    break;
                }
            }
        }
        return distinct;
    }

    private List<IndexHit> search(final Query query, final int limit) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final TopDocs top = searcher.search(query, limit);
            final StoredFields storedFields = searcher.storedFields();
            final List<IndexHit> hits = new ArrayList<>(top.scoreDocs.length);
            for (final ScoreDoc sd : top.scoreDocs) {
                final String chunkId = storedFields.document(sd.doc).get(FIELD_CHUNK_ID);
                if (chunkId != null) {
                    hits.add(new IndexHit(chunkId, sd.score));
                }
            }
            return hits;
        } finally {
            searcherManager.release(searcher);
        }
    }

    private Query toFilterQuery(final CandidateFilter filter) {
        if (filter == null || filter.isUnrestricted()) {
            return null;
        }
        final BooleanQuery.Builder builder = new BooleanQuery.Builder();

        if (!filter.types().isEmpty()) {
            final BooleanQuery.Builder types = new BooleanQuery.Builder();
            for (final DocumentType type : filter.types()) {
                types.add(new TermQuery(new Term(FIELD_TYPE, type.name())), BooleanClause.Occur.SHOULD);
            }
            builder.add(types.build(), BooleanClause.Occur.FILTER);
        }

        if (filter.region() != null) {
            final BooleanQuery.Builder regions = new BooleanQuery.Builder()
                    .add(new TermQuery(new Term(FIELD_REGION, filter.region())), BooleanClause.Occur.SHOULD)
                    .add(new TermQuery(new Term(FIELD_REGION, Chunk.REGION_ALL)), BooleanClause.Occur.SHOULD);
            builder.add(regions.build(), BooleanClause.Occur.FILTER);
        }
        return builder.build();
    }

    private Chunk toChunk(final Document doc) {
        return new Chunk(
                doc.get(FIELD_CHUNK_ID),
                doc.get(FIELD_TEXT),
                doc.get(FIELD_SOURCE),
                DocumentType.fromLabel(doc.get(FIELD_TYPE)),
                intValue(doc.getField(FIELD_VALID_FROM), Chunk.EARLIEST_YEAR),
                intValue(doc.getField(FIELD_VALID_UNTIL), Chunk.NO_EXPIRY),
                doc.get(FIELD_REGION));
    }

    private static int intValue(final IndexableField field, final int fallback) {
        return field == null || field.numericValue() == null ? fallback : field.numericValue().intValue();
    }
}
