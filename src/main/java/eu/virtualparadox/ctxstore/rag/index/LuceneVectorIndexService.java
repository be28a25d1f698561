package eu.virtualparadox.ctxstore.rag.index;

import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkEntity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static eu.virtualparadox.ctxstore.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code entityKey} – {@code type:id}, used for deletion</li>
 *   <li>{@code entityType}, {@code repoId}, {@code projectId} – keyword fields used by the scope filter;
 *       repo-level chunks carry {@link eu.virtualparadox.ctxstore.util.LuceneConstants#REPO_LEVEL}</li>
 *   <li>{@code entityId}, {@code chunkIndex} – stored only</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField} with cosine similarity</li>
 * </ul>
 *
 * <p><b>Scores:</b> Lucene reports cosine hits as {@code (1 + cos) / 2}. {@link #search} converts
 * them back to the raw cosine similarity.</p>
 *
 * <p><b>Vector dimensions:</b> Lucene requires a constant dimension per vector field across an index.
 * Incoming vectors are validated against the first seen dimension until the next {@link #rebuild}.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LuceneVectorIndexService implements VectorIndexService {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * First-seen vector dimension of this index instance.
     */
    private Integer vectorDim;

    @Override
    public synchronized void add(final List<EmbeddingChunkEntity> chunks) throws IOException {
        requireNonNullOrEmpty(chunks, "chunks");
        for (final EmbeddingChunkEntity c : chunks) {
            ensureConsistentDimension(c.getVector().length);
            writer.addDocument(buildLuceneDocument(c));
        }
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    @Override
    public synchronized void deleteByEntity(final String entityType, final String entityId) throws IOException {
        requireNonNullOrEmpty(entityType, "entityType");
        requireNonNullOrEmpty(entityId, "entityId");
        writer.deleteDocuments(new Term(FIELD_ENTITY_KEY, entityKey(entityType, entityId)));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    @Override
    public List<VectorHit> search(final float[] vector, final VectorFilter filter, final int k) throws IOException {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("vector must not be empty");
        }
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive");
        }

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, vector, k, buildFilter(filter));
            final TopDocs topDocs = searcher.search(knn, k);
            final StoredFields storedFields = searcher.storedFields();

            final List<VectorHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                final String projectId = doc.get(FIELD_PROJECT_ID);
                hits.add(new VectorHit(
                        doc.get(FIELD_ENTITY_TYPE),
                        doc.get(FIELD_ENTITY_ID),
                        doc.getField(FIELD_CHUNK_INDEX).numericValue().intValue(),
                        doc.get(FIELD_REPO_ID),
                        REPO_LEVEL.equals(projectId) ? null : projectId,
                        2.0 * sd.score - 1.0
                ));
            }
            return hits;
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public int count() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    @Override
    public synchronized void rebuild(final List<EmbeddingChunkEntity> chunks) throws IOException {
        writer.deleteAll();
        vectorDim = null;
        for (final EmbeddingChunkEntity c : chunks) {
            ensureConsistentDimension(c.getVector().length);
            writer.addDocument(buildLuceneDocument(c));
        }
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        log.info("Rebuilt vector index with {} chunks", chunks.size());
    }

    /**
     * Scope filter: {@code repoId AND (repo-level OR projectId) AND entityType IN (...)}.
     */
    private Query buildFilter(final VectorFilter filter) {
        final BooleanQuery.Builder scope = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_REPO_ID, filter.repoId())), BooleanClause.Occur.FILTER);

        final BooleanQuery.Builder project = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(FIELD_PROJECT_ID, REPO_LEVEL)), BooleanClause.Occur.SHOULD);
        if (filter.projectId() != null) {
            project.add(new TermQuery(new Term(FIELD_PROJECT_ID, filter.projectId())), BooleanClause.Occur.SHOULD);
        }
        project.setMinimumNumberShouldMatch(1);
        scope.add(project.build(), BooleanClause.Occur.FILTER);

        final BooleanQuery.Builder types = new BooleanQuery.Builder();
        for (final String type : filter.entityTypes()) {
            types.add(new TermQuery(new Term(FIELD_ENTITY_TYPE, type)), BooleanClause.Occur.SHOULD);
        }
        types.setMinimumNumberShouldMatch(1);
        scope.add(types.build(), BooleanClause.Occur.FILTER);

        return scope.build();
    }

    /**
     * Ensures an internal, stable notion of the vector dimension.
     *
     * @param dim proposed dimension
     * @throws IllegalArgumentException if a different dimension has already been established
     */
    private void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (!vectorDim.equals(dim)) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (rebuild the index if you changed the embedder)");
        }
    }

    private Document buildLuceneDocument(final EmbeddingChunkEntity c) {
        final String entityType = c.getId().getEntityType();
        final String entityId = c.getId().getEntityId();
        final Document d = new Document();

        // Identifiers
        d.add(new StringField(FIELD_ENTITY_KEY, entityKey(entityType, entityId), Field.Store.NO));
        d.add(new StringField(FIELD_ENTITY_TYPE, entityType, Field.Store.YES));
        d.add(new StoredField(FIELD_ENTITY_ID, entityId));
        d.add(new StoredField(FIELD_CHUNK_INDEX, c.getId().getChunkIndex()));

        // Scope
        d.add(new StringField(FIELD_REPO_ID, c.getRepoId(), Field.Store.YES));
        d.add(new StringField(FIELD_PROJECT_ID, c.getProjectId() == null ? REPO_LEVEL : c.getProjectId(), Field.Store.YES));

        // Vector for HNSW ANN search
        d.add(new KnnFloatVectorField(FIELD_VECTOR, c.getVector(), VectorSimilarityFunction.COSINE));
        return d;
    }

    private void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
