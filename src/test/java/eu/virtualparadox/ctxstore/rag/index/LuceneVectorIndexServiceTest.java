package eu.virtualparadox.ctxstore.rag.index;

import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkEntity;
import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkId;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LuceneVectorIndexServiceTest {

    private static final Set<String> RULES = Set.of("business_rule");

    private ByteBuffersDirectory directory;
    private IndexWriter writer;
    private SearcherManager searcherManager;
    private LuceneVectorIndexService index;

    @BeforeEach
    void setUp() throws IOException {
        directory = new ByteBuffersDirectory();
        writer = new IndexWriter(directory, new IndexWriterConfig());
        searcherManager = new SearcherManager(writer, null);
        index = new LuceneVectorIndexService(writer, searcherManager);
    }

    @AfterEach
    void tearDown() throws IOException {
        searcherManager.close();
        writer.close();
        directory.close();
    }

    private static EmbeddingChunkEntity chunk(String type, String id, int idx, String projectId, float... vector) {
        return EmbeddingChunkEntity.builder()
                .id(new EmbeddingChunkId(type, id, idx))
                .repoId("r1")
                .projectId(projectId)
                .vector(vector)
                .embeddingModel("m")
                .dimension(vector.length)
                .contentHash("h")
                .totalChunks(1)
                .chunkStartOffset(0)
                .chunkEndOffset(1)
                .createdAt(Instant.now())
                .build();
    }

    @Test
    void testSearchReturnsRawCosineBestFirst() throws IOException {
        index.add(List.of(chunk("business_rule", "same", 0, null, 1f, 0f, 0f)));
        index.add(List.of(chunk("business_rule", "orthogonal", 0, null, 0f, 1f, 0f)));

        List<VectorHit> hits = index.search(new float[]{1f, 0f, 0f}, new VectorFilter("r1", null, RULES), 10);

        assertThat(hits).extracting(VectorHit::entityId).containsExactly("same", "orthogonal");
        assertThat(hits.get(0).similarity()).isCloseTo(1.0, within(1e-5));
        assertThat(hits.get(1).similarity()).isCloseTo(0.0, within(1e-5));
        assertThat(hits.get(0).projectId()).isNull();
    }

    @Test
    void testProjectChunksOnlyVisibleWithTheirProject() throws IOException {
        index.add(List.of(chunk("business_rule", "repoLevel", 0, null, 1f, 0f, 0f)));
        index.add(List.of(chunk("business_rule", "inP1", 0, "p1", 1f, 0f, 0f)));
        index.add(List.of(chunk("business_rule", "inP2", 0, "p2", 1f, 0f, 0f)));
        float[] q = {1f, 0f, 0f};

        assertThat(index.search(q, new VectorFilter("r1", null, RULES), 10))
                .extracting(VectorHit::entityId).containsExactly("repoLevel");
        assertThat(index.search(q, new VectorFilter("r1", "p1", RULES), 10))
                .extracting(VectorHit::entityId).containsExactlyInAnyOrder("repoLevel", "inP1");
        assertThat(index.search(q, new VectorFilter("other", null, RULES), 10)).isEmpty();
    }

    @Test
    void testEntityTypeFilter() throws IOException {
        index.add(List.of(chunk("business_rule", "rule", 0, null, 1f, 0f, 0f)));
        index.add(List.of(chunk("pattern", "pat", 0, null, 1f, 0f, 0f)));

        List<VectorHit> hits = index.search(new float[]{1f, 0f, 0f},
                new VectorFilter("r1", null, Set.of("pattern")), 10);

        assertThat(hits).extracting(VectorHit::entityId).containsExactly("pat");
    }

    @Test
    void testDeleteByEntityRemovesAllChunks() throws IOException {
        index.add(List.of(
                chunk("document", "doc", 0, null, 1f, 0f, 0f),
                chunk("document", "doc", 1, null, 0f, 1f, 0f)));
        index.add(List.of(chunk("document", "keep", 0, null, 0f, 0f, 1f)));
        assertThat(index.count()).isEqualTo(3);

        index.deleteByEntity("document", "doc");
        index.deleteByEntity("document", "unknown");

        assertThat(index.count()).isEqualTo(1);
    }

    @Test
    void testRebuildReplacesContent() throws IOException {
        index.add(List.of(chunk("business_rule", "old", 0, null, 1f, 0f, 0f)));

        index.rebuild(List.of(chunk("business_rule", "new", 0, null, 0f, 1f, 0f)));

        assertThat(index.count()).isEqualTo(1);
        assertThat(index.search(new float[]{0f, 1f, 0f}, new VectorFilter("r1", null, RULES), 5))
                .extracting(VectorHit::entityId).containsExactly("new");
    }

    @Test
    void testDimensionMismatchIsRejected() throws IOException {
        index.add(List.of(chunk("business_rule", "a", 0, null, 1f, 0f, 0f)));

        assertThatThrownBy(() -> index.add(List.of(chunk("business_rule", "b", 0, null, 1f, 0f))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("dimension mismatch");
    }
}
