package eu.virtualparadox.ctxstore.ingest.lifecycle;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.entity.ContextEntity;
import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import eu.virtualparadox.ctxstore.catalog.model.ContextWriteResult;
import eu.virtualparadox.ctxstore.catalog.service.ContextCatalogService;
import eu.virtualparadox.ctxstore.ingest.hash.ContentHasher;
import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkEntity;
import eu.virtualparadox.ctxstore.support.ContextStoreTestBase;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EmbeddingLifecycleManagerTest extends ContextStoreTestBase {

    @Autowired
    private ContextCatalogService catalogService;

    @Autowired
    private EmbeddingLifecycleManager lifecycleManager;

    @Autowired
    private ContentHasher contentHasher;

    private ContextWriteResult storeRule(final String name, final String description) {
        return catalogService.store(EEntityType.BUSINESS_RULE, repo.getId(), null,
                ContextFields.builder().name(name).description(description).build());
    }

    /**
     * Sentences drawn from a small fixed vocabulary, so the shared test embedder stays collision free.
     */
    private static String longContent(final int sentences) {
        final String[] words = {"alpha", "bravo", "charlie", "delta", "echo", "foxtrot", "golf", "hotel"};
        final StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sentences; i++) {
            for (int w = 0; w < 8; w++) {
                if (w > 0) sb.append(' ');
                sb.append(words[(i + w) % words.length]);
            }
            sb.append(i % 5 == 4 ? ".\n\n" : ". ");
        }
        return sb.toString();
    }

    @Test
    void testUnchangedContentIsNotReembedded() {
        final ContextEntity rule = storeRule("Retry Rule", "retries must back off").entity();
        assertThat(embedder.calls()).isEqualTo(1);

        final ESyncOutcome second = lifecycleManager.sync(rule, repo.getId(), null);

        assertThat(second).isEqualTo(ESyncOutcome.UNCHANGED);
        assertThat(embedder.calls()).isEqualTo(1);
    }

    @Test
    void testFieldOutsideCanonicalTextDoesNotReembed() {
        final ContextEntity rule = storeRule("Audit Rule", "writes must be audited").entity();

        final ContextWriteResult updated = catalogService.update(EEntityType.BUSINESS_RULE, rule.getId(),
                ContextFields.builder().priority("high").category("compliance").build());

        assertThat(updated.syncOutcome()).isEqualTo(ESyncOutcome.UNCHANGED);
        assertThat(embedder.calls()).isEqualTo(1);
    }

    @Test
    void testChangedContentReplacesChunks() {
        final ContextEntity rule = storeRule("Audit Rule", "writes must be audited").entity();
        final String firstHash = lifecycleManager.chunksOf(EEntityType.BUSINESS_RULE, rule.getId()).get(0).getContentHash();

        final ContextWriteResult updated = catalogService.update(EEntityType.BUSINESS_RULE, rule.getId(),
                ContextFields.builder().description("reads and writes must be audited").build());

        assertThat(updated.syncOutcome()).isEqualTo(ESyncOutcome.REEMBEDDED);
        assertThat(embedder.calls()).isEqualTo(2);
        final List<EmbeddingChunkEntity> chunks = lifecycleManager.chunksOf(EEntityType.BUSINESS_RULE, rule.getId());
        assertThat(chunks).hasSize(1);
        assertThat(chunks.get(0).getContentHash()).isNotEqualTo(firstHash);
        assertThat(chunks.get(0).getEmbeddingModel()).isEqualTo("test-prefix-bag");
    }

    @Test
    void testGeneratorFailureKeepsEntityAndRetriesLater() {
        embedder.setFailing(true);
        final ContextWriteResult stored = storeRule("Flaky Rule", "the model may be down");

        assertThat(stored.syncOutcome()).isEqualTo(ESyncOutcome.FAILED);
        final String id = stored.entity().getId();
        assertThat(catalogService.get(EEntityType.BUSINESS_RULE, id).getDisplayName()).isEqualTo("Flaky Rule");
        assertThat(lifecycleManager.chunksOf(EEntityType.BUSINESS_RULE, id)).isEmpty();

        embedder.setFailing(false);
        final ContextWriteResult retried = catalogService.update(EEntityType.BUSINESS_RULE, id, new ContextFields());

        assertThat(retried.syncOutcome()).isEqualTo(ESyncOutcome.REEMBEDDED);
        assertThat(lifecycleManager.chunksOf(EEntityType.BUSINESS_RULE, id)).hasSize(1);
    }

    @Test
    void testLongDocumentChunksCoverTheWholeText() {
        final ContextEntity doc = catalogService.store(EEntityType.DOCUMENT, repo.getId(), null,
                ContextFields.builder().title("Runbook").content(longContent(80)).build()).entity();
        final String canonical = contentHasher.canonicalText(doc);

        final List<EmbeddingChunkEntity> chunks = lifecycleManager.chunksOf(EEntityType.DOCUMENT, doc.getId());

        assertThat(chunks.size()).isGreaterThan(1);
        assertThat(embedder.calls()).isEqualTo(chunks.size());
        assertThat(chunks.get(0).getChunkStartOffset()).isZero();
        assertThat(chunks.get(chunks.size() - 1).getChunkEndOffset()).isEqualTo(canonical.length());
        for (int i = 0; i < chunks.size(); i++) {
            final EmbeddingChunkEntity c = chunks.get(i);
            assertThat(c.getId().getChunkIndex()).isEqualTo(i);
            assertThat(c.getTotalChunks()).isEqualTo(chunks.size());
            if (i > 0) {
                // chunker.overlap-chars
                assertThat(c.getChunkStartOffset()).isEqualTo(chunks.get(i - 1).getChunkEndOffset() - 100);
            }
        }
    }

    @Test
    void testDeleteRemovesAllChunks() {
        final ContextEntity doc = catalogService.store(EEntityType.DOCUMENT, repo.getId(), null,
                ContextFields.builder().title("Runbook").content(longContent(40)).build()).entity();
        assertThat(lifecycleManager.chunksOf(EEntityType.DOCUMENT, doc.getId())).isNotEmpty();

        assertThat(catalogService.delete(EEntityType.DOCUMENT, doc.getId())).isTrue();

        assertThat(lifecycleManager.chunksOf(EEntityType.DOCUMENT, doc.getId())).isEmpty();
        assertThat(catalogService.delete(EEntityType.DOCUMENT, doc.getId())).isFalse();
    }
}
