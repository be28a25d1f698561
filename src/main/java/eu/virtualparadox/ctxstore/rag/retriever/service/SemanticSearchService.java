package eu.virtualparadox.ctxstore.rag.retriever.service;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.repo.ContextRepositoryRegistry;
import eu.virtualparadox.ctxstore.exception.ContextStoreException;
import eu.virtualparadox.ctxstore.exception.EErrorCode;
import eu.virtualparadox.ctxstore.exception.NotFoundException;
import eu.virtualparadox.ctxstore.exception.ValidationException;
import eu.virtualparadox.ctxstore.ingest.hash.ContentHasher;
import eu.virtualparadox.ctxstore.ingest.model.Embeddable;
import eu.virtualparadox.ctxstore.rag.embed.EmbeddingService;
import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkEntity;
import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkId;
import eu.virtualparadox.ctxstore.rag.embed.repo.EmbeddingChunkRepository;
import eu.virtualparadox.ctxstore.rag.index.VectorFilter;
import eu.virtualparadox.ctxstore.rag.index.VectorHit;
import eu.virtualparadox.ctxstore.rag.index.VectorIndexService;
import eu.virtualparadox.ctxstore.rag.retriever.model.EProvenance;
import eu.virtualparadox.ctxstore.rag.retriever.model.EntityMatch;
import eu.virtualparadox.ctxstore.rag.retriever.model.SearchOptions;
import eu.virtualparadox.ctxstore.scope.service.ScopeService;
import eu.virtualparadox.ctxstore.ticket.repo.TicketRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Semantic search over stored embeddings.
 * <p>
 * Steps:
 * <ol>
 *   <li>Validate the options and the scope</li>
 *   <li>Embed the query once</li>
 *   <li>Run a filtered k-NN search over the scope's chunks</li>
 *   <li>Keep the best chunk per entity and drop matches below {@code minSimilarity}</li>
 *   <li>Hydrate to owning entities, skipping embeddings whose entity is gone</li>
 *   <li>Sort by similarity, then most recent {@code updatedAt}, and truncate to {@code topK}</li>
 * </ol>
 * Without a project only repo-level embeddings are candidates; with one, the project's embeddings
 * are searched in addition to the repo's.
 */
@Service
@Slf4j
public class SemanticSearchService {

    private static final int MIN_CANDIDATES = 50;
    private static final int CANDIDATE_FACTOR = 4;
    private static final int EXCERPT_MAX_CHARS = 300;

    private final EmbeddingService embeddingService;
    private final VectorIndexService vectorIndexService;
    private final EmbeddingChunkRepository chunkRepository;
    private final ContextRepositoryRegistry contextRepositories;
    private final TicketRepository ticketRepository;
    private final ContentHasher contentHasher;
    private final ScopeService scopeService;
    private final int defaultTopK;
    private final double defaultMinSimilarity;

    public SemanticSearchService(final EmbeddingService embeddingService,
                                 final VectorIndexService vectorIndexService,
                                 final EmbeddingChunkRepository chunkRepository,
                                 final ContextRepositoryRegistry contextRepositories,
                                 final TicketRepository ticketRepository,
                                 final ContentHasher contentHasher,
                                 final ScopeService scopeService,
                                 @Value("${search.default-top-k:5}") final int defaultTopK,
                                 @Value("${search.default-min-similarity:0.5}") final double defaultMinSimilarity) {
        this.embeddingService = embeddingService;
        this.vectorIndexService = vectorIndexService;
        this.chunkRepository = chunkRepository;
        this.contextRepositories = contextRepositories;
        this.ticketRepository = ticketRepository;
        this.contentHasher = contentHasher;
        this.scopeService = scopeService;
        this.defaultTopK = defaultTopK;
        this.defaultMinSimilarity = defaultMinSimilarity;
    }

    /**
     * Executes a semantic search.
     *
     * @param query   free text query, must not be blank
     * @param options scope and ranking options
     * @return ranked matches, never null
     */
    public List<EntityMatch> search(final String query, final SearchOptions options) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("query must not be blank");
        }
        final ResolvedOptions resolved = resolve(options);
        scopeService.checkReadScope(resolved.repoId(), resolved.projectId());

        final float[] vector = embeddingService.embedQuery(query);
        return rank(vector, resolved, null);
    }

    /**
     * Finds entities similar to a stored one, using its first chunk as the query vector.
     * <p>Scope defaults to the entity's own repo and project. The entity itself is excluded.</p>
     *
     * @return ranked matches, empty when the entity has no embeddings yet
     */
    public List<EntityMatch> findSimilar(final EEntityType entityType,
                                         final String entityId,
                                         final SearchOptions options) {
        if (hydrate(entityType, entityId).isEmpty()) {
            throw new NotFoundException(entityType.wireName(), entityId);
        }
        final Optional<EmbeddingChunkEntity> head =
                chunkRepository.findById(new EmbeddingChunkId(entityType.wireName(), entityId, 0));
        if (head.isEmpty()) {
            log.debug("{} {} has no embeddings yet", entityType.wireName(), entityId);
            return List.of();
        }

        final SearchOptions base = options == null ? SearchOptions.builder().build() : options;
        final SearchOptions scoped = base.toBuilder()
                .repoId(base.repoId() == null ? head.get().getRepoId() : base.repoId())
                .projectId(base.projectId() == null ? head.get().getProjectId() : base.projectId())
                .build();
        final ResolvedOptions resolved = resolve(scoped);
        return rank(head.get().getVector(), resolved, entityId);
    }

    private List<EntityMatch> rank(final float[] vector, final ResolvedOptions options, final String excludeId) {
        final int k = Math.max(options.topK() * CANDIDATE_FACTOR, MIN_CANDIDATES);
        final Set<String> types = options.entityTypes().stream()
                .map(EEntityType::wireName)
                .collect(Collectors.toSet());

        final List<VectorHit> hits;
        try {
            hits = vectorIndexService.search(vector, new VectorFilter(options.repoId(), options.projectId(), types), k);
        } catch (IOException e) {
            throw new ContextStoreException(EErrorCode.INTERNAL, "Vector search failed", e);
        }

        // best chunk per entity; hits arrive best first
        final Map<String, VectorHit> best = new LinkedHashMap<>();
        for (final VectorHit hit : hits) {
            if (hit.entityId().equals(excludeId) || hit.similarity() < options.minSimilarity()) {
                continue;
            }
            best.putIfAbsent(hit.entityType() + ":" + hit.entityId(), hit);
        }
        log.debug("Search produced {} chunk hits, {} distinct entities above {}",
                hits.size(), best.size(), options.minSimilarity());

        final List<EntityMatch> matches = new ArrayList<>(best.size());
        for (final VectorHit hit : best.values()) {
            toMatch(hit).ifPresent(matches::add);
        }

        matches.sort(Comparator.comparingDouble(EntityMatch::similarity).reversed()
                .thenComparing(EntityMatch::updatedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
        return matches.size() > options.topK() ? new ArrayList<>(matches.subList(0, options.topK())) : matches;
    }

    private Optional<EntityMatch> toMatch(final VectorHit hit) {
        final EEntityType type = EEntityType.fromValue(hit.entityType());
        final Optional<Embeddable> entity = hydrate(type, hit.entityId());
        if (entity.isEmpty()) {
            log.debug("Skipping embedding of missing {} {}", hit.entityType(), hit.entityId());
            return Optional.empty();
        }
        final Optional<EmbeddingChunkEntity> chunk =
                chunkRepository.findById(new EmbeddingChunkId(hit.entityType(), hit.entityId(), hit.chunkIndex()));
        if (chunk.isEmpty()) {
            log.debug("Skipping stale index entry {} {}#{}", hit.entityType(), hit.entityId(), hit.chunkIndex());
            return Optional.empty();
        }

        final EmbeddingChunkEntity c = chunk.get();
        final Embeddable e = entity.get();
        final Instant updatedAt = e.getUpdatedAt();
        return Optional.of(new EntityMatch(
                type,
                e.getId(),
                e.getDisplayName(),
                hit.similarity(),
                hit.projectId() == null ? EProvenance.REPO : EProvenance.PROJECT,
                hit.repoId(),
                hit.projectId(),
                c.getId().getChunkIndex(),
                c.getTotalChunks(),
                c.getChunkStartOffset(),
                c.getChunkEndOffset(),
                excerpt(e, c),
                updatedAt,
                e));
    }

    private Optional<Embeddable> hydrate(final EEntityType type, final String id) {
        if (type == EEntityType.TICKET) {
            return ticketRepository.findById(id).map(Embeddable.class::cast);
        }
        return contextRepositories.findById(type, id).map(Embeddable.class::cast);
    }

    private String excerpt(final Embeddable entity, final EmbeddingChunkEntity chunk) {
        final String text = contentHasher.canonicalText(entity);
        final int start = Math.min(chunk.getChunkStartOffset(), text.length());
        final int end = Math.min(Math.min(chunk.getChunkEndOffset(), text.length()), start + EXCERPT_MAX_CHARS);
        return text.substring(start, end);
    }

    private ResolvedOptions resolve(final SearchOptions options) {
        if (options == null || options.repoId() == null || options.repoId().isBlank()) {
            throw new ValidationException("repoId must not be blank");
        }
        final int topK = options.topK() == null ? defaultTopK : options.topK();
        if (topK < 1) {
            throw new ValidationException("topK must be at least 1", Map.of("topK", topK));
        }
        final double minSimilarity = options.minSimilarity() == null ? defaultMinSimilarity : options.minSimilarity();
        if (Double.isNaN(minSimilarity) || minSimilarity < 0.0 || minSimilarity > 1.0) {
            throw new ValidationException("minSimilarity must be within [0, 1]", Map.of("minSimilarity", minSimilarity));
        }
        final Set<EEntityType> types = options.entityTypes() == null || options.entityTypes().isEmpty()
                ? EEntityType.contextTypes()
                : options.entityTypes();
        return new ResolvedOptions(options.repoId(), options.projectId(), types, topK, minSimilarity);
    }

    private record ResolvedOptions(String repoId,
                                   String projectId,
                                   Set<EEntityType> entityTypes,
                                   int topK,
                                   double minSimilarity) {
    }
}
