package eu.virtualparadox.ctxstore.catalog.service;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.entity.ContextEntity;
import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import eu.virtualparadox.ctxstore.catalog.model.ContextWriteResult;
import eu.virtualparadox.ctxstore.catalog.repo.ContextRepositoryRegistry;
import eu.virtualparadox.ctxstore.exception.ConflictException;
import eu.virtualparadox.ctxstore.exception.NotFoundException;
import eu.virtualparadox.ctxstore.exception.ValidationException;
import eu.virtualparadox.ctxstore.ingest.lifecycle.ESyncOutcome;
import eu.virtualparadox.ctxstore.ingest.lifecycle.EmbeddingLifecycleManager;
import eu.virtualparadox.ctxstore.scope.service.ScopeService;
import eu.virtualparadox.ctxstore.util.Ids;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Service layer responsible for the context entity catalog.
 * <p>
 * Responsibilities:
 * <ul>
 *     <li>Validating required fields, enum values and the target scope</li>
 *     <li>Enforcing per-repo uniqueness of business rule names and glossary terms</li>
 *     <li>Persisting entities and keeping their embeddings in sync</li>
 * </ul>
 *
 * <p>Writes are not wrapped in one transaction with the embedding sync: the entity row is
 * committed first and an embedding failure only degrades the write.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ContextCatalogService {

    private final ContextRepositoryRegistry repositories;
    private final EmbeddingLifecycleManager lifecycleManager;
    private final ScopeService scopeService;

    /**
     * Stores a new context entity and embeds it.
     *
     * @param type      context type
     * @param repoId    owning repo
     * @param projectId optional owning project
     * @param fields    field values; required fields of {@code type} must be present
     * @return persisted entity and sync outcome
     */
    public ContextWriteResult store(final EEntityType type,
                                    final String repoId,
                                    final String projectId,
                                    final ContextFields fields) {
        requireContextType(type);
        Objects.requireNonNull(fields, "fields");
        scopeService.checkWriteScope(repoId, projectId);

        final ContextEntity entity = repositories.newInstance(type);
        entity.applyFields(fields);
        requireComplete(entity);

        if (repositories.isDuplicateKey(type, repoId, entity.getDisplayName(), null)) {
            throw ConflictException.alreadyExists(type.wireName(), keyField(type), entity.getDisplayName());
        }

        entity.setId(Ids.newId());
        entity.setRepoId(repoId);
        entity.setProjectId(projectId);
        final ContextEntity saved = repositories.save(entity);
        log.info("Stored {} {} in repo {}{}", type.wireName(), saved.getId(), repoId,
                projectId == null ? "" : " / project " + projectId);

        final ESyncOutcome outcome = lifecycleManager.sync(saved, repoId, projectId);
        return new ContextWriteResult(saved, outcome);
    }

    /**
     * Applies a partial update. Only supplied fields change; the embeddings are re-synced afterwards.
     *
     * @return updated entity and sync outcome
     */
    public ContextWriteResult update(final EEntityType type, final String id, final ContextFields fields) {
        requireContextType(type);
        Objects.requireNonNull(fields, "fields");
        final ContextEntity entity = get(type, id);
        final String previousKey = entity.getDisplayName();

        entity.applyFields(fields);
        requireComplete(entity);

        if (!Objects.equals(previousKey, entity.getDisplayName())
                && repositories.isDuplicateKey(type, entity.getRepoId(), entity.getDisplayName(), id)) {
            throw ConflictException.alreadyExists(type.wireName(), keyField(type), entity.getDisplayName());
        }

        entity.touch();
        final ContextEntity saved = repositories.save(entity);
        log.info("Updated {} {}", type.wireName(), id);

        final ESyncOutcome outcome = lifecycleManager.sync(saved, saved.getRepoId(), saved.getProjectId());
        return new ContextWriteResult(saved, outcome);
    }

    /**
     * Deletes an entity and all of its embedding chunks.
     *
     * @return {@code false} if no entity with this id existed
     */
    public boolean delete(final EEntityType type, final String id) {
        requireContextType(type);
        final Optional<ContextEntity> existing = repositories.findById(type, id);

        // chunk cleanup runs first, also for orphans of an already deleted entity
        lifecycleManager.remove(type, id);

        if (existing.isEmpty()) {
            log.debug("Nothing to delete for {} {}", type.wireName(), id);
            return false;
        }
        repositories.deleteById(type, id);
        log.info("Deleted {} {}", type.wireName(), id);
        return true;
    }

    public ContextEntity get(final EEntityType type, final String id) {
        requireContextType(type);
        if (id == null || id.isBlank()) {
            throw new ValidationException("id must not be blank");
        }
        return repositories.findById(type, id)
                .orElseThrow(() -> new NotFoundException(type.wireName(), id));
    }

    /**
     * Lists entities of a type. Without a project only repo-level entities are listed; with one,
     * the repo-level entities plus the project's.
     *
     * @param category optional exact category filter (document type for documents)
     */
    public List<ContextEntity> list(final EEntityType type,
                                    final String repoId,
                                    final String projectId,
                                    final String category) {
        requireContextType(type);
        scopeService.checkReadScope(repoId, projectId);
        return repositories.findByRepoId(type, repoId).stream()
                .filter(e -> e.getProjectId() == null || e.getProjectId().equals(projectId))
                .filter(e -> category == null || category.equals(e.getCategory()))
                .toList();
    }

    private static void requireContextType(final EEntityType type) {
        if (type == null || !type.isContext()) {
            throw new ValidationException("Not a context entity type: " + type);
        }
    }

    private static void requireComplete(final ContextEntity entity) {
        final List<String> missing = entity.missingRequiredFields();
        if (!missing.isEmpty()) {
            throw new ValidationException("Missing required fields for " + entity.getEntityType().wireName()
                    + ": " + String.join(", ", missing), Map.of("fields", missing));
        }
    }

    private static String keyField(final EEntityType type) {
        return type == EEntityType.GLOSSARY_ENTRY ? "term" : "name";
    }
}
