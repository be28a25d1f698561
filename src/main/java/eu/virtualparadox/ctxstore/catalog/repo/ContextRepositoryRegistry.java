package eu.virtualparadox.ctxstore.catalog.repo;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.entity.BusinessRuleEntity;
import eu.virtualparadox.ctxstore.catalog.entity.ContextEntity;
import eu.virtualparadox.ctxstore.catalog.entity.ConventionEntity;
import eu.virtualparadox.ctxstore.catalog.entity.DocumentEntity;
import eu.virtualparadox.ctxstore.catalog.entity.GlossaryEntryEntity;
import eu.virtualparadox.ctxstore.catalog.entity.PatternEntity;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Dispatches context entity persistence to the repository of the entity's type.
 */
@Component
@RequiredArgsConstructor
public class ContextRepositoryRegistry {

    private final BusinessRuleRepository businessRules;
    private final GlossaryEntryRepository glossaryEntries;
    private final PatternRepository patterns;
    private final ConventionRepository conventions;
    private final DocumentRepository documents;

    /**
     * Creates an empty, unsaved entity of the given context type.
     */
    public ContextEntity newInstance(final EEntityType type) {
        return switch (type) {
            case BUSINESS_RULE -> new BusinessRuleEntity();
            case GLOSSARY_ENTRY -> new GlossaryEntryEntity();
            case PATTERN -> new PatternEntity();
            case CONVENTION -> new ConventionEntity();
            case DOCUMENT -> new DocumentEntity();
            case TICKET -> throw new IllegalArgumentException("Tickets are not context entities");
        };
    }

    public ContextEntity save(final ContextEntity entity) {
        return switch (entity.getEntityType()) {
            case BUSINESS_RULE -> businessRules.save((BusinessRuleEntity) entity);
            case GLOSSARY_ENTRY -> glossaryEntries.save((GlossaryEntryEntity) entity);
            case PATTERN -> patterns.save((PatternEntity) entity);
            case CONVENTION -> conventions.save((ConventionEntity) entity);
            case DOCUMENT -> documents.save((DocumentEntity) entity);
            case TICKET -> throw new IllegalArgumentException("Tickets are not context entities");
        };
    }

    public Optional<ContextEntity> findById(final EEntityType type, final String id) {
        return switch (type) {
            case BUSINESS_RULE -> businessRules.findById(id).map(ContextEntity.class::cast);
            case GLOSSARY_ENTRY -> glossaryEntries.findById(id).map(ContextEntity.class::cast);
            case PATTERN -> patterns.findById(id).map(ContextEntity.class::cast);
            case CONVENTION -> conventions.findById(id).map(ContextEntity.class::cast);
            case DOCUMENT -> documents.findById(id).map(ContextEntity.class::cast);
            case TICKET -> Optional.empty();
        };
    }

    public List<ContextEntity> findByRepoId(final EEntityType type, final String repoId) {
        return switch (type) {
            case BUSINESS_RULE -> new ArrayList<>(businessRules.findByRepoId(repoId));
            case GLOSSARY_ENTRY -> new ArrayList<>(glossaryEntries.findByRepoId(repoId));
            case PATTERN -> new ArrayList<>(patterns.findByRepoId(repoId));
            case CONVENTION -> new ArrayList<>(conventions.findByRepoId(repoId));
            case DOCUMENT -> new ArrayList<>(documents.findByRepoId(repoId));
            case TICKET -> new ArrayList<>();
        };
    }

    public void deleteById(final EEntityType type, final String id) {
        switch (type) {
            case BUSINESS_RULE -> businessRules.deleteById(id);
            case GLOSSARY_ENTRY -> glossaryEntries.deleteById(id);
            case PATTERN -> patterns.deleteById(id);
            case CONVENTION -> conventions.deleteById(id);
            case DOCUMENT -> documents.deleteById(id);
            case TICKET -> throw new IllegalArgumentException("Tickets are not context entities");
        }
    }

    /**
     * Checks the per-repo uniqueness of a business rule name or glossary term.
     *
     * @param excludeId id of the entity being renamed, {@code null} on create
     * @return {@code true} when another entity of the same type already uses the key
     */
    public boolean isDuplicateKey(final EEntityType type,
                                  final String repoId,
                                  final String key,
                                  final String excludeId) {
        return switch (type) {
            case BUSINESS_RULE -> excludeId == null
                    ? businessRules.existsByRepoIdAndName(repoId, key)
                    : businessRules.existsByRepoIdAndNameAndIdNot(repoId, key, excludeId);
            case GLOSSARY_ENTRY -> excludeId == null
                    ? glossaryEntries.existsByRepoIdAndTerm(repoId, key)
                    : glossaryEntries.existsByRepoIdAndTermAndIdNot(repoId, key, excludeId);
            default -> false;
        };
    }
}
