package eu.virtualparadox.ctxstore.catalog.entity;

import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import eu.virtualparadox.ctxstore.ingest.model.Embeddable;
import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PrePersist;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Columns shared by every context entity table, plus the hooks the catalog uses to
 * apply {@link ContextFields} without knowing the concrete type.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class ContextEntity implements Embeddable {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "repo_id", length = 64, nullable = false)
    private String repoId;

    /**
     * {@code null} for repo-level entities.
     */
    @Column(name = "project_id", length = 64)
    private String projectId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * Copies every supplied (non-null) field of {@code fields} that belongs to this type.
     *
     * @param fields supplied values
     * @throws eu.virtualparadox.ctxstore.exception.ValidationException on a malformed enum value
     */
    public abstract void applyFields(ContextFields fields);

    /**
     * @return names of required fields that are missing or blank
     */
    public abstract List<String> missingRequiredFields();

    /**
     * @return the category used for list filtering, may be {@code null}
     */
    public abstract String getCategory();

    /**
     * Marks the entity as modified. Called by the catalog on every accepted update.
     */
    public void touch() {
        this.updatedAt = Instant.now();
    }

    @PrePersist
    void prePersist() {
        final Instant now = Instant.now();
        if (createdAt == null) {
            createdAt = now;
        }
        if (updatedAt == null) {
            updatedAt = now;
        }
    }

    protected static void requireText(final List<String> missing, final String value, final String name) {
        if (value == null || value.isBlank()) {
            missing.add(name);
        }
    }

    protected static List<String> copyOf(final List<String> values) {
        return values == null ? new ArrayList<>() : new ArrayList<>(values);
    }
}
