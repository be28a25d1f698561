package eu.virtualparadox.ctxstore.scope.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "projects")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProjectEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "repo_id", length = 64, nullable = false)
    private String repoId;

    @Column(length = 256, nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    /**
     * When false, the project is not allowed to receive project-scoped context writes.
     */
    @Column(name = "inherits_from_repo", nullable = false)
    @Builder.Default
    private boolean inheritsFromRepo = true;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
