package eu.virtualparadox.ctxstore.scope.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "repos")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RepoEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(length = 256, nullable = false)
    private String name;

    @Column(length = 2048)
    private String description;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
