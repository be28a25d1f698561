package eu.virtualparadox.ctxstore.rag.embed.entity;

import eu.virtualparadox.ctxstore.catalog.converter.FloatArrayConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One embedded chunk of an entity's canonical text. All chunks of an entity share the same
 * {@code contentHash} and are replaced together.
 */
@Entity
@Table(name = "embedding_chunks", indexes = {
        @Index(name = "idx_chunks_repo", columnList = "repo_id"),
        @Index(name = "idx_chunks_entity", columnList = "entity_type,entity_id")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EmbeddingChunkEntity {

    @EmbeddedId
    private EmbeddingChunkId id;

    @Column(name = "repo_id", length = 64, nullable = false)
    private String repoId;

    @Column(name = "project_id", length = 64)
    private String projectId;

    @Column(name = "vector", length = 65536, nullable = false)
    @Convert(converter = FloatArrayConverter.class)
    private float[] vector;

    @Column(name = "embedding_model", length = 128, nullable = false)
    private String embeddingModel;

    @Column(nullable = false)
    private int dimension;

    @Column(name = "content_hash", length = 64, nullable = false)
    private String contentHash;

    @Column(name = "total_chunks", nullable = false)
    private int totalChunks;

    @Column(name = "chunk_start_offset", nullable = false)
    private int chunkStartOffset;

    @Column(name = "chunk_end_offset", nullable = false)
    private int chunkEndOffset;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
