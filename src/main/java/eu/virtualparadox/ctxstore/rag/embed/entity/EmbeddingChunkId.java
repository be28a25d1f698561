package eu.virtualparadox.ctxstore.rag.embed.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class EmbeddingChunkId implements Serializable {

    /**
     * Wire name of the owning entity type, see {@link eu.virtualparadox.ctxstore.catalog.EEntityType#wireName()}.
     */
    @Column(name = "entity_type", length = 32, nullable = false)
    private String entityType;

    @Column(name = "entity_id", length = 64, nullable = false)
    private String entityId;

    @Column(name = "chunk_index", nullable = false)
    private int chunkIndex;
}
