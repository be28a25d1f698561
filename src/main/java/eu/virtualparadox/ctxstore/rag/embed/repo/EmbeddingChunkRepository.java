package eu.virtualparadox.ctxstore.rag.embed.repo;

import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkEntity;
import eu.virtualparadox.ctxstore.rag.embed.entity.EmbeddingChunkId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface EmbeddingChunkRepository extends JpaRepository<EmbeddingChunkEntity, EmbeddingChunkId> {

    @Query("select c from EmbeddingChunkEntity c " +
            "where c.id.entityType = :entityType and c.id.entityId = :entityId " +
            "order by c.id.chunkIndex asc")
    List<EmbeddingChunkEntity> findByEntity(@Param("entityType") String entityType,
                                            @Param("entityId") String entityId);

    @Modifying
    @Transactional
    @Query("delete from EmbeddingChunkEntity c where c.id.entityType = :entityType and c.id.entityId = :entityId")
    int deleteByEntity(@Param("entityType") String entityType, @Param("entityId") String entityId);
}
