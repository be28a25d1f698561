package eu.virtualparadox.ctxstore.ticket.repo;

import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TicketRepository extends JpaRepository<TicketEntity, String> {

    List<TicketEntity> findByProjectIdOrderByOrderIndexAsc(String projectId);

    Optional<TicketEntity> findByProjectIdAndTitle(String projectId, String title);

    Optional<TicketEntity> findByProjectIdAndId(String projectId, String id);

    @Query("select coalesce(max(t.orderIndex), 0) from TicketEntity t where t.projectId = :projectId")
    int findMaxOrder(@Param("projectId") String projectId);
}
