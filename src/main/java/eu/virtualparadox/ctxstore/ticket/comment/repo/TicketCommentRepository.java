package eu.virtualparadox.ctxstore.ticket.comment.repo;

import eu.virtualparadox.ctxstore.ticket.comment.entity.TicketCommentEntity;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

public interface TicketCommentRepository extends JpaRepository<TicketCommentEntity, String> {

    List<TicketCommentEntity> findByTicketId(String ticketId, Sort sort);

    long countByTicketId(String ticketId);

    @Modifying
    @Transactional
    @Query("delete from TicketCommentEntity c where c.ticketId = :ticketId")
    int deleteByTicketId(@Param("ticketId") String ticketId);
}
