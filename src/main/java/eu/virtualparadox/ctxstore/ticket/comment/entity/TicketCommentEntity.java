package eu.virtualparadox.ctxstore.ticket.comment.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Free text note attached to a ticket. Markdown is stored as is.
 */
@Entity
@Table(name = "ticket_comments", indexes = @Index(name = "idx_ticket_comments_ticket", columnList = "ticket_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TicketCommentEntity {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "ticket_id", length = 64, nullable = false)
    private String ticketId;

    @Lob
    @Column(nullable = false)
    private String content;

    @Column(name = "created_by", length = 256)
    private String createdBy;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void prePersist() {
        final Instant now = Instant.now();
        if (createdAt == null) createdAt = now;
        if (updatedAt == null) updatedAt = now;
    }
}
