package eu.virtualparadox.ctxstore.ticket.entity;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.converter.StringListConverter;
import eu.virtualparadox.ctxstore.common.EPriority;
import eu.virtualparadox.ctxstore.ingest.model.Embeddable;
import eu.virtualparadox.ctxstore.ticket.ETicketStatus;
import eu.virtualparadox.ctxstore.ticket.ETicketType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "tickets", indexes = @Index(name = "idx_tickets_project", columnList = "project_id"))
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TicketEntity implements Embeddable {

    @Id
    @Column(length = 64, nullable = false)
    private String id;

    @Column(name = "project_id", length = 64, nullable = false)
    private String projectId;

    @Column(length = 512, nullable = false)
    private String title;

    @Column(length = 8192)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private ETicketStatus status;

    @Enumerated(EnumType.STRING)
    @Column(length = 16, nullable = false)
    private EPriority priority;

    /**
     * Stable tie-break for planning, assigned on creation.
     */
    @Column(name = "order_index", nullable = false)
    private int orderIndex;

    @Enumerated(EnumType.STRING)
    @Column(length = 32, nullable = false)
    private ETicketType type;

    @Column(name = "estimated_time", length = 64)
    private String estimatedTime;

    /**
     * Ids of the tickets this ticket depends on. Always replaced, never edited in place.
     */
    @Column(name = "depends_on", length = 4096, nullable = false)
    @Convert(converter = StringListConverter.class)
    @Builder.Default
    private List<String> dependsOn = new ArrayList<>();

    @Column(name = "validation_criteria", length = 8192)
    @Convert(converter = StringListConverter.class)
    @Builder.Default
    private List<String> validationCriteria = new ArrayList<>();

    @Column(length = 4096)
    @Convert(converter = StringListConverter.class)
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(length = 8192)
    @Convert(converter = StringListConverter.class)
    @Builder.Default
    private List<String> objectives = new ArrayList<>();

    @Column(name = "external_id", length = 256)
    private String externalId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Override
    public EEntityType getEntityType() {
        return EEntityType.TICKET;
    }

    @Override
    public String getDisplayName() {
        return title;
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
        if (status == null) {
            status = ETicketStatus.PENDING;
        }
        if (priority == null) {
            priority = EPriority.MEDIUM;
        }
        if (type == null) {
            type = ETicketType.IMPLEMENTATION;
        }
    }
}
