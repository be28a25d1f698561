package eu.virtualparadox.ctxstore.ticket.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A ticket to be created as part of a batch. {@code dependsOn} names tickets by title, either
 * other drafts of the same batch or tickets already stored in the project.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketDraft {
    private String title;
    private String description;
    private String status;
    private String priority;
    private String type;
    private String estimatedTime;
    private List<String> dependsOn;
    private List<String> validationCriteria;
    private List<String> tags;
    private List<String> objectives;
    private String externalId;
}
