package eu.virtualparadox.ctxstore.ticket.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial ticket update; {@code null} fields are left unchanged.
 * {@code dependsOn} replaces the whole list and accepts ticket ids or titles.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TicketPatch {
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
