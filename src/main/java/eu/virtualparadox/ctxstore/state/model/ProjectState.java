package eu.virtualparadox.ctxstore.state.model;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import eu.virtualparadox.ctxstore.ticket.planner.ExecutionPlan;

import java.util.Map;

/**
 * Snapshot of a project: ticket counts, progress, the current plan and the context visible to it.
 *
 * @param progress      completed tickets in percent
 * @param contextByType repo-level plus project-level context entities per type
 */
public record ProjectState(ProjectEntity project,
                           String repoName,
                           TicketStatusCounts tickets,
                           int progress,
                           ExecutionPlan plan,
                           Map<EEntityType, Integer> contextByType,
                           int contextTotal) {
}
