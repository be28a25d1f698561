package eu.virtualparadox.ctxstore.state.model;

import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;

public record ProjectSummary(ProjectEntity project, int ticketCount, int progress) {
}
