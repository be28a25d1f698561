package eu.virtualparadox.ctxstore.state.service;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.service.ContextCatalogService;
import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import eu.virtualparadox.ctxstore.scope.entity.RepoEntity;
import eu.virtualparadox.ctxstore.scope.service.ScopeService;
import eu.virtualparadox.ctxstore.state.model.ProjectState;
import eu.virtualparadox.ctxstore.state.model.ProjectSummary;
import eu.virtualparadox.ctxstore.state.model.RepoState;
import eu.virtualparadox.ctxstore.state.model.TicketStatusCounts;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import eu.virtualparadox.ctxstore.ticket.planner.ExecutionPlan;
import eu.virtualparadox.ctxstore.ticket.planner.PlanOptions;
import eu.virtualparadox.ctxstore.ticket.service.TicketService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only summaries of repos and projects.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StateService {

    private final ScopeService scopeService;
    private final TicketService ticketService;
    private final ContextCatalogService catalogService;

    public ProjectState projectState(final String projectId) {
        final ProjectEntity project = scopeService.requireProject(projectId);
        final RepoEntity repo = scopeService.requireRepo(project.getRepoId());

        final List<TicketEntity> tickets = ticketService.listTickets(projectId, null);
        final TicketStatusCounts counts = TicketStatusCounts.of(tickets);
        final ExecutionPlan plan = ticketService.getExecutionPlan(projectId, PlanOptions.defaults());
        final Map<EEntityType, Integer> context = countContext(repo.getId(), projectId);

        log.debug("State of project {}: {} ticket(s), {}% done", projectId, counts.total(), counts.progress());
        return new ProjectState(project, repo.getName(), counts, counts.progress(), plan, context, sum(context));
    }

    public RepoState repoState(final String repoId) {
        final RepoEntity repo = scopeService.requireRepo(repoId);

        final List<ProjectSummary> projects = scopeService.listProjects(repoId).stream()
                .sorted(Comparator.comparing(ProjectEntity::getCreatedAt).reversed())
                .map(p -> {
                    final TicketStatusCounts counts = TicketStatusCounts.of(ticketService.listTickets(p.getId(), null));
                    return new ProjectSummary(p, counts.total(), counts.progress());
                })
                .toList();
        final Map<EEntityType, Integer> context = countContext(repoId, null);

        return new RepoState(repo, projects, context, sum(context));
    }

    private Map<EEntityType, Integer> countContext(final String repoId, final String projectId) {
        final Map<EEntityType, Integer> counts = new EnumMap<>(EEntityType.class);
        for (final EEntityType type : EEntityType.contextTypes()) {
            counts.put(type, catalogService.list(type, repoId, projectId, null).size());
        }
        return Collections.unmodifiableMap(counts);
    }

    private static int sum(final Map<EEntityType, Integer> counts) {
        return counts.values().stream().mapToInt(Integer::intValue).sum();
    }
}
