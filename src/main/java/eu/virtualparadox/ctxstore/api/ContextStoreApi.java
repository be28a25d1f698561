package eu.virtualparadox.ctxstore.api;

import eu.virtualparadox.ctxstore.api.model.ContextScope;
import eu.virtualparadox.ctxstore.api.model.DeleteContextResult;
import eu.virtualparadox.ctxstore.api.model.OperationResult;
import eu.virtualparadox.ctxstore.api.model.QueryFilters;
import eu.virtualparadox.ctxstore.api.model.StoreContextResult;
import eu.virtualparadox.ctxstore.api.model.UpdateContextResult;
import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.entity.ContextEntity;
import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import eu.virtualparadox.ctxstore.catalog.model.ContextWriteResult;
import eu.virtualparadox.ctxstore.catalog.service.ContextCatalogService;
import eu.virtualparadox.ctxstore.exception.ContextStoreException;
import eu.virtualparadox.ctxstore.exception.ErrorDetails;
import eu.virtualparadox.ctxstore.exception.ValidationException;
import eu.virtualparadox.ctxstore.rag.retriever.model.EntityMatch;
import eu.virtualparadox.ctxstore.rag.retriever.model.SearchOptions;
import eu.virtualparadox.ctxstore.rag.retriever.service.SemanticSearchService;
import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import eu.virtualparadox.ctxstore.scope.entity.RepoEntity;
import eu.virtualparadox.ctxstore.scope.service.ScopeService;
import eu.virtualparadox.ctxstore.state.model.ProjectState;
import eu.virtualparadox.ctxstore.state.model.RepoState;
import eu.virtualparadox.ctxstore.state.service.StateService;
import eu.virtualparadox.ctxstore.ticket.comment.entity.TicketCommentEntity;
import eu.virtualparadox.ctxstore.ticket.comment.model.CommentPage;
import eu.virtualparadox.ctxstore.ticket.comment.model.CommentQuery;
import eu.virtualparadox.ctxstore.ticket.comment.service.TicketCommentService;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import eu.virtualparadox.ctxstore.ticket.model.DeleteTicketResult;
import eu.virtualparadox.ctxstore.ticket.model.TicketDraft;
import eu.virtualparadox.ctxstore.ticket.model.TicketPatch;
import eu.virtualparadox.ctxstore.ticket.model.TicketRef;
import eu.virtualparadox.ctxstore.ticket.planner.ExecutionPlan;
import eu.virtualparadox.ctxstore.ticket.planner.PlanOptions;
import eu.virtualparadox.ctxstore.ticket.service.TicketService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Entry point for the external RPC layer. Every operation returns an {@link OperationResult};
 * domain errors are reported as {@link ErrorDetails} and never thrown.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ContextStoreApi {

    private final ContextCatalogService catalogService;
    private final SemanticSearchService searchService;
    private final TicketService ticketService;
    private final ScopeService scopeService;
    private final TicketCommentService commentService;
    private final StateService stateService;

    // ---------- scope ----------

    public OperationResult<RepoEntity> createRepo(final String name, final String description) {
        return run("createRepo", () -> scopeService.createRepo(name, description));
    }

    public OperationResult<ProjectEntity> createProject(final String repoId,
                                                        final String name,
                                                        final String description,
                                                        final Boolean inheritsFromRepo) {
        return run("createProject", () -> scopeService.createProject(repoId, name, description, inheritsFromRepo));
    }

    public OperationResult<ProjectEntity> updateProjectInheritance(final String projectId, final boolean inheritsFromRepo) {
        return run("updateProjectInheritance", () -> scopeService.setInheritance(projectId, inheritsFromRepo));
    }

    // ---------- context ----------

    public OperationResult<StoreContextResult> storeContext(final String type,
                                                            final ContextScope scope,
                                                            final ContextFields fields) {
        return run("storeContext", () -> {
            requireScope(scope);
            final ContextWriteResult result = catalogService.store(
                    EEntityType.contextFromValue(type), scope.repoId(), scope.projectId(), fields);
            return new StoreContextResult(result.entity().getId(), result.syncOutcome().resynced());
        });
    }

    public OperationResult<UpdateContextResult> updateContext(final String type,
                                                              final String id,
                                                              final ContextFields fields) {
        return run("updateContext", () -> {
            final ContextWriteResult result = catalogService.update(EEntityType.contextFromValue(type), id, fields);
            return new UpdateContextResult(true, result.syncOutcome().resynced());
        });
    }

    public OperationResult<DeleteContextResult> deleteContext(final String type, final String id) {
        return run("deleteContext",
                () -> new DeleteContextResult(catalogService.delete(EEntityType.contextFromValue(type), id)));
    }

    public OperationResult<ContextEntity> getContext(final String type, final String id) {
        return run("getContext", () -> catalogService.get(EEntityType.contextFromValue(type), id));
    }

    public OperationResult<List<ContextEntity>> listContext(final String type,
                                                            final ContextScope scope,
                                                            final String category) {
        return run("listContext", () -> {
            requireScope(scope);
            return catalogService.list(EEntityType.contextFromValue(type), scope.repoId(), scope.projectId(), category);
        });
    }

    public OperationResult<List<EntityMatch>> queryContext(final String query,
                                                           final ContextScope scope,
                                                           final QueryFilters filters) {
        return run("queryContext", () -> {
            requireScope(scope);
            return searchService.search(query, toOptions(scope, filters));
        });
    }

    public OperationResult<List<EntityMatch>> findSimilarContext(final String type,
                                                                 final String id,
                                                                 final QueryFilters filters) {
        return run("findSimilarContext",
                () -> searchService.findSimilar(EEntityType.contextFromValue(type), id, toOptions(null, filters)));
    }

    // ---------- tickets ----------

    public OperationResult<List<TicketEntity>> storeTickets(final String projectId, final List<TicketDraft> drafts) {
        return run("storeTickets", () -> ticketService.storeTickets(projectId, drafts));
    }

    public OperationResult<TicketEntity> updateTicket(final String projectId,
                                                      final TicketRef ref,
                                                      final TicketPatch patch) {
        return run("updateTicket", () -> ticketService.updateTicket(projectId, ref, patch));
    }

    public OperationResult<DeleteTicketResult> deleteTicket(final String projectId,
                                                            final TicketRef ref,
                                                            final boolean force) {
        return run("deleteTicket", () -> ticketService.deleteTicket(projectId, ref, force));
    }

    public OperationResult<ExecutionPlan> getExecutionPlan(final String projectId) {
        return getExecutionPlan(projectId, PlanOptions.defaults());
    }

    public OperationResult<ExecutionPlan> getExecutionPlan(final String projectId, final PlanOptions options) {
        return run("getExecutionPlan", () -> ticketService.getExecutionPlan(projectId, options));
    }

    public OperationResult<List<TicketEntity>> listTickets(final String projectId, final String status) {
        return run("listTickets", () -> ticketService.listTickets(projectId, status));
    }

    public OperationResult<List<EntityMatch>> searchTickets(final String projectId,
                                                            final String query,
                                                            final Integer topK,
                                                            final Double minSimilarity) {
        return run("searchTickets", () -> ticketService.searchTickets(projectId, query, topK, minSimilarity));
    }

    public OperationResult<TicketCommentEntity> createTicketComment(final String ticketId,
                                                                    final String content,
                                                                    final String createdBy) {
        return run("createTicketComment", () -> commentService.create(ticketId, content, createdBy));
    }

    public OperationResult<CommentPage> listTicketComments(final String ticketId, final CommentQuery query) {
        return run("listTicketComments", () -> commentService.list(ticketId, query));
    }

    public OperationResult<TicketCommentEntity> updateTicketComment(final String commentId, final String content) {
        return run("updateTicketComment", () -> commentService.update(commentId, content));
    }

    // ---------- state ----------

    public OperationResult<ProjectState> getProjectState(final String projectId) {
        return run("getProjectState", () -> stateService.projectState(projectId));
    }

    public OperationResult<RepoState> getRepoState(final String repoId) {
        return run("getRepoState", () -> stateService.repoState(repoId));
    }

    // ---------- helpers ----------

    private SearchOptions toOptions(final ContextScope scope, final QueryFilters filters) {
        final QueryFilters f = filters == null ? QueryFilters.defaults() : filters;
        final Set<EEntityType> types = f.entityTypes() == null ? null : f.entityTypes().stream()
                .map(EEntityType::contextFromValue)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        return SearchOptions.builder()
                .repoId(scope == null ? null : scope.repoId())
                .projectId(scope == null ? null : scope.projectId())
                .entityTypes(types)
                .topK(f.topK())
                .minSimilarity(f.minSimilarity())
                .build();
    }

    private static void requireScope(final ContextScope scope) {
        if (scope == null) {
            throw new ValidationException("scope must not be null");
        }
    }

    private <T> OperationResult<T> run(final String operation, final Supplier<T> action) {
        try {
            return OperationResult.success(action.get());
        } catch (ContextStoreException e) {
            log.info("{} rejected: {}", operation, e.toString());
            return OperationResult.failure(ErrorDetails.of(e));
        } catch (RuntimeException e) {
            log.error("{} failed", operation, e);
            return OperationResult.failure(ErrorDetails.internal(e));
        }
    }
}
