package eu.virtualparadox.ctxstore.ticket.service;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.common.EPriority;
import eu.virtualparadox.ctxstore.exception.ConflictException;
import eu.virtualparadox.ctxstore.exception.DependencyCycleException;
import eu.virtualparadox.ctxstore.exception.NotFoundException;
import eu.virtualparadox.ctxstore.exception.SelfDependencyException;
import eu.virtualparadox.ctxstore.exception.ValidationException;
import eu.virtualparadox.ctxstore.ingest.lifecycle.EmbeddingLifecycleManager;
import eu.virtualparadox.ctxstore.rag.retriever.model.EntityMatch;
import eu.virtualparadox.ctxstore.rag.retriever.model.SearchOptions;
import eu.virtualparadox.ctxstore.rag.retriever.service.SemanticSearchService;
import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import eu.virtualparadox.ctxstore.scope.service.ScopeService;
import eu.virtualparadox.ctxstore.ticket.ETicketStatus;
import eu.virtualparadox.ctxstore.ticket.ETicketType;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import eu.virtualparadox.ctxstore.ticket.graph.CycleDetector;
import eu.virtualparadox.ctxstore.ticket.graph.DependencyGraph;
import eu.virtualparadox.ctxstore.ticket.graph.DependencyGraphBuilder;
import eu.virtualparadox.ctxstore.ticket.model.DeleteTicketResult;
import eu.virtualparadox.ctxstore.ticket.model.TicketDraft;
import eu.virtualparadox.ctxstore.ticket.model.TicketPatch;
import eu.virtualparadox.ctxstore.ticket.model.TicketRef;
import eu.virtualparadox.ctxstore.ticket.planner.ExecutionPlan;
import eu.virtualparadox.ctxstore.ticket.planner.ExecutionPlanner;
import eu.virtualparadox.ctxstore.ticket.planner.PlanOptions;
import eu.virtualparadox.ctxstore.ticket.repo.TicketRepository;
import eu.virtualparadox.ctxstore.util.Ids;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ticket lifecycle: batch creation with dependency validation, partial updates, deletion with
 * dependent rewriting, execution planning and semantic ticket search.
 * <p>All validation happens before the first write, so a rejected batch or update leaves the store unchanged.</p>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TicketService {

    private final TicketRepository repository;
    private final TicketPersistenceService persistence;
    private final DependencyGraphBuilder graphBuilder;
    private final CycleDetector cycleDetector;
    private final ExecutionPlanner planner;
    private final EmbeddingLifecycleManager lifecycleManager;
    private final SemanticSearchService searchService;
    private final ScopeService scopeService;

    /**
     * Creates a batch of tickets. Dependencies are given by title and may point forward within the batch.
     *
     * @param projectId owning project
     * @param drafts    tickets to create, in creation order
     * @return created tickets in draft order
     * @throws SelfDependencyException  if a draft names itself
     * @throws DependencyCycleException if the dependencies would form a cycle; nothing is persisted
     */
    public List<TicketEntity> storeTickets(final String projectId, final List<TicketDraft> drafts) {
        final ProjectEntity project = scopeService.requireProject(projectId);
        if (drafts == null || drafts.isEmpty()) {
            throw new ValidationException("At least one ticket is required");
        }

        final List<TicketEntity> existing = repository.findByProjectIdOrderByOrderIndexAsc(projectId);
        final Map<String, TicketEntity> existingByTitle = new HashMap<>();
        existing.forEach(t -> existingByTitle.put(t.getTitle(), t));

        // titles and self dependencies
        final Set<String> batchTitles = new HashSet<>();
        for (final TicketDraft d : drafts) {
            final String title = requireTitle(d.getTitle());
            if (!batchTitles.add(title) || existingByTitle.containsKey(title)) {
                throw ConflictException.alreadyExists("ticket", "title", title);
            }
        }
        for (final TicketDraft d : drafts) {
            if (d.getDependsOn() != null && d.getDependsOn().contains(d.getTitle())) {
                throw new SelfDependencyException(d.getTitle());
            }
        }

        // dependency names must resolve
        for (final TicketDraft d : drafts) {
            for (final String dep : nullSafe(d.getDependsOn())) {
                if (!batchTitles.contains(dep) && !existingByTitle.containsKey(dep)) {
                    throw new ValidationException("Unknown dependency '" + dep + "' of ticket '" + d.getTitle() + "'",
                            Map.of("ticket", d.getTitle(), "dependency", dep));
                }
            }
        }

        // cycles over the stored tickets plus the batch, by title
        final Map<String, String> titleById = new HashMap<>();
        existing.forEach(t -> titleById.put(t.getId(), t.getTitle()));
        final Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (final TicketEntity t : existing) {
            adjacency.put(t.getTitle(), t.getDependsOn().stream()
                    .filter(titleById::containsKey)
                    .map(titleById::get)
                    .toList());
        }
        for (final TicketDraft d : drafts) {
            adjacency.put(d.getTitle(), List.copyOf(new LinkedHashSet<>(nullSafe(d.getDependsOn()))));
        }
        final List<List<String>> cycles = cycleDetector.findCycles(adjacency);
        if (!cycles.isEmpty()) {
            throw new DependencyCycleException(cycles);
        }

        // pass 1: ids, fields and order
        final int baseOrder = repository.findMaxOrder(projectId);
        final Map<String, String> idByTitle = new HashMap<>();
        existing.forEach(t -> idByTitle.put(t.getTitle(), t.getId()));
        final List<TicketEntity> created = new ArrayList<>(drafts.size());
        final Instant now = Instant.now();
        for (int i = 0; i < drafts.size(); i++) {
            final TicketDraft d = drafts.get(i);
            final ETicketStatus status = d.getStatus() == null ? ETicketStatus.PENDING : ETicketStatus.fromValue(d.getStatus());
            final TicketEntity ticket = TicketEntity.builder()
                    .id(Ids.newId())
                    .projectId(projectId)
                    .title(d.getTitle())
                    .description(d.getDescription())
                    .status(status)
                    .priority(d.getPriority() == null ? EPriority.MEDIUM : EPriority.fromValue(d.getPriority()))
                    .type(d.getType() == null ? ETicketType.IMPLEMENTATION : ETicketType.fromValue(d.getType()))
                    .orderIndex(baseOrder + 1 + i)
                    .estimatedTime(d.getEstimatedTime())
                    .validationCriteria(new ArrayList<>(nullSafe(d.getValidationCriteria())))
                    .tags(new ArrayList<>(nullSafe(d.getTags())))
                    .objectives(new ArrayList<>(nullSafe(d.getObjectives())))
                    .externalId(d.getExternalId())
                    .createdAt(now)
                    .updatedAt(now)
                    .completedAt(status == ETicketStatus.COMPLETED ? now : null)
                    .build();
            idByTitle.put(ticket.getTitle(), ticket.getId());
            created.add(ticket);
        }

        // pass 2: titles to ids
        for (int i = 0; i < drafts.size(); i++) {
            final List<String> ids = new ArrayList<>();
            for (final String dep : new LinkedHashSet<>(nullSafe(drafts.get(i).getDependsOn()))) {
                ids.add(idByTitle.get(dep));
            }
            created.get(i).setDependsOn(ids);
        }

        final List<TicketEntity> saved = persistence.saveBatch(created);
        log.info("Stored {} ticket(s) in project {}", saved.size(), projectId);

        for (final TicketEntity t : saved) {
            lifecycleManager.sync(t, project.getRepoId(), projectId);
        }
        return saved;
    }

    /**
     * Applies a partial update to a ticket. A new dependency list is validated like a batch.
     *
     * @throws SelfDependencyException  if the new dependencies include the ticket itself
     * @throws DependencyCycleException if the new dependencies would close a cycle
     */
    public TicketEntity updateTicket(final String projectId, final TicketRef ref, final TicketPatch patch) {
        final ProjectEntity project = scopeService.requireProject(projectId);
        final TicketEntity ticket = resolve(projectId, ref);
        final List<TicketEntity> all = repository.findByProjectIdOrderByOrderIndexAsc(projectId);

        if (patch.getTitle() != null) {
            final String title = requireTitle(patch.getTitle());
            if (!title.equals(ticket.getTitle())
                    && all.stream().anyMatch(t -> t.getTitle().equals(title))) {
                throw ConflictException.alreadyExists("ticket", "title", title);
            }
        }
        final ETicketStatus status = patch.getStatus() == null ? null : ETicketStatus.fromValue(patch.getStatus());
        final EPriority priority = patch.getPriority() == null ? null : EPriority.fromValue(patch.getPriority());
        final ETicketType type = patch.getType() == null ? null : ETicketType.fromValue(patch.getType());

        List<String> dependsOn = null;
        if (patch.getDependsOn() != null) {
            dependsOn = resolveDependencies(ticket, patch.getDependsOn(), all);
            checkCycles(ticket, dependsOn, all);
        }

        if (patch.getTitle() != null) ticket.setTitle(patch.getTitle());
        if (patch.getDescription() != null) ticket.setDescription(patch.getDescription());
        if (priority != null) ticket.setPriority(priority);
        if (type != null) ticket.setType(type);
        if (patch.getEstimatedTime() != null) ticket.setEstimatedTime(patch.getEstimatedTime());
        if (dependsOn != null) ticket.setDependsOn(dependsOn);
        if (patch.getValidationCriteria() != null) ticket.setValidationCriteria(new ArrayList<>(patch.getValidationCriteria()));
        if (patch.getTags() != null) ticket.setTags(new ArrayList<>(patch.getTags()));
        if (patch.getObjectives() != null) ticket.setObjectives(new ArrayList<>(patch.getObjectives()));
        if (patch.getExternalId() != null) ticket.setExternalId(patch.getExternalId());

        final Instant now = Instant.now();
        if (status != null && status != ticket.getStatus()) {
            ticket.setCompletedAt(status == ETicketStatus.COMPLETED ? now : null);
            ticket.setStatus(status);
        }
        ticket.setUpdatedAt(now);

        final TicketEntity saved = persistence.save(ticket);
        log.info("Updated ticket {} ({}) in project {}", saved.getTitle(), saved.getId(), projectId);

        lifecycleManager.sync(saved, project.getRepoId(), projectId);
        return saved;
    }

    /**
     * Deletes a ticket and drops its id from the dependency list of every other ticket.
     * Without {@code force}, existing dependents are reported at WARN before the deletion goes ahead.
     */
    public DeleteTicketResult deleteTicket(final String projectId, final TicketRef ref, final boolean force) {
        scopeService.requireProject(projectId);
        final TicketEntity ticket = resolve(projectId, ref);
        final List<TicketEntity> dependents = repository.findByProjectIdOrderByOrderIndexAsc(projectId).stream()
                .filter(t -> t.getDependsOn().contains(ticket.getId()))
                .toList();

        if (!dependents.isEmpty() && !force) {
            log.warn("Ticket '{}' has {} dependent(s): {}; their dependency lists will be rewritten",
                    ticket.getTitle(), dependents.size(),
                    dependents.stream().map(TicketEntity::getTitle).toList());
        }

        lifecycleManager.remove(EEntityType.TICKET, ticket.getId());
        persistence.deleteAndRewrite(ticket, dependents);

        final List<String> rewritten = dependents.stream().map(TicketEntity::getId).toList();
        log.info("Deleted ticket {} ({}), rewrote {} dependent(s)", ticket.getTitle(), ticket.getId(), rewritten.size());
        return new DeleteTicketResult(true, rewritten);
    }

    public ExecutionPlan getExecutionPlan(final String projectId, final PlanOptions options) {
        scopeService.requireProject(projectId);
        final List<TicketEntity> tickets = repository.findByProjectIdOrderByOrderIndexAsc(projectId);
        final DependencyGraph graph = graphBuilder.build(tickets);
        return planner.plan(tickets, graph, options == null ? PlanOptions.defaults() : options);
    }

    public TicketEntity getTicket(final String projectId, final TicketRef ref) {
        scopeService.requireProject(projectId);
        return resolve(projectId, ref);
    }

    /**
     * @param status optional status filter
     * @return tickets in creation order
     */
    public List<TicketEntity> listTickets(final String projectId, final String status) {
        scopeService.requireProject(projectId);
        final ETicketStatus filter = status == null ? null : ETicketStatus.fromValue(status);
        return repository.findByProjectIdOrderByOrderIndexAsc(projectId).stream()
                .filter(t -> filter == null || t.getStatus() == filter)
                .toList();
    }

    public List<EntityMatch> searchTickets(final String projectId,
                                           final String query,
                                           final Integer topK,
                                           final Double minSimilarity) {
        final ProjectEntity project = scopeService.requireProject(projectId);
        return searchService.search(query, SearchOptions.builder()
                .repoId(project.getRepoId())
                .projectId(projectId)
                .entityTypes(Set.of(EEntityType.TICKET))
                .topK(topK)
                .minSimilarity(minSimilarity)
                .build());
    }

    private TicketEntity resolve(final String projectId, final TicketRef ref) {
        if (ref == null || (ref.id() == null && ref.title() == null)) {
            throw new ValidationException("A ticket id or title is required");
        }
        if (ref.id() != null) {
            return repository.findByProjectIdAndId(projectId, ref.id())
                    .orElseThrow(() -> new NotFoundException("ticket", ref.id()));
        }
        return repository.findByProjectIdAndTitle(projectId, ref.title())
                .orElseThrow(() -> new NotFoundException("ticket", ref.title()));
    }

    /**
     * Resolves dependency references by id first, then by title.
     */
    private List<String> resolveDependencies(final TicketEntity ticket,
                                             final List<String> refs,
                                             final List<TicketEntity> all) {
        final Map<String, String> idByTitle = new HashMap<>();
        final Set<String> ids = new HashSet<>();
        for (final TicketEntity t : all) {
            idByTitle.put(t.getTitle(), t.getId());
            ids.add(t.getId());
        }

        final LinkedHashSet<String> resolved = new LinkedHashSet<>();
        for (final String ref : refs) {
            final String id = ids.contains(ref) ? ref : idByTitle.get(ref);
            if (id == null) {
                throw new ValidationException("Unknown dependency '" + ref + "' of ticket '" + ticket.getTitle() + "'",
                        Map.of("ticket", ticket.getTitle(), "dependency", ref));
            }
            if (id.equals(ticket.getId())) {
                throw new SelfDependencyException(ticket.getTitle());
            }
            resolved.add(id);
        }
        return new ArrayList<>(resolved);
    }

    private void checkCycles(final TicketEntity ticket, final List<String> dependsOn, final List<TicketEntity> all) {
        final Map<String, String> titleById = new HashMap<>();
        all.forEach(t -> titleById.put(t.getId(), t.getTitle()));

        final Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (final TicketEntity t : all) {
            final List<String> deps = t.getId().equals(ticket.getId()) ? dependsOn : t.getDependsOn();
            adjacency.put(t.getId(), deps.stream().filter(titleById::containsKey).toList());
        }

        final List<List<String>> cycles = cycleDetector.findCycles(adjacency);
        if (!cycles.isEmpty()) {
            throw new DependencyCycleException(cycles.stream()
                    .map(c -> c.stream().map(titleById::get).toList())
                    .toList());
        }
    }

    private static String requireTitle(final String title) {
        if (title == null || title.isBlank()) {
            throw new ValidationException("Ticket title must not be blank");
        }
        return title;
    }

    private static List<String> nullSafe(final List<String> values) {
        return values == null ? List.of() : values;
    }
}
