package eu.virtualparadox.ctxstore.state.service;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import eu.virtualparadox.ctxstore.catalog.service.ContextCatalogService;
import eu.virtualparadox.ctxstore.exception.NotFoundException;
import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import eu.virtualparadox.ctxstore.state.model.ProjectState;
import eu.virtualparadox.ctxstore.state.model.ProjectSummary;
import eu.virtualparadox.ctxstore.state.model.RepoState;
import eu.virtualparadox.ctxstore.state.model.TicketStatusCounts;
import eu.virtualparadox.ctxstore.support.ContextStoreTestBase;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import eu.virtualparadox.ctxstore.ticket.model.TicketDraft;
import eu.virtualparadox.ctxstore.ticket.service.TicketService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class StateServiceTest extends ContextStoreTestBase {

    @Autowired
    private StateService stateService;

    @Autowired
    private TicketService ticketService;

    @Autowired
    private ContextCatalogService catalogService;

    private void storeRule(final String projectId, final String name) {
        catalogService.store(EEntityType.BUSINESS_RULE, repo.getId(), projectId,
                ContextFields.builder().name(name).description("rule " + name).build());
    }

    @Test
    void testProjectStateCountsTicketsAndContext() {
        ProjectEntity project = newProject("state");
        ticketService.storeTickets(project.getId(), List.of(
                TicketDraft.builder().title("Done").status("completed").build(),
                TicketDraft.builder().title("Next").dependsOn(List.of("Done")).build(),
                TicketDraft.builder().title("Later").dependsOn(List.of("Next")).build(),
                TicketDraft.builder().title("Doing").status("in-progress").build()));
        storeRule(null, "Repo Rule");
        storeRule(project.getId(), "Project Rule");
        catalogService.store(EEntityType.GLOSSARY_ENTRY, repo.getId(), null,
                ContextFields.builder().term("Tenant").definition("a customer").build());

        ProjectState state = stateService.projectState(project.getId());

        assertThat(state.repoName()).isEqualTo(repo.getName());
        assertThat(state.tickets()).isEqualTo(new TicketStatusCounts(4, 2, 1, 1, 0));
        assertThat(state.progress()).isEqualTo(25);
        assertThat(state.plan().available()).extracting(TicketEntity::getTitle).containsExactly("Next");
        assertThat(state.plan().blocked()).extracting(b -> b.ticket().getTitle()).containsExactly("Later");
        assertThat(state.contextByType())
                .containsEntry(EEntityType.BUSINESS_RULE, 2)
                .containsEntry(EEntityType.GLOSSARY_ENTRY, 1)
                .containsEntry(EEntityType.DOCUMENT, 0);
        assertThat(state.contextTotal()).isEqualTo(3);
    }

    @Test
    void testRepoStateSummarisesProjects() {
        ProjectEntity empty = newProject("empty");
        ProjectEntity half = newProject("half");
        ticketService.storeTickets(half.getId(), List.of(
                TicketDraft.builder().title("A").status("completed").build(),
                TicketDraft.builder().title("B").build()));
        storeRule(null, "Repo Rule");
        storeRule(half.getId(), "Project Rule");

        RepoState state = stateService.repoState(repo.getId());

        assertThat(state.repo().getId()).isEqualTo(repo.getId());
        assertThat(state.projects())
                .extracting(s -> s.project().getId(), ProjectSummary::ticketCount, ProjectSummary::progress)
                .containsExactlyInAnyOrder(
                        tuple(empty.getId(), 0, 0),
                        tuple(half.getId(), 2, 50));
        assertThat(state.contextByType()).containsEntry(EEntityType.BUSINESS_RULE, 1);
        assertThat(state.contextTotal()).isEqualTo(1);
    }

    @Test
    void testUnknownScopes() {
        assertThatThrownBy(() -> stateService.projectState("missing")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> stateService.repoState("missing")).isInstanceOf(NotFoundException.class);
    }
}
