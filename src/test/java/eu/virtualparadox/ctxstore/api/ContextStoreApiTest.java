package eu.virtualparadox.ctxstore.api;

import eu.virtualparadox.ctxstore.api.model.ContextScope;
import eu.virtualparadox.ctxstore.api.model.DeleteContextResult;
import eu.virtualparadox.ctxstore.api.model.OperationResult;
import eu.virtualparadox.ctxstore.api.model.QueryFilters;
import eu.virtualparadox.ctxstore.api.model.StoreContextResult;
import eu.virtualparadox.ctxstore.api.model.UpdateContextResult;
import eu.virtualparadox.ctxstore.catalog.entity.ContextEntity;
import eu.virtualparadox.ctxstore.catalog.model.ContextFields;
import eu.virtualparadox.ctxstore.exception.EErrorCode;
import eu.virtualparadox.ctxstore.rag.retriever.model.EntityMatch;
import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import eu.virtualparadox.ctxstore.support.ContextStoreTestBase;
import eu.virtualparadox.ctxstore.state.model.ProjectState;
import eu.virtualparadox.ctxstore.ticket.comment.entity.TicketCommentEntity;
import eu.virtualparadox.ctxstore.ticket.comment.model.CommentPage;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import eu.virtualparadox.ctxstore.ticket.model.TicketDraft;
import eu.virtualparadox.ctxstore.ticket.planner.ExecutionPlan;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextStoreApiTest extends ContextStoreTestBase {

    @Autowired
    private ContextStoreApi api;

    private static ContextFields rule(final String name, final String description) {
        return ContextFields.builder().name(name).description(description).build();
    }

    @Test
    void testStoreQueryAndDeleteRoundTrip() {
        final ContextScope scope = ContextScope.repo(repo.getId());
        final OperationResult<StoreContextResult> stored = api.storeContext("business_rule", scope,
                rule("Email Validation Rule", "emails must be validated"));
        assertThat(stored.success()).isTrue();
        assertThat(stored.value().embedded()).isTrue();

        final OperationResult<List<EntityMatch>> found = api.queryContext("email verification requirements", scope,
                new QueryFilters(null, 5, 0.3));
        assertThat(found.value()).extracting(EntityMatch::entityId).containsExactly(stored.value().id());

        final OperationResult<DeleteContextResult> deleted = api.deleteContext("business_rule", stored.value().id());
        assertThat(deleted.value().deleted()).isTrue();
        assertThat(api.queryContext("email verification requirements", scope, new QueryFilters(null, 5, 0.0)).value())
                .isEmpty();
        assertThat(api.getContext("business_rule", stored.value().id()).error().code())
                .isEqualTo(EErrorCode.NOT_FOUND);
    }

    @Test
    void testUpdateReportsWhetherEmbeddingsWereResynced() {
        final String id = api.storeContext("business-rule", ContextScope.repo(repo.getId()),
                rule("Retry Rule", "retries must back off")).value().id();

        final OperationResult<UpdateContextResult> cosmetic = api.updateContext("business_rule", id,
                ContextFields.builder().category("resilience").build());
        assertThat(cosmetic.value().updated()).isTrue();
        assertThat(cosmetic.value().embeddingResynced()).isFalse();

        final OperationResult<UpdateContextResult> content = api.updateContext("business_rule", id,
                ContextFields.builder().description("retries must back off exponentially").build());
        assertThat(content.value().embeddingResynced()).isTrue();
    }

    @Test
    void testDuplicateRuleNameIsAlreadyExists() {
        final ContextScope scope = ContextScope.repo(repo.getId());
        api.storeContext("business_rule", scope, rule("Unique Rule", "first"));

        final OperationResult<StoreContextResult> second = api.storeContext("business_rule", scope,
                rule("Unique Rule", "second"));

        assertThat(second.success()).isFalse();
        assertThat(second.value()).isNull();
        assertThat(second.error().code()).isEqualTo(EErrorCode.ALREADY_EXISTS);
        assertThat(second.error().type()).isEqualTo("ConflictException");
    }

    @Test
    void testProjectWithoutInheritanceRejectsContextWrites() {
        final ProjectEntity isolated = api.createProject(repo.getId(), "isolated", null, false).value();

        final OperationResult<StoreContextResult> result = api.storeContext("convention",
                ContextScope.project(repo.getId(), isolated.getId()),
                ContextFields.builder().category("naming").rule("use camelCase").build());

        assertThat(result.error().code()).isEqualTo(EErrorCode.FAILED_PRECONDITION);

        api.updateProjectInheritance(isolated.getId(), true);
        assertThat(api.storeContext("convention", ContextScope.project(repo.getId(), isolated.getId()),
                ContextFields.builder().category("naming").rule("use camelCase").build()).success()).isTrue();
    }

    @Test
    void testInvalidInputsAreInvalidArgument() {
        final ContextScope scope = ContextScope.repo(repo.getId());

        assertThat(api.storeContext("recipe", scope, rule("x", "y")).error().code())
                .isEqualTo(EErrorCode.INVALID_ARGUMENT);
        assertThat(api.storeContext("ticket", scope, rule("x", "y")).error().code())
                .isEqualTo(EErrorCode.INVALID_ARGUMENT);
        assertThat(api.storeContext("business_rule", scope, ContextFields.builder().name("no description").build())
                .error().code()).isEqualTo(EErrorCode.INVALID_ARGUMENT);
        assertThat(api.storeContext("business_rule", null, rule("x", "y")).error().code())
                .isEqualTo(EErrorCode.INVALID_ARGUMENT);
        assertThat(api.queryContext("q", scope, new QueryFilters(null, 0, null)).error().code())
                .isEqualTo(EErrorCode.INVALID_ARGUMENT);
    }

    @Test
    void testListContextCombinesRepoAndProjectEntities() {
        final ProjectEntity project = newProject("web");
        api.storeContext("glossary_entry", ContextScope.repo(repo.getId()),
                ContextFields.builder().term("Tenant").definition("a paying customer").build());
        api.storeContext("glossary_entry", ContextScope.project(repo.getId(), project.getId()),
                ContextFields.builder().term("Widget").definition("a dashboard tile").build());

        final List<ContextEntity> repoOnly = api.listContext("glossary_entry", ContextScope.repo(repo.getId()), null).value();
        final List<ContextEntity> withProject = api.listContext("glossary_entry",
                ContextScope.project(repo.getId(), project.getId()), null).value();

        assertThat(repoOnly).extracting(ContextEntity::getDisplayName).containsExactly("Tenant");
        assertThat(withProject).extracting(ContextEntity::getDisplayName).containsExactlyInAnyOrder("Tenant", "Widget");
    }

    @Test
    void testTicketErrorsAreStructured() {
        final ProjectEntity project = newProject("tickets");

        final OperationResult<List<TicketEntity>> cyclic = api.storeTickets(project.getId(), List.of(
                TicketDraft.builder().title("A").dependsOn(List.of("B")).build(),
                TicketDraft.builder().title("B").dependsOn(List.of("A")).build()));

        assertThat(cyclic.error().code()).isEqualTo(EErrorCode.DEPENDENCY_CYCLE);
        assertThat(cyclic.error().context()).containsKey("cycles");

        final OperationResult<List<TicketEntity>> self = api.storeTickets(project.getId(), List.of(
                TicketDraft.builder().title("A").dependsOn(List.of("A")).build()));
        assertThat(self.error().code()).isEqualTo(EErrorCode.SELF_DEPENDENCY);

        final OperationResult<ExecutionPlan> plan = api.getExecutionPlan(project.getId());
        assertThat(plan.success()).isTrue();
        assertThat(plan.value().available()).isEmpty();
    }

    @Test
    void testTicketCommentsAndProjectState() {
        final ProjectEntity project = newProject("comments-api");
        final TicketEntity ticket = api.storeTickets(project.getId(),
                List.of(TicketDraft.builder().title("Only").status("completed").build())).value().get(0);

        final OperationResult<TicketCommentEntity> created = api.createTicketComment(ticket.getId(), "shipped", "bob");
        assertThat(created.success()).isTrue();
        assertThat(api.updateTicketComment(created.value().getId(), "shipped in 1.2").value().getContent())
                .isEqualTo("shipped in 1.2");

        final OperationResult<CommentPage> page = api.listTicketComments(ticket.getId(), null);
        assertThat(page.value().total()).isEqualTo(1);
        assertThat(page.value().hasMore()).isFalse();
        assertThat(api.createTicketComment(ticket.getId(), " ", null).error().code())
                .isEqualTo(EErrorCode.INVALID_ARGUMENT);
        assertThat(api.updateTicketComment("missing", "text").error().code()).isEqualTo(EErrorCode.NOT_FOUND);

        final OperationResult<ProjectState> state = api.getProjectState(project.getId());
        assertThat(state.value().progress()).isEqualTo(100);
        assertThat(state.value().tickets().completed()).isEqualTo(1);
        assertThat(api.getRepoState(repo.getId()).value().projects()).hasSize(1);
        assertThat(api.getProjectState("missing").error().code()).isEqualTo(EErrorCode.NOT_FOUND);
    }
}
