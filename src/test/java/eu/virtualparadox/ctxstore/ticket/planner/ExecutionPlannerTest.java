package eu.virtualparadox.ctxstore.ticket.planner;

import eu.virtualparadox.ctxstore.common.EPriority;
import eu.virtualparadox.ctxstore.exception.ValidationException;
import eu.virtualparadox.ctxstore.ticket.ETicketStatus;
import eu.virtualparadox.ctxstore.ticket.ETicketType;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import eu.virtualparadox.ctxstore.ticket.graph.DependencyGraphBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionPlannerTest {

    private final ExecutionPlanner planner = new ExecutionPlanner();
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();

    private static TicketEntity ticket(String id, int order, EPriority priority, ETicketStatus status, String... deps) {
        return TicketEntity.builder()
                .id(id)
                .title("T-" + id)
                .orderIndex(order)
                .priority(priority)
                .status(status)
                .type(ETicketType.IMPLEMENTATION)
                .dependsOn(List.of(deps))
                .build();
    }

    private ExecutionPlan plan(List<TicketEntity> tickets, PlanOptions options) {
        return planner.plan(tickets, graphBuilder.build(tickets), options);
    }

    @Test
    void testPendingTicketWithUnfinishedDependencyIsBlocked() {
        TicketEntity t1 = ticket("1", 1, EPriority.MEDIUM, ETicketStatus.PENDING);
        TicketEntity t2 = ticket("2", 2, EPriority.MEDIUM, ETicketStatus.PENDING, "1");

        ExecutionPlan plan = plan(List.of(t1, t2), PlanOptions.defaults());

        assertThat(plan.available()).containsExactly(t1);
        assertThat(plan.blocked()).extracting(BlockedTicket::ticket).containsExactly(t2);
        assertThat(plan.blocked().get(0).unfinishedDependencies()).containsExactly("1");
        assertThat(plan.recommended()).contains(t1);
    }

    @Test
    void testCompletingDependencyMakesDependentAvailable() {
        TicketEntity t1 = ticket("1", 1, EPriority.MEDIUM, ETicketStatus.COMPLETED);
        TicketEntity t2 = ticket("2", 2, EPriority.MEDIUM, ETicketStatus.PENDING, "1");

        ExecutionPlan plan = plan(List.of(t1, t2), PlanOptions.defaults());

        assertThat(plan.available()).containsExactly(t2);
        assertThat(plan.completed()).containsExactly(t1);
        assertThat(plan.blocked()).isEmpty();
    }

    @Test
    void testAvailableOrderedByPriorityThenOrder() {
        TicketEntity low = ticket("low", 1, EPriority.LOW, ETicketStatus.PENDING);
        TicketEntity high2 = ticket("high2", 3, EPriority.HIGH, ETicketStatus.PENDING);
        TicketEntity high1 = ticket("high1", 2, EPriority.HIGH, ETicketStatus.PENDING);
        TicketEntity critical = ticket("crit", 4, EPriority.CRITICAL, ETicketStatus.PENDING);

        ExecutionPlan plan = plan(List.of(low, high2, high1, critical), new PlanOptions(10, true));

        assertThat(plan.available()).containsExactly(critical, high1, high2, low);
        assertThat(plan.recommended()).contains(critical);
    }

    @Test
    void testBlockedFollowsDependenciesNotStoredStatus() {
        TicketEntity base = ticket("a", 1, EPriority.MEDIUM, ETicketStatus.PENDING);
        TicketEntity working = ticket("b", 2, EPriority.HIGH, ETicketStatus.IN_PROGRESS, "a");
        TicketEntity flagged = ticket("c", 3, EPriority.HIGH, ETicketStatus.BLOCKED);

        ExecutionPlan plan = plan(List.of(base, working, flagged), PlanOptions.defaults());

        assertThat(plan.available()).containsExactly(base);
        assertThat(plan.blocked()).extracting(BlockedTicket::ticket).containsExactly(working);
        assertThat(plan.blocked().get(0).unfinishedDependencies()).containsExactly("a");
        assertThat(plan.inProgress()).containsExactly(working);
        assertThat(plan.recommended()).contains(base);
    }

    @Test
    void testStoredBlockedTicketWithUnfinishedDependencyIsBlocked() {
        TicketEntity base = ticket("a", 1, EPriority.MEDIUM, ETicketStatus.IN_PROGRESS);
        TicketEntity flagged = ticket("b", 2, EPriority.MEDIUM, ETicketStatus.BLOCKED, "a");

        ExecutionPlan plan = plan(List.of(base, flagged), PlanOptions.defaults());

        assertThat(plan.blocked()).extracting(BlockedTicket::ticket).containsExactly(flagged);
        assertThat(plan.available()).isEmpty();
        assertThat(plan.recommended()).isEmpty();
    }

    @Test
    void testRecommendationsHonourLimitAndTestingFilter() {
        TicketEntity testing = ticket("t", 1, EPriority.CRITICAL, ETicketStatus.PENDING);
        testing.setType(ETicketType.TESTING);
        TicketEntity a = ticket("a", 2, EPriority.HIGH, ETicketStatus.PENDING);
        TicketEntity b = ticket("b", 3, EPriority.HIGH, ETicketStatus.PENDING);
        TicketEntity c = ticket("c", 4, EPriority.HIGH, ETicketStatus.PENDING);

        ExecutionPlan withTesting = plan(List.of(testing, a, b, c), new PlanOptions(2, true));
        assertThat(withTesting.recommendations()).containsExactly(testing, a);

        ExecutionPlan withoutTesting = plan(List.of(testing, a, b, c), new PlanOptions(2, false));
        assertThat(withoutTesting.recommendations()).containsExactly(a, b);
        assertThat(withoutTesting.available()).contains(testing);
    }

    @Test
    void testDanglingDependencyDoesNotBlock() {
        TicketEntity t = ticket("1", 1, EPriority.MEDIUM, ETicketStatus.PENDING, "deleted-id");

        ExecutionPlan plan = plan(List.of(t), PlanOptions.defaults());

        assertThat(plan.available()).containsExactly(t);
        assertThat(plan.danglingReferences()).containsKey("1");
    }

    @Test
    void testInvalidLimitIsRejected() {
        assertThatThrownBy(() -> plan(List.of(), new PlanOptions(0, true)))
                .isInstanceOf(ValidationException.class);
    }
}
