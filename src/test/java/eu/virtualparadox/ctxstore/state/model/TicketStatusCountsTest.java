package eu.virtualparadox.ctxstore.state.model;

import eu.virtualparadox.ctxstore.ticket.ETicketStatus;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TicketStatusCountsTest {

    private static TicketEntity ticket(ETicketStatus status) {
        return TicketEntity.builder().status(status).build();
    }

    @Test
    void testCountsPerStatus() {
        TicketStatusCounts counts = TicketStatusCounts.of(List.of(
                ticket(ETicketStatus.PENDING),
                ticket(ETicketStatus.PENDING),
                ticket(ETicketStatus.IN_PROGRESS),
                ticket(ETicketStatus.COMPLETED),
                ticket(ETicketStatus.BLOCKED)));

        assertThat(counts).isEqualTo(new TicketStatusCounts(5, 2, 1, 1, 1));
    }

    @Test
    void testProgressIsRoundedPercentage() {
        assertThat(TicketStatusCounts.of(List.of()).progress()).isZero();
        assertThat(TicketStatusCounts.of(List.of(
                ticket(ETicketStatus.COMPLETED),
                ticket(ETicketStatus.PENDING),
                ticket(ETicketStatus.PENDING))).progress()).isEqualTo(33);
        assertThat(TicketStatusCounts.of(List.of(
                ticket(ETicketStatus.COMPLETED),
                ticket(ETicketStatus.COMPLETED),
                ticket(ETicketStatus.PENDING))).progress()).isEqualTo(67);
        assertThat(TicketStatusCounts.of(List.of(ticket(ETicketStatus.COMPLETED))).progress()).isEqualTo(100);
    }
}
