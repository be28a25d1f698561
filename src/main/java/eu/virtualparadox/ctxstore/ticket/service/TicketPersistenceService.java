package eu.virtualparadox.ctxstore.ticket.service;

import eu.virtualparadox.ctxstore.ticket.comment.repo.TicketCommentRepository;
import eu.virtualparadox.ctxstore.ticket.entity.TicketEntity;
import eu.virtualparadox.ctxstore.ticket.repo.TicketRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Transactional ticket writes. Callers validate first; each method either fully applies or not at all.
 */
@Service
@RequiredArgsConstructor
public class TicketPersistenceService {

    private final TicketRepository repository;
    private final TicketCommentRepository commentRepository;

    @Transactional
    public List<TicketEntity> saveBatch(final List<TicketEntity> tickets) {
        return repository.saveAll(tickets);
    }

    @Transactional
    public TicketEntity save(final TicketEntity ticket) {
        return repository.save(ticket);
    }

    /**
     * Drops {@code ticket} from the dependency lists of {@code dependents} and deletes it with its comments.
     * The lists are replaced, not edited in place.
     */
    @Transactional
    public void deleteAndRewrite(final TicketEntity ticket, final List<TicketEntity> dependents) {
        for (final TicketEntity dependent : dependents) {
            final List<String> rewritten = new ArrayList<>(dependent.getDependsOn());
            rewritten.removeIf(ticket.getId()::equals);
            dependent.setDependsOn(rewritten);
        }
        repository.saveAll(dependents);
        commentRepository.deleteByTicketId(ticket.getId());
        repository.deleteById(ticket.getId());
    }
}
