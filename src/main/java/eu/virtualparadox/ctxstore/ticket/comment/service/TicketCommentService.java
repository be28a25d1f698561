package eu.virtualparadox.ctxstore.ticket.comment.service;

import eu.virtualparadox.ctxstore.exception.NotFoundException;
import eu.virtualparadox.ctxstore.exception.ValidationException;
import eu.virtualparadox.ctxstore.ticket.comment.entity.TicketCommentEntity;
import eu.virtualparadox.ctxstore.ticket.comment.model.CommentPage;
import eu.virtualparadox.ctxstore.ticket.comment.model.CommentQuery;
import eu.virtualparadox.ctxstore.ticket.comment.repo.TicketCommentRepository;
import eu.virtualparadox.ctxstore.ticket.repo.TicketRepository;
import eu.virtualparadox.ctxstore.util.Ids;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Comments on tickets. Comments are not embedded and play no part in planning.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TicketCommentService {

    static final int DEFAULT_LIMIT = 20;
    static final int MAX_LIMIT = 100;

    private final TicketCommentRepository repository;
    private final TicketRepository ticketRepository;

    public TicketCommentEntity create(final String ticketId, final String content, final String createdBy) {
        requireTicket(ticketId);
        final String text = requireContent(content);

        final TicketCommentEntity comment = repository.save(TicketCommentEntity.builder()
                .id(Ids.newId())
                .ticketId(ticketId)
                .content(text)
                .createdBy(createdBy)
                .build());
        log.info("Added comment {} to ticket {}", comment.getId(), ticketId);
        return comment;
    }

    /**
     * Replaces the content of a comment and refreshes its {@code updatedAt}.
     */
    public TicketCommentEntity update(final String commentId, final String content) {
        if (commentId == null || commentId.isBlank()) {
            throw new ValidationException("commentId must not be blank");
        }
        final String text = requireContent(content);
        final TicketCommentEntity comment = repository.findById(commentId)
                .orElseThrow(() -> new NotFoundException("comment", commentId));

        comment.setContent(text);
        comment.setUpdatedAt(Instant.now());
        log.info("Updated comment {} of ticket {}", commentId, comment.getTicketId());
        return repository.save(comment);
    }

    public CommentPage list(final String ticketId, final CommentQuery query) {
        requireTicket(ticketId);
        final CommentQuery q = query == null ? CommentQuery.defaults() : query;

        final int offset = q.offset() == null ? 0 : Math.max(0, q.offset());
        final int limit = q.limit() == null ? DEFAULT_LIMIT : Math.min(Math.max(1, q.limit()), MAX_LIMIT);
        final Sort sort = Sort.by(direction(q.orderDirection()), sortField(q.orderBy()))
                .and(Sort.by(Sort.Direction.ASC, "id"));

        final List<TicketCommentEntity> all = repository.findByTicketId(ticketId, sort);
        final int from = Math.min(offset, all.size());
        final int to = Math.min(from + limit, all.size());
        return new CommentPage(all.size(), offset, limit, offset + limit < all.size(), List.copyOf(all.subList(from, to)));
    }

    private void requireTicket(final String ticketId) {
        if (ticketId == null || ticketId.isBlank()) {
            throw new ValidationException("ticketId must not be blank");
        }
        if (!ticketRepository.existsById(ticketId)) {
            throw new NotFoundException("ticket", ticketId);
        }
    }

    private static String requireContent(final String content) {
        if (content == null || content.isBlank()) {
            throw new ValidationException("content must not be blank", Map.of("field", "content"));
        }
        return content.trim();
    }

    private static String sortField(final String orderBy) {
        if (orderBy == null || orderBy.equals("createdAt")) {
            return "createdAt";
        }
        if (orderBy.equals("updatedAt")) {
            return "updatedAt";
        }
        throw new ValidationException("orderBy must be createdAt or updatedAt", Map.of("orderBy", orderBy));
    }

    private static Sort.Direction direction(final String orderDirection) {
        if (orderDirection == null) {
            return Sort.Direction.DESC;
        }
        return Sort.Direction.fromOptionalString(orderDirection)
                .orElseThrow(() -> new ValidationException("orderDirection must be asc or desc",
                        Map.of("orderDirection", orderDirection)));
    }
}
