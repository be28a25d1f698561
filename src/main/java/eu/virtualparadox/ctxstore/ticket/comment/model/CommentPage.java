package eu.virtualparadox.ctxstore.ticket.comment.model;

import eu.virtualparadox.ctxstore.ticket.comment.entity.TicketCommentEntity;

import java.util.List;

/**
 * One page of a ticket's comments.
 *
 * @param total all comments of the ticket
 */
public record CommentPage(long total, int offset, int limit, boolean hasMore, List<TicketCommentEntity> comments) {
}
