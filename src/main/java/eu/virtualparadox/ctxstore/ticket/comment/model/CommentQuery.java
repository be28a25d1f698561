package eu.virtualparadox.ctxstore.ticket.comment.model;

/**
 * Paging and ordering of a comment listing. {@code null} values use the defaults.
 *
 * @param offset         comments to skip, negative values count as 0
 * @param limit          page size, clamped to {@code [1, 100]}, default 20
 * @param orderBy        {@code createdAt} (default) or {@code updatedAt}
 * @param orderDirection {@code asc} or {@code desc} (default)
 */
public record CommentQuery(Integer offset, Integer limit, String orderBy, String orderDirection) {

    public static CommentQuery defaults() {
        return new CommentQuery(null, null, null, null);
    }
}
