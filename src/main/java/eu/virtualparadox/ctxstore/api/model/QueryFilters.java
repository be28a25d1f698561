package eu.virtualparadox.ctxstore.api.model;

import java.util.List;

/**
 * Optional search filters; {@code null} values use the defaults.
 *
 * @param entityTypes wire names of context types to search
 */
public record QueryFilters(List<String> entityTypes, Integer topK, Double minSimilarity) {

    public static QueryFilters defaults() {
        return new QueryFilters(null, null, null);
    }
}
