package eu.virtualparadox.ctxstore.state.model;

import eu.virtualparadox.ctxstore.catalog.EEntityType;
import eu.virtualparadox.ctxstore.scope.entity.RepoEntity;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a repo: its projects, newest first, and its repo-level context per type.
 */
public record RepoState(RepoEntity repo,
                        List<ProjectSummary> projects,
                        Map<EEntityType, Integer> contextByType,
                        int contextTotal) {
}
