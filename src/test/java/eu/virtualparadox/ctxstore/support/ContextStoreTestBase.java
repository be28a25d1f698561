package eu.virtualparadox.ctxstore.support;

import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import eu.virtualparadox.ctxstore.scope.entity.RepoEntity;
import eu.virtualparadox.ctxstore.scope.service.ScopeService;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

/**
 * Shared Spring context for service tests: in-memory H2, in-memory Lucene and the prefix-bag embedder.
 * Every test works in a fresh repo so tests never see each other's data.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestEmbeddingConfig.class)
public abstract class ContextStoreTestBase {

    @Autowired
    protected ScopeService scopeService;

    @Autowired
    protected PrefixBagEmbeddingService embedder;

    protected RepoEntity repo;

    @BeforeEach
    void setUpScope() {
        embedder.reset();
        repo = scopeService.createRepo("repo-" + System.nanoTime(), "test repo");
    }

    protected ProjectEntity newProject(final String name) {
        return scopeService.createProject(repo.getId(), name, null, true);
    }
}
