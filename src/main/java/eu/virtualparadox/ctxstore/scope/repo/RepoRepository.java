package eu.virtualparadox.ctxstore.scope.repo;

import eu.virtualparadox.ctxstore.scope.entity.RepoEntity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RepoRepository extends JpaRepository<RepoEntity, String> {
}
