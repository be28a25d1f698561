package eu.virtualparadox.ctxstore.scope.repo;

import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProjectRepository extends JpaRepository<ProjectEntity, String> {

    List<ProjectEntity> findByRepoId(String repoId);
}
