package eu.virtualparadox.ctxstore.catalog.repo;

import eu.virtualparadox.ctxstore.catalog.entity.ConventionEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ConventionRepository extends JpaRepository<ConventionEntity, String> {

    List<ConventionEntity> findByRepoId(String repoId);
}
