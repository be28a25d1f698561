package eu.virtualparadox.ctxstore.catalog.repo;

import eu.virtualparadox.ctxstore.catalog.entity.PatternEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PatternRepository extends JpaRepository<PatternEntity, String> {

    List<PatternEntity> findByRepoId(String repoId);
}
