package eu.virtualparadox.ctxstore.catalog.repo;

import eu.virtualparadox.ctxstore.catalog.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    List<DocumentEntity> findByRepoId(String repoId);
}
