package eu.virtualparadox.ctxstore.catalog.repo;

import eu.virtualparadox.ctxstore.catalog.entity.GlossaryEntryEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface GlossaryEntryRepository extends JpaRepository<GlossaryEntryEntity, String> {

    List<GlossaryEntryEntity> findByRepoId(String repoId);

    boolean existsByRepoIdAndTerm(String repoId, String term);

    boolean existsByRepoIdAndTermAndIdNot(String repoId, String term, String id);
}
