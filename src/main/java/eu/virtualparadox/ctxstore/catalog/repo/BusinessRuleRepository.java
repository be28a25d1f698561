package eu.virtualparadox.ctxstore.catalog.repo;

import eu.virtualparadox.ctxstore.catalog.entity.BusinessRuleEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface BusinessRuleRepository extends JpaRepository<BusinessRuleEntity, String> {

    List<BusinessRuleEntity> findByRepoId(String repoId);

    boolean existsByRepoIdAndName(String repoId, String name);

    boolean existsByRepoIdAndNameAndIdNot(String repoId, String name, String id);
}
