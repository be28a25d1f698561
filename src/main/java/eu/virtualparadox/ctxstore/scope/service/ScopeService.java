package eu.virtualparadox.ctxstore.scope.service;

import eu.virtualparadox.ctxstore.exception.ConflictException;
import eu.virtualparadox.ctxstore.exception.NotFoundException;
import eu.virtualparadox.ctxstore.exception.ValidationException;
import eu.virtualparadox.ctxstore.scope.entity.ProjectEntity;
import eu.virtualparadox.ctxstore.scope.entity.RepoEntity;
import eu.virtualparadox.ctxstore.scope.repo.ProjectRepository;
import eu.virtualparadox.ctxstore.scope.repo.RepoRepository;
import eu.virtualparadox.ctxstore.util.Ids;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Registry of repositories and projects, and the scope checks that guard context writes and reads.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScopeService {

    private final RepoRepository repoRepository;
    private final ProjectRepository projectRepository;

    @Transactional
    public RepoEntity createRepo(final String name, final String description) {
        requireText(name, "name");
        final RepoEntity repo = RepoEntity.builder()
                .id(Ids.newId())
                .name(name)
                .description(description)
                .build();
        log.info("Created repo {} ({})", repo.getName(), repo.getId());
        return repoRepository.save(repo);
    }

    @Transactional
    public ProjectEntity createProject(final String repoId,
                                       final String name,
                                       final String description,
                                       final Boolean inheritsFromRepo) {
        requireText(name, "name");
        requireRepo(repoId);
        final ProjectEntity project = ProjectEntity.builder()
                .id(Ids.newId())
                .repoId(repoId)
                .name(name)
                .description(description)
                .inheritsFromRepo(inheritsFromRepo == null || inheritsFromRepo)
                .build();
        log.info("Created project {} ({}) in repo {}", project.getName(), project.getId(), repoId);
        return projectRepository.save(project);
    }

    @Transactional
    public ProjectEntity setInheritance(final String projectId, final boolean inheritsFromRepo) {
        final ProjectEntity project = requireProject(projectId);
        project.setInheritsFromRepo(inheritsFromRepo);
        return projectRepository.save(project);
    }

    @Transactional(readOnly = true)
    public RepoEntity requireRepo(final String repoId) {
        requireText(repoId, "repoId");
        return repoRepository.findById(repoId)
                .orElseThrow(() -> new NotFoundException("repo", repoId));
    }

    @Transactional(readOnly = true)
    public ProjectEntity requireProject(final String projectId) {
        requireText(projectId, "projectId");
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new NotFoundException("project", projectId));
    }

    @Transactional(readOnly = true)
    public List<ProjectEntity> listProjects(final String repoId) {
        requireRepo(repoId);
        return projectRepository.findByRepoId(repoId);
    }

    /**
     * Validates the target scope of a context write.
     * <p>A repo-level write needs an existing repo. A project-level write additionally needs the
     * project to belong to the repo and to inherit from it.</p>
     *
     * @param repoId    owning repo
     * @param projectId optional project
     */
    @Transactional(readOnly = true)
    public void checkWriteScope(final String repoId, final String projectId) {
        requireRepo(repoId);
        if (projectId == null) {
            return;
        }
        final ProjectEntity project = requireProject(projectId);
        if (!project.getRepoId().equals(repoId)) {
            throw new ValidationException("Project " + projectId + " does not belong to repo " + repoId,
                    Map.of("repoId", repoId, "projectId", projectId));
        }
        if (!project.isInheritsFromRepo()) {
            throw ConflictException.precondition(
                    "Project " + projectId + " does not inherit from repo " + repoId,
                    Map.of("repoId", repoId, "projectId", projectId));
        }
    }

    /**
     * Validates the scope of a read. Unlike writes, a project that opted out of inheritance can still be read.
     */
    @Transactional(readOnly = true)
    public void checkReadScope(final String repoId, final String projectId) {
        requireRepo(repoId);
        if (projectId == null) {
            return;
        }
        final ProjectEntity project = requireProject(projectId);
        if (!project.getRepoId().equals(repoId)) {
            throw new ValidationException("Project " + projectId + " does not belong to repo " + repoId,
                    Map.of("repoId", repoId, "projectId", projectId));
        }
    }

    private static void requireText(final String value, final String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(name + " must not be blank", Map.of("field", name));
        }
    }
}
