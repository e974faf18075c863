package bugtrail.spi;

import bugtrail.model.Project;

import java.util.List;

/**
 * Read access to projects and their retention policies.
 */
public interface ProjectRepository {

    /**
     * Returns all projects, oldest first.
     */
    List<Project> findAll();

    /**
     * Returns the project, or {@code null} if it does not exist.
     */
    Project findById(String projectId);
}
