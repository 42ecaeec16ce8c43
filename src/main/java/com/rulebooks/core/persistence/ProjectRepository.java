package com.rulebooks.core.persistence;

import com.rulebooks.core.model.Project;
import com.rulebooks.core.model.Rule;
import com.rulebooks.core.model.Rulebook;
import com.rulebooks.core.model.Ruleset;

import java.util.List;
import java.util.Optional;

/**
 * Storage for imported projects and their rulebook tree.
 * <p>
 * Writes join whatever transaction is active on the calling thread. Parents
 * must be created before their children; the returned copies carry the
 * generated ids in the same order as the input.
 */
public interface ProjectRepository {

    Project createProject(Project project);

    Rulebook createRulebook(Rulebook rulebook);

    /** Inserts all rulesets in one batch. */
    List<Ruleset> createRulesets(List<Ruleset> rulesets);

    /** Inserts all rules in one batch. */
    List<Rule> createRules(List<Rule> rules);

    /**
     * Records the stored archive name on an existing project.
     *
     * @throws org.springframework.dao.DataAccessException if the project does not exist
     */
    void attachArchive(long projectId, String archiveFile);

    Optional<Project> findProject(long projectId);

    /** All projects, oldest first. */
    List<Project> listProjects();

    long countProjects();

    List<Rulebook> findRulebooks(long projectId);

    List<Ruleset> findRulesets(long rulebookId);

    List<Rule> findRules(long rulesetId);
}
