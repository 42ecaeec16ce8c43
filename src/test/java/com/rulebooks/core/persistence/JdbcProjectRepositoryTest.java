package com.rulebooks.core.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulebooks.core.model.Project;
import com.rulebooks.core.model.Rule;
import com.rulebooks.core.model.Rulebook;
import com.rulebooks.core.model.Ruleset;
import com.rulebooks.support.TestDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link JdbcProjectRepository} against an in-memory H2 database.
 */
class JdbcProjectRepositoryTest {

    private DataSource dataSource;
    private JdbcProjectRepository repository;

    @BeforeEach
    void setUp() {
        dataSource = TestDatabase.newDataSource();
        repository = new JdbcProjectRepository(dataSource, new ObjectMapper());
        repository.createTables();
    }

    private Project newProject(String name) {
        return repository.createProject(new Project(null, name, "", "https://git.example.com/repo.git",
                "0123456789abcdef0123456789abcdef01234567", null, null));
    }

    @Test
    @DisplayName("createTables is idempotent")
    void createTablesTwice() {
        assertDoesNotThrow(() -> repository.createTables());
    }

    @Nested
    @DisplayName("Projects")
    class Projects {

        @Test
        @DisplayName("createProject assigns an id and the row can be read back")
        void createAndFind() {
            Project created = newProject("demo");

            assertNotNull(created.id());
            assertNotNull(created.createdAt());
            var found = repository.findProject(created.id()).orElseThrow();
            assertEquals("demo", found.name());
            assertEquals("", found.description());
            assertEquals("https://git.example.com/repo.git", found.url());
            assertEquals(created.gitHash(), found.gitHash());
            assertNull(found.archiveFile());
        }

        @Test
        @DisplayName("a null description is stored as empty")
        void nullDescription() {
            Project created = repository.createProject(new Project(null, "p", null, "u", "h", null, null));

            assertEquals("", repository.findProject(created.id()).orElseThrow().description());
        }

        @Test
        @DisplayName("ids are distinct and listProjects returns creation order")
        void listInOrder() {
            Project first = newProject("first");
            Project second = newProject("second");

            assertNotEquals(first.id(), second.id());
            assertEquals(List.of("first", "second"),
                    repository.listProjects().stream().map(Project::name).toList());
            assertEquals(2, repository.countProjects());
        }

        @Test
        @DisplayName("attachArchive records the stored name")
        void attachArchive() {
            Project project = newProject("demo");

            repository.attachArchive(project.id(), "0000000001.archive.tar.gz");

            assertEquals("0000000001.archive.tar.gz",
                    repository.findProject(project.id()).orElseThrow().archiveFile());
        }

        @Test
        @DisplayName("attachArchive on an unknown project fails")
        void attachArchiveUnknownProject() {
            assertThrows(DataAccessException.class, () -> repository.attachArchive(999L, "x.tar.gz"));
        }

        @Test
        @DisplayName("findProject returns empty for unknown ids")
        void findUnknown() {
            assertTrue(repository.findProject(12345L).isEmpty());
        }
    }

    @Nested
    @DisplayName("Rulebook tree")
    class RulebookTree {

        @Test
        @DisplayName("bulk-created rulesets and rules keep input order and get ids")
        void bulkCreateKeepsOrder() {
            Project project = newProject("demo");
            Rulebook rulebook = repository.createRulebook(new Rulebook(null, project.id(), "a.yml", "- rules: []"));

            var sources = List.<Map<String, Object>>of(Map.of("name", "range", "type", "range"));
            List<Ruleset> rulesets = repository.createRulesets(List.of(
                    new Ruleset(null, rulebook.id(), "first", sources),
                    new Ruleset(null, rulebook.id(), "second", null),
                    new Ruleset(null, rulebook.id(), "third", List.of())));

            assertEquals(List.of("first", "second", "third"), rulesets.stream().map(Ruleset::name).toList());
            assertTrue(rulesets.stream().allMatch(r -> r.id() != null));
            assertEquals(3, rulesets.stream().map(Ruleset::id).distinct().count());

            List<Rule> rules = repository.createRules(List.of(
                    new Rule(null, rulesets.get(0).id(), "r-a", Map.of("debug", Map.of("msg", "hi"))),
                    new Rule(null, rulesets.get(2).id(), "r-b", "run_playbook"),
                    new Rule(null, rulesets.get(0).id(), "r-c", null)));
            assertEquals(3, rules.size());
            assertTrue(rules.stream().allMatch(r -> r.id() != null));

            var stored = repository.findRulesets(rulebook.id());
            assertEquals(sources, stored.get(0).sources());
            assertNull(stored.get(1).sources());
            assertEquals(List.of(), stored.get(2).sources());

            var firstRules = repository.findRules(rulesets.get(0).id());
            assertEquals(List.of("r-a", "r-c"), firstRules.stream().map(Rule::name).toList());
            assertEquals(Map.of("debug", Map.of("msg", "hi")), firstRules.get(0).action());
            assertNull(firstRules.get(1).action());
            assertEquals("run_playbook", repository.findRules(rulesets.get(2).id()).get(0).action());
            assertTrue(repository.findRules(rulesets.get(1).id()).isEmpty());
        }

        @Test
        @DisplayName("empty bulk inserts are no-ops")
        void emptyBulkInsert() {
            assertEquals(List.of(), repository.createRulesets(List.of()));
            assertEquals(List.of(), repository.createRules(List.of()));
        }

        @Test
        @DisplayName("children cannot reference a missing parent")
        void referentialIntegrity() {
            assertThrows(DataAccessException.class,
                    () -> repository.createRulebook(new Rulebook(null, 4242L, "a.yml", "")));
            assertThrows(DataAccessException.class,
                    () -> repository.createRulesets(List.of(new Ruleset(null, 4242L, "r", null))));
            assertThrows(DataAccessException.class,
                    () -> repository.createRules(List.of(new Rule(null, 4242L, "r", null))));
        }

        @Test
        @DisplayName("findRulebooks returns the rulebooks of one project only")
        void findRulebooksByProject() {
            Project one = newProject("one");
            Project two = newProject("two");
            repository.createRulebook(new Rulebook(null, one.id(), "a.yml", "x"));
            repository.createRulebook(new Rulebook(null, two.id(), "b.yml", "y"));

            var rulebooks = repository.findRulebooks(one.id());
            assertEquals(1, rulebooks.size());
            assertEquals("a.yml", rulebooks.get(0).name());
            assertEquals("x", rulebooks.get(0).content());
        }
    }

    @Nested
    @DisplayName("Transactions")
    class Transactions {

        @Test
        @DisplayName("writes join the surrounding transaction and roll back with it")
        void rollsBackWithTransaction() {
            var template = new TransactionTemplate(new DataSourceTransactionManager(dataSource));

            template.executeWithoutResult(status -> {
                Project project = newProject("doomed");
                Rulebook rulebook = repository.createRulebook(new Rulebook(null, project.id(), "a.yml", ""));
                repository.createRulesets(List.of(new Ruleset(null, rulebook.id(), "r1", null)));
                status.setRollbackOnly();
            });

            assertEquals(0, repository.countProjects());
        }
    }
}
