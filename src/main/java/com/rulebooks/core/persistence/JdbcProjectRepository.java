package com.rulebooks.core.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulebooks.core.model.Project;
import com.rulebooks.core.model.Rule;
import com.rulebooks.core.model.Rulebook;
import com.rulebooks.core.model.Ruleset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.JdbcUpdateAffectedIncorrectNumberOfRowsException;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link ProjectRepository} backed by four relational tables:
 * {@code projects}, {@code rulebooks}, {@code rulesets} and {@code rules}.
 * <p>
 * Children reference their parent with a cascading foreign key. Ruleset
 * sources and rule actions are stored as JSON text. All statements go through
 * a {@link JdbcTemplate}, so they take part in a Spring-managed transaction
 * when one is open.
 * <p>
 * The tables are created by {@link #createTables()}; the DDL runs on both
 * PostgreSQL and H2.
 */
public class JdbcProjectRepository implements ProjectRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcProjectRepository.class);

    private static final List<String> CREATE_TABLES_SQL = List.of(
            """
            CREATE TABLE IF NOT EXISTS projects (
                id           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                name         VARCHAR(255) NOT NULL,
                description  TEXT NOT NULL,
                url          TEXT NOT NULL,
                git_hash     VARCHAR(64) NOT NULL,
                archive_file VARCHAR(255),
                created_at   TIMESTAMP NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS rulebooks (
                id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                project_id BIGINT NOT NULL REFERENCES projects (id) ON DELETE CASCADE,
                name       TEXT NOT NULL,
                content    TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS rulesets (
                id          BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                rulebook_id BIGINT NOT NULL REFERENCES rulebooks (id) ON DELETE CASCADE,
                name        TEXT NOT NULL,
                sources     TEXT
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS rules (
                id         BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                ruleset_id BIGINT NOT NULL REFERENCES rulesets (id) ON DELETE CASCADE,
                name       TEXT NOT NULL,
                action     TEXT
            )
            """
    );

    private static final String INSERT_PROJECT_SQL = """
            INSERT INTO projects (name, description, url, git_hash, archive_file, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String INSERT_RULEBOOK_SQL = """
            INSERT INTO rulebooks (project_id, name, content) VALUES (?, ?, ?)
            """;

    private static final String INSERT_RULESET_SQL = """
            INSERT INTO rulesets (rulebook_id, name, sources) VALUES (?, ?, ?)
            """;

    private static final String INSERT_RULE_SQL = """
            INSERT INTO rules (ruleset_id, name, action) VALUES (?, ?, ?)
            """;

    private static final String UPDATE_ARCHIVE_SQL = """
            UPDATE projects SET archive_file = ? WHERE id = ?
            """;

    private static final String SELECT_PROJECT_COLUMNS = """
            SELECT id, name, description, url, git_hash, archive_file, created_at FROM projects
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<Project> projectMapper = (rs, rowNum) -> new Project(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getString("url"),
            rs.getString("git_hash"),
            rs.getString("archive_file"),
            toInstant(rs.getTimestamp("created_at")));

    private final RowMapper<Rulebook> rulebookMapper = (rs, rowNum) -> new Rulebook(
            rs.getLong("id"),
            rs.getLong("project_id"),
            rs.getString("name"),
            rs.getString("content"));

    private final RowMapper<Ruleset> rulesetMapper = (rs, rowNum) -> new Ruleset(
            rs.getLong("id"),
            rs.getLong("rulebook_id"),
            rs.getString("name"),
            readJson(rs.getString("sources"), new TypeReference<List<Map<String, Object>>>() {}));

    private final RowMapper<Rule> ruleMapper = (rs, rowNum) -> new Rule(
            rs.getLong("id"),
            rs.getLong("ruleset_id"),
            rs.getString("name"),
            readJson(rs.getString("action"), new TypeReference<Object>() {}));

    public JdbcProjectRepository(DataSource dataSource, ObjectMapper objectMapper) {
        Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper must not be null");
    }

    /**
     * Creates the project tables if they do not already exist.
     * Should be called once during application startup.
     */
    public void createTables() {
        CREATE_TABLES_SQL.forEach(jdbcTemplate::execute);
        log.info("Project tables ensured");
    }

    @Override
    public Project createProject(Project project) {
        Instant createdAt = project.createdAt() != null ? project.createdAt() : Instant.now();
        String description = project.description() != null ? project.description() : "";
        long id = insert(INSERT_PROJECT_SQL, ps -> {
            ps.setString(1, project.name());
            ps.setString(2, description);
            ps.setString(3, project.url());
            ps.setString(4, project.gitHash());
            ps.setString(5, project.archiveFile());
            ps.setTimestamp(6, Timestamp.from(createdAt));
        });
        log.debug("Created project {} ('{}')", id, project.name());
        return new Project(id, project.name(), description, project.url(),
                project.gitHash(), project.archiveFile(), createdAt);
    }

    @Override
    public Rulebook createRulebook(Rulebook rulebook) {
        long id = insert(INSERT_RULEBOOK_SQL, ps -> {
            ps.setLong(1, rulebook.projectId());
            ps.setString(2, rulebook.name());
            ps.setString(3, rulebook.content());
        });
        log.debug("Created rulebook {} '{}' in project {}", id, rulebook.name(), rulebook.projectId());
        return rulebook.withId(id);
    }

    @Override
    public List<Ruleset> createRulesets(List<Ruleset> rulesets) {
        List<Long> ids = insertBatch(INSERT_RULESET_SQL, rulesets.size(), (ps, i) -> {
            Ruleset ruleset = rulesets.get(i);
            ps.setLong(1, ruleset.rulebookId());
            ps.setString(2, ruleset.name());
            setJson(ps, 3, ruleset.sources());
        });

        var created = new ArrayList<Ruleset>(rulesets.size());
        for (int i = 0; i < rulesets.size(); i++) {
            created.add(rulesets.get(i).withId(ids.get(i)));
        }
        return created;
    }

    @Override
    public List<Rule> createRules(List<Rule> rules) {
        List<Long> ids = insertBatch(INSERT_RULE_SQL, rules.size(), (ps, i) -> {
            Rule rule = rules.get(i);
            ps.setLong(1, rule.rulesetId());
            ps.setString(2, rule.name());
            setJson(ps, 3, rule.action());
        });

        var created = new ArrayList<Rule>(rules.size());
        for (int i = 0; i < rules.size(); i++) {
            created.add(rules.get(i).withId(ids.get(i)));
        }
        return created;
    }

    @Override
    public void attachArchive(long projectId, String archiveFile) {
        int updated = jdbcTemplate.update(UPDATE_ARCHIVE_SQL, archiveFile, projectId);
        if (updated != 1) {
            throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(UPDATE_ARCHIVE_SQL, 1, updated);
        }
        log.debug("Attached archive {} to project {}", archiveFile, projectId);
    }

    @Override
    public Optional<Project> findProject(long projectId) {
        return jdbcTemplate.query(SELECT_PROJECT_COLUMNS + " WHERE id = ?", projectMapper, projectId)
                .stream()
                .findFirst();
    }

    @Override
    public List<Project> listProjects() {
        return jdbcTemplate.query(SELECT_PROJECT_COLUMNS + " ORDER BY id", projectMapper);
    }

    @Override
    public long countProjects() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM projects", Long.class);
        return count != null ? count : 0L;
    }

    @Override
    public List<Rulebook> findRulebooks(long projectId) {
        return jdbcTemplate.query(
                "SELECT id, project_id, name, content FROM rulebooks WHERE project_id = ? ORDER BY id",
                rulebookMapper, projectId);
    }

    @Override
    public List<Ruleset> findRulesets(long rulebookId) {
        return jdbcTemplate.query(
                "SELECT id, rulebook_id, name, sources FROM rulesets WHERE rulebook_id = ? ORDER BY id",
                rulesetMapper, rulebookId);
    }

    @Override
    public List<Rule> findRules(long rulesetId) {
        return jdbcTemplate.query(
                "SELECT id, ruleset_id, name, action FROM rules WHERE ruleset_id = ? ORDER BY id",
                ruleMapper, rulesetId);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    @FunctionalInterface
    private interface ParameterSetter {
        void setValues(PreparedStatement ps) throws SQLException;
    }

    private long insert(String sql, ParameterSetter setter) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
            setter.setValues(ps);
            return ps;
        }, keyHolder);
        return extractId(keyHolder.getKeys());
    }

    private List<Long> insertBatch(String sql, int size, RowSetter setter) {
        if (size == 0) {
            return List.of();
        }
        KeyHolder keyHolder = new GeneratedKeyHolder();
        PreparedStatementCreator creator =
                connection -> connection.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS);
        jdbcTemplate.batchUpdate(creator, new BatchPreparedStatementSetter() {
            @Override
            public void setValues(PreparedStatement ps, int i) throws SQLException {
                setter.setValues(ps, i);
            }

            @Override
            public int getBatchSize() {
                return size;
            }
        }, keyHolder);

        List<Map<String, Object>> keys = keyHolder.getKeyList();
        if (keys.size() != size) {
            throw new JdbcUpdateAffectedIncorrectNumberOfRowsException(sql, size, keys.size());
        }
        return keys.stream().map(JdbcProjectRepository::extractId).toList();
    }

    @FunctionalInterface
    private interface RowSetter {
        void setValues(PreparedStatement ps, int index) throws SQLException;
    }

    /**
     * Generated-key maps are case-insensitive; PostgreSQL returns every column,
     * H2 only the identity.
     */
    private static long extractId(Map<String, Object> keys) {
        if (keys == null || !(keys.get("id") instanceof Number id)) {
            throw new IllegalStateException("Insert did not return a generated id: " + keys);
        }
        return id.longValue();
    }

    private void setJson(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.VARCHAR);
        } else {
            ps.setString(index, writeJson(value));
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value to JSON", e);
        }
    }

    private <T> T readJson(String json, TypeReference<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize stored JSON", e);
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
