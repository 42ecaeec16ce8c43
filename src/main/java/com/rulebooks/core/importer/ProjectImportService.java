package com.rulebooks.core.importer;

import com.rulebooks.core.expansion.RulesetSourceExpander;
import com.rulebooks.core.logging.MdcContext;
import com.rulebooks.core.metrics.ImportMetrics;
import com.rulebooks.core.model.Project;
import com.rulebooks.core.model.Rule;
import com.rulebooks.core.model.Rulebook;
import com.rulebooks.core.model.RulebookRecord;
import com.rulebooks.core.model.Ruleset;
import com.rulebooks.core.persistence.ArchiveStorage;
import com.rulebooks.core.persistence.ProjectRepository;
import com.rulebooks.core.scanner.RulebookScanner;
import com.rulebooks.core.vcs.GitClient;
import com.rulebooks.core.vcs.GitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Imports a git repository as a {@link Project}.
 * <p>
 * The repository is cloned into a temporary directory, its rulebooks are
 * scanned, expanded and stored, and a snapshot of {@code HEAD} is archived and
 * attached to the project. Everything from creating the project row to
 * attaching the archive runs in one transaction: a failure at any point leaves
 * neither rows nor a stored archive behind. The temporary directory is removed
 * on every exit path.
 * <p>
 * Importing the same URL twice creates two projects.
 */
@Service
public class ProjectImportService {

    private static final Logger log = LoggerFactory.getLogger(ProjectImportService.class);

    static final String SOURCE_DIR = "src";
    static final String ARCHIVE_FILE = "archive.tar.gz";
    static final String HEAD = "HEAD";

    private final GitClient gitClient;
    private final RulebookScanner scanner;
    private final RulesetSourceExpander sourceExpander;
    private final ProjectRepository repository;
    private final ArchiveStorage archiveStorage;
    private final PlatformTransactionManager transactionManager;
    private final ImportMetrics metrics;
    private final ImporterProperties properties;

    public ProjectImportService(GitClient gitClient,
                                RulebookScanner scanner,
                                RulesetSourceExpander sourceExpander,
                                ProjectRepository repository,
                                ArchiveStorage archiveStorage,
                                PlatformTransactionManager transactionManager,
                                ImportMetrics metrics,
                                ImporterProperties properties) {
        this.gitClient = gitClient;
        this.scanner = scanner;
        this.sourceExpander = sourceExpander;
        this.repository = repository;
        this.archiveStorage = archiveStorage;
        this.transactionManager = transactionManager;
        this.metrics = metrics;
        this.properties = properties;
    }

    public Project importProject(String name, String url) {
        return importProject(name, url, "");
    }

    /**
     * Clones {@code url} and imports its rulebooks as a new project.
     *
     * @param name        project name
     * @param url         remote git URL
     * @param description free-form description, {@code null} is stored as empty
     * @return the committed project with its archive attached
     * @throws com.rulebooks.core.vcs.GitException      if cloning, resolving or archiving fails
     * @throws ProjectImportException                   if the repository has no rulebooks
     *                                                  directory or a rulebook is malformed
     * @throws org.springframework.dao.DataAccessException if persistence fails
     */
    public Project importProject(String name, String url, String description) {
        long start = System.currentTimeMillis();
        MdcContext.setImport(name, url);
        try {
            Project project = runImport(name, url, description != null ? description : "");
            metrics.recordImportResult("success");
            log.info("Imported project {} '{}' at {}", project.id(), project.name(), project.gitHash());
            return project;
        } catch (RuntimeException e) {
            metrics.recordImportResult(e.getClass().getSimpleName());
            log.error("Import of project '{}' failed: {}", name, e.getMessage());
            throw e;
        } finally {
            metrics.recordImportDuration(System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }

    private Project runImport(String name, String url, String description) {
        Path tempDir = createTempDirectory();
        try {
            Path repoDir = tempDir.resolve(SOURCE_DIR);
            GitRepository repo = gitClient.clone(url, repoDir, properties.getCloneDepth());
            String commitId = repo.revParse(HEAD);
            log.debug("Cloned {} at {}", url, commitId);

            return importInTransaction(new Project(null, name, description, url, commitId, null, null),
                    repo, tempDir);
        } finally {
            deleteTempDirectory(tempDir);
        }
    }

    private Project importInTransaction(Project draft, GitRepository repo, Path tempDir) {
        var definition = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
        definition.setName("import:" + draft.url());
        TransactionStatus transaction = transactionManager.getTransaction(definition);

        String storedArchive = null;
        try {
            Project project = repository.createProject(draft);
            MdcContext.setProjectId(project.id());

            ImportTally tally = importRulebooks(project, repo.workingDirectory());

            storedArchive = storeProjectArchive(project, repo, tempDir);
            repository.attachArchive(project.id(), storedArchive);
            log.debug("Attached archive {} to project {}", storedArchive, project.id());
            project = project.withArchiveFile(storedArchive);

            transactionManager.commit(transaction);
            tally.report(metrics);
            return project;
        } catch (RuntimeException | Error e) {
            if (!transaction.isCompleted()) {
                transactionManager.rollback(transaction);
                log.debug("Rolled back import of {}", draft.url());
            }
            if (storedArchive != null) {
                discardArchive(storedArchive, e);
            }
            throw e;
        }
    }

    private ImportTally importRulebooks(Project project, Path repoDir) {
        var tally = new ImportTally();
        try (Stream<RulebookRecord> rulebooks = scanner.scan(repoDir)) {
            rulebooks.forEach(record -> {
                MdcContext.setRulebook(record.relativePath());
                try {
                    tally.add(importRulebook(project, record));
                } finally {
                    MdcContext.clearRulebook();
                }
            });
        }
        log.info("Imported {} rulebook(s) with {} ruleset(s) and {} rule(s)",
                tally.rulebooks, tally.rulesets, tally.rules);
        return tally;
    }

    /**
     * Stores one rulebook with its rulesets and rules.
     * <p>
     * Each pending ruleset is paired with the entry it was built from, so rules
     * always land under the ruleset of their own entry.
     */
    ImportedRulebook importRulebook(Project project, RulebookRecord record) {
        Rulebook rulebook = repository.createRulebook(
                new Rulebook(null, project.id(), record.name(), record.rawContent()));

        Map<String, List<Map<String, Object>>> expandedSources = sourceExpander.expand(record.content());

        var pending = new ArrayList<PendingRuleset>();
        for (Map<String, Object> entry : record.content()) {
            String rulesetName = requireName(entry, "ruleset", record);
            var ruleset = new Ruleset(null, rulebook.id(), rulesetName, expandedSources.get(rulesetName));
            pending.add(new PendingRuleset(ruleset, rulesOf(entry, rulesetName, record)));
        }

        List<Ruleset> rulesets = repository.createRulesets(pending.stream().map(PendingRuleset::ruleset).toList());

        var rules = new ArrayList<Rule>();
        for (int i = 0; i < rulesets.size(); i++) {
            Ruleset created = rulesets.get(i);
            for (Map<String, Object> rule : pending.get(i).rules()) {
                rules.add(new Rule(null, created.id(), requireName(rule, "rule", record), requireAction(rule, record)));
            }
        }
        List<Rule> createdRules = repository.createRules(rules);

        log.debug("Imported rulebook '{}' with {} ruleset(s) and {} rule(s)",
                rulebook.name(), rulesets.size(), createdRules.size());
        return new ImportedRulebook(rulebook, rulesets, createdRules);
    }

    private String storeProjectArchive(Project project, GitRepository repo, Path tempDir) {
        Path archiveFile = tempDir.resolve(ARCHIVE_FILE);
        repo.archive(HEAD, archiveFile, properties.getArchiveFormat());
        return archiveStorage.store(archiveFilename(project.id()), archiveFile);
    }

    /**
     * Zero-padded so that archive names sort in project order.
     */
    static String archiveFilename(long projectId) {
        return String.format("%010d.archive.tar.gz", projectId);
    }

    /**
     * Scalar names are stored as text; a missing or structured name fails the import.
     */
    private static String requireName(Map<String, Object> entry, String kind, RulebookRecord record) {
        Object name = entry.get("name");
        if (name == null || name instanceof Map<?, ?> || name instanceof Collection<?>) {
            throw new ProjectImportException(
                    "A %s in rulebook '%s' has no name".formatted(kind, record.relativePath()));
        }
        return String.valueOf(name);
    }

    /**
     * The action payload is opaque but must be present; {@code action: null} is kept as is.
     */
    private static Object requireAction(Map<String, Object> rule, RulebookRecord record) {
        if (!rule.containsKey("action")) {
            throw new ProjectImportException("Rule '%s' in rulebook '%s' has no action"
                    .formatted(rule.get("name"), record.relativePath()));
        }
        return rule.get("action");
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> rulesOf(Map<String, Object> entry, String rulesetName,
                                                     RulebookRecord record) {
        Object rules = entry.get("rules");
        if (!(rules instanceof List<?> list) || !list.stream().allMatch(Map.class::isInstance)) {
            throw new ProjectImportException("Rules of ruleset '%s' in rulebook '%s' must be a list of mappings"
                    .formatted(rulesetName, record.relativePath()));
        }
        return (List<Map<String, Object>>) rules;
    }

    private Path createTempDirectory() {
        try {
            return Files.createTempDirectory(properties.getTempPrefix());
        } catch (IOException e) {
            throw new ProjectImportException("Cannot create a temporary working directory", e);
        }
    }

    private void deleteTempDirectory(Path tempDir) {
        try {
            FileSystemUtils.deleteRecursively(tempDir);
        } catch (IOException e) {
            log.warn("Could not remove temporary directory {}: {}", tempDir, e.getMessage());
        }
    }

    private void discardArchive(String storedName, Throwable failure) {
        try {
            archiveStorage.delete(storedName);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
            log.warn("Could not remove archive {} of a rolled back import", storedName, e);
        }
    }

    /**
     * A ruleset row that has not been inserted yet, together with the rule
     * entries of the document entry it came from.
     */
    private record PendingRuleset(Ruleset ruleset, List<Map<String, Object>> rules) {}

    /**
     * Rows created for one rulebook.
     */
    record ImportedRulebook(Rulebook rulebook, List<Ruleset> rulesets, List<Rule> rules) {}

    private static final class ImportTally {
        private int rulebooks;
        private int rulesets;
        private int rules;

        void add(ImportedRulebook imported) {
            rulebooks++;
            rulesets += imported.rulesets().size();
            rules += imported.rules().size();
        }

        void report(ImportMetrics metrics) {
            metrics.recordRulebooks(rulebooks, rulesets, rules);
        }
    }
}
