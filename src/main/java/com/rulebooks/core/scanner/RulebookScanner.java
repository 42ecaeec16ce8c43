package com.rulebooks.core.scanner;

import com.rulebooks.core.importer.ProjectImportException;
import com.rulebooks.core.model.RulebookRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.FileVisitor;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks the {@code rulebooks} directory of a checked-out repository and yields
 * every file that parses as a rulebook.
 * <p>
 * A file is a rulebook when its YAML document is a list whose entries are all
 * maps carrying a {@code rules} key. Anything else under the directory is
 * expected and skipped: other YAML at debug level, broken YAML at warn level,
 * and unexpected read failures, including directories that cannot be listed,
 * at error level. None of these stop the walk.
 * <p>
 * Symbolic links are not followed, so a crafted repository cannot make the
 * scanner read files outside its checkout.
 */
@Service
public class RulebookScanner {

    private static final Logger log = LoggerFactory.getLogger(RulebookScanner.class);

    /** Directory, relative to the repository root, that holds rulebooks. */
    public static final String RULEBOOKS_DIR = "rulebooks";

    /** Extensions a candidate file must carry. Matched case-sensitively. */
    static final Set<String> YAML_EXTENSIONS = Set.of(".yml", ".yaml");

    /**
     * Returns a lazy stream of the rulebooks under {@code repositoryRoot/rulebooks}.
     * <p>
     * Candidate files are listed up front; each is read and parsed only when the
     * stream reaches it. Callers close the stream, e.g. with try-with-resources.
     * Order follows the filesystem walk and is stable for an unchanged tree.
     *
     * @param repositoryRoot root of the checked-out repository
     * @return stream of parsed rulebook files
     * @throws MissingRulebooksDirectoryException if the rulebooks directory does not exist
     */
    public Stream<RulebookRecord> scan(Path repositoryRoot) {
        Path rulebooksDir = repositoryRoot.resolve(RULEBOOKS_DIR);
        if (!Files.isDirectory(rulebooksDir, LinkOption.NOFOLLOW_LINKS)) {
            throw new MissingRulebooksDirectoryException(repositoryRoot);
        }

        List<Path> candidates = new ArrayList<>();
        try {
            walk(rulebooksDir, new CandidateCollector(candidates));
        } catch (IOException e) {
            throw new ProjectImportException("Failed to walk " + rulebooksDir, e);
        }

        return candidates.stream()
                .map(path -> tryLoadRulebook(repositoryRoot, path))
                .flatMap(Optional::stream);
    }

    /**
     * Walks {@code start} without following symbolic links.
     */
    void walk(Path start, FileVisitor<Path> visitor) throws IOException {
        Files.walkFileTree(start, visitor);
    }

    /**
     * Returns {@code true} if {@code data} has the shape of a rulebook.
     * An empty list qualifies and produces a rulebook without rulesets.
     */
    static boolean isRulebook(Object data) {
        if (!(data instanceof List<?> entries)) {
            return false;
        }
        return entries.stream()
                .allMatch(entry -> entry instanceof Map<?, ?> map && map.containsKey("rules"));
    }

    static boolean hasYamlExtension(Path path) {
        String filename = path.getFileName().toString();
        int dot = filename.lastIndexOf('.');
        // a leading dot marks a hidden file, not an extension (".yml" alone has none)
        if (dot <= 0) {
            return false;
        }
        return YAML_EXTENSIONS.contains(filename.substring(dot));
    }

    private Optional<RulebookRecord> tryLoadRulebook(Path repositoryRoot, Path path) {
        try {
            Optional<RulebookRecord> rulebook = loadRulebook(repositoryRoot, path);
            if (rulebook.isEmpty()) {
                log.debug("Not a rulebook file: {}", path);
            }
            return rulebook;
        } catch (IOException | RuntimeException e) {
            log.error("Unexpected exception when scanning file {}. Skipping.", path, e);
            return Optional.empty();
        }
    }

    @SuppressWarnings("unchecked")
    private Optional<RulebookRecord> loadRulebook(Path repositoryRoot, Path path) throws IOException {
        String rawContent = Files.readString(path, StandardCharsets.UTF_8);

        Object content;
        try {
            content = newYaml().load(rawContent);
        } catch (YAMLException e) {
            log.warn("Invalid YAML file {}: {}", path, e.getMessage());
            return Optional.empty();
        }

        if (!isRulebook(content)) {
            return Optional.empty();
        }

        return Optional.of(new RulebookRecord(
                relativePath(repositoryRoot, path),
                rawContent,
                (List<Map<String, Object>>) content));
    }

    private static String relativePath(Path repositoryRoot, Path path) {
        Path relative = repositoryRoot.relativize(path);
        return StreamSupport.stream(relative.spliterator(), false)
                .map(Path::toString)
                .collect(Collectors.joining("/"));
    }

    /**
     * Collects regular files with a YAML extension. Entries that cannot be
     * read are logged and skipped so one unreadable directory does not end
     * the walk.
     */
    static final class CandidateCollector extends SimpleFileVisitor<Path> {

        private final List<Path> candidates;

        CandidateCollector(List<Path> candidates) {
            this.candidates = candidates;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && hasYamlExtension(file)) {
                candidates.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) {
            log.error("Unexpected exception when scanning {}. Skipping.", file, e);
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException e) {
            if (e != null) {
                log.error("Unexpected exception when listing directory {}. Skipping the rest of it.", dir, e);
            }
            return FileVisitResult.CONTINUE;
        }
    }

    /** SnakeYAML instances are not thread-safe; one per document. */
    private static Yaml newYaml() {
        return new Yaml(new SafeConstructor(new LoaderOptions()));
    }
}
