package com.rulebooks.core.importer;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "rulebooks")
public class ImporterProperties {

    private Import importSettings = new Import();
    private Storage storage = new Storage();
    private Git git = new Git();

    // -- Import accessors (delegate to nested) --
    public String getTempPrefix() { return importSettings.tempPrefix; }
    public int getCloneDepth() { return importSettings.cloneDepth; }
    public String getArchiveFormat() { return importSettings.archiveFormat; }

    // -- Storage / git accessors (delegate to nested) --
    public String getArchiveDir() { return storage.archiveDir; }
    public boolean isInitializeSchema() { return storage.initializeSchema; }
    public String getGitExecutable() { return git.executable; }

    /** Bound from {@code rulebooks.import.*}; {@code import} is a Java keyword. */
    public Import getImport() { return importSettings; }
    public void setImport(Import importSettings) { this.importSettings = importSettings; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Git getGit() { return git; }
    public void setGit(Git git) { this.git = git; }

    public static class Import {
        private String tempPrefix = "eda-project-";
        private int cloneDepth = 1;
        private String archiveFormat = "tar.gz";

        public String getTempPrefix() { return tempPrefix; }
        public void setTempPrefix(String tempPrefix) { this.tempPrefix = tempPrefix; }
        public int getCloneDepth() { return cloneDepth; }
        public void setCloneDepth(int cloneDepth) { this.cloneDepth = cloneDepth; }
        public String getArchiveFormat() { return archiveFormat; }
        public void setArchiveFormat(String archiveFormat) { this.archiveFormat = archiveFormat; }
    }

    public static class Storage {
        private String archiveDir = "data/archives";
        private boolean initializeSchema = true;

        public String getArchiveDir() { return archiveDir; }
        public void setArchiveDir(String archiveDir) { this.archiveDir = archiveDir; }
        public boolean isInitializeSchema() { return initializeSchema; }
        public void setInitializeSchema(boolean initializeSchema) { this.initializeSchema = initializeSchema; }
    }

    public static class Git {
        private String executable = "git";

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
    }
}
