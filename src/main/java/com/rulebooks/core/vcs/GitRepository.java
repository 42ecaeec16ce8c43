package com.rulebooks.core.vcs;

import java.nio.file.Path;

/**
 * A local checkout produced by {@link GitClient#clone}.
 */
public interface GitRepository {

    /** Root directory of the checkout. */
    Path workingDirectory();

    /**
     * Resolves a ref (e.g. {@code HEAD}) to a full commit id.
     *
     * @throws GitResolutionException if the ref is unknown
     */
    String revParse(String ref);

    /**
     * Writes an archive of the tree at {@code ref} to {@code output}.
     *
     * @param ref    ref whose tree is archived
     * @param output file to write
     * @param format archive format understood by git, e.g. {@code tar.gz}
     * @throws GitArchiveException if the archive cannot be written
     */
    void archive(String ref, Path output, String format);
}
