package com.codegraph.builder.vcs;

import java.nio.file.Path;
import java.util.List;

/**
 * Source of the changed-file set and commit identity for a diff run.
 */
public interface ChangeSource {

    /**
     * Project-relative paths ('/' separators) changed since {@code ref}.
     *
     * @throws VcsException if the change set cannot be determined
     */
    List<String> changedFiles(Path projectRoot, String ref);

    /**
     * @throws VcsException if the current commit cannot be determined
     */
    String headCommit(Path projectRoot);
}
