package com.hooklight.core.git;

import com.hooklight.core.model.GitInfo;

import java.nio.file.Path;

/**
 * Supplies the current branch and commit of a working directory.
 */
public interface GitInfoProvider {

    /**
     * Never throws. Parts that cannot be determined are null.
     */
    GitInfo getGitInfo(Path cwd);
}
