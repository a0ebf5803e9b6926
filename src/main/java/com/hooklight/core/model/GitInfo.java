package com.hooklight.core.model;

import java.io.Serializable;

/**
 * Branch and short commit of a working directory. Either part is null when git could not
 * report it.
 */
public record GitInfo(String branch, String commit) implements Serializable {

    public static GitInfo none() {
        return new GitInfo(null, null);
    }
}
