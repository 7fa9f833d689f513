package de.bsommerfeld.sysml.sql.api;

import java.util.Objects;

/**
 * Chooses the commit to fetch within a project.
 */
public record CommitSelector(Kind kind, String value) {

    public enum Kind {
        COMMIT_ID,
        /** Head commit of the branch with this id. */
        BRANCH_ID,
        /** Head commit of the only branch whose name starts with the value. */
        BRANCH_NAME,
        /** Head commit of the project's default branch. */
        DEFAULT_BRANCH
    }

    public CommitSelector {
        Objects.requireNonNull(kind, "kind");
        if ((kind == Kind.DEFAULT_BRANCH) != (value == null)) {
            throw new IllegalArgumentException(kind + " " + (value == null ? "requires" : "takes no") + " value");
        }
    }

    public static CommitSelector commitId(String commitId) {
        return new CommitSelector(Kind.COMMIT_ID, commitId);
    }

    public static CommitSelector branchId(String branchId) {
        return new CommitSelector(Kind.BRANCH_ID, branchId);
    }

    public static CommitSelector branchName(String namePrefix) {
        return new CommitSelector(Kind.BRANCH_NAME, namePrefix);
    }

    public static CommitSelector defaultBranch() {
        return new CommitSelector(Kind.DEFAULT_BRANCH, null);
    }
}
