package com.prrules.analyzer;

import com.prrules.analyzer.model.PullRequest;
import com.prrules.analyzer.model.Repository;
import com.prrules.analyzer.model.ReviewComment;

/**
 * GitHub DTOs shared by store, processor and orchestrator tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Repository repository(long id, String owner, String name) {
        return new Repository(id, name, owner + "/" + name, new Repository.Owner(owner),
                "https://github.com/" + owner + "/" + name, "Test repository", "Python",
                false, false, "2024-01-01T00:00:00Z", "2024-06-01T00:00:00Z");
    }

    public static PullRequest closedPullRequest(long id, int number) {
        return new PullRequest(id, number, "Change #" + number, "Body of #" + number, PullRequest.STATE_CLOSED,
                "https://github.com/octo/repo/pull/" + number,
                "2024-05-10T08:00:00Z", "2024-05-12T16:00:00Z",
                "2024-05-12T16:00:00Z", "2024-05-12T16:00:00Z",
                new PullRequest.User("author", 1));
    }

    public static ReviewComment reviewComment(long id, String body, String path, Integer position, String diffHunk) {
        return new ReviewComment(id, body, path, position, position, "RIGHT", diffHunk,
                "https://github.com/octo/repo/pull/1#discussion_r" + id,
                "2024-05-11T12:00:00Z", "2024-05-11T12:00:00Z",
                new ReviewComment.User("reviewer", 2));
    }

    public static ReviewComment issueComment(long id, String body) {
        return new ReviewComment(id, body, null, null, null, null, null,
                "https://github.com/octo/repo/pull/1#issuecomment-" + id,
                "2024-05-11T12:00:00Z", "2024-05-11T12:00:00Z",
                new ReviewComment.User("reviewer", 2));
    }
}
