package ai.jirasearch.issues;

import com.google.common.collect.ImmutableList;

/**
 * A single page of search results. {@code total} is the server's count of all matches and may exceed the number of
 * issues returned.
 */
public record SearchResult(int total, ImmutableList<Issue> issues) {
    public SearchResult {
        if (total < 0) {
            throw new IllegalArgumentException("total must not be negative, got " + total);
        }
    }

    public static SearchResult empty() {
        return new SearchResult(0, ImmutableList.of());
    }
}
