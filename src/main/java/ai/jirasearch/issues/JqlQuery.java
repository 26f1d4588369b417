package ai.jirasearch.issues;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A JQL query plus the paging parameters sent alongside it. Results are always ordered most recently updated
 * first; the ordering is part of {@link #jql()}.
 */
public record JqlQuery(String jql, int maxResults, Set<String> fields) {
    public static final int DEFAULT_MAX_RESULTS = 50;

    /** Iteration order is preserved, so the fields parameter is stable from run to run. */
    public static final Set<String> DEFAULT_FIELDS = Collections.unmodifiableSet(
            new LinkedHashSet<>(List.of("summary", "status", "assignee", "priority", "created", "updated")));

    public JqlQuery {
        if (jql.isBlank()) {
            throw new IllegalArgumentException("JQL must not be blank");
        }
        if (maxResults <= 0) {
            throw new IllegalArgumentException("maxResults must be positive, got " + maxResults);
        }
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("At least one field must be requested");
        }
        fields = Collections.unmodifiableSet(new LinkedHashSet<>(fields));
    }

    public JqlQuery(String jql) {
        this(jql, DEFAULT_MAX_RESULTS, DEFAULT_FIELDS);
    }

    /** Comma-joined field list as the search endpoint expects it. */
    public String fieldsParameter() {
        return String.join(",", fields);
    }
}
