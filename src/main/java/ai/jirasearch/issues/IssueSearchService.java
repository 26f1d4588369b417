package ai.jirasearch.issues;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Runs issue searches against a tracker. Transport and parse failures are thrown as {@link IOException}; HTTP-level
 * rejections come back as {@link SearchOutcome.Failed}.
 */
public interface IssueSearchService extends AutoCloseable {

    SearchOutcome search(JqlQuery query) throws IOException;

    /** Base URL used to build browse links for returned issues. */
    String baseUrl();

    default SearchOutcome search(String jql, int maxResults, Set<String> fields) throws IOException {
        return search(new JqlQuery(jql, maxResults, fields));
    }

    default SearchOutcome search(FilterIntent intent) throws IOException {
        return search(JqlQueryBuilder.build(intent));
    }

    default SearchOutcome findIssuesAssignedTo(String username) throws IOException {
        return search(new FilterIntent.ByAssignee(username));
    }

    default SearchOutcome findIssuesByLabel(String label) throws IOException {
        return search(new FilterIntent.ByLabel(label));
    }

    default SearchOutcome findIssuesByLabels(List<String> labels, boolean matchAll) throws IOException {
        return search(new FilterIntent.ByLabels(labels, matchAll));
    }

    @Override
    default void close() {}
}
