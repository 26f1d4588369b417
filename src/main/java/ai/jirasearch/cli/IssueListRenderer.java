package ai.jirasearch.cli;

import ai.jirasearch.issues.Issue;
import ai.jirasearch.issues.SearchResult;
import com.google.common.base.Strings;
import java.io.PrintWriter;
import org.jetbrains.annotations.Nullable;

/** Plain-text listing of a search page, one numbered block per issue. */
public final class IssueListRenderer {
    private static final String RULE = Strings.repeat("=", 80);

    private final String baseUrl;

    public IssueListRenderer(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public void render(SearchResult result, @Nullable String title, PrintWriter out) {
        out.println(RULE);
        out.println(
                title == null
                        ? "Found %d issue(s)".formatted(result.total())
                        : "Found %d issue(s) for: %s".formatted(result.total(), title));
        out.println(RULE);
        out.println();

        if (result.issues().isEmpty()) {
            out.println("No issues found.");
            out.flush();
            return;
        }

        int index = 1;
        for (Issue issue : result.issues()) {
            out.printf("%d. [%s] %s%n", index++, issue.key(), issue.summary());
            out.printf("   Status: %s | Priority: %s%n", issue.status(), issue.priority());
            out.printf("   Updated: %s%n", issue.updated());
            out.printf("   URL: %s%n", issue.browseUrl(baseUrl));
            out.println();
        }
        out.flush();
    }
}
