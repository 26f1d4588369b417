package ai.jirasearch.issues;

/** One issue from a search page. {@code updated} is Jira's timestamp string, unparsed. */
public record Issue(
        String key, // e.g. "FOO-456"
        String summary,
        String status,
        String priority,
        String updated) {
    public static final String UNKNOWN_STATUS = "Unknown";
    public static final String NO_PRIORITY = "None";

    public String browseUrl(String baseUrl) {
        return baseUrl + "/browse/" + key;
    }
}
