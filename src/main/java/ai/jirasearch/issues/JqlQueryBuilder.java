package ai.jirasearch.issues;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Translates a {@link FilterIntent} into JQL. Pure; the same intent always yields the same query.
 *
 * <p>Assignee names are inserted unquoted, so Jira treats them as identifiers. Labels are wrapped in double quotes
 * but embedded quotes are passed through as-is: a label containing {@code "} produces JQL the server rejects with
 * a 400.
 */
public final class JqlQueryBuilder {
    static final String ORDER_BY_UPDATED = " ORDER BY updated DESC";

    private JqlQueryBuilder() {}

    public static JqlQuery build(FilterIntent intent) {
        return build(intent, JqlQuery.DEFAULT_MAX_RESULTS, JqlQuery.DEFAULT_FIELDS);
    }

    public static JqlQuery build(FilterIntent intent, int maxResults, Set<String> fields) {
        return new JqlQuery(toJql(intent), maxResults, fields);
    }

    public static String toJql(FilterIntent intent) {
        if (intent instanceof FilterIntent.ByAssignee byAssignee) {
            return String.format("assignee = %s%s", byAssignee.username(), ORDER_BY_UPDATED);
        }
        if (intent instanceof FilterIntent.ByLabel byLabel) {
            return labelClause(byLabel.label()) + ORDER_BY_UPDATED;
        }
        if (intent instanceof FilterIntent.ByLabels byLabels) {
            var operator = byLabels.matchAll() ? " AND " : " OR ";
            var conditions = byLabels.labels().stream()
                    .map(JqlQueryBuilder::labelClause)
                    .collect(Collectors.joining(operator));
            return "(" + conditions + ")" + ORDER_BY_UPDATED;
        }
        throw new IllegalArgumentException("Unsupported filter: " + intent.getClass().getName());
    }

    private static String labelClause(String label) {
        return String.format("labels = \"%s\"", label);
    }
}
