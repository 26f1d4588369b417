package ai.jirasearch.issues;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class JqlQueryBuilderTest {

    @Test
    void assigneeIsInsertedUnquoted() {
        var query = JqlQueryBuilder.build(new FilterIntent.ByAssignee("jdoe"));
        assertEquals("assignee = jdoe ORDER BY updated DESC", query.jql());
    }

    @ParameterizedTest
    @ValueSource(strings = {"backend", "needs triage", "release-2.1", "ünïcode"})
    void singleLabelIsQuoted(String label) {
        var query = JqlQueryBuilder.build(new FilterIntent.ByLabel(label));
        assertEquals("labels = \"" + label + "\" ORDER BY updated DESC", query.jql());
    }

    @Test
    void embeddedQuotesInLabelsAreNotEscaped() {
        var jql = JqlQueryBuilder.toJql(new FilterIntent.ByLabel("say \"hi\""));
        assertEquals("labels = \"say \"hi\"\" ORDER BY updated DESC", jql);
    }

    @Test
    void matchAllJoinsLabelsWithAnd() {
        var jql = JqlQueryBuilder.toJql(new FilterIntent.ByLabels(List.of("a", "b"), true));
        assertEquals("(labels = \"a\" AND labels = \"b\") ORDER BY updated DESC", jql);
    }

    @Test
    void matchAnyJoinsLabelsWithOr() {
        var jql = JqlQueryBuilder.toJql(new FilterIntent.ByLabels(List.of("a", "b"), false));
        assertEquals("(labels = \"a\" OR labels = \"b\") ORDER BY updated DESC", jql);
    }

    @Test
    void singleElementLabelSetIsStillParenthesized() {
        var jql = JqlQueryBuilder.toJql(new FilterIntent.ByLabels(List.of("solo"), true));
        assertEquals("(labels = \"solo\") ORDER BY updated DESC", jql);
    }

    @Test
    void labelOrderIsPreserved() {
        var jql = JqlQueryBuilder.toJql(new FilterIntent.ByLabels(List.of("z", "a", "m"), false));
        assertEquals("(labels = \"z\" OR labels = \"a\" OR labels = \"m\") ORDER BY updated DESC", jql);
    }

    @Test
    void defaultsApplyWhenNoOverridesGiven() {
        var query = JqlQueryBuilder.build(new FilterIntent.ByAssignee("jdoe"));
        assertEquals(50, query.maxResults());
        assertEquals("summary,status,assignee,priority,created,updated", query.fieldsParameter());
    }

    @Test
    void overridesArePassedThrough() {
        var query = JqlQueryBuilder.build(new FilterIntent.ByLabel("x"), 10, Set.of("summary"));
        assertEquals(10, query.maxResults());
        assertEquals("summary", query.fieldsParameter());
    }

    @Test
    void sameIntentBuildsEqualQueries() {
        var intent = new FilterIntent.ByLabels(List.of("a", "b"), true);
        assertEquals(JqlQueryBuilder.build(intent), JqlQueryBuilder.build(intent));
    }

    @Test
    void nonPositiveMaxResultsIsRejected() {
        var intent = new FilterIntent.ByAssignee("jdoe");
        assertThrows(IllegalArgumentException.class, () -> JqlQueryBuilder.build(intent, 0, JqlQuery.DEFAULT_FIELDS));
    }

    @Test
    void emptyFieldSetIsRejected() {
        var intent = new FilterIntent.ByAssignee("jdoe");
        assertThrows(IllegalArgumentException.class, () -> JqlQueryBuilder.build(intent, 5, Set.of()));
    }
}
