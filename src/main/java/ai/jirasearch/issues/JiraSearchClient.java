package ai.jirasearch.issues;

import ai.jirasearch.config.JiraConfig;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Searches a Jira instance through {@code /rest/api/2/search}. Issues one blocking request per call and never retries.
 */
public class JiraSearchClient implements IssueSearchService {
    private static final Logger logger = LogManager.getLogger(JiraSearchClient.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    static final String SEARCH_PATH = "/rest/api/2/search";

    private final JiraConfig config;
    private final OkHttpClient httpClient;

    public JiraSearchClient(JiraConfig config) {
        this(config, new JiraAuth(config));
    }

    JiraSearchClient(JiraConfig config, JiraAuth jiraAuth) {
        this.config = config;
        this.httpClient = jiraAuth.buildAuthenticatedClient();
    }

    @Override
    public String baseUrl() {
        return config.baseUrl();
    }

    @Override
    public SearchOutcome search(JqlQuery query) throws IOException {
        logger.debug("Executing Jira JQL query: {}", query.jql());

        var searchUrl = HttpUrl.parse(config.baseUrl() + SEARCH_PATH);
        if (searchUrl == null) {
            throw new IOException("Invalid Jira base URL: " + config.baseUrl());
        }
        HttpUrl url = searchUrl
                .newBuilder()
                .addQueryParameter("jql", query.jql())
                .addQueryParameter("maxResults", String.valueOf(query.maxResults()))
                .addQueryParameter("fields", query.fieldsParameter())
                .build();

        Request request = new Request.Builder()
                .url(url)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .get()
                .build();

        String responseBodyString;
        int code;
        try (Response response = httpClient.newCall(request).execute()) {
            code = response.code();
            ResponseBody responseBody = response.body();
            responseBodyString = responseBody != null ? responseBody.string() : "";
        } catch (IOException e) {
            logger.debug("IOException while fetching Jira issues (URL: {}): {}", request.url(), e.getMessage());
            throw e;
        }

        if (code != 200) {
            logger.debug(
                    "Jira search failed. URL: {}. HTTP Status: {}. Body: {}",
                    request.url(),
                    code,
                    abbreviate(responseBodyString));
            return new SearchOutcome.Failed(ApiError.fromStatus(code, responseBodyString));
        }

        SearchResult result;
        try {
            result = parseSearchResult(responseBodyString);
        } catch (JsonProcessingException e) {
            logger.debug(
                    "JSON parsing error while processing Jira search response. URL: {}. Error: {}",
                    request.url(),
                    e.getOriginalMessage());
            throw e;
        }
        logger.info("Fetched {} of {} Jira issues.", result.issues().size(), result.total());
        return new SearchOutcome.Found(result);
    }

    /**
     * Reads a search response body. A missing {@code issues} array is an empty page, a missing {@code total} is zero.
     */
    static SearchResult parseSearchResult(String json) throws JsonProcessingException {
        JsonNode rootNode = objectMapper.readTree(json);
        if (rootNode == null || !rootNode.isObject()) {
            throw new JsonParseFailure("Expected a JSON object from Jira search but got: " + abbreviate(json));
        }

        int total = rootNode.path("total").asInt(0);
        JsonNode issuesNode = rootNode.path("issues");

        var issues = ImmutableList.<Issue>builder();
        if (issuesNode.isArray()) {
            for (JsonNode issueNode : issuesNode) {
                String issueKey = issueNode.path("key").asText(null);
                if (issueKey == null) {
                    logger.warn("Skipping issue with null key: {}", issueNode);
                    continue;
                }

                JsonNode fieldsNode = issueNode.path("fields");
                issues.add(new Issue(
                        issueKey,
                        fieldsNode.path("summary").asText(""),
                        fieldsNode.path("status").path("name").asText(Issue.UNKNOWN_STATUS),
                        fieldsNode.path("priority").path("name").asText(Issue.NO_PRIORITY),
                        fieldsNode.path("updated").asText("")));
            }
        } else if (!issuesNode.isMissingNode() && !issuesNode.isNull()) {
            logger.warn("Jira response 'issues' field is not an array: {}", issuesNode.getNodeType());
        }

        return new SearchResult(Math.max(total, 0), issues.build());
    }

    private static String abbreviate(String text) {
        return text.length() <= 200 ? text : text.substring(0, 200) + "...";
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    /** Thrown when the body is valid JSON but not a search response object. */
    static final class JsonParseFailure extends JsonProcessingException {
        JsonParseFailure(String message) {
            super(message);
        }
    }
}
