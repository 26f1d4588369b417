package ai.jirasearch.config;

import ai.jirasearch.exception.ConfigurationException;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Connection settings for a Jira instance. Built once at startup and handed to the search client.
 *
 * <p>The base URL may be overridden via JIRA_BASE_URL, which is useful for test instances or a different
 * deployment of the tracker. Credentials have no defaults.
 */
public record JiraConfig(String baseUrl, String username, String apiToken) {
    private static final Logger logger = LogManager.getLogger(JiraConfig.class);

    public static final String ENV_USERNAME = "JIRA_USERNAME";
    public static final String ENV_TOKEN = "JIRA_TOKEN";
    public static final String ENV_BASE_URL = "JIRA_BASE_URL";

    public static final String DEFAULT_BASE_URL = "https://jira-eng-rtp1.cisco.com/jira";

    public JiraConfig {
        baseUrl = stripTrailingSlashes(baseUrl);
    }

    /** Reads the configuration from the process environment. */
    public static JiraConfig fromEnvironment() throws ConfigurationException {
        return fromEnvironment(System.getenv());
    }

    public static JiraConfig fromEnvironment(Map<String, String> env) throws ConfigurationException {
        var username = require(env, ENV_USERNAME);
        var token = require(env, ENV_TOKEN);

        var baseUrl = env.get(ENV_BASE_URL);
        if (baseUrl == null || baseUrl.isBlank()) {
            baseUrl = DEFAULT_BASE_URL;
        } else {
            logger.debug("Using Jira base URL from {}: {}", ENV_BASE_URL, baseUrl.trim());
        }
        return new JiraConfig(baseUrl.trim(), username, token);
    }

    private static String require(Map<String, String> env, String name) throws ConfigurationException {
        @Nullable String value = env.get(name);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException(name + " environment variable is not set");
        }
        return value.trim();
    }

    private static String stripTrailingSlashes(String url) {
        var result = url;
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    @Override
    public String toString() {
        return "JiraConfig[baseUrl=" + baseUrl + ", username=" + username + ", apiToken=****]";
    }
}
