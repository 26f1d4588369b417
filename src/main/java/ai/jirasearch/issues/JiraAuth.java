package ai.jirasearch.issues;

import ai.jirasearch.config.JiraConfig;
import java.time.Duration;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/** Builds OkHttp clients that authenticate against Jira with a Bearer token and send each request once. */
public class JiraAuth {
    private static final Logger logger = LogManager.getLogger(JiraAuth.class);

    public static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration READ_TIMEOUT = Duration.ofSeconds(30);

    private static final int HTTP_SERVICE_UNAVAILABLE = 503;

    private final JiraConfig config;
    private final Duration connectTimeout;
    private final Duration readTimeout;

    public JiraAuth(JiraConfig config) {
        this(config, CONNECT_TIMEOUT, READ_TIMEOUT);
    }

    JiraAuth(JiraConfig config, Duration connectTimeout, Duration readTimeout) {
        this.config = config;
        this.connectTimeout = connectTimeout;
        this.readTimeout = readTimeout;
    }

    public OkHttpClient buildAuthenticatedClient() {
        var apiToken = config.apiToken();

        var client = new OkHttpClient.Builder()
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .followRedirects(true)
                .retryOnConnectionFailure(false)
                .addInterceptor(chain -> {
                    Request originalRequest = chain.request();
                    Request authenticatedRequest = originalRequest
                            .newBuilder()
                            .header("Authorization", "Bearer " + apiToken)
                            .build();
                    return chain.proceed(authenticatedRequest);
                })
                .addNetworkInterceptor(chain -> {
                    Response response = chain.proceed(chain.request());
                    // OkHttp re-sends a request answered by 503 with Retry-After: 0
                    if (response.code() == HTTP_SERVICE_UNAVAILABLE && response.header("Retry-After") != null) {
                        return response.newBuilder().removeHeader("Retry-After").build();
                    }
                    return response;
                })
                .build();
        logger.debug("Authenticated OkHttpClient (Bearer Token) created for Jira user {}", config.username());
        return client;
    }
}
