package ai.jirasearch.cli;

import ai.jirasearch.config.JiraConfig;
import ai.jirasearch.exception.ConfigurationException;
import ai.jirasearch.issues.FilterIntent;
import ai.jirasearch.issues.IssueSearchService;
import ai.jirasearch.issues.JiraSearchClient;
import ai.jirasearch.issues.JqlQuery;
import ai.jirasearch.issues.JqlQueryBuilder;
import ai.jirasearch.issues.SearchOutcome;
import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

@CommandLine.Command(
        name = "jira-search",
        mixinStandardHelpOptions = true,
        versionProvider = JiraSearchCli.ManifestVersionProvider.class,
        description = "List Jira issues by assignee or label. Reads JIRA_USERNAME and JIRA_TOKEN from the environment.")
public final class JiraSearchCli implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(JiraSearchCli.class);

    static final String DEFAULT_ASSIGNEE = "mihall3";
    static final String DEFAULT_MAX_RESULTS = "" + JqlQuery.DEFAULT_MAX_RESULTS;

    @CommandLine.Option(
            names = "--assignee",
            paramLabel = "USERNAME",
            description = "Find issues assigned to this user (default: ${DEFAULT-VALUE}).",
            defaultValue = DEFAULT_ASSIGNEE)
    private String assignee = DEFAULT_ASSIGNEE;

    @CommandLine.Option(names = "--label", paramLabel = "LABEL", description = "Find issues with this label.")
    @Nullable
    private String label;

    @CommandLine.Option(
            names = "--labels",
            paramLabel = "LABEL1,LABEL2",
            description = "Find issues with any of these comma-separated labels (all of them with --match-all).")
    @Nullable
    private String labels;

    @CommandLine.Option(names = "--match-all", description = "With --labels, require every label to match.")
    private boolean matchAll = false;

    @CommandLine.Option(
            names = "--max-results",
            paramLabel = "N",
            description = "Maximum number of issues to fetch (default: ${DEFAULT-VALUE}).",
            defaultValue = DEFAULT_MAX_RESULTS)
    private int maxResults = JqlQuery.DEFAULT_MAX_RESULTS;

    // injected by picocli before call()
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final Map<String, String> environment;
    private final Function<JiraConfig, IssueSearchService> serviceFactory;

    public JiraSearchCli() {
        this(System.getenv(), JiraSearchClient::new);
    }

    JiraSearchCli(Map<String, String> environment, Function<JiraConfig, IssueSearchService> serviceFactory) {
        this.environment = environment;
        this.serviceFactory = serviceFactory;
    }

    public static void main(String[] args) {
        logger.debug("Starting jira-search");
        int exitCode = newCommandLine(new JiraSearchCli()).execute(args);
        System.exit(exitCode);
    }

    /** Wires the error handlers so every failure, including bad usage, ends with exit status 1. */
    static CommandLine newCommandLine(JiraSearchCli cli) {
        var commandLine = new CommandLine(cli);
        commandLine.setParameterExceptionHandler((ex, args) -> {
            var err = ex.getCommandLine().getErr();
            err.println("Error: " + ex.getMessage());
            err.flush();
            return 1;
        });
        commandLine.setExecutionExceptionHandler((ex, cmd, parseResult) -> {
            logger.error("Unexpected failure", ex);
            cmd.getErr().println("Error: " + ex.getMessage());
            cmd.getErr().flush();
            return 1;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            var config = JiraConfig.fromEnvironment(environment);
            var intent = resolveIntent();
            var query = JqlQueryBuilder.build(intent, maxResults, JqlQuery.DEFAULT_FIELDS);

            try (var service = serviceFactory.apply(config)) {
                var outcome = service.search(query);
                if (outcome instanceof SearchOutcome.Failed failed) {
                    return fail(err, failed.error().message());
                }
                var result = ((SearchOutcome.Found) outcome).result();
                new IssueListRenderer(service.baseUrl()).render(result, intent.describe(), out);
                return 0;
            }
        } catch (ConfigurationException | IOException | IllegalArgumentException e) {
            logger.debug("Search failed", e);
            return fail(err, e.getMessage());
        }
    }

    /** Precedence: --label, then a non-empty --labels, then --assignee. */
    FilterIntent resolveIntent() {
        if (label != null) {
            return new FilterIntent.ByLabel(label);
        }
        List<String> labelList = parseLabels(labels);
        if (!labelList.isEmpty()) {
            return new FilterIntent.ByLabels(labelList, matchAll);
        }
        return new FilterIntent.ByAssignee(assignee);
    }

    static List<String> parseLabels(@Nullable String raw) {
        if (raw == null) {
            return List.of();
        }
        return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(raw);
    }

    private static int fail(PrintWriter err, @Nullable String message) {
        err.println("Error: " + message);
        err.flush();
        return 1;
    }

    public static final class ManifestVersionProvider implements CommandLine.IVersionProvider {
        @Override
        public String[] getVersion() {
            var version = JiraSearchCli.class.getPackage().getImplementationVersion();
            return new String[] {"jira-search " + (version == null ? "dev" : version)};
        }
    }
}
