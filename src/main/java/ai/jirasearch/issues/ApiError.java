package ai.jirasearch.issues;

/**
 * A non-200 answer from the search endpoint. Each variant carries a message that tells the user what to check.
 */
public sealed interface ApiError permits ApiError.Unauthorized, ApiError.Forbidden, ApiError.NotFound, ApiError.Other {

    String message();

    /** Maps an HTTP status other than 200 to its error variant. */
    static ApiError fromStatus(int statusCode, String body) {
        return switch (statusCode) {
            case 401 -> new Unauthorized();
            case 403 -> new Forbidden();
            case 404 -> new NotFound();
            default -> new Other(statusCode, body);
        };
    }

    /** Token missing, invalid or expired. */
    record Unauthorized() implements ApiError {
        @Override
        public String message() {
            return "Authentication failed. Check your JIRA_TOKEN.";
        }
    }

    record Forbidden() implements ApiError {
        @Override
        public String message() {
            return "Access forbidden. You may not have permission to access this resource.";
        }
    }

    /** Usually a wrong base URL. */
    record NotFound() implements ApiError {
        @Override
        public String message() {
            return "Resource not found. Check the Jira URL.";
        }
    }

    record Other(int statusCode, String body) implements ApiError {
        @Override
        public String message() {
            return "Request failed with status %d: %s".formatted(statusCode, body);
        }
    }
}
