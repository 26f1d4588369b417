package ai.jirasearch.issues;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ApiErrorTest {

    @Test
    void knownStatusesMapToDedicatedVariants() {
        assertInstanceOf(ApiError.Unauthorized.class, ApiError.fromStatus(401, ""));
        assertInstanceOf(ApiError.Forbidden.class, ApiError.fromStatus(403, ""));
        assertInstanceOf(ApiError.NotFound.class, ApiError.fromStatus(404, ""));
    }

    @Test
    void otherStatusesKeepCodeAndBody() {
        var error = ApiError.fromStatus(502, "Bad Gateway");
        assertEquals(new ApiError.Other(502, "Bad Gateway"), error);
        assertEquals("Request failed with status 502: Bad Gateway", error.message());
    }

    @Test
    void messagesPointAtTheLikelyCause() {
        assertTrue(new ApiError.Unauthorized().message().contains("JIRA_TOKEN"));
        assertTrue(new ApiError.Forbidden().message().contains("permission"));
        assertTrue(new ApiError.NotFound().message().contains("Jira URL"));
    }
}
