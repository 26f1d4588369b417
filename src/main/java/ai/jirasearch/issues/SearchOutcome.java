package ai.jirasearch.issues;

/** Either a complete page of results or the API error that prevented it. There is no partial result. */
public sealed interface SearchOutcome permits SearchOutcome.Found, SearchOutcome.Failed {

    record Found(SearchResult result) implements SearchOutcome {}

    record Failed(ApiError error) implements SearchOutcome {}
}
