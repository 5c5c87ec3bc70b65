package com.semsearch.query;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.semsearch.error.ErrorKind;
import com.semsearch.error.SemanticSearchException;

/**
 * Result slot of a batch query: either ranked results or the failure of that one query.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record QueryOutcome(
        @JsonProperty("query") String query,
        @JsonProperty("results") List<RankedResult> results,
        @JsonProperty("error") ErrorKind error,
        @JsonProperty("message") String message) {

    public static QueryOutcome success(String query, List<RankedResult> results) {
        return new QueryOutcome(query, List.copyOf(results), null, null);
    }

    public static QueryOutcome failure(String query, SemanticSearchException failure) {
        return new QueryOutcome(query, null, failure.kind(), failure.getMessage());
    }

    @JsonProperty("success")
    public boolean isSuccess() {
        return error == null;
    }
}
