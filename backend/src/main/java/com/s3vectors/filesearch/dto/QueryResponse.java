package com.s3vectors.filesearch.dto;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.s3vectors.filesearch.service.vector.QueryResult;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

  @JsonProperty("results")
  private List<Match> results;

  @JsonProperty("total_results")
  private int totalResults;

  @JsonProperty("requested_top_k")
  private int requestedTopK;

  @JsonProperty("effective_top_k")
  private int effectiveTopK;

  @JsonProperty("query_time_ms")
  private long queryTimeMs;

  @Data
  @Builder
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Match {

    @JsonProperty("file_id")
    private String fileId;

    @JsonProperty("similarity_score")
    private double similarityScore;

    @JsonProperty("metadata")
    private Map<String, String> metadata;
  }

  public static QueryResponse from(QueryResult result) {
    List<Match> matches =
        result.getMatches().stream()
            .map(
                match ->
                    Match.builder()
                        .fileId(match.getKey())
                        .similarityScore(match.getSimilarityScore())
                        .metadata(match.getMetadata())
                        .build())
            .collect(Collectors.toList());
    return QueryResponse.builder()
        .results(matches)
        .totalResults(matches.size())
        .requestedTopK(result.getRequestedTopK())
        .effectiveTopK(result.getEffectiveTopK())
        .queryTimeMs(result.getQueryTimeMs())
        .build();
  }
}
