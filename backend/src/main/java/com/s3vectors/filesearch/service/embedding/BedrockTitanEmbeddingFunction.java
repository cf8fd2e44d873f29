package com.s3vectors.filesearch.service.embedding;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.s3vectors.filesearch.exception.EmbeddingException;

import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.services.bedrockruntime.BedrockRuntimeClient;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelRequest;
import software.amazon.awssdk.services.bedrockruntime.model.InvokeModelResponse;

/** Embeds text with an Amazon Titan Text Embeddings model on AWS Bedrock. */
@Slf4j
public class BedrockTitanEmbeddingFunction implements EmbeddingFunction {

  private final BedrockRuntimeClient bedrockClient;
  private final ObjectMapper objectMapper;
  private final String embeddingModelId;
  private final int dimensions;
  private final boolean normalize;

  public BedrockTitanEmbeddingFunction(
      BedrockRuntimeClient bedrockClient,
      ObjectMapper objectMapper,
      String embeddingModelId,
      int dimensions,
      boolean normalize) {
    this.bedrockClient = bedrockClient;
    this.objectMapper = objectMapper;
    this.embeddingModelId = embeddingModelId;
    this.dimensions = dimensions;
    this.normalize = normalize;
  }

  @Override
  public String modelId() {
    return embeddingModelId;
  }

  @Override
  public List<Float> embed(String text) {
    log.debug(
        "Generating embedding for text: {}",
        text.substring(0, Math.min(text.length(), 100)) + "...");

    try {
      Map<String, Object> requestBody = new LinkedHashMap<>();
      requestBody.put("inputText", text);
      requestBody.put("dimensions", dimensions);
      requestBody.put("normalize", normalize);

      String payload = objectMapper.writeValueAsString(requestBody);

      InvokeModelRequest invokeRequest =
          InvokeModelRequest.builder()
              .modelId(embeddingModelId)
              .contentType("application/json")
              .accept("application/json")
              .body(SdkBytes.fromString(payload, StandardCharsets.UTF_8))
              .build();

      InvokeModelResponse response = bedrockClient.invokeModel(invokeRequest);

      String responseJson = response.body().asUtf8String();
      @SuppressWarnings("unchecked")
      Map<String, Object> responseMap = objectMapper.readValue(responseJson, Map.class);

      @SuppressWarnings("unchecked")
      List<Number> embedding = (List<Number>) responseMap.get("embedding");
      if (embedding == null || embedding.isEmpty()) {
        throw new EmbeddingException("Embedding model returned no vector");
      }

      return embedding.stream().map(Number::floatValue).collect(Collectors.toList());

    } catch (EmbeddingException e) {
      throw e;
    } catch (Exception e) {
      log.error("Error generating embedding for text", e);
      throw new EmbeddingException("Failed to generate embedding", e);
    }
  }
}
