package com.skintip.placement.app.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.skintip.placement.app.config.GenerationProperties;
import com.skintip.placement.app.exception.ExternalServiceException;
import com.skintip.placement.app.model.GenerationJob;
import com.skintip.placement.app.model.JobStatus;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Thin client for the asynchronous prediction API: one call to submit a job, one call to read
 * its current state. Polling policy lives in {@link JobPoller}.
 */
@Log4j2
public class ImageGenerationClient {

  public static final String SERVICE = "generation-api";

  private final WebClient webClient;
  private final GenerationProperties props;

  public ImageGenerationClient(WebClient.Builder builder, GenerationProperties props) {
    this.props = Objects.requireNonNull(props, "GenerationProperties must not be null");
    this.webClient = builder.baseUrl(trimSlash(props.getApiBaseUrl())).build();
  }

  /**
   * Creates a prediction.
   *
   * @param version model version selector
   * @param input model input (prompt, images as data URIs, sampling parameters)
   * @param endpointOverride absolute URL to post to instead of {@code <base>/predictions}, or null
   * @return the job as acknowledged by the API (id and initial status)
   */
  public GenerationJob submit(String version, Map<String, Object> input, String endpointOverride) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("version", version);
    body.put("input", input);

    boolean override = endpointOverride != null && !endpointOverride.isBlank();
    log.info(
        "generation.submit version={} endpoint={} outputs={}",
        version,
        override ? endpointOverride : "<default>",
        input.get("num_outputs"));

    WebClient.RequestBodySpec spec =
        override ? webClient.post().uri(endpointOverride) : webClient.post().uri("/predictions");

    JsonNode response =
        exchange(
            spec.header("Authorization", "Bearer " + props.getApiToken())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> toError(r, "submission rejected"))
                .bodyToMono(JsonNode.class),
            props.getRequestTimeout(),
            "submission");

    GenerationJob job = toJob(response, 0);
    if (job.getId() == null || job.getId().isBlank()) {
      throw new ExternalServiceException(
          SERVICE, "submission returned no job id", null, String.valueOf(response));
    }
    log.info("generation.submitted jobId={} status={}", job.getId(), job.getRawStatus());
    return job;
  }

  /** Reads the current state of job {@code id}. */
  public GenerationJob fetch(String id) {
    JsonNode response =
        exchange(
            webClient
                .get()
                .uri("/predictions/{id}", id)
                .header("Authorization", "Bearer " + props.getApiToken())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, r -> toError(r, "poll failed"))
                .bodyToMono(JsonNode.class),
            props.getPollTimeout(),
            "poll");
    return toJob(response, 0);
  }

  // ------------------ Helpers ------------------

  private static JsonNode exchange(Mono<JsonNode> call, Duration timeout, String what) {
    try {
      JsonNode node = call.block(timeout);
      if (node == null) {
        throw new ExternalServiceException(SERVICE, what + " returned an empty body", null, null);
      }
      return node;
    } catch (WebClientResponseException e) {
      // answered, but the body could not be read as JSON
      throw new ExternalServiceException(
          SERVICE, what + " returned an unreadable response: " + e.getMessage(), e);
    } catch (WebClientException | IllegalStateException e) {
      // transport failure or blocking timeout
      throw new ExternalServiceException(SERVICE, what + " transport error: " + e.getMessage(), e);
    }
  }

  private static Mono<ExternalServiceException> toError(ClientResponse response, String what) {
    int status = response.statusCode().value();
    return response
        .bodyToMono(String.class)
        .defaultIfEmpty("")
        .map(
            body ->
                new ExternalServiceException(SERVICE, what + " (" + status + ")", status, body));
  }

  static GenerationJob toJob(JsonNode node, int attempts) {
    String raw = node.path("status").asText(null);
    GenerationJob.GenerationJobBuilder job =
        GenerationJob.builder()
            .id(node.path("id").asText(null))
            .rawStatus(raw)
            .status(JobStatus.fromWire(raw))
            .attempts(attempts)
            .error(textOrNull(node.get("error")))
            .logs(textOrNull(node.get("logs")));

    JsonNode output = node.get("output");
    if (output != null && output.isArray()) {
      for (JsonNode o : output) {
        if (o.isTextual() && !o.asText().isBlank()) job.output(o.asText());
      }
    } else if (output != null && output.isTextual() && !output.asText().isBlank()) {
      job.output(output.asText());
    }
    return job.build();
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull() || n.isMissingNode()) return null;
    return n.isTextual() ? n.asText() : n.toString();
  }

  private static String trimSlash(String url) {
    if (url == null) return "";
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
