package com.skintip.placement.app.service;

import com.skintip.placement.app.exception.ExternalServiceException;
import java.time.Duration;
import lombok.extern.log4j.Log4j2;
import org.springframework.http.HttpStatusCode;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/** Fetches the raw bytes of a generated output image. */
@Log4j2
public class ImageDownloadService {

  public static final String SERVICE = "output-download";

  private static final Duration TIMEOUT = Duration.ofSeconds(60);
  private static final int MAX_BYTES = 32 * 1024 * 1024;

  private final WebClient webClient;

  public ImageDownloadService(WebClient.Builder builder) {
    this.webClient =
        builder.codecs(c -> c.defaultCodecs().maxInMemorySize(MAX_BYTES)).build();
  }

  public byte[] download(String url) {
    try {
      byte[] bytes =
          webClient
              .get()
              .uri(url)
              .retrieve()
              .onStatus(HttpStatusCode::isError, r -> r.createException())
              .bodyToMono(byte[].class)
              .block(TIMEOUT);
      if (bytes == null || bytes.length == 0) {
        throw new ExternalServiceException(SERVICE, "empty body from " + url, null, null);
      }
      log.debug("download.ok url={} size={}", url, bytes.length);
      return bytes;
    } catch (WebClientResponseException e) {
      log.error("download.error url={} status={}", url, e.getStatusCode().value());
      throw new ExternalServiceException(
          SERVICE,
          "download of " + url + " failed",
          e.getStatusCode().value(),
          e.getResponseBodyAsString());
    } catch (WebClientRequestException | IllegalStateException e) {
      log.error("download.error url={} msg={}", url, e.getMessage());
      throw new ExternalServiceException(SERVICE, "download of " + url + " failed", e);
    }
  }
}
