package com.skintip.placement.app.service;

import com.skintip.placement.app.config.BackgroundRemovalProperties;
import com.skintip.placement.app.util.ImageCodec;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Cuts the background out of a tattoo design. This step is best-effort: whatever goes wrong, the
 * caller gets the normalized original back and generation continues.
 */
@Log4j2
public class BackgroundRemovalService {

  static final String UPLOAD_FILENAME = "tattoo_design.png";

  private final WebClient webClient;
  private final BackgroundRemovalProperties props;

  public BackgroundRemovalService(WebClient.Builder builder, BackgroundRemovalProperties props) {
    this.props = Objects.requireNonNull(props, "BackgroundRemovalProperties must not be null");
    this.webClient = builder.build();
  }

  /**
   * @param design design image in any decodable format
   * @return PNG with transparent background, or the design normalized to PNG on any failure
   * @throws com.skintip.placement.app.exception.PlacementValidationException if {@code design}
   *     cannot be decoded at all
   */
  public byte[] removeBackground(byte[] design) {
    byte[] original = ImageCodec.normalizeToPng(design, "tattoo design");

    if (props.getApiKey() == null || props.getApiKey().isBlank()) {
      log.warn("removebg.skip reason=no-api-key");
      return original;
    }

    MultipartBodyBuilder parts = new MultipartBodyBuilder();
    parts
        .part(
            "image_file",
            new ByteArrayResource(original) {
              @Override
              public String getFilename() {
                return UPLOAD_FILENAME;
              }
            })
        .contentType(MediaType.IMAGE_PNG);
    parts.part("size", props.getSize());
    parts.part("format", props.getFormat());

    try {
      ResponseEntity<byte[]> response =
          webClient
              .post()
              .uri(props.getApiUrl())
              .header("X-Api-Key", props.getApiKey())
              .contentType(MediaType.MULTIPART_FORM_DATA)
              .body(BodyInserters.fromMultipartData(parts.build()))
              .exchangeToMono(r -> r.toEntity(byte[].class))
              .block(props.getTimeout());

      if (response == null || response.getStatusCode().value() != 200) {
        log.warn(
            "removebg.fallback status={} body={}",
            response == null ? null : response.getStatusCode().value(),
            response == null ? "" : describe(response.getBody()));
        return original;
      }
      byte[] body = response.getBody();
      if (body == null || body.length == 0) {
        log.warn("removebg.fallback reason=empty-body");
        return original;
      }

      byte[] png = ImageCodec.normalizeToPng(body, "background-removed design");
      log.info("removebg.ok in={} out={}", original.length, png.length);
      return png;
    } catch (RuntimeException e) {
      log.warn("removebg.fallback reason={} msg={}", e.getClass().getSimpleName(), e.getMessage());
      return original;
    }
  }

  /** Error payload as UTF-8 text, cut to 300 chars for the log line. */
  static String describe(byte[] body) {
    if (body == null) return "";
    String s = new String(body, StandardCharsets.UTF_8);
    return s.length() > 300 ? s.substring(0, 300) + "...(truncated)" : s;
  }
}
