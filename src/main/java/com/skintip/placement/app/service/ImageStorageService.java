package com.skintip.placement.app.service;

import com.skintip.placement.app.config.StorageProperties;
import com.skintip.placement.app.exception.ExternalServiceException;
import com.skintip.placement.app.util.ImageCodec;
import java.util.Objects;
import java.util.UUID;
import lombok.extern.log4j.Log4j2;
import org.apache.commons.io.FilenameUtils;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectResponse;

/** Writes finished renders and debug inputs to S3 and hands back their public URLs. */
@Log4j2
public class ImageStorageService {

  public static final String SERVICE = "object-storage";

  private final S3Client s3;
  private final StorageProperties props;

  public ImageStorageService(S3Client s3, StorageProperties props) {
    this.s3 = Objects.requireNonNull(s3, "S3Client must not be null");
    this.props = Objects.requireNonNull(props, "StorageProperties must not be null");
  }

  // ------------------ Public API ------------------

  /**
   * Uploads {@code bytes} to {@code <userId>/<folder>/<fileName>}. Any directory part of {@code
   * fileName} is dropped.
   *
   * @return public URL of the stored object
   */
  public String upload(
      byte[] bytes, String fileName, String userId, String folder, String contentType) {
    String key = objectKey(userId, folder, fileName);
    String ct =
        (contentType == null || contentType.isBlank()) ? "application/octet-stream" : contentType;
    try {
      PutObjectRequest req =
          PutObjectRequest.builder()
              .bucket(props.getBucket())
              .key(key)
              .contentType(ct)
              .contentLength((long) bytes.length)
              .build();

      PutObjectResponse resp = s3.putObject(req, RequestBody.fromBytes(bytes));

      log.info(
          "storage.upload ok bucket={} key={} size={} eTag={}",
          props.getBucket(),
          key,
          bytes.length,
          resp.eTag());
      return publicUrl(key);
    } catch (SdkException e) {
      log.error(
          "storage.upload error bucket={} key={} msg={}",
          props.getBucket(),
          key,
          e.getMessage(),
          e);
      throw new ExternalServiceException(SERVICE, "upload of " + key + " failed", e);
    }
  }

  /** Uploads a PNG under a fresh {@code tattoo-<uuid>.png} name. */
  public String uploadPng(byte[] png, String userId, String folder) {
    String name = "tattoo-" + UUID.randomUUID() + ".png";
    return upload(png, name, userId, folder, ImageCodec.PNG_CONTENT_TYPE);
  }

  // ------------------ Helpers ------------------

  static String objectKey(String userId, String folder, String fileName) {
    String name = FilenameUtils.getName(fileName);
    if (name == null || name.isBlank()) {
      name = UUID.randomUUID().toString();
    }
    StringBuilder key = new StringBuilder();
    appendSegment(key, userId);
    appendSegment(key, folder);
    return key.append(name).toString();
  }

  private static void appendSegment(StringBuilder key, String segment) {
    if (segment == null) return;
    String s = segment.trim();
    while (s.startsWith("/")) s = s.substring(1);
    while (s.endsWith("/")) s = s.substring(0, s.length() - 1);
    if (!s.isEmpty()) key.append(s).append('/');
  }

  String publicUrl(String key) {
    String base = props.getPublicBaseUrl();
    if (base != null && !base.isBlank()) {
      return (base.endsWith("/") ? base : base + "/") + key;
    }
    return "https://" + props.getBucket() + ".s3." + props.getRegion() + ".amazonaws.com/" + key;
  }
}
