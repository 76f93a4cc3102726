package com.skintip.placement.app.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Object storage target for finished renders and debug inputs. */
@Data
@ConfigurationProperties(prefix = "storage")
public class StorageProperties {
  private String bucket = "generated-tattoos";
  private String region = "us-east-1";

  /**
   * Public base URL objects are served from (CDN or bucket website). When blank the virtual-host
   * S3 URL of {@link #bucket} is used.
   */
  private String publicBaseUrl;
}
