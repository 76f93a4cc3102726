package com.skintip.placement.app.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Rendering engine variants the placement policy can choose between. */
public enum EngineId {
  /** General-purpose image-conditioned editing model. */
  KONTEXT("kontext"),
  /** Inpainting model tuned for filling masked regions; better at thin strokes. */
  FILL("fill");

  private final String id;

  EngineId(String id) {
    this.id = id;
  }

  @JsonValue
  public String id() {
    return id;
  }

  @JsonCreator
  public static EngineId fromId(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("engine must not be blank");
    }
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (EngineId e : values()) {
      if (e.id.equals(v)) return e;
    }
    throw new IllegalArgumentException("Unknown engine: " + value);
  }

  @Override
  public String toString() {
    return id;
  }
}
