package com.skintip.placement.app.model;

import lombok.Builder;
import lombok.Value;

/** Skin, design and mask shared by every row of one hill-climb batch. */
@Value
@Builder(toBuilder = true)
public class PlacementInputs {
  byte[] skinImage;
  byte[] tattooDesign;
  byte[] mask;
  String userId;
}
