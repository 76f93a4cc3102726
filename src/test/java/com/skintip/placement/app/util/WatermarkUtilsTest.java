package com.skintip.placement.app.util;

import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;

class WatermarkUtilsTest {

  @Test
  void undecodableBytesAreReturnedUnchanged() {
    byte[] junk = {0x01, 0x02, 0x03};

    assertSame(junk, WatermarkUtils.apply(junk));
  }
}
