package org.waabox.baker.datamodel;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SigImageConfig} and {@link SigImageConfigTemplate}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SigImageConfigTest {

  @Test
  void whenChangingVersion_shouldLeaveOriginalUntouched() {
    final SigImageConfig original = new SigImageConfig("AKS-Ubuntu",
        "AKSUbuntu", "2204containerd", "202405.20.0", "sub");

    final SigImageConfig copy = original.withVersion("202406.01.0");

    assertEquals("202405.20.0", original.version());
    assertEquals("202406.01.0", copy.version());
    assertEquals(original.definition(), copy.definition());
    assertNotEquals(original, copy);
  }

  @Test
  void whenBinding_givenGallery_shouldFillLocation() {
    final SigImageConfig config = new SigImageConfigTemplate("V2gen2",
        "202405.20.0").bind(new SigGalleryConfig("AKSCBLMariner",
            "AKS-CBLMariner"), "sub-9");

    assertEquals(new SigImageConfig("AKS-CBLMariner", "AKSCBLMariner",
        "V2gen2", "202405.20.0", "sub-9"), config);
  }
}
