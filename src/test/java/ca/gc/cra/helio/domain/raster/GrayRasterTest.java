package ca.gc.cra.helio.domain.raster;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class GrayRasterTest {

  @Test
  void mirrorReversesEachRow() {
    GrayRaster raster = new GrayRaster(3, 2, new byte[] {1, 2, 3, 4, 5, 6});

    assertArrayEquals(new byte[] {3, 2, 1, 6, 5, 4}, raster.mirrorHorizontal().pixels());
  }

  @Test
  void pixelCountMustMatchDimensions() {
    assertThrows(IllegalArgumentException.class, () -> new GrayRaster(2, 2, new byte[3]));
    assertEquals(12, GrayRaster.black(4, 3).pixels().length);
  }

  @Test
  void scalePolicyFloorsAndFitPolicyIgnoresInput() {
    ResamplePolicy half = ResamplePolicy.scale(0.5);
    ResamplePolicy fit = ResamplePolicy.fit(64, 32);

    assertEquals(2048, half.outputWidth(4096));
    assertEquals(1, half.outputHeight(1));
    assertEquals(64, fit.outputWidth(4096));
    assertEquals(32, fit.outputHeight(7));
  }

  @Test
  void normalizationPolicyDefaultsFormatAndTracksMirrors() {
    NormalizationPolicy policy =
        new NormalizationPolicy(ResamplePolicy.scale(1.0), ColorPolicy.ENCODED, " PNG ", false, Set.of(19));

    assertEquals("png", policy.encodedFormat());
    assertTrue(policy.mirrors(19));
  }
}
