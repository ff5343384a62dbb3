package ca.gc.cra.helio.infrastructure.raster;

import ca.gc.cra.helio.domain.raster.GrayRaster;

/**
 * Separable Lanczos (a = 3) resampler for eight-bit grayscale rasters.
 *
 * <p>When shrinking, the kernel is stretched by the inverse scale so every source pixel contributes. Samples past
 * the border repeat the edge pixel.</p>
 */
final class LanczosResampler {
  static final int LOBES = 3;

  private LanczosResampler() {}

  static GrayRaster resample(GrayRaster source, int width, int height) {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("target size must be positive (was " + width + "x" + height + ")");
    }
    if (source.width() == width && source.height() == height) {
      return source;
    }
    int srcWidth = source.width();
    int srcHeight = source.height();
    byte[] in = source.pixels();
    Taps horizontal = Taps.compute(srcWidth, width);
    Taps vertical = Taps.compute(srcHeight, height);

    float[] rows = new float[srcHeight * width];
    for (int y = 0; y < srcHeight; y++) {
      int rowOffset = y * srcWidth;
      for (int x = 0; x < width; x++) {
        int[] idx = horizontal.indices[x];
        float[] w = horizontal.weights[x];
        float sum = 0f;
        for (int t = 0; t < idx.length; t++) {
          sum += (in[rowOffset + idx[t]] & 0xFF) * w[t];
        }
        rows[y * width + x] = sum;
      }
    }

    byte[] out = new byte[Math.multiplyExact(width, height)];
    for (int y = 0; y < height; y++) {
      int[] idx = vertical.indices[y];
      float[] w = vertical.weights[y];
      for (int x = 0; x < width; x++) {
        float sum = 0f;
        for (int t = 0; t < idx.length; t++) {
          sum += rows[idx[t] * width + x] * w[t];
        }
        out[y * width + x] = (byte) clamp(Math.round(sum));
      }
    }
    return new GrayRaster(width, height, out);
  }

  static double kernel(double x) {
    if (x == 0.0) {
      return 1.0;
    }
    if (x <= -LOBES || x >= LOBES) {
      return 0.0;
    }
    double px = Math.PI * x;
    return LOBES * Math.sin(px) * Math.sin(px / LOBES) / (px * px);
  }

  private static int clamp(int value) {
    return value < 0 ? 0 : Math.min(value, 255);
  }

  /** Per-output-sample source indices and normalized weights along one axis. */
  private static final class Taps {
    final int[][] indices;
    final float[][] weights;

    private Taps(int[][] indices, float[][] weights) {
      this.indices = indices;
      this.weights = weights;
    }

    static Taps compute(int inSize, int outSize) {
      double scale = (double) outSize / inSize;
      double stretch = scale < 1.0 ? 1.0 / scale : 1.0;
      double support = LOBES * stretch;
      int[][] indices = new int[outSize][];
      float[][] weights = new float[outSize][];
      for (int i = 0; i < outSize; i++) {
        double center = (i + 0.5) / scale;
        int left = (int) Math.floor(center - support);
        int right = (int) Math.ceil(center + support);
        int n = right - left + 1;
        int[] idx = new int[n];
        double[] raw = new double[n];
        double total = 0.0;
        for (int t = 0; t < n; t++) {
          int j = left + t;
          raw[t] = kernel((j + 0.5 - center) / stretch);
          idx[t] = Math.min(Math.max(j, 0), inSize - 1);
          total += raw[t];
        }
        float[] w = new float[n];
        for (int t = 0; t < n; t++) {
          w[t] = (float) (total == 0.0 ? 0.0 : raw[t] / total);
        }
        indices[i] = idx;
        weights[i] = w;
      }
      return new Taps(indices, weights);
    }
  }
}
