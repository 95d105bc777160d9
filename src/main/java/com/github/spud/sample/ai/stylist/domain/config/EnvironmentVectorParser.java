package com.github.spud.sample.ai.stylist.domain.config;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Base64;

/**
 * Decodes a vector carried inline in a variable.
 *
 * <p>Two encodings are accepted:
 * <ul>
 *   <li>comma-separated decimals, e.g. {@code 0.12, -0.5, 3e-4}</li>
 *   <li>{@code base64:} followed by standard Base64 of little-endian IEEE-754 float64 values</li>
 * </ul>
 */
public final class EnvironmentVectorParser {

  static final String BASE64_PREFIX = "base64:";

  private EnvironmentVectorParser() {
  }

  public static double[] parse(String raw, int dimensions) throws MalformedSourceException {
    String value = raw.strip();
    double[] vector = value.startsWith(BASE64_PREFIX)
      ? decodeBase64(value.substring(BASE64_PREFIX.length()).strip())
      : decodeList(value);

    if (vector.length != dimensions) {
      throw new MalformedSourceException(
        "expected " + dimensions + " values but found " + vector.length);
    }
    for (int i = 0; i < vector.length; i++) {
      if (!Double.isFinite(vector[i])) {
        throw new MalformedSourceException("non-finite value at index " + i);
      }
    }
    return vector;
  }

  public static String encodeBase64(double[] vector) {
    ByteBuffer buffer = ByteBuffer.allocate(vector.length * Double.BYTES)
      .order(ByteOrder.LITTLE_ENDIAN);
    for (double v : vector) {
      buffer.putDouble(v);
    }
    return BASE64_PREFIX + Base64.getEncoder().encodeToString(buffer.array());
  }

  private static double[] decodeList(String value) throws MalformedSourceException {
    if (value.isEmpty()) {
      throw new MalformedSourceException("empty value");
    }
    String[] parts = value.split(",", -1);
    double[] vector = new double[parts.length];
    for (int i = 0; i < parts.length; i++) {
      String part = parts[i].strip();
      try {
        vector[i] = Double.parseDouble(part);
      } catch (NumberFormatException e) {
        throw new MalformedSourceException("unparsable value '" + part + "' at index " + i, e);
      }
    }
    return vector;
  }

  private static double[] decodeBase64(String value) throws MalformedSourceException {
    byte[] bytes;
    try {
      bytes = Base64.getDecoder().decode(value);
    } catch (IllegalArgumentException e) {
      throw new MalformedSourceException("invalid base64 payload", e);
    }
    if (bytes.length % Double.BYTES != 0) {
      throw new MalformedSourceException(
        "base64 payload of " + bytes.length + " bytes is not a whole number of float64 values");
    }
    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    double[] vector = new double[bytes.length / Double.BYTES];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = buffer.getDouble();
    }
    return vector;
  }
}
