package com.github.spud.sample.ai.stylist.infrastructure.npy;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads and writes one-dimensional float arrays in NumPy's .npy format.
 *
 * <p>Layout: the magic string {@code \x93NUMPY}, a major and minor version byte, the header
 * length (little-endian u16 for version 1, u32 for versions 2 and 3), an ASCII Python dict
 * literal such as {@code {'descr': '<f8', 'fortran_order': False, 'shape': (768,), }} padded
 * with spaces and a newline so the data starts on a 64-byte boundary, then the raw values.
 *
 * <p>Files are written as version 1.0 with dtype {@code <f8}. On read {@code <f8}, {@code >f8},
 * {@code <f4} and {@code >f4} are accepted; float32 values are widened.
 */
@Slf4j
@Component
public class NpyVectorCodec {

  private static final byte[] MAGIC = {(byte) 0x93, 'N', 'U', 'M', 'P', 'Y'};
  private static final int HEADER_ALIGNMENT = 64;
  private static final String WRITE_DESCR = "<f8";

  private static final Pattern DESCR = Pattern.compile("'descr'\\s*:\\s*'([^']*)'");
  private static final Pattern SHAPE = Pattern.compile("'shape'\\s*:\\s*\\(([^)]*)\\)");

  public double[] read(Path path, int expectedLength) throws IOException {
    return decode(Files.readAllBytes(path), expectedLength);
  }

  public double[] decode(byte[] bytes, int expectedLength) throws NpyFormatException {
    if (bytes.length < MAGIC.length + 4) {
      throw new NpyFormatException("file too short for a .npy header");
    }
    for (int i = 0; i < MAGIC.length; i++) {
      if (bytes[i] != MAGIC[i]) {
        throw new NpyFormatException("missing .npy magic string");
      }
    }

    ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    buffer.position(MAGIC.length);
    int major = buffer.get() & 0xFF;
    buffer.get();
    long headerLength;
    if (major == 1) {
      headerLength = buffer.getShort() & 0xFFFF;
    } else if (major == 2 || major == 3) {
      if (buffer.remaining() < Integer.BYTES) {
        throw new NpyFormatException("truncated header length");
      }
      headerLength = buffer.getInt() & 0xFFFFFFFFL;
    } else {
      throw new NpyFormatException("unsupported .npy version " + major);
    }
    if (headerLength > buffer.remaining()) {
      throw new NpyFormatException("header length " + headerLength + " exceeds file size");
    }

    byte[] headerBytes = new byte[(int) headerLength];
    buffer.get(headerBytes);
    String header = new String(headerBytes,
      major == 3 ? StandardCharsets.UTF_8 : StandardCharsets.ISO_8859_1);

    Dtype dtype = Dtype.parse(field(DESCR, header, "descr"));
    List<Long> shape = parseShape(field(SHAPE, header, "shape"));
    if (shape.size() != 1) {
      throw new NpyFormatException("expected a 1-D array but shape is " + shape);
    }
    if (shape.get(0) != expectedLength) {
      throw new NpyFormatException(
        "expected shape (" + expectedLength + ",) but found (" + shape.get(0) + ",)");
    }

    long dataLength = (long) expectedLength * dtype.size;
    if (buffer.remaining() != dataLength) {
      throw new NpyFormatException(
        "expected " + dataLength + " data bytes but found " + buffer.remaining());
    }

    buffer.order(dtype.order);
    double[] values = new double[expectedLength];
    for (int i = 0; i < expectedLength; i++) {
      values[i] = dtype.size == Double.BYTES ? buffer.getDouble() : buffer.getFloat();
    }
    return values;
  }

  public byte[] encode(double[] values) {
    String dict = "{'descr': '" + WRITE_DESCR + "', 'fortran_order': False, 'shape': ("
      + values.length + ",), }";
    int prefixLength = MAGIC.length + 2 + Short.BYTES;
    int unpadded = prefixLength + dict.length() + 1;
    int padding = (HEADER_ALIGNMENT - unpadded % HEADER_ALIGNMENT) % HEADER_ALIGNMENT;
    String header = dict + " ".repeat(padding) + "\n";

    ByteBuffer buffer = ByteBuffer
      .allocate(prefixLength + header.length() + values.length * Double.BYTES)
      .order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(MAGIC);
    buffer.put((byte) 1);
    buffer.put((byte) 0);
    buffer.putShort((short) header.length());
    buffer.put(header.getBytes(StandardCharsets.US_ASCII));
    for (double value : values) {
      buffer.putDouble(value);
    }
    return buffer.array();
  }

  /**
   * Writes to a sibling temporary file and renames it over {@code target}.
   */
  public void writeAtomically(Path target, double[] values) throws IOException {
    Path absolute = target.toAbsolutePath();
    Path directory = absolute.getParent();
    Files.createDirectories(directory);

    Path temp = Files.createTempFile(directory, absolute.getFileName().toString(), ".tmp");
    try {
      Files.write(temp, encode(values));
      try {
        Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE,
          StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        log.debug("Atomic move not supported in {}, replacing in place", directory);
        Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING);
      }
    } finally {
      Files.deleteIfExists(temp);
    }
  }

  private static String field(Pattern pattern, String header, String name)
    throws NpyFormatException {
    Matcher matcher = pattern.matcher(header);
    if (!matcher.find()) {
      throw new NpyFormatException("header has no '" + name + "' entry");
    }
    return matcher.group(1);
  }

  private static List<Long> parseShape(String dims) throws NpyFormatException {
    List<Long> shape = new ArrayList<>();
    for (String part : dims.split(",")) {
      String dim = part.strip();
      if (dim.isEmpty()) {
        continue;
      }
      try {
        shape.add(Long.parseLong(dim));
      } catch (NumberFormatException e) {
        throw new NpyFormatException("invalid shape entry '" + dim + "'");
      }
    }
    return shape;
  }

  private enum Dtype {
    LE_F8("<f8", ByteOrder.LITTLE_ENDIAN, Double.BYTES),
    BE_F8(">f8", ByteOrder.BIG_ENDIAN, Double.BYTES),
    LE_F4("<f4", ByteOrder.LITTLE_ENDIAN, Float.BYTES),
    BE_F4(">f4", ByteOrder.BIG_ENDIAN, Float.BYTES);

    private final String descr;
    private final ByteOrder order;
    private final int size;

    Dtype(String descr, ByteOrder order, int size) {
      this.descr = descr;
      this.order = order;
      this.size = size;
    }

    static Dtype parse(String descr) throws NpyFormatException {
      for (Dtype dtype : values()) {
        if (dtype.descr.equals(descr)) {
          return dtype;
        }
      }
      throw new NpyFormatException("unsupported dtype '" + descr + "'");
    }
  }
}
