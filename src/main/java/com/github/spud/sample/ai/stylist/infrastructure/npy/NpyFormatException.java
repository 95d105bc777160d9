package com.github.spud.sample.ai.stylist.infrastructure.npy;

import java.io.IOException;

/**
 * The bytes are not a .npy array of the expected dtype and shape
 */
public class NpyFormatException extends IOException {

  public NpyFormatException(String message) {
    super(message);
  }
}
