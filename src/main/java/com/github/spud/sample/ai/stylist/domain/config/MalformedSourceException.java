package com.github.spud.sample.ai.stylist.domain.config;

/**
 * A configuration source was present but its content could not be used. Always caught by
 * {@link ConfigResolver}, which moves on to the next tier.
 */
public class MalformedSourceException extends Exception {

  public MalformedSourceException(String message) {
    super(message);
  }

  public MalformedSourceException(String message, Throwable cause) {
    super(message, cause);
  }
}
