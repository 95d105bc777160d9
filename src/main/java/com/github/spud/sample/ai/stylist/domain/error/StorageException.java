package com.github.spud.sample.ai.stylist.domain.error;

/**
 * Durable storage could not be read or written. Raised for file writes of the embedding and
 * for every agent state store failure; never raised for a lost concurrent-write race.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
