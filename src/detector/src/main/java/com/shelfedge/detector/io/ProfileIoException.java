package com.shelfedge.detector.io;

/** Raised when profile input cannot be read or results cannot be written. */
public class ProfileIoException extends RuntimeException {
  public ProfileIoException(String message, Throwable cause) {
    super(message, cause);
  }
}
