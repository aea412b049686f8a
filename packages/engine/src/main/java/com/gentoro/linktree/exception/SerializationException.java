package com.gentoro.linktree.exception;

/** JSON/YAML/CSV serialization or deserialization error. */
public class SerializationException extends LinkTreeException {
  public SerializationException(String message) {
    super(LinkTreeErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(LinkTreeErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
