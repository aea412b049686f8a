package com.gentoro.linktree.exception;

/** I/O operation failed (outline files, tagged database CSV, classpath resources). */
public class IoException extends LinkTreeException {
  public IoException(String message) {
    super(LinkTreeErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(LinkTreeErrorCode.IO_ERROR, message, cause);
  }
}
