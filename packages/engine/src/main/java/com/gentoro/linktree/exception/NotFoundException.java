package com.gentoro.linktree.exception;

import java.util.Map;

/** Requested version or resource was not found. */
public class NotFoundException extends LinkTreeException {
  public NotFoundException(String message, Map<String, ?> context) {
    super(LinkTreeErrorCode.NOT_FOUND, message, context);
  }
}
