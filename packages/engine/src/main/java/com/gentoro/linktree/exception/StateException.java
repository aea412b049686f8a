package com.gentoro.linktree.exception;

/** Component used before it was initialized, or in an otherwise illegal state. */
public class StateException extends LinkTreeException {
  public StateException(String message) {
    super(LinkTreeErrorCode.FAILED_PRECONDITION, message);
  }
}
