package com.gentoro.linktree.exception;

/** Configuration problem detected while loading or resolving settings. */
public class ConfigException extends LinkTreeException {
  public ConfigException(String message) {
    super(LinkTreeErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(LinkTreeErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
