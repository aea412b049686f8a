package com.gentoro.linktree;

import com.gentoro.linktree.exception.ExceptionUtil;
import com.gentoro.linktree.utility.JacksonUtility;

public class LinkTreeApp {

  private static final org.slf4j.Logger log =
      com.gentoro.linktree.logging.LoggingService.getLogger(LinkTreeApp.class);

  public static void main(String[] args) {
    try {
      LinkTree app = new LinkTree(args);
      if (!"help".equals(app.startupParameters().mode())) {
        app.initialize();
      }
      System.out.println(JacksonUtility.toJson(app.run()));
    } catch (Exception e) {
      log.error("Command failed", e);
      System.err.println(JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)));
      System.exit(1);
    }
  }
}
