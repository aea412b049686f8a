package com.gentoro.linktree;

import com.gentoro.linktree.exception.StateException;
import com.gentoro.linktree.logging.LoggingService;
import com.gentoro.linktree.procedure.NewProcedure;
import com.gentoro.linktree.service.LinkTreeService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/** Application context: parses startup options, loads configuration and runs one command. */
public class LinkTree {
  private static final org.slf4j.Logger log = LoggingService.getLogger(LinkTree.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private LinkTreeService service;

  public LinkTree(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    this.configurationProvider = new ConfigurationProvider(startupParameters.configFile());
    LoggingService.applyConfiguration(configuration());
    this.service = new LinkTreeService(configuration());
    log.info(
        "{} initialized with {} version(s)",
        configuration().getString("linktree.title", "Links Manager"),
        service.versions().size());
  }

  /**
   * Execute the command selected by {@code --mode}.
   *
   * @return the command result, ready to be serialized as JSON
   */
  public Object run() {
    String version = startupParameters.getParameter("version", String.class);
    switch (startupParameters.mode()) {
      case "tree":
        return service().view(version);
      case "graph":
        return service().view(version).graph();
      case "keywords":
        return service().keywordVocabulary(version);
      case "search":
        return service().search(version, text("query"));
      case "update-tag":
        return result("updated", service().updateProcedureTag(version, text("code"), text("tag")));
      case "add":
        NewProcedure request =
            new NewProcedure(text("code"), text("title"), text("link"), text("tag"));
        return result("added", service().addProcedure(version, request));
      case "help":
        return usage();
      default:
        throw new IllegalArgumentException("Invalid mode: " + startupParameters.mode());
    }
  }

  private String text(String name) {
    return startupParameters.getOptionalParameter(name, String.class).orElse("");
  }

  private static Map<String, Object> result(String key, boolean value) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(key, value);
    return map;
  }

  private static Map<String, Object> usage() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(
        "usage",
        "--config-file <location> --mode <tree|graph|keywords|search|update-tag|add|help>"
            + " [--version id] [--query text] [--code c] [--title t] [--link l] [--tag a;b]");
    return map;
  }

  /** Expose the application configuration to other components. */
  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("LinkTree not initialized. Call initialize() first.");
    }
    return configurationProvider.config();
  }

  public LinkTreeService service() {
    if (service == null) {
      throw new StateException("LinkTree not initialized. Call initialize() first.");
    }
    return service;
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }
}
