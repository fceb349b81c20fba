package com.recipedirectory.config;

import com.google.common.base.Strings;
import com.recipedirectory.common.status.Status;
import com.recipedirectory.common.status.StatusOr;
import java.util.Map;

/**
 * HTTP listener configuration.
 *
 * @param port The port the REST server binds to
 */
public record ServerConfig(int port) {

  public static final String PORT_VARIABLE = "PORT";
  public static final int DEFAULT_PORT = 5004;

  /**
   * Reads {@code PORT} from the environment, defaulting to {@value #DEFAULT_PORT} when unset.
   *
   * @param env The environment, usually {@code System.getenv()}
   * @return The configuration, or INVALID_ARGUMENT when the port is not a valid TCP port
   */
  public static StatusOr<ServerConfig> fromEnvironment(Map<String, String> env) {
    String rawPort = env.get(PORT_VARIABLE);
    if (Strings.isNullOrEmpty(rawPort)) {
      return StatusOr.ofValue(new ServerConfig(DEFAULT_PORT));
    }
    int port;
    try {
      port = Integer.parseInt(rawPort.trim());
    } catch (NumberFormatException e) {
      return StatusOr.ofStatus(
          Status.invalidArgument(PORT_VARIABLE + " is not a number: " + rawPort));
    }
    if (port < 0 || port > 65535) {
      return StatusOr.ofStatus(Status.invalidArgument(PORT_VARIABLE + " is out of range: " + port));
    }
    return StatusOr.ofValue(new ServerConfig(port));
  }
}
