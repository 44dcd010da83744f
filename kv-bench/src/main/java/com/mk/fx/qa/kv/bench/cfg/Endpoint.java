package com.mk.fx.qa.kv.bench.cfg;

import com.mk.fx.qa.kv.bench.exception.ConfigurationException;

/** Server address a client dials. */
public record Endpoint(String host, int port) {

  /**
   * Parses {@code host:port}, optionally prefixed with a {@code tcp://} scheme. An empty host means
   * the loopback address.
   */
  public static Endpoint parse(String address) {
    if (address == null || address.isBlank()) {
      throw new ConfigurationException("Server address must be provided");
    }
    String value = address.trim();
    int scheme = value.indexOf("://");
    if (scheme >= 0) {
      value = value.substring(scheme + 3);
    }
    int colon = value.lastIndexOf(':');
    if (colon < 0) {
      throw new ConfigurationException("Server address must be host:port, got " + address);
    }
    String host = value.substring(0, colon);
    try {
      int port = Integer.parseInt(value.substring(colon + 1));
      return new Endpoint(host.isEmpty() ? "127.0.0.1" : host, port);
    } catch (NumberFormatException e) {
      throw new ConfigurationException("Invalid port in server address " + address, e);
    }
  }

  @Override
  public String toString() {
    return host + ":" + port;
  }
}
