package com.mk.fx.qa.kv.bench.trace;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One line of the operation trace.
 *
 * @param kind invocation or response
 * @param clientId issuing client
 * @param id transaction id (quorum protocol) or command id (fast path)
 * @param operation GET or PUT for invocations, absent for responses that do not say
 * @param key key of the invocation, absent for responses
 * @param value written value, or the value returned by a read
 * @param timestamp wall clock in ms when the event was observed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceEvent(
    Kind kind,
    int clientId,
    long id,
    String operation,
    Long key,
    Long value,
    long timestamp) {

  public enum Kind {
    INV,
    RES
  }

  public static TraceEvent invocation(
      int clientId, long id, String operation, long key, long value, long timestamp) {
    return new TraceEvent(Kind.INV, clientId, id, operation, key, value, timestamp);
  }

  public static TraceEvent response(int clientId, long id, Long value, long timestamp) {
    return new TraceEvent(Kind.RES, clientId, id, null, null, value, timestamp);
  }
}
