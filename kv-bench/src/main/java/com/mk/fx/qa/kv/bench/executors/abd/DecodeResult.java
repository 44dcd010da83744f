package com.mk.fx.qa.kv.bench.executors.abd;

import com.mk.fx.qa.kv.bench.wire.model.Response;
import java.io.IOException;

/**
 * Item passed from the decoder to the collector: either a decoded response, a frame that could
 * not be decoded, or the end of the inbound stream.
 */
public record DecodeResult(Status status, Response response, IOException failure) {

  public enum Status {
    DECODED,
    FAILED,
    STREAM_ENDED
  }

  public static DecodeResult decoded(Response response) {
    return new DecodeResult(Status.DECODED, response, null);
  }

  public static DecodeResult failed(IOException failure) {
    return new DecodeResult(Status.FAILED, null, failure);
  }

  public static DecodeResult streamEnded(IOException failure) {
    return new DecodeResult(Status.STREAM_ENDED, null, failure);
  }
}
