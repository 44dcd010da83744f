package com.mk.fx.qa.kv.bench.executors.abd;

import com.mk.fx.qa.kv.bench.wire.codec.AbdCodec;
import com.mk.fx.qa.kv.bench.wire.codec.WireFormatException;
import java.io.IOException;
import java.io.InputStream;
import java.util.concurrent.BlockingQueue;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads response frames off the inbound stream and hands them to the collector. A malformed frame
 * is reported and skipped; any other read failure ends the stream and the task.
 */
@Slf4j
public final class ResponseDecoder implements Runnable {

  private final InputStream input;
  private final AbdCodec codec;
  private final BlockingQueue<DecodeResult> results;

  public ResponseDecoder(InputStream input, AbdCodec codec, BlockingQueue<DecodeResult> results) {
    this.input = input;
    this.codec = codec;
    this.results = results;
  }

  @Override
  public void run() {
    long decoded = 0;
    try {
      while (!Thread.currentThread().isInterrupted()) {
        try {
          results.put(DecodeResult.decoded(codec.readResponse(input)));
          decoded++;
        } catch (WireFormatException e) {
          results.put(DecodeResult.failed(e));
        } catch (IOException e) {
          log.debug("Response stream ended after {} responses: {}", decoded, e.toString());
          results.put(DecodeResult.streamEnded(e));
          return;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    log.debug("Response decoder stopped after {} responses", decoded);
  }
}
