package com.acme.resume.ingest.util;

import lombok.experimental.UtilityClass;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.springframework.core.io.buffer.DataBufferUtils.release;

@UtilityClass
public class MiscUtil {
  public static Mono<String> readAllBuffersAsUtf8String(Flux<DataBuffer> source) {
    return source.as(DataBufferUtils::join)
        .map(accumulator -> {
          final var responseBodyAsStr = accumulator.toString(UTF_8);
          release(accumulator);
          return responseBodyAsStr;
        });
  }

  /**
   * Aggregates all buffers into a single byte array. Errors with {@link org.springframework.core.io.buffer.DataBufferLimitException} as soon as more than <code>maxByteCount</code> bytes arrive, so an oversized source is never held in memory as a whole
   */
  public static Mono<byte[]> readAllBytes(Flux<DataBuffer> source, int maxByteCount) {
    return DataBufferUtils.join(source, maxByteCount)
        .map(aggregateBuffer -> {
          final var allBytes = new byte[aggregateBuffer.readableByteCount()];
          aggregateBuffer.read(allBytes);
          release(aggregateBuffer);
          return allBytes;
        })
        .defaultIfEmpty(new byte[0]);
  }
}
