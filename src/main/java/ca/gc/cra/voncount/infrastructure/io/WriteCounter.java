package ca.gc.cra.voncount.infrastructure.io;

import ca.gc.cra.voncount.application.port.Counter;
import ca.gc.cra.voncount.validation.Numbers;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OutputStream wrapper that counts the bytes written through it.
 *
 * <p>Nothing is buffered: every call goes straight to the wrapped stream. The wrapped stream is
 * borrowed, so {@link #close()} neither flushes nor closes it. Instances are not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class WriteCounter extends OutputStream implements Counter {
  private static final Logger log = LoggerFactory.getLogger(WriteCounter.class);

  private final OutputStream delegate;
  private long count;

  WriteCounter(OutputStream delegate, long initialCount) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.count = initialCount;
  }

  /**
   * Wraps a writable stream with a counter starting at zero.
   *
   * @param delegate stream to write to; must not be {@code null}
   * @return a new counting wrapper
   * @throws NullPointerException if {@code delegate} is {@code null}
   */
  public static WriteCounter from(OutputStream delegate) {
    return new WriteCounter(delegate, 0L);
  }

  /**
   * Returns the number of bytes written so far.
   *
   * @return bytes accepted by the wrapped stream since construction
   */
  @Override
  public long count() {
    return count;
  }

  @Override
  public void write(int b) throws IOException {
    try {
      delegate.write(b);
    } catch (IOException ex) {
      log.debug("Single byte write failed after {} bytes", count, ex);
      throw ex;
    }
    count = Numbers.addExact("WriteCounter", count, 1);
  }

  /**
   * Proxies to the wrapped stream and counts {@code len} bytes once it returns.
   *
   * @throws IOException exactly as thrown by the wrapped stream; the count is left unchanged
   * @throws ArithmeticException if the running count would exceed {@link Long#MAX_VALUE}
   */
  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    Objects.checkFromIndexSize(off, len, b.length);
    try {
      delegate.write(b, off, len);
    } catch (IOException ex) {
      log.debug("Write of {} bytes failed after {} bytes", len, count, ex);
      throw ex;
    }
    count = Numbers.addExact("WriteCounter", count, len);
  }

  @Override
  public void flush() throws IOException {
    delegate.flush();
  }

  /** Releases the wrapper only; the wrapped stream is neither flushed nor closed. */
  @Override
  public void close() {
    // Borrowed stream
  }
}
