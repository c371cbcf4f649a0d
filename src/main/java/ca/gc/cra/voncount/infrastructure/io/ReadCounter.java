package ca.gc.cra.voncount.infrastructure.io;

import ca.gc.cra.voncount.application.port.Counter;
import ca.gc.cra.voncount.validation.Numbers;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * InputStream wrapper that counts the bytes read through it.
 *
 * <p>The wrapped stream is borrowed, not owned: closing this wrapper leaves it open, and the caller
 * must not read the wrapped stream through any other handle while the wrapper is in use. Bytes
 * passed over with {@link #skip(long)} are not counted. Instances are not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class ReadCounter extends InputStream implements Counter {
  private static final Logger log = LoggerFactory.getLogger(ReadCounter.class);

  private final InputStream delegate;
  private long count;

  ReadCounter(InputStream delegate, long initialCount) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.count = initialCount;
  }

  /**
   * Wraps a readable stream with a counter starting at zero.
   *
   * @param delegate stream to read from; must not be {@code null}
   * @return a new counting wrapper
   * @throws NullPointerException if {@code delegate} is {@code null}
   */
  public static ReadCounter from(InputStream delegate) {
    return new ReadCounter(delegate, 0L);
  }

  /**
   * Returns the number of bytes read so far.
   *
   * @return bytes delivered to callers since construction
   */
  @Override
  public long count() {
    return count;
  }

  @Override
  public int read() throws IOException {
    int value;
    try {
      value = delegate.read();
    } catch (IOException ex) {
      log.debug("Single byte read failed after {} bytes", count, ex);
      throw ex;
    }
    if (value != -1) {
      count = Numbers.addExact("ReadCounter", count, 1);
    }
    return value;
  }

  /**
   * Proxies to the wrapped stream, counting the bytes it reports as read.
   *
   * @throws IOException exactly as thrown by the wrapped stream; the count is left unchanged
   * @throws ArithmeticException if the running count would exceed {@link Long#MAX_VALUE}
   */
  @Override
  public int read(byte[] b, int off, int len) throws IOException {
    int n;
    try {
      n = delegate.read(b, off, len);
    } catch (IOException ex) {
      log.debug("Read of up to {} bytes failed after {} bytes", len, count, ex);
      throw ex;
    }
    if (n > 0) {
      count = Numbers.addExact("ReadCounter", count, n);
    }
    return n;
  }

  @Override
  public long skip(long n) throws IOException {
    return delegate.skip(n);
  }

  @Override
  public int available() throws IOException {
    return delegate.available();
  }

  /** Releases the wrapper only; the wrapped stream stays open for its owner. */
  @Override
  public void close() {
    // Borrowed stream
  }
}
