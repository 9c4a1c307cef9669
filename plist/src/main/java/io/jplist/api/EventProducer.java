package io.jplist.api;

/**
 * Pull side of the event stream. Every physical-format reader and the value-tree walker implement
 * this interface.
 *
 * <p>A producer describes exactly one value. Once {@link #next()} has returned {@code null} it
 * keeps returning {@code null}. Once it has thrown a {@link PlistException} it is unusable and
 * further calls throw {@link IllegalStateException}.
 */
public interface EventProducer {
  /**
   * Returns the next event.
   *
   * @return the next event, or {@code null} when the value is complete
   * @throws PlistException if the underlying input is malformed
   * @throws IllegalStateException if an earlier call failed
   */
  PlistEvent next() throws PlistException;
}
