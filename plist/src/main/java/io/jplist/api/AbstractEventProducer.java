package io.jplist.api;

/**
 * Base for producers that enforces the end-of-stream and failure contract of {@link
 * EventProducer}. Subclasses implement {@link #produce()}.
 */
public abstract class AbstractEventProducer implements EventProducer {
  private boolean finished;
  private boolean failed;

  @Override
  public final PlistEvent next() throws PlistException {
    if (failed) {
      throw new IllegalStateException("Producer failed earlier and cannot be resumed");
    }
    if (finished) {
      return null;
    }
    try {
      PlistEvent event = produce();
      if (event == null) {
        finished = true;
      }
      return event;
    } catch (PlistException | RuntimeException e) {
      failed = true;
      throw e;
    }
  }

  /**
   * @return the next event, or {@code null} once the value is complete
   * @throws PlistException if the input is malformed
   */
  protected abstract PlistEvent produce() throws PlistException;
}
