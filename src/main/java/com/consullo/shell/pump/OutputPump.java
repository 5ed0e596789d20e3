package com.consullo.shell.pump;

import com.consullo.shell.process.ShellProcessController;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the shell's stdout and stderr pipes on two independent reader threads.
 *
 * <p>
 * Every non-blank line is:
 * <ul>
 * <li>queued for pull-based consumers ({@link #drain(Duration)}), dropping the
 * oldest line when the queue is full</li>
 * <li>fanned out synchronously to every registered {@link OutputListener}, each
 * call isolated so a failing listener cannot stop delivery or the loop</li>
 * </ul>
 * </p>
 *
 * <p>
 * Line order is preserved per pipe. Lines from stdout and stderr that arrive
 * concurrently have no defined relative order.
 * </p>
 *
 * <p>
 * The pump outlives individual processes: listeners stay registered across
 * start/stop cycles, and {@link #start} binds new reader threads to each new
 * process.
 * </p>
 */
public final class OutputPump {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputPump.class);

  // Guards listener mutation only; never held while invoking callbacks.
  private final Object listenerLock = new Object();
  private final List<OutputListener> listeners = new ArrayList<>();

  private final BlockingDeque<OutputLine> queue;
  private final Charset charset;

  private volatile Thread stdoutReader;
  private volatile Thread stderrReader;

  public OutputPump(Charset charset, int queueCapacity) {
    Validate.notNull(charset, "charset must not be null");
    Validate.isTrue(queueCapacity > 0, "queueCapacity must be positive");
    this.charset = charset;
    this.queue = new LinkedBlockingDeque<>(queueCapacity);
  }

  /**
   * Starts the two reader loops for a freshly spawned process.
   *
   * @param controller running process
   * @param running cancellation signal for this process only, checked before and after each read
   */
  public void start(ShellProcessController controller, BooleanSupplier running) {
    Validate.notNull(controller, "controller must not be null");
    Validate.notNull(running, "running must not be null");

    queue.clear();
    this.stdoutReader = startReader(OutputLine.Stream.STDOUT, controller.getStdout(), running);
    this.stderrReader = startReader(OutputLine.Stream.STDERR, controller.getStderr(), running);
  }

  /**
   * Registers a listener. Registering the same listener twice has no effect.
   *
   * @param listener listener
   */
  public void addListener(OutputListener listener) {
    if (listener == null) {
      throw new IllegalArgumentException("listener must not be null.");
    }
    synchronized (listenerLock) {
      if (!listeners.contains(listener)) {
        listeners.add(listener);
      }
    }
  }

  public void removeListener(OutputListener listener) {
    if (listener == null) {
      return;
    }
    synchronized (listenerLock) {
      listeners.remove(listener);
    }
  }

  /**
   * Pops queued lines. Waits up to {@code timeout} for the first line, then returns it together with
   * whatever else is queued at that moment. This is a best-effort read, not a complete capture.
   *
   * @param timeout maximum wait for the first line
   * @return drained lines, empty on timeout or interruption
   */
  public List<OutputLine> drain(Duration timeout) {
    Validate.notNull(timeout, "timeout must not be null");
    List<OutputLine> out = new ArrayList<>();
    try {
      OutputLine first = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
      if (first == null) {
        return out;
      }
      out.add(first);
      queue.drainTo(out);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    return out;
  }

  /**
   * Discards every queued line.
   */
  public void clear() {
    queue.clear();
  }

  /**
   * Waits for both reader threads of the current process to finish. A reader calling this from a
   * listener does not wait for itself.
   *
   * @param timeout total time budget
   * @return true if both readers have ended
   */
  public boolean join(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    boolean joined = true;
    for (Thread reader : new Thread[]{stdoutReader, stderrReader}) {
      if (reader == null || reader == Thread.currentThread()) {
        continue;
      }
      long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      try {
        if (remainingMillis > 0) {
          reader.join(remainingMillis);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      joined &= !reader.isAlive();
    }
    return joined;
  }

  private Thread startReader(OutputLine.Stream stream, InputStream in, BooleanSupplier running) {
    Thread reader = new Thread(() -> readLoop(stream, in, running),
            "ShellOutputPump-" + stream.name().toLowerCase());
    reader.setDaemon(true);
    reader.start();
    return reader;
  }

  private void readLoop(OutputLine.Stream stream, InputStream in, BooleanSupplier running) {
    LOGGER.debug("{} reader started", stream);
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, charset))) {
      while (running.getAsBoolean()) {
        String line = reader.readLine();
        if (line == null) {
          break;
        }
        if (!running.getAsBoolean()) {
          // the read outlived its process generation
          LOGGER.debug("{} reader dropped a line after stop: {}", stream, line);
          break;
        }
        if (line.isBlank()) {
          continue;
        }
        publish(OutputLine.of(stream, line));
      }
    } catch (IOException e) {
      if (running.getAsBoolean()) {
        LOGGER.warn("Error reading shell {}: {}", stream, e.getMessage(), e);
      } else {
        LOGGER.debug("{} reader closed during shutdown: {}", stream, e.getMessage());
      }
    }
    LOGGER.debug("{} reader finished", stream);
  }

  private void publish(OutputLine line) {
    LOGGER.debug("{}", line);
    while (!queue.offerLast(line)) {
      OutputLine dropped = queue.pollFirst();
      if (dropped != null) {
        LOGGER.debug("Output queue full, dropped oldest line: {}", dropped);
      }
    }
    List<OutputListener> copy;
    synchronized (listenerLock) {
      copy = new ArrayList<>(listeners);
    }
    for (OutputListener listener : copy) {
      try {
        listener.onOutputLine(line.stream(), line.text());
      } catch (RuntimeException e) {
        // keep the loop and the other listeners alive
        LOGGER.error("Output listener failed on {} line: {}", line.stream(), e.getMessage(), e);
      }
    }
  }
}
