package se.alipsa.jcolumnar;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Properties;

/**
 * Engine settings.
 *
 * <p>
 * Values are read from {@code jcolumnar.properties} on the classpath when
 * present and can be overridden by system properties with the same keys:
 * </p>
 * <ul>
 * <li>{@value #SEGMENT_CAPACITY}: rows per segment, default 65536</li>
 * <li>{@value #DICTIONARY_THRESHOLD}: largest distinct count for dictionary
 * encoding and retained distinct value sets, default 256</li>
 * <li>{@value #WORKER_THREADS}: size of the worker pool, default the number of
 * available processors</li>
 * <li>{@value #VERIFY_PRUNING}: re-check pruned segments row by row, default
 * false</li>
 * <li>{@value #PARALLEL_THRESHOLD}: row count below which grouping runs on the
 * calling thread, default 10000</li>
 * </ul>
 */
public final class EngineConfig {

  public static final String SEGMENT_CAPACITY = "jcolumnar.segmentCapacity";
  public static final String DICTIONARY_THRESHOLD = "jcolumnar.dictionaryThreshold";
  public static final String WORKER_THREADS = "jcolumnar.workerThreads";
  public static final String VERIFY_PRUNING = "jcolumnar.verifyPruning";
  public static final String PARALLEL_THRESHOLD = "jcolumnar.parallelThreshold";

  static final String RESOURCE = "jcolumnar.properties";

  private final int segmentCapacity;
  private final int dictionaryThreshold;
  private final int workerThreads;
  private final boolean verifyPruning;
  private final int parallelThreshold;

  private EngineConfig(int segmentCapacity, int dictionaryThreshold, int workerThreads, boolean verifyPruning,
      int parallelThreshold) {
    this.segmentCapacity = segmentCapacity;
    this.dictionaryThreshold = dictionaryThreshold;
    this.workerThreads = workerThreads;
    this.verifyPruning = verifyPruning;
    this.parallelThreshold = parallelThreshold;
  }

  /**
   * Built-in defaults, ignoring the classpath resource and system properties.
   *
   * @return the default configuration
   */
  public static EngineConfig defaults() {
    return fromProperties(new Properties());
  }

  /**
   * Load the configuration from the classpath resource with system property
   * overrides.
   *
   * @return the configuration
   */
  public static EngineConfig load() {
    Properties props = new Properties();
    try (InputStream in = EngineConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
      if (in != null) {
        props.load(in);
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + RESOURCE, e);
    }
    for (String key : new String[] {
        SEGMENT_CAPACITY, DICTIONARY_THRESHOLD, WORKER_THREADS, VERIFY_PRUNING, PARALLEL_THRESHOLD
    }) {
      String override = System.getProperty(key);
      if (override != null) {
        props.setProperty(key, override);
      }
    }
    return fromProperties(props);
  }

  /**
   * Build a configuration from properties; missing keys take their defaults.
   *
   * @param props
   *          the properties
   * @return the configuration
   * @throws IllegalArgumentException
   *           if a value is malformed or out of range
   */
  public static EngineConfig fromProperties(Properties props) {
    Objects.requireNonNull(props, "props");
    int capacity = intValue(props, SEGMENT_CAPACITY, 65536, 1);
    int dictionary = intValue(props, DICTIONARY_THRESHOLD, 256, 0);
    int workers = intValue(props, WORKER_THREADS, Runtime.getRuntime().availableProcessors(), 1);
    boolean verify = booleanValue(props, VERIFY_PRUNING);
    int parallel = intValue(props, PARALLEL_THRESHOLD, 10000, 0);
    return new EngineConfig(capacity, dictionary, workers, verify, parallel);
  }

  /**
   * Start from this configuration and change selected settings.
   *
   * @return a builder initialised with the current values
   */
  public Builder toBuilder() {
    return new Builder(this);
  }

  public int segmentCapacity() {
    return segmentCapacity;
  }

  public int dictionaryThreshold() {
    return dictionaryThreshold;
  }

  public int workerThreads() {
    return workerThreads;
  }

  public boolean verifyPruning() {
    return verifyPruning;
  }

  public int parallelThreshold() {
    return parallelThreshold;
  }

  private static int intValue(Properties props, String key, int defaultValue, int min) {
    String raw = props.getProperty(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    int value;
    try {
      value = Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(key + " must be an integer but was '" + raw + "'", e);
    }
    if (value < min) {
      throw new IllegalArgumentException(key + " must be at least " + min + " but was " + value);
    }
    return value;
  }

  private static boolean booleanValue(Properties props, String key) {
    String raw = props.getProperty(key, "false").trim();
    if ("true".equalsIgnoreCase(raw)) {
      return true;
    }
    if ("false".equalsIgnoreCase(raw)) {
      return false;
    }
    throw new IllegalArgumentException(key + " must be true or false but was '" + raw + "'");
  }

  @Override
  public String toString() {
    return "EngineConfig{segmentCapacity=" + segmentCapacity + ", dictionaryThreshold=" + dictionaryThreshold
        + ", workerThreads=" + workerThreads + ", verifyPruning=" + verifyPruning + ", parallelThreshold="
        + parallelThreshold + "}";
  }

  /**
   * Builder for adjusted copies of a configuration.
   */
  public static final class Builder {
    private int segmentCapacity;
    private int dictionaryThreshold;
    private int workerThreads;
    private boolean verifyPruning;
    private int parallelThreshold;

    private Builder(EngineConfig base) {
      this.segmentCapacity = base.segmentCapacity;
      this.dictionaryThreshold = base.dictionaryThreshold;
      this.workerThreads = base.workerThreads;
      this.verifyPruning = base.verifyPruning;
      this.parallelThreshold = base.parallelThreshold;
    }

    public Builder segmentCapacity(int segmentCapacity) {
      this.segmentCapacity = segmentCapacity;
      return this;
    }

    public Builder dictionaryThreshold(int dictionaryThreshold) {
      this.dictionaryThreshold = dictionaryThreshold;
      return this;
    }

    public Builder workerThreads(int workerThreads) {
      this.workerThreads = workerThreads;
      return this;
    }

    public Builder verifyPruning(boolean verifyPruning) {
      this.verifyPruning = verifyPruning;
      return this;
    }

    public Builder parallelThreshold(int parallelThreshold) {
      this.parallelThreshold = parallelThreshold;
      return this;
    }

    /**
     * Build the configuration.
     *
     * @return the configuration
     * @throws IllegalArgumentException
     *           if a value is out of range
     */
    public EngineConfig build() {
      Properties props = new Properties();
      props.setProperty(SEGMENT_CAPACITY, String.valueOf(segmentCapacity));
      props.setProperty(DICTIONARY_THRESHOLD, String.valueOf(dictionaryThreshold));
      props.setProperty(WORKER_THREADS, String.valueOf(workerThreads));
      props.setProperty(VERIFY_PRUNING, String.valueOf(verifyPruning));
      props.setProperty(PARALLEL_THRESHOLD, String.valueOf(parallelThreshold));
      return fromProperties(props);
    }
  }
}
