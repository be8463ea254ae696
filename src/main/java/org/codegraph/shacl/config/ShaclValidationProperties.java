package org.codegraph.shacl.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.codegraph.shacl.util.SubstitutionMode;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for SHACL validation runs.
 */
@Configuration
@Validated
@ConfigurationProperties(prefix = "shacl.validation")
public class ShaclValidationProperties {

  /** Default query timeout in milliseconds (30 seconds). */
  private static final long DEFAULT_QUERY_TIMEOUT = 30000L;

  /** Default per-shape timeout in milliseconds for parallel runs (60 seconds). */
  private static final long DEFAULT_SHAPE_TIMEOUT = 60000L;

  /** Default worker count for parallel runs. */
  private static final int DEFAULT_MAX_CONCURRENT = 4;

  private boolean enabled = true;

  @Min(1)
  private long queryTimeout = DEFAULT_QUERY_TIMEOUT;

  private boolean parallel;

  @Min(1)
  private int maxConcurrent = DEFAULT_MAX_CONCURRENT;

  @Min(1)
  private long shapeTimeout = DEFAULT_SHAPE_TIMEOUT;

  @NotNull
  private SubstitutionMode substitutionMode = SubstitutionMode.TEXT;

  /**
   * Check if validation is enabled.
   *
   * @return true if enabled
   */
  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Set whether validation is enabled.
   *
   * @param enabled true to enable
   */
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  /**
   * Get the timeout applied to each query-based constraint execution.
   *
   * @return timeout in milliseconds
   */
  public long getQueryTimeout() {
    return queryTimeout;
  }

  public void setQueryTimeout(long queryTimeout) {
    this.queryTimeout = queryTimeout;
  }

  /**
   * Check if node shapes are validated in parallel.
   *
   * @return true if parallel
   */
  public boolean isParallel() {
    return parallel;
  }

  public void setParallel(boolean parallel) {
    this.parallel = parallel;
  }

  /**
   * Get the number of worker threads used by parallel runs.
   *
   * @return worker count
   */
  public int getMaxConcurrent() {
    return maxConcurrent;
  }

  public void setMaxConcurrent(int maxConcurrent) {
    this.maxConcurrent = maxConcurrent;
  }

  /**
   * Get the time a single shape task may take in a parallel run.
   *
   * @return timeout in milliseconds
   */
  public long getShapeTimeout() {
    return shapeTimeout;
  }

  public void setShapeTimeout(long shapeTimeout) {
    this.shapeTimeout = shapeTimeout;
  }

  public SubstitutionMode getSubstitutionMode() {
    return substitutionMode;
  }

  public void setSubstitutionMode(SubstitutionMode substitutionMode) {
    this.substitutionMode = substitutionMode;
  }
}
