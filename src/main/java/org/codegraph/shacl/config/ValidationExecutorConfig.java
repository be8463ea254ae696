package org.codegraph.shacl.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool used to fan out node shapes when parallel validation is enabled.
 */
@Configuration
public class ValidationExecutorConfig {

  /** Queue capacity for pending shape tasks. */
  private static final int QUEUE_CAPACITY = 1000;

  /** Seconds to wait for running shape tasks on shutdown. */
  private static final int AWAIT_TERMINATION_SECONDS = 30;

  private final ShaclValidationProperties properties;

  /**
   * Constructor for ValidationExecutorConfig.
   *
   * @param properties validation properties
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "ShaclValidationProperties is a Spring-managed configuration bean")
  public ValidationExecutorConfig(ShaclValidationProperties properties) {
    this.properties = properties;
  }

  /**
   * Executor for shape validation tasks, sized by
   * {@code shacl.validation.max-concurrent}. When every worker is busy and the
   * queue is full, the submitting thread runs the task itself.
   *
   * @return ThreadPoolTaskExecutor for shape tasks
   */
  @Bean(name = "shaclValidationExecutor")
  public Executor shaclValidationExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getMaxConcurrent());
    executor.setMaxPoolSize(properties.getMaxConcurrent());
    executor.setQueueCapacity(QUEUE_CAPACITY);
    executor.setThreadNamePrefix("shacl-validate-");
    executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
    executor.initialize();
    return executor;
  }
}
