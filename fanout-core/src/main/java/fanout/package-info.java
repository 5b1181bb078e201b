/**
 * Scheduled fan-out delivery engine.
 *
 * <h2>Flow</h2>
 * <p>A single-flight {@linkplain fanout.scheduler.ContentScheduler scheduler} discovers due
 * content, claims it (PENDING to PROCESSING) and {@linkplain fanout.scheduler.FanOut fans it
 * out} into one delivery task per active subscriber. A fixed
 * {@linkplain fanout.worker.DeliveryWorkerPool worker pool} drains the
 * {@linkplain fanout.spi.TaskQueue task queue} through a shared
 * {@linkplain fanout.ratelimit.RateLimiter rate limiter}, sends through the
 * {@link fanout.spi.Mailer}, records each outcome in the delivery log and asks the
 * {@linkplain fanout.completion.CompletionEvaluator completion evaluator} whether the content
 * is fully resolved. Finalization (PROCESSING to SENT) happens exactly once.
 *
 * <p>Delivery is at-least-once: a task whose worker dies before acknowledging is redelivered
 * after its lease expires. Failed attempts are retried with exponential backoff up to a total
 * attempt budget, after which the delivery is recorded as FAILED and the task moved to the
 * dead sink.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>fanout-core</b> - model, SPI, scheduler, queues, workers (only depends on ulid-creator)</li>
 *   <li><b>fanout-jdbc</b> - JDBC stores for H2 and PostgreSQL</li>
 *   <li><b>fanout-micrometer</b> - Micrometer {@link fanout.spi.MetricsExporter}</li>
 *   <li><b>fanout-spring-boot-starter</b> - auto-configuration and a JavaMail {@link fanout.spi.Mailer}</li>
 * </ul>
 *
 * @see fanout.FanoutEngine
 */
package fanout;
