/**
 * Micrometer metrics for the fan-out engine.
 *
 * @see fanout.micrometer.MicrometerMetricsExporter
 */
package fanout.micrometer;
