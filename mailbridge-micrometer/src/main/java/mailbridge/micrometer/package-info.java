/**
 * Micrometer bridge for exporting dispatch metrics to Prometheus, Grafana and other backends.
 *
 * @see mailbridge.micrometer.MicrometerMetricsExporter
 */
package mailbridge.micrometer;
