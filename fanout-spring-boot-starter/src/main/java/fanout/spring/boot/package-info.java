/**
 * Spring Boot auto-configuration for the fan-out engine: properties under {@code fanout.*},
 * store detection, a JavaMail-backed mailer and Micrometer metrics.
 */
package fanout.spring.boot;
