/**
 * Delivery workers: rate-limited, time-bounded mail attempts with retry and dead-lettering.
 */
package fanout.worker;
