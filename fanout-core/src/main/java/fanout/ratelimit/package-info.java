/**
 * Send-rate limiting shared by the delivery workers.
 */
package fanout.ratelimit;
