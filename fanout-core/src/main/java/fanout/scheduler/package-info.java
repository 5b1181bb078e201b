/**
 * Due-content discovery and fan-out into the delivery task queue.
 */
package fanout.scheduler;
