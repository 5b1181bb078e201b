/**
 * Immutable data carriers: content, subscribers, delivery tasks and delivery log rows.
 */
package fanout.model;
