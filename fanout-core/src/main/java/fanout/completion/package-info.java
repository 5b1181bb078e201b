/**
 * Completion tracking: finalizes content once every expected delivery is resolved.
 */
package fanout.completion;
