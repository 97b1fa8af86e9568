/**
 * Small helpers shared across the consumer.
 */
package io.xqueue.util;
