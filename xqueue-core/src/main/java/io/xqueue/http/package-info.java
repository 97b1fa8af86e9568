/**
 * Outbound HTTP: the {@link io.xqueue.http.DeliveryClient} contract and its Apache HttpClient
 * implementation, used for both grader requests and origin callbacks.
 */
package io.xqueue.http;
