/**
 * Spring Boot auto-configuration for the xqueue consumer.
 *
 * <p>{@link io.xqueue.spring.boot.XQueueAutoConfiguration} detects the submission store from the
 * application {@link javax.sql.DataSource}, binds {@code xqueue.*} properties and runs an
 * {@link io.xqueue.XQueueConsumer}. {@link io.xqueue.spring.boot.XQueueMicrometerAutoConfiguration}
 * adds a Micrometer exporter when a {@code MeterRegistry} is available.
 */
package io.xqueue.spring.boot;
