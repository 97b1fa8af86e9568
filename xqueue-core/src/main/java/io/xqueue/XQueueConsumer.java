package io.xqueue;

import io.xqueue.http.DeliveryClient;
import io.xqueue.http.HttpDeliveryClient;
import io.xqueue.notify.ResultNotifier;
import io.xqueue.spi.ConnectionProvider;
import io.xqueue.spi.MetricsExporter;
import io.xqueue.spi.SubmissionStore;
import io.xqueue.worker.PullConsumer;
import io.xqueue.worker.PushWorker;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Runs the push workers of every configured queue as one {@link AutoCloseable} unit.
 *
 * <p>Each push binding gets {@link QueueBinding#workerCount()} independent workers sharing one
 * {@link DeliveryClient} and one {@link ResultNotifier}. Pull-only bindings start no worker;
 * their submissions are handed out through {@link #pullConsumer()}.
 *
 * <pre>{@code
 * try (XQueueConsumer consumer = XQueueConsumer.builder()
 *     .connectionProvider(connectionProvider)
 *     .submissionStore(new H2SubmissionStore())
 *     .binding(QueueBinding.push("python", "http://grader:1710/", 2))
 *     .binding(QueueBinding.pullOnly("manual"))
 *     .build()) {
 *   consumer.start();
 *   ...
 * }
 * }</pre>
 */
public final class XQueueConsumer implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(XQueueConsumer.class.getName());

    private final List<QueueBinding> bindings;
    private final List<PushWorker> workers;
    private final PullConsumer pullConsumer;
    private final HttpDeliveryClient ownedClient;
    private final MetricsExporter metrics;

    private XQueueConsumer(List<QueueBinding> bindings, List<PushWorker> workers,
            PullConsumer pullConsumer, HttpDeliveryClient ownedClient, MetricsExporter metrics) {
        this.bindings = bindings;
        this.workers = workers;
        this.pullConsumer = pullConsumer;
        this.ownedClient = ownedClient;
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts every push worker.
     */
    public void start() {
        for (PushWorker worker : workers) {
            worker.start();
        }
        logger.info("Started " + workers.size() + " push worker(s) for " + bindings.size() + " queue(s)");
    }

    public List<QueueBinding> bindings() {
        return bindings;
    }

    public List<PushWorker> workers() {
        return workers;
    }

    public PullConsumer pullConsumer() {
        return pullConsumer;
    }

    /**
     * Stops every worker, then releases the HTTP client if this consumer created it.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        for (PushWorker worker : workers) {
            try {
                worker.close();
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (ownedClient != null) {
            try {
                ownedClient.close();
            } catch (RuntimeException e) {
                if (first == null) first = e; else first.addSuppressed(e);
            }
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /**
     * Builder for {@link XQueueConsumer}.
     */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private SubmissionStore submissionStore;
        private XQueueConfig config;
        private DeliveryClient deliveryClient;
        private MetricsExporter metrics;
        private Clock clock;
        private final Map<String, QueueBinding> bindings = new LinkedHashMap<>();
        private final AtomicBoolean built = new AtomicBoolean(false);

        private Builder() {
        }

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> */
        public Builder submissionStore(SubmissionStore submissionStore) {
            this.submissionStore = submissionStore;
            return this;
        }

        /** Optional. Defaults to {@link XQueueConfig#defaults()}. */
        public Builder config(XQueueConfig config) {
            this.config = config;
            return this;
        }

        /**
         * Adds a queue. A later binding for the same queue name replaces the earlier one.
         *
         * @param binding the queue binding
         * @return this builder
         */
        public Builder binding(QueueBinding binding) {
            Objects.requireNonNull(binding, "binding");
            bindings.put(binding.queueName(), binding);
            return this;
        }

        public Builder bindings(Iterable<QueueBinding> bindings) {
            for (QueueBinding binding : bindings) {
                binding(binding);
            }
            return this;
        }

        /**
         * Sets the client for grader and callback calls.
         *
         * <p>Optional. Defaults to an {@link HttpDeliveryClient} built from the config, owned and
         * closed by the consumer. A client passed here is not closed by the consumer.
         *
         * @param deliveryClient the client
         * @return this builder
         */
        public Builder deliveryClient(DeliveryClient deliveryClient) {
            this.deliveryClient = deliveryClient;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /** Optional. Defaults to the UTC system clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Builds the consumer and its workers without starting them.
         *
         * @return a new consumer
         * @throws IllegalStateException if called twice
         */
        public XQueueConsumer build() {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            Objects.requireNonNull(connectionProvider, "connectionProvider");
            Objects.requireNonNull(submissionStore, "submissionStore");
            XQueueConfig cfg = config != null ? config : XQueueConfig.defaults();
            MetricsExporter exporter = metrics != null ? metrics : MetricsExporter.NOOP;
            Clock workerClock = clock != null ? clock : Clock.systemUTC();

            HttpDeliveryClient owned = null;
            DeliveryClient client = deliveryClient;
            if (client == null) {
                owned = new HttpDeliveryClient(cfg);
                client = owned;
            }
            ResultNotifier notifier = new ResultNotifier(client, cfg);

            List<PushWorker> workers = new ArrayList<>();
            for (QueueBinding binding : bindings.values()) {
                if (!binding.isPush()) {
                    continue;
                }
                for (int i = 0; i < binding.workerCount(); i++) {
                    workers.add(PushWorker.builder()
                            .queueName(binding.queueName())
                            .graderUrl(binding.graderUrl())
                            .connectionProvider(connectionProvider)
                            .submissionStore(submissionStore)
                            .deliveryClient(client)
                            .resultNotifier(notifier)
                            .config(cfg)
                            .metrics(exporter)
                            .clock(workerClock)
                            .build());
                }
            }
            PullConsumer pullConsumer = new PullConsumer(connectionProvider, submissionStore, cfg, workerClock);
            return new XQueueConsumer(
                    Collections.unmodifiableList(new ArrayList<>(bindings.values())),
                    Collections.unmodifiableList(workers),
                    pullConsumer, owned, exporter);
        }
    }
}
