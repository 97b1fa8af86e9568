package io.xqueue.http;

import io.xqueue.BasicCredentials;
import io.xqueue.XQueueConfig;

import org.apache.hc.client5.http.auth.UsernamePasswordCredentials;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.DefaultSchemePortResolver;
import org.apache.hc.client5.http.impl.auth.BasicScheme;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.client5.http.routing.RoutingSupport;
import org.apache.hc.client5.http.ssl.NoopHostnameVerifier;
import org.apache.hc.client5.http.ssl.SSLConnectionSocketFactoryBuilder;
import org.apache.hc.client5.http.ssl.TrustAllStrategy;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpException;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link DeliveryClient} on Apache HttpClient 5.
 *
 * <p>Only HTTP 200 counts as success. Connection failures and timeouts are reported with the
 * fixed message {@value #CANNOT_CONNECT}; any other status with {@code unexpected HTTP status
 * code [<status>]}. Automatic retries are disabled.
 *
 * <p>With {@link XQueueConfig#verifyTls()} off (the default) any certificate and host name
 * is accepted, and a warning is logged when the client is created.
 */
public final class HttpDeliveryClient implements DeliveryClient, AutoCloseable {
    private static final Logger logger = Logger.getLogger(HttpDeliveryClient.class.getName());

    static final String CANNOT_CONNECT = "cannot connect to server";

    private final CloseableHttpClient httpClient;
    private final UsernamePasswordCredentials credentials;

    /**
     * Creates a client from the TLS and credential settings of {@code config}. Timeouts are given
     * per call.
     *
     * @param config consumer settings
     */
    public HttpDeliveryClient(XQueueConfig config) {
        this(newHttpClient(config.verifyTls()), config.basicAuth());
        if (!config.verifyTls()) {
            logger.warning("TLS certificate verification is disabled for grader and callback requests");
        }
    }

    HttpDeliveryClient(CloseableHttpClient httpClient, BasicCredentials basicAuth) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.credentials = basicAuth == null
            ? null
            : new UsernamePasswordCredentials(basicAuth.username(), basicAuth.password().toCharArray());
    }

    @Override
    @SuppressWarnings("deprecation")
    public DeliveryResult post(String url, Payload payload, Duration timeout) {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(timeout, "timeout");
        HttpPost request;
        HttpHost target;
        try {
            request = new HttpPost(url);
            target = RoutingSupport.determineHost(request);
        } catch (IllegalArgumentException | HttpException e) {
            logger.log(Level.SEVERE, "Invalid endpoint url " + url, e);
            return DeliveryResult.failure(CANNOT_CONNECT);
        }
        Timeout callTimeout = Timeout.ofMilliseconds(timeout.toMillis());
        // deprecated, but the only per-request connect timeout
        request.setConfig(RequestConfig.custom()
            .setConnectionRequestTimeout(callTimeout)
            .setConnectTimeout(callTimeout)
            .setResponseTimeout(callTimeout)
            .build());
        request.setEntity(new StringEntity(payload.body(),
            ContentType.create(payload.mimeType(), StandardCharsets.UTF_8)));

        HttpClientContext context = HttpClientContext.create();
        if (credentials != null && target != null) {
            BasicScheme basic = new BasicScheme();
            basic.initPreemptive(credentials);
            context.resetAuthExchange(RoutingSupport.normalize(target, DefaultSchemePortResolver.INSTANCE), basic);
        }

        try {
            return httpClient.execute(request, context, response -> {
                int code = response.getCode();
                // drain the entity so the connection goes back to the pool
                String body = response.getEntity() == null
                    ? ""
                    : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
                if (code != 200) {
                    logger.severe("Server " + url + " returned status_code=" + code);
                    return DeliveryResult.failure("unexpected HTTP status code [" + code + "]");
                }
                return DeliveryResult.success(body);
            });
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Could not connect to server at " + url + " in timeout=" + timeout, e);
            return DeliveryResult.failure(CANNOT_CONNECT);
        }
    }

    @Override
    public void close() {
        try {
            httpClient.close();
        } catch (IOException e) {
            logger.log(Level.WARNING, "Failed to close HTTP client", e);
        }
    }

    private static CloseableHttpClient newHttpClient(boolean verifyTls) {
        PoolingHttpClientConnectionManagerBuilder manager = PoolingHttpClientConnectionManagerBuilder.create();
        if (!verifyTls) {
            manager.setSSLSocketFactory(SSLConnectionSocketFactoryBuilder.create()
                .setSslContext(trustAllContext())
                .setHostnameVerifier(NoopHostnameVerifier.INSTANCE)
                .build());
        }
        return HttpClients.custom()
            .setConnectionManager(manager.build())
            .disableAutomaticRetries()
            .build();
    }

    private static SSLContext trustAllContext() {
        try {
            return SSLContexts.custom().loadTrustMaterial(TrustAllStrategy.INSTANCE).build();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to create trust-all SSL context", e);
        }
    }
}
