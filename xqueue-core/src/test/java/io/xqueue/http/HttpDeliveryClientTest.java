package io.xqueue.http;

import io.xqueue.BasicCredentials;
import io.xqueue.XQueueConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpDeliveryClientTest {
    private StubHttpServer server;

    @BeforeEach
    void setup() throws Exception {
        server = new StubHttpServer();
    }

    @AfterEach
    void teardown() {
        server.close();
    }

    @Test
    void status200ReturnsBody() {
        server.respond(StubHttpServer.Response.ok("{\"correct\":true,\"score\":1}"));

        try (HttpDeliveryClient client = new HttpDeliveryClient(XQueueConfig.defaults())) {
            DeliveryResult result = client.post(server.url("/grade"), Payload.json("{\"a\":1}"), Duration.ofSeconds(5));

            assertTrue(result.success());
            assertEquals("{\"correct\":true,\"score\":1}", result.message());
        }

        assertEquals(1, server.requests().size());
        StubHttpServer.Request request = server.requests().get(0);
        assertEquals("POST", request.method());
        assertEquals("/grade", request.path());
        assertEquals("{\"a\":1}", request.body());
        assertTrue(request.contentType().startsWith("application/json"));
        assertNull(request.authorization());
    }

    @Test
    void non200IsReportedWithStatusCode() {
        server.respond(StubHttpServer.Response.status(500));

        try (HttpDeliveryClient client = new HttpDeliveryClient(XQueueConfig.defaults())) {
            DeliveryResult result = client.post(server.url("/"), Payload.json("{}"), Duration.ofSeconds(5));

            assertFalse(result.success());
            assertEquals("unexpected HTTP status code [500]", result.message());
        }
    }

    @Test
    void otherSuccessCodesAreStillFailures() {
        server.respond(StubHttpServer.Response.status(204));

        try (HttpDeliveryClient client = new HttpDeliveryClient(XQueueConfig.defaults())) {
            DeliveryResult result = client.post(server.url("/"), Payload.json("{}"), Duration.ofSeconds(5));

            assertFalse(result.success());
            assertEquals("unexpected HTTP status code [204]", result.message());
        }
    }

    @Test
    void refusedConnectionReportsCannotConnect() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }

        try (HttpDeliveryClient client = new HttpDeliveryClient(XQueueConfig.defaults())) {
            DeliveryResult result = client.post("http://127.0.0.1:" + port + "/", Payload.json("{}"), Duration.ofSeconds(2));

            assertFalse(result.success());
            assertEquals(HttpDeliveryClient.CANNOT_CONNECT, result.message());
        }
    }

    @Test
    void slowServerTimesOut() {
        server.respond(new StubHttpServer.Response(200, "late", 2000));

        try (HttpDeliveryClient client = new HttpDeliveryClient(XQueueConfig.defaults())) {
            long start = System.nanoTime();
            DeliveryResult result = client.post(server.url("/"), Payload.json("{}"), Duration.ofMillis(200));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertFalse(result.success());
            assertEquals(HttpDeliveryClient.CANNOT_CONNECT, result.message());
            assertTrue(elapsedMs < 1500, "timed out after " + elapsedMs + "ms");
        }
    }

    @Test
    void malformedUrlReportsCannotConnect() {
        try (HttpDeliveryClient client = new HttpDeliveryClient(XQueueConfig.defaults())) {
            DeliveryResult result = client.post("not a url", Payload.json("{}"), Duration.ofSeconds(1));

            assertFalse(result.success());
            assertEquals(HttpDeliveryClient.CANNOT_CONNECT, result.message());
        }
    }

    @Test
    void basicCredentialsAreSentPreemptively() {
        XQueueConfig config = XQueueConfig.builder()
            .basicAuth(new BasicCredentials("grader", "s3cret"))
            .build();

        try (HttpDeliveryClient client = new HttpDeliveryClient(config)) {
            assertTrue(client.post(server.url("/"), Payload.json("{}"), Duration.ofSeconds(5)).success());
        }

        String expected = "Basic " + Base64.getEncoder()
            .encodeToString("grader:s3cret".getBytes(StandardCharsets.UTF_8));
        assertEquals(expected, server.requests().get(0).authorization());
    }

    @Test
    void formPayloadIsUrlEncoded() {
        try (HttpDeliveryClient client = new HttpDeliveryClient(XQueueConfig.defaults())) {
            client.post(server.url("/"), Payload.form(Map.of("xqueue_body", "a b&c")), Duration.ofSeconds(5));
        }

        StubHttpServer.Request request = server.requests().get(0);
        assertTrue(request.contentType().startsWith("application/x-www-form-urlencoded"));
        assertEquals("xqueue_body=a+b%26c", request.body());
    }

    @Test
    void selfSignedCertificateAcceptedWhenVerificationOff() throws Exception {
        try (StubHttpServer tls = StubHttpServer.https();
             HttpDeliveryClient client = new HttpDeliveryClient(XQueueConfig.defaults())) {
            tls.respond(StubHttpServer.Response.ok("graded"));

            DeliveryResult result = client.post(tls.url("/grade"), Payload.json("{}"), Duration.ofSeconds(5));

            assertTrue(result.success());
            assertEquals("graded", result.message());
            assertEquals(1, tls.requests().size());
        }
    }

    @Test
    void selfSignedCertificateRejectedWhenVerificationOn() throws Exception {
        XQueueConfig config = XQueueConfig.builder().verifyTls(true).build();

        try (StubHttpServer tls = StubHttpServer.https();
             HttpDeliveryClient client = new HttpDeliveryClient(config)) {
            DeliveryResult result = client.post(tls.url("/grade"), Payload.json("{}"), Duration.ofSeconds(5));

            assertFalse(result.success());
            assertEquals(HttpDeliveryClient.CANNOT_CONNECT, result.message());
            assertTrue(tls.requests().isEmpty());
        }
    }

    @Test
    void connectTimeoutFollowsCallTimeout() throws Exception {
        XQueueConfig config = XQueueConfig.builder().requestsTimeout(Duration.ofSeconds(30)).build();
        InetAddress loopback = InetAddress.getLoopbackAddress();
        List<Socket> backlog = new ArrayList<>();

        // a listener that never accepts: once its backlog is full new connects hang
        try (ServerSocket listener = new ServerSocket(0, 1, loopback);
             HttpDeliveryClient client = new HttpDeliveryClient(config)) {
            InetSocketAddress address = new InetSocketAddress(loopback, listener.getLocalPort());
            for (int i = 0; i < 4; i++) {
                Socket socket = new Socket();
                backlog.add(socket);
                try {
                    socket.connect(address, 200);
                } catch (IOException e) {
                    break;
                }
            }

            long start = System.nanoTime();
            DeliveryResult result = client.post("http://" + loopback.getHostAddress() + ":" + listener.getLocalPort() + "/",
                Payload.json("{}"), Duration.ofMillis(300));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertFalse(result.success());
            assertEquals(HttpDeliveryClient.CANNOT_CONNECT, result.message());
            assertTrue(elapsedMs < 5000, "gave up after " + elapsedMs + "ms");
        } finally {
            for (Socket socket : backlog) {
                socket.close();
            }
        }
    }
}
