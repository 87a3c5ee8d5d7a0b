package org.learningjava.vaultsearch.infrastructure.adapter.out.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.*;
import okio.Buffer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.vaultsearch.application.port.EmbeddingConfigurationException;
import org.learningjava.vaultsearch.application.port.EmbeddingException;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives the adapter against canned HTTP responses served by an OkHttp interceptor; no sockets are opened.
 */
class OpenAiEmbeddingAdapterTest {

    private static final String BASE_URL = "http://embeddings.test/v1";
    private static final RetryPolicy FAST = new RetryPolicy(3, Duration.ofMillis(1), Duration.ofMillis(5), 2.0);
    private static final ObjectMapper OM = new ObjectMapper();

    private StubServer server;

    @BeforeEach
    void setUp() {
        server = new StubServer();
    }

    @Test
    void results_are_ordered_by_index_not_position() {
        server.enqueue(req -> json(200, """
                {"data":[
                  {"index":2,"embedding":[2.0,2.5]},
                  {"index":0,"embedding":[0.0,0.5]},
                  {"index":1,"embedding":[1.0,1.5]}
                ]}"""));

        List<float[]> out = adapter("sk-test", 10).embedBatch(List.of("a", "b", "c"));

        assertEquals(3, out.size());
        assertArrayEquals(new float[]{0.0f, 0.5f}, out.get(0));
        assertArrayEquals(new float[]{1.0f, 1.5f}, out.get(1));
        assertArrayEquals(new float[]{2.0f, 2.5f}, out.get(2));
    }

    @Test
    void request_carries_model_inputs_and_bearer_token() throws IOException {
        server.enqueue(req -> vectorsFor(req));

        adapter("sk-test", 10).embed("hello");

        Request sent = server.requests.get(0);
        assertEquals("POST", sent.method());
        assertEquals(BASE_URL + "/embeddings", sent.url().toString());
        assertEquals("Bearer sk-test", sent.header("Authorization"));
        JsonNode body = OM.readTree(bodyOf(sent));
        assertEquals("text-embedding-3-small", body.get("model").asText());
        assertEquals("float", body.get("encoding_format").asText());
        assertEquals("hello", body.get("input").get(0).asText());
    }

    @Test
    void rate_limit_is_retried_until_success() {
        server.enqueue(req -> json(429, "{\"error\":\"slow down\"}"));
        server.enqueue(req -> json(429, "{\"error\":\"slow down\"}"));
        server.enqueue(this::vectorsFor);

        List<float[]> out = adapter("sk-test", 10).embedBatch(List.of("x", "yy"));

        assertEquals(3, server.requests.size());
        assertArrayEquals(new float[]{2.0f}, out.get(1));
    }

    @Test
    void server_errors_exhaust_retries() {
        for (int i = 0; i < 3; i++) server.enqueue(req -> json(503, "{}"));

        EmbeddingException e = assertThrows(EmbeddingException.class,
                () -> adapter("sk-test", 10).embedBatch(List.of("x")));

        assertEquals(3, server.requests.size());
        assertThat(e.getMessage(), containsString("after 3 attempts"));
    }

    @Test
    void network_errors_are_retried() {
        server.enqueue(req -> { throw new java.io.UncheckedIOException(new IOException("connection reset")); });
        server.enqueue(this::vectorsFor);

        List<float[]> out = adapter("sk-test", 10).embedBatch(List.of("abc"));

        assertEquals(2, server.requests.size());
        assertArrayEquals(new float[]{3.0f}, out.get(0));
    }

    @Test
    void client_errors_fail_immediately() {
        server.enqueue(req -> json(400, "{\"error\":\"bad input\"}"));

        EmbeddingException e = assertThrows(EmbeddingException.class,
                () -> adapter("sk-test", 10).embedBatch(List.of("x")));

        assertEquals(1, server.requests.size());
        assertThat(e.getMessage(), containsString("400"));
    }

    @Test
    void missing_api_key_fails_without_a_call() {
        assertThrows(EmbeddingConfigurationException.class,
                () -> adapter(" ", 10).embedBatch(List.of("x")));

        assertTrue(server.requests.isEmpty());
    }

    @Test
    void count_mismatch_is_not_retried() {
        server.enqueue(req -> json(200, "{\"data\":[{\"index\":0,\"embedding\":[1.0]}]}"));

        EmbeddingException e = assertThrows(EmbeddingException.class,
                () -> adapter("sk-test", 10).embedBatch(List.of("a", "b")));

        assertEquals(1, server.requests.size());
        assertThat(e.getMessage(), containsString("count mismatch"));
    }

    @Test
    void inputs_are_sliced_by_max_batch_size() {
        for (int i = 0; i < 3; i++) server.enqueue(this::vectorsFor);

        List<float[]> out = adapter("sk-test", 2).embedBatch(List.of("a", "bb", "ccc", "dddd", "eeeee"));

        assertEquals(3, server.requests.size());
        assertEquals(5, out.size());
        for (int i = 0; i < 5; i++) {
            assertArrayEquals(new float[]{i + 1.0f}, out.get(i));
        }
    }

    @Test
    void empty_input_makes_no_call() {
        assertTrue(adapter("sk-test", 10).embedBatch(List.of()).isEmpty());
        assertTrue(server.requests.isEmpty());
    }

    @Test
    void duplicate_or_out_of_range_indices_are_rejected() {
        OpenAiEmbeddingAdapter a = adapter("sk-test", 10);

        assertThrows(EmbeddingException.class, () -> a.parse(
                "{\"data\":[{\"index\":0,\"embedding\":[1]},{\"index\":0,\"embedding\":[2]}]}", 2));
        assertThrows(EmbeddingException.class, () -> a.parse(
                "{\"data\":[{\"index\":5,\"embedding\":[1]}]}", 1));
        assertThrows(EmbeddingException.class, () -> a.parse(
                "{\"data\":[{\"index\":0,\"embedding\":[]}]}", 1));
        assertThrows(EmbeddingException.class, () -> a.parse("not json", 1));
    }

    @Test
    void backoff_grows_and_is_capped() {
        RetryPolicy p = new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(30), 2.0);

        assertEquals(Duration.ofSeconds(2), p.delayFor(0));
        assertEquals(Duration.ofSeconds(8), p.delayFor(2));
        assertEquals(Duration.ofSeconds(30), p.delayFor(10));
    }

    // ---------- helpers ----------

    private OpenAiEmbeddingAdapter adapter(String apiKey, int maxBatch) {
        OkHttpClient http = new OkHttpClient.Builder().addInterceptor(server).build();
        return new OpenAiEmbeddingAdapter(BASE_URL, apiKey, "text-embedding-3-small", maxBatch, FAST, http);
    }

    /** One single-element vector per input holding the input's length. */
    private Response vectorsFor(Request req) {
        try {
            JsonNode input = OM.readTree(bodyOf(req)).get("input");
            StringBuilder sb = new StringBuilder("{\"data\":[");
            for (int i = 0; i < input.size(); i++) {
                if (i > 0) sb.append(',');
                sb.append("{\"index\":").append(i).append(",\"embedding\":[")
                        .append(input.get(i).asText().length()).append(".0]}");
            }
            sb.append("]}");
            return json(200, sb.toString());
        } catch (IOException e) {
            throw new java.io.UncheckedIOException(e);
        }
    }

    private static String bodyOf(Request req) throws IOException {
        Buffer buf = new Buffer();
        req.body().writeTo(buf);
        return buf.readUtf8();
    }

    private static Function<Request, Response> never() {
        return req -> { throw new AssertionError("unexpected request"); };
    }

    private Response json(int code, String body) {
        return new Response.Builder()
                .request(server.current)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message(code == 200 ? "OK" : "Error")
                .body(ResponseBody.create(body, MediaType.get("application/json")))
                .build();
    }

    private static final class StubServer implements Interceptor {
        private final Deque<Function<Request, Response>> script = new ArrayDeque<>();
        private final List<Request> requests = new ArrayList<>();
        private Request current;

        void enqueue(Function<Request, Response> handler) {
            script.add(handler);
        }

        @Override
        public Response intercept(Chain chain) throws IOException {
            current = chain.request();
            requests.add(current);
            Function<Request, Response> handler = script.isEmpty() ? never() : script.poll();
            try {
                return handler.apply(current);
            } catch (java.io.UncheckedIOException e) {
                throw e.getCause();
            }
        }
    }
}
