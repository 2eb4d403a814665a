package io.expbin.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.expbin.server.sweep.SweepCoordinator;
import io.expbin.storage.DurableRecordStore;
import io.expbin.storage.FileSnapshotter;
import io.expbin.storage.FileWal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP surface: routes, JSON shapes and status mapping.
 */
class WebServerTest {

    @TempDir Path walDir;
    @TempDir Path snapDir;

    private final MutableClock clock = new MutableClock(Instant.ofEpochSecond(1_700_000_000L));
    private final ObjectMapper json = new ObjectMapper();
    private WebServer server;
    private SweepCoordinator sweeps;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        var store = new DurableRecordStore(new FileWal(walDir, 1L << 60), new FileSnapshotter(snapDir), clock);
        sweeps = new SweepCoordinator(store, clock, 1, Duration.ofMinutes(5));
        var service = new ExpireBinService(store, new FieldAccessor(store, clock), sweeps);

        server = new WebServer(0, service); // any free port
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop();
        }
        if (sweeps != null) {
            sweeps.close();
        }
    }

    private String url(String path) {
        return "http://localhost:" + server.port() + path;
    }

    private HttpResponse<String> call(String method, String path, String body) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(url(path)));
        if (body == null) {
            b.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            b.header("Content-Type", "application/json").method(method, HttpRequest.BodyPublishers.ofString(body));
        }
        return client.send(b.build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode body(HttpResponse<String> resp) throws Exception {
        return json.readTree(resp.body());
    }

    @Test
    void health_is_ok() throws Exception {
        var resp = call("GET", "/admin/health", null);
        assertEquals(200, resp.statusCode());
        assertEquals("ok", body(resp).get("status").asText());
    }

    @Test
    void put_get_ttl_round_trip() throws Exception {
        var put = call("PUT", "/records/test/users/u1/bins/session", "{\"value\":\"abc\",\"ttl\":60}");
        assertEquals(200, put.statusCode());
        assertEquals("OK", body(put).get("status").asText());

        var get = call("GET", "/records/test/users/u1?bins=session,missing", null);
        assertEquals(200, get.statusCode());
        JsonNode bins = body(get).get("bins");
        assertEquals("abc", bins.get("session").asText());
        assertFalse(bins.has("missing"));

        var ttl = call("GET", "/records/test/users/u1/bins/session/ttl", null);
        assertEquals("REMAINING", body(ttl).get("state").asText());
        assertEquals(60, body(ttl).get("seconds").asLong());

        clock.advance(Duration.ofSeconds(60));
        var gone = call("GET", "/records/test/users/u1/bins/session/ttl", null);
        assertEquals("ABSENT", body(gone).get("state").asText());
        assertTrue(body(gone).get("seconds").isNull());
    }

    @Test
    void structured_values_and_bytes_round_trip() throws Exception {
        call("POST", "/records/test/users/u1/bins", """
                {"entries":[
                  {"bin":"profile","value":{"age":36,"tags":["a",true,1.5,null]}},
                  {"bin":"blob","valueBase64":"AQID","ttl":-1}
                ]}
                """);

        JsonNode bins = body(call("GET", "/records/test/users/u1", null)).get("bins");
        assertEquals(36, bins.get("profile").get("age").asLong());
        assertEquals(4, bins.get("profile").get("tags").size());
        assertEquals("AQID", bins.get("blob").get("$bytes").asText());
    }

    @Test
    void raw_view_shows_marker_bins() throws Exception {
        call("PUT", "/records/test/users/u1/bins/session", "{\"value\":\"abc\",\"ttl\":60}");

        var raw = call("GET", "/raw/test/users/u1", null);

        assertEquals(200, raw.statusCode());
        JsonNode bins = body(raw).get("bins");
        assertEquals(1_700_000_060L, bins.get("~exp:session").asLong());
        assertEquals(1, body(raw).get("generation").asInt());
    }

    @Test
    void failed_batch_maps_to_409() throws Exception {
        call("PUT", "/records/test/users/u1/bins/a", "{\"value\":1}");

        var resp = call("POST", "/records/test/users/u1/touch", "{\"entries\":[{\"bin\":\"missing\",\"ttl\":5}]}");

        assertEquals(409, resp.statusCode());
        assertEquals("FAILED", body(resp).get("status").asText());
        assertEquals(1, body(resp).get("code").asInt());
    }

    @Test
    void touch_without_ttl_is_400() throws Exception {
        call("PUT", "/records/test/users/u1/bins/a", "{\"value\":1,\"ttl\":10}");

        var resp = call("POST", "/records/test/users/u1/touch", "{\"entries\":[{\"bin\":\"a\"}]}");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("ttl is required"));
    }

    @Test
    void missing_record_is_404() throws Exception {
        assertEquals(404, call("GET", "/records/test/users/nobody", null).statusCode());
        assertEquals(404, call("GET", "/records/test/users/nobody/bins/a/ttl", null).statusCode());
        assertEquals(404, call("GET", "/raw/test/users/nobody", null).statusCode());
    }

    @Test
    void validation_errors_are_400() throws Exception {
        assertEquals(400, call("PUT", "/records/test/users/u1/bins/~exp:a", "{\"value\":1}").statusCode());
        assertEquals(400, call("PUT", "/records/test/users/u1/bins/a", "{\"value\":1,\"ttl\":-5}").statusCode());
        assertEquals(400, call("PUT", "/records/test/users/u1/bins/a", "{\"ttl\":5}").statusCode());
        assertEquals(400, call("GET", "/records/", null).statusCode());
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        var resp = call("PUT", "/records/test/users/u1/bins/a", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));
    }

    @Test
    void json_null_body_returns_400() throws Exception {
        assertEquals(400, call("PUT", "/records/test/users/u1/bins/a", "null").statusCode());
        assertEquals(400, call("POST", "/records/test/users/u1/bins", "null").statusCode());
        assertEquals(400, call("POST", "/records/test/users/u1/touch", "null").statusCode());
        assertEquals(400, call("POST", "/sweeps/test/users", "null").statusCode());
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        String big = "x".repeat(11 * 1024 * 1024);
        var resp = call("PUT", "/records/test/users/big/bins/a", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    @Test
    void wrong_method_is_405_and_unknown_path_404() throws Exception {
        assertEquals(405, call("DELETE", "/records/test/users/u1", null).statusCode());
        assertEquals(404, call("GET", "/nowhere", null).statusCode());
    }

    @Test
    void sweep_can_be_started_polled_and_cancelled() throws Exception {
        call("PUT", "/records/test/users/u1/bins/session", "{\"value\":\"abc\",\"ttl\":5}");
        clock.advance(Duration.ofSeconds(5));

        var started = call("POST", "/sweeps/test/users", "{\"bins\":[\"session\"]}");
        assertEquals(202, started.statusCode());
        String id = body(started).get("id").asText();

        JsonNode view = null;
        for (int i = 0; i < 100; i++) {
            view = body(call("GET", "/sweeps/" + id, null));
            if (!"RUNNING".equals(view.get("state").asText())) break;
            Thread.sleep(20);
        }
        assertEquals("DONE", view.get("state").asText());
        assertEquals(1, view.get("binsRemoved").asLong());

        var cancelled = call("DELETE", "/sweeps/" + id, null);
        assertEquals(200, cancelled.statusCode());
        assertEquals("DONE", body(cancelled).get("state").asText(), "cancel after completion is a no-op");

        assertEquals(404, call("GET", "/sweeps/unknown-id", null).statusCode());
    }
}
