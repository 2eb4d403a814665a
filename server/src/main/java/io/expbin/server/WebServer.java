// file: server/src/main/java/io/expbin/server/WebServer.java
package io.expbin.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.expbin.core.BinTouch;
import io.expbin.core.BinValidationException;
import io.expbin.core.BinValue;
import io.expbin.core.BinWrite;
import io.expbin.core.OpStatus;
import io.expbin.core.TtlResult;
import io.expbin.server.dto.BatchRequest;
import io.expbin.server.dto.GetResponse;
import io.expbin.server.dto.JsonValues;
import io.expbin.server.dto.PutRequest;
import io.expbin.server.dto.RawRecordResponse;
import io.expbin.server.dto.StatusResponse;
import io.expbin.server.dto.SweepRequest;
import io.expbin.server.dto.SweepResponse;
import io.expbin.server.dto.TtlResponse;
import io.expbin.server.sweep.SweepJob;
import io.expbin.server.sweep.SweepNotFoundException;
import io.expbin.server.sweep.SweepProgress;
import io.expbin.storage.RecordKey;
import io.expbin.storage.RecordNotFoundException;
import io.expbin.storage.RecordSet;
import io.expbin.storage.StoredRecord;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;

/**
 * Thin HTTP adapter over ExpireBinService.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert service results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit basic per-request logging.
 *
 * Path layout:
 *   - GET    /records/{ns}/{set}/{key}?bins=a,b          live bins (all when 'bins' is omitted)
 *   - PUT    /records/{ns}/{set}/{key}/bins/{bin}        put one bin
 *   - POST   /records/{ns}/{set}/{key}/bins              batch put
 *   - POST   /records/{ns}/{set}/{key}/touch             replace bin expirations
 *   - GET    /records/{ns}/{set}/{key}/bins/{bin}/ttl    remaining lifetime
 *   - GET    /raw/{ns}/{set}/{key}                       record as stored, markers included
 *   - POST   /sweeps/{ns}/{set}                          start (or resume) a clean pass
 *   - GET    /sweeps/{id}                                poll a pass
 *   - DELETE /sweeps/{id}                                cancel a pass
 *   - GET    /admin/health                               basic health check
 *
 * Status mapping: FAILED -> 409, validation / invalid JSON -> 400, unknown record
 * or sweep -> 404, body too large -> 413, sweep queue full -> 503, anything else -> 500.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final ExpireBinService svc;

    public WebServer(int port, ExpireBinService svc) {
        this.svc = svc;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    /** Bound port; useful when the server was created with port 0. */
    public int port() {
        return ((InetSocketAddress) server.getListenerInfo().get(0).getAddress()).getPort();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        if (ex.isInIoThread()) {
            // store calls block on fsync; keep them off the IO threads
            ex.dispatch(this::route);
            return;
        }
        ex.startBlocking();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        List<String> seg = segments(path);

        if ("/admin/health".equals(path)) {
            respond(ex, () -> new Reply(200, Map.of("status", "ok")));
        } else if (!seg.isEmpty() && "records".equals(seg.get(0))) {
            respond(ex, () -> records(ex, method, seg));
        } else if (!seg.isEmpty() && "raw".equals(seg.get(0)) && "GET".equals(method)) {
            respond(ex, () -> raw(seg));
        } else if (!seg.isEmpty() && "sweeps".equals(seg.get(0))) {
            respond(ex, () -> sweeps(ex, method, seg));
        } else {
            respond(ex, () -> new Reply(404, Map.of("error", "not found")));
        }
    }

    private Reply records(HttpServerExchange ex, String method, List<String> seg) throws IOException {
        if (seg.size() < 4) {
            return new Reply(400, Map.of("error", "namespace, set and key must not be empty"));
        }
        RecordKey key = new RecordKey(seg.get(1), seg.get(2), seg.get(3));

        if (seg.size() == 4) {
            return "GET".equals(method) ? handleGet(ex, key) : methodNotAllowed();
        }
        String sub = seg.get(4);
        if (seg.size() == 5 && "bins".equals(sub)) {
            return "POST".equals(method) ? handlePuts(ex, key) : methodNotAllowed();
        }
        if (seg.size() == 5 && "touch".equals(sub)) {
            return "POST".equals(method) ? handleTouch(ex, key) : methodNotAllowed();
        }
        if (seg.size() == 6 && "bins".equals(sub)) {
            return "PUT".equals(method) ? handlePut(ex, key, seg.get(5)) : methodNotAllowed();
        }
        if (seg.size() == 7 && "bins".equals(sub) && "ttl".equals(seg.get(6))) {
            return "GET".equals(method) ? handleTtl(key, seg.get(5)) : methodNotAllowed();
        }
        return new Reply(404, Map.of("error", "not found"));
    }

    private Reply sweeps(HttpServerExchange ex, String method, List<String> seg) throws IOException {
        if (seg.size() == 3 && "POST".equals(method)) {
            return handleClean(ex, new RecordSet(seg.get(1), seg.get(2)));
        }
        if (seg.size() == 2) {
            switch (method) {
                case "GET" -> {
                    return new Reply(200, view(svc.sweep(seg.get(1))));
                }
                case "DELETE" -> {
                    return new Reply(200, view(svc.cancel(seg.get(1))));
                }
                default -> {
                    return methodNotAllowed();
                }
            }
        }
        return new Reply(404, Map.of("error", "not found"));
    }

    // ---------- handlers ----------

    /** GET /records/{ns}/{set}/{key}?bins=a,b */
    private Reply handleGet(HttpServerExchange ex, RecordKey key) {
        String binsParam = firstOrNull(ex.getQueryParameters().get("bins"));
        List<String> bins = new ArrayList<>();
        if (binsParam != null) {
            for (String b : binsParam.split(",")) {
                if (!b.isBlank()) bins.add(b.trim());
            }
        }
        var dto = new GetResponse();
        dto.bins = JsonValues.toJson(svc.get(key, bins));
        return new Reply(200, dto);
    }

    /** PUT /records/{ns}/{set}/{key}/bins/{bin} */
    private Reply handlePut(HttpServerExchange ex, RecordKey key, String bin) throws IOException {
        byte[] data = readBody(ex);
        if (data == null) return tooLarge();
        var req = parse(data, PutRequest.class);
        BinValue value = valueOf(req.value, req.valueBase64);
        return status(svc.put(key, bin, value, req.ttl == null ? 0 : req.ttl));
    }

    /** POST /records/{ns}/{set}/{key}/bins */
    private Reply handlePuts(HttpServerExchange ex, RecordKey key) throws IOException {
        byte[] data = readBody(ex);
        if (data == null) return tooLarge();
        var req = parse(data, BatchRequest.class);
        List<BinWrite> writes = new ArrayList<>();
        for (BatchRequest.Entry e : entriesOf(req)) {
            writes.add(new BinWrite(e.bin, valueOf(e.value, e.valueBase64), e.ttl));
        }
        return status(svc.puts(key, writes));
    }

    /** POST /records/{ns}/{set}/{key}/touch */
    private Reply handleTouch(HttpServerExchange ex, RecordKey key) throws IOException {
        byte[] data = readBody(ex);
        if (data == null) return tooLarge();
        var req = parse(data, BatchRequest.class);
        List<BinTouch> touches = new ArrayList<>();
        for (BatchRequest.Entry e : entriesOf(req)) {
            touches.add(new BinTouch(e.bin, e.ttl));
        }
        return status(svc.touch(key, touches));
    }

    /** GET /records/{ns}/{set}/{key}/bins/{bin}/ttl */
    private Reply handleTtl(RecordKey key, String bin) {
        TtlResult r = svc.ttl(key, bin);
        var dto = new TtlResponse();
        if (r instanceof TtlResult.Remaining) {
            dto.state = "REMAINING";
        } else if (r instanceof TtlResult.Never) {
            dto.state = "NEVER";
        } else {
            dto.state = "ABSENT";
        }
        dto.seconds = r.toSeconds();
        return new Reply(200, dto);
    }

    /** GET /raw/{ns}/{set}/{key} */
    private Reply raw(List<String> seg) {
        if (seg.size() != 4) {
            return new Reply(400, Map.of("error", "namespace, set and key must not be empty"));
        }
        StoredRecord rec = svc.raw(new RecordKey(seg.get(1), seg.get(2), seg.get(3)));
        var dto = new RawRecordResponse();
        dto.generation = rec.generation();
        dto.voidTime = rec.voidTime();
        dto.bins = JsonValues.toJson(rec.bins());
        return new Reply(200, dto);
    }

    /** POST /sweeps/{ns}/{set} */
    private Reply handleClean(HttpServerExchange ex, RecordSet set) throws IOException {
        byte[] data = readBody(ex);
        if (data == null) return tooLarge();
        var req = data.length == 0 ? new SweepRequest() : parse(data, SweepRequest.class);
        Duration timeout = req.timeoutMillis == null ? null : Duration.ofMillis(req.timeoutMillis);

        SweepJob job;
        if (req.resumeFrom != null && !req.resumeFrom.isBlank()) {
            SweepJob previous = svc.sweep(req.resumeFrom);
            if (!previous.recordSet().equals(set)) {
                throw new BinValidationException("sweep " + previous.id() + " ran on " + previous.recordSet());
            }
            job = svc.resume(previous.id(), timeout);
        } else {
            job = svc.clean(set, req.bins == null ? List.of() : req.bins, timeout);
        }
        return new Reply(202, view(job));
    }

    // ---------- plumbing ----------

    private record Reply(int status, Object body) {}

    @FunctionalInterface
    private interface Action {
        Reply run() throws Exception;
    }

    /** Run 'action', map its outcome or failure to a status, send and log. */
    private void respond(HttpServerExchange ex, Action action) {
        long start = System.nanoTime();
        int status;
        long engineMs = -1L;
        Throwable error = null;
        try {
            long sStart = System.nanoTime();
            Reply reply = action.run();
            engineMs = (System.nanoTime() - sStart) / 1_000_000L;
            status = reply.status();
            send(ex, status, reply.body());
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (RecordNotFoundException | SweepNotFoundException missing) {
            status = 404;
            error = missing;
            send(ex, status, Map.of("error", missing.getMessage()));
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (RejectedExecutionException busy) {
            status = 503;
            error = busy;
            send(ex, status, Map.of("error", "too many sweeps queued"));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        }
        long totalMs = (System.nanoTime() - start) / 1_000_000L;
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), status, totalMs, engineMs, error);
    }

    private static Reply status(OpStatus s) {
        var dto = new StatusResponse();
        dto.status = s.name();
        dto.code = s.code();
        return new Reply(s == OpStatus.OK ? 200 : 409, dto);
    }

    private static Reply methodNotAllowed() {
        return new Reply(405, Map.of("error", "method not allowed"));
    }

    private static Reply tooLarge() {
        return new Reply(413, Map.of("error", "request body too large"));
    }

    /** Bind a request body; a literal JSON null is rejected like any malformed body. */
    private <T> T parse(byte[] data, Class<T> type) throws IOException {
        T req = json.readValue(data, type);
        if (req == null) {
            throw new BinValidationException("request body must be a JSON object");
        }
        return req;
    }

    private static List<BatchRequest.Entry> entriesOf(BatchRequest req) {
        if (req.entries == null) {
            throw new BinValidationException("entries must not be empty");
        }
        for (BatchRequest.Entry e : req.entries) {
            if (e == null) {
                throw new BinValidationException("entries must not contain null");
            }
        }
        return req.entries;
    }

    /** 'value' or 'valueBase64' as a BinValue; null when neither is present. */
    private static BinValue valueOf(JsonNode value, String valueBase64) {
        if (valueBase64 != null) {
            if (value != null) {
                throw new BinValidationException("use either value or valueBase64, not both");
            }
            return JsonValues.fromBase64(valueBase64);
        }
        return value == null ? null : JsonValues.toBinValue(value);
    }

    /**
     * Read the whole body. Returns null (after draining the rest) when it is
     * larger than MAX_BODY_BYTES.
     */
    private static byte[] readBody(HttpServerExchange ex) throws IOException {
        InputStream in = ex.getInputStream();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        long total = 0;
        for (int n; (n = in.read(buf)) != -1; ) {
            total += n;
            if (total <= MAX_BODY_BYTES) {
                out.write(buf, 0, n);
            }
        }
        return total > MAX_BODY_BYTES ? null : out.toByteArray();
    }

    private static SweepResponse view(SweepJob job) {
        SweepProgress p = job.progress();
        var dto = new SweepResponse();
        dto.id = job.id();
        dto.namespace = job.recordSet().namespace();
        dto.set = job.recordSet().set();
        dto.bins = List.copyOf(job.candidates());
        dto.state = job.state().name();
        dto.recordsVisited = p.recordsVisited();
        dto.recordsCleaned = p.recordsCleaned();
        dto.binsRemoved = p.binsRemoved();
        dto.errors = p.errors();
        dto.lastKey = p.lastKey();
        dto.startedAt = job.startedAt().toString();
        dto.finishedAt = job.finishedAt() == null ? null : job.finishedAt().toString();
        dto.failure = job.failure() == null ? null : String.valueOf(job.failure().getMessage());
        return dto;
    }

    private static List<String> segments(String path) {
        String trimmed = path.startsWith("/") ? path.substring(1) : path;
        if (trimmed.isEmpty()) return List.of();
        return Arrays.asList(trimmed.split("/", -1));
    }

    private static String firstOrNull(Deque<String> deque) {
        return (deque == null || deque.isEmpty()) ? null : deque.getFirst();
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
