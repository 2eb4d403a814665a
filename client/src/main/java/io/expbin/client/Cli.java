// file: client/src/main/java/io/expbin/client/Cli.java
package io.expbin.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * Simple CLI for interacting with a running ExpireBin server over HTTP.
 *
 * Usage:
 *   expbin-cli [--base-url http://host:port] <command> ...
 *
 * Examples:
 *   expbin-cli put test users u1 session abc 60
 *   expbin-cli puts test users u1 -1 name=Ada city=Paris
 *   expbin-cli get test users u1 session name
 *   expbin-cli touch test users u1 120 session
 *   expbin-cli ttl test users u1 session
 *   expbin-cli clean test users session
 *   expbin-cli sweep 3f1c...
 *
 * Values are sent as JSON strings unless --json is given, in which case the
 * value argument must already be a JSON literal (42, true, [1,2], {"a":1}).
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private static final String USAGE = """
            Usage:
              expbin-cli [--base-url http://host:port] [--json] <command>

            Commands:
              get    <ns> <set> <key> [bin...]
              put    <ns> <set> <key> <bin> <value> [ttl]
              puts   <ns> <set> <key> <ttl> <bin>=<value>...
              touch  <ns> <set> <key> <ttl> <bin>...
              ttl    <ns> <set> <key> <bin>
              raw    <ns> <set> <key>
              clean  <ns> <set> [bin...]
              sweep  <id>
              cancel <id>

            ttl: -1 never expires, 0 plain, n > 0 seconds
            """;

    private final HttpClient http;

    private Cli() {
        this.http = HttpClient.newHttpClient();
    }

    public static void main(String[] args) {
        try {
            Options opts = parseOptions(args);
            HttpRequest req = buildRequest(opts.baseUrl(), opts.jsonValues(), opts.command());
            new Cli().send(req);
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    private void send(HttpRequest req) throws Exception {
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        System.out.println(resp.body());
        if (resp.statusCode() >= 400) {
            System.err.println("HTTP " + resp.statusCode());
            System.exit(resp.statusCode() == 409 ? 3 : 1);
        }
    }

    // ---------- parsing ----------

    record Options(String baseUrl, boolean jsonValues, String[] command) {}

    static Options parseOptions(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        boolean json = false;
        int i = 0;
        while (i < args.length && args[i].startsWith("--")) {
            switch (args[i]) {
                case "--base-url" -> {
                    if (i + 1 >= args.length) throw new CliException("--base-url requires a value");
                    baseUrl = args[i + 1];
                    i += 2;
                }
                case "--json" -> {
                    json = true;
                    i++;
                }
                default -> throw new CliException("unknown option: " + args[i]);
            }
        }
        if (i >= args.length) {
            throw new CliException("missing command");
        }
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return new Options(baseUrl, json, Arrays.copyOfRange(args, i, args.length));
    }

    /** Translate one command line into the HTTP request for it. */
    static HttpRequest buildRequest(String baseUrl, boolean jsonValues, String[] cmd) {
        String name = cmd[0];
        switch (name) {
            case "get" -> {
                requireArgs(cmd, 4, "get requires <ns> <set> <key> [bin...]");
                String query = cmd.length > 4
                        ? "?bins=" + encode(String.join(",", Arrays.copyOfRange(cmd, 4, cmd.length)))
                        : "";
                return get(baseUrl + recordPath(cmd) + query);
            }
            case "put" -> {
                if (cmd.length != 6 && cmd.length != 7) {
                    throw new CliException("put requires <ns> <set> <key> <bin> <value> [ttl]");
                }
                int ttl = cmd.length == 7 ? parseTtl(cmd[6]) : 0;
                String body = "{\"value\":" + valueJson(cmd[5], jsonValues) + ",\"ttl\":" + ttl + "}";
                return send("PUT", baseUrl + recordPath(cmd) + "/bins/" + encode(cmd[4]), body);
            }
            case "puts" -> {
                requireArgs(cmd, 6, "puts requires <ns> <set> <key> <ttl> <bin>=<value>...");
                int ttl = parseTtl(cmd[4]);
                StringBuilder body = new StringBuilder("{\"entries\":[");
                for (int i = 5; i < cmd.length; i++) {
                    Map.Entry<String, String> kv = splitAssignment(cmd[i]);
                    if (i > 5) body.append(',');
                    body.append("{\"bin\":").append(jsonString(kv.getKey()))
                            .append(",\"value\":").append(valueJson(kv.getValue(), jsonValues))
                            .append(",\"ttl\":").append(ttl).append('}');
                }
                body.append("]}");
                return send("POST", baseUrl + recordPath(cmd) + "/bins", body.toString());
            }
            case "touch" -> {
                requireArgs(cmd, 6, "touch requires <ns> <set> <key> <ttl> <bin>...");
                int ttl = parseTtl(cmd[4]);
                StringBuilder body = new StringBuilder("{\"entries\":[");
                for (int i = 5; i < cmd.length; i++) {
                    if (i > 5) body.append(',');
                    body.append("{\"bin\":").append(jsonString(cmd[i])).append(",\"ttl\":").append(ttl).append('}');
                }
                body.append("]}");
                return send("POST", baseUrl + recordPath(cmd) + "/touch", body.toString());
            }
            case "ttl" -> {
                if (cmd.length != 5) throw new CliException("ttl requires <ns> <set> <key> <bin>");
                return get(baseUrl + recordPath(cmd) + "/bins/" + encode(cmd[4]) + "/ttl");
            }
            case "raw" -> {
                if (cmd.length != 4) throw new CliException("raw requires <ns> <set> <key>");
                return get(baseUrl + "/raw/" + encode(cmd[1]) + "/" + encode(cmd[2]) + "/" + encode(cmd[3]));
            }
            case "clean" -> {
                requireArgs(cmd, 3, "clean requires <ns> <set> [bin...]");
                StringBuilder body = new StringBuilder("{\"bins\":[");
                for (int i = 3; i < cmd.length; i++) {
                    if (i > 3) body.append(',');
                    body.append(jsonString(cmd[i]));
                }
                body.append("]}");
                return send("POST", baseUrl + "/sweeps/" + encode(cmd[1]) + "/" + encode(cmd[2]), body.toString());
            }
            case "sweep" -> {
                if (cmd.length != 2) throw new CliException("sweep requires <id>");
                return get(baseUrl + "/sweeps/" + encode(cmd[1]));
            }
            case "cancel" -> {
                if (cmd.length != 2) throw new CliException("cancel requires <id>");
                return HttpRequest.newBuilder().uri(URI.create(baseUrl + "/sweeps/" + encode(cmd[1]))).DELETE().build();
            }
            default -> throw new CliException("unknown command: " + name);
        }
    }

    // ---------- helpers ----------

    private static HttpRequest get(String url) {
        return HttpRequest.newBuilder().uri(URI.create(url)).GET().build();
    }

    private static HttpRequest send(String method, String url, String body) {
        return HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(body))
                .build();
    }

    private static void requireArgs(String[] cmd, int min, String msg) {
        if (cmd.length < min) throw new CliException(msg);
    }

    private static String recordPath(String[] cmd) {
        return "/records/" + encode(cmd[1]) + "/" + encode(cmd[2]) + "/" + encode(cmd[3]);
    }

    private static int parseTtl(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new CliException("ttl must be an integer: " + s);
        }
    }

    private static Map.Entry<String, String> splitAssignment(String arg) {
        int eq = arg.indexOf('=');
        if (eq <= 0) throw new CliException("expected <bin>=<value>, got: " + arg);
        return Map.entry(arg.substring(0, eq), arg.substring(eq + 1));
    }

    private static String valueJson(String raw, boolean jsonValues) {
        return jsonValues ? raw : jsonString(raw);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Minimal JSON string literal; the CLI has no JSON dependency. */
    static String jsonString(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
                }
            }
        }
        return sb.append('"').toString();
    }

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }
}
