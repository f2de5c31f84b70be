// file: client/src/main/java/io/otlite/client/Cli.java
package io.otlite.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Simple CLI for interacting with a running OT-Lite server over HTTP.
 *
 * Usage:
 *   otlite-cli [options] get <doc>
 *   otlite-cli [options] open <doc> <text>
 *   otlite-cli [options] insert <doc> <baseVersion> <position> <text>
 *   otlite-cli [options] delete <doc> <baseVersion> <position> <length>
 *   otlite-cli [options] replace <doc> <baseVersion> <position> <length> <text>
 *
 * Options:
 *   --base-url http://host:port   (default http://localhost:8080)
 *   --author <id>                 (default: $USER, or "cli")
 *   --logical-time <n>            (default 0)
 *
 * Examples:
 *   otlite-cli open notes "hello"
 *   otlite-cli insert notes 0 5 " world"
 *   otlite-cli get notes
 */
public final class Cli {

    static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Parsed command line: global options plus the command and its arguments. */
    record Invocation(String baseUrl, String author, long logicalTime, String command, List<String> args) {}

    private final HttpClient http;
    private final String baseUrl;

    private Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public static void main(String[] args) {
        try {
            Invocation inv = parse(args);
            Cli cli = new Cli(inv.baseUrl());
            List<String> a = inv.args();

            switch (inv.command()) {
                case "get" -> {
                    requireArgs(a, 1, "get requires <doc>");
                    cli.get(a.get(0));
                }
                case "open" -> {
                    requireArgs(a, 2, "open requires <doc> <text>");
                    cli.open(a.get(0), a.get(1));
                }
                case "insert" -> {
                    requireArgs(a, 4, "insert requires <doc> <baseVersion> <position> <text>");
                    cli.submit(a.get(0), submitBody(inv, "INSERT",
                            parseLong(a.get(1), "baseVersion"), parseInt(a.get(2), "position"), 0, a.get(3)));
                }
                case "delete" -> {
                    requireArgs(a, 4, "delete requires <doc> <baseVersion> <position> <length>");
                    cli.submit(a.get(0), submitBody(inv, "DELETE",
                            parseLong(a.get(1), "baseVersion"), parseInt(a.get(2), "position"),
                            parseInt(a.get(3), "length"), null));
                }
                case "replace" -> {
                    requireArgs(a, 5, "replace requires <doc> <baseVersion> <position> <length> <text>");
                    cli.submit(a.get(0), submitBody(inv, "REPLACE",
                            parseLong(a.get(1), "baseVersion"), parseInt(a.get(2), "position"),
                            parseInt(a.get(3), "length"), a.get(4)));
                }
                default -> throw new CliException("unknown command: " + inv.command());
            }
        } catch (CliException e) {
            usageAndExit(e.getMessage());
        } catch (RequestFailedException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    // ---------- parsing ----------

    static Invocation parse(String[] args) {
        String baseUrl = DEFAULT_BASE_URL;
        String user = System.getenv("USER");
        String author = user == null || user.isBlank() ? "cli" : user;
        long logicalTime = 0;

        List<String> rest = new ArrayList<>(Arrays.asList(args));
        while (!rest.isEmpty() && rest.get(0).startsWith("--")) {
            String flag = rest.remove(0);
            if (rest.isEmpty()) {
                throw new CliException(flag + " requires a value");
            }
            String value = rest.remove(0);
            switch (flag) {
                case "--base-url" -> baseUrl = value;
                case "--author" -> author = value;
                case "--logical-time" -> logicalTime = parseLong(value, "logical-time");
                default -> throw new CliException("unknown option: " + flag);
            }
        }
        if (rest.isEmpty()) {
            throw new CliException("missing command");
        }
        String command = rest.remove(0);
        return new Invocation(baseUrl, author, logicalTime, command, List.copyOf(rest));
    }

    /** JSON body for POST /docs/{id}/ops; every invocation gets its own operationId. */
    static String submitBody(Invocation inv, String kind, long baseVersion, int position, int length, String text) {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("baseVersion", baseVersion);
        ObjectNode op = root.putObject("operation");
        op.put("kind", kind);
        op.put("position", position);
        op.put("length", length);
        if (text != null) {
            op.put("content", text);
        }
        op.put("authorId", inv.author());
        op.put("logicalTime", inv.logicalTime());
        op.put("operationId", UUID.randomUUID().toString());
        return root.toString();
    }

    private static void requireArgs(List<String> a, int n, String message) {
        if (a.size() != n) {
            throw new CliException(message);
        }
    }

    private static long parseLong(String s, String what) {
        try {
            return Long.parseLong(s);
        } catch (NumberFormatException e) {
            throw new CliException(what + " must be a number, got: " + s);
        }
    }

    private static int parseInt(String s, String what) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            throw new CliException(what + " must be a number, got: " + s);
        }
    }

    // ---------- commands ----------

    private void get(String doc) throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(docUri(doc, "")).GET());
        JsonNode snap = expectOk("GET", resp);
        System.out.printf("v%d: %s%n", snap.path("version").asLong(), snap.path("content").asText());
    }

    private void open(String doc, String text) throws Exception {
        ObjectNode body = MAPPER.createObjectNode().put("content", text);
        HttpResponse<String> resp = send(HttpRequest.newBuilder(docUri(doc, ""))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofString(body.toString())));
        JsonNode snap = expectOk("PUT", resp);
        System.out.printf("opened %s at v%d%n", doc, snap.path("version").asLong());
    }

    private void submit(String doc, String body) throws Exception {
        HttpResponse<String> resp = send(HttpRequest.newBuilder(docUri(doc, "/ops"))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body)));
        if (resp.statusCode() == 409) {
            JsonNode err = MAPPER.readTree(resp.body());
            throw new RequestFailedException(String.format("stale base version: server is at v%d, oldest rebasable v%d; run get and retry",
                    err.path("currentVersion").asLong(), err.path("oldestRebasableVersion").asLong()));
        }
        JsonNode result = expectOk("POST", resp);
        JsonNode op = result.path("operation");
        System.out.printf("applied as %s(%d, %d) -> v%d%n",
                op.path("kind").asText(), op.path("position").asInt(), op.path("length").asInt(),
                result.path("version").asLong());
    }

    private HttpResponse<String> send(HttpRequest.Builder builder) throws Exception {
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode expectOk(String method, HttpResponse<String> resp) throws Exception {
        if (resp.statusCode() != 200) {
            throw new RequestFailedException(method + " failed (" + resp.statusCode() + "): " + resp.body());
        }
        return MAPPER.readTree(resp.body());
    }

    private URI docUri(String doc, String suffix) {
        String encoded = URLEncoder.encode(doc, StandardCharsets.UTF_8).replace("+", "%20");
        return URI.create(baseUrl + "/docs/" + encoded + suffix);
    }

    private static void usageAndExit(String msg) {
        if (msg != null && !msg.isBlank()) {
            System.err.println("error: " + msg);
        }
        System.err.println("""
                Usage:
                  otlite-cli [options] get <doc>
                  otlite-cli [options] open <doc> <text>
                  otlite-cli [options] insert <doc> <baseVersion> <position> <text>
                  otlite-cli [options] delete <doc> <baseVersion> <position> <length>
                  otlite-cli [options] replace <doc> <baseVersion> <position> <length> <text>

                Options:
                  --base-url http://host:port   (default http://localhost:8080)
                  --author <id>
                  --logical-time <n>            (default 0)
                """);
        System.exit(1);
    }

    /** Bad command line: reported with usage. */
    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    /** Server answered with an error status. */
    private static final class RequestFailedException extends RuntimeException {
        RequestFailedException(String msg) {
            super(msg);
        }
    }
}
