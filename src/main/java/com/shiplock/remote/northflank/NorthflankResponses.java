package com.shiplock.remote.northflank;

import com.fasterxml.jackson.databind.JsonNode;
import com.shiplock.core.model.BuildHandle;
import com.shiplock.core.model.BuildRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Extracts the fields Shiplock needs from Northflank JSON.
 *
 * <p>The REST API wraps payloads in a {@code data} envelope; the CLI with
 * {@code --output json} prints them bare. Both shapes are accepted.
 */
final class NorthflankResponses {

    private NorthflankResponses() {
        // utility class
    }

    static JsonNode unwrap(JsonNode root) {
        var data = root.get("data");
        return data != null && data.isObject() ? data : root;
    }

    /** Build id from a build acknowledgement, or empty string if absent. */
    static String buildId(JsonNode root) {
        var id = unwrap(root).get("id");
        return id != null && id.isTextual() ? id.asText().trim() : "";
    }

    static List<BuildRecord> builds(JsonNode root) {
        var records = new ArrayList<BuildRecord>();
        var builds = unwrap(root).get("builds");
        if (builds == null || !builds.isArray()) {
            return records;
        }
        for (var build : builds) {
            var id = build.path("id").asText("").trim();
            if (id.isBlank()) {
                continue;
            }
            var sha = build.hasNonNull("sha") ? build.get("sha").asText() : null;
            var status = build.hasNonNull("status") ? build.get("status").asText() : "";
            records.add(new BuildRecord(new BuildHandle(id), sha, status));
        }
        return records;
    }

    /** Live revision from a deployment description, or empty string if nothing is deployed. */
    static String deployedRevision(JsonNode root) {
        var sha = unwrap(root).path("internal").get("deployedSHA");
        return sha != null && sha.isTextual() ? sha.asText().trim() : "";
    }
}
