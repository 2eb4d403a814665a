package io.expbin.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON body for POST .../bins (batch put) and POST .../touch.
 * Example:
 *   {
 *     "entries": [
 *       { "bin": "session", "value": "abc", "ttl": 30 },
 *       { "bin": "seen",    "ttl": -1 }
 *     ]
 *   }
 * For touch only "bin" and "ttl" are read, and "ttl" is required.
 */
public class BatchRequest {
    public List<Entry> entries;

    public static class Entry {
        public String bin;
        public JsonNode value;      // absent: keep the current value (puts only)
        public String valueBase64;
        public Integer ttl;
    }
}
