package io.expbin.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * JSON response for GET /records/{ns}/{set}/{key}.
 *   {
 *     "bins": { "name": "Ada", "session": "abc" }
 *   }
 * Expired or missing bins are absent from the map.
 */
public class GetResponse {
    public Map<String, JsonNode> bins;
}
