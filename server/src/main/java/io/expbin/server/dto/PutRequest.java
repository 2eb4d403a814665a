package io.expbin.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON body for PUT /records/{ns}/{set}/{key}/bins/{bin}.
 * Example:
 *   {
 *     "value": "hello",
 *     "ttl": 60
 *   }
 * Bytes travel as "valueBase64" instead of "value".
 */
public class PutRequest {
    public JsonNode value;
    public String valueBase64;
    public Integer ttl;        // -1 never, 0 or absent plain, n > 0 seconds
}
