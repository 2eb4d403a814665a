package io.expbin.server.dto;

/**
 * JSON response for GET .../bins/{bin}/ttl.
 *   { "state": "REMAINING", "seconds": 42 }
 *   { "state": "NEVER",     "seconds": -1 }
 *   { "state": "ABSENT",    "seconds": null }
 */
public class TtlResponse {
    public String state;
    public Long seconds;
}
