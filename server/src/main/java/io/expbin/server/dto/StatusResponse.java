package io.expbin.server.dto;

/**
 * JSON response for put, puts and touch.
 *   { "status": "OK", "code": 0 }
 */
public class StatusResponse {
    public String status;
    public int code;
}
