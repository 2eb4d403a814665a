package io.expbin.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * JSON response for GET /raw/{ns}/{set}/{key}: the record as the store holds it,
 * marker bins ("~exp:" prefix) included.
 */
public class RawRecordResponse {
    public int generation;
    public long voidTime;
    public Map<String, JsonNode> bins;
}
