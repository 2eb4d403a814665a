package io.expbin.server.dto;

import java.util.List;

/**
 * JSON view of a sweep job.
 */
public class SweepResponse {
    public String id;
    public String namespace;
    public String set;
    public List<String> bins;
    public String state;
    public long recordsVisited;
    public long recordsCleaned;
    public long binsRemoved;
    public long errors;
    public String lastKey;
    public String startedAt;
    public String finishedAt;
    public String failure;
}
