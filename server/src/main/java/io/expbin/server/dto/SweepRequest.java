package io.expbin.server.dto;

import java.util.List;

/**
 * JSON body for POST /sweeps/{ns}/{set}. Every field is optional.
 *   {
 *     "bins": ["session"],
 *     "timeoutMillis": 60000,
 *     "resumeFrom": "3f1c..."
 *   }
 */
public class SweepRequest {
    public List<String> bins;
    public Long timeoutMillis;
    public String resumeFrom;   // id of a finished job to continue after
}
