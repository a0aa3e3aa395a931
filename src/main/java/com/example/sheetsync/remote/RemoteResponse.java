package com.example.sheetsync.remote;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/**
 * Successful reply of the remote store: {@code {ok, data?, message?}}.
 */
@Value
public class RemoteResponse {
    boolean ok;
    JsonNode data;
    String message;
    JsonNode pagination;
}
