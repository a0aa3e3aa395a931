package com.example.sheetsync.remote;

import com.example.sheetsync.model.Operation;
import reactor.core.publisher.Mono;

/**
 * One round trip to the spreadsheet-backed store. Implementations fail with
 * {@link com.example.sheetsync.error.RemoteStoreException} for rejected calls and with
 * transport exceptions otherwise; classification happens upstream.
 */
public interface SheetsClient {
    Mono<RemoteResponse> execute(Operation operation);
}
