package com.example.sheetsync.sync;

import com.example.sheetsync.model.Conflict;
import lombok.Value;

/**
 * Outcome of feeding an event to, or resolving through, the {@link ConflictDetector}.
 */
@Value
public class ConflictUpdate {

    public enum Type {
        CREATED, ATTACHED, RESOLVED, ALREADY_RESOLVED
    }

    Type type;
    Conflict conflict;
}
