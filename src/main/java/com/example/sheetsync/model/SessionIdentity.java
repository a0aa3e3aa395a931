package com.example.sheetsync.model;

import lombok.Value;

/**
 * Who is acting, as established by the authentication layer in front of this service.
 */
@Value
public class SessionIdentity {
    String userId;
    String userName;
    String sessionId;
}
