package com.example.sheetsync.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class RemoteSettings {
    String baseUrl;
    String token;
    Duration timeout;
}
