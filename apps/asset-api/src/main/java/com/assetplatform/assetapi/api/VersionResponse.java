package com.assetplatform.assetapi.api;

import java.time.Instant;

public record VersionResponse(String application, String version, Instant buildTime) {}
