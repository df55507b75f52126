package com.assetplatform.assetapi.telemetry;

public enum RetrievalOutcome {
  MERGED,
  NO_SAMPLE_AVAILABLE
}
