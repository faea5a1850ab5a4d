package com.mealvision.backend.mealphoto.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** 外部呼叫的單行 log：status / provider / model / latency / tokens */
@Slf4j
@Service
public class ProviderTelemetry {

    public void ok(String provider, String modelId, String ref, long latencyMs,
                   Integer promptTok, Integer candTok, Integer totalTok) {
        log.info("provider_call status=OK provider={} modelId={} ref={} latencyMs={} tokensPrompt={} tokensCand={} tokensTotal={}",
                safe(provider), safe(modelId), safe(ref), latencyMs,
                n(promptTok), n(candTok), n(totalTok));
    }

    public void ok(String provider, String ref, long latencyMs) {
        ok(provider, null, ref, latencyMs, null, null, null);
    }

    public void fail(String provider, String modelId, String ref, long latencyMs, String errorCode) {
        log.warn("provider_call status=FAIL provider={} modelId={} ref={} latencyMs={} errorCode={}",
                safe(provider), safe(modelId), safe(ref), latencyMs, safe(errorCode));
    }

    public static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }

    private static String safe(String s) { return (s == null || s.isBlank()) ? "UNKNOWN" : s; }
    private static Object n(Integer v) { return v == null ? "NA" : v; }
}
