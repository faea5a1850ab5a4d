package com.mealvision.backend.mealphoto.provider;

import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/** 外部呼叫（vision / search）的例外 → 穩定錯誤碼 */
public final class ProviderErrorMapper {

    private ProviderErrorMapper() {}

    public record Mapped(String code, String message) {}

    public static Mapped map(Throwable e) {
        if (e == null) return new Mapped("PROVIDER_FAILED", null);

        // timeout 優先判斷（常被包在 ResourceAccessException 的 cause 裡）
        if (isTimeout(e)) return new Mapped("PROVIDER_TIMEOUT", safeMsg(e));

        if (e instanceof IllegalStateException ise) {
            String m = ise.getMessage();
            if (m != null && (m.startsWith("PROVIDER_") || m.startsWith("GEMINI_") || m.startsWith("TAVILY_"))) {
                return new Mapped(m, m);
            }
        }

        if (e instanceof RestClientResponseException re) {
            var sc = re.getStatusCode();
            int status = sc.value();
            if (status == 401 || status == 403) return new Mapped("PROVIDER_AUTH_FAILED", "auth failed");
            if (status == 429) return new Mapped("PROVIDER_RATE_LIMITED", "rate limited");
            if (status == 408) return new Mapped("PROVIDER_TIMEOUT", "timeout");
            if (sc.is5xxServerError()) return new Mapped("PROVIDER_UPSTREAM_5XX", "upstream " + status);
            if (sc.is4xxClientError()) return new Mapped("PROVIDER_BAD_REQUEST", "bad request " + status);
            return new Mapped("PROVIDER_FAILED", "http " + status);
        }

        if (e instanceof ResourceAccessException rae) {
            return new Mapped("PROVIDER_NETWORK_ERROR", safeMsg(rae));
        }

        if (e instanceof RestClientException rce) {
            return new Mapped("PROVIDER_CLIENT_ERROR", safeMsg(rce));
        }

        return new Mapped("PROVIDER_FAILED", safeMsg(e));
    }

    private static boolean isTimeout(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof SocketTimeoutException || c instanceof TimeoutException) return true;
            if ("java.net.http.HttpTimeoutException".equals(c.getClass().getName())) return true;
            String m = c.getMessage();
            if (m != null) {
                String s = m.toLowerCase(Locale.ROOT);
                if (s.contains("timed out") || s.contains("timeout")) return true;
            }
        }
        return false;
    }

    private static String safeMsg(Throwable t) {
        String m = t.getMessage();
        return (m == null || m.isBlank()) ? t.getClass().getSimpleName() : m;
    }
}
