package com.example.cliporganizer.common.logging;

import com.example.cliporganizer.common.util.LogSanitizer;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags each API request with a request id (taken from {@code X-Request-Id} when it looks safe) and logs one
 * {@code ACCESS} line when it finishes. Sync calls can run for minutes, so slow requests are logged at WARN.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    public static final String MDC_REQUEST_ID = "requestId";

    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final Pattern SAFE_REQUEST_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    private final long slowRequestMillis;

    public AccessLogFilter(long slowRequestMillis) {
        this.slowRequestMillis = slowRequestMillis;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long startedAt = System.currentTimeMillis();
        String requestId = resolveRequestId(request.getHeader(HEADER_REQUEST_ID));
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            long costMs = System.currentTimeMillis() - startedAt;
            String uri = LogSanitizer.sanitize(request.getRequestURI());
            if (costMs >= slowRequestMillis) {
                log.warn("ACCESS_SLOW method={} uri={} status={} costMs={}",
                        request.getMethod(), uri, response.getStatus(), costMs);
            } else {
                log.info("ACCESS method={} uri={} status={} costMs={}",
                        request.getMethod(), uri, response.getStatus(), costMs);
            }
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    static String resolveRequestId(String header) {
        if (header != null && SAFE_REQUEST_ID.matcher(header.trim()).matches()) {
            return header.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }
}
