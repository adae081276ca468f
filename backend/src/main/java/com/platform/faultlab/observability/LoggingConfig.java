package com.platform.faultlab.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation IDs and MDC helpers for scenario and benchmark runs.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_CORRELATION_ID = "correlationId";
    public static final String MDC_SCENARIO_ID = "scenarioId";
    public static final String MDC_BENCHMARK_ID = "benchmarkId";
    public static final String MDC_STORE = "store";

    /**
     * Filter to add correlation ID to all requests.
     */
    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    @Bean
    public RequestStatsFilter requestStatsFilter(RequestStats requestStats) {
        return new RequestStatsFilter(requestStats);
    }

    public static class CorrelationIdFilter extends OncePerRequestFilter {

        private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_REQUEST_PATH = "requestPath";
        private static final String MDC_REQUEST_METHOD = "requestMethod";

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {

            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }

                MDC.put(MDC_CORRELATION_ID, correlationId);
                MDC.put(MDC_REQUEST_PATH, request.getRequestURI());
                MDC.put(MDC_REQUEST_METHOD, request.getMethod());

                response.setHeader(CORRELATION_ID_HEADER, correlationId);

                filterChain.doFilter(request, response);

            } finally {
                MDC.remove(MDC_CORRELATION_ID);
                MDC.remove(MDC_REQUEST_PATH);
                MDC.remove(MDC_REQUEST_METHOD);
            }
        }
    }

    /**
     * Set scenario context in MDC for logging.
     */
    public static void setScenarioContext(String scenarioId) {
        MDC.put(MDC_SCENARIO_ID, scenarioId);
    }

    /**
     * Clear scenario context from MDC.
     */
    public static void clearScenarioContext() {
        MDC.remove(MDC_SCENARIO_ID);
    }

    /**
     * Set benchmark context for a single store's workload.
     */
    public static void setBenchmarkContext(String benchmarkId, String store) {
        MDC.put(MDC_BENCHMARK_ID, benchmarkId);
        MDC.put(MDC_STORE, store);
    }

    public static void clearBenchmarkContext() {
        MDC.remove(MDC_BENCHMARK_ID);
        MDC.remove(MDC_STORE);
    }
}
