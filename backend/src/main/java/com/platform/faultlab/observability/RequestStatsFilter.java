package com.platform.faultlab.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Times every API request into {@link RequestStats}.
 */
public class RequestStatsFilter extends OncePerRequestFilter {

    private final RequestStats requestStats;

    public RequestStatsFilter(RequestStats requestStats) {
        this.requestStats = requestStats;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            requestStats.record(RequestStats.categoryOf(request.getRequestURI()), System.nanoTime() - start);
        }
    }
}
