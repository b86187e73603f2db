package com.williamcallahan.research_engine;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Logs start and end of every API request. Event streams log only their opening,
 * since the servlet call returns as soon as the async response starts.
 */
@Component
public class RequestLoggingFilter implements Filter {
    private static final Logger logger = LoggerFactory.getLogger(RequestLoggingFilter.class);

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest req = (HttpServletRequest) request;
        String uri = req.getRequestURI();
        if (!uri.startsWith("/api")) {
            chain.doFilter(request, response);
            return;
        }
        long startTime = System.currentTimeMillis();
        logger.info("Incoming request: {} {} from {}", req.getMethod(), uri, req.getRemoteAddr());
        chain.doFilter(request, response);
        if (req.isAsyncStarted()) {
            logger.info("Request {} {} continues asynchronously", req.getMethod(), uri);
            return;
        }
        long duration = System.currentTimeMillis() - startTime;
        int status = response instanceof HttpServletResponse ? ((HttpServletResponse) response).getStatus() : 0;
        logger.info("Completed request: {} {} with status {} in {} ms", req.getMethod(), uri, status, duration);
    }
}
