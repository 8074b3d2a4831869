package com.shardrouter.infrastructure.filter;

import com.shardrouter.application.port.in.RoutingScopeUseCase.RoutingScope;
import com.shardrouter.domain.model.ForcedTarget;
import com.shardrouter.infrastructure.context.ConnectionBinding;
import com.shardrouter.infrastructure.context.RoutingContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Applies the optional {@code X-Routing-Target} header as a forced block for the whole request
 * and guarantees the worker thread leaves the request with no routing state behind.
 */
@Component
@Order(1)
public class RoutingContextFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(RoutingContextFilter.class);

    public static final String ROUTING_TARGET_HEADER = "X-Routing-Target";
    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_ID_MDC_KEY = "requestId";

    private final RoutingContext routingContext;
    private final ConnectionBinding connectionBinding;

    public RoutingContextFilter(RoutingContext routingContext, ConnectionBinding connectionBinding) {
        this.routingContext = routingContext;
        this.connectionBinding = connectionBinding;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {

        String requestId = getOrGenerateRequestId(request);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        try {
            String targetHeader = request.getHeader(ROUTING_TARGET_HEADER);
            if (targetHeader == null || targetHeader.isBlank()) {
                filterChain.doFilter(request, response);
                return;
            }

            var targetResult = ForcedTarget.parse(targetHeader);
            if (targetResult.isFailure()) {
                var error = targetResult.errorOrNull();
                log.warn("Invalid {} header: {}", ROUTING_TARGET_HEADER, error.message());
                response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
                response.setContentType("application/json");
                response.getWriter().write(
                    "{\"error\":\"" + error.code() + "\",\"message\":\"" + error.message() + "\",\"requestId\":\"" + requestId + "\"}"
                );
                return;
            }

            log.debug("Request forced to {}: requestId={}, path={}", targetResult.getOrThrow(), requestId, request.getRequestURI());
            try (RoutingScope ignored = routingContext.enterForced(targetResult.getOrThrow())) {
                filterChain.doFilter(request, response);
            }
        } finally {
            routingContext.clear();
            connectionBinding.clear();
            MDC.remove(REQUEST_ID_MDC_KEY);
        }
    }

    private String getOrGenerateRequestId(HttpServletRequest request) {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        return requestId;
    }
}
