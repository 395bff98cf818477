package org.caureq.opsinsights.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.caureq.opsinsights.config.AppProps;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Requires {@code X-API-KEY} on write requests when {@code app.api-key} is set. Reads stay open. */
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {
    private final AppProps props;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String method = req.getMethod();
        boolean write = "POST".equalsIgnoreCase(method) || "PUT".equalsIgnoreCase(method)
                || "PATCH".equalsIgnoreCase(method) || "DELETE".equalsIgnoreCase(method);

        if (write && props.apiKeyRequired()) {
            String key = req.getHeader("X-API-KEY");
            if (key == null || !key.equals(props.apiKey())) {
                res.setStatus(HttpStatus.UNAUTHORIZED.value());
                res.setContentType("application/json");
                res.getWriter().write("{\"code\":\"AUTH_REQUIRED\",\"message\":\"Missing or invalid X-API-KEY\"}");
                return;
            }
        }

        chain.doFilter(req, res);
    }
}
