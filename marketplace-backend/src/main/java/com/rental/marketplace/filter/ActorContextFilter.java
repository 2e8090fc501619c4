package com.rental.marketplace.filter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rental.marketplace.dto.CommonResponse;
import com.rental.marketplace.enums.UserRole;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Resolves the authenticated actor from the {@code X-User-Id} / {@code X-User-Role} headers set by the
 * gateway and stores it as a request attribute. Requests without a usable actor get a JSON 401.
 */
@Component
public class ActorContextFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(ActorContextFilter.class);

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    private final ObjectMapper objectMapper;

    public ActorContextFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        // CORS preflight carries no credentials
        if (HttpMethod.OPTIONS.matches(httpRequest.getMethod())) {
            chain.doFilter(request, response);
            return;
        }

        AuthenticatedActor actor = resolve(httpRequest);
        if (actor == null) {
            log.warn("Rejected unauthenticated request: {} {}", httpRequest.getMethod(), httpRequest.getRequestURI());

            httpResponse.setStatus(HttpStatus.UNAUTHORIZED.value());
            httpResponse.setContentType(MediaType.APPLICATION_JSON_VALUE);
            httpResponse.setCharacterEncoding(StandardCharsets.UTF_8.name());

            CommonResponse<Void> errorResponse = CommonResponse.error(401, "Authentication required");
            httpResponse.getWriter().write(objectMapper.writeValueAsString(errorResponse));
            return;
        }

        httpRequest.setAttribute(AuthenticatedActor.REQUEST_ATTRIBUTE, actor);
        chain.doFilter(request, response);
    }

    private AuthenticatedActor resolve(HttpServletRequest request) {
        String userId = request.getHeader(USER_ID_HEADER);
        String role = request.getHeader(USER_ROLE_HEADER);
        if (userId == null || userId.isBlank()) {
            return null;
        }
        try {
            UserRole userRole = (role == null || role.isBlank()) ? UserRole.USER : UserRole.fromValue(role.trim());
            return new AuthenticatedActor(Long.valueOf(userId.trim()), userRole);
        } catch (IllegalArgumentException e) {
            // NumberFormatException included
            log.warn("Invalid actor headers: userId={}, role={}", userId, role);
            return null;
        }
    }
}
