package com.demo.relay.controller;

import com.demo.relay.service.SessionStore;
import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;
import org.springframework.web.util.WebUtils;

/**
 * Maps the session cookie onto a {@link SessionStore} id, setting a fresh cookie whenever
 * the client's token was missing or unknown.
 */
@Component
public class SessionCookieResolver {

    private final SessionStore sessionStore;
    private final String cookieName;

    public SessionCookieResolver(SessionStore sessionStore,
                                 @Value("${relay.session.cookie-name:session_id}") String cookieName) {
        this.sessionStore = sessionStore;
        this.cookieName = cookieName;
    }

    public String resolve(HttpServletRequest request, HttpServletResponse response) {
        Cookie cookie = WebUtils.getCookie(request, cookieName);
        String token = cookie != null ? cookie.getValue() : null;

        String sessionId = sessionStore.resolve(token);
        if (!sessionId.equals(token)) {
            ResponseCookie fresh = ResponseCookie.from(cookieName, sessionId)
                    .path("/")
                    .httpOnly(true)
                    .sameSite("Lax")
                    .build();
            response.addHeader(HttpHeaders.SET_COOKIE, fresh.toString());
        }
        return sessionId;
    }
}
