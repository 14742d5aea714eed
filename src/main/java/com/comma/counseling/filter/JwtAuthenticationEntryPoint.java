package com.comma.counseling.filter;

import com.comma.counseling.utils.ErrorUtility;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;

@Component
public class JwtAuthenticationEntryPoint implements AuthenticationEntryPoint {

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        ErrorUtility.printError(HttpServletResponse.SC_UNAUTHORIZED, "AUTHENTICATION_ERROR",
                "Authentication required", response);
    }
}
