package com.comma.counseling.filter;

import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.exceptions.InvalidCredentialException;
import com.comma.counseling.security.AuthenticatedParticipant;
import com.comma.counseling.service.ParticipantService;
import com.comma.counseling.utils.ErrorUtility;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolves the bearer token of REST calls into an {@link AuthenticatedParticipant} principal.
 */
@Slf4j
@Component
public class AuthFilter extends OncePerRequestFilter {

    private final ParticipantService participantService;

    public AuthFilter(ParticipantService participantService) {
        this.participantService = participantService;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        return request.getRequestURI().startsWith("/ws/");
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (Objects.nonNull(header) && header.startsWith("Bearer ")) {
            String token = header.substring(7);
            try {
                AuthenticatedParticipant participant = participantService.authenticate(token);
                List<SimpleGrantedAuthority> authorities =
                        List.of(new SimpleGrantedAuthority(participant.getKind().name().toUpperCase(Locale.ROOT)));

                SecurityContextHolder.getContext().setAuthentication(
                        new UsernamePasswordAuthenticationToken(participant, null, authorities)
                );
            } catch (InvalidCredentialException ex) {
                ErrorUtility.printError(HttpServletResponse.SC_UNAUTHORIZED, ex.getCode(),
                        "Authentication Failed: " + ex.getMessage(), response);
                return;
            } catch (ForbiddenException ex) {
                ErrorUtility.printError(HttpServletResponse.SC_FORBIDDEN, ex.getCode(),
                        "Access Denied: " + ex.getMessage(), response);
                return;
            } catch (RuntimeException ex) {
                log.error("Authentication failed unexpectedly: {}", ex.getMessage(), ex);
                ErrorUtility.printError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "INTERNAL_ERROR",
                        "Internal Server Error", response);
                return;
            }
        }

        filterChain.doFilter(request, response);
    }
}
