package io.intellixity.vista.server.web;

import io.intellixity.vista.session.SessionContext;
import io.intellixity.vista.session.Sessions;
import io.intellixity.vista.temporal.PdvmStamp;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/** Binds the caller's {@link SessionContext} for {@code /api/} requests. */
@Component
public final class SessionContextFilter extends OncePerRequestFilter {
  public static final String SESSION_HEADER = "X-Session-Id";
  public static final String USER_HEADER = "X-User-Id";
  public static final String AS_OF_HEADER = "X-As-Of";
  public static final String ROLES_HEADER = "X-Roles";

  private final Clock clock;

  public SessionContextFilter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    String path = request.getRequestURI();
    return path == null || !path.startsWith("/api/");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String sessionId = request.getHeader(SESSION_HEADER);
    if (sessionId == null || sessionId.isBlank()) {
      response.sendError(400, "Missing required header: " + SESSION_HEADER);
      return;
    }

    PdvmStamp asOf;
    try {
      asOf = parseAsOf(request.getHeader(AS_OF_HEADER));
    } catch (IllegalArgumentException e) {
      response.sendError(400, "Invalid " + AS_OF_HEADER + " header: " + e.getMessage());
      return;
    }

    String userId = request.getHeader(USER_HEADER);
    SessionContext ctx = new SessionContext(sessionId.trim(), userId == null ? null : userId.trim(), asOf,
        parseRoles(request.getHeader(ROLES_HEADER)));

    try {
      Sessions.inSession(ctx, () -> {
        try {
          filterChain.doFilter(request, response);
        } catch (IOException | ServletException e) {
          throw new FilterChainFailure(e);
        }
        return null;
      });
    } catch (FilterChainFailure e) {
      if (e.getCause() instanceof IOException ioe) throw ioe;
      throw (ServletException) e.getCause();
    }
  }

  /**
   * PDVM stamp ({@code 2025043.5}), ISO date or ISO date-time. Absent means the start of today, so the
   * result cache key only moves at a day boundary.
   */
  PdvmStamp parseAsOf(String raw) {
    if (raw == null || raw.isBlank()) return PdvmStamp.of(LocalDate.now(clock));
    String s = raw.trim();
    PdvmStamp numeric = PdvmStamp.tryParse(s);
    if (numeric != null) {
      if (numeric.toLocalDateTime() == null) throw new IllegalArgumentException("not a valid date: " + s);
      return numeric;
    }
    try {
      return s.contains("T") ? PdvmStamp.of(LocalDateTime.parse(s)) : PdvmStamp.of(LocalDate.parse(s));
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("not a PDVM stamp or ISO date: " + s, e);
    }
  }

  static Set<String> parseRoles(String raw) {
    Set<String> out = new LinkedHashSet<>();
    if (raw == null) return out;
    for (String part : raw.split(",")) {
      String r = part.trim();
      if (!r.isEmpty()) out.add(r);
    }
    return out;
  }

  private static final class FilterChainFailure extends RuntimeException {
    FilterChainFailure(Exception cause) {
      super(cause);
    }
  }
}
