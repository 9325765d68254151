package com.budgetme.goals.security;

import com.budgetme.goals.dto.ApiResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Escreve 401/403 no mesmo envelope {@link ApiResponse} do GlobalExceptionHandler,
 * para erros que acontecem antes do DispatcherServlet (filtro JWT, entry point).
 */
@Component
@RequiredArgsConstructor
public class SecurityErrorResponseWriter {

    private final ObjectMapper objectMapper;

    public void unauthorized(HttpServletResponse response, String reason) throws IOException {
        write(response, HttpServletResponse.SC_UNAUTHORIZED, "Não autenticado", reason);
    }

    public void forbidden(HttpServletResponse response, String reason) throws IOException {
        write(response, HttpServletResponse.SC_FORBIDDEN, "Acesso negado", reason);
    }

    private void write(HttpServletResponse response, int status, String message, String reason) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), ApiResponse.error(message, List.of(reason != null ? reason : message)));
    }
}
