package io.ingestline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;

import java.io.IOException;
import java.time.Instant;

/** Writes an {@link ErrorPayload} straight to the servlet response, for use outside MVC. */
final class ErrorResponses {
    private ErrorResponses() {}

    static void write(ObjectMapper json, HttpServletRequest request, HttpServletResponse response,
                      HttpStatus status, String message) throws IOException {
        response.reset();
        response.setStatus(status.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        var body = new ErrorPayload(Instant.now(), status.value(), status.getReasonPhrase(), message,
                request.getRequestURI());
        json.writeValue(response.getOutputStream(), body);
    }
}
