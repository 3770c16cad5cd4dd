package io.ingestline.api.metrics;

import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpServletResponseWrapper;

import java.io.IOException;

/**
 * Observes the status a handler sets without changing anything the client
 * sees. Only calls made before the response is committed count, since later
 * ones never reach the wire.
 */
final class StatusCapturingResponse extends HttpServletResponseWrapper {
    private int status = SC_OK;

    StatusCapturingResponse(HttpServletResponse response) {
        super(response);
    }

    @Override
    public void setStatus(int sc) {
        capture(sc);
        super.setStatus(sc);
    }

    @Override
    public void sendError(int sc) throws IOException {
        capture(sc);
        super.sendError(sc);
    }

    @Override
    public void sendError(int sc, String msg) throws IOException {
        capture(sc);
        super.sendError(sc, msg);
    }

    @Override
    public void sendRedirect(String location) throws IOException {
        capture(SC_FOUND);
        super.sendRedirect(location);
    }

    @Override
    public void reset() {
        if (!isCommitted()) status = SC_OK;
        super.reset();
    }

    int capturedStatus() {
        return status;
    }

    private void capture(int sc) {
        if (!isCommitted()) status = sc;
    }
}
