package io.ingestline.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import io.ingestline.core.EventCandidate;
import io.ingestline.core.InvalidEventException;
import io.ingestline.core.StoredEvent;
import io.ingestline.store.EventStore;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

@RestController
@RequestMapping("/events")
public class EventController {
    /** Fixed page size for listing; clients cannot override it. */
    static final int PAGE_SIZE = 50;

    private final EventStore store;
    private final ObjectMapper json;

    public EventController(EventStore store, ObjectMapper json) {
        this.store = store;
        this.json = strictText(json);
    }

    /** Numbers and booleans are not accepted where a string is expected. */
    private static ObjectMapper strictText(ObjectMapper shared) {
        var mapper = shared.copy();
        mapper.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return mapper;
    }

    /**
     * The body is decoded as JSON whatever Content-Type the client sent, and the
     * reply is JSON whatever the client accepts.
     */
    @PostMapping
    public ResponseEntity<StoredEvent> create(@RequestBody(required = false) byte[] body) {
        var candidate = decode(body).validated();
        return ResponseEntity.status(HttpStatus.CREATED)
                .contentType(MediaType.APPLICATION_JSON)
                .body(store.add(candidate));
    }

    @GetMapping
    public ResponseEntity<List<StoredEvent>> list() {
        return ResponseEntity.ok().contentType(MediaType.APPLICATION_JSON).body(store.list(PAGE_SIZE));
    }

    private EventCandidate decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new InvalidEventException("empty body (need type, payload)");
        }
        EventCandidate candidate;
        try {
            candidate = json.readValue(body, EventCandidate.class);
        } catch (IOException e) {
            throw new InvalidEventException("invalid json (need type, payload)", e);
        }
        if (candidate == null) {
            throw new InvalidEventException("invalid json (need type, payload)");
        }
        return candidate;
    }
}
