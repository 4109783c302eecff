package ai.shield.api;

import ai.shield.api.model.EventLogResponse;
import ai.shield.audit.ShieldEventLogger;
import ai.shield.service.ValidationException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class EventLogController {
    private final ShieldEventLogger events;
    private final int defaultLimit;

    public EventLogController(
            ShieldEventLogger events,
            @Value("${shield.events.default-limit:200}") int defaultLimit
    ) {
        this.events = events;
        this.defaultLimit = defaultLimit;
    }

    @GetMapping("/api/logs")
    public EventLogResponse recent(@RequestParam(name = "limit", required = false) Integer limit) {
        int effective = limit == null ? defaultLimit : limit;
        if (effective <= 0) {
            throw new ValidationException("'limit' must be a positive integer.");
        }
        return new EventLogResponse(events.query(effective));
    }
}
