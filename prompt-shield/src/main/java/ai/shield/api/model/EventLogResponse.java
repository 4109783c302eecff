package ai.shield.api.model;

import ai.shield.audit.ShieldEvent;

import java.util.List;

public record EventLogResponse(List<ShieldEvent> events) {}
