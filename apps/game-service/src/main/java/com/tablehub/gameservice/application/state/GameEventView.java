package com.tablehub.gameservice.application.state;

import java.time.OffsetDateTime;
import java.util.Map;

public record GameEventView(Long id,
                            String gameId,
                            Integer version,
                            String eventType,
                            Map<String, Object> payload,
                            OffsetDateTime createdAt) {
}
