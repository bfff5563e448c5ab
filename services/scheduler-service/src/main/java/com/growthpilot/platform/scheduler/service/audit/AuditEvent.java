package com.growthpilot.platform.scheduler.service.audit;

import lombok.*;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {
    private AuditEventType type;
    private UUID userId;
    private UUID subjectId;
    private String status;
    private String detail;
    private OffsetDateTime occurredAt;
}
