package com.acme.leadflow.audit.query;

import com.acme.leadflow.audit.util.AuditDefaults;

import java.time.Instant;

/**
 * Filter set for a log scan. Absent filters are {@code null}; time bounds are inclusive.
 * Also serves as the query cache key.
 */
public record AuditQuery(
    String eventType,
    String leadId,
    String workflow,
    Instant startTime,
    Instant endTime,
    int limit
) {
    public AuditQuery {
        limit = limit <= 0 ? AuditDefaults.DEFAULT_QUERY_LIMIT : limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static AuditQuery forLead(String leadId, int limit) {
        return new AuditQuery(null, leadId, null, null, null, limit);
    }

    public static final class Builder {
        private String eventType;
        private String leadId;
        private String workflow;
        private Instant startTime;
        private Instant endTime;
        private int limit = AuditDefaults.DEFAULT_QUERY_LIMIT;

        private Builder() {
        }

        public Builder eventType(String eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder leadId(String leadId) {
            this.leadId = leadId;
            return this;
        }

        public Builder workflow(String workflow) {
            this.workflow = workflow;
            return this;
        }

        public Builder between(Instant startTime, Instant endTime) {
            this.startTime = startTime;
            this.endTime = endTime;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public AuditQuery build() {
            return new AuditQuery(eventType, leadId, workflow, startTime, endTime, limit);
        }
    }
}
