package com.quotagate.observability;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes audit records to the {@code quotagate.audit} logger, which the
 * logging configuration routes to its own appender for retention.
 */
@Slf4j(topic = "quotagate.audit")
public class LoggingAuditSink implements AuditSink {

    @Override
    public void record(AuditRecord record) {
        log.info("outcome={} operation={} key={} client={} principal={} path={} limit={} retryAfter={} reason={} at={}",
                record.getOutcome(),
                record.getOperationId(),
                record.getKey(),
                record.getClientAddress(),
                record.getPrincipalId(),
                record.getPath(),
                record.getLimit(),
                record.getRetryAfterSeconds(),
                record.getReason(),
                record.getOccurredAt());
    }
}
