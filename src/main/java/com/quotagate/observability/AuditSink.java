package com.quotagate.observability;

public interface AuditSink {

    void record(AuditRecord record);
}
