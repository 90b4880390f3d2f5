package com.bank_sync_engine.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.UUID;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@Table("sync_runs")
public class SyncRun {

    @Id
    private UUID id;

    @Column("connection_id")
    private UUID connectionId;

    @Column("status")
    private SyncStatus status;

    @Column("from_date")
    private LocalDate fromDate;

    @Column("to_date")
    private LocalDate toDate;

    @Column("transactions_found")
    private Integer transactionsFound;

    @Column("transactions_new")
    private Integer transactionsNew;

    @Column("transactions_updated")
    private Integer transactionsUpdated;

    @Column("transactions_skipped")
    private Integer transactionsSkipped;

    @Column("error_code")
    private String errorCode;

    @Column("error_message")
    private String errorMessage;

    @Column("started_at")
    private OffsetDateTime startedAt;

    @Column("completed_at")
    private OffsetDateTime completedAt;
}
