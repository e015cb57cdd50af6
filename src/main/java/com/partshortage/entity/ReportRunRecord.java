package com.partshortage.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Archived copy of one generated shortage report.
 */
@Entity
@Table(
    name = "report_runs",
    indexes = {
        @Index(name = "idx_run_generated", columnList = "generated_at"),
        @Index(name = "idx_run_planning_date", columnList = "planning_date"),
    }
)
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ReportRunRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(updatable = false, nullable = false)
    private UUID id;

    @CreationTimestamp
    @Column(name = "generated_at", updatable = false)
    private Instant generatedAt;

    @Column(name = "planning_date", nullable = false)
    private LocalDate planningDate;

    @Column(name = "horizon_days")
    private int horizonDays;

    @Column(name = "lead_workdays")
    private int leadWorkdays;

    @Column(name = "order_status_open_threshold")
    private int orderStatusOpenThreshold;

    @Column(name = "part_count")
    private int partCount;

    @Column(name = "shortage_row_count")
    private int shortageRowCount;

    @Column(name = "request_id", length = 64)
    private String requestId;

    @Lob
    @Column(name = "report_csv")
    private String reportCsv;
}
