package com.flagship.bookkeeping.snapshot;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * One cached statement of one month, stored as JSON.
 *
 * Rows are only ever inserted or deleted; a snapshot is never updated in place.
 */
@Entity
@Table(
    name = "monthly_reports",
    uniqueConstraints = @UniqueConstraint(name = "uk_monthly_reports_month_type", columnNames = {"report_month", "report_type"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MonthlyReportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "report_month", nullable = false, updatable = false)
    private LocalDate reportMonth;

    @Enumerated(EnumType.STRING)
    @Column(name = "report_type", nullable = false, length = 50, updatable = false)
    private ReportType reportType;

    @Column(nullable = false, updatable = false, length = 1048576)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static MonthlyReportEntity create(LocalDate reportMonth, ReportType reportType, String payload, Instant now) {
        return new MonthlyReportEntity(null, reportMonth, reportType, payload, now);
    }
}
