package com.workledger.api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

/**
 * A row of the durable timesheet store. Unique on (date, sender_email, project, client),
 * which is the conflict key used by the extraction merge.
 */
@Entity
@Table(name = "timesheets",
        uniqueConstraints = @UniqueConstraint(name = "uq_timesheets_natural_key",
                columnNames = {"date", "sender_email", "project", "client"}))
@Getter
@Setter
public class TimesheetEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private LocalDate date;

    @Column
    private String day;

    @Column(precision = 5, scale = 2)
    private BigDecimal hours;

    @Column(name = "required_hours", precision = 5, scale = 2)
    private BigDecimal requiredHours;

    @Column
    private String activity;

    @Column(nullable = false)
    private String client;

    @Column(nullable = false)
    private String project;

    @Column(name = "employee_name")
    private String employeeName;

    @Column(name = "employee_id")
    private String employeeId;

    @Column(name = "sender_email", nullable = false)
    private String senderEmail;

    @Column(name = "created_at")
    private OffsetDateTime createdAt;
}
