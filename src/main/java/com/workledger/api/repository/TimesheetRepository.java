package com.workledger.api.repository;

import com.workledger.api.model.TimesheetEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.OffsetDateTime;

@Repository
public interface TimesheetRepository extends JpaRepository<TimesheetEntry, Long> {

    /**
     * Inserts the row, or updates the existing one sharing (date, sender_email, project, client).
     * Returns the number of rows written, which is 1 in both cases.
     */
    @Modifying
    @Query(nativeQuery = true, value = """
            INSERT INTO timesheets
                (date, day, hours, required_hours, activity, client, project,
                 employee_name, employee_id, sender_email, created_at)
            VALUES
                (:date, :day, :hours, :requiredHours, :activity, :client, :project,
                 :employeeName, :employeeId, :senderEmail, :createdAt)
            ON CONFLICT (date, sender_email, project, client) DO UPDATE SET
                day = EXCLUDED.day,
                hours = EXCLUDED.hours,
                required_hours = EXCLUDED.required_hours,
                activity = EXCLUDED.activity,
                employee_name = EXCLUDED.employee_name,
                employee_id = EXCLUDED.employee_id
            """)
    int upsert(@Param("date") LocalDate date,
               @Param("day") String day,
               @Param("hours") BigDecimal hours,
               @Param("requiredHours") BigDecimal requiredHours,
               @Param("activity") String activity,
               @Param("client") String client,
               @Param("project") String project,
               @Param("employeeName") String employeeName,
               @Param("employeeId") String employeeId,
               @Param("senderEmail") String senderEmail,
               @Param("createdAt") OffsetDateTime createdAt);
}
