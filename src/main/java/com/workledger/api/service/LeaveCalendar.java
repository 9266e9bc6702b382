package com.workledger.api.service;

import com.workledger.api.model.PtoRequest;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Holiday dates plus approved leave intervals, keyed by employee id.
 * Comparisons are date-only.
 */
public final class LeaveCalendar {

    private final Set<LocalDate> holidays;
    private final Map<String, List<PtoRequest>> leaveByEmployee;

    public LeaveCalendar(Set<LocalDate> holidays, List<PtoRequest> approvedLeave) {
        this.holidays = Set.copyOf(holidays);
        this.leaveByEmployee = approvedLeave.stream()
                .filter(pto -> pto.getEmployeeId() != null && pto.getStartDate() != null && pto.getEndDate() != null)
                .collect(Collectors.groupingBy(PtoRequest::getEmployeeId));
    }

    public static LeaveCalendar empty() {
        return new LeaveCalendar(Set.of(), List.of());
    }

    public boolean isHoliday(LocalDate date) {
        return holidays.contains(date);
    }

    public boolean isOnLeave(String employeeId, LocalDate date) {
        if (employeeId == null) {
            return false;
        }
        return leaveByEmployee.getOrDefault(employeeId, List.of()).stream()
                .anyMatch(pto -> pto.covers(date));
    }
}
