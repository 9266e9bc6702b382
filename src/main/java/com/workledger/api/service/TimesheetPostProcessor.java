package com.workledger.api.service;

import com.workledger.api.dto.ExtractedEntry;
import com.workledger.api.dto.TimesheetEntryDTO;
import com.workledger.api.model.Holiday;
import com.workledger.api.model.enums.Activity;
import com.workledger.api.model.enums.PtoStatus;
import com.workledger.api.repository.HolidayRepository;
import com.workledger.api.repository.PtoRequestRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
public class TimesheetPostProcessor {

    private static final Logger logger = LoggerFactory.getLogger(TimesheetPostProcessor.class);

    private static final DateTimeFormatter WORKER_DATE =
            DateTimeFormatter.ofPattern("M/d/uuuu").withResolverStyle(ResolverStyle.STRICT);

    private final HolidayRepository holidayRepository;
    private final PtoRequestRepository ptoRequestRepository;

    public TimesheetPostProcessor(HolidayRepository holidayRepository, PtoRequestRepository ptoRequestRepository) {
        this.holidayRepository = holidayRepository;
        this.ptoRequestRepository = ptoRequestRepository;
    }

    @Transactional(readOnly = true)
    public LeaveCalendar loadCalendar() {
        Set<LocalDate> holidays = holidayRepository.findAll().stream()
                .map(Holiday::getHolidayDate)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        return new LeaveCalendar(holidays, ptoRequestRepository.findByStatus(PtoStatus.approved));
    }

    /**
     * Resolves project and required hours from the mapping and reclassifies the activity:
     * a holiday wins over approved leave, which wins over what the worker reported.
     * Rows without a sender or a readable date cannot be keyed in the store and are dropped.
     */
    public List<TimesheetEntryDTO> process(List<ExtractedEntry> entries, EmployeeProjectMap mapping,
                                           LeaveCalendar calendar) {
        List<TimesheetEntryDTO> processed = new ArrayList<>(entries.size());

        for (ExtractedEntry entry : entries) {
            Optional<LocalDate> date = parseDate(entry.date());
            if (entry.senderEmail() == null || entry.senderEmail().isBlank()) {
                logger.warn("Dropping extracted row dated {} without a sender email", entry.date());
                continue;
            }
            if (date.isEmpty()) {
                logger.warn("Dropping extracted row from {} with unreadable date '{}'", entry.senderEmail(), entry.date());
                continue;
            }

            String project = entry.project() != null ? entry.project() : "";
            BigDecimal requiredHours = BigDecimal.ZERO;
            Optional<EmployeeProjectMap.ProjectAssignment> assignment = mapping.resolve(entry.senderEmail(), entry.client());
            if (assignment.isPresent()) {
                project = assignment.get().project() != null ? assignment.get().project() : project;
                requiredHours = assignment.get().requiredHours();
            }

            String employeeId = entry.employeeId();
            if (employeeId == null) {
                employeeId = mapping.employee(entry.senderEmail())
                        .map(EmployeeProjectMap.EmployeeMapping::employeeId)
                        .orElse(null);
            }

            processed.add(new TimesheetEntryDTO(
                    date.get().toString(),
                    entry.day(),
                    entry.hours(),
                    requiredHours,
                    classify(entry.activity(), employeeId, date.get(), calendar),
                    entry.client() != null ? entry.client() : "",
                    project,
                    entry.employeeName(),
                    employeeId,
                    entry.senderEmail()
            ));
        }

        return processed;
    }

    static String classify(String reported, String employeeId, LocalDate date, LeaveCalendar calendar) {
        if (calendar.isHoliday(date)) {
            return Activity.HOLIDAY.name();
        }
        if (calendar.isOnLeave(employeeId, date)) {
            return Activity.PTO.name();
        }
        return reported != null ? reported : Activity.WORK.name();
    }

    /**
     * Worker dates come as M/d/yyyy (the spreadsheet, PDF and image extractors all write that);
     * ISO dates and date-times are accepted too, and only the date part is kept.
     */
    static Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String datePart = value.trim().split("[ T]", 2)[0];
        DateTimeFormatter format = datePart.indexOf('/') >= 0 ? WORKER_DATE : DateTimeFormatter.ISO_LOCAL_DATE;
        try {
            return Optional.of(LocalDate.parse(datePart, format));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
