package com.workledger.api.service;

import com.workledger.api.dto.TimesheetEntryDTO;
import com.workledger.api.repository.TimesheetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.List;

@Service
public class TimesheetMergeService {

    private static final Logger logger = LoggerFactory.getLogger(TimesheetMergeService.class);

    private final TimesheetRepository timesheetRepository;
    private final Clock clock;

    public TimesheetMergeService(TimesheetRepository timesheetRepository, Clock clock) {
        this.timesheetRepository = timesheetRepository;
        this.clock = clock;
    }

    /**
     * Upserts the whole batch in its own transaction, keyed on (date, sender_email, project, client).
     * Re-running an extraction over the same dates updates rows instead of duplicating them.
     * Any failure rolls the entire batch back.
     *
     * @return number of rows written, inserts and updates alike
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public int merge(List<TimesheetEntryDTO> entries) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        int written = 0;

        for (TimesheetEntryDTO entry : entries) {
            written += timesheetRepository.upsert(
                    LocalDate.parse(entry.date()),
                    entry.day(),
                    entry.hours(),
                    entry.requiredHours(),
                    entry.activity(),
                    entry.client(),
                    entry.project(),
                    entry.employeeName(),
                    entry.employeeId(),
                    entry.senderEmail(),
                    now
            );
        }

        logger.info("Merged {} timesheet rows ({} written, updates included)", entries.size(), written);
        return written;
    }
}
