package com.workledger.api.service;

import com.workledger.api.dto.TimesheetEntryDTO;
import com.workledger.api.repository.TimesheetRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TimesheetMergeServiceTest {

    @Mock
    private TimesheetRepository timesheetRepository;

    private TimesheetMergeService mergeService;

    // Stands in for the timesheets table, keyed like its unique constraint
    private final Map<List<Object>, BigDecimal> table = new HashMap<>();

    @BeforeEach
    void setUp() {
        mergeService = new TimesheetMergeService(timesheetRepository,
                Clock.fixed(Instant.parse("2024-06-01T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Merging the same dates twice updates rows instead of duplicating them")
    void mergeIsIdempotentOnNaturalKey() {
        // given
        stubUpsertIntoTable();
        List<TimesheetEntryDTO> first = List.of(
                row("2024-05-01", "alice@example.com", "8"),
                row("2024-05-02", "alice@example.com", "8"));
        List<TimesheetEntryDTO> second = List.of(
                row("2024-05-02", "alice@example.com", "6"),
                row("2024-05-03", "alice@example.com", "8"));

        // when
        int firstWritten = mergeService.merge(first);
        int secondWritten = mergeService.merge(second);

        // then
        assertThat(firstWritten).isEqualTo(2);
        assertThat(secondWritten).isEqualTo(2);
        assertThat(table).hasSize(3);
        assertThat(table.get(List.of(LocalDate.parse("2024-05-02"), "alice@example.com", "Portal", "acme")))
                .isEqualByComparingTo("6");
    }

    @Test
    @DisplayName("A failing row aborts the merge")
    void failurePropagates() {
        when(timesheetRepository.upsert(any(), any(), any(), any(), any(), any(), any(), any(), any(), any(), any()))
                .thenThrow(new IllegalStateException("constraint violated"));

        assertThatThrownBy(() -> mergeService.merge(List.of(row("2024-05-01", "alice@example.com", "8"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("constraint violated");
    }

    private void stubUpsertIntoTable() {
        when(timesheetRepository.upsert(any(), any(), any(), any(), any(), any(), any(), any(), any(), any(), any()))
                .thenAnswer(inv -> {
                    List<Object> key = List.of(inv.getArgument(0), inv.getArgument(9), inv.getArgument(6),
                            inv.getArgument(5));
                    table.put(key, inv.getArgument(2));
                    return 1;
                });
    }

    private static TimesheetEntryDTO row(String date, String sender, String hours) {
        return new TimesheetEntryDTO(date, "Wednesday", new BigDecimal(hours), new BigDecimal("8"), "WORK",
                "acme", "Portal", "Alice", "E1", sender);
    }
}
