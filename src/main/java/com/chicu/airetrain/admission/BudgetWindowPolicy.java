package com.chicu.airetrain.admission;

import com.chicu.airetrain.config.RetrainProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.TemporalAdjusters;
import java.util.Set;

/**
 * Режет время на чередующиеся окна "выходные" / "будни" в зоне budget-zone.
 *
 * Пример (SAT+SUN): окно выходных = Sat 00:00 .. Mon 00:00, окно будней = Mon 00:00 .. Sat 00:00.
 * Если weekend-days пустой или содержит все дни: одно недельное окно с понедельника.
 */
@Component
@RequiredArgsConstructor
public class BudgetWindowPolicy {

    private final RetrainProperties props;

    public BudgetWindow windowAt(Instant at) {
        ZoneId zone = props.zone();
        Set<DayOfWeek> weekendDays = props.getWeekendDays();
        LocalDate day = at.atZone(zone).toLocalDate();

        if (weekendDays == null || weekendDays.isEmpty() || weekendDays.size() == DayOfWeek.values().length) {
            boolean allWeekend = weekendDays != null && !weekendDays.isEmpty();
            LocalDate monday = day.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
            return new BudgetWindow(
                    monday.atStartOfDay(zone).toInstant(),
                    monday.plusWeeks(1).atStartOfDay(zone).toInstant(),
                    allWeekend,
                    capFor(allWeekend)
            );
        }

        boolean weekend = weekendDays.contains(day.getDayOfWeek());

        LocalDate first = day;
        for (int i = 0; i < 7 && weekendDays.contains(first.minusDays(1).getDayOfWeek()) == weekend; i++) {
            first = first.minusDays(1);
        }

        LocalDate afterLast = day.plusDays(1);
        for (int i = 0; i < 7 && weekendDays.contains(afterLast.getDayOfWeek()) == weekend; i++) {
            afterLast = afterLast.plusDays(1);
        }

        return new BudgetWindow(
                first.atStartOfDay(zone).toInstant(),
                afterLast.atStartOfDay(zone).toInstant(),
                weekend,
                capFor(weekend)
        );
    }

    private int capFor(boolean weekend) {
        return weekend ? props.getMaxWeekendRetrains() : props.getMaxWeekdayRetrains();
    }
}
