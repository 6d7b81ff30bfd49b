package com.devflow.core.safety;

import com.devflow.core.model.TimeContext;
import com.devflow.core.model.WorkingHours;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Computes the {@link TimeContext} for decisions from an injectable {@link Clock}.
 * <p>
 * Working hours are zero-padded "HH:MM" strings compared lexicographically with the
 * local time in the window's timezone (the clock's zone when none is set).
 * Both ends are inclusive at minute resolution.
 */
@Component
public class TimeContextProvider {

    private static final DateTimeFormatter HH_MM = DateTimeFormatter.ofPattern("HH:mm");

    private final Clock clock;

    public TimeContextProvider(Clock clock) {
        this.clock = clock;
    }

    public TimeContext current(WorkingHours workingHours) {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zoneOf(workingHours)));
        return new TimeContext(now, isWorkingHours(workingHours, now), null, now.getDayOfWeek());
    }

    /**
     * @return true when no window is configured or {@code time} falls inside it
     */
    public boolean isWorkingHours(WorkingHours workingHours, ZonedDateTime time) {
        if (workingHours == null) {
            return true;
        }
        String local = time.withZoneSameInstant(zoneOf(workingHours)).format(HH_MM);
        return local.compareTo(workingHours.start()) >= 0 && local.compareTo(workingHours.end()) <= 0;
    }

    private ZoneId zoneOf(WorkingHours workingHours) {
        if (workingHours == null || workingHours.timezone() == null || workingHours.timezone().isBlank()) {
            return clock.getZone();
        }
        return ZoneId.of(workingHours.timezone());
    }
}
