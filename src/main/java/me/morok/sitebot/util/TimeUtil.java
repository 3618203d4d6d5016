package me.morok.sitebot.util;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

public class TimeUtil {

    DateTimeFormatter out = DateTimeFormatter.ofPattern("dd.MM.yyyy HH:mm");

    Clock clock;

    public TimeUtil() {
        this(Clock.systemDefaultZone());
    }

    public TimeUtil(Clock clock) {
        this.clock = clock;
    }

    public String now() {
        return LocalDateTime.now(clock).format(out);
    }
}
