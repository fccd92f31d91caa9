package com.dealtracker.poller.domain.notification;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalTime;
import org.junit.jupiter.api.Test;

class NotificationWindowTest {

    @Test
    void contains_sameDayWindow_boundsInclusive() {
        var window = new NotificationWindow(LocalTime.of(8, 0), LocalTime.of(22, 0));

        assertThat(window.contains(LocalTime.of(8, 0))).isTrue();
        assertThat(window.contains(LocalTime.of(15, 30))).isTrue();
        assertThat(window.contains(LocalTime.of(22, 0))).isTrue();
        assertThat(window.contains(LocalTime.of(7, 59))).isFalse();
        assertThat(window.contains(LocalTime.of(22, 1))).isFalse();
    }

    @Test
    void contains_windowAcrossMidnight_wraps() {
        var window = new NotificationWindow(LocalTime.of(22, 0), LocalTime.of(6, 0));

        assertThat(window.contains(LocalTime.of(23, 30))).isTrue();
        assertThat(window.contains(LocalTime.of(0, 0))).isTrue();
        assertThat(window.contains(LocalTime.of(6, 0))).isTrue();
        assertThat(window.contains(LocalTime.of(12, 0))).isFalse();
    }

    @Test
    void contains_allDay_acceptsEveryTime() {
        assertThat(NotificationWindow.ALL_DAY.contains(LocalTime.MIDNIGHT)).isTrue();
        assertThat(NotificationWindow.ALL_DAY.contains(LocalTime.of(23, 59, 59))).isTrue();
    }
}
