package uk.gegc.surveylink.features.onelink.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OneLinkCleanupSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T00:00:00Z");

    @Mock
    private LinkStore linkStore;

    @Test
    @DisplayName("purgeExpiredLinks: deletes links expired before the current instant")
    void purgeExpiredLinks_deletes() {
        OneLinkCleanupScheduler scheduler = new OneLinkCleanupScheduler(linkStore, Clock.fixed(NOW, ZoneOffset.UTC));
        when(linkStore.deleteExpired(NOW)).thenReturn(3);

        scheduler.purgeExpiredLinks();

        verify(linkStore).deleteExpired(NOW);
    }

    @Test
    @DisplayName("purgeExpiredLinks: store failure is logged, not thrown")
    void purgeExpiredLinks_failure() {
        OneLinkCleanupScheduler scheduler = new OneLinkCleanupScheduler(linkStore, Clock.fixed(NOW, ZoneOffset.UTC));
        when(linkStore.deleteExpired(NOW)).thenThrow(new IllegalStateException("db down"));

        assertThatCode(scheduler::purgeExpiredLinks).doesNotThrowAnyException();
    }
}
