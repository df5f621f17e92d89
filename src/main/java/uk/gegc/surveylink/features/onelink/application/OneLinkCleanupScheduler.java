package uk.gegc.surveylink.features.onelink.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Slf4j
@Component
@RequiredArgsConstructor
public class OneLinkCleanupScheduler {

    private final LinkStore linkStore;
    private final Clock clock;

    @Scheduled(cron = "${surveylink.one-link.cleanup-cron:0 0 * * * *}")
    public void purgeExpiredLinks() {
        try {
            int deleted = linkStore.deleteExpired(clock.instant());
            if (deleted > 0) {
                log.info("Deleted {} expired one-time links", deleted);
            }
        } catch (Exception e) {
            log.error("Failed to clean up expired one-time links", e);
        }
    }
}
