package uk.gegc.surveylink.features.onelink.infra.persistence;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.surveylink.features.onelink.application.LinkStore;
import uk.gegc.surveylink.features.onelink.domain.model.OneLink;
import uk.gegc.surveylink.features.onelink.domain.repository.OneLinkRepository;

import java.time.Instant;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaLinkStore implements LinkStore {

    private final OneLinkRepository oneLinkRepository;

    @Override
    @Transactional
    public OneLink create(OneLink link) {
        return oneLinkRepository.save(link);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<OneLink> findByToken(String token) {
        return oneLinkRepository.findByToken(token);
    }

    @Override
    @Transactional
    public boolean markUsed(Long id, Instant usedAt) {
        return oneLinkRepository.markUsed(id, usedAt) == 1;
    }

    @Override
    @Transactional
    public void markAccessedIfUnset(Long id, Instant accessedAt) {
        oneLinkRepository.markAccessedIfUnset(id, accessedAt);
    }

    @Override
    @Transactional
    public int deleteExpired(Instant now) {
        return oneLinkRepository.deleteExpired(now);
    }
}
