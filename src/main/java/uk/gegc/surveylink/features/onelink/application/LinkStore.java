package uk.gegc.surveylink.features.onelink.application;

import uk.gegc.surveylink.features.onelink.domain.model.OneLink;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable store of issued links. Every operation is atomic for a single record.
 */
public interface LinkStore {

    /**
     * Persists a new link and returns it with its generated id.
     */
    OneLink create(OneLink link);

    Optional<OneLink> findByToken(String token);

    /**
     * Flips {@code used} to true and stamps {@code usedAt}, only if the link is still unused.
     *
     * @return true if this call performed the transition, false if the link is missing or already used
     */
    boolean markUsed(Long id, Instant usedAt);

    /**
     * Stamps {@code accessedAt} if it has never been set. Repeated calls are no-ops.
     */
    void markAccessedIfUnset(Long id, Instant accessedAt);

    /**
     * Removes links whose expiry lies before {@code now}.
     *
     * @return number of removed links
     */
    int deleteExpired(Instant now);
}
