package uk.gegc.surveylink.features.onelink.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.surveylink.features.onelink.domain.model.OneLink;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface OneLinkRepository extends JpaRepository<OneLink, Long> {

    Optional<OneLink> findByTokenHash(String tokenHash);

    default Optional<OneLink> findByToken(String token) {
        return findByTokenHash(OneLink.hashToken(token))
                .filter(link -> token.equals(link.getToken()));
    }

    @Modifying(clearAutomatically = true)
    @Query("UPDATE OneLink l SET l.used = true, l.usedAt = :now WHERE l.id = :id AND l.used = false")
    int markUsed(@Param("id") Long id, @Param("now") Instant now);

    @Modifying(clearAutomatically = true)
    @Query("UPDATE OneLink l SET l.accessedAt = :now WHERE l.id = :id AND l.accessedAt IS NULL")
    int markAccessedIfUnset(@Param("id") Long id, @Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM OneLink l WHERE l.expiresAt < :now")
    int deleteExpired(@Param("now") Instant now);
}
