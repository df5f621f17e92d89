package uk.gegc.surveylink.features.onelink.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.web.util.UriComponentsBuilder;
import uk.gegc.surveylink.features.onelink.application.ConsumedLink;
import uk.gegc.surveylink.features.onelink.application.DistributedLock;
import uk.gegc.surveylink.features.onelink.application.DistributedLock.LockLease;
import uk.gegc.surveylink.features.onelink.application.IssuedLink;
import uk.gegc.surveylink.features.onelink.application.LinkAction;
import uk.gegc.surveylink.features.onelink.application.LinkErrorKind;
import uk.gegc.surveylink.features.onelink.application.LinkPreview;
import uk.gegc.surveylink.features.onelink.application.LinkResult;
import uk.gegc.surveylink.features.onelink.application.LinkStatusCache;
import uk.gegc.surveylink.features.onelink.application.LinkStore;
import uk.gegc.surveylink.features.onelink.application.OneLinkService;
import uk.gegc.surveylink.features.onelink.application.PrefillKeyValidator;
import uk.gegc.surveylink.features.onelink.application.TokenCodec;
import uk.gegc.surveylink.features.onelink.config.OneLinkProperties;
import uk.gegc.surveylink.features.onelink.domain.exception.InvalidTokenException;
import uk.gegc.surveylink.features.onelink.domain.exception.TokenEncodingException;
import uk.gegc.surveylink.features.onelink.domain.model.LinkPayload;
import uk.gegc.surveylink.features.onelink.domain.model.OneLink;
import uk.gegc.surveylink.features.onelink.domain.model.PrefillDataConverter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Issues one-time links and enforces exactly-once consumption.
 *
 * <p>Consumption follows cache, then lock, then durable re-check: the status cache can only
 * short-circuit a rejection, the per-token lock serialises the read-then-write of the {@code used}
 * flag, and the store decides. The business action and the {@code used} flip share one transaction,
 * which commits before the lock is released.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OneLinkServiceImpl implements OneLinkService {

    static final String LOCK_KEY_PREFIX = "onelink:consume:";
    private static final PrefillDataConverter PREFILL_CONVERTER = new PrefillDataConverter();

    private final TokenCodec tokenCodec;
    private final LinkStore linkStore;
    private final LinkStatusCache statusCache;
    private final DistributedLock distributedLock;
    private final PrefillKeyValidator prefillKeyValidator;
    private final OneLinkProperties properties;
    private final TransactionOperations transactionOperations;
    private final Clock clock;

    @Override
    public LinkResult<IssuedLink> issueLink(Long surveyId, Map<String, Object> prefill, Instant requestedExpiry) {
        Map<String, Object> prefillData = prefill == null ? Map.of() : prefill;

        Set<String> invalidKeys = prefillKeyValidator.invalidKeys(surveyId, prefillData.keySet());
        if (!invalidKeys.isEmpty()) {
            Set<String> sorted = new TreeSet<>(invalidKeys);
            log.debug("Rejected link issuance for survey {}: unknown prefill keys {}", surveyId, sorted);
            return LinkResult.failure(LinkErrorKind.INVALID_PREFILL_KEY,
                    "Invalid prefill keys " + sorted + " - no matching question found",
                    Map.of("invalidKeys", sorted));
        }

        Instant now = clock.instant();
        Instant expiresAt;
        if (requestedExpiry != null) {
            expiresAt = requestedExpiry.truncatedTo(ChronoUnit.SECONDS);
            if (!expiresAt.isAfter(now)) {
                return LinkResult.failure(LinkErrorKind.EXPIRY_OUT_OF_RANGE, "Expiration time must be in the future");
            }
            if (expiresAt.isAfter(now.plus(properties.getMaxExpiry()))) {
                return LinkResult.failure(LinkErrorKind.EXPIRY_OUT_OF_RANGE,
                        "Expiration time exceeds maximum allowed duration of " + properties.getMaxExpiry());
            }
        } else {
            expiresAt = now.plus(properties.getDefaultExpiry()).truncatedTo(ChronoUnit.SECONDS);
        }

        LinkPayload payload = new LinkPayload(surveyId, prefillData, expiresAt.getEpochSecond(),
                UUID.randomUUID().toString());
        String token;
        try {
            int prefillLength = serializedLength(payload.prefill());
            if (prefillLength > OneLink.MAX_PREFILL_LENGTH) {
                log.debug("Rejected link issuance for survey {}: prefill of {} characters", surveyId, prefillLength);
                return LinkResult.failure(LinkErrorKind.PREFILL_TOO_LARGE,
                        "Prefill data must not exceed " + OneLink.MAX_PREFILL_LENGTH + " characters once serialized",
                        Map.of("maxLength", OneLink.MAX_PREFILL_LENGTH, "actualLength", prefillLength));
            }
            token = tokenCodec.encode(payload);
        } catch (TokenEncodingException ex) {
            log.error("Failed to encode one-time link for survey {}", surveyId, ex);
            return LinkResult.failure(LinkErrorKind.ENCODING_ERROR, "Failed to generate link token");
        }

        OneLink link = new OneLink();
        link.setSurveyId(surveyId);
        link.setToken(token);
        link.setPrefillData(new HashMap<>(payload.prefill()));
        link.setExpiresAt(expiresAt);
        link.setUsed(false);
        link.setCreatedAt(now);
        OneLink saved = linkStore.create(link);

        String url = UriComponentsBuilder.fromUriString(properties.getBaseUrl())
                .path("/surveys/{surveyId}")
                .queryParam("token", token)
                .buildAndExpand(surveyId)
                .toUriString();

        log.info("Issued one-time link {} for survey {} expiring at {}", saved.getId(), surveyId, expiresAt);
        return LinkResult.success(new IssuedLink(saved.getId(), token, url, expiresAt));
    }

    @Override
    public LinkResult<LinkPreview> previewLink(String token) {
        Instant now = clock.instant();
        LinkResult<LinkPayload> decoded = decodeAndCheckExpiry(token, now);
        if (decoded.isFailure()) {
            return LinkResult.failure(decoded.error());
        }
        LinkPayload payload = decoded.value();

        if (isCachedAsUsed(token)) {
            return alreadyUsed();
        }

        LinkResult<OneLink> checked = loadAndRecheck(token, payload, now);
        if (checked.isFailure()) {
            return LinkResult.failure(checked.error());
        }
        OneLink link = checked.value();

        if (link.getAccessedAt() == null) {
            markAccessedQuietly(link.getId(), now);
        }

        return LinkResult.success(new LinkPreview(link.getId(), payload.resourceId(), payload.prefill(),
                payload.expiresAtInstant()));
    }

    @Override
    public <T> LinkResult<T> consumeLink(String token, LinkAction<T> action) {
        Objects.requireNonNull(action, "action");
        Instant now = clock.instant();
        LinkResult<LinkPayload> decoded = decodeAndCheckExpiry(token, now);
        if (decoded.isFailure()) {
            return LinkResult.failure(decoded.error());
        }
        LinkPayload payload = decoded.value();

        if (isCachedAsUsed(token)) {
            return alreadyUsed();
        }

        Optional<LockLease> lease = tryLock(token);
        if (lease.isEmpty()) {
            log.warn("Concurrent submission rejected for link {}", fingerprint(token));
            return LinkResult.failure(LinkErrorKind.CONCURRENT_SUBMISSION,
                    "This link is being submitted by another request, please do not submit twice");
        }

        try {
            stampFirstAccess(token, payload, now);
            LinkResult<T> result = transactionOperations.execute(status -> consumeUnderLock(token, payload, action, status));
            if (result == null) {
                throw new IllegalStateException("Consumption transaction returned no result");
            }
            if (result.isSuccess()) {
                cacheUsed(token, payload);
            }
            return result;
        } finally {
            releaseQuietly(lease.get(), token);
        }
    }

    private <T> LinkResult<T> consumeUnderLock(String token, LinkPayload payload, LinkAction<T> action,
                                               TransactionStatus status) {
        Instant now = clock.instant();
        LinkResult<OneLink> checked = loadAndRecheck(token, payload, now);
        if (checked.isFailure()) {
            return LinkResult.failure(checked.error());
        }
        OneLink link = checked.value();

        T value = action.execute(new ConsumedLink(link.getId(), payload.resourceId(), payload.prefill(),
                payload.expiresAtInstant()));

        if (!linkStore.markUsed(link.getId(), clock.instant())) {
            // lease lapsed and another holder committed first
            status.setRollbackOnly();
            log.warn("Link {} was already consumed when committing, rolling back business action", link.getId());
            cacheUsed(token, payload);
            return alreadyUsed();
        }
        log.info("One-time link {} consumed for survey {}", link.getId(), link.getSurveyId());
        return LinkResult.success(value);
    }

    /**
     * Records the first access in its own write, so a failing action cannot roll it back. Runs under
     * the consumption lock; validity is re-checked inside the transaction.
     */
    private void stampFirstAccess(String token, LinkPayload payload, Instant now) {
        LinkResult<OneLink> checked;
        try {
            checked = loadAndRecheck(token, payload, now);
        } catch (RuntimeException ex) {
            log.warn("Failed to load link {} for its access stamp: {}", fingerprint(token), ex.getMessage());
            return;
        }
        if (checked.isSuccess() && checked.value().getAccessedAt() == null) {
            markAccessedQuietly(checked.value().getId(), now);
        }
    }

    private void markAccessedQuietly(Long linkId, Instant now) {
        try {
            linkStore.markAccessedIfUnset(linkId, now);
        } catch (RuntimeException ex) {
            log.warn("Failed to record first access of link {}", linkId, ex);
        }
    }

    private int serializedLength(Map<String, Object> prefill) {
        try {
            String json = PREFILL_CONVERTER.convertToDatabaseColumn(prefill);
            return json == null ? 0 : json.length();
        } catch (IllegalArgumentException ex) {
            throw new TokenEncodingException("Prefill data is not serializable", ex);
        }
    }

    private LinkResult<LinkPayload> decodeAndCheckExpiry(String token, Instant now) {
        LinkPayload payload;
        try {
            payload = tokenCodec.decode(token);
        } catch (InvalidTokenException ex) {
            log.debug("Rejected token {}: {}", fingerprint(token), ex.getMessage());
            return LinkResult.failure(LinkErrorKind.INVALID_TOKEN, "Invalid token");
        }
        if (payload.isExpiredAt(now)) {
            return expired();
        }
        return LinkResult.success(payload);
    }

    private LinkResult<OneLink> loadAndRecheck(String token, LinkPayload payload, Instant now) {
        Optional<OneLink> found = linkStore.findByToken(token);
        if (found.isEmpty()) {
            log.debug("Token {} decodes but was never issued", fingerprint(token));
            return LinkResult.failure(LinkErrorKind.INVALID_TOKEN, "Invalid token");
        }
        OneLink link = found.get();
        if (!Objects.equals(link.getSurveyId(), payload.resourceId())) {
            log.warn("Link {} belongs to survey {} but its token names survey {}",
                    link.getId(), link.getSurveyId(), payload.resourceId());
            return LinkResult.failure(LinkErrorKind.INVALID_TOKEN, "Invalid token");
        }
        if (link.isUsed()) {
            cacheUsed(token, payload);
            return alreadyUsed();
        }
        if (link.isExpiredAt(now)) {
            return expired();
        }
        return LinkResult.success(link);
    }

    private boolean isCachedAsUsed(String token) {
        try {
            return statusCache.getUsed(token).orElse(false);
        } catch (RuntimeException ex) {
            log.warn("Link status cache read failed, falling back to store: {}", ex.getMessage());
            return false;
        }
    }

    private void cacheUsed(String token, LinkPayload payload) {
        Duration ttl = Duration.between(clock.instant(), payload.expiresAtInstant());
        if (ttl.isZero() || ttl.isNegative()) {
            return;
        }
        try {
            statusCache.put(token, true, ttl);
        } catch (RuntimeException ex) {
            log.warn("Failed to cache used status of link {}: {}", fingerprint(token), ex.getMessage());
        }
    }

    private Optional<LockLease> tryLock(String token) {
        try {
            return distributedLock.tryAcquire(LOCK_KEY_PREFIX + token, properties.getLockLease());
        } catch (RuntimeException ex) {
            log.warn("Lock acquisition failed for link {}: {}", fingerprint(token), ex.getMessage());
            return Optional.empty();
        }
    }

    private void releaseQuietly(LockLease lease, String token) {
        try {
            lease.release();
        } catch (RuntimeException ex) {
            log.warn("Failed to release lock of link {}, it expires with its lease: {}", fingerprint(token), ex.getMessage());
        }
    }

    private static <T> LinkResult<T> alreadyUsed() {
        return LinkResult.failure(LinkErrorKind.LINK_ALREADY_USED, "This link has already been used");
    }

    private static <T> LinkResult<T> expired() {
        return LinkResult.failure(LinkErrorKind.TOKEN_EXPIRED, "This link has expired");
    }

    static String fingerprint(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 8 ? token : token.substring(0, 8) + "...";
    }
}
