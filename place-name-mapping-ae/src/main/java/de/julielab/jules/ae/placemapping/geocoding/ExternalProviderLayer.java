package de.julielab.jules.ae.placemapping.geocoding;

import static de.julielab.jules.ae.placemapping.PlaceMappingConfiguration.*;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.RateLimiter;

import de.julielab.jules.ae.placemapping.PlaceMappingConfiguration;
import de.julielab.jules.ae.placemapping.textmodel.AcceptedMention;
import de.julielab.jules.ae.placemapping.textmodel.GeocodedRecord;
import de.julielab.jules.ae.placemapping.utils.GeocodingException;
import de.julielab.jules.ae.placemapping.utils.TransientGeocodingException;
import de.julielab.jules.ae.placemapping.utils.norm.PlaceNameNormalizer;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

/**
 * <p>
 * The last resolver layer, asking an {@link ExternalGeocodingProvider}. Two
 * consecutive calls are at least <tt>geocoding_min_delay_ms</tt> apart, across
 * all threads. Transient failures are retried up to
 * <tt>geocoding_max_attempts</tt> times with exponential backoff starting at
 * <tt>geocoding_backoff_ms</tt>; a "not found" answer and all other errors are
 * not retried.
 * </p>
 * <p>
 * Outcomes, including "not found", are cached by normalized name and region
 * hint in the {@link GeocodingCache}.
 * </p>
 */
public class ExternalProviderLayer implements ResolverLayer {
    public static final String SOURCE_SUFFIX = "_with_context";
    private static final Logger log = LoggerFactory.getLogger(ExternalProviderLayer.class);

    private final ExternalGeocodingProvider provider;
    private final GeocodingCache cache;
    private final PlaceNameNormalizer normalizer;
    private final RateLimiter rateLimiter;
    private final Retry retry;

    public ExternalProviderLayer(ExternalGeocodingProvider provider, GeocodingCache cache,
                                 PlaceNameNormalizer normalizer, PlaceMappingConfiguration config) {
        this.provider = provider;
        this.cache = cache;
        this.normalizer = normalizer;
        int minDelay = config.getInt(GEOCODING_MIN_DELAY_MS, 1000);
        // With a warm-up period, permits stored while idle are as expensive as fresh ones.
        this.rateLimiter = minDelay > 0 ? RateLimiter.create(1000d / minDelay, minDelay, TimeUnit.MILLISECONDS) : null;
        int maxAttempts = Math.max(1, config.getInt(GEOCODING_MAX_ATTEMPTS, 3));
        long backoffMillis = Math.max(1, config.getInt(GEOCODING_BACKOFF_MS, 500));
        double backoffMultiplier = Math.max(1, config.getDouble(GEOCODING_BACKOFF_MULTIPLIER, 2));
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(backoffMillis, backoffMultiplier))
                .retryExceptions(TransientGeocodingException.class)
                .build();
        this.retry = Retry.of("geocoding-" + provider.getProviderId(), retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Transient failure of provider {} in attempt {} of {}, retrying in {} ms: {}",
                provider.getProviderId(), event.getNumberOfRetryAttempts(), maxAttempts,
                event.getWaitInterval().toMillis(), event.getLastThrowable().getMessage()));
        log.info("External geocoding with provider {}, minimum delay {} ms, {} attempts, initial backoff {} ms",
                provider.getProviderId(), minDelay, maxAttempts, backoffMillis);
    }

    @Override
    public String getName() {
        return provider.getProviderId() + SOURCE_SUFFIX;
    }

    @Override
    public Optional<GeocodedRecord> tryResolve(AcceptedMention mention, ResolutionContext context) {
        String name = normalizer.normalize(mention.getPlaceName());
        String regionHint = context.getRegionHint();
        CachedResolution resolution;
        try {
            resolution = cache.get(new ResolutionCacheKey(name, regionHint),
                    () -> query(name, regionHint, mention.getSentenceText()));
        } catch (GeocodingException e) {
            log.warn("External geocoding of {} (region hint {}) with provider {} failed: {}", name, regionHint,
                    provider.getProviderId(), e.getMessage());
            return Optional.empty();
        }
        if (!resolution.isFound()) {
            log.debug("Provider {} does not know {} (region hint {})", provider.getProviderId(), name, regionHint);
            return Optional.empty();
        }
        ProviderResult result = resolution.getResult();
        String canonicalName = result.getDisplayName() != null ? result.getDisplayName() : name;
        return Optional.of(new GeocodedRecord(mention, canonicalName, result.getLatitude(), result.getLongitude(),
                result.getConfidence(), getName(), regionHint, resolution.getRepresentativeContext()));
    }

    private CachedResolution query(String name, String regionHint, String sentence) throws GeocodingException {
        try {
            return retry.executeCallable(() -> {
                if (rateLimiter != null)
                    rateLimiter.acquire();
                Optional<ProviderResult> result = provider.geocode(name, regionHint);
                return new CachedResolution(result.orElse(null), sentence);
            });
        } catch (GeocodingException e) {
            throw e;
        } catch (Exception e) {
            throw new GeocodingException("Geocoding of " + name + " with provider " + provider.getProviderId()
                    + " failed", e);
        }
    }
}
