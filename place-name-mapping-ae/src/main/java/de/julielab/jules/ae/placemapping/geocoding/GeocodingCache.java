package de.julielab.jules.ae.placemapping.geocoding;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;

import de.julielab.jules.ae.placemapping.utils.GeocodingException;

/**
 * Corpus-wide cache of external geocoding outcomes, shared by all workers. The
 * coordinates of a place do not depend on the sentence, so each place name and
 * region hint is looked up only once. A failed lookup is not cached and will be
 * attempted again for the next mention.
 */
public class GeocodingCache {
    private static final Logger log = LoggerFactory.getLogger(GeocodingCache.class);

    private final Cache<ResolutionCacheKey, CachedResolution> cache;

    public GeocodingCache(long maximumSize) {
        log.info("Creating geocoding cache with a maximum size of {}", maximumSize);
        this.cache = CacheBuilder.newBuilder().maximumSize(maximumSize).build();
    }

    /**
     * Returns the cached outcome for <tt>key</tt> or calls the loader and caches
     * its result. Concurrent requests for the same key wait for a single load.
     *
     * @throws GeocodingException if the loader fails; nothing is cached in this case
     */
    public CachedResolution get(ResolutionCacheKey key, Callable<CachedResolution> loader) throws GeocodingException {
        try {
            return cache.get(key, loader);
        } catch (ExecutionException | UncheckedExecutionException | ExecutionError e) {
            Throwable cause = e.getCause();
            if (cause instanceof GeocodingException)
                throw (GeocodingException) cause;
            throw new GeocodingException("Geocoding of " + key + " failed", cause);
        }
    }

    public long size() {
        return cache.size();
    }
}
