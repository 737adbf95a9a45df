package org.wikidata.query.rdf.entitystore.taxonomy;

import java.util.concurrent.atomic.AtomicLong;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.collect.ImmutableList;

/**
 * Run-wide memo of type identifier to transitive superclasses.
 * <p>
 * Each type is resolved at most once: concurrent requests for a type that is not cached yet wait for
 * a single lookup and share its result. Empty results are kept as well, so a type that failed to resolve
 * is not queried again during the same run.
 *
 * @author Marco Fossati - User:Hjfocs
 * @since 0.1.0
 */
public class SuperclassCache {

    private final LoadingCache<String, ImmutableList<String>> cache;
    private final AtomicLong remoteLookups = new AtomicLong();

    public SuperclassCache(TaxonomyResolver resolver) {
        this.cache = CacheBuilder.newBuilder()
            .build(new CacheLoader<String, ImmutableList<String>>() {
                @Override
                public ImmutableList<String> load(String typeId) {
                    remoteLookups.incrementAndGet();
                    return resolver.superclasses(typeId);
                }
            });
    }

    /**
     * @return the superclasses of the type, the type itself included; empty if they could not be resolved
     */
    public ImmutableList<String> get(String typeId) {
        return cache.getUnchecked(typeId);
    }

    /**
     * @return how many lookups reached the remote service
     */
    public long remoteLookups() {
        return remoteLookups.get();
    }

    public long size() {
        return cache.size();
    }
}
