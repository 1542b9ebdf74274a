package com.dietwatch.search.service;

import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.model.SearchableEntity;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One HTTP round trip against the structured store per call. Rate limiting, retries and caching are
 * layered on top by {@link StructuredStoreClient}.
 */
public interface StructuredStoreGateway {

    /**
     * One page of records matching any query term, scored locally. Records scoring zero are left out,
     * but still count in {@link KeywordPage#scanned()}. Pass the previous page's offset to continue.
     */
    KeywordPage search(String text, SearchFilters filters, String offset);

    Optional<SearchableEntity> getEntity(String entityId);

    /**
     * One page of records modified after {@code since}. Pass the previous page's offset to continue.
     */
    ChangedPage listChangedSince(Instant since, String offset);

    record KeywordPage(List<ScoredHit> hits, int scanned, String nextOffset) {

        public boolean hasMore() {
            return nextOffset != null && !nextOffset.isBlank();
        }
    }

    record ChangedPage(List<SearchableEntity> entities, String nextOffset) {

        public boolean hasMore() {
            return nextOffset != null && !nextOffset.isBlank();
        }
    }
}
