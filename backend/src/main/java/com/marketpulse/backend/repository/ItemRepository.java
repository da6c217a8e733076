package com.marketpulse.backend.repository;

import com.marketpulse.backend.model.Item;
import com.marketpulse.backend.model.ItemSource;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

@Repository
public interface ItemRepository extends JpaRepository<Item, String>, JpaSpecificationExecutor<Item> {

    @Query("SELECT i FROM Item i WHERE i.asset = :asset AND i.ts > :from AND i.ts <= :to "
            + "AND (:includeLowRelevance = true OR i.lowRelevance = false) ORDER BY i.ts ASC, i.id ASC")
    List<Item> findWindow(@Param("asset") String asset,
                          @Param("from") Instant from,
                          @Param("to") Instant to,
                          @Param("includeLowRelevance") boolean includeLowRelevance);

    @Query("SELECT i.ts FROM Item i WHERE i.asset = :asset AND i.ts > :from AND i.ts <= :to "
            + "AND (:includeLowRelevance = true OR i.lowRelevance = false)")
    List<Instant> findTimestamps(@Param("asset") String asset,
                                 @Param("from") Instant from,
                                 @Param("to") Instant to,
                                 @Param("includeLowRelevance") boolean includeLowRelevance);

    @Query("SELECT i FROM Item i WHERE i.asset = :asset AND i.ts >= :notBefore AND i.ts <= :readyBefore "
            + "AND (i.impact IS NULL OR i.impact60m IS NULL) ORDER BY i.ts ASC")
    List<Item> findPendingImpact(@Param("asset") String asset,
                                 @Param("notBefore") Instant notBefore,
                                 @Param("readyBefore") Instant readyBefore,
                                 Pageable pageable);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Item i SET i.impact = :impact, i.impactMeta = :meta WHERE i.id = :id AND i.impact IS NULL")
    int writeImpact15m(@Param("id") String id, @Param("impact") double impact, @Param("meta") String meta);

    @Modifying(clearAutomatically = true)
    @Transactional
    @Query("UPDATE Item i SET i.impact60m = :impact, i.impactMeta = :meta WHERE i.id = :id AND i.impact60m IS NULL")
    int writeImpact60m(@Param("id") String id, @Param("impact") double impact, @Param("meta") String meta);

    @Query("SELECT COUNT(i) FROM Item i WHERE i.asset = :asset AND i.ts > :from AND i.ts <= :to "
            + "AND (:includeLowRelevance = true OR i.lowRelevance = false)")
    long countWindow(@Param("asset") String asset,
                     @Param("from") Instant from,
                     @Param("to") Instant to,
                     @Param("includeLowRelevance") boolean includeLowRelevance);

    long countByAssetAndTsAfter(String asset, Instant since);

    @Query("SELECT AVG(i.score) FROM Item i WHERE i.asset = :asset AND i.ts > :since")
    Double averageScoreSince(@Param("asset") String asset, @Param("since") Instant since);

    @Query("SELECT i FROM Item i WHERE i.asset = :asset AND i.ts >= :since AND i.impact IS NOT NULL "
            + "ORDER BY ABS(i.impact) DESC")
    List<Item> findTopImpact(@Param("asset") String asset, @Param("since") Instant since, Pageable pageable);

    @Query("SELECT i FROM Item i WHERE i.asset = :asset AND i.source = :source AND i.ts >= :since "
            + "AND i.impact IS NOT NULL ORDER BY ABS(i.impact) DESC")
    List<Item> findTopImpactBySource(@Param("asset") String asset,
                                     @Param("source") ItemSource source,
                                     @Param("since") Instant since,
                                     Pageable pageable);

    List<Item> findTop50ByAssetAndLowRelevanceFalseAndTsAfterOrderByTsDesc(String asset, Instant since);
}
