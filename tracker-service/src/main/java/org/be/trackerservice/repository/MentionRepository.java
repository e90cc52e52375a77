package org.be.trackerservice.repository;

import org.be.trackerservice.entity.Mention;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface MentionRepository extends JpaRepository<Mention, Long>, JpaSpecificationExecutor<Mention> {

    /**
     * 기준 시각 이후 멘션 수
     */
    long countByCreatedAtGreaterThanEqual(LocalDateTime since);

    /**
     * 버킷 집계용 생성 시각 목록 (오름차순)
     */
    @Query("SELECT m.createdAt FROM Mention m WHERE m.createdAt >= :since ORDER BY m.createdAt")
    List<LocalDateTime> findCreatedAtSince(@Param("since") LocalDateTime since);

    /**
     * 감성 라벨별 멘션 수
     */
    @Query("""
        SELECT m.sentiment, COUNT(m)
        FROM Mention m
        WHERE m.createdAt >= :since AND m.sentiment IS NOT NULL
        GROUP BY m.sentiment
        """)
    List<Object[]> countBySentimentSince(@Param("since") LocalDateTime since);

    /**
     * 토픽별 멘션 수 (많은 순)
     */
    @Query("""
        SELECT m.topic, COUNT(m)
        FROM Mention m
        WHERE m.createdAt >= :since AND m.topic IS NOT NULL
        GROUP BY m.topic
        ORDER BY COUNT(m) DESC, m.topic ASC
        """)
    List<Object[]> countByTopicSince(@Param("since") LocalDateTime since, Pageable pageable);

    /**
     * 소스별 멘션 수 (많은 순)
     */
    @Query("""
        SELECT m.source, COUNT(m)
        FROM Mention m
        WHERE m.createdAt >= :since
        GROUP BY m.source
        ORDER BY COUNT(m) DESC
        """)
    List<Object[]> countBySourceSince(@Param("since") LocalDateTime since, Pageable pageable);

    /**
     * 타임라인용 (생성 시각, 감성) 쌍
     */
    @Query("SELECT m.createdAt, m.sentiment FROM Mention m WHERE m.createdAt >= :since ORDER BY m.createdAt")
    List<Object[]> findTimelineRowsSince(@Param("since") LocalDateTime since);
}
