package com.codefarm.shorturl.repository;

import com.codefarm.shorturl.domain.UrlStatus;
import com.codefarm.shorturl.model.ShortUrlEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface ShortUrlRepository extends JpaRepository<ShortUrlEntity, UUID> {

    Optional<ShortUrlEntity> findByShortCode(String shortCode);

    boolean existsByShortCode(String shortCode);

    Page<ShortUrlEntity> findByCreatedBy(String createdBy, Pageable pageable);

    /**
     * Short URL that may still redirect: in the given status and not past its expiry.
     */
    @Query("select u from ShortUrlEntity u " +
            "where u.shortCode = :shortCode and u.status = :status " +
            "and (u.expiresAt is null or u.expiresAt >= :now)")
    Optional<ShortUrlEntity> findResolvable(
            @Param("shortCode") String shortCode,
            @Param("status") UrlStatus status,
            @Param("now") Instant now
    );
}
