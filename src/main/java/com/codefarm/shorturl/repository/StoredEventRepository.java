package com.codefarm.shorturl.repository;

import com.codefarm.shorturl.model.StoredEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface StoredEventRepository extends JpaRepository<StoredEventEntity, UUID> {

    List<StoredEventEntity> findByAggregateIdOrderByVersionAsc(UUID aggregateId);

    @Query("select coalesce(max(e.version), 0L) from StoredEventEntity e where e.aggregateId = :aggregateId")
    long findCurrentVersion(@Param("aggregateId") UUID aggregateId);
}
