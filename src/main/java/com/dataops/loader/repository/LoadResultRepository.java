package com.dataops.loader.repository;

import com.dataops.loader.model.LoadResult;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface LoadResultRepository extends JpaRepository<LoadResult, Long> {

    Optional<LoadResult> findBySourceFileId(Long sourceFileId);

    @Modifying(flushAutomatically = true)
    @Query("DELETE FROM LoadResult r WHERE r.sourceFileId = :sourceFileId")
    int deleteBySourceFileId(@Param("sourceFileId") Long sourceFileId);
}
