package com.partshortage.repository;

import com.partshortage.entity.ReportRunRecord;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ReportRunRepository extends JpaRepository<ReportRunRecord, UUID> {

    Page<ReportRunRecord> findAllByOrderByGeneratedAtDesc(Pageable pageable);
}
