package com.mockinterview.platform.repository;

import com.mockinterview.platform.model.ResumeRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ResumeRepository extends JpaRepository<ResumeRecord, String> {
}
