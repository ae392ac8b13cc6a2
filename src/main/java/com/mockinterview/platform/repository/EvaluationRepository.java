package com.mockinterview.platform.repository;

import com.mockinterview.platform.model.EvaluationRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface EvaluationRepository extends JpaRepository<EvaluationRecord, String> {
}
