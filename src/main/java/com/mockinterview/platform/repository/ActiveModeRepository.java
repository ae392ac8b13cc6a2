package com.mockinterview.platform.repository;

import com.mockinterview.platform.model.ActiveModeSet;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ActiveModeRepository extends JpaRepository<ActiveModeSet, String> {
}
