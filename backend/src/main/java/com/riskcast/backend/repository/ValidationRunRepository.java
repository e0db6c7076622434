package com.riskcast.backend.repository;

import com.riskcast.backend.model.ValidationRun;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ValidationRunRepository extends JpaRepository<ValidationRun, Long> {
    List<ValidationRun> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
