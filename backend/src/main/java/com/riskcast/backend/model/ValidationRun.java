package com.riskcast.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Entity
@Table(name = "validation_runs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 64)
    private String runId;

    @Column(nullable = false)
    private boolean targetAchieved;

    @Column(nullable = false)
    private int folds;

    @Column(nullable = false)
    private long randomSeed;

    @Column(nullable = false)
    private int sampleCount;

    @Column(nullable = false)
    private double overallCalibrationError;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String resultJson;

    @Column(nullable = false)
    private LocalDateTime createdAt;
}
