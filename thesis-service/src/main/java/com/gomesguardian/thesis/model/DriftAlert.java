package com.gomesguardian.thesis.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Drift or conflict alert. Acknowledgement is the only permitted change.
 */
@Data
@NoArgsConstructor
@Table("drift_alert")
public class DriftAlert {

    @Id
    private Long id;

    private String ticker;
    private String alertType;
    private String severity;
    private Integer oldScore;
    private int newScore;
    private String title;
    private String message;
    private String recommendation;
    private String source;

    private boolean acknowledged;
    private LocalDateTime acknowledgedAt;
    private LocalDateTime createdAt;
}
