package com.gomesguardian.thesis.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Immutable score history row. {@code recordedAt} strictly increases per ticker.
 */
@Data
@NoArgsConstructor
@Table("score_history")
public class ScoreHistoryEntry {

    @Id
    private Long id;

    private String ticker;
    private int score;
    private String thesisStatus;
    private String source;
    private LocalDateTime recordedAt;
}
