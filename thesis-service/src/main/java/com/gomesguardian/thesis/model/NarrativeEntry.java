package com.gomesguardian.thesis.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One append-only narrative entry. {@code (ticker, sequenceNo)} is unique and
 * sequence numbers start at 1.
 */
@Data
@NoArgsConstructor
@Table("thesis_narrative")
public class NarrativeEntry {

    @Id
    private Long id;

    private String ticker;
    private int sequenceNo;
    private String source;
    private String content;
    private String conflicts;
    private String conflictType;
    private String classificationPath;
    private Integer scoreBefore;
    private int scoreAfter;
    private LocalDateTime recordedAt;
}
