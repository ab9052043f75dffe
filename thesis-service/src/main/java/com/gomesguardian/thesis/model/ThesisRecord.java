package com.gomesguardian.thesis.model;

import com.gomesguardian.common.model.ThesisView;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Living belief record for one ticker.
 *
 * <p>Written only by the knowledge synthesis merge (score, facts, narrative pointer)
 * and by the drift monitor ({@code needsReview}). The narrative itself lives in
 * {@code thesis_narrative}; {@code narrativeHeadId} points at the latest entry.
 */
@Data
@NoArgsConstructor
@Table("thesis")
public class ThesisRecord {

    @Id
    private Long id;

    private String ticker;
    private Integer convictionScore;

    private String edge;
    private String catalysts;
    private String risks;
    private String actionVerdict;
    private String sources;

    private Long narrativeHeadId;
    private int narrativeCount;

    private boolean needsReview;
    private String reviewReason;

    @Version
    private Long version;

    private LocalDateTime createdAt;
    private LocalDateTime lastUpdated;

    public ThesisView toView() {
        return new ThesisView(ticker, convictionScore, edge, catalysts, risks, actionVerdict, lastUpdated);
    }
}
