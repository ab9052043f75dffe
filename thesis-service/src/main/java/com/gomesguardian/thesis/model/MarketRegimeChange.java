package com.gomesguardian.thesis.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("market_regime_log")
public class MarketRegimeChange {

    @Id
    private Long id;

    private String fromRegime;
    private String toRegime;
    private String note;
    private boolean escalation;
    private String changedBy;
    private LocalDateTime changedAt;
}
