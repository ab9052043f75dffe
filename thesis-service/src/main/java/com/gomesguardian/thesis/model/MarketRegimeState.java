package com.gomesguardian.thesis.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** The single current market regime row ({@code id = 1}). */
@Data
@NoArgsConstructor
@Table("market_regime")
public class MarketRegimeState {

    public static final long SINGLETON_ID = 1L;

    @Id
    private Long id;

    private String regime;
    private String note;
    private long version;
    private String updatedBy;
    private LocalDateTime updatedAt;
}
