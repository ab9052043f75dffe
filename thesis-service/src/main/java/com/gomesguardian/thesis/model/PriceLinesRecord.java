package com.gomesguardian.thesis.model;

import com.gomesguardian.common.model.PriceLines;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One version of a ticker's price lines. The current version has no {@code validUntil}.
 */
@Data
@NoArgsConstructor
@Table("price_lines")
public class PriceLinesRecord {

    @Id
    private Long id;

    private String ticker;
    private Double greenLine;
    private Double redLine;
    private Double greyLine;
    private String source;
    private LocalDateTime effectiveFrom;
    private LocalDateTime validUntil;

    public PriceLines toPriceLines() {
        return new PriceLines(greenLine, redLine, greyLine);
    }
}
