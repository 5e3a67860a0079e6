package com.pricecheck.checker.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One observed price of a best-match product, stored in {@code price_history}.
 * {@code productKey} includes the source's disambiguator so pack sizes never mix.
 */
@Data
@NoArgsConstructor
@Table("price_history")
public class PriceHistoryRecord {

    @Id
    private Long id;

    private String        productKey;
    private String        productName;
    private String        source;
    private Double        price;
    private Double        wasPrice;
    private boolean       onSale;
    private String        promoText;
    private String        url;
    private LocalDateTime recordedAt;
}
