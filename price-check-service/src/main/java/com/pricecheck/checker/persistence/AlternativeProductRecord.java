package com.pricecheck.checker.persistence;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** A ranked alternative seen for a query, stored in {@code alternative_products}. */
@Data
@NoArgsConstructor
@Table("alternative_products")
public class AlternativeProductRecord {

    @Id
    private Long id;

    private String        searchQuery;
    private String        source;
    private String        productName;
    private Double        price;
    private Double        wasPrice;
    private boolean       onSale;
    private String        promoText;
    private String        url;
    private Double        matchScore;
    private LocalDateTime recordedAt;
}
