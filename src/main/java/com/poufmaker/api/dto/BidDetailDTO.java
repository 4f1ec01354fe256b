package com.poufmaker.api.dto;

import com.poufmaker.api.entity.Bid;
import com.poufmaker.api.enums.BidStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A bid together with the product it targets and the upholsterer who placed it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BidDetailDTO {
    private UUID id;
    private UUID productId;
    private UUID upholstererId;
    private BigDecimal amount;
    private String notes;
    private BidStatus status;
    private Instant createdAt;
    private Instant updatedAt;
    private ProductSummaryDTO product;
    private UserSummaryDTO upholsterer;

    public static BidDetailDTO fromEntity(Bid bid, ProductSummaryDTO product, UserSummaryDTO upholsterer) {
        return BidDetailDTO.builder()
                .id(bid.getId())
                .productId(bid.getProductId())
                .upholstererId(bid.getUpholstererId())
                .amount(bid.getAmount())
                .notes(bid.getNotes())
                .status(bid.getStatus())
                .createdAt(bid.getCreatedAt())
                .updatedAt(bid.getUpdatedAt())
                .product(product)
                .upholsterer(upholsterer)
                .build();
    }
}
