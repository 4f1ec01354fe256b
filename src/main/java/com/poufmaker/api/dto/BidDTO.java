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
 * A bid as listed under its product.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BidDTO {
    private UUID id;
    private BigDecimal amount;
    private String notes;
    private BidStatus status;
    private Instant createdAt;
    private UserSummaryDTO upholsterer;

    public static BidDTO fromEntity(Bid bid, UserSummaryDTO upholsterer) {
        return BidDTO.builder()
                .id(bid.getId())
                .amount(bid.getAmount())
                .notes(bid.getNotes())
                .status(bid.getStatus())
                .createdAt(bid.getCreatedAt())
                .upholsterer(upholsterer)
                .build();
    }
}
