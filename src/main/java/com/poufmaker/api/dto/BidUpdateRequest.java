package com.poufmaker.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.poufmaker.api.enums.BidStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Partial bid update. A null field is left unchanged.
 * <p>
 * {@code amount} and {@code notes} belong to the bidding upholsterer,
 * {@code status} to the product creator.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BidUpdateRequest {
    private BigDecimal amount;
    private String notes;
    private BidStatus status;

    @JsonIgnore
    public boolean isEmpty() {
        return amount == null && notes == null && status == null;
    }

    @JsonIgnore
    public boolean changesTerms() {
        return amount != null || notes != null;
    }

    @JsonIgnore
    public boolean changesStatus() {
        return status != null;
    }
}
