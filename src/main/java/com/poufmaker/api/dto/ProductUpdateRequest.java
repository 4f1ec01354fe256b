package com.poufmaker.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.poufmaker.api.enums.ProductStatus;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductUpdateRequest {
    private String title;
    private String description;

    @PositiveOrZero(message = "Price cannot be negative")
    private BigDecimal price;

    private String imageUrl;
    private ProductStatus status;

    @JsonIgnore
    public boolean isEmpty() {
        return title == null && description == null && price == null && imageUrl == null && status == null;
    }
}
