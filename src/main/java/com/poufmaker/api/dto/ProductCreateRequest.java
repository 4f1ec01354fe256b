package com.poufmaker.api.dto;

import com.poufmaker.api.enums.ProductStatus;
import jakarta.validation.constraints.NotBlank;
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
public class ProductCreateRequest {
    @NotBlank(message = "Title and description are required")
    private String title;

    @NotBlank(message = "Title and description are required")
    private String description;

    @PositiveOrZero(message = "Price cannot be negative")
    private BigDecimal price;

    private String imageUrl;

    // defaults to ai-generated
    private ProductStatus status;
}
