package com.poufmaker.api.dto;

import com.poufmaker.api.entity.Product;
import com.poufmaker.api.enums.ProductStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductSummaryDTO {
    private UUID id;
    private String title;
    private String description;
    private ProductStatus status;
    private UserSummaryDTO creator;

    public static ProductSummaryDTO fromEntity(Product product, UserSummaryDTO creator) {
        return ProductSummaryDTO.builder()
                .id(product.getId())
                .title(product.getTitle())
                .description(product.getDescription())
                .status(product.getStatus())
                .creator(creator)
                .build();
    }
}
