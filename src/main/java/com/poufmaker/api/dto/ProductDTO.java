package com.poufmaker.api.dto;

import com.poufmaker.api.entity.Product;
import com.poufmaker.api.enums.ProductStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductDTO {
    private UUID id;
    private String title;
    private String description;
    private BigDecimal price;
    private String imageUrl;
    private ProductStatus status;
    private UUID creatorId;
    private UUID manufacturerId;
    private Instant createdAt;
    private Instant updatedAt;
    private UserSummaryDTO creator;
    private UserSummaryDTO manufacturer;
    private List<BidDTO> bids;

    public static ProductDTO fromEntity(Product product, UserSummaryDTO creator, UserSummaryDTO manufacturer,
                                        List<BidDTO> bids) {
        return ProductDTO.builder()
                .id(product.getId())
                .title(product.getTitle())
                .description(product.getDescription())
                .price(product.getPrice())
                .imageUrl(product.getImageUrl())
                .status(product.getStatus())
                .creatorId(product.getCreatorId())
                .manufacturerId(product.getManufacturerId())
                .createdAt(product.getCreatedAt())
                .updatedAt(product.getUpdatedAt())
                .creator(creator)
                .manufacturer(manufacturer)
                .bids(bids)
                .build();
    }
}
