package com.poufmaker.api.service;

import com.poufmaker.api.dto.BidDTO;
import com.poufmaker.api.dto.ProductCreateRequest;
import com.poufmaker.api.dto.ProductDTO;
import com.poufmaker.api.dto.ProductUpdateRequest;
import com.poufmaker.api.dto.UserSummaryDTO;
import com.poufmaker.api.entity.Bid;
import com.poufmaker.api.entity.Product;
import com.poufmaker.api.enums.ProductStatus;
import com.poufmaker.api.exception.InvalidRequestException;
import com.poufmaker.api.exception.ResourceNotFoundException;
import com.poufmaker.api.exception.UnauthorizedAccessException;
import com.poufmaker.api.repository.BidRepository;
import com.poufmaker.api.repository.ProductRepository;
import com.poufmaker.api.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductService {

    private final ProductRepository productRepository;
    private final BidRepository bidRepository;
    private final UserDirectoryService userDirectory;

    @Transactional
    public ProductDTO createProduct(AuthenticatedUser principal, ProductCreateRequest request) {
        AuthenticatedUser.require(principal);
        if (isBlank(request.getTitle()) || isBlank(request.getDescription())) {
            throw new InvalidRequestException("Title and description are required");
        }

        Product product = Product.builder()
                .title(request.getTitle().trim())
                .description(request.getDescription().trim())
                .price(request.getPrice())
                .imageUrl(request.getImageUrl())
                .status(request.getStatus() != null ? request.getStatus() : ProductStatus.AI_GENERATED)
                .creatorId(principal.userId())
                .build();
        Product saved = productRepository.saveAndFlush(product);
        log.info("Product {} created by {}", saved.getId(), principal.userId());
        return toDto(saved, List.of());
    }

    @Transactional(readOnly = true)
    public List<ProductDTO> listProducts(ProductStatus status, UUID creatorId) {
        List<Product> products = productRepository.search(status, creatorId);
        if (products.isEmpty()) {
            return List.of();
        }

        List<UUID> productIds = products.stream().map(Product::getId).toList();
        Map<UUID, List<Bid>> bidsByProduct = bidRepository.findByProductIdIn(productIds).stream()
                .collect(Collectors.groupingBy(Bid::getProductId));

        List<UUID> userIds = new ArrayList<>();
        products.forEach(p -> {
            userIds.add(p.getCreatorId());
            userIds.add(p.getManufacturerId());
        });
        bidsByProduct.values().forEach(bids -> bids.forEach(b -> userIds.add(b.getUpholstererId())));
        Map<UUID, UserSummaryDTO> users = userDirectory.findSummaries(userIds);

        return products.stream()
                .map(p -> toDto(p, bidsByProduct.getOrDefault(p.getId(), List.of()), users))
                .toList();
    }

    @Transactional(readOnly = true)
    public ProductDTO getProduct(UUID productId) {
        Product product = findProduct(productId);
        return toDto(product, bidRepository.findByProductId(productId));
    }

    @Transactional
    public ProductDTO updateProduct(AuthenticatedUser principal, UUID productId, ProductUpdateRequest request) {
        AuthenticatedUser.require(principal);
        Product product = findProduct(productId);
        if (!product.getCreatorId().equals(principal.userId())) {
            throw new UnauthorizedAccessException("Not authorized to update this product");
        }
        if (request.isEmpty()) {
            throw new InvalidRequestException("No valid fields to update");
        }
        if (request.getTitle() != null) {
            if (isBlank(request.getTitle())) {
                throw new InvalidRequestException("Title cannot be blank");
            }
            product.setTitle(request.getTitle().trim());
        }
        if (request.getDescription() != null) {
            if (isBlank(request.getDescription())) {
                throw new InvalidRequestException("Description cannot be blank");
            }
            product.setDescription(request.getDescription().trim());
        }
        if (request.getPrice() != null) {
            product.setPrice(request.getPrice());
        }
        if (request.getImageUrl() != null) {
            product.setImageUrl(request.getImageUrl());
        }
        if (request.getStatus() != null) {
            product.setStatus(request.getStatus());
        }

        Product saved = productRepository.saveAndFlush(product);
        return toDto(saved, bidRepository.findByProductId(productId));
    }

    /**
     * Deletes the product together with the bids placed on it.
     */
    @Transactional
    public void deleteProduct(AuthenticatedUser principal, UUID productId) {
        AuthenticatedUser.require(principal);
        Product product = findProduct(productId);
        if (!product.getCreatorId().equals(principal.userId())) {
            throw new UnauthorizedAccessException("Not authorized to delete this product");
        }
        bidRepository.deleteByProductId(productId);
        productRepository.delete(product);
        log.info("Product {} deleted by {}", productId, principal.userId());
    }

    private Product findProduct(UUID productId) {
        return productRepository.findById(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));
    }

    private ProductDTO toDto(Product product, List<Bid> bids) {
        List<UUID> userIds = new ArrayList<>(bids.stream().map(Bid::getUpholstererId).toList());
        userIds.add(product.getCreatorId());
        userIds.add(product.getManufacturerId());
        return toDto(product, bids, userDirectory.findSummaries(userIds));
    }

    private ProductDTO toDto(Product product, List<Bid> bids, Map<UUID, UserSummaryDTO> users) {
        List<BidDTO> bidDtos = bids.stream()
                .map(bid -> BidDTO.fromEntity(bid, users.get(bid.getUpholstererId())))
                .toList();
        UserSummaryDTO manufacturer = product.getManufacturerId() != null ? users.get(product.getManufacturerId()) : null;
        return ProductDTO.fromEntity(product, users.get(product.getCreatorId()), manufacturer, bidDtos);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
