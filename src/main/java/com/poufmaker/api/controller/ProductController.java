package com.poufmaker.api.controller;

import com.poufmaker.api.dto.InfoResponse;
import com.poufmaker.api.dto.ProductCreateRequest;
import com.poufmaker.api.dto.ProductDTO;
import com.poufmaker.api.dto.ProductUpdateRequest;
import com.poufmaker.api.enums.ProductStatus;
import com.poufmaker.api.security.AuthenticatedUser;
import com.poufmaker.api.service.ProductService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/products")
@RequiredArgsConstructor
public class ProductController {
    private final ProductService productService;

    @GetMapping
    public ResponseEntity<List<ProductDTO>> listProducts(@RequestParam(required = false) ProductStatus status,
                                                         @RequestParam(required = false) UUID creatorId) {
        return ResponseEntity.ok(productService.listProducts(status, creatorId));
    }

    @PostMapping
    public ResponseEntity<ProductDTO> createProduct(@AuthenticationPrincipal AuthenticatedUser principal,
                                                    @Valid @RequestBody ProductCreateRequest request) {
        return new ResponseEntity<>(productService.createProduct(principal, request), HttpStatus.CREATED);
    }

    @GetMapping("/{productId}")
    public ResponseEntity<ProductDTO> getProduct(@PathVariable UUID productId) {
        return ResponseEntity.ok(productService.getProduct(productId));
    }

    @PutMapping("/{productId}")
    public ResponseEntity<ProductDTO> updateProduct(@AuthenticationPrincipal AuthenticatedUser principal,
                                                    @PathVariable UUID productId,
                                                    @Valid @RequestBody ProductUpdateRequest request) {
        return ResponseEntity.ok(productService.updateProduct(principal, productId, request));
    }

    @DeleteMapping("/{productId}")
    public ResponseEntity<InfoResponse> deleteProduct(@AuthenticationPrincipal AuthenticatedUser principal,
                                                      @PathVariable UUID productId) {
        productService.deleteProduct(principal, productId);
        return ResponseEntity.ok(new InfoResponse("Product deleted successfully"));
    }
}
