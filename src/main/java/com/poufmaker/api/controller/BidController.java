package com.poufmaker.api.controller;

import com.poufmaker.api.dto.BidCreateRequest;
import com.poufmaker.api.dto.BidDetailDTO;
import com.poufmaker.api.dto.BidUpdateRequest;
import com.poufmaker.api.dto.InfoResponse;
import com.poufmaker.api.enums.BidStatus;
import com.poufmaker.api.security.AuthenticatedUser;
import com.poufmaker.api.service.BidService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/bids")
@RequiredArgsConstructor
public class BidController {
    private final BidService bidService;

    @GetMapping
    public ResponseEntity<List<BidDetailDTO>> listBids(@RequestParam(required = false) UUID productId,
                                                       @RequestParam(required = false) UUID upholstererId,
                                                       @RequestParam(required = false) BidStatus status) {
        return ResponseEntity.ok(bidService.listBids(productId, upholstererId, status));
    }

    @PostMapping
    public ResponseEntity<BidDetailDTO> placeBid(@AuthenticationPrincipal AuthenticatedUser principal,
                                                 @RequestBody BidCreateRequest bidRequest) {
        return new ResponseEntity<>(bidService.placeBid(principal, bidRequest), HttpStatus.CREATED);
    }

    @GetMapping("/{bidId}")
    public ResponseEntity<BidDetailDTO> getBid(@PathVariable UUID bidId) {
        return ResponseEntity.ok(bidService.getBid(bidId));
    }

    // amount/notes for the bidder, status for the product creator
    @PutMapping("/{bidId}")
    public ResponseEntity<BidDetailDTO> updateBid(@AuthenticationPrincipal AuthenticatedUser principal,
                                                  @PathVariable UUID bidId,
                                                  @RequestBody BidUpdateRequest request) {
        return ResponseEntity.ok(bidService.updateBid(principal, bidId, request));
    }

    @DeleteMapping("/{bidId}")
    public ResponseEntity<InfoResponse> deleteBid(@AuthenticationPrincipal AuthenticatedUser principal,
                                                  @PathVariable UUID bidId) {
        bidService.deleteBid(principal, bidId);
        return ResponseEntity.ok(new InfoResponse("Bid deleted successfully"));
    }
}
