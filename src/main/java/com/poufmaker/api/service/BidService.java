package com.poufmaker.api.service;

import com.poufmaker.api.dto.BidCreateRequest;
import com.poufmaker.api.dto.BidDetailDTO;
import com.poufmaker.api.dto.BidUpdateRequest;
import com.poufmaker.api.dto.ProductSummaryDTO;
import com.poufmaker.api.dto.UserSummaryDTO;
import com.poufmaker.api.entity.Bid;
import com.poufmaker.api.entity.Product;
import com.poufmaker.api.enums.BidStatus;
import com.poufmaker.api.enums.ProductStatus;
import com.poufmaker.api.exception.DuplicateBidException;
import com.poufmaker.api.exception.IllegalBidException;
import com.poufmaker.api.exception.InvalidRequestException;
import com.poufmaker.api.exception.ResourceNotFoundException;
import com.poufmaker.api.exception.UnauthorizedAccessException;
import com.poufmaker.api.repository.BidRepository;
import com.poufmaker.api.repository.ProductRepository;
import com.poufmaker.api.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The bid ledger: placing bids, the field-scoped update with its accept/reject
 * transition, and deletion.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BidService {

    private final BidRepository bidRepository;
    private final ProductRepository productRepository;
    private final UserDirectoryService userDirectory;

    @Transactional
    public BidDetailDTO placeBid(AuthenticatedUser principal, BidCreateRequest request) {
        AuthenticatedUser.require(principal);
        if (!principal.role().canPlaceBids()) {
            throw new UnauthorizedAccessException("Only upholsterers can create bids");
        }
        if (request.getProductId() == null || request.getAmount() == null) {
            throw new InvalidRequestException("Product ID and amount are required");
        }
        validateAmount(request.getAmount());

        Product product = productRepository.findById(request.getProductId())
                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));
        if (product.getStatus() != ProductStatus.AI_GENERATED) {
            throw new IllegalBidException("Product is not available for bidding");
        }
        if (bidRepository.existsByProductIdAndUpholstererId(product.getId(), principal.userId())) {
            throw new DuplicateBidException("You have already bid on this product");
        }

        Bid newBid = Bid.builder()
                .productId(product.getId())
                .upholstererId(principal.userId())
                .amount(request.getAmount())
                .notes(request.getNotes())
                .status(BidStatus.PENDING)
                .build();

        Bid savedBid;
        try {
            savedBid = bidRepository.saveAndFlush(newBid);
        } catch (DataIntegrityViolationException e) {
            // the unique (product, upholsterer) constraint caught a concurrent duplicate
            throw new DuplicateBidException("You have already bid on this product");
        }
        log.info("Bid {} placed on product {} by {}", savedBid.getId(), product.getId(), principal.userId());
        return toDetail(savedBid, product);
    }

    @Transactional(readOnly = true)
    public BidDetailDTO getBid(UUID bidId) {
        Bid bid = findBid(bidId);
        Product product = productRepository.findById(bid.getProductId())
                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));
        return toDetail(bid, product);
    }

    @Transactional(readOnly = true)
    public List<BidDetailDTO> listBids(UUID productId, UUID upholstererId, BidStatus status) {
        List<Bid> bids = bidRepository.search(productId, upholstererId, status);
        if (bids.isEmpty()) {
            return List.of();
        }

        List<UUID> productIds = bids.stream().map(Bid::getProductId).distinct().toList();
        Map<UUID, Product> products = productRepository.findAllById(productIds).stream()
                .collect(Collectors.toMap(Product::getId, Function.identity()));

        List<UUID> userIds = new ArrayList<>(bids.stream().map(Bid::getUpholstererId).toList());
        products.values().forEach(p -> userIds.add(p.getCreatorId()));
        Map<UUID, UserSummaryDTO> users = userDirectory.findSummaries(userIds);

        return bids.stream()
                .map(bid -> {
                    Product product = products.get(bid.getProductId());
                    ProductSummaryDTO summary = product != null
                            ? ProductSummaryDTO.fromEntity(product, users.get(product.getCreatorId()))
                            : null;
                    return BidDetailDTO.fromEntity(bid, summary, users.get(bid.getUpholstererId()));
                })
                .toList();
    }

    /**
     * Applies a partial update. The bidding upholsterer may change amount and notes
     * at any time, the product creator may decide a pending bid; accepting a bid
     * rejects every other bid on the same product in the same transaction.
     * <p>
     * The parent product row is locked before the bid is read, so status changes on
     * bids of one product are serialized and at most one of them can ever be accepted.
     */
    @Transactional
    public BidDetailDTO updateBid(AuthenticatedUser principal, UUID bidId, BidUpdateRequest request) {
        AuthenticatedUser.require(principal);
        BidContext ctx = loadForUpdate(bidId);
        Bid bid = ctx.bid();

        boolean isBidder = bid.getUpholstererId().equals(principal.userId());
        boolean isCreator = ctx.product().getCreatorId().equals(principal.userId());
        if (!isBidder && !isCreator) {
            throw new UnauthorizedAccessException("Not authorized to update this bid");
        }
        if (request.isEmpty()) {
            throw new InvalidRequestException("No valid fields to update");
        }
        if (request.changesTerms() && !isBidder) {
            throw new UnauthorizedAccessException("Only the bidding upholsterer can change the amount or notes");
        }
        if (request.changesStatus() && !isCreator) {
            throw new UnauthorizedAccessException("Only the product creator can change the bid status");
        }
        if (request.getStatus() == BidStatus.PENDING) {
            throw new InvalidRequestException("A bid can only be accepted or rejected");
        }
        if (request.getAmount() != null) {
            validateAmount(request.getAmount());
        }
        if (request.changesStatus() && bid.getStatus() != BidStatus.PENDING) {
            throw new IllegalBidException("Bid has already been " + bid.getStatus().getValue());
        }

        if (request.getAmount() != null) {
            bid.setAmount(request.getAmount());
        }
        if (request.getNotes() != null) {
            bid.setNotes(request.getNotes());
        }
        if (request.getStatus() == BidStatus.ACCEPTED) {
            acceptBid(bid, ctx.product());
        } else if (request.getStatus() == BidStatus.REJECTED) {
            bid.setStatus(BidStatus.REJECTED);
            log.info("Bid {} rejected", bid.getId());
        }

        Bid savedBid = bidRepository.saveAndFlush(bid);
        return toDetail(savedBid, ctx.product());
    }

    /**
     * Bids can be withdrawn by their upholsterer or discarded by the product creator,
     * whatever their status.
     */
    @Transactional
    public void deleteBid(AuthenticatedUser principal, UUID bidId) {
        AuthenticatedUser.require(principal);
        Bid bid = findBid(bidId);
        Product product = productRepository.findById(bid.getProductId()).orElse(null);

        boolean isBidder = bid.getUpholstererId().equals(principal.userId());
        boolean isCreator = product != null && product.getCreatorId().equals(principal.userId());
        if (!isBidder && !isCreator) {
            throw new UnauthorizedAccessException("Not authorized to delete this bid");
        }

        if (product != null && bid.getStatus() == BidStatus.ACCEPTED
                && bid.getUpholstererId().equals(product.getManufacturerId())) {
            product.setManufacturerId(null);
            log.info("Accepted bid {} deleted; product {} no longer has a manufacturer", bid.getId(), product.getId());
        }
        bidRepository.delete(bid);
    }

    // The winning bid is accepted, every sibling is rejected whatever its prior state.
    private void acceptBid(Bid winningBid, Product product) {
        List<Bid> allBidsForProduct = bidRepository.findByProductId(product.getId());
        for (Bid bid : allBidsForProduct) {
            if (bid.getId().equals(winningBid.getId())) {
                bid.setStatus(BidStatus.ACCEPTED);
            } else {
                bid.setStatus(BidStatus.REJECTED);
            }
        }
        winningBid.setStatus(BidStatus.ACCEPTED);
        bidRepository.saveAll(allBidsForProduct);

        product.setManufacturerId(winningBid.getUpholstererId());
        product.setStatus(ProductStatus.IN_PROGRESS);
        log.info("Bid {} accepted for product {}; {} competing bid(s) rejected",
                winningBid.getId(), product.getId(), allBidsForProduct.size() - 1);
    }

    private BidContext loadForUpdate(UUID bidId) {
        UUID productId = bidRepository.findProductIdById(bidId)
                .orElseThrow(() -> new ResourceNotFoundException("Bid not found"));
        Product product = productRepository.findByIdForUpdate(productId)
                .orElseThrow(() -> new ResourceNotFoundException("Product not found"));
        Bid bid = findBid(bidId);
        return new BidContext(bid, product);
    }

    private Bid findBid(UUID bidId) {
        return bidRepository.findById(bidId)
                .orElseThrow(() -> new ResourceNotFoundException("Bid not found"));
    }

    private BidDetailDTO toDetail(Bid bid, Product product) {
        Map<UUID, UserSummaryDTO> users = userDirectory.findSummaries(
                List.of(bid.getUpholstererId(), product.getCreatorId()));
        ProductSummaryDTO productSummary = ProductSummaryDTO.fromEntity(product, users.get(product.getCreatorId()));
        return BidDetailDTO.fromEntity(bid, productSummary, users.get(bid.getUpholstererId()));
    }

    private static void validateAmount(BigDecimal amount) {
        if (Objects.requireNonNull(amount).signum() <= 0) {
            throw new InvalidRequestException("Amount must be greater than zero");
        }
    }

    private record BidContext(Bid bid, Product product) {}
}
