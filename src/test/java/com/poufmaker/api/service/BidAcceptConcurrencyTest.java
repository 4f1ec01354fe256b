package com.poufmaker.api.service;

import com.poufmaker.api.AbstractIntegrationTest;
import com.poufmaker.api.dto.BidCreateRequest;
import com.poufmaker.api.dto.BidUpdateRequest;
import com.poufmaker.api.entity.Bid;
import com.poufmaker.api.entity.Product;
import com.poufmaker.api.entity.User;
import com.poufmaker.api.enums.BidStatus;
import com.poufmaker.api.enums.ProductStatus;
import com.poufmaker.api.enums.UserRole;
import com.poufmaker.api.exception.IllegalBidException;
import com.poufmaker.api.repository.BidRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Competing accepts commit in their own transactions. Not {@code @Transactional};
 * rows are removed after each test.
 */
class BidAcceptConcurrencyTest extends AbstractIntegrationTest {

    private static final int BIDDERS = 5;

    @Autowired
    private BidService bidService;

    @Autowired
    private BidRepository bidRepository;

    private final List<UUID> createdUsers = new ArrayList<>();
    private Product product;

    @AfterEach
    void cleanUp() {
        if (product != null) {
            bidRepository.deleteAll(bidRepository.findByProductId(product.getId()));
            productRepository.deleteById(product.getId());
        }
        userRepository.deleteAllById(createdUsers);
    }

    @Test
    void concurrent_accepts_leave_exactly_one_accepted_bid() throws Exception {
        User creator = track(createUser("Clara", UserRole.CLIENT));
        product = createProduct(creator, ProductStatus.AI_GENERATED);

        List<UUID> bidIds = new ArrayList<>();
        for (int i = 0; i < BIDDERS; i++) {
            User upholsterer = track(createUser("Upholsterer" + i, UserRole.UPHOLSTERER));
            bidIds.add(bidService.placeBid(principalOf(upholsterer), BidCreateRequest.builder()
                    .productId(product.getId())
                    .amount(new BigDecimal(100 + i))
                    .build()).getId());
        }

        ExecutorService executor = Executors.newFixedThreadPool(BIDDERS);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        try {
            for (UUID bidId : bidIds) {
                outcomes.add(executor.submit(() -> {
                    start.await();
                    try {
                        bidService.updateBid(principalOf(creator), bidId,
                                BidUpdateRequest.builder().status(BidStatus.ACCEPTED).build());
                        return true;
                    } catch (IllegalBidException e) {
                        return false;
                    }
                }));
            }
            start.countDown();

            int succeeded = 0;
            for (Future<Boolean> outcome : outcomes) {
                if (outcome.get(30, TimeUnit.SECONDS)) {
                    succeeded++;
                }
            }
            assertThat(succeeded).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        List<Bid> bids = bidRepository.findByProductId(product.getId());
        assertThat(bids).filteredOn(b -> b.getStatus() == BidStatus.ACCEPTED).hasSize(1);
        assertThat(bids).filteredOn(b -> b.getStatus() == BidStatus.REJECTED).hasSize(BIDDERS - 1);

        Bid winner = bids.stream().filter(b -> b.getStatus() == BidStatus.ACCEPTED).findFirst().orElseThrow();
        Product updated = productRepository.findById(product.getId()).orElseThrow();
        assertThat(updated.getManufacturerId()).isEqualTo(winner.getUpholstererId());
        assertThat(updated.getStatus()).isEqualTo(ProductStatus.IN_PROGRESS);
    }

    private User track(User user) {
        createdUsers.add(user.getId());
        return user;
    }
}
