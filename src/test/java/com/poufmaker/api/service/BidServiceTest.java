package com.poufmaker.api.service;

import com.poufmaker.api.AbstractIntegrationTest;
import com.poufmaker.api.dto.BidCreateRequest;
import com.poufmaker.api.dto.BidDetailDTO;
import com.poufmaker.api.dto.BidUpdateRequest;
import com.poufmaker.api.entity.Product;
import com.poufmaker.api.entity.User;
import com.poufmaker.api.enums.BidStatus;
import com.poufmaker.api.enums.ProductStatus;
import com.poufmaker.api.enums.UserRole;
import com.poufmaker.api.exception.DuplicateBidException;
import com.poufmaker.api.exception.IllegalBidException;
import com.poufmaker.api.exception.InvalidRequestException;
import com.poufmaker.api.exception.ResourceNotFoundException;
import com.poufmaker.api.exception.UnauthorizedAccessException;
import com.poufmaker.api.repository.BidRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Transactional // rolls back after each test
class BidServiceTest extends AbstractIntegrationTest {

    @Autowired
    private BidService bidService;

    @Autowired
    private BidRepository bidRepository;

    private User client;
    private User alice;
    private User bob;
    private Product product;

    @BeforeEach
    void setUp() {
        client = createUser("Clara", UserRole.CLIENT);
        alice = createUser("Alice", UserRole.UPHOLSTERER);
        bob = createUser("Bob", UserRole.UPHOLSTERER);
        product = createProduct(client, ProductStatus.AI_GENERATED);
    }

    @Test
    void placeBid_creates_pending_bid() {
        BidDetailDTO bid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));

        assertThat(bid.getId()).isNotNull();
        assertThat(bid.getStatus()).isEqualTo(BidStatus.PENDING);
        assertThat(bid.getAmount()).isEqualByComparingTo("120.00");
        assertThat(bid.getUpholsterer().getFullName()).isEqualTo("Alice");
        assertThat(bid.getProduct().getTitle()).isEqualTo("Velvet pouf");
        assertThat(bid.getCreatedAt()).isNotNull();
        assertThat(productRepository.findById(product.getId()).orElseThrow().getStatus())
                .isEqualTo(ProductStatus.AI_GENERATED);
    }

    @Test
    void second_bid_by_same_upholsterer_is_a_conflict() {
        bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));

        assertThatThrownBy(() -> bidService.placeBid(principalOf(alice), bidOn(product, "99.00")))
                .isInstanceOf(DuplicateBidException.class);
        assertThat(bidRepository.findByProductId(product.getId())).hasSize(1);
    }

    @Test
    void only_upholsterers_can_bid() {
        assertThatThrownBy(() -> bidService.placeBid(principalOf(client), bidOn(product, "50.00")))
                .isInstanceOf(UnauthorizedAccessException.class)
                .hasMessage("Only upholsterers can create bids");
        assertThatThrownBy(() -> bidService.placeBid(null, bidOn(product, "50.00")))
                .isInstanceOf(UnauthorizedAccessException.class);
    }

    @Test
    void bids_require_an_open_product_and_a_positive_amount() {
        Product pending = createProduct(client, ProductStatus.PENDING);

        assertThatThrownBy(() -> bidService.placeBid(principalOf(alice), bidOn(pending, "50.00")))
                .isInstanceOf(IllegalBidException.class);
        assertThatThrownBy(() -> bidService.placeBid(principalOf(alice), bidOn(product, "0")))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> bidService.placeBid(principalOf(alice),
                BidCreateRequest.builder().productId(product.getId()).build()))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> bidService.placeBid(principalOf(alice),
                BidCreateRequest.builder().productId(UUID.randomUUID()).amount(BigDecimal.TEN).build()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void accepting_a_bid_rejects_all_others_and_assigns_the_manufacturer() {
        BidDetailDTO aliceBid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));
        BidDetailDTO bobBid = bidService.placeBid(principalOf(bob), bidOn(product, "110.00"));

        BidDetailDTO accepted = bidService.updateBid(principalOf(client), aliceBid.getId(),
                BidUpdateRequest.builder().status(BidStatus.ACCEPTED).build());

        assertThat(accepted.getStatus()).isEqualTo(BidStatus.ACCEPTED);
        assertThat(bidRepository.findById(bobBid.getId()).orElseThrow().getStatus()).isEqualTo(BidStatus.REJECTED);

        Product updated = productRepository.findById(product.getId()).orElseThrow();
        assertThat(updated.getManufacturerId()).isEqualTo(alice.getId());
        assertThat(updated.getStatus()).isEqualTo(ProductStatus.IN_PROGRESS);
        assertThat(bidRepository.findByProductId(product.getId()))
                .filteredOn(b -> b.getStatus() == BidStatus.ACCEPTED)
                .hasSize(1);
    }

    @Test
    void decided_bids_cannot_be_decided_again() {
        BidDetailDTO aliceBid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));
        BidDetailDTO bobBid = bidService.placeBid(principalOf(bob), bidOn(product, "110.00"));
        bidService.updateBid(principalOf(client), aliceBid.getId(),
                BidUpdateRequest.builder().status(BidStatus.ACCEPTED).build());

        assertThatThrownBy(() -> bidService.updateBid(principalOf(client), bobBid.getId(),
                BidUpdateRequest.builder().status(BidStatus.ACCEPTED).build()))
                .isInstanceOf(IllegalBidException.class);
        assertThatThrownBy(() -> bidService.updateBid(principalOf(client), aliceBid.getId(),
                BidUpdateRequest.builder().status(BidStatus.REJECTED).build()))
                .isInstanceOf(IllegalBidException.class);
    }

    @Test
    void bidder_can_edit_terms_of_a_decided_bid() {
        BidDetailDTO aliceBid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));
        BidDetailDTO bobBid = bidService.placeBid(principalOf(bob), bidOn(product, "110.00"));
        bidService.updateBid(principalOf(client), aliceBid.getId(),
                BidUpdateRequest.builder().status(BidStatus.ACCEPTED).build());

        BidDetailDTO accepted = bidService.updateBid(principalOf(alice), aliceBid.getId(),
                BidUpdateRequest.builder().notes("delivery next week").build());
        BidDetailDTO rejected = bidService.updateBid(principalOf(bob), bobBid.getId(),
                BidUpdateRequest.builder().amount(new BigDecimal("90.00")).build());

        assertThat(accepted.getNotes()).isEqualTo("delivery next week");
        assertThat(accepted.getStatus()).isEqualTo(BidStatus.ACCEPTED);
        assertThat(rejected.getAmount()).isEqualByComparingTo("90.00");
        assertThat(rejected.getStatus()).isEqualTo(BidStatus.REJECTED);
    }

    @Test
    void update_fields_are_scoped_to_bidder_and_creator() {
        BidDetailDTO bid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));

        assertThatThrownBy(() -> bidService.updateBid(principalOf(alice), bid.getId(),
                BidUpdateRequest.builder().status(BidStatus.ACCEPTED).build()))
                .isInstanceOf(UnauthorizedAccessException.class);
        assertThatThrownBy(() -> bidService.updateBid(principalOf(client), bid.getId(),
                BidUpdateRequest.builder().amount(new BigDecimal("1.00")).build()))
                .isInstanceOf(UnauthorizedAccessException.class);
        assertThatThrownBy(() -> bidService.updateBid(principalOf(bob), bid.getId(),
                BidUpdateRequest.builder().notes("mine now").build()))
                .isInstanceOf(UnauthorizedAccessException.class)
                .hasMessage("Not authorized to update this bid");

        assertThat(bidRepository.findById(bid.getId()).orElseThrow().getStatus()).isEqualTo(BidStatus.PENDING);
    }

    @Test
    void bidder_can_revise_a_pending_bid() {
        BidDetailDTO bid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));

        BidDetailDTO revised = bidService.updateBid(principalOf(alice), bid.getId(),
                BidUpdateRequest.builder().amount(new BigDecimal("100.00")).notes("Includes fabric").build());

        assertThat(revised.getAmount()).isEqualByComparingTo("100.00");
        assertThat(revised.getNotes()).isEqualTo("Includes fabric");
        assertThat(revised.getStatus()).isEqualTo(BidStatus.PENDING);
    }

    @Test
    void update_rejects_empty_changes_and_pending_target() {
        BidDetailDTO bid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));

        assertThatThrownBy(() -> bidService.updateBid(principalOf(alice), bid.getId(), new BidUpdateRequest()))
                .isInstanceOf(InvalidRequestException.class)
                .hasMessage("No valid fields to update");
        assertThatThrownBy(() -> bidService.updateBid(principalOf(client), bid.getId(),
                BidUpdateRequest.builder().status(BidStatus.PENDING).build()))
                .isInstanceOf(InvalidRequestException.class);
        assertThatThrownBy(() -> bidService.updateBid(principalOf(client), UUID.randomUUID(),
                BidUpdateRequest.builder().status(BidStatus.REJECTED).build()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void deleting_the_accepted_bid_clears_the_manufacturer() {
        BidDetailDTO bid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));
        bidService.updateBid(principalOf(client), bid.getId(),
                BidUpdateRequest.builder().status(BidStatus.ACCEPTED).build());

        assertThatThrownBy(() -> bidService.deleteBid(principalOf(bob), bid.getId()))
                .isInstanceOf(UnauthorizedAccessException.class);

        bidService.deleteBid(principalOf(alice), bid.getId());

        assertThat(bidRepository.findById(bid.getId())).isEmpty();
        Product updated = productRepository.findById(product.getId()).orElseThrow();
        assertThat(updated.getManufacturerId()).isNull();
        assertThat(updated.getStatus()).isEqualTo(ProductStatus.IN_PROGRESS);
    }

    @Test
    void product_creator_can_discard_a_bid() {
        BidDetailDTO bid = bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));
        bidService.updateBid(principalOf(client), bid.getId(),
                BidUpdateRequest.builder().status(BidStatus.REJECTED).build());

        bidService.deleteBid(principalOf(client), bid.getId());

        assertThat(bidRepository.findById(bid.getId())).isEmpty();
        assertThat(productRepository.findById(product.getId()).orElseThrow().getStatus())
                .isEqualTo(ProductStatus.AI_GENERATED);
        assertThatThrownBy(() -> bidService.deleteBid(principalOf(client), bid.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void listBids_filters_by_product_upholsterer_and_status() {
        Product other = createProduct(client, ProductStatus.AI_GENERATED);
        bidService.placeBid(principalOf(alice), bidOn(product, "120.00"));
        bidService.placeBid(principalOf(bob), bidOn(product, "110.00"));
        bidService.placeBid(principalOf(alice), bidOn(other, "80.00"));

        assertThat(bidService.listBids(product.getId(), null, null)).hasSize(2);
        List<BidDetailDTO> aliceBids = bidService.listBids(null, alice.getId(), BidStatus.PENDING);
        assertThat(aliceBids).hasSize(2)
                .allSatisfy(b -> assertThat(b.getUpholsterer().getFullName()).isEqualTo("Alice"));
        assertThat(bidService.listBids(product.getId(), null, BidStatus.ACCEPTED)).isEmpty();
    }

    private static BidCreateRequest bidOn(Product product, String amount) {
        return BidCreateRequest.builder()
                .productId(product.getId())
                .amount(new BigDecimal(amount))
                .build();
    }
}
