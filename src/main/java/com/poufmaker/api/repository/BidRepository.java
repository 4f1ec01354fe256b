package com.poufmaker.api.repository;

import com.poufmaker.api.entity.Bid;
import com.poufmaker.api.enums.BidStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BidRepository extends JpaRepository<Bid, UUID> {
    List<Bid> findByProductId(UUID productId);

    List<Bid> findByProductIdIn(List<UUID> productIds);

    boolean existsByProductIdAndUpholstererId(UUID productId, UUID upholstererId);

    void deleteByProductId(UUID productId);

    // Scalar lookup, so the bid itself is only loaded once its product row is locked.
    @Query("select b.productId from Bid b where b.id = :id")
    Optional<UUID> findProductIdById(@Param("id") UUID id);

    @Query("select b from Bid b " +
           "where (:productId is null or b.productId = :productId) " +
           "and (:upholstererId is null or b.upholstererId = :upholstererId) " +
           "and (:status is null or b.status = :status) " +
           "order by b.createdAt desc")
    List<Bid> search(@Param("productId") UUID productId,
                     @Param("upholstererId") UUID upholstererId,
                     @Param("status") BidStatus status);
}
