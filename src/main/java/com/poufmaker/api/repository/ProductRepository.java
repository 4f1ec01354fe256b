package com.poufmaker.api.repository;

import com.poufmaker.api.entity.Product;
import com.poufmaker.api.enums.ProductStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProductRepository extends JpaRepository<Product, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select p from Product p where p.id = :id")
    Optional<Product> findByIdForUpdate(@Param("id") UUID id);

    @Query("select p from Product p " +
           "where (:status is null or p.status = :status) " +
           "and (:creatorId is null or p.creatorId = :creatorId) " +
           "order by p.createdAt desc")
    List<Product> search(@Param("status") ProductStatus status, @Param("creatorId") UUID creatorId);
}
