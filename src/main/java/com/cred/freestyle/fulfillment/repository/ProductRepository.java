package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository interface for Product entity.
 *
 * @author Fulfillment Team
 */
@Repository
public interface ProductRepository extends JpaRepository<Product, String> {
}
