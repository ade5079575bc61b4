package com.cred.freestyle.fulfillment.repository;

import com.cred.freestyle.fulfillment.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserRepository extends JpaRepository<User, String> {
}
