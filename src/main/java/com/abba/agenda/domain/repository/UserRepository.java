package com.abba.agenda.domain.repository;

import com.abba.agenda.domain.model.User;
import com.abba.agenda.domain.model.UserRole;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface UserRepository extends MongoRepository<User, String> {

    Optional<User> findByIdAndRoleAndActiveTrue(String id, UserRole role);
}
