package com.library.bookshelf.repository;

import com.library.bookshelf.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByExternalSubjectId(String externalSubjectId);
}
