package com.myfinancehub.ledger.repository;

import com.myfinancehub.ledger.entity.UserEntity;
import jakarta.persistence.LockModeType;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface JpaUserRepository extends JpaRepository<UserEntity, String> {

    /**
     * Row lock on the owner's account, held until the surrounding transaction ends. Ledger writes that
     * span several statements take it first so writes for one user serialize.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT u FROM UserEntity u WHERE u.username = :username")
    Optional<UserEntity> lockByUsername(@Param("username") String username);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserEntity u SET u.passwordHash = :passwordHash WHERE u.username = :username")
    int updatePasswordHash(@Param("username") String username, @Param("passwordHash") String passwordHash);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE UserEntity u SET u.email = :email WHERE u.username = :username")
    int updateEmail(@Param("username") String username, @Param("email") String email);
}
