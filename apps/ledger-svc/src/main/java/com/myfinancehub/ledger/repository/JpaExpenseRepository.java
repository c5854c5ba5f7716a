package com.myfinancehub.ledger.repository;

import com.myfinancehub.ledger.entity.ExpenseEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaExpenseRepository extends JpaRepository<ExpenseEntity, Long> {

    @Query("SELECT e FROM ExpenseEntity e WHERE e.username = :username ORDER BY e.spentOn ASC, e.id ASC")
    List<ExpenseEntity> findByOwner(@Param("username") String username);

    // ISO dates compare correctly as text
    @Query("""
            SELECT e FROM ExpenseEntity e
            WHERE e.username = :username AND e.spentOn >= :from AND e.spentOn <= :to
            ORDER BY e.spentOn ASC, e.id ASC
            """)
    List<ExpenseEntity> findByOwnerAndRange(@Param("username") String username,
                                            @Param("from") String from,
                                            @Param("to") String to);

    @Query("SELECT e FROM ExpenseEntity e WHERE e.id = :id AND e.username = :username")
    Optional<ExpenseEntity> findOwned(@Param("id") long id, @Param("username") String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM ExpenseEntity e WHERE e.id = :id AND e.username = :username")
    int deleteOwned(@Param("id") long id, @Param("username") String username);
}
