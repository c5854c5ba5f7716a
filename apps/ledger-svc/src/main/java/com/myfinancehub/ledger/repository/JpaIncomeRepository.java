package com.myfinancehub.ledger.repository;

import com.myfinancehub.ledger.entity.IncomeEntity;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaIncomeRepository extends JpaRepository<IncomeEntity, Long> {

    @Query("SELECT i FROM IncomeEntity i WHERE i.username = :username ORDER BY i.receivedOn ASC, i.id ASC")
    List<IncomeEntity> findByOwner(@Param("username") String username);

    @Query("""
            SELECT i FROM IncomeEntity i
            WHERE i.username = :username AND i.receivedOn >= :from AND i.receivedOn <= :to
            ORDER BY i.receivedOn ASC, i.id ASC
            """)
    List<IncomeEntity> findByOwnerAndRange(@Param("username") String username,
                                           @Param("from") String from,
                                           @Param("to") String to);

    @Query("SELECT i FROM IncomeEntity i WHERE i.id = :id AND i.username = :username")
    Optional<IncomeEntity> findOwned(@Param("id") long id, @Param("username") String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("DELETE FROM IncomeEntity i WHERE i.id = :id AND i.username = :username")
    int deleteOwned(@Param("id") long id, @Param("username") String username);
}
