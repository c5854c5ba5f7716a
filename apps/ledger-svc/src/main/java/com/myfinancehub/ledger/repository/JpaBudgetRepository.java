package com.myfinancehub.ledger.repository;

import com.myfinancehub.ledger.entity.BudgetEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaBudgetRepository extends JpaRepository<BudgetEntity, Long> {

    @Query("""
            SELECT b FROM BudgetEntity b
            WHERE b.username = :username AND b.month = :month AND b.year = :year
            ORDER BY b.category ASC
            """)
    List<BudgetEntity> findByOwnerAndPeriod(@Param("username") String username,
                                            @Param("month") int month,
                                            @Param("year") int year);

    @Query("""
            SELECT COUNT(b) FROM BudgetEntity b
            WHERE b.username = :username AND b.category = :category AND b.month = :month AND b.year = :year
            """)
    long countByTuple(@Param("username") String username,
                      @Param("category") String category,
                      @Param("month") int month,
                      @Param("year") int year);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            DELETE FROM BudgetEntity b
            WHERE b.username = :username AND b.category = :category AND b.month = :month AND b.year = :year
            """)
    int deleteByTuple(@Param("username") String username,
                      @Param("category") String category,
                      @Param("month") int month,
                      @Param("year") int year);
}
