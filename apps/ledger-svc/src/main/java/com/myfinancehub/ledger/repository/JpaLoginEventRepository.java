package com.myfinancehub.ledger.repository;

import com.myfinancehub.ledger.entity.LoginEventEntity;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaLoginEventRepository extends JpaRepository<LoginEventEntity, Long> {

    List<LoginEventEntity> findByUsernameOrderByOccurredAtDescIdDesc(String username, Pageable pageable);
}
