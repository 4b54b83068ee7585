package com.sandy.aiot.vto.bridge.repository;

import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BemfaAccountRepository extends JpaRepository<BemfaAccount, Long> {
    List<BemfaAccount> findByEnabledTrue();
}
