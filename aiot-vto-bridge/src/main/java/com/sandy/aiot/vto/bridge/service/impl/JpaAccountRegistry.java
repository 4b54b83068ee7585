package com.sandy.aiot.vto.bridge.service.impl;

import com.sandy.aiot.vto.bridge.entity.BemfaAccount;
import com.sandy.aiot.vto.bridge.repository.BemfaAccountRepository;
import com.sandy.aiot.vto.bridge.service.AccountRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class JpaAccountRegistry implements AccountRegistry {

    private final BemfaAccountRepository accountRepository;

    @Override
    @Transactional(readOnly = true)
    public List<BemfaAccount> listEnabledAccounts() {
        return accountRepository.findByEnabledTrue();
    }
}
