package com.sandy.aiot.vto.bridge.service;

import com.sandy.aiot.vto.bridge.entity.BemfaAccount;

import java.util.List;

public interface AccountRegistry {
    List<BemfaAccount> listEnabledAccounts();
}
