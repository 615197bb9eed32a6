package com.txengine.accounts;

import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory registry of client accounts.
 *
 * Accounts are created on first reference and never removed. The backing
 * map only guards creation and lookup; balance updates are isolated per
 * account by the account's own lock.
 *
 * One registry backs one processing run.
 */
@Slf4j
public class AccountRegistry {

    private final Map<Integer, Account> accounts = new ConcurrentHashMap<>();

    /**
     * Return the account for the client, creating an empty unlocked one if the
     * client has not been seen yet. Concurrent calls for the same unseen client
     * create exactly one account.
     */
    public Account getOrCreate(int clientId) {
        Account account = accounts.get(clientId);
        if (account != null) {
            return account;
        }
        return accounts.computeIfAbsent(clientId, id -> {
            log.debug("Created account for client {}", id);
            return new Account(id);
        });
    }

    public Optional<Account> find(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    public int size() {
        return accounts.size();
    }

    /**
     * Copy every account's state, ordered by client id.
     *
     * Each account is read under its own lock. Intended to be called once all
     * processing has finished; while transitions are still running the result
     * mixes states from different moments.
     */
    public List<AccountSnapshot> snapshotAll() {
        return accounts.values().stream()
            .map(Account::snapshot)
            .sorted(Comparator.comparingInt(AccountSnapshot::getClientId))
            .collect(Collectors.toList());
    }
}
