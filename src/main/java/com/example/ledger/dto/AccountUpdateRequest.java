package com.example.ledger.dto;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.AccountSubType;

/**
 * Partial update of an account. Null fields are left unchanged. The parent is only touched when
 * {@code changeParent} is set, in which case a null {@code parentId} moves the account to the
 * root.
 */
public record AccountUpdateRequest(
    String name,
    String description,
    AccountSubType subType,
    Account.Status status,
    boolean changeParent,
    Long parentId) {

  public static AccountUpdateRequest rename(String name) {
    return new AccountUpdateRequest(name, null, null, null, false, null);
  }

  public static AccountUpdateRequest status(Account.Status status) {
    return new AccountUpdateRequest(null, null, null, status, false, null);
  }

  public static AccountUpdateRequest moveTo(Long parentId) {
    return new AccountUpdateRequest(null, null, null, null, true, parentId);
  }
}
