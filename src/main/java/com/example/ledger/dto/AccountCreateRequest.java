package com.example.ledger.dto;

import com.example.ledger.domain.AccountSubType;
import com.example.ledger.domain.AccountType;

/**
 * Input for creating an account. {@code parentId} and {@code currency} are optional; a missing
 * currency defaults to the company's functional currency. Header accounts are never postable.
 */
public record AccountCreateRequest(
    String code,
    String name,
    String description,
    AccountType type,
    AccountSubType subType,
    Long parentId,
    boolean header,
    String currency) {

  public static AccountCreateRequest detail(
      String code, String name, AccountType type, Long parentId) {
    return new AccountCreateRequest(code, name, null, type, null, parentId, false, null);
  }

  public static AccountCreateRequest header(
      String code, String name, AccountType type, Long parentId) {
    return new AccountCreateRequest(code, name, null, type, null, parentId, true, null);
  }
}
