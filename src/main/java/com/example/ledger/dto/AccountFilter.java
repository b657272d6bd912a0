package com.example.ledger.dto;

import java.util.Set;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.AccountType;

/** Optional criteria for listing accounts. Null or empty criteria match everything. */
public record AccountFilter(
    Set<AccountType> types,
    Set<Account.Status> statuses,
    Boolean header,
    Boolean postable,
    Long parentId,
    String currency,
    String search) {

  public static AccountFilter all() {
    return new AccountFilter(null, null, null, null, null, null, null);
  }

  public static AccountFilter ofTypes(Set<AccountType> types) {
    return new AccountFilter(types, null, null, null, null, null, null);
  }

  public boolean matches(Account account) {
    if (types != null && !types.isEmpty() && !types.contains(account.getType())) {
      return false;
    }
    if (statuses != null && !statuses.isEmpty() && !statuses.contains(account.getStatus())) {
      return false;
    }
    if (header != null && header != account.isHeader()) {
      return false;
    }
    if (postable != null && postable != account.isPostable()) {
      return false;
    }
    if (parentId != null && !parentId.equals(account.getParentId())) {
      return false;
    }
    if (currency != null && !currency.equalsIgnoreCase(account.getCurrency())) {
      return false;
    }
    if (search != null && !search.isBlank()) {
      String needle = search.toLowerCase();
      return account.getCode().toLowerCase().contains(needle)
          || account.getName().toLowerCase().contains(needle)
          || (account.getDescription() != null
              && account.getDescription().toLowerCase().contains(needle));
    }
    return true;
  }
}
