package com.example.ledger.dto;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.AccountLevel;
import com.example.ledger.domain.AccountSubType;
import com.example.ledger.domain.AccountType;

/** A node of the chart-of-accounts tree; children are ordered by code. */
public record AccountTreeNode(
    Long id,
    String code,
    String name,
    AccountType type,
    AccountSubType subType,
    AccountLevel level,
    BigDecimal balance,
    String currency,
    boolean header,
    boolean postable,
    Account.Status status,
    List<AccountTreeNode> children) {

  public static AccountTreeNode of(Account account) {
    return new AccountTreeNode(
        account.getId(),
        account.getCode(),
        account.getName(),
        account.getType(),
        account.getSubType(),
        account.getLevel(),
        account.getBalance().getBalance(),
        account.getCurrency(),
        account.isHeader(),
        account.isPostable(),
        account.getStatus(),
        new ArrayList<>());
  }

  /** Sorts these nodes and, recursively, their children by code. */
  public static void sortByCode(List<AccountTreeNode> nodes) {
    nodes.sort(Comparator.comparing(AccountTreeNode::code));
    for (AccountTreeNode node : nodes) {
      sortByCode(node.children());
    }
  }
}
