package com.example.ledger.service;

import static com.example.ledger.domain.AccountSubType.*;
import static com.example.ledger.domain.AccountType.*;

import java.util.List;

import com.example.ledger.domain.AccountSubType;
import com.example.ledger.domain.AccountType;

/**
 * The standard chart of accounts created for a new company. Templates are listed parents first,
 * so each one can be attached to an already-created parent.
 */
final class DefaultChartOfAccounts {

  record Template(
      String code,
      String name,
      AccountType type,
      AccountSubType subType,
      String parentCode,
      boolean header,
      String systemKey,
      String currency) {}

  private static final List<Template> TEMPLATES =
      List.of(
          // Assets
          header("100000", "Assets", ASSET, CURRENT_ASSET, null),
          header("110000", "Cash and Bank", ASSET, CURRENT_ASSET, "100000"),
          detail("110001", "Cash on Hand", ASSET, CURRENT_ASSET, "110000", "CASH_ON_HAND"),
          detail("110002", "Petty Cash", ASSET, CURRENT_ASSET, "110000", "PETTY_CASH"),
          detail("111001", "Bank Account - Local", ASSET, CURRENT_ASSET, "110000", "BANK_LOCAL"),
          new Template(
              "111002", "Bank Account - USD", ASSET, CURRENT_ASSET, "110000", false, "BANK_USD",
              "USD"),
          header("120000", "Receivables", ASSET, CURRENT_ASSET, "100000"),
          detail(
              "120001", "Accounts Receivable", ASSET, CURRENT_ASSET, "120000",
              "ACCOUNTS_RECEIVABLE"),
          header("150000", "Fixed Assets", ASSET, FIXED_ASSET, "100000"),
          detail(
              "150001", "Property and Equipment", ASSET, FIXED_ASSET, "150000", "FIXED_ASSETS"),
          detail(
              "159001", "Accumulated Depreciation", ASSET, FIXED_ASSET, "150000",
              "ACCUMULATED_DEPRECIATION"),

          // Liabilities
          header("200000", "Liabilities", LIABILITY, CURRENT_LIABILITY, null),
          header("210000", "Payables", LIABILITY, CURRENT_LIABILITY, "200000"),
          detail(
              "210001", "Accounts Payable", LIABILITY, CURRENT_LIABILITY, "210000",
              "ACCOUNTS_PAYABLE"),
          header("230000", "Tax Liabilities", LIABILITY, CURRENT_LIABILITY, "200000"),
          detail("230001", "VAT Payable", LIABILITY, CURRENT_LIABILITY, "230000", "VAT_PAYABLE"),
          detail(
              "230002", "PAYE Payable", LIABILITY, CURRENT_LIABILITY, "230000", "PAYE_PAYABLE"),
          detail(
              "230003", "Social Security Payable", LIABILITY, CURRENT_LIABILITY, "230000",
              "SOCIAL_SECURITY_PAYABLE"),

          // Equity
          header("300000", "Equity", EQUITY, SHARE_CAPITAL, null),
          detail("310001", "Share Capital", EQUITY, SHARE_CAPITAL, "300000", "SHARE_CAPITAL"),
          detail(
              "320001", "Retained Earnings", EQUITY, RETAINED_EARNINGS, "300000",
              "RETAINED_EARNINGS"),
          detail(
              "320002", "Current Year Earnings", EQUITY, RETAINED_EARNINGS, "300000",
              "CURRENT_YEAR_EARNINGS"),

          // Revenue
          header("400000", "Revenue", REVENUE, OPERATING_REVENUE, null),
          detail("410001", "Sales Revenue", REVENUE, OPERATING_REVENUE, "400000", "SALES_REVENUE"),
          detail(
              "410002", "Service Revenue", REVENUE, OPERATING_REVENUE, "400000",
              "SERVICE_REVENUE"),
          detail(
              "420001", "Interest Income", REVENUE, NON_OPERATING_REVENUE, "400000",
              "INTEREST_INCOME"),
          detail("430001", "Other Income", REVENUE, OTHER_INCOME, "400000", "OTHER_INCOME"),

          // Expenses
          header("500000", "Expenses", EXPENSE, OPERATING_EXPENSE, null),
          detail(
              "510001", "Cost of Goods Sold", EXPENSE, COST_OF_SALES, "500000",
              "COST_OF_GOODS_SOLD"),
          header("520000", "Operating Expenses", EXPENSE, OPERATING_EXPENSE, "500000"),
          detail(
              "520001", "Salaries and Wages", EXPENSE, OPERATING_EXPENSE, "520000",
              "SALARIES_EXPENSE"),
          detail("520002", "Rent Expense", EXPENSE, OPERATING_EXPENSE, "520000", "RENT_EXPENSE"),
          detail(
              "520003", "Utilities Expense", EXPENSE, OPERATING_EXPENSE, "520000",
              "UTILITIES_EXPENSE"),
          detail(
              "530001", "Depreciation Expense", EXPENSE, OPERATING_EXPENSE, "500000",
              "DEPRECIATION_EXPENSE"),
          header("540000", "Financial Expenses", EXPENSE, FINANCIAL_EXPENSE, "500000"),
          detail("540001", "Bank Charges", EXPENSE, FINANCIAL_EXPENSE, "540000", "BANK_CHARGES"),
          detail(
              "540002", "Interest Expense", EXPENSE, FINANCIAL_EXPENSE, "540000",
              "INTEREST_EXPENSE"));

  private DefaultChartOfAccounts() {}

  static List<Template> templates() {
    return TEMPLATES;
  }

  private static Template header(
      String code, String name, AccountType type, AccountSubType subType, String parentCode) {
    return new Template(code, name, type, subType, parentCode, true, null, null);
  }

  private static Template detail(
      String code,
      String name,
      AccountType type,
      AccountSubType subType,
      String parentCode,
      String systemKey) {
    return new Template(code, name, type, subType, parentCode, false, systemKey, null);
  }
}
