package com.example.ledger.service;

import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.Company;
import com.example.ledger.exception.NotFoundException;
import com.example.ledger.exception.ValidationException;
import com.example.ledger.repository.CompanyRepository;

/** Creates and looks up the companies that scope all ledger data. */
@Service
@Transactional
public class CompanyService {

  private static final Logger log = LoggerFactory.getLogger(CompanyService.class);

  @Value("${ledger.functional-currency:UGX}")
  private String defaultFunctionalCurrency = "UGX";

  @Value("${ledger.fiscal-year-start-month:7}")
  private int defaultFiscalYearStartMonth = 7;

  private final CompanyRepository companyRepository;

  public CompanyService(CompanyRepository companyRepository) {
    this.companyRepository = companyRepository;
  }

  /** Creates a company using the configured functional currency and fiscal-year start. */
  public Company createCompany(String name) {
    return createCompany(name, defaultFunctionalCurrency, defaultFiscalYearStartMonth);
  }

  public Company createCompany(String name, String functionalCurrency, int fiscalYearStartMonth) {
    if (name == null || name.isBlank()) {
      throw new ValidationException("Company name is required");
    }
    if (functionalCurrency == null || functionalCurrency.length() != 3) {
      throw new ValidationException("Functional currency must be a 3-letter code");
    }
    if (fiscalYearStartMonth < 1 || fiscalYearStartMonth > 12) {
      throw new ValidationException(
          "Fiscal year start month must be between 1 and 12: " + fiscalYearStartMonth);
    }
    Company company =
        companyRepository.save(
            new Company(name, functionalCurrency.toUpperCase(), fiscalYearStartMonth));
    log.info(
        "Created company {} (functional currency {}, fiscal year starts month {})",
        company.getName(),
        company.getFunctionalCurrency(),
        company.getFiscalYearStartMonth());
    return company;
  }

  @Transactional(readOnly = true)
  public Optional<Company> findById(Long companyId) {
    return companyRepository.findById(companyId);
  }

  @Transactional(readOnly = true)
  public Company getById(Long companyId) {
    return companyRepository
        .findById(companyId)
        .orElseThrow(() -> new NotFoundException("Company not found: " + companyId));
  }
}
