package com.example.ledger.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import com.example.ledger.domain.Account;
import com.example.ledger.domain.Company;
import com.example.ledger.repository.CompanyRepository;
import com.example.ledger.service.AccountService;
import com.example.ledger.service.CompanyService;

/**
 * Seeds a demo company with the default chart of accounts on startup. Only runs when {@code
 * ledger.seed.enabled} is true.
 */
@Component
public class DataInitializer implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

  static final String DEMO_COMPANY_NAME = "Demo Company";
  private static final String SYSTEM_ACTOR = "system";

  @Value("${ledger.seed.enabled:false}")
  private boolean seedEnabled;

  private final CompanyRepository companyRepository;
  private final CompanyService companyService;
  private final AccountService accountService;

  public DataInitializer(
      CompanyRepository companyRepository,
      CompanyService companyService,
      AccountService accountService) {
    this.companyRepository = companyRepository;
    this.companyService = companyService;
    this.accountService = accountService;
  }

  @Override
  @Transactional
  public void run(ApplicationArguments args) {
    if (!seedEnabled) {
      return;
    }
    if (companyRepository.findByName(DEMO_COMPANY_NAME).isPresent()) {
      log.info("Demo company already exists: {}", DEMO_COMPANY_NAME);
      return;
    }

    log.info("Creating demo company: {}", DEMO_COMPANY_NAME);
    Company company = companyService.createCompany(DEMO_COMPANY_NAME);
    List<Account> accounts = accountService.initializeDefaultChart(company.getId(), SYSTEM_ACTOR);
    log.info("Seeded {} accounts for {}", accounts.size(), DEMO_COMPANY_NAME);
  }

  void setSeedEnabled(boolean seedEnabled) {
    this.seedEnabled = seedEnabled;
  }
}
