package com.example.ledger.repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import com.example.ledger.domain.Account;

@Repository
public interface AccountRepository extends JpaRepository<Account, Long> {

  @Query("SELECT a FROM Account a WHERE a.company.id = :companyId AND a.id = :id")
  Optional<Account> findByCompanyIdAndId(
      @Param("companyId") Long companyId, @Param("id") Long id);

  @Query("SELECT a FROM Account a WHERE a.company.id = :companyId AND a.code = :code")
  Optional<Account> findByCompanyIdAndCode(
      @Param("companyId") Long companyId, @Param("code") String code);

  @Query(
      "SELECT a FROM Account a WHERE a.company.id = :companyId AND a.systemKey = :systemKey")
  Optional<Account> findByCompanyIdAndSystemKey(
      @Param("companyId") Long companyId, @Param("systemKey") String systemKey);

  @Query(
      "SELECT CASE WHEN COUNT(a) > 0 THEN true ELSE false END FROM Account a "
          + "WHERE a.company.id = :companyId AND a.code = :code")
  boolean existsByCompanyIdAndCode(@Param("companyId") Long companyId, @Param("code") String code);

  @Query("SELECT COUNT(a) FROM Account a WHERE a.company.id = :companyId")
  long countByCompanyId(@Param("companyId") Long companyId);

  @Query("SELECT a FROM Account a WHERE a.company.id = :companyId ORDER BY a.code")
  List<Account> findByCompanyIdOrderByCode(@Param("companyId") Long companyId);

  @Query(
      "SELECT a FROM Account a WHERE a.company.id = :companyId AND a.status = :status ORDER BY a.code")
  List<Account> findByCompanyIdAndStatusOrderByCode(
      @Param("companyId") Long companyId, @Param("status") Account.Status status);

  @Query("SELECT a FROM Account a WHERE a.parent.id = :parentId ORDER BY a.code")
  List<Account> findByParentId(@Param("parentId") Long parentId);

  @Query(
      "SELECT CASE WHEN COUNT(a) > 0 THEN true ELSE false END FROM Account a "
          + "WHERE a.parent.id = :parentId AND a.status <> :excluded")
  boolean existsChildWithStatusNot(
      @Param("parentId") Long parentId, @Param("excluded") Account.Status excluded);

  /** Children that still count against archiving their parent (anything not archived). */
  default boolean existsLiveChild(Long parentId) {
    return existsChildWithStatusNot(parentId, Account.Status.ARCHIVED);
  }

  /**
   * Loads and row-locks the given accounts in ascending id order, so concurrent postings touching
   * overlapping accounts always acquire locks in the same order.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query(
      "SELECT a FROM Account a WHERE a.company.id = :companyId AND a.id IN :ids ORDER BY a.id")
  List<Account> findAllForUpdate(
      @Param("companyId") Long companyId, @Param("ids") Collection<Long> ids);
}
