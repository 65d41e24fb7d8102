package com.example.identity.repository;

import com.example.identity.service.ErrorKind;
import com.example.identity.service.IdentityException;
import com.example.identity.service.InfrastructureException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Spring の {@link DataAccessException} を型付きのエラーへ変換する。一意制約違反は呼び出し側で
 * 先に {@link UniqueConstraintViolationException} へ変換しておくこと。
 */
final class StoreExceptionTranslator {

  private static final Logger logger = LoggerFactory.getLogger(StoreExceptionTranslator.class);

  private StoreExceptionTranslator() {}

  static <T> T execute(String storeName, Supplier<T> action) {
    try {
      return action.get();
    } catch (QueryTimeoutException ex) {
      logger.warn("{} query timed out: {}", storeName, ex.getMessage());
      throw new InfrastructureException(
          InfrastructureException.Reason.TIMEOUT, storeName + " timed out", ex);
    } catch (TransientDataAccessException | DataAccessResourceFailureException ex) {
      logger.warn("{} unavailable: {}", storeName, ex.getMessage());
      throw new InfrastructureException(
          InfrastructureException.Reason.UNAVAILABLE, storeName + " unavailable", ex);
    } catch (DataIntegrityViolationException ex) {
      // 列幅超過、NOT NULL、CHECK 違反
      logger.warn("{} rejected values: {}", storeName, ex.getMostSpecificCause().getMessage());
      throw new IdentityException(ErrorKind.VALIDATION, storeName + " rejected the values", ex);
    } catch (DataAccessException ex) {
      logger.error("{} failed", storeName, ex);
      throw new InfrastructureException(
          InfrastructureException.Reason.UNAVAILABLE, storeName + " failed", ex);
    }
  }
}
