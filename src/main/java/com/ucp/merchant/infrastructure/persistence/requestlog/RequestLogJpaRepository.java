package com.ucp.merchant.infrastructure.persistence.requestlog;

import com.ucp.merchant.domain.requestlog.RequestLog;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

/**
 * RequestLog JPA Repository
 */
public interface RequestLogJpaRepository extends JpaRepository<RequestLog, Long> {

    List<RequestLog> findAllByOrderByRequestLogIdDesc(Pageable pageable);

    List<RequestLog> findByCheckoutSessionIdOrderByRequestLogIdDesc(String checkoutSessionId, Pageable pageable);
}
