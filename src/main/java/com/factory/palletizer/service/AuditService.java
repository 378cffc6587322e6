package com.factory.palletizer.service;

import com.factory.palletizer.model.AuditLog;
import com.factory.palletizer.repository.AuditLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

@Service
public class AuditService {

    private static final Logger logger = LoggerFactory.getLogger(AuditService.class);

    private final AuditLogRepository auditLogRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate auditTransaction;

    public AuditService(AuditLogRepository auditLogRepository, ApplicationEventPublisher eventPublisher,
            PlatformTransactionManager transactionManager) {
        this.auditLogRepository = auditLogRepository;
        this.eventPublisher = eventPublisher;
        this.auditTransaction = new TransactionTemplate(transactionManager);
        this.auditTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Records an action once the surrounding transaction has committed, or right
     * away when called outside a transaction. Rolled back work leaves no entry.
     */
    public void log(String action, String details) {
        var auth = SecurityContextHolder.getContext().getAuthentication();
        String username = auth != null ? auth.getName() : "SYSTEM";
        eventPublisher.publishEvent(new AuditEvent(username, action, details));
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void write(AuditEvent event) {
        try {
            auditTransaction.executeWithoutResult(status -> {
                AuditLog log = new AuditLog();
                log.setUsername(event.username());
                log.setAction(event.action());
                log.setDetails(event.details());
                auditLogRepository.save(log);
            });
        } catch (RuntimeException e) {
            logger.warn("Failed to write audit log {} for {}: {}", event.action(), event.username(), e.getMessage());
        }
    }

    @Transactional(readOnly = true)
    public List<AuditLog> recent() {
        return auditLogRepository.findTop100ByOrderByTimestampDesc();
    }

    public record AuditEvent(String username, String action, String details) {
    }
}
