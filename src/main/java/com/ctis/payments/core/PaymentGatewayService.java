package com.ctis.payments.core;

import com.ctis.payments.client.ClientDirectory;
import com.ctis.payments.config.GatewayProperties;
import com.ctis.payments.domain.Actor;
import com.ctis.payments.domain.AuditEntry;
import com.ctis.payments.domain.DispatchResult;
import com.ctis.payments.domain.InitiatePaymentCommand;
import com.ctis.payments.domain.PaymentTransaction;
import com.ctis.payments.domain.ProviderStatus;
import com.ctis.payments.domain.TransactionStatus;
import com.ctis.payments.domain.TransactionTransitions;
import com.ctis.payments.exception.ClientNotFoundException;
import com.ctis.payments.exception.ConcurrencyConflictException;
import com.ctis.payments.exception.IllegalTransitionException;
import com.ctis.payments.exception.PaymentValidationException;
import com.ctis.payments.exception.TransactionExpiredException;
import com.ctis.payments.exception.TransactionNotFoundException;
import com.ctis.payments.messaging.PaymentNotificationDispatcher;
import com.ctis.payments.persistence.entity.PaymentTransactionEntity;
import com.ctis.payments.persistence.service.TransactionStore;
import com.ctis.payments.provider.ProviderAdapterRegistry;
import com.ctis.payments.receipt.ReceiptGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Owns every status change of a gateway transaction. The interactive flow, webhooks and
 * the reconciliation sweep all mutate through here; each change re-reads the row, checks
 * it against {@link TransactionTransitions}, and commits with the version it read.
 * <p>
 * Not transactional itself: every {@link TransactionStore} call is its own unit, and
 * provider calls happen outside any database transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentGatewayService {

    static final Actor STATUS_CHECK = Actor.user("status-check");

    private static final Pattern CURRENCY = Pattern.compile("[A-Z]{3}");

    private final TransactionStore store;
    private final ProviderAdapterRegistry providers;
    private final ClientDirectory clientDirectory;
    private final PaymentNotificationDispatcher notificationDispatcher;
    private final ReceiptGenerator receiptGenerator;
    private final TransactionReferenceGenerator referenceGenerator;
    private final GatewayProperties properties;
    private final Clock clock;

    /**
     * Creates a transaction in Initiated with its first audit entry. Repeating a
     * caller-supplied reference returns the stored transaction unchanged.
     *
     * @throws PaymentValidationException on bad input or a reference owned by another client
     * @throws ClientNotFoundException    when the client directory does not know the client
     */
    public PaymentTransaction initiate(InitiatePaymentCommand command) {
        if (command == null) {
            throw new PaymentValidationException("Payment command is required");
        }
        String currency = validate(command);
        String requestedReference = blankToNull(command.getTransactionReference());

        if (requestedReference != null) {
            Optional<PaymentTransaction> existing = store.findByReference(requestedReference);
            if (existing.isPresent()) {
                return sameClientOrReject(existing.get(), command.getClientId());
            }
        }

        if (!clientDirectory.exists(command.getClientId())) {
            throw new ClientNotFoundException(command.getClientId());
        }

        Instant now = Instant.now(clock);
        String reference = requestedReference != null ? requestedReference : referenceGenerator.next();
        PaymentTransactionEntity entity = PaymentTransactionEntity.builder()
                .transactionReference(reference)
                .clientId(command.getClientId())
                .amount(command.getAmount().setScale(2))
                .currency(currency)
                .gatewayType(command.getGatewayType())
                .status(TransactionStatus.INITIATED)
                .initiatedAt(now)
                .expiresAt(now.plus(properties.getSessionWindow()))
                .initiatedBy(command.getInitiatedBy())
                .metadata(command.getMetadata() != null ? new HashMap<>(command.getMetadata()) : null)
                .build();

        Actor actor = Actor.user(command.getInitiatedBy());
        try {
            PaymentTransaction created = store.create(entity, actor, "Payment initiated");
            log.info("Initiated transaction: id={}, reference={}, clientId={}, gateway={}, amount={} {}",
                    created.getId(), reference, created.getClientId(), created.getGatewayType(),
                    created.getAmount(), created.getCurrency());
            return created;
        } catch (DataIntegrityViolationException e) {
            if (requestedReference == null) {
                throw e;
            }
            // lost a race against a retry of the same request
            PaymentTransaction winner = store.findByReference(requestedReference).orElseThrow(() -> e);
            return sameClientOrReject(winner, command.getClientId());
        }
    }

    /**
     * Asks the provider to prompt the payer and moves Initiated to Pending.
     *
     * @throws IllegalTransitionException  when the row is not Initiated
     * @throws TransactionExpiredException when the session window has elapsed
     */
    public PaymentTransaction requestConfirmation(Long transactionId, Actor actor) {
        PaymentTransaction transaction = getTransaction(transactionId);
        if (transaction.isTerminal()) {
            return transaction;
        }
        if (transaction.getStatus() != TransactionStatus.INITIATED) {
            throw new IllegalTransitionException(transactionId, transaction.getStatus(), TransactionStatus.PENDING);
        }
        if (transaction.isExpiredAt(Instant.now(clock))) {
            throw new TransactionExpiredException(transactionId);
        }

        DispatchResult prompt = providers.requestConfirmation(transaction);
        log.info("Confirmation prompt sent: transactionId={}, externalReference={}",
                transactionId, prompt.getExternalReference());
        try {
            return commit(transactionId, TransactionStatus.PENDING, describe(prompt, "Awaiting payer confirmation"), actor,
                    entity -> entity.setExternalReference(prompt.getExternalReference()))
                    .orElseGet(() -> getTransaction(transactionId));
        } catch (IllegalTransitionException e) {
            return joinConcurrentDispatch(transactionId, TransactionStatus.PENDING, prompt, e);
        }
    }

    /**
     * Dispatches the payment and moves it to Processing together with the provider's
     * reference. A terminal row is returned unchanged.
     *
     * @throws IllegalTransitionException  when the row is neither Initiated nor Pending
     * @throws TransactionExpiredException when the session window has elapsed
     * @throws com.ctis.payments.exception.ProviderUnavailableException when dispatch fails; nothing is written
     */
    public PaymentTransaction process(Long transactionId, Actor actor) {
        PaymentTransaction transaction = getTransaction(transactionId);
        if (transaction.isTerminal()) {
            log.debug("Process on terminal transaction {} ({}) ignored", transactionId, transaction.getStatus());
            return transaction;
        }
        if (transaction.getStatus() != TransactionStatus.INITIATED && transaction.getStatus() != TransactionStatus.PENDING) {
            throw new IllegalTransitionException(transactionId, transaction.getStatus(), TransactionStatus.PROCESSING);
        }
        if (transaction.isExpiredAt(Instant.now(clock))) {
            throw new TransactionExpiredException(transactionId);
        }

        DispatchResult dispatched = providers.dispatch(transaction);
        log.info("Dispatched transaction: id={}, gateway={}, externalReference={}",
                transactionId, transaction.getGatewayType(), dispatched.getExternalReference());
        try {
            return commit(transactionId, TransactionStatus.PROCESSING, describe(dispatched, "Dispatched to provider"), actor,
                    entity -> entity.setExternalReference(dispatched.getExternalReference()))
                    .orElseGet(() -> getTransaction(transactionId));
        } catch (IllegalTransitionException e) {
            return joinConcurrentDispatch(transactionId, TransactionStatus.PROCESSING, dispatched, e);
        }
    }

    /**
     * A concurrent request committed the same provider payment first. Adapters dispatch
     * idempotently per transaction reference, so a row already in {@code target} with
     * our external reference is the outcome this call would have produced.
     */
    private PaymentTransaction joinConcurrentDispatch(Long transactionId, TransactionStatus target,
                                                      DispatchResult result, IllegalTransitionException conflict) {
        PaymentTransaction current = getTransaction(transactionId);
        if (current.getStatus() == target
                && Objects.equals(current.getExternalReference(), result.getExternalReference())) {
            log.info("Transaction {} already moved to {} with externalReference={} by a concurrent request",
                    transactionId, target, result.getExternalReference());
            return current;
        }
        throw conflict;
    }

    /**
     * Status as the provider sees it, for callers polling the interactive flow.
     */
    public ProviderStatus checkStatus(Long transactionId) {
        return checkStatus(transactionId, STATUS_CHECK);
    }

    /**
     * Queries the provider where the family supports it and applies a definitive
     * terminal answer as {@code actor}. Pending, processing and unreachable answers never
     * change the row. Rows that cannot be queried report their stored status.
     */
    public ProviderStatus checkStatus(Long transactionId, Actor actor) {
        PaymentTransaction transaction = getTransaction(transactionId);
        if (transaction.isTerminal()
                || transaction.getExternalReference() == null
                || !providers.supportsActiveQuery(transaction.getGatewayType())) {
            return ProviderStatus.of(transaction.getStatus(), transaction.getStatusMessage());
        }

        ProviderStatus providerStatus = providers.queryStatus(transaction.getGatewayType(), transaction.getExternalReference());
        if (!providerStatus.isReachable()) {
            log.debug("Provider unreachable for transaction {}: {}", transactionId, providerStatus.getMessage());
            return providerStatus;
        }
        if (providerStatus.isDefinitiveTerminal()
                && TransactionTransitions.isLegal(transaction.getStatus(), providerStatus.getStatus())) {
            String reason = providerStatus.getMessage() != null
                    ? providerStatus.getMessage()
                    : "Provider reported " + providerStatus.getStatus();
            updateStatus(transactionId, providerStatus.getStatus(), reason, actor);
        }
        return providerStatus;
    }

    /**
     * The single mutation primitive.
     *
     * @return false when the row was already terminal and nothing changed
     * @throws IllegalTransitionException   when {@code newStatus} is not a legal next state
     * @throws ConcurrencyConflictException when the version race is lost on every attempt
     */
    public boolean updateStatus(Long transactionId, TransactionStatus newStatus, String reason, Actor actor) {
        return commit(transactionId, newStatus, reason, actor, null).isPresent();
    }

    /**
     * Expires a non-terminal transaction whose session window has elapsed.
     *
     * @return false when the row is terminal or not yet past {@code expiresAt}
     */
    public boolean expire(Long transactionId, Actor actor) {
        PaymentTransaction transaction = getTransaction(transactionId);
        if (transaction.isTerminal() || !transaction.isExpiredAt(Instant.now(clock))) {
            return false;
        }
        return updateStatus(transactionId, TransactionStatus.EXPIRED, "Session window elapsed", actor);
    }

    /**
     * User cancellation. Follows the transition table, so an Initiated row cannot be cancelled.
     */
    public boolean cancel(Long transactionId, String reason, Actor actor) {
        String why = reason == null || reason.isBlank() ? "Cancelled by " + actor.getName() : reason;
        return updateStatus(transactionId, TransactionStatus.CANCELLED, why, actor);
    }

    public PaymentTransaction getTransaction(Long transactionId) {
        return store.findById(transactionId).orElseThrow(() -> TransactionNotFoundException.byId(transactionId));
    }

    public PaymentTransaction findByReference(String transactionReference) {
        return store.findByReference(transactionReference)
                .orElseThrow(() -> TransactionNotFoundException.byReference(transactionReference));
    }

    public List<AuditEntry> getAuditTrail(Long transactionId) {
        getTransaction(transactionId);
        return store.auditTrail(transactionId);
    }

    /**
     * Read, validate, write with the version read; on a lost race start over.
     *
     * @return the updated transaction, or empty when the row was already terminal
     */
    private Optional<PaymentTransaction> commit(Long transactionId, TransactionStatus newStatus, String reason,
                                                Actor actor, Consumer<PaymentTransactionEntity> mutation) {
        int maxAttempts = properties.getMaxUpdateAttempts();
        OptimisticLockingFailureException lastConflict = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            PaymentTransaction current = getTransaction(transactionId);
            if (current.isTerminal()) {
                log.debug("Transaction {} already {}; {} -> {} by {} ignored",
                        transactionId, current.getStatus(), current.getStatus(), newStatus, actor);
                return Optional.empty();
            }
            if (!TransactionTransitions.isLegal(current.getStatus(), newStatus)) {
                throw new IllegalTransitionException(transactionId, current.getStatus(), newStatus);
            }
            try {
                PaymentTransaction updated = store.applyTransition(transactionId, current.getVersion(), newStatus,
                        reason, actor, Instant.now(clock), mutation);
                log.info("Transaction {} moved {} -> {} by {}: {}",
                        transactionId, current.getStatus(), newStatus, actor, reason);
                if (updated.isTerminal()) {
                    afterTerminal(updated);
                }
                return Optional.of(updated);
            } catch (OptimisticLockingFailureException e) {
                lastConflict = e;
                log.debug("Version conflict on transaction {} (attempt {}/{})", transactionId, attempt, maxAttempts);
            }
        }
        log.warn("Giving up on transaction {} -> {} after {} conflicting attempts", transactionId, newStatus, maxAttempts);
        throw new ConcurrencyConflictException(transactionId, maxAttempts, lastConflict);
    }

    /**
     * Runs after the terminal state is committed; failures here never undo it.
     */
    private void afterTerminal(PaymentTransaction transaction) {
        try {
            notificationDispatcher.onTerminal(transaction);
        } catch (Exception e) {
            log.warn("Notification failed for transaction {} ({}): {}",
                    transaction.getId(), transaction.getStatus(), e.getMessage(), e);
        }
        if (transaction.getStatus() == TransactionStatus.COMPLETED) {
            try {
                String receiptNumber = receiptGenerator.issue(transaction);
                log.info("Receipt {} issued for transaction {}", receiptNumber, transaction.getId());
            } catch (Exception e) {
                log.warn("Receipt generation failed for transaction {}: {}", transaction.getId(), e.getMessage(), e);
            }
        }
    }

    private String validate(InitiatePaymentCommand command) {
        if (command.getClientId() == null || command.getClientId().isBlank()) {
            throw new PaymentValidationException("clientId is required");
        }
        if (command.getGatewayType() == null) {
            throw new PaymentValidationException("gatewayType is required");
        }
        BigDecimal amount = command.getAmount();
        if (amount == null) {
            throw new PaymentValidationException("amount is required");
        }
        if (amount.signum() <= 0) {
            throw new PaymentValidationException("amount must be greater than zero");
        }
        if (amount.compareTo(properties.getMaxAmount()) >= 0) {
            throw new PaymentValidationException("amount must be less than " + properties.getMaxAmount().toPlainString());
        }
        if (amount.stripTrailingZeros().scale() > 2) {
            throw new PaymentValidationException("amount must have at most two decimal places");
        }
        String currency = command.getCurrency() == null || command.getCurrency().isBlank()
                ? properties.getDefaultCurrency()
                : command.getCurrency().trim().toUpperCase(Locale.ROOT);
        if (!CURRENCY.matcher(currency).matches()) {
            throw new PaymentValidationException("currency must be a three-letter ISO 4217 code");
        }
        return currency;
    }

    private static PaymentTransaction sameClientOrReject(PaymentTransaction existing, String clientId) {
        if (!existing.getClientId().equals(clientId)) {
            throw new PaymentValidationException(
                    "transactionReference " + existing.getTransactionReference() + " belongs to another client");
        }
        log.info("Returning existing transaction for reference {}: id={}, status={}",
                existing.getTransactionReference(), existing.getId(), existing.getStatus());
        return existing;
    }

    private static String describe(DispatchResult result, String fallback) {
        return result.getMessage() != null && !result.getMessage().isBlank() ? result.getMessage() : fallback;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
