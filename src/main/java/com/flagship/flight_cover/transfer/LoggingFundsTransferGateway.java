package com.flagship.flight_cover.transfer;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default transfer rail: records disbursements in the application log.
 *
 * Deployments that move real funds replace this bean with a wallet or bank
 * integration. Duplicate references are acknowledged without a second delivery.
 */
@Component
@Slf4j
public class LoggingFundsTransferGateway implements FundsTransferGateway {

    private final Set<String> deliveredReferences = ConcurrentHashMap.newKeySet();

    @Override
    public void transfer(String recipient, BigDecimal amount, String reference) throws FundsTransferException {
        if (recipient == null || recipient.isBlank()) {
            throw new FundsTransferException("No recipient for transfer " + reference);
        }
        if (!deliveredReferences.add(reference)) {
            log.info("Transfer {} already delivered, not repeating", reference);
            return;
        }
        log.info("Disbursed {} to {} (reference={})", amount.toPlainString(), recipient, reference);
    }
}
