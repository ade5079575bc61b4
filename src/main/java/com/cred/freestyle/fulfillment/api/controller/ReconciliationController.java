package com.cred.freestyle.fulfillment.api.controller;

import com.cred.freestyle.fulfillment.api.dto.ReconciliationItemResponse;
import com.cred.freestyle.fulfillment.security.SecurityUtils;
import com.cred.freestyle.fulfillment.service.fulfillment.ReconciliationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Admin view of captured payments whose orders were closed (stock conflicts and late captures).
 *
 * @author Fulfillment Team
 */
@RestController
@RequestMapping("/api/v1/admin/reconciliation")
public class ReconciliationController {

    private static final Logger logger = LoggerFactory.getLogger(ReconciliationController.class);

    private final ReconciliationService reconciliationService;

    public ReconciliationController(ReconciliationService reconciliationService) {
        this.reconciliationService = reconciliationService;
    }

    /**
     * List payments awaiting refund or credit.
     *
     * Authorization: ADMIN role
     *
     * @return Divergent payments, most recent first
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<ReconciliationItemResponse>> listPending() {
        List<ReconciliationItemResponse> items = reconciliationService.findPendingReconciliation();
        logger.info("Reconciliation list requested by {}: {} entries", SecurityUtils.getCurrentUserId(), items.size());
        return ResponseEntity.ok(items);
    }
}
