package com.arbiter.core.health;

import com.arbiter.core.advisory.AdvisoryModel;
import com.arbiter.core.advisory.TimeBoundedAdvisory;
import com.arbiter.core.ledger.AuditLedger;
import com.arbiter.core.ledger.LedgerVerification;
import com.arbiter.core.policy.GovernancePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final GovernancePolicy policy;
    private final AuditLedger ledger;
    private final TimeBoundedAdvisory advisory;

    public HealthCheckService(GovernancePolicy policy, AuditLedger ledger, TimeBoundedAdvisory advisory) {
        this.policy = policy;
        this.ledger = ledger;
        this.advisory = advisory;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkPolicy());
        results.add(checkLedger());
        results.add(checkAdvisory());
        return results;
    }

    HealthStatus checkPolicy() {
        return new HealthStatus("policy", HealthStatus.Status.UP,
                "Dictionary " + policy.dictionary().version() + ", boundaries " + policy.boundaries().version(),
                Map.of("dictionaryFingerprint", policy.dictionaryFingerprint(),
                        "boundariesFingerprint", policy.boundariesFingerprint()));
    }

    HealthStatus checkLedger() {
        try {
            LedgerVerification verification = ledger.verify();
            if (verification.intact()) {
                return new HealthStatus("ledger", HealthStatus.Status.UP,
                        "Hash chain intact", Map.of("records", String.valueOf(verification.recordsChecked())));
            }
            return new HealthStatus("ledger", HealthStatus.Status.DOWN,
                    "Hash chain broken: " + verification.reason(),
                    Map.of("firstBrokenSequence", String.valueOf(verification.firstBrokenSequence())));
        } catch (Exception e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            return new HealthStatus("ledger", HealthStatus.Status.DOWN,
                    "Ledger error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkAdvisory() {
        AdvisoryModel model = advisory.model();
        return new HealthStatus("advisory", HealthStatus.Status.UP,
                "Model " + model.modelId() + " v" + model.modelVersion(),
                Map.of("timeout", advisory.timeout().toString()));
    }
}
