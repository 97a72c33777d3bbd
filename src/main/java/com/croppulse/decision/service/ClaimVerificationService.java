package com.croppulse.decision.service;

import com.croppulse.decision.config.DecisionConfig;
import com.croppulse.decision.config.MetricsConfig;
import com.croppulse.decision.engine.claim.ClaimContext;
import com.croppulse.decision.engine.claim.ClaimVerificationEngine;
import com.croppulse.decision.engine.evidence.FarmRegistry;
import com.croppulse.decision.exception.MalformedInputException;
import com.croppulse.decision.model.ClaimRecommendation;
import com.croppulse.decision.model.ClaimRequest;
import com.croppulse.decision.model.ClaimType;
import com.croppulse.decision.model.ClaimVerdict;
import com.croppulse.decision.model.Farm;
import com.croppulse.decision.repository.ClaimVerdictRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Main orchestrator for claim verification.
 *
 * Flow:
 * 1. Validate the request (identifiers, claim type, claim date range) before any evidence fetch
 * 2. Resolve the claimed farm from the registry
 * 3. Run the ClaimVerificationEngine over satellite, neighbor and self-report evidence
 * 4. Link the verdict to the claim's previous verdict and persist it append-only
 */
@Service
public class ClaimVerificationService {

    private static final Logger log = LoggerFactory.getLogger(ClaimVerificationService.class);

    private final ClaimVerificationEngine engine;
    private final FarmRegistry farmRegistry;
    private final ClaimVerdictRepository verdictRepository;
    private final DecisionConfig config;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    public ClaimVerificationService(ClaimVerificationEngine engine,
                                    FarmRegistry farmRegistry,
                                    ClaimVerdictRepository verdictRepository,
                                    DecisionConfig config,
                                    MetricsConfig metricsConfig,
                                    Clock clock) {
        this.engine = engine;
        this.farmRegistry = farmRegistry;
        this.verdictRepository = verdictRepository;
        this.config = config;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    @Observed(name = "claims.verify_request", contextualName = "verify-claim-request")
    public ClaimVerdict verify(ClaimRequest request) {
        if (request == null) {
            throw new MalformedInputException("request", "Claim request body is required");
        }
        String subjectId = require(request.getSubjectId(), "subjectId");
        String farmId = require(request.getFarmId(), "farmId");
        ClaimType claimType = ClaimType.parse(request.getClaimType());
        LocalDate claimDate = validateClaimDate(request.getClaimDate());

        Farm farm = farmRegistry.findFarm(farmId)
                .orElseThrow(() -> new MalformedInputException("farmId", "Unknown farm: " + farmId));
        if (!Objects.equals(farm.getFarmerId(), subjectId)) {
            throw new MalformedInputException("farmId",
                    "Farm " + farmId + " is not registered to subject " + subjectId);
        }

        String claimId = request.getClaimId() == null || request.getClaimId().isBlank()
                ? deriveClaimId(subjectId, farmId, claimDate, claimType)
                : request.getClaimId();

        Optional<ClaimVerdict> previous = verdictRepository.findLatestByClaimId(claimId);
        previous.ifPresent(prior -> requireSameClaim(prior, subjectId, farmId, claimDate, claimType));

        ClaimContext context = ClaimContext.builder()
                .claimId(claimId)
                .subjectId(subjectId)
                .farm(farm)
                .claimDate(claimDate)
                .claimType(claimType)
                .build();

        ClaimVerdict evaluated = engine.verify(context);

        ClaimVerdict verdict = evaluated.toBuilder()
                .verdictId(UUID.randomUUID().toString())
                .supersedesVerdictId(previous.map(ClaimVerdict::getVerdictId).orElse(null))
                .build();
        verdictRepository.save(verdict);

        metricsConfig.recordClaimVerdict(verdict.getRecommendation().name(), verdict.getConfidence());
        if (verdict.getRecommendation() == ClaimRecommendation.REJECT) {
            log.warn("Claim {} ({} {} on {}) rejected: confidence {}",
                    claimId, claimType, farmId, claimDate, verdict.getConfidence());
        } else {
            log.info("Claim {} verdict {}: confidence {} -> {}",
                    claimId, verdict.getVerdictId(), verdict.getConfidence(), verdict.getRecommendation());
        }
        return verdict;
    }

    public List<ClaimVerdict> getVerdicts(String claimId) {
        return verdictRepository.findByClaimId(claimId);
    }

    static String deriveClaimId(String subjectId, String farmId, LocalDate claimDate, ClaimType claimType) {
        return subjectId + ":" + farmId + ":" + claimDate + ":" + claimType;
    }

    private LocalDate validateClaimDate(LocalDate claimDate) {
        if (claimDate == null) {
            throw new MalformedInputException("claimDate", "claimDate is required");
        }
        LocalDate today = LocalDate.now(clock);
        if (claimDate.isAfter(today)) {
            throw new MalformedInputException("claimDate", "claimDate " + claimDate + " is in the future");
        }
        int maxAge = config.getClaim().getMaxClaimAgeDays();
        if (claimDate.isBefore(today.minusDays(maxAge))) {
            throw new MalformedInputException("claimDate",
                    "claimDate " + claimDate + " is more than " + maxAge + " days old");
        }
        return claimDate;
    }

    /**
     * A claim id names one claim: re-verification must repeat its subject, farm, date and type.
     */
    private static void requireSameClaim(ClaimVerdict prior, String subjectId, String farmId,
                                         LocalDate claimDate, ClaimType claimType) {
        if (!Objects.equals(prior.getSubjectId(), subjectId)
                || !Objects.equals(prior.getFarmId(), farmId)
                || !Objects.equals(prior.getClaimDate(), claimDate)
                || prior.getClaimType() != claimType) {
            throw new MalformedInputException("claimId", String.format(
                    "Claim %s was filed by %s for farm %s on %s (%s); it cannot be re-verified as %s/%s/%s/%s",
                    prior.getClaimId(), prior.getSubjectId(), prior.getFarmId(), prior.getClaimDate(),
                    prior.getClaimType(), subjectId, farmId, claimDate, claimType));
        }
    }

    private static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new MalformedInputException(field, field + " is required");
        }
        return value;
    }
}
