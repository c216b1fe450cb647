package com.privinsight.api.compliance;

import com.privinsight.core.domain.ComplianceFramework;
import com.privinsight.core.domain.ComplianceRule;
import com.privinsight.core.domain.ComplianceRule.Severity;
import com.privinsight.core.repository.ComplianceFrameworkRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Compliance Engine: evaluates job metadata against registered frameworks.
 *
 * Frameworks are immutable once registered; a changed rule set is registered
 * under a new framework id.
 */
@Service
public class ComplianceEngine {

    private static final Logger log = LoggerFactory.getLogger(ComplianceEngine.class);

    private final ComplianceFrameworkRepository frameworkRepository;
    private final Clock clock;

    public ComplianceEngine(ComplianceFrameworkRepository frameworkRepository, Clock clock) {
        this.frameworkRepository = frameworkRepository;
        this.clock = clock;
    }

    /**
     * @throws FrameworkAlreadyRegisteredException if the id is taken
     */
    @Transactional
    public ComplianceFramework registerFramework(FrameworkDefinition definition) {
        Objects.requireNonNull(definition, "Framework definition cannot be null");
        Objects.requireNonNull(definition.frameworkId(), "Framework ID cannot be null");
        if (frameworkRepository.existsById(definition.frameworkId())) {
            throw new FrameworkAlreadyRegisteredException(definition.frameworkId());
        }
        ComplianceFramework framework = ComplianceFramework.create(
                definition.frameworkId(),
                definition.name(),
                definition.rules(),
                definition.advisories(),
                clock.instant());
        try {
            ComplianceFramework saved = frameworkRepository.saveAndFlush(framework);
            log.info("Registered compliance framework {} with {} rules",
                    saved.getFrameworkId(), saved.getRules().size());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new FrameworkAlreadyRegisteredException(definition.frameworkId());
        }
    }

    public Optional<ComplianceFramework> getFramework(String frameworkId) {
        return frameworkRepository.findById(frameworkId);
    }

    public boolean isRegistered(String frameworkId) {
        return frameworkId != null && frameworkRepository.existsById(frameworkId);
    }

    public List<ComplianceFramework> listFrameworks() {
        return frameworkRepository.findAll();
    }

    /**
     * Evaluates one framework.
     *
     * @throws UnknownFrameworkException if the framework is not registered
     */
    @Transactional(readOnly = true)
    public ComplianceResult evaluate(String frameworkId, Map<String, Object> metadata) {
        ComplianceFramework framework = frameworkRepository.findById(frameworkId)
                .orElseThrow(() -> new UnknownFrameworkException(List.of(String.valueOf(frameworkId))));
        ComplianceResult result = ComplianceScorer.score(
                framework.getFrameworkId(), framework.getRules(), framework.getAdvisories(), metadata);
        log.debug("Evaluated {}: compliant={}, score={}, violations={}",
                frameworkId, result.compliant(), result.score(), result.violations().size());
        return result;
    }

    /**
     * Evaluates every framework independently; a failing framework never stops
     * the others. All ids are resolved first, so an unknown id fails the whole
     * call before any evaluation.
     *
     * @throws UnknownFrameworkException naming every unknown id
     */
    @Transactional(readOnly = true)
    public List<ComplianceResult> evaluateMany(List<String> frameworkIds, Map<String, Object> metadata) {
        Objects.requireNonNull(frameworkIds, "Framework ids cannot be null");
        Map<String, ComplianceFramework> frameworks = new LinkedHashMap<>();
        List<String> unknown = new ArrayList<>();
        for (String id : new LinkedHashSet<>(frameworkIds)) {
            Optional<ComplianceFramework> framework = id != null ? frameworkRepository.findById(id) : Optional.empty();
            if (framework.isPresent()) {
                frameworks.put(id, framework.get());
            } else {
                unknown.add(String.valueOf(id));
            }
        }
        if (!unknown.isEmpty()) {
            throw new UnknownFrameworkException(unknown);
        }

        List<ComplianceResult> results = new ArrayList<>();
        for (ComplianceFramework framework : frameworks.values()) {
            results.add(ComplianceScorer.score(
                    framework.getFrameworkId(), framework.getRules(), framework.getAdvisories(), metadata));
        }
        return results;
    }

    /**
     * Aggregates several framework evaluations into one audit report.
     */
    @Transactional(readOnly = true)
    public ComplianceReport generateReport(List<String> frameworkIds, Map<String, Object> metadata) {
        List<ComplianceResult> results = evaluateMany(frameworkIds, metadata);
        boolean overall = results.stream().allMatch(ComplianceResult::compliant);
        int average = results.isEmpty() ? 100 : BigDecimal.valueOf(
                        results.stream().mapToInt(ComplianceResult::score).sum())
                .divide(BigDecimal.valueOf(results.size()), 0, RoundingMode.HALF_UP)
                .intValueExact();
        long critical = results.stream().mapToLong(r -> r.countBySeverity(Severity.CRITICAL)).sum();
        LinkedHashSet<String> recommendations = new LinkedHashSet<>();
        results.forEach(r -> recommendations.addAll(r.recommendations()));

        return new ComplianceReport(results, overall, average, critical, new ArrayList<>(recommendations));
    }

    /**
     * Lists what a framework checks and what it advises.
     */
    @Transactional(readOnly = true)
    public FrameworkRequirements getRequirements(String frameworkId) {
        ComplianceFramework framework = frameworkRepository.findById(frameworkId)
                .orElseThrow(() -> new UnknownFrameworkException(List.of(String.valueOf(frameworkId))));
        List<FrameworkRequirements.Requirement> requirements = new ArrayList<>();
        for (ComplianceRule rule : framework.getRules()) {
            requirements.add(new FrameworkRequirements.Requirement(
                    rule.getRuleId(), rule.getDescription(), rule.getSeverity(), rule.getFields(), rule.getRemedyText()));
        }
        List<String> advisories = framework.getAdvisories().stream().map(a -> a.getAdvice()).toList();
        return new FrameworkRequirements(framework.getFrameworkId(), framework.getName(),
                framework.maxPossiblePoints(), requirements, advisories);
    }

    public record ComplianceReport(
            List<ComplianceResult> results,
            boolean overallCompliant,
            int averageScore,
            long criticalIssues,
            List<String> recommendations
    ) {}

    public record FrameworkRequirements(
            String frameworkId,
            String name,
            int maxPossiblePoints,
            List<Requirement> requirements,
            List<String> advisories
    ) {
        public record Requirement(
                String ruleId,
                String description,
                Severity severity,
                List<String> fields,
                String remedyText
        ) {}
    }
}
