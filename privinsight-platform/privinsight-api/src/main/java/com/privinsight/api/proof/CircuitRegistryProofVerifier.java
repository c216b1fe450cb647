package com.privinsight.api.proof;

import com.privinsight.core.domain.CircuitRegistration;
import com.privinsight.core.repository.CircuitRegistrationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Proof verifier backed by persisted circuit registrations.
 * Fails closed: malformed input, unknown circuits, arity mismatches and errors in the
 * proof system all yield {@code false}.
 */
@Service
public class CircuitRegistryProofVerifier implements ProofVerifier {

    private static final Logger log = LoggerFactory.getLogger(CircuitRegistryProofVerifier.class);

    private final CircuitRegistrationRepository circuitRepository;
    private final ProofSystem proofSystem;
    private final Clock clock;

    public CircuitRegistryProofVerifier(
            CircuitRegistrationRepository circuitRepository,
            ProofSystem proofSystem,
            Clock clock) {
        this.circuitRepository = circuitRepository;
        this.proofSystem = proofSystem;
        this.clock = clock;
    }

    @Override
    public CircuitRegistrationOutcome registerCircuit(String circuitId, VerifyingKey verifyingKey) {
        if (circuitId == null || circuitId.isBlank()) {
            throw new IllegalArgumentException("Circuit ID cannot be null or blank");
        }
        Objects.requireNonNull(verifyingKey, "Verifying key cannot be null");
        if (circuitRepository.existsById(circuitId)) {
            log.warn("Circuit {} is already registered", circuitId);
            return CircuitRegistrationOutcome.ALREADY_REGISTERED;
        }
        try {
            circuitRepository.saveAndFlush(CircuitRegistration.create(
                    circuitId, verifyingKey.keyMaterial(), verifyingKey.publicInputArity(), clock.instant()));
        } catch (DataIntegrityViolationException e) {
            log.warn("Circuit {} registered concurrently", circuitId);
            return CircuitRegistrationOutcome.ALREADY_REGISTERED;
        }
        log.info("Registered circuit {} with {} public inputs", circuitId, verifyingKey.publicInputArity());
        return CircuitRegistrationOutcome.REGISTERED;
    }

    @Override
    public boolean verify(Proof proof, List<String> publicInputs, String circuitId) {
        if (proof == null || publicInputs == null || circuitId == null) {
            return false;
        }
        try {
            Optional<CircuitRegistration> registration = circuitRepository.findById(circuitId);
            if (registration.isEmpty()) {
                log.debug("Rejecting proof for unknown circuit {}", circuitId);
                return false;
            }
            CircuitRegistration circuit = registration.get();
            if (publicInputs.size() != circuit.getPublicInputArity()
                    || publicInputs.stream().anyMatch(Objects::isNull)) {
                log.debug("Rejecting proof for {}: expected {} public inputs, got {}",
                        circuitId, circuit.getPublicInputArity(), publicInputs.size());
                return false;
            }
            if (!circuitId.equals(proof.circuitId()) || !publicInputs.equals(proof.publicInputs())) {
                return false;
            }
            byte[] proofBytes = proof.proofBytes();
            if (proofBytes == null || proofBytes.length == 0) {
                return false;
            }
            return proofSystem.verify(circuit.keyMaterial(), circuitId, publicInputs, proofBytes);
        } catch (RuntimeException e) {
            log.warn("Proof verification for circuit {} failed with {}", circuitId, e.toString());
            return false;
        }
    }

    @Override
    public boolean isRegistered(String circuitId) {
        return circuitId != null && circuitRepository.existsById(circuitId);
    }

    @Override
    public OptionalInt publicInputArity(String circuitId) {
        if (circuitId == null) {
            return OptionalInt.empty();
        }
        return circuitRepository.findById(circuitId)
                .map(circuit -> OptionalInt.of(circuit.getPublicInputArity()))
                .orElseGet(OptionalInt::empty);
    }

    public Optional<VerifyingKey> getVerifyingKey(String circuitId) {
        if (circuitId == null) {
            return Optional.empty();
        }
        return circuitRepository.findById(circuitId)
                .map(circuit -> new VerifyingKey(circuit.keyMaterial(), circuit.getPublicInputArity()));
    }
}
