package com.privinsight.core.domain;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.Base64;

/**
 * Verifying key registered for a named proof circuit.
 */
@Entity
@Table(name = "circuit_registrations")
public class CircuitRegistration {

    @Id
    @Column(name = "circuit_id", length = 128)
    private String circuitId;

    @Column(name = "verifying_key", nullable = false, columnDefinition = "TEXT")
    private String verifyingKey;

    @Column(name = "public_input_arity", nullable = false)
    private int publicInputArity;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    @Version
    private Long version;

    protected CircuitRegistration() {}

    public static CircuitRegistration create(String circuitId, byte[] keyMaterial, int publicInputArity, Instant now) {
        if (circuitId == null || circuitId.isBlank()) {
            throw new IllegalArgumentException("Circuit ID cannot be null or blank");
        }
        if (keyMaterial == null || keyMaterial.length == 0) {
            throw new IllegalArgumentException("Verifying key cannot be empty");
        }
        if (publicInputArity < 0) {
            throw new IllegalArgumentException("Public input arity cannot be negative");
        }
        CircuitRegistration registration = new CircuitRegistration();
        registration.circuitId = circuitId;
        registration.verifyingKey = Base64.getEncoder().encodeToString(keyMaterial);
        registration.publicInputArity = publicInputArity;
        registration.registeredAt = now;
        return registration;
    }

    public byte[] keyMaterial() {
        return Base64.getDecoder().decode(verifyingKey);
    }

    // Getters
    public String getCircuitId() { return circuitId; }
    public String getVerifyingKey() { return verifyingKey; }
    public int getPublicInputArity() { return publicInputArity; }
    public Instant getRegisteredAt() { return registeredAt; }
}
