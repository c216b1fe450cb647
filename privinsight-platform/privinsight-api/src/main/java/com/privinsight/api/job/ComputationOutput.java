package com.privinsight.api.job;

import com.privinsight.api.proof.Proof;

public record ComputationOutput(String resultHash, Proof proof) {}
