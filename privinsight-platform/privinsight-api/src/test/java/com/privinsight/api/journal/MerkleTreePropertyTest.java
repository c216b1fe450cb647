package com.privinsight.api.journal;

import com.privinsight.api.journal.MerkleTree.MerkleProof;
import net.jqwik.api.*;
import net.jqwik.api.constraints.*;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for journal Merkle batches.
 */
class MerkleTreePropertyTest {

    private static List<String> leafHashes(List<String> payloads) {
        return payloads.stream().map(MerkleTree::sha256).toList();
    }

    @Property(tries = 100)
    @Label("every leaf's inclusion proof verifies against the root, also after serialization")
    void everyLeafProves(@ForAll @Size(min = 1, max = 40) List<@AlphaChars @StringLength(max = 16) String> payloads) {
        MerkleTree tree = MerkleTree.build(leafHashes(payloads));

        for (int i = 0; i < tree.size(); i++) {
            MerkleProof proof = tree.getProof(i);
            MerkleProof restored = MerkleProof.deserialize(proof.serialize());

            assertThat(MerkleTree.verifyProof(proof, tree.getRoot())).isTrue();
            assertThat(restored).isEqualTo(proof);
            assertThat(MerkleTree.verifyProof(restored, tree.getRoot())).isTrue();
        }
    }

    @Property(tries = 100)
    @Label("a proof for a substituted leaf does not verify")
    void substitutedLeafFails(
            @ForAll @Size(min = 2, max = 40) List<@AlphaChars @StringLength(max = 16) String> payloads,
            @ForAll @IntRange(min = 0, max = 39) int position) {
        MerkleTree tree = MerkleTree.build(leafHashes(payloads));
        MerkleProof proof = tree.getProof(position % tree.size());
        MerkleProof forged = new MerkleProof(MerkleTree.sha256("forged"), proof.leafIndex(), proof.path(), proof.root());

        assertThat(MerkleTree.verifyProof(forged, tree.getRoot())).isFalse();
    }

    @Property(tries = 100)
    @Label("the root depends on leaf order")
    void rootDependsOnOrder(@ForAll @AlphaChars @StringLength(min = 1, max = 16) String a,
                            @ForAll @AlphaChars @StringLength(min = 1, max = 16) String b) {
        Assume.that(!a.equals(b));

        String forward = MerkleTree.build(leafHashes(List.of(a, b))).getRoot();
        String reversed = MerkleTree.build(leafHashes(List.of(b, a))).getRoot();

        assertThat(forward).isNotEqualTo(reversed);
    }

    @Example
    void singleLeafIsItsOwnRoot() {
        String leaf = MerkleTree.sha256("only");
        MerkleTree tree = MerkleTree.build(List.of(leaf));

        assertThat(tree.getRoot()).isEqualTo(leaf);
        assertThat(tree.getProof(0).path()).isEmpty();
        assertThat(MerkleTree.verifyProof(MerkleProof.deserialize(tree.getProof(0).serialize()), leaf)).isTrue();
    }

    @Example
    void malformedProofsAreRejected() {
        assertThatThrownBy(() -> MerkleProof.deserialize("no-separators"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MerkleProof.deserialize("leaf:0:Xabc:root"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MerkleProof.deserialize("leaf:0:Labc,,Rdef:root"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MerkleTree.build(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
