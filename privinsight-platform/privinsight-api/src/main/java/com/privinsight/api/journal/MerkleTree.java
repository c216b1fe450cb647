package com.privinsight.api.journal;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Merkle tree over journal event hashes, used to anchor a batch of events with one root.
 * An odd node at any level is paired with itself.
 */
public final class MerkleTree {

    private final List<String> leaves;
    private final List<List<String>> levels;

    private MerkleTree(List<String> leaves, List<List<String>> levels) {
        this.leaves = leaves;
        this.levels = levels;
    }

    public static MerkleTree build(List<String> leafHashes) {
        if (leafHashes == null || leafHashes.isEmpty()) {
            throw new IllegalArgumentException("Cannot build Merkle tree from empty list");
        }
        List<List<String>> levels = new ArrayList<>();
        List<String> level = List.copyOf(leafHashes);
        levels.add(level);
        while (level.size() > 1) {
            List<String> parents = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i < level.size(); i += 2) {
                String left = level.get(i);
                String right = i + 1 < level.size() ? level.get(i + 1) : left;
                parents.add(hashPair(left, right));
            }
            level = List.copyOf(parents);
            levels.add(level);
        }
        return new MerkleTree(levels.get(0), List.copyOf(levels));
    }

    public String getRoot() {
        return levels.get(levels.size() - 1).get(0);
    }

    public List<String> getLeaves() {
        return leaves;
    }

    public int size() {
        return leaves.size();
    }

    /**
     * Sibling path from a leaf up to the root.
     */
    public MerkleProof getProof(int leafIndex) {
        if (leafIndex < 0 || leafIndex >= leaves.size()) {
            throw new IndexOutOfBoundsException("Leaf index out of bounds: " + leafIndex);
        }
        List<Sibling> path = new ArrayList<>();
        int index = leafIndex;
        for (int depth = 0; depth < levels.size() - 1; depth++) {
            List<String> level = levels.get(depth);
            boolean isRightChild = index % 2 == 1;
            int siblingIndex = isRightChild ? index - 1 : Math.min(index + 1, level.size() - 1);
            path.add(new Sibling(level.get(siblingIndex), isRightChild));
            index /= 2;
        }
        return new MerkleProof(leaves.get(leafIndex), leafIndex, List.copyOf(path), getRoot());
    }

    public static boolean verifyProof(MerkleProof proof, String expectedRoot) {
        if (proof == null || expectedRoot == null) {
            return false;
        }
        String current = proof.leafHash();
        for (Sibling sibling : proof.path()) {
            current = sibling.onLeft() ? hashPair(sibling.hash(), current) : hashPair(current, sibling.hash());
        }
        return current.equals(expectedRoot);
    }

    private static String hashPair(String left, String right) {
        return sha256(left + right);
    }

    public static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public record Sibling(String hash, boolean onLeft) {}

    /**
     * Inclusion proof. Serialized as {@code leaf:index:L<hash>,R<hash>...:root}.
     */
    public record MerkleProof(String leafHash, int leafIndex, List<Sibling> path, String root) {

        public String serialize() {
            StringBuilder sb = new StringBuilder()
                    .append(leafHash).append(':').append(leafIndex).append(':');
            for (int i = 0; i < path.size(); i++) {
                if (i > 0) {
                    sb.append(',');
                }
                Sibling sibling = path.get(i);
                sb.append(sibling.onLeft() ? 'L' : 'R').append(sibling.hash());
            }
            return sb.append(':').append(root).toString();
        }

        public static MerkleProof deserialize(String serialized) {
            String[] parts = serialized.split(":", -1);
            if (parts.length != 4) {
                throw new IllegalArgumentException("Invalid proof format");
            }
            List<Sibling> path = new ArrayList<>();
            if (!parts[2].isEmpty()) {
                for (String element : parts[2].split(",")) {
                    char side = element.isEmpty() ? '?' : element.charAt(0);
                    if (side != 'L' && side != 'R') {
                        throw new IllegalArgumentException("Invalid proof element: " + element);
                    }
                    path.add(new Sibling(element.substring(1), side == 'L'));
                }
            }
            return new MerkleProof(parts[0], Integer.parseInt(parts[1]), List.copyOf(path), parts[3]);
        }
    }
}
