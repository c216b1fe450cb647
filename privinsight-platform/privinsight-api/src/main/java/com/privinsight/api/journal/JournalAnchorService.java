package com.privinsight.api.journal;

import com.privinsight.blockchain.service.BlockchainJournalAnchorService;
import com.privinsight.blockchain.service.BlockchainJournalAnchorService.AnchorResult;
import com.privinsight.core.domain.JobEvent;
import com.privinsight.core.repository.JobEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Batches journal events into Merkle trees and anchors each root on chain when enabled.
 * <p>
 * With anchoring enabled an event is pending until it carries an anchor transaction hash, and
 * its root and proof are written only once the chain accepted the batch. With anchoring
 * disabled an event is pending until it carries a Merkle proof.
 */
@Service
public class JournalAnchorService {

    private static final Logger log = LoggerFactory.getLogger(JournalAnchorService.class);

    static final int MERKLE_BATCH_SIZE = 100;

    private final JobEventRepository eventRepository;
    private final BlockchainJournalAnchorService blockchainAnchorService;
    private final TransactionTemplate transactions;

    public JournalAnchorService(
            JobEventRepository eventRepository,
            BlockchainJournalAnchorService blockchainAnchorService,
            PlatformTransactionManager transactionManager) {
        this.eventRepository = eventRepository;
        this.blockchainAnchorService = blockchainAnchorService;
        this.transactions = new TransactionTemplate(transactionManager);
    }

    /**
     * Anchors the oldest batch of pending events.
     * A batch the chain did not accept stays pending and is picked up again by the next call.
     *
     * @return the batch root and the number of events it recorded, zero when nothing was recorded
     */
    public AnchorBatchResult anchorPending() {
        boolean onChain = blockchainAnchorService.isEnabled();
        PageRequest batch = PageRequest.of(0, MERKLE_BATCH_SIZE);
        List<JobEvent> pending = onChain
                ? eventRepository.findEventsWithoutAnchorTx(batch)
                : eventRepository.findUnanchoredEvents(batch);
        if (pending.isEmpty()) {
            return new AnchorBatchResult(null, 0, null);
        }

        MerkleTree tree = MerkleTree.build(pending.stream().map(JobEvent::getEventHash).toList());
        String root = tree.getRoot();

        String txHash = null;
        if (onChain) {
            // Runs outside any transaction; the receipt can take blocks to arrive.
            String lastEventHash = pending.get(pending.size() - 1).getEventHash();
            txHash = blockchainAnchorService.anchorBatch(root, pending.size(), lastEventHash)
                    .filter(AnchorResult::success)
                    .map(AnchorResult::txHash)
                    .orElse(null);
            if (txHash == null) {
                log.warn("Chain did not accept journal root {} for {} events; they stay pending",
                        root, pending.size());
                return new AnchorBatchResult(root, 0, null);
            }
        }

        String confirmedTx = txHash;
        transactions.executeWithoutResult(status -> {
            for (int i = 0; i < pending.size(); i++) {
                JobEvent event = pending.get(i);
                event.recordMerkleProof(root, tree.getProof(i).serialize());
                if (confirmedTx != null) {
                    event.recordAnchor(confirmedTx);
                }
            }
            eventRepository.saveAll(pending);
        });

        log.info("Anchored {} journal events under root {}{}", pending.size(), root,
                txHash != null ? " (tx " + txHash + ")" : "");
        return new AnchorBatchResult(root, pending.size(), txHash);
    }

    /**
     * Checks an event's stored inclusion proof against its recorded root.
     */
    public boolean verifyInclusion(Long eventId) {
        return eventRepository.findById(eventId)
                .filter(event -> event.getMerkleProof() != null)
                .map(event -> {
                    try {
                        MerkleTree.MerkleProof proof = MerkleTree.MerkleProof.deserialize(event.getMerkleProof());
                        return proof.leafHash().equals(event.getEventHash())
                                && MerkleTree.verifyProof(proof, event.getMerkleRoot());
                    } catch (IllegalArgumentException e) {
                        log.warn("Malformed Merkle proof on event {}: {}", eventId, e.getMessage());
                        return false;
                    }
                })
                .orElse(false);
    }

    public record AnchorBatchResult(String merkleRoot, int eventCount, String txHash) {}
}
