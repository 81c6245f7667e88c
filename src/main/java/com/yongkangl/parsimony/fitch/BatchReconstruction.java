package com.yongkangl.parsimony.fitch;

import com.yongkangl.parsimony.io.LeafStateParser;
import com.yongkangl.parsimony.io.TreeNode;
import com.yongkangl.parsimony.model.ParsimonyConfig;
import com.yongkangl.parsimony.model.Reconstruction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Reconstructs many traits over one tree, one task per trait on a fixed pool.
 */
public class BatchReconstruction {
    private static final Logger logger = LogManager.getLogger(BatchReconstruction.class);

    private final TreeNode tree;
    private final LeafStateParser states;
    private final ParsimonyConfig config;
    private final FitchParsimony fitch;

    public BatchReconstruction(TreeNode tree, LeafStateParser states, ParsimonyConfig config) {
        this.tree = tree;
        this.states = states;
        this.config = config;
        this.fitch = new FitchParsimony(config);
    }

    public List<Reconstruction> run() {
        return run(states.getTraits());
    }

    /**
     * @return one reconstruction per trait, in the order given
     */
    public List<Reconstruction> run(List<String> traits) {
        logger.info("Reconstructing {} traits on {} threads", traits.size(), config.getThreads());
        ExecutorService executorService = Executors.newFixedThreadPool(config.getThreads());
        try {
            List<Future<Reconstruction>> futures = new ArrayList<>();
            for (String trait : traits) {
                futures.add(executorService.submit(() -> reconstruct(trait)));
            }

            List<Reconstruction> reconstructions = new ArrayList<>();
            for (Future<Reconstruction> future : futures) {
                reconstructions.add(future.get());
            }
            logger.info("Finished {} traits", reconstructions.size());
            return reconstructions;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reconstructing traits", e);
        } finally {
            executorService.shutdownNow();
        }
    }

    private Reconstruction reconstruct(String trait) {
        TreeNode copy = tree.deepCopy();
        states.assignStates(copy, trait);
        return fitch.reconstruct(trait, copy);
    }
}
