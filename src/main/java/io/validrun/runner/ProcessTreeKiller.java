package io.validrun.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Terminates a process and all of its descendants: polite destroy first, forcible destroy after
 * the grace period. Pids still alive after escalation are reported back, never ignored.
 */
public final class ProcessTreeKiller {
    private static final Logger log = LoggerFactory.getLogger(ProcessTreeKiller.class);

    private final Duration grace;

    public ProcessTreeKiller(Duration grace) {
        this.grace = grace;
    }

    public List<Long> killTree(ProcessHandle root) {
        // Snapshot first: once the root dies its children are re-parented and drop out of descendants().
        List<ProcessHandle> tree = new ArrayList<>(root.descendants().toList());
        tree.add(root);
        log.info("Terminating process tree of pid {} ({} processes)", root.pid(), tree.size());

        tree.forEach(ProcessHandle::destroy);
        List<ProcessHandle> alive = awaitExit(tree);
        if (!alive.isEmpty()) {
            log.warn("{} processes ignored termination, escalating to forcible kill", alive.size());
            alive.forEach(ProcessHandle::destroyForcibly);
            alive = awaitExit(alive);
        }
        List<Long> survivors = alive.stream().map(ProcessHandle::pid).toList();
        if (!survivors.isEmpty()) {
            log.error("Process tree of pid {} survived forcible termination: {}", root.pid(), survivors);
        }
        return survivors;
    }

    private List<ProcessHandle> awaitExit(List<ProcessHandle> handles) {
        CompletableFuture<?>[] exits = handles.stream()
                .map(ProcessHandle::onExit)
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(exits).get(grace.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Grace period of {} elapsed with processes alive", grace);
        } catch (ExecutionException e) {
            log.warn("Failed waiting for process exit: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return handles.stream().filter(ProcessHandle::isAlive).toList();
    }
}
