package com.platform.gitops.apply;

import com.platform.gitops.error.ErrorCode;
import com.platform.gitops.error.ReconciliationException;
import com.platform.gitops.inventory.ResourceInventory;
import com.platform.gitops.model.ObjectIdentifier;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of an apply/prune pass.
 *
 * @param inventory objects applied successfully, in apply order
 * @param changeSet mutations and deletions performed
 * @param applyErrors one message per object that failed to apply
 * @param pruneErrors one message per stale object that failed to delete
 * @param pruned stale objects deleted or already gone
 * @param skipped stale objects kept because pruning is disabled on them
 */
public record ApplyResult(
    ResourceInventory inventory,
    List<ChangeSetEntry> changeSet,
    List<String> applyErrors,
    List<String> pruneErrors,
    List<ObjectIdentifier> pruned,
    List<ObjectIdentifier> skipped
) {

    public ApplyResult {
        changeSet = List.copyOf(changeSet);
        applyErrors = List.copyOf(applyErrors);
        pruneErrors = List.copyOf(pruneErrors);
        pruned = List.copyOf(pruned);
        skipped = List.copyOf(skipped);
    }

    public boolean hasMutations() {
        return !changeSet.isEmpty();
    }

    /**
     * The failure to report, apply errors taking precedence over prune errors.
     */
    public Optional<ReconciliationException> failure() {
        if (!applyErrors.isEmpty()) {
            return Optional.of(new ReconciliationException(ErrorCode.APPLY_FAILED, String.join("\n", applyErrors)));
        }
        if (!pruneErrors.isEmpty()) {
            return Optional.of(new ReconciliationException(ErrorCode.PRUNE_FAILED, String.join("\n", pruneErrors)));
        }
        return Optional.empty();
    }

    /**
     * Multi-line change set summary, or {@code "no changes"}.
     */
    public String summary() {
        if (changeSet.isEmpty()) {
            return "no changes";
        }
        return changeSet.stream().map(ChangeSetEntry::toString).collect(Collectors.joining("\n"));
    }
}
