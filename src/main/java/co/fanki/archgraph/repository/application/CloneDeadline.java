package co.fanki.archgraph.repository.application;

import org.eclipse.jgit.lib.EmptyProgressMonitor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Progress monitor that cancels a JGit operation once a wall-clock
 * deadline has passed.
 *
 * <p>JGit polls {@link #isCancelled()} while receiving packs and while
 * checking out files, so a clone that keeps transferring data slowly is
 * still bounded. Stalled sockets are covered by the transport timeout.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class CloneDeadline extends EmptyProgressMonitor {

    private final Clock clock;

    private final Instant deadline;

    private volatile boolean expired;

    /**
     * Starts a deadline that ends after the given budget.
     *
     * @param theClock the clock to read
     * @param budget the time allowed from now
     */
    CloneDeadline(final Clock theClock, final Duration budget) {
        this.clock = theClock;
        this.deadline = theClock.instant().plus(budget);
    }

    @Override
    public boolean isCancelled() {
        if (!expired && clock.instant().isAfter(deadline)) {
            expired = true;
        }
        return expired;
    }

    /**
     * Checks whether the deadline cancelled the operation.
     *
     * @return true once {@link #isCancelled()} has observed the deadline
     */
    boolean expired() {
        return expired;
    }

}
