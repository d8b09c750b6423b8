package net.littleredcomputer.crossword;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * AC-3: narrows a {@link Domains} store until every candidate of every variable has a
 * compatible candidate in each neighbor's domain.
 */
public class ArcConsistency {
    private static final Logger log = LogManager.getFormatterLogger(ArcConsistency.class);
    private final Crossword crossword;
    private final Domains domains;
    private boolean singletonPruning = false;
    private long revisions;
    private long removals;

    public ArcConsistency(Crossword crossword, Domains domains) {
        this.crossword = crossword;
        this.domains = domains;
    }

    /**
     * When set, a revision of x against a neighbor y whose domain has collapsed to a single
     * word also removes that word from the domain of x, since no two slots may hold the same
     * word. Off by default: the classic revision considers the overlap alone.
     */
    public ArcConsistency setSingletonPruning(boolean singletonPruning) {
        this.singletonPruning = singletonPruning;
        return this;
    }

    /**
     * Makes x arc consistent with y: removes from the domain of x each word having no
     * counterpart in the domain of y that agrees with it at their overlap.
     * @return true if the domain of x changed
     */
    public boolean revise(Variable x, Variable y) {
        Optional<Overlap> o = crossword.overlap(x, y);
        if (!o.isPresent()) return false;
        final int i = o.get().first();
        final int j = o.get().second();
        ++revisions;
        Set<Character> supported = new HashSet<>();
        for (String w : domains.get(y)) supported.add(w.charAt(j));
        int before = domains.size(x);
        domains.removeIf(x, w -> !supported.contains(w.charAt(i)));
        if (singletonPruning && domains.size(y) == 1) {
            domains.remove(x, domains.get(y).iterator().next());
        }
        int removed = before - domains.size(x);
        removals += removed;
        return removed > 0;
    }

    /**
     * Enforces arc consistency over every arc of the puzzle.
     * @return false if some domain became empty
     */
    public boolean enforce() {
        return enforce(crossword.arcs());
    }

    /**
     * Enforces arc consistency starting from the given arcs. Whenever a revision narrows the
     * domain of x, the arcs (z, x) for the other neighbors z of x are queued again.
     * @param arcs the arcs with which to seed the queue
     * @return false if some domain became empty
     */
    public boolean enforce(Collection<Arc> arcs) {
        Deque<Arc> queue = new ArrayDeque<>(arcs);
        long startRevisions = revisions;
        long startRemovals = removals;
        while (!queue.isEmpty()) {
            Arc a = queue.pop();
            if (!revise(a.x, a.y)) continue;
            if (domains.size(a.x) == 0) {
                log.debug("domain of %s exhausted after %d revisions", a.x, revisions - startRevisions);
                return false;
            }
            for (Variable z : crossword.neighbors(a.x).keySet()) {
                if (!z.equals(a.y)) queue.add(new Arc(z, a.x));
            }
        }
        log.debug("arc consistent after %d revisions removing %d candidates",
                revisions - startRevisions, removals - startRemovals);
        return true;
    }

    /**
     * @return the arcs (z, v) for every neighbor z of v
     */
    static List<Arc> arcsInto(Crossword crossword, Variable v) {
        return crossword.neighbors(v).keySet().stream().map(z -> new Arc(z, v)).collect(Collectors.toList());
    }

    long revisions() { return revisions; }
}
