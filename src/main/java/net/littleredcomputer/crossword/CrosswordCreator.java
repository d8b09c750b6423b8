package net.littleredcomputer.crossword;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableSortedMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.message.FormattedMessage;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.Spliterator;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Fills a crossword by treating it as a constraint satisfaction problem: node consistency and
 * AC-3 narrow the domains, then a backtracking search guided by the minimum-remaining-values
 * and least-constraining-value heuristics looks for assignments.
 */
public class CrosswordCreator {
    private static final Logger log = LogManager.getFormatterLogger(CrosswordCreator.class);
    private static final long logCheckSteps = 1000;

    /** How the next variable to assign is chosen. */
    public enum Strategy {
        FIRST,
        MRV,
    }

    /** The order in which a variable's candidates are tried. */
    public enum ValueOrder {
        DOMAIN,
        LCV,
    }

    private final Crossword crossword;
    private Strategy strategy = Strategy.MRV;
    private ValueOrder valueOrder = ValueOrder.LCV;
    private boolean inference = false;
    private boolean singletonPruning = false;
    private Duration logInterval = Duration.ofMillis(5000);
    private Duration timeLimit = null;
    private long nodes = 0;

    public CrosswordCreator(Crossword crossword) {
        this.crossword = crossword;
    }

    public CrosswordCreator setStrategy(Strategy strategy) {
        this.strategy = strategy;
        return this;
    }

    public CrosswordCreator setValueOrder(ValueOrder valueOrder) {
        this.valueOrder = valueOrder;
        return this;
    }

    /**
     * When set, each assignment made during the search is followed by arc consistency over the
     * arcs into the assigned variable, and candidates leaving some domain empty are rejected.
     */
    public CrosswordCreator setInference(boolean inference) {
        this.inference = inference;
        return this;
    }

    /** @see ArcConsistency#setSingletonPruning(boolean) */
    public CrosswordCreator setSingletonPruning(boolean singletonPruning) {
        this.singletonPruning = singletonPruning;
        return this;
    }

    public CrosswordCreator setLogInterval(Duration logInterval) {
        this.logInterval = logInterval;
        return this;
    }

    /**
     * Bounds the time spent searching; exceeding it raises {@link SearchTimeoutException}.
     */
    public CrosswordCreator setTimeLimit(Duration timeLimit) {
        this.timeLimit = timeLimit;
        return this;
    }

    /**
     * @return the number of search nodes (variable choices) expanded by this creator so far
     */
    long nodes() { return nodes; }

    ArcConsistency arcConsistency(Domains domains) {
        return new ArcConsistency(crossword, domains).setSingletonPruning(singletonPruning);
    }

    /**
     * @return the domains after node consistency and arc consistency have been enforced, or
     * empty if some domain was exhausted, in which case the puzzle has no solution
     */
    Optional<Domains> propagate() {
        Domains domains = Domains.of(crossword);
        domains.enforceNodeConsistency();
        if (domains.anyEmpty() || !arcConsistency(domains).enforce()) return Optional.empty();
        return Optional.of(domains);
    }

    /**
     * @return a complete assignment of words to the variables of the puzzle, or empty if there
     * is none
     */
    public Optional<Map<Variable, String>> solve() {
        Optional<Map<Variable, String>> solution = solutions().findFirst();
        if (!solution.isPresent()) log.info("no solution for %d variables", crossword.variables().size());
        return solution;
    }

    /**
     * @return every complete assignment, in the order the search finds them. The effort for
     * any given solution is expended only when that solution is demanded.
     */
    public Stream<Map<Variable, String>> solutions() {
        Optional<Domains> domains = propagate();
        if (!domains.isPresent()) {
            log.debug("a domain was exhausted before search");
            return Stream.empty();
        }
        return StreamSupport.stream(new Solutions(domains.get()), false);
    }

    /**
     * @return true if the assigned words are distinct, fit their slots, and agree wherever
     * two assigned slots cross
     */
    public boolean consistent(Map<Variable, String> assignment) {
        Set<String> distinct = new HashSet<>();
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            if (!distinct.add(e.getValue())) return false;
            if (e.getValue().length() != e.getKey().length()) return false;
        }
        for (Map.Entry<Variable, String> e : assignment.entrySet()) {
            for (Map.Entry<Variable, Overlap> n : crossword.neighbors(e.getKey()).entrySet()) {
                String w = assignment.get(n.getKey());
                if (w != null && !n.getValue().agrees(e.getValue(), w)) return false;
            }
        }
        return true;
    }

    /**
     * Chooses an unassigned variable. Under MRV this is one with the fewest remaining
     * candidates, preferring the most neighbors among those; remaining ties go to the first
     * variable in natural order.
     */
    Variable selectUnassignedVariable(Domains domains, Map<Variable, String> assignment) {
        Variable chosen = null;
        int minSize = Integer.MAX_VALUE;
        int maxDegree = -1;
        for (Variable v : crossword.variables()) {
            if (assignment.containsKey(v)) continue;
            switch (strategy) {
                case FIRST:
                    return v;
                case MRV:
                    int size = domains.size(v);
                    int degree = crossword.degree(v);
                    if (size < minSize || (size == minSize && degree > maxDegree)) {
                        chosen = v;
                        minSize = size;
                        maxDegree = degree;
                    }
                    break;
            }
        }
        if (chosen == null) throw new IllegalStateException("every variable is assigned");
        return chosen;
    }

    /**
     * Under LCV, orders the candidates of v by the number of candidates each would rule out
     * among the neighbors of v, fewest first. Ties keep domain order.
     */
    List<String> orderDomainValues(Variable v, Domains domains) {
        List<String> values = new ArrayList<>(domains.get(v));
        if (valueOrder == ValueOrder.DOMAIN) return values;
        Map<String, Integer> ruledOut = new HashMap<>();
        for (String w : values) ruledOut.put(w, ruledOut(v, w, domains));
        values.sort(Comparator.comparing(ruledOut::get));
        return values;
    }

    int ruledOut(Variable v, String w, Domains domains) {
        int n = 0;
        for (Map.Entry<Variable, Overlap> e : crossword.neighbors(v).entrySet()) {
            for (String u : domains.get(e.getKey())) {
                // A neighbor's candidate is lost if it disagrees at the crossing or repeats w.
                if (!e.getValue().agrees(w, u) || w.equals(u)) ++n;
            }
        }
        return n;
    }

    private static class Frame {
        final Variable variable;
        final List<String> candidates;
        final Iterator<String> remaining;
        final Domains saved;
        int tried = 0;

        Frame(Variable variable, List<String> candidates, Domains saved) {
            this.variable = variable;
            this.candidates = candidates;
            this.remaining = candidates.iterator();
            this.saved = saved;
        }
    }

    private static final int ENTER = 1;
    private static final int TRY = 2;
    private static final int LEAVE = 3;

    private class Solutions implements Spliterator<Map<Variable, String>> {
        private final Deque<Frame> stack = new ArrayDeque<>();
        private final Map<Variable, String> assignment = new HashMap<>();
        private final Stopwatch stopwatch = Stopwatch.createUnstarted();
        private final Instant deadline;
        private Domains domains;
        private Instant lastLogTime;
        private int step = ENTER;
        private long stepCount = 0;
        private long solCount = 0;

        Solutions(Domains domains) {
            this.domains = domains;
            Instant now = Instant.now();
            this.deadline = timeLimit == null ? null : now.plus(timeLimit);
            this.lastLogTime = now;
        }

        /**
         * Searches for the next solution. Announces it via the supplied consumer and returns true,
         * or returns false when the search space is exhausted.
         */
        @Override
        public boolean tryAdvance(Consumer<? super Map<Variable, String>> action) {
            stopwatch.start();
            while (true) {
                ++stepCount;
                if (stepCount % logCheckSteps == 0) maybeReportProgress();
                switch (step) {
                    case ENTER: {  // Extend the assignment by one variable.
                        if (assignment.size() == crossword.variables().size()) {
                            step = LEAVE;
                            ++solCount;
                            stopwatch.stop();
                            action.accept(ImmutableSortedMap.copyOf(assignment));
                            return true;
                        }
                        Variable v = selectUnassignedVariable(domains, assignment);
                        stack.push(new Frame(v, orderDomainValues(v, domains), domains));
                        ++nodes;
                    }
                    case TRY: {  // Try the next candidate of the variable on top of the stack.
                        Frame f = stack.peek();
                        if (!f.remaining.hasNext()) {
                            stack.pop();
                            step = LEAVE;
                            continue;
                        }
                        checkDeadline();
                        String w = f.remaining.next();
                        ++f.tried;
                        assignment.put(f.variable, w);
                        if (consistent(assignment) && infer(f, w)) {
                            step = ENTER;
                            continue;
                        }
                        assignment.remove(f.variable);
                        step = TRY;
                        continue;
                    }
                    case LEAVE: {  // Backtrack: undo the assignment on top of the stack.
                        Frame f = stack.peek();
                        if (f == null) {
                            stopwatch.stop();
                            return false;
                        }
                        assignment.remove(f.variable);
                        domains = f.saved;
                        step = TRY;
                    }
                }
            }
        }

        private boolean infer(Frame f, String w) {
            if (!inference) return true;
            Domains d = f.saved.copy();
            d.assign(f.variable, w);
            if (!arcConsistency(d).enforce(ArcConsistency.arcsInto(crossword, f.variable))) return false;
            domains = d;
            return true;
        }

        private void checkDeadline() {
            if (deadline != null && !Instant.now().isBefore(deadline)) {
                stopwatch.stop();
                throw new SearchTimeoutException(timeLimit, nodes);
            }
        }

        private void maybeReportProgress() {
            Instant now = Instant.now();
            if (Duration.between(lastLogTime, now).compareTo(logInterval) < 0) return;
            log.info(() -> {
                StringBuilder sb = new StringBuilder();
                for (Iterator<Frame> it = stack.descendingIterator(); it.hasNext(); ) {
                    Frame f = it.next();
                    sb.append(f.tried).append('/').append(f.candidates.size()).append(' ');
                }
                return new FormattedMessage("%d steps %s %.0f/sec depth %d %d solutions %s",
                        stepCount, stopwatch, 1000. * stepCount / Math.max(1, stopwatch.elapsed().toMillis()),
                        stack.size(), solCount, sb.toString());
            });
            lastLogTime = now;
        }

        @Override
        public Spliterator<Map<Variable, String>> trySplit() {
            return null;
        }

        @Override
        public long estimateSize() {
            return Long.MAX_VALUE;
        }

        @Override
        public int characteristics() {
            return NONNULL;
        }
    }
}
