package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * The current candidate words of each variable. Domains are narrowed in place; a search that
 * needs to undo narrowing works on a {@link #copy()}.
 */
public class Domains {
    private final Map<Variable, Set<String>> domains = new LinkedHashMap<>();

    private Domains() {}

    /**
     * @return a store in which every variable of the puzzle may take any word of the vocabulary
     */
    public static Domains of(Crossword crossword) {
        Domains d = new Domains();
        for (Variable v : crossword.variables()) {
            d.domains.put(v, new LinkedHashSet<>(crossword.words()));
        }
        return d;
    }

    public Domains copy() {
        Domains d = new Domains();
        domains.forEach((v, ws) -> d.domains.put(v, new LinkedHashSet<>(ws)));
        return d;
    }

    public Set<String> get(Variable v) {
        return Collections.unmodifiableSet(domain(v));
    }

    public int size(Variable v) {
        return domain(v).size();
    }

    public boolean contains(Variable v, String word) {
        return domain(v).contains(word);
    }

    public boolean remove(Variable v, String word) {
        return domain(v).remove(word);
    }

    public boolean removeIf(Variable v, Predicate<String> p) {
        return domain(v).removeIf(p);
    }

    /**
     * Narrows the domain of v to the single word w.
     */
    public void assign(Variable v, String w) {
        Set<String> d = domain(v);
        d.clear();
        d.add(w);
    }

    public boolean anyEmpty() {
        return domains.values().stream().anyMatch(Set::isEmpty);
    }

    /**
     * Removes from each domain the words whose length differs from the length of the variable.
     * @return true if any domain changed
     */
    public boolean enforceNodeConsistency() {
        boolean changed = false;
        for (Map.Entry<Variable, Set<String>> e : domains.entrySet()) {
            final int length = e.getKey().length();
            changed |= e.getValue().removeIf(w -> w.length() != length);
        }
        return changed;
    }

    public ImmutableMap<Variable, ImmutableSet<String>> snapshot() {
        ImmutableMap.Builder<Variable, ImmutableSet<String>> b = ImmutableMap.builder();
        domains.forEach((v, ws) -> b.put(v, ImmutableSet.copyOf(ws)));
        return b.build();
    }

    private Set<String> domain(Variable v) {
        Set<String> d = domains.get(v);
        if (d == null) throw new IllegalArgumentException("unknown variable: " + v);
        return d;
    }

    @Override
    public String toString() {
        return domains.toString();
    }
}
