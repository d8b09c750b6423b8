package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.greaterThan;
import static org.junit.Assert.assertThat;

/**
 * Compares the solutions found by search against those found by trying every assignment of
 * words to slots, on small random puzzles.
 */
public class ExhaustiveSearchTest {
    private static final String RING = "___\n_#_\n___";
    private static final String LADDER = "_____\n_#_#_\n_____";

    private static List<String> allWords(String alphabet, int length) {
        List<String> words = new ArrayList<>();
        words.add("");
        for (int k = 0; k < length; ++k) {
            List<String> longer = new ArrayList<>();
            for (String w : words) {
                for (char c : alphabet.toCharArray()) longer.add(w + c);
            }
            words = longer;
        }
        return words;
    }

    private static List<String> sample(Random r, List<String> words, int n) {
        List<String> copy = new ArrayList<>(words);
        Collections.shuffle(copy, r);
        return copy.subList(0, n);
    }

    private static Set<Map<Variable, String>> bruteForce(Crossword c) {
        CrosswordCreator checker = new CrosswordCreator(c);
        Set<Map<Variable, String>> found = new HashSet<>();
        extend(c, checker, c.variables(), new HashMap<>(), found);
        return found;
    }

    private static void extend(Crossword c, CrosswordCreator checker, List<Variable> vs,
                               Map<Variable, String> a, Set<Map<Variable, String>> found) {
        if (a.size() == vs.size()) {
            if (checker.consistent(a)) found.add(ImmutableMap.copyOf(a));
            return;
        }
        Variable v = vs.get(a.size());
        for (String w : c.words()) {
            if (w.length() != v.length()) continue;
            a.put(v, w);
            extend(c, checker, vs, a, found);
            a.remove(v);
        }
    }

    private static final List<Function<Crossword, CrosswordCreator>> creators = ImmutableList.of(
            CrosswordCreator::new,
            c -> new CrosswordCreator(c).setInference(true),
            c -> new CrosswordCreator(c).setSingletonPruning(true),
            c -> new CrosswordCreator(c).setInference(true).setSingletonPruning(true),
            c -> new CrosswordCreator(c)
                    .setStrategy(CrosswordCreator.Strategy.FIRST)
                    .setValueOrder(CrosswordCreator.ValueOrder.DOMAIN));

    private int compare(Crossword c) {
        Set<Map<Variable, String>> expected = bruteForce(c);
        for (Function<Crossword, CrosswordCreator> f : creators) {
            CrosswordCreator creator = f.apply(c);
            List<Map<Variable, String>> found = creator.solutions().collect(Collectors.toList());
            for (Map<Variable, String> s : found) {
                assertThat(s.keySet().equals(new HashSet<>(c.variables())), is(true));
                assertThat(creator.consistent(s), is(true));
            }
            // Each solution is found exactly once, and none is missed.
            assertThat(found.size(), is(expected.size()));
            assertThat(new HashSet<>(found), is(expected));
            assertThat(creator.solve().isPresent(), is(!expected.isEmpty()));
        }
        return expected.size();
    }

    @Test
    public void ring() {
        Random r = new Random(271828);
        List<String> words = allWords("ABC", 3);
        int total = 0;
        for (int trial = 0; trial < 25; ++trial) {
            total += compare(Crossword.parseFrom(RING, String.join("\n", sample(r, words, 10))));
        }
        assertThat(total, is(greaterThan(0)));
    }

    @Test
    public void ladder() {
        Random r = new Random(161803);
        List<String> longWords = allWords("AB", 5);
        List<String> shortWords = allWords("AB", 3);
        int total = 0;
        for (int trial = 0; trial < 20; ++trial) {
            List<String> vocabulary = new ArrayList<>(sample(r, longWords, 8));
            vocabulary.addAll(sample(r, shortWords, 6));
            total += compare(Crossword.parseFrom(LADDER, String.join("\n", vocabulary)));
        }
        assertThat(total, is(greaterThan(0)));
    }
}
