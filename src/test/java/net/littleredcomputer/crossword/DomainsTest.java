package net.littleredcomputer.crossword;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import org.junit.Test;

import static net.littleredcomputer.crossword.Variable.Direction.ACROSS;
import static net.littleredcomputer.crossword.Variable.Direction.DOWN;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.Matchers.contains;
import static org.junit.Assert.assertThat;

public class DomainsTest {
    private final Crossword ring = CrosswordTest.ring();
    private final Variable top = new Variable(0, 0, ACROSS, 3);

    @Test
    public void initiallyTheWholeVocabulary() {
        Domains d = Domains.of(ring);
        for (Variable v : ring.variables()) assertThat(d.get(v).equals(ring.words()), is(true));
        assertThat(d.anyEmpty(), is(false));
    }

    @Test
    public void nodeConsistencyKeepsWordsOfTheRightLength() {
        Domains d = Domains.of(ring);
        assertThat(d.enforceNodeConsistency(), is(true));
        for (Variable v : ring.variables()) {
            assertThat(d.get(v), contains("CAT", "COW", "TOE", "WOE", "DOG", "ANT"));
        }
    }

    @Test
    public void nodeConsistencyIsIdempotent() {
        Domains d = Domains.of(ring);
        d.enforceNodeConsistency();
        ImmutableMap<Variable, ImmutableSet<String>> once = d.snapshot();
        assertThat(d.enforceNodeConsistency(), is(false));
        assertThat(d.snapshot(), is(once));
    }

    @Test
    public void nodeConsistencyOnlyShrinks() {
        Domains d = Domains.of(ring);
        ImmutableMap<Variable, ImmutableSet<String>> before = d.snapshot();
        d.enforceNodeConsistency();
        for (Variable v : ring.variables()) assertThat(before.get(v).containsAll(d.get(v)), is(true));
    }

    @Test
    public void domainMayBecomeEmpty() {
        Crossword c = Crossword.parseFrom("___", "word\nat");
        Domains d = Domains.of(c);
        d.enforceNodeConsistency();
        assertThat(d.anyEmpty(), is(true));
    }

    @Test
    public void copiesAreIndependent() {
        Domains d = Domains.of(ring);
        Domains e = d.copy();
        e.assign(top, "CAT");
        assertThat(e.get(top), contains("CAT"));
        assertThat(d.size(top), is(8));
        assertThat(d.contains(top, "HORSE"), is(true));
    }

    @Test
    public void removal() {
        Domains d = Domains.of(ring);
        assertThat(d.remove(top, "CAT"), is(true));
        assertThat(d.remove(top, "CAT"), is(false));
        assertThat(d.removeIf(top, w -> w.startsWith("C")), is(true));
        assertThat(d.get(top), contains("TOE", "WOE", "DOG", "ANT", "AT", "HORSE"));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void viewsAreReadOnly() {
        Domains.of(ring).get(top).clear();
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownVariable() {
        Domains.of(ring).size(new Variable(5, 5, DOWN, 2));
    }
}
