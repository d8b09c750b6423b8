package net.littleredcomputer.crossword;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.Test;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.fail;

public class MainTest {
    private static CommandLine parse(String... args) throws ParseException {
        return new DefaultParser().parse(Main.options(), args);
    }

    @Test
    public void limitDefaultsToOne() throws ParseException {
        assertThat(Main.limit(parse()), is(1L));
        assertThat(Main.limit(parse("-limit", "12")), is(12L));
    }

    @Test
    public void malformedLimitNamesTheOption() throws ParseException {
        try {
            Main.limit(parse("-limit", "lots"));
            fail();
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), containsString("limit"));
            assertThat(e.getMessage(), containsString("lots"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void limitMustBePositive() throws ParseException {
        Main.limit(parse("-limit", "0"));
    }

    @Test
    public void outputIsText() {
        assertThat(Main.options().getOption("output").getDescription(), containsString("as text"));
    }
}
