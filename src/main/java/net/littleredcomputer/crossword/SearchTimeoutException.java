package net.littleredcomputer.crossword;

import java.time.Duration;

/**
 * Thrown when a search runs past its time limit. Unlike an empty result, this says nothing
 * about whether the puzzle has a solution.
 */
public class SearchTimeoutException extends RuntimeException {
    SearchTimeoutException(Duration limit, long nodes) {
        super(String.format("search abandoned after %s (%d nodes)", limit, nodes));
    }
}
