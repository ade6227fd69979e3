package com.idsplit.infrastructure.splitting.simple;

import com.idsplit.domain.split.oracle.SimpleSplitter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an identifier at its unambiguous boundaries:
 * - any character that is neither a letter nor a digit (dropped)
 * - letter/digit run changes (digit runs become their own segments)
 * - lower-case letter followed by upper-case letter ({@code getMAX} → get, MAX)
 *
 * Upper-to-lower transitions are ambiguous and left for the frequency-based splitter.
 */
@Component
public class DelimiterSplitter implements SimpleSplitter {

    @Override
    public List<String> split(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return List.of();
        }

        List<String> segments = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < identifier.length(); i++) {
            char c = identifier.charAt(i);
            if (!Character.isLetterOrDigit(c)) {
                flush(current, segments);
                continue;
            }
            if (!current.isEmpty() && isBoundary(current.charAt(current.length() - 1), c)) {
                flush(current, segments);
            }
            current.append(c);
        }
        flush(current, segments);
        return segments;
    }

    private static boolean isBoundary(char previous, char next) {
        if (Character.isDigit(previous) != Character.isDigit(next)) {
            return true;
        }
        return Character.isLowerCase(previous) && Character.isUpperCase(next);
    }

    private static void flush(StringBuilder current, List<String> segments) {
        if (!current.isEmpty()) {
            segments.add(current.toString());
            current.setLength(0);
        }
    }
}
