package com.dnagraph.core.report;

import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.model.Decision;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Case-insensitive substring search over decision titles and bodies.
 * Multiple terms are OR-matched.
 */
@Service
public class DecisionSearch {

    public static final List<String> BODY_SECTIONS =
            List.of("Decision", "Reasoning", "Assumptions", "Tradeoffs", "Detail");

    public static final String TITLE_SECTION = "title";

    public SearchResult search(DecisionGraph graph, List<String> rawTerms) {
        List<String> terms = rawTerms.stream()
                .filter(t -> t != null && !t.isBlank())
                .map(t -> t.toLowerCase(Locale.ROOT))
                .toList();
        if (terms.isEmpty()) {
            return new SearchResult(terms, 0, List.of());
        }

        var hits = new ArrayList<SearchHit>();
        for (Decision n : graph.decisions()) {
            String title = n.titleOrEmpty().toLowerCase(Locale.ROOT);
            String body = n.body();
            String bodyLower = body.toLowerCase(Locale.ROOT);
            if (terms.stream().noneMatch(t -> title.contains(t) || bodyLower.contains(t))) continue;

            var matched = new ArrayList<String>();
            if (terms.stream().anyMatch(title::contains)) {
                matched.add(TITLE_SECTION);
            }
            for (String section : BODY_SECTIONS) {
                sectionText(body, section)
                        .map(text -> text.toLowerCase(Locale.ROOT))
                        .filter(text -> terms.stream().anyMatch(text::contains))
                        .ifPresent(text -> matched.add(section));
            }
            hits.add(new SearchHit(n.id(), n.titleOrEmpty(), n.level(), n.stateOrUnknown(), n.scope().value(),
                    List.copyOf(matched)));
        }
        return new SearchResult(terms, hits.size(), List.copyOf(hits));
    }

    /**
     * Text of the first {@code ## name} section, up to the next level-two heading.
     */
    static Optional<String> sectionText(String body, String name) {
        Pattern pattern = Pattern.compile("^## " + Pattern.quote(name) + "\\s*$(.*?)(?=^## |\\z)",
                Pattern.MULTILINE | Pattern.DOTALL);
        Matcher m = pattern.matcher(body);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
