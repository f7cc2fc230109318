package com.dnagraph.core.validation;

import com.dnagraph.core.graph.DecisionGraph;
import com.dnagraph.core.model.Decision;
import com.dnagraph.core.model.DecisionState;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex checks over decision body text. Every finding is a warning tagged with
 * its rule, e.g. {@code DEC-004 [broken-ref]: ...}.
 */
public class BodyLinter {

    private static final Pattern STALE_INF = Pattern.compile("\\bINF-\\d{3}\\b");
    private static final Pattern STALE_CTX = Pattern.compile("\\bCTX-\\d{3}\\b");
    private static final Pattern DEC_REF = Pattern.compile("\\bDEC-(\\d{3})\\b");
    private static final Pattern SUPERSEDES = Pattern.compile("[Ss]upersedes?\\s+(DEC-\\d{3})");

    private final Pattern termPattern;
    private final List<Pattern> termExemptions;
    private final LintConfig config;

    public BodyLinter(LintConfig config) {
        this.config = config != null ? config : LintConfig.empty();
        var terminology = this.config.terminology();
        this.termPattern = terminology != null ? terminology.termPattern().orElse(null) : null;
        this.termExemptions = terminology != null ? terminology.exemptionPatterns() : List.of();
    }

    public List<String> lint(Decision node, DecisionGraph graph) {
        var warnings = new ArrayList<String>();
        String body = node.body();
        if (body.isEmpty()) {
            return warnings;
        }
        String nid = node.id();

        staleRefs(nid, body, STALE_INF, "INF", warnings);
        staleRefs(nid, body, STALE_CTX, "CTX", warnings);
        brokenRefs(node, body, graph, warnings);
        supersessionClaims(nid, body, graph, warnings);
        terminology(nid, body, warnings);
        deletedArtifacts(nid, body, warnings);
        return warnings;
    }

    private void staleRefs(String nid, String body, Pattern pattern, String family, List<String> warnings) {
        var found = new TreeSet<String>();
        Matcher m = pattern.matcher(body);
        while (m.find()) {
            found.add(m.group());
        }
        if (!found.isEmpty()) {
            warnings.add(nid + " [stale-ref]: body references " + found.size() + " stale " + family
                    + " ID(s) (" + String.join(", ", found) + ")");
        }
    }

    private void brokenRefs(Decision node, String body, DecisionGraph graph, List<String> warnings) {
        var missing = new TreeSet<String>();
        Matcher m = DEC_REF.matcher(body);
        while (m.find()) {
            String ref = "DEC-" + m.group(1);
            if (!ref.equals(node.id()) && !graph.contains(ref)) {
                missing.add(ref);
            }
        }
        if (!missing.isEmpty()) {
            warnings.add(node.id() + " [broken-ref]: body references non-existent " + String.join(", ", missing));
        }
    }

    private void supersessionClaims(String nid, String body, DecisionGraph graph, List<String> warnings) {
        Matcher m = SUPERSEDES.matcher(body);
        while (m.find()) {
            String target = m.group(1);
            graph.find(target)
                    .filter(t -> !t.isIn(DecisionState.SUPERSEDED))
                    .ifPresent(t -> warnings.add(nid + " [supersession]: claims to supersede " + target
                            + ", but " + target + " state is '" + t.stateOrUnknown() + "'"));
        }
    }

    private void terminology(String nid, String body, List<String> warnings) {
        if (termPattern == null || config.terminology().exemptIds().contains(nid)) {
            return;
        }
        int count = 0;
        for (String line : body.split("\n", -1)) {
            if (!termPattern.matcher(line).find()) continue;
            boolean exempt = termExemptions.stream().anyMatch(p -> p.matcher(line).find());
            if (!exempt) count++;
        }
        if (count > 0) {
            warnings.add(nid + " [terminology]: " + count + " line(s) with unexempted '"
                    + config.terminology().flaggedTerm() + "' in body text");
        }
    }

    private void deletedArtifacts(String nid, String body, List<String> warnings) {
        var matched = new ArrayList<String>();
        for (var artifact : config.deletedArtifacts()) {
            if (artifact.pattern() == null || artifact.pattern().isEmpty()) continue;
            if (Pattern.compile(artifact.pattern()).matcher(body).find()) {
                matched.add(artifact.labelOrPattern());
            }
        }
        if (!matched.isEmpty()) {
            warnings.add(nid + " [deleted-artifact]: body references deleted artifacts: " + String.join(", ", matched));
        }
    }
}
