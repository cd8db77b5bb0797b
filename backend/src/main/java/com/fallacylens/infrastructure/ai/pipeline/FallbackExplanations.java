package com.fallacylens.infrastructure.ai.pipeline;

import com.fallacylens.domain.analysis.model.Explanation;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed educational text per fallacy kind, used when the reasoning service cannot explain an item.
 */
@Component
public class FallbackExplanations {

    private static final String GENERIC_RATIONALE =
            "The flagged passage shows a pattern typical of this fallacy. A detailed explanation is not available right now.";

    private static final Map<String, Explanation> CATALOG;

    static {
        Map<String, Explanation> m = new LinkedHashMap<>();
        m.put("ad_hominem", entry(
                "Attacking the person making an argument instead of the argument itself.",
                "Respond to the claim and its evidence, not to the character or motives of whoever made it."));
        m.put("straw_man", entry(
                "Misrepresenting an opposing view as weaker or more extreme than it is, then refuting that version.",
                "Restate the other side in a form its supporters would accept before criticizing it."));
        m.put("false_dilemma", entry(
                "Presenting only two options when more possibilities exist.",
                "Ask whether there are middle grounds or alternatives that were left out."));
        m.put("slippery_slope", entry(
                "Claiming one step will inevitably lead to an extreme outcome without showing the links in between.",
                "Support each step in the chain with evidence, or limit the claim to the first step."));
        m.put("appeal_to_authority", entry(
                "Treating a claim as true because an authority said it, especially outside their expertise.",
                "Cite the evidence behind the authority's position and check it is within their field."));
        m.put("appeal_to_emotion", entry(
                "Using feelings such as fear, pity or outrage in place of reasons.",
                "Keep emotional language, but make sure a factual reason carries the conclusion."));
        m.put("hasty_generalization", entry(
                "Drawing a broad conclusion from too few or unrepresentative examples.",
                "Qualify the claim or gather a larger, representative sample."));
        m.put("circular_reasoning", entry(
                "Using the conclusion as one of the premises that is supposed to support it.",
                "Check that each premise could be accepted by someone who does not yet accept the conclusion."));
        m.put("red_herring", entry(
                "Introducing an irrelevant topic to divert attention from the issue at hand.",
                "Before adding a point, check that it bears directly on the question being argued."));
        m.put("bandwagon", entry(
                "Arguing a claim is true or good because many people believe or do it.",
                "Popularity is not evidence; give the reasons those people have, if any."));
        m.put("tu_quoque", entry(
                "Dismissing criticism by pointing out that the critic does the same thing.",
                "Someone's inconsistency does not make their criticism wrong; address the criticism directly."));
        m.put("post_hoc", entry(
                "Assuming that because one event followed another, the first caused the second.",
                "Look for a mechanism and rule out coincidence or common causes before claiming causation."));
        m.put("appeal_to_ignorance", entry(
                "Claiming something is true because it has not been proven false, or the reverse.",
                "Absence of evidence shifts nothing on its own; state what evidence would settle the question."));
        CATALOG = Collections.unmodifiableMap(m);
    }

    private static Explanation entry(String definition, String note) {
        return new Explanation(definition, GENERIC_RATIONALE, note);
    }

    /**
     * Fallback explanation for the kind; a generic one when the kind is not catalogued.
     */
    public Explanation forKind(String kind) {
        Explanation known = CATALOG.get(kind);
        if (known != null) {
            return known;
        }
        String label = kind == null || kind.isBlank() ? "this reasoning flaw" : "'" + kind.replace('_', ' ') + "'";
        return new Explanation(
                "A fallacy is a flaw in reasoning that weakens an argument; " + label + " is one such pattern.",
                GENERIC_RATIONALE,
                "Check that each conclusion follows from the evidence offered for it.");
    }

    public Map<String, Explanation> catalog() {
        return CATALOG;
    }
}
